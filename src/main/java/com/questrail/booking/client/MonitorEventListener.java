package com.questrail.booking.client;

import com.questrail.booking.model.MonitorEvent;

/**
 * Receives facility change notifications during a monitoring window.
 * Called on the client's transport thread; implementations should return
 * quickly.
 */
@FunctionalInterface
public interface MonitorEventListener
{
    void onEvent(MonitorEvent event);
}
