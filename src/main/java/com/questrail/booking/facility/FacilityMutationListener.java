package com.questrail.booking.facility;

import com.questrail.booking.model.MonitorEvent;

/**
 * Receives every successful facility mutation.
 *
 * <p>Invoked by {@link BookingEngine} while the mutated facility's lock is
 * held, so events of one facility arrive in the order the mutations took
 * effect. Implementations must not call back into the engine.</p>
 */
@FunctionalInterface
public interface FacilityMutationListener
{
    FacilityMutationListener NONE = event -> { };

    void onMutation(MonitorEvent event);
}
