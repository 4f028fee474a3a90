package com.questrail.booking.client;

import com.questrail.booking.model.BookFacility;
import com.questrail.booking.model.BookedInterval;
import com.questrail.booking.model.BookingId;
import com.questrail.booking.model.BookingRejectedException;
import com.questrail.booking.model.CancelBooking;
import com.questrail.booking.model.ExtendBooking;
import com.questrail.booking.model.Interval;
import com.questrail.booking.model.LookupBooking;
import com.questrail.booking.model.MonitorFacility;
import com.questrail.booking.model.QueryAvailability;
import com.questrail.booking.model.Reply;
import com.questrail.booking.model.ReplyPayload;
import com.questrail.booking.model.ServiceCall;
import com.questrail.booking.model.ShiftBooking;
import com.questrail.booking.model.TimePoint;

import java.time.DayOfWeek;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * BookingClient
 * =============================================================================
 * Typed, blocking API over a {@link ClientInvocationManager}.
 *
 * <p>Every method performs one invocation (with retransmissions as the
 * {@link InvocationPolicy} allows) and either returns the operation's result
 * or throws:</p>
 * <ul>
 *   <li>{@link BookingRejectedException} when the server answered with a
 *       non-success status;</li>
 *   <li>{@link InvocationTimeoutException} when no reply arrived.</li>
 * </ul>
 */
public final class BookingClient
{
    private final ClientInvocationManager invocations;

    public BookingClient(ClientInvocationManager invocations)
    {
        this.invocations = Objects.requireNonNull(invocations, "invocations");
    }

    public Map<DayOfWeek, List<BookedInterval>> queryAvailability(String facilityName, Set<DayOfWeek> days)
            throws InterruptedException
    {
        return call(new QueryAvailability(facilityName, days), ReplyPayload.Availability.class).days();
    }

    public BookingId book(String facilityName, TimePoint start, TimePoint end) throws InterruptedException
    {
        return call(new BookFacility(facilityName, start, end), ReplyPayload.Created.class).bookingId();
    }

    public Interval shift(BookingId bookingId, Duration offset) throws InterruptedException
    {
        return call(new ShiftBooking(bookingId, offset), ReplyPayload.Rescheduled.class).interval();
    }

    public Interval extend(BookingId bookingId, Duration offset) throws InterruptedException
    {
        return call(new ExtendBooking(bookingId, offset), ReplyPayload.Rescheduled.class).interval();
    }

    public ReplyPayload.Details lookupBooking(BookingId bookingId) throws InterruptedException
    {
        return call(new LookupBooking(bookingId), ReplyPayload.Details.class);
    }

    public void cancel(BookingId bookingId) throws InterruptedException
    {
        call(new CancelBooking(bookingId), ReplyPayload.Acknowledged.class);
    }

    /**
     * Subscribes to changes of a facility and returns the granted window.
     * Until the window elapses, events go to {@code listener} and every other
     * method of this client throws {@link IllegalStateException}.
     */
    public Duration monitor(String facilityName, Duration window, MonitorEventListener listener)
            throws InterruptedException
    {
        Reply reply = invocations.monitor(new MonitorFacility(facilityName, window), listener);
        return payload(reply, ReplyPayload.Subscribed.class).window();
    }

    public void awaitMonitoringEnd() throws InterruptedException
    {
        invocations.awaitMonitoringEnd();
    }

    public boolean isMonitoring()
    {
        return invocations.isMonitoring();
    }

    private <T extends ReplyPayload> T call(ServiceCall request, Class<T> expected) throws InterruptedException
    {
        return payload(invocations.invoke(request), expected);
    }

    private static <T extends ReplyPayload> T payload(Reply reply, Class<T> expected)
    {
        if (!reply.isSuccess()) {
            throw new BookingRejectedException(reply.status(), ((ReplyPayload.Failure) reply.payload()).message());
        }
        return expected.cast(reply.payload());
    }
}
