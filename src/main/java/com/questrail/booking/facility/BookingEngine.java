package com.questrail.booking.facility;

import com.questrail.booking.model.BookedInterval;
import com.questrail.booking.model.Booking;
import com.questrail.booking.model.BookingId;
import com.questrail.booking.model.BookingRejectedException;
import com.questrail.booking.model.ClientId;
import com.questrail.booking.model.Interval;
import com.questrail.booking.model.MonitorEvent;
import com.questrail.booking.model.MutationKind;
import com.questrail.booking.model.StatusCode;
import com.questrail.booking.model.TimePoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DayOfWeek;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * BookingEngine
 * =============================================================================
 * Validates and applies every calendar operation against a
 * {@link FacilityStore}.
 *
 * <h2>Failure model</h2>
 * Every refusal is a {@link BookingRejectedException} carrying the status to
 * report. A refused operation leaves the facility untouched.
 *
 * <h2>Concurrency</h2>
 * Each operation holds the lock of exactly one facility for its whole
 * duration, including the {@link FacilityMutationListener} callback, so the
 * listener sees mutations of one facility in the order they were applied.
 * Operations on different facilities run in parallel.
 *
 * <h2>Time model</h2>
 * The week is a flat line from {@link TimePoint#WEEK_START} to
 * {@link TimePoint#WEEK_END}; moving a booking past either end is an
 * {@link StatusCode#INVALID_INTERVAL}, never a wraparound.
 */
public final class BookingEngine
{
    private static final Logger log = LoggerFactory.getLogger(BookingEngine.class);

    private final FacilityStore store;
    private final FacilityMutationListener listener;

    public BookingEngine(FacilityStore store, FacilityMutationListener listener)
    {
        this.store = Objects.requireNonNull(store, "store");
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    public FacilityStore store()
    {
        return store;
    }

    // ========================================================================
    // Queries
    // ========================================================================

    /**
     * Bookings intersecting each requested day, in start order. Every
     * requested day is present in the result, possibly with an empty list.
     */
    public Map<DayOfWeek, List<BookedInterval>> queryAvailability(String facilityName, Set<DayOfWeek> days)
    {
        Objects.requireNonNull(days, "days");
        Facility facility = store.require(facilityName);
        if (days.isEmpty()) {
            throw new BookingRejectedException(StatusCode.INVALID_REQUEST, "no days requested");
        }

        Map<DayOfWeek, List<BookedInterval>> result = new EnumMap<>(DayOfWeek.class);
        facility.lock().lock();
        try {
            for (DayOfWeek day : days) {
                result.put(day, facility.bookedOn(day));
            }
        } finally {
            facility.lock().unlock();
        }
        return result;
    }

    public Booking lookup(BookingId id)
    {
        Facility facility = store.requireHolderOf(id);
        facility.lock().lock();
        try {
            return requireBooking(facility, id);
        } finally {
            facility.lock().unlock();
        }
    }

    // ========================================================================
    // Mutations
    // ========================================================================

    public Booking book(String facilityName, TimePoint start, TimePoint end, ClientId owner)
    {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        Objects.requireNonNull(owner, "owner");

        Facility facility = store.require(facilityName);
        if (!start.isBefore(end)) {
            throw new BookingRejectedException(StatusCode.INVALID_INTERVAL,
                    "start " + start + " is not before end " + end);
        }
        Interval interval = Interval.of(start, end);

        facility.lock().lock();
        try {
            rejectConflict(facility, interval, null);

            Booking booking = new Booking(BookingId.random(), facility.name(), interval, owner);
            facility.insert(booking);
            store.index(booking.id(), facility);

            publish(facility, MutationKind.BOOKED, booking.id(), interval);
            return booking;
        } finally {
            facility.lock().unlock();
        }
    }

    /**
     * Moves both ends of a booking by {@code offset}. The booking's own
     * current interval does not count as a conflict.
     */
    public Interval shift(BookingId id, Duration offset)
    {
        long minutes = requireOffset(offset);
        Facility facility = store.requireHolderOf(id);

        facility.lock().lock();
        try {
            Booking current = requireBooking(facility, id);
            Interval from = current.interval();
            Interval to = Interval.ofMinutes(from.start().minuteOfWeek() + minutes, from.end().minuteOfWeek() + minutes)
                    .orElseThrow(() -> new BookingRejectedException(StatusCode.INVALID_INTERVAL,
                            "shifting " + from + " by " + minutes + " min leaves the week"));
            return reschedule(facility, current, to, MutationKind.SHIFTED);
        } finally {
            facility.lock().unlock();
        }
    }

    /**
     * Moves only the end of a booking by {@code offset}; a negative offset
     * shortens it.
     */
    public Interval extend(BookingId id, Duration offset)
    {
        long minutes = requireOffset(offset);
        Facility facility = store.requireHolderOf(id);

        facility.lock().lock();
        try {
            Booking current = requireBooking(facility, id);
            Interval from = current.interval();
            Interval to = Interval.ofMinutes(from.start().minuteOfWeek(), from.end().minuteOfWeek() + minutes)
                    .orElseThrow(() -> new BookingRejectedException(StatusCode.INVALID_INTERVAL,
                            "extending " + from + " by " + minutes + " min gives an empty or out-of-week interval"));
            return reschedule(facility, current, to, MutationKind.EXTENDED);
        } finally {
            facility.lock().unlock();
        }
    }

    public Booking cancel(BookingId id)
    {
        Facility facility = store.requireHolderOf(id);

        facility.lock().lock();
        try {
            Booking current = requireBooking(facility, id);
            facility.remove(id);
            store.unindex(id);

            publish(facility, MutationKind.CANCELLED, id, current.interval());
            return current;
        } finally {
            facility.lock().unlock();
        }
    }

    // ========================================================================
    // Internals (facility lock held)
    // ========================================================================

    private Interval reschedule(Facility facility, Booking current, Interval to, MutationKind kind)
    {
        rejectConflict(facility, to, current.id());
        facility.replace(current.withInterval(to));
        publish(facility, kind, current.id(), to);
        return to;
    }

    private static void rejectConflict(Facility facility, Interval candidate, BookingId excluded)
    {
        Optional<Booking> conflict = facility.findConflict(candidate, excluded);
        if (conflict.isPresent()) {
            throw new BookingRejectedException(StatusCode.OVERLAP,
                    candidate + " overlaps booking " + conflict.get().id() + " (" + conflict.get().interval() + ")");
        }
    }

    private static Booking requireBooking(Facility facility, BookingId id)
    {
        // The index may briefly point at a facility from which the booking was just cancelled.
        return facility.find(id).orElseThrow(() ->
                new BookingRejectedException(StatusCode.BOOKING_NOT_FOUND, "no such booking: " + id));
    }

    private static long requireOffset(Duration offset)
    {
        Objects.requireNonNull(offset, "offset");
        long minutes = offset.toMinutes();
        if (minutes == 0) {
            throw new BookingRejectedException(StatusCode.INVALID_REQUEST, "offset must not be zero");
        }
        if (Math.abs(minutes) >= TimePoint.MINUTES_PER_WEEK) {
            throw new BookingRejectedException(StatusCode.INVALID_REQUEST,
                    "offset of " + minutes + " min is a week or more");
        }
        return minutes;
    }

    private void publish(Facility facility, MutationKind kind, BookingId id, Interval interval)
    {
        MonitorEvent event = new MonitorEvent(facility.name(), kind, id, interval, facility.nextRevision());
        log.debug("{} {} {} on {} (revision {})", kind, id, interval, facility.name(), event.revision());
        listener.onMutation(event);
    }
}
