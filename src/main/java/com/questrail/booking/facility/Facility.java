package com.questrail.booking.facility;

import com.questrail.booking.model.BookedInterval;
import com.questrail.booking.model.Booking;
import com.questrail.booking.model.BookingId;
import com.questrail.booking.model.Interval;
import com.questrail.booking.model.RequestId;

import java.time.DayOfWeek;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Facility
 * =============================================================================
 * One bookable resource and its weekly calendar.
 *
 * <h2>Invariants</h2>
 * <ul>
 *   <li>Bookings are kept sorted by interval start.</li>
 *   <li>No two bookings overlap (half-open comparison).</li>
 *   <li>The revision grows by one per successful mutation.</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * Not thread-safe on its own: every accessor other than {@link #name()}
 * requires {@link #lock()} to be held by the caller. {@link BookingEngine}
 * is the only caller.
 */
public final class Facility
{
    private static final Comparator<Booking> BY_START =
            Comparator.comparing((Booking b) -> b.interval().start());

    private final String name;
    private final ReentrantLock lock = new ReentrantLock();
    private final List<Booking> bookings = new ArrayList<>();
    private long revision;

    Facility(String name)
    {
        this.name = Objects.requireNonNull(name, "name");
    }

    public String name()
    {
        return name;
    }

    ReentrantLock lock()
    {
        return lock;
    }

    long revision()
    {
        return revision;
    }

    /**
     * Advances the revision, wrapping within the unsigned 32-bit wire range.
     */
    long nextRevision()
    {
        revision = (revision + 1) & RequestId.MAX_SEQUENCE;
        return revision;
    }

    List<Booking> bookings()
    {
        return List.copyOf(bookings);
    }

    Optional<Booking> find(BookingId id)
    {
        for (Booking b : bookings) {
            if (b.id().equals(id)) {
                return Optional.of(b);
            }
        }
        return Optional.empty();
    }

    /**
     * First booking overlapping {@code candidate}, ignoring {@code excluded}
     * (the booking being moved, if any).
     */
    Optional<Booking> findConflict(Interval candidate, BookingId excluded)
    {
        for (Booking b : bookings) {
            if (b.id().equals(excluded)) {
                continue;
            }
            if (b.interval().start().compareTo(candidate.end()) >= 0) {
                break; // sorted by start: nothing further can overlap
            }
            if (b.interval().overlaps(candidate)) {
                return Optional.of(b);
            }
        }
        return Optional.empty();
    }

    List<BookedInterval> bookedOn(DayOfWeek day)
    {
        List<BookedInterval> result = new ArrayList<>();
        for (Booking b : bookings) {
            if (b.interval().intersects(day)) {
                result.add(b.toBookedInterval());
            }
        }
        return result;
    }

    void insert(Booking booking)
    {
        int index = 0;
        while (index < bookings.size() && BY_START.compare(bookings.get(index), booking) <= 0) {
            index++;
        }
        bookings.add(index, booking);
    }

    void replace(Booking updated)
    {
        remove(updated.id());
        insert(updated);
    }

    boolean remove(BookingId id)
    {
        return bookings.removeIf(b -> b.id().equals(id));
    }
}
