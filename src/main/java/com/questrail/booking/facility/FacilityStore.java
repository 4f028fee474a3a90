package com.questrail.booking.facility;

import com.questrail.booking.model.BookingId;
import com.questrail.booking.model.BookingRejectedException;
import com.questrail.booking.model.StatusCode;

import java.util.Collection;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * FacilityStore
 * -----------------------------------------------------------------------------
 * Registry of facilities by name plus an index from booking id to the
 * facility holding it.
 *
 * <p>Facilities are registered during server start-up; the name set does not
 * change while requests are served. The booking index is maintained by
 * {@link BookingEngine} under the owning facility's lock.</p>
 */
public final class FacilityStore
{
    private final ConcurrentMap<String, Facility> facilities = new ConcurrentHashMap<>();
    private final ConcurrentMap<BookingId, Facility> bookingIndex = new ConcurrentHashMap<>();

    public static FacilityStore of(Collection<String> names)
    {
        FacilityStore store = new FacilityStore();
        names.forEach(store::register);
        return store;
    }

    /**
     * @throws IllegalArgumentException if the name is blank or already registered
     */
    public Facility register(String name)
    {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) {
            throw new IllegalArgumentException("facility name must not be blank");
        }
        Facility facility = new Facility(name);
        if (facilities.putIfAbsent(name, facility) != null) {
            throw new IllegalArgumentException("facility already registered: " + name);
        }
        return facility;
    }

    public Optional<Facility> find(String name)
    {
        return Optional.ofNullable(facilities.get(name));
    }

    /**
     * @throws BookingRejectedException with {@link StatusCode#FACILITY_NOT_FOUND}
     */
    public Facility require(String name)
    {
        Facility facility = facilities.get(name);
        if (facility == null) {
            throw new BookingRejectedException(StatusCode.FACILITY_NOT_FOUND, "no such facility: " + name);
        }
        return facility;
    }

    /**
     * @throws BookingRejectedException with {@link StatusCode#BOOKING_NOT_FOUND}
     */
    public Facility requireHolderOf(BookingId id)
    {
        Facility facility = bookingIndex.get(id);
        if (facility == null) {
            throw new BookingRejectedException(StatusCode.BOOKING_NOT_FOUND, "no such booking: " + id);
        }
        return facility;
    }

    public Set<String> names()
    {
        return new TreeSet<>(facilities.keySet());
    }

    void index(BookingId id, Facility facility)
    {
        bookingIndex.put(id, facility);
    }

    void unindex(BookingId id)
    {
        bookingIndex.remove(id);
    }
}
