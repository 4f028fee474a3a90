package com.questrail.booking.codec.impl;

import com.questrail.booking.model.TimePoint;

import java.nio.charset.StandardCharsets;
import java.time.DayOfWeek;
import java.util.Arrays;
import java.util.Set;
import java.util.UUID;

/**
 * Growable big-endian byte sink used by {@link DefaultMessageEncoder}.
 */
final class WireWriter
{
    private byte[] buffer = new byte[64];
    private int size;

    WireWriter u8(int value) {
        ensure(1);
        buffer[size++] = (byte) value;
        return this;
    }

    WireWriter u16(int value) {
        ensure(2);
        buffer[size++] = (byte) (value >>> 8);
        buffer[size++] = (byte) value;
        return this;
    }

    WireWriter u32(long value) {
        if (value < 0 || value > 0xFFFF_FFFFL) {
            throw new IllegalArgumentException("value does not fit in u32: " + value);
        }
        return i32((int) value);
    }

    WireWriter i32(int value) {
        ensure(4);
        buffer[size++] = (byte) (value >>> 24);
        buffer[size++] = (byte) (value >>> 16);
        buffer[size++] = (byte) (value >>> 8);
        buffer[size++] = (byte) value;
        return this;
    }

    WireWriter uuid(UUID value) {
        long msb = value.getMostSignificantBits();
        long lsb = value.getLeastSignificantBits();
        i32((int) (msb >>> 32));
        i32((int) msb);
        i32((int) (lsb >>> 32));
        return i32((int) lsb);
    }

    WireWriter string(String value) {
        byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
        if (bytes.length > WireFormat.MAX_STRING_BYTES) {
            throw new IllegalArgumentException("string exceeds " + WireFormat.MAX_STRING_BYTES + " bytes");
        }
        u16(bytes.length);
        ensure(bytes.length);
        System.arraycopy(bytes, 0, buffer, size, bytes.length);
        size += bytes.length;
        return this;
    }

    WireWriter timePoint(TimePoint point) {
        return u8(point.dayIndex()).u8(point.hour()).u8(point.minute());
    }

    WireWriter daySet(Set<DayOfWeek> days) {
        int bits = 0;
        for (DayOfWeek day : days) {
            bits |= 1 << TimePoint.indexOf(day);
        }
        return u8(bits);
    }

    byte[] toByteArray() {
        return Arrays.copyOf(buffer, size);
    }

    private void ensure(int extra) {
        if (size + extra > buffer.length) {
            buffer = Arrays.copyOf(buffer, Math.max(buffer.length * 2, size + extra));
        }
    }
}
