package com.questrail.booking.codec.impl;

import com.questrail.booking.codec.MalformedMessageException;
import com.questrail.booking.model.Interval;
import com.questrail.booking.model.TimePoint;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.time.DayOfWeek;
import java.util.EnumSet;
import java.util.Set;
import java.util.UUID;

/**
 * Bounds-checked big-endian reader used by {@link DefaultMessageDecoder}.
 *
 * <p>Every read names the field being read so truncation errors point at the
 * exact place the datagram ran out.</p>
 */
final class WireReader
{
    private final ByteBuffer buffer;

    WireReader(byte[] datagram) {
        this.buffer = ByteBuffer.wrap(datagram);
    }

    int u8(String field) {
        require(1, field);
        return buffer.get() & 0xFF;
    }

    int u16(String field) {
        require(2, field);
        return buffer.getShort() & 0xFFFF;
    }

    long u32(String field) {
        require(4, field);
        return buffer.getInt() & 0xFFFF_FFFFL;
    }

    int i32(String field) {
        require(4, field);
        return buffer.getInt();
    }

    UUID uuid(String field) {
        require(WireFormat.UUID_LENGTH, field);
        return new UUID(buffer.getLong(), buffer.getLong());
    }

    String string(String field) {
        int length = u16(field + " length");
        require(length, field);
        ByteBuffer slice = buffer.slice();
        slice.limit(length);
        try {
            CharBuffer chars = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(slice);
            buffer.position(buffer.position() + length);
            return chars.toString();
        } catch (CharacterCodingException e) {
            throw new MalformedMessageException(field + " is not valid UTF-8", e);
        }
    }

    TimePoint timePoint(String field) {
        require(WireFormat.TIME_POINT_LENGTH, field);
        int day = buffer.get() & 0xFF;
        int hour = buffer.get() & 0xFF;
        int minute = buffer.get() & 0xFF;
        if (day > 6 || hour > 23 || minute > 59) {
            throw new MalformedMessageException(
                    field + " out of range (day=" + day + ", hour=" + hour + ", minute=" + minute + ")");
        }
        return TimePoint.of(TimePoint.dayOfIndex(day), hour, minute);
    }

    Interval interval(String field) {
        TimePoint start = timePoint(field + " start");
        TimePoint end = timePoint(field + " end");
        if (!start.isBefore(end)) {
            throw new MalformedMessageException(field + " start " + start + " is not before end " + end);
        }
        return Interval.of(start, end);
    }

    Set<DayOfWeek> daySet(String field) {
        int bits = u8(field);
        if ((bits & ~WireFormat.DAY_MASK) != 0) {
            throw new MalformedMessageException(field + " has reserved bits set: 0x" + Integer.toHexString(bits));
        }
        Set<DayOfWeek> days = EnumSet.noneOf(DayOfWeek.class);
        for (int i = 0; i < 7; i++) {
            if ((bits & (1 << i)) != 0) {
                days.add(TimePoint.dayOfIndex(i));
            }
        }
        return days;
    }

    void expectEnd() {
        if (buffer.hasRemaining()) {
            throw new MalformedMessageException(buffer.remaining() + " trailing byte(s) after message");
        }
    }

    private void require(int length, String field) {
        if (buffer.remaining() < length) {
            throw new MalformedMessageException(
                    "truncated datagram reading " + field + ": need " + length + " byte(s), have " + buffer.remaining());
        }
    }
}
