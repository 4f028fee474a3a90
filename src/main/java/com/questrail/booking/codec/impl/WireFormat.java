package com.questrail.booking.codec.impl;

/**
 * WireFormat
 * -----------------------------------------------------------------------------
 * Constants shared by {@link DefaultMessageEncoder} and
 * {@link DefaultMessageDecoder}.
 */
final class WireFormat
{
    /** Leading byte of a client request. */
    static final int KIND_REQUEST = 0x01;

    /** Leading byte of a server reply. */
    static final int KIND_REPLY = 0x02;

    /** Leading byte of an unsolicited monitor push. */
    static final int KIND_MONITOR_EVENT = 0x03;

    static final int UUID_LENGTH = 16;
    static final int TIME_POINT_LENGTH = 3;

    /** Days are a bitset; bit {@code i} selects day index {@code i}. Bit 7 is reserved. */
    static final int DAY_MASK = 0x7F;

    static final int MAX_STRING_BYTES = 0xFFFF;

    private WireFormat() {
    }
}
