/**
 * Booking Wire Codec
 * =============================================================================
 *
 * <p>Translates between datagram payloads and the semantic messages of
 * {@code com.questrail.booking.model}. The codec sits directly above the
 * transport port and below the invocation managers:</p>
 *
 * <pre>
 *   byte[] datagram
 *        → MessageDecoder        (layout and range checks applied here)
 *            → Request | Reply | MonitorEvent
 *                → invocation managers
 * </pre>
 *
 * <h2>Layout</h2>
 * <p>All integers are big-endian. The first byte of every datagram is the
 * message kind ({@code 0x01} request, {@code 0x02} reply, {@code 0x03}
 * monitor event). Requests continue with
 * {@code [clientId:16][sequence:u32][opcode:u8][payload]}; replies with
 * {@code [clientId:16][sequence:u32][opcode:u8][status:u8][payload]}.
 * Strings are a {@code u16} byte length followed by UTF-8.</p>
 *
 * <p>Decode failures surface as {@link com.questrail.booking.codec.MalformedMessageException}
 * and never reach the booking engine.</p>
 */
package com.questrail.booking.codec;
