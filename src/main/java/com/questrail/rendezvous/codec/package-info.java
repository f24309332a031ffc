/**
 * Rendezvous Datagram Codec
 * =============================================================================
 *
 * <p>Wire format of one {@link com.questrail.rendezvous.internal.frame.EnvelopeFrame}
 * per datagram. All integers are big-endian; strings are UTF-8.</p>
 *
 * <pre>
 *   u8[2]  magic 'R' 'V'
 *   u8     version (1)
 *   u8     flags (bit 0: live)
 *   u16    key length, key bytes
 *   u16    attribute count, then per attribute:
 *            u16 name length, name bytes, u16 value length, value bytes
 *   i32    payload length (0 for a dead envelope), payload bytes
 *   u32    CRC-32 of every preceding byte
 * </pre>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   byte[] datagram
 *        → EnvelopeFrameDecoder   (wire rules applied here)
 *            → EnvelopeFrame      (checksum-validated, key parsed)
 *                → Rendezvous.send on the receiving process
 * </pre>
 *
 * <p>Decoders never throw for wire defects; they return
 * {@link java.util.Optional#empty()} and the datagram is dropped.</p>
 */
package com.questrail.rendezvous.codec;
