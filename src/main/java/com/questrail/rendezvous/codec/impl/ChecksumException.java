package com.questrail.rendezvous.codec.impl;

/**
 * A datagram's trailing CRC-32 does not match its contents. Internal to the codec; surfaces as a dropped datagram.
 */
final class ChecksumException extends Exception
{
    ChecksumException(String message) {
        super(message);
    }
}
