package com.questrail.rendezvous.codec.impl;

/**
 * A datagram does not follow the rendezvous frame layout. Internal to the codec; surfaces as a dropped datagram.
 */
final class FramingException extends Exception
{
    FramingException(String message) {
        super(message);
    }
}
