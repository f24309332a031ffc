/**
 * Default codec implementations. Framing helpers and wire exceptions are
 * package-private.
 */
package com.questrail.rendezvous.codec.impl;
