package com.classmonitor.config;

/**
 * What a WebSocket endpoint does with a missing or invalid credential.
 */
public enum HandshakePolicy {
    /** Accept the upgrade, then close with 1008 (policy violation). */
    CLOSE_ON_INVALID,
    /** Admit the peer as anonymous and log the rejection reason. */
    ALLOW_ANONYMOUS
}
