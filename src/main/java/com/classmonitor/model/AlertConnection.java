package com.classmonitor.model;

/**
 * One live outbound alert connection (a single device of a recipient).
 */
public interface AlertConnection {

    /**
     * Stable id of the underlying session, used for logging.
     */
    String getId();

    /**
     * Attempt to write an already serialized payload to the peer.
     *
     * @return false when the connection can no longer deliver
     */
    boolean trySend(String payload);
}
