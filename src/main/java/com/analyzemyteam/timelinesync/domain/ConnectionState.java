package com.analyzemyteam.timelinesync.domain;

/**
 * Remote connection lifecycle.
 *
 * <p>{@link #DEGRADED} is terminal until an explicit reconnect: it is entered when the
 * reconnect budget is exhausted.
 */
public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED,
    DEGRADED
}
