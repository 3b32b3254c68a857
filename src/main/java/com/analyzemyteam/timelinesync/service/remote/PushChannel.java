package com.analyzemyteam.timelinesync.service.remote;

/**
 * Bidirectional push connection to the analytics backend.
 */
public interface PushChannel {

    /**
     * Opens a new connection, closing any previous one. Callbacks for a connection arrive on
     * the listener passed with it; callbacks of superseded connections must be ignored by the caller.
     */
    void open(Listener listener);

    /**
     * @return false when the text could not be queued (no open connection)
     */
    boolean send(String text);

    /** Closes the current connection, if any. */
    void close();

    /**
     * Connection callbacks. May be invoked from transport threads.
     */
    interface Listener {
        void onOpen();

        void onMessage(String text);

        void onClosed(String reason);

        void onFailure(Throwable error);
    }
}
