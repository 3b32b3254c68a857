package com.analyzemyteam.timelinesync.service.remote;

import com.analyzemyteam.timelinesync.domain.SyncEvent;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Request/response side of the analytics backend.
 */
public interface RemoteEventApi {

    /**
     * Fetches all events with {@code fromMs <= videoTimestamp <= toMs}.
     *
     * <p>Cancelling the returned future aborts the underlying request.
     *
     * @return future completing with the decoded events (invalid items already dropped),
     *         or exceptionally with a {@link com.analyzemyteam.timelinesync.exception.RemoteSyncException}
     */
    CompletableFuture<List<SyncEvent>> fetchRange(long fromMs, long toMs);
}
