package com.analyzemyteam.timelinesync.service.remote;

import com.analyzemyteam.timelinesync.domain.SyncEvent;

import java.util.List;

/**
 * Receives remote data from {@link RemoteSyncClient}. Implementations must only enqueue work:
 * callbacks run on transport threads.
 */
public interface RemoteEventListener {

    void onPushMessage(PushMessage message);

    void onFetchCompleted(long fromMs, long toMs, List<SyncEvent> events);
}
