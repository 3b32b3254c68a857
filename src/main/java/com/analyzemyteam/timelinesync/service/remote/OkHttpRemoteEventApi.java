package com.analyzemyteam.timelinesync.service.remote;

import com.analyzemyteam.timelinesync.config.properties.SyncProperties;
import com.analyzemyteam.timelinesync.domain.SyncEvent;
import com.analyzemyteam.timelinesync.exception.InvalidEventException;
import com.analyzemyteam.timelinesync.exception.RemoteSyncException;
import com.analyzemyteam.timelinesync.service.codec.EventJsonCodec;
import com.analyzemyteam.timelinesync.util.LogSanitizer;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * REST fetch over OkHttp: {@code GET {base-url}/events?from=..&to=..}.
 *
 * <p>The response is a JSON array of events, or an object with an {@code events} array.
 * Items that fail validation are dropped and logged; the rest of the batch is kept.
 */
@Component
public class OkHttpRemoteEventApi implements RemoteEventApi {

    private static final Logger LOG = LogManager.getLogger(OkHttpRemoteEventApi.class);

    static final int FETCH_LIMIT = 1_000;
    private static final int LOG_PREVIEW_CHARS = 200;

    private final OkHttpClient httpClient;
    private final SyncProperties properties;
    private final Clock clock;

    public OkHttpRemoteEventApi(OkHttpClient httpClient, SyncProperties properties, Clock clock) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.properties = Objects.requireNonNull(properties, "properties");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public CompletableFuture<List<SyncEvent>> fetchRange(long fromMs, long toMs) {
        CompletableFuture<List<SyncEvent>> future = new CompletableFuture<>();
        Request request;
        try {
            request = buildRequest(fromMs, toMs);
        } catch (IllegalArgumentException ex) {
            future.completeExceptionally(new RemoteSyncException("fetch", "invalid base url", ex));
            return future;
        }

        Call call = httpClient.newCall(request);
        call.timeout().timeout(properties.getFetch().getTimeoutMs(), TimeUnit.MILLISECONDS);
        // cancellation or an external timeout aborts the HTTP call
        future.whenComplete((events, error) -> {
            if (error != null) {
                call.cancel();
            }
        });
        call.enqueue(new Callback() {
            @Override
            public void onFailure(Call c, IOException e) {
                future.completeExceptionally(new RemoteSyncException("fetch", e.getMessage(), e));
            }

            @Override
            public void onResponse(Call c, Response response) {
                try (response) {
                    if (!response.isSuccessful()) {
                        future.completeExceptionally(new RemoteSyncException("fetch", response.code(), response.message()));
                        return;
                    }
                    ResponseBody body = response.body();
                    future.complete(parseEvents(body == null ? "" : body.string()));
                } catch (RemoteSyncException e) {
                    future.completeExceptionally(e);
                } catch (IOException | RuntimeException e) {
                    future.completeExceptionally(new RemoteSyncException("fetch", "unreadable response: " + e.getMessage(), e));
                }
            }
        });
        return future;
    }

    Request buildRequest(long fromMs, long toMs) {
        SyncProperties.Remote remote = properties.getRemote();
        HttpUrl base = HttpUrl.get(remote.getBaseUrl());
        HttpUrl url = base.newBuilder()
                .addPathSegment("events")
                .addQueryParameter("from", Long.toString(fromMs))
                .addQueryParameter("to", Long.toString(toMs))
                .addQueryParameter("order", "video_timestamp.asc")
                .addQueryParameter("limit", Integer.toString(FETCH_LIMIT))
                .build();
        Request.Builder builder = new Request.Builder().url(url).get().header("Accept", "application/json");
        String apiKey = remote.getApiKey();
        if (apiKey != null && !apiKey.isBlank()) {
            builder.header("apikey", apiKey).header("Authorization", "Bearer " + apiKey);
        }
        return builder.build();
    }

    List<SyncEvent> parseEvents(String body) {
        JSONArray items;
        try {
            String trimmed = body.trim();
            if (trimmed.startsWith("[")) {
                items = new JSONArray(trimmed);
            } else {
                JSONObject root = new JSONObject(trimmed);
                items = root.optJSONArray("events");
                if (items == null) {
                    throw new RemoteSyncException("fetch", "response has no events array");
                }
            }
        } catch (JSONException ex) {
            throw new RemoteSyncException("fetch", "response is not JSON: "
                    + LogSanitizer.preview(body, LOG_PREVIEW_CHARS), ex);
        }

        long now = clock.millis();
        List<SyncEvent> events = new ArrayList<>(items.length());
        int dropped = 0;
        for (int i = 0; i < items.length(); i++) {
            try {
                events.add(EventJsonCodec.decodeEvent(items.optJSONObject(i), now));
            } catch (InvalidEventException ex) {
                dropped++;
                LOG.warn("Dropping fetched event #{}: {}", i, ex.getMessage());
            }
        }
        if (dropped > 0) {
            LOG.info("Fetch returned {} events, {} dropped as invalid", events.size(), dropped);
        }
        return events;
    }
}
