package com.analyzemyteam.timelinesync.service.remote;

import com.analyzemyteam.timelinesync.config.properties.SyncProperties;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * {@link PushChannel} over an OkHttp WebSocket.
 */
@Component
public class OkHttpPushChannel implements PushChannel {

    private static final Logger LOG = LogManager.getLogger(OkHttpPushChannel.class);

    static final int NORMAL_CLOSURE = 1000;

    private final OkHttpClient httpClient;
    private final SyncProperties properties;
    private final AtomicReference<WebSocket> current = new AtomicReference<>();

    public OkHttpPushChannel(OkHttpClient httpClient, SyncProperties properties) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.properties = Objects.requireNonNull(properties, "properties");
    }

    @Override
    public void open(Listener listener) {
        Objects.requireNonNull(listener, "listener");
        close();
        SyncProperties.Remote remote = properties.getRemote();
        Request.Builder builder = new Request.Builder().url(remote.getPushUrl());
        String apiKey = remote.getApiKey();
        if (apiKey != null && !apiKey.isBlank()) {
            builder.header("apikey", apiKey).header("Authorization", "Bearer " + apiKey);
        }
        Request request;
        try {
            request = builder.build();
        } catch (IllegalArgumentException ex) {
            listener.onFailure(ex);
            return;
        }
        LOG.debug("Opening push channel to {}", remote.getPushUrl());
        WebSocket socket = httpClient.newWebSocket(request, new WebSocketListener() {
            @Override
            public void onOpen(WebSocket webSocket, Response response) {
                listener.onOpen();
            }

            @Override
            public void onMessage(WebSocket webSocket, String text) {
                listener.onMessage(text);
            }

            @Override
            public void onClosing(WebSocket webSocket, int code, String reason) {
                webSocket.close(NORMAL_CLOSURE, null);
            }

            @Override
            public void onClosed(WebSocket webSocket, int code, String reason) {
                current.compareAndSet(webSocket, null);
                listener.onClosed(code + " " + reason);
            }

            @Override
            public void onFailure(WebSocket webSocket, Throwable t, Response response) {
                current.compareAndSet(webSocket, null);
                listener.onFailure(t);
            }
        });
        current.set(socket);
    }

    @Override
    public boolean send(String text) {
        WebSocket socket = current.get();
        return socket != null && socket.send(text);
    }

    @Override
    public void close() {
        WebSocket socket = current.getAndSet(null);
        if (socket != null) {
            socket.close(NORMAL_CLOSURE, "client closing");
        }
    }
}
