package com.analyzemyteam.timelinesync.config;

import com.analyzemyteam.timelinesync.config.properties.SyncProperties;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Shared OkHttp client for the REST fetch and the push WebSocket.
 *
 * <p>Read timeout is disabled so an idle push connection is not torn down between messages;
 * liveness is enforced by the application heartbeat instead. REST calls carry their own
 * per-call timeout.
 */
@Configuration
public class RemoteClientConfig {

    @Bean
    public OkHttpClient remoteHttpClient(SyncProperties properties) {
        Duration connectTimeout = Duration.ofMillis(properties.getFetch().getTimeoutMs());
        return new OkHttpClient.Builder()
                .connectTimeout(connectTimeout)
                .readTimeout(Duration.ZERO)
                .writeTimeout(connectTimeout)
                .retryOnConnectionFailure(true)
                .build();
    }
}
