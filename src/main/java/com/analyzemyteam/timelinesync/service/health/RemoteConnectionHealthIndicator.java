package com.analyzemyteam.timelinesync.service.health;

import com.analyzemyteam.timelinesync.domain.ConnectionStatus;
import com.analyzemyteam.timelinesync.service.remote.RemoteSyncClient;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health of the analytics backend connection.
 *
 * <ul>
 *   <li>UP: push channel connected, or remote sync disabled (local-only mode)</li>
 *   <li>DEGRADED: connecting or temporarily disconnected, reconnects pending</li>
 *   <li>DOWN: reconnect budget exhausted</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class RemoteConnectionHealthIndicator implements HealthIndicator {

    private final RemoteSyncClient client;

    public RemoteConnectionHealthIndicator(RemoteSyncClient client) {
        this.client = client;
    }

    @Override
    public Health health() {
        if (!client.isEnabled()) {
            return Health.up().withDetail("status", "Remote sync disabled").build();
        }
        ConnectionStatus status = client.status();
        Health.Builder builder = new Health.Builder();
        switch (status.state()) {
            case CONNECTED -> builder.up().withDetail("status", "Connected");
            case CONNECTING, DISCONNECTED -> builder.status("DEGRADED")
                    .withDetail("status", "Reconnecting");
            default -> builder.down().withDetail("status", "Reconnect attempts exhausted");
        }
        builder.withDetail("state", status.state().name())
                .withDetail("reconnectAttempts", status.reconnectAttemptCount());
        if (status.lastHeartbeatAck() != null) {
            builder.withDetail("lastHeartbeatAck", status.lastHeartbeatAck().toString());
        }
        return builder.build();
    }
}
