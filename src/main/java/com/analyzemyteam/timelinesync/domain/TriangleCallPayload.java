package com.analyzemyteam.timelinesync.domain;

/**
 * Triangle call issued for a formation, either by the backend or by a coach override.
 */
public record TriangleCallPayload(TriangleCallType call, String formationId, String reason) implements EventPayload {

    public TriangleCallPayload {
        call = call == null ? TriangleCallType.NO_CALL : call;
        formationId = formationId == null ? "" : formationId;
        reason = reason == null ? "" : reason;
    }

    @Override
    public EventKind kind() {
        return EventKind.TRIANGLE_CALL;
    }
}
