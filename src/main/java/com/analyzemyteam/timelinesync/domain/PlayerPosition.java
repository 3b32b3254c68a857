package com.analyzemyteam.timelinesync.domain;

/**
 * Field position of one player within a detected formation (normalised field coordinates).
 */
public record PlayerPosition(String playerId, String role, double x, double y) {
}
