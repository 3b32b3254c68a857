/**
 * Immutable domain model of the synchronization engine.
 *
 * <p>{@link com.analyzemyteam.timelinesync.domain.SyncEvent} is a tagged union: its
 * {@link com.analyzemyteam.timelinesync.domain.EventKind} selects exactly one
 * {@link com.analyzemyteam.timelinesync.domain.EventPayload} record type. Markers are derived
 * views of events and are referenced by id outside the marker manager.
 */
package com.analyzemyteam.timelinesync.domain;
