/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.analyzemyteam.timelinesync.exception.TimelineSyncException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.analyzemyteam.timelinesync.exception.InvalidEventException} - Thrown when
 *       an inbound event fails validation at the ingestion boundary</li>
 *   <li>{@link com.analyzemyteam.timelinesync.exception.RemoteSyncException} - Thrown inside the
 *       remote client for transport failures; retried and never propagated to the coordinator</li>
 *   <li>{@link com.analyzemyteam.timelinesync.exception.EventStoreException} - Wraps persistence
 *       failures of the local event store</li>
 *   <li>{@link com.analyzemyteam.timelinesync.exception.MarkerNotFoundException} - Thrown when a
 *       marker id is unknown</li>
 * </ul>
 *
 * <p>All exceptions are unchecked and map to HTTP status codes via {@code GlobalExceptionHandler}.
 *
 * @see com.analyzemyteam.timelinesync.presentation.exception.GlobalExceptionHandler
 */
package com.analyzemyteam.timelinesync.exception;
