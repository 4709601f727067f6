/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.capturesync.exception.CaptureSyncException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.capturesync.exception.SessionSetupException} - Fatal start
 *       failures (missing data directory, directory reset errors)</li>
 *   <li>{@link com.phillippitts.capturesync.exception.CaptureEngineException} - Capture engine
 *       failed to start or stop</li>
 *   <li>{@link com.phillippitts.capturesync.exception.LedgerReadException} - Segment ledger
 *       missing or unreadable mid-session</li>
 *   <li>{@link com.phillippitts.capturesync.exception.UploadException} - A single file upload
 *       failed (logged, never retried)</li>
 *   <li>{@link com.phillippitts.capturesync.exception.SessionConflictException} - Start
 *       requested while a session is active</li>
 *   <li>{@link com.phillippitts.capturesync.exception.DrainIncompleteException} - Stop could
 *       not confirm that a track drained</li>
 * </ul>
 *
 * <p>All exceptions are unchecked and map to HTTP status codes via {@code GlobalExceptionHandler}.
 *
 * @see com.phillippitts.capturesync.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.capturesync.exception;
