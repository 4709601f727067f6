/**
 * Core domain model for recording sessions.
 *
 * <p>Contains immutable value types shared between the capture, ledger and upload layers:
 * <ul>
 *   <li>{@link com.phillippitts.capturesync.domain.RecordingOptions} - per-session identity and destination</li>
 *   <li>{@link com.phillippitts.capturesync.domain.SessionPaths} - working-directory layout of one session</li>
 *   <li>{@link com.phillippitts.capturesync.domain.UploadTask} - one file handed to the upload primitive</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.capturesync.domain;
