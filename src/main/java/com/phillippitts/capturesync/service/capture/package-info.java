/**
 * Capture engine abstraction.
 *
 * <p>The coordinator treats the engine as an opaque component that writes segment files and
 * ledgers to disk. {@link com.phillippitts.capturesync.service.capture.ffmpeg.FfmpegCaptureEngine}
 * is the default implementation.
 */
package com.phillippitts.capturesync.service.capture;
