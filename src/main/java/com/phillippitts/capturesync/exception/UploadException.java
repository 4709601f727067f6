package com.phillippitts.capturesync.exception;

/**
 * Thrown when a single file upload fails. Never retried; logged and discarded by the dispatcher.
 */
public class UploadException extends CaptureSyncException {

    private final String objectKey;

    public UploadException(String message, String objectKey) {
        super(message + " (key: " + objectKey + ")");
        this.objectKey = objectKey;
    }

    public UploadException(String message, String objectKey, Throwable cause) {
        super(message + " (key: " + objectKey + ")", cause);
        this.objectKey = objectKey;
    }

    public String getObjectKey() {
        return objectKey;
    }
}
