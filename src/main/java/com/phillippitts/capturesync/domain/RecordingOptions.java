package com.phillippitts.capturesync.domain;

import jakarta.validation.constraints.NotBlank;

import java.util.Optional;

/**
 * Identity and destination of one recording session, as supplied by the caller of start.
 *
 * @param userId owner of the recording
 * @param videoId id of the video the segments belong to
 * @param screenIndex capture-engine screen selector
 * @param videoIndex capture-engine camera/video device selector
 * @param audioName audio input device name; blank means no explicit device
 * @param awsRegion destination region (falls back to configured default when blank)
 * @param awsBucket destination bucket (falls back to configured default when blank)
 */
public record RecordingOptions(
        @NotBlank String userId,
        @NotBlank String videoId,
        String screenIndex,
        String videoIndex,
        String audioName,
        String awsRegion,
        String awsBucket
) {

    /** Audio device hint for the capture engine; empty when no device name was given. */
    public Optional<String> audioDevice() {
        return (audioName == null || audioName.isBlank()) ? Optional.empty() : Optional.of(audioName);
    }
}
