package com.phillippitts.capturesync.service.upload.s3;

import com.phillippitts.capturesync.config.upload.S3UploadProperties;
import com.phillippitts.capturesync.domain.RecordingOptions;
import com.phillippitts.capturesync.exception.UploadException;
import com.phillippitts.capturesync.service.upload.SegmentUploader;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectResponse;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Uploads session files to S3 with a single PutObject per file.
 *
 * <p>Object key layout: {@code <userId>/<videoId>/<trackKindLabel>/<fileName>}.
 * Bucket and region come from the session options, falling back to {@code upload.s3.*}.
 */
@Service
public class S3SegmentUploader implements SegmentUploader {

    private static final Logger LOG = LogManager.getLogger(S3SegmentUploader.class);

    private final S3Clients clients;
    private final S3UploadProperties props;

    public S3SegmentUploader(S3Clients clients, S3UploadProperties props) {
        this.clients = Objects.requireNonNull(clients, "clients");
        this.props = Objects.requireNonNull(props, "props");
    }

    @Override
    public void upload(RecordingOptions options, Path file, String trackKindLabel) {
        Objects.requireNonNull(options, "options");
        Objects.requireNonNull(file, "file");
        String fileName = file.getFileName().toString();
        String key = objectKey(options, trackKindLabel, fileName);
        String bucket = firstNonBlank(options.awsBucket(), props.getBucket());
        if (bucket == null) {
            throw new UploadException("No destination bucket configured", key);
        }
        String region = firstNonBlank(options.awsRegion(), props.getRegion());

        // the body measures the file itself, so the request carries no separate length
        RequestBody body;
        try {
            body = RequestBody.fromFile(file);
        } catch (UncheckedIOException e) {
            throw new UploadException("Cannot read " + fileName, key, e);
        }

        PutObjectRequest request = PutObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .contentType(contentType(fileName))
                .build();
        try {
            PutObjectResponse response = clients.forRegion(region).putObject(request, body);
            LOG.debug("Stored s3://{}/{} (etag={})", bucket, key, response.eTag());
        } catch (SdkException e) {
            throw new UploadException("S3 upload failed: " + e.getMessage(), key, e);
        }
    }

    static String objectKey(RecordingOptions options, String trackKindLabel, String fileName) {
        return options.userId() + "/" + options.videoId() + "/" + trackKindLabel + "/" + fileName;
    }

    static String contentType(String fileName) {
        return MediaTypeFactory.getMediaType(fileName)
                .orElse(MediaType.APPLICATION_OCTET_STREAM)
                .toString();
    }

    private static String firstNonBlank(String preferred, String fallback) {
        if (preferred != null && !preferred.isBlank()) {
            return preferred;
        }
        return (fallback == null || fallback.isBlank()) ? null : fallback;
    }
}
