package com.phillippitts.capturesync.config.upload;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for S3 uploads.
 *
 * <p>Bucket and region act as defaults; a session's {@code awsBucket} / {@code awsRegion}
 * take precedence when present. Credentials fall back to the AWS default provider chain when
 * no static keys are configured.
 *
 * <pre>
 * upload.s3.region=us-east-1
 * upload.s3.bucket=capture-uploads
 * upload.s3.endpoint=http://localhost:9000
 * upload.s3.path-style-access=true
 * </pre>
 */
@ConfigurationProperties(prefix = "upload.s3")
@Validated
public class S3UploadProperties {

    @NotBlank(message = "Default S3 region must not be blank")
    private String region = "us-east-1";

    /** Default bucket; may be blank when every session supplies one. */
    private String bucket;

    /** Endpoint override for S3-compatible stores (MinIO, LocalStack). */
    private String endpoint;

    private boolean pathStyleAccess = false;

    private String accessKey;

    private String secretKey;

    public String getRegion() {
        return region;
    }

    public void setRegion(String region) {
        this.region = region;
    }

    public String getBucket() {
        return bucket;
    }

    public void setBucket(String bucket) {
        this.bucket = bucket;
    }

    public String getEndpoint() {
        return endpoint;
    }

    public void setEndpoint(String endpoint) {
        this.endpoint = endpoint;
    }

    public boolean isPathStyleAccess() {
        return pathStyleAccess;
    }

    public void setPathStyleAccess(boolean pathStyleAccess) {
        this.pathStyleAccess = pathStyleAccess;
    }

    public String getAccessKey() {
        return accessKey;
    }

    public void setAccessKey(String accessKey) {
        this.accessKey = accessKey;
    }

    public String getSecretKey() {
        return secretKey;
    }

    public void setSecretKey(String secretKey) {
        this.secretKey = secretKey;
    }

    public boolean hasStaticCredentials() {
        return accessKey != null && !accessKey.isBlank() && secretKey != null && !secretKey.isBlank();
    }
}
