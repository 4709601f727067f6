package com.phillippitts.capturesync.service.upload.s3;

import com.phillippitts.capturesync.config.upload.S3UploadProperties;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.services.s3.S3Configuration;

import java.net.URI;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Lazily builds and caches one {@link S3Client} per region.
 *
 * <p>Sessions may target different regions, so a single client bean is not enough. Clients are
 * thread-safe and shared by all concurrent uploads.
 */
@Component
public class S3Clients {

    private static final Logger LOG = LogManager.getLogger(S3Clients.class);

    private final S3UploadProperties props;
    private final Map<String, S3Client> clients = new ConcurrentHashMap<>();

    public S3Clients(S3UploadProperties props) {
        this.props = Objects.requireNonNull(props, "props");
    }

    public S3Client forRegion(String region) {
        return clients.computeIfAbsent(region, this::build);
    }

    private S3Client build(String region) {
        S3ClientBuilder builder = S3Client.builder()
                .region(Region.of(region))
                .credentialsProvider(credentials())
                .serviceConfiguration(S3Configuration.builder()
                        .pathStyleAccessEnabled(props.isPathStyleAccess())
                        .build());
        if (props.getEndpoint() != null && !props.getEndpoint().isBlank()) {
            builder.endpointOverride(URI.create(props.getEndpoint()));
        }
        LOG.info("Created S3 client for region {}", region);
        return builder.build();
    }

    private AwsCredentialsProvider credentials() {
        if (props.hasStaticCredentials()) {
            return StaticCredentialsProvider.create(
                    AwsBasicCredentials.create(props.getAccessKey(), props.getSecretKey()));
        }
        return DefaultCredentialsProvider.create();
    }

    @PreDestroy
    public void close() {
        clients.values().forEach(S3Client::close);
        clients.clear();
    }
}
