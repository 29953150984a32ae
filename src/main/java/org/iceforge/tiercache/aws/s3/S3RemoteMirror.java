package org.iceforge.tiercache.aws.s3;

import org.iceforge.tiercache.cache.CacheCounters;
import org.iceforge.tiercache.remote.RemoteAccessException;
import org.iceforge.tiercache.remote.RemoteMirror;
import org.iceforge.tiercache.remote.RemoteObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.ResponseInputStream;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link RemoteMirror} backed by the AWS SDK v2 {@link S3Client}.
 * Objects are written to {@code s3://<bucket>/<prefix>/<actionId>}.
 */
public class S3RemoteMirror implements RemoteMirror {
    private static final Logger logger = LoggerFactory.getLogger(S3RemoteMirror.class);

    private final S3Client s3;
    private final String bucket;
    private final String prefix;
    private final CacheCounters counters = new CacheCounters();

    public S3RemoteMirror(S3Client s3, String bucket, String prefix) {
        this.s3 = Objects.requireNonNull(s3, "s3");
        if (bucket == null || bucket.isBlank()) {
            throw new IllegalArgumentException("S3 bucket must be set");
        }
        this.bucket = bucket;
        this.prefix = Objects.requireNonNull(prefix, "prefix");
    }

    @Override
    public void put(String actionId, String outputId, long size, InputStream body) {
        counters.recordPut();
        String key = objectKey(actionId);
        logger.debug("s3 put s3://{}/{} outputId={} size={}", bucket, key, outputId, size);

        PutObjectRequest req = PutObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .contentLength(size)
                .metadata(Map.of(OUTPUT_ID_METADATA_KEY, outputId))
                .build();
        // some transports reject a missing body, so size 0 still sends a concrete empty one
        RequestBody requestBody = size == 0 ? RequestBody.empty() : RequestBody.fromInputStream(body, size);

        long start = System.nanoTime();
        try {
            s3.putObject(req, requestBody);
        } catch (SdkException | UncheckedIOException e) {
            counters.recordPutError();
            throw new RemoteAccessException("S3 put failed: s3://" + bucket + "/" + key, e);
        }
        counters.recordPutTransfer(size, Duration.ofNanos(System.nanoTime() - start));
    }

    @Override
    public Optional<RemoteObject> get(String actionId) {
        counters.recordGet();
        String key = objectKey(actionId);
        logger.debug("s3 get s3://{}/{}", bucket, key);

        long start = System.nanoTime();
        ResponseInputStream<GetObjectResponse> in;
        try {
            in = s3.getObject(GetObjectRequest.builder().bucket(bucket).key(key).build());
        } catch (SdkException e) {
            if (S3NotFoundClassifier.isNotFound(e)) {
                counters.recordMiss();
                return Optional.empty();
            }
            counters.recordGetError();
            throw new RemoteAccessException("S3 get failed: s3://" + bucket + "/" + key, e);
        }
        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);

        GetObjectResponse resp = in.response();
        String outputId = resp.metadata() == null ? null : resp.metadata().get(OUTPUT_ID_METADATA_KEY);
        if (outputId == null || outputId.isBlank()) {
            closeAfterFailure(in, key);
            counters.recordGetError();
            throw new RemoteAccessException("S3 object has no " + OUTPUT_ID_METADATA_KEY
                    + " metadata: s3://" + bucket + "/" + key);
        }
        if (resp.contentLength() == null) {
            closeAfterFailure(in, key);
            counters.recordGetError();
            throw new RemoteAccessException("S3 object has no content length: s3://" + bucket + "/" + key);
        }

        long size = resp.contentLength();
        if (logger.isDebugEnabled() && elapsed.toMillis() > 0) {
            logger.debug("s3 get s3://{}/{}: {} bytes / {} ms = {} B/ms",
                    bucket, key, size, elapsed.toMillis(), size / elapsed.toMillis());
        }
        counters.recordGetTransfer(size, elapsed);
        counters.recordHit();
        return Optional.of(new RemoteObject(outputId, size, in));
    }

    @Override
    public String prefix() {
        return prefix;
    }

    @Override
    public CacheCounters counters() {
        return counters;
    }

    public String bucket() {
        return bucket;
    }

    String objectKey(String actionId) {
        return prefix + "/" + actionId;
    }

    private void closeAfterFailure(InputStream in, String key) {
        try {
            in.close();
        } catch (IOException e) {
            logger.debug("Failed to close response stream for s3://{}/{}", bucket, key, e);
        }
    }
}
