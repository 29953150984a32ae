package org.iceforge.tiercache.aws.s3;

import org.iceforge.tiercache.remote.RemoteAccessException;
import org.iceforge.tiercache.remote.RemoteObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import software.amazon.awssdk.awscore.exception.AwsErrorDetails;
import software.amazon.awssdk.core.ResponseInputStream;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.http.AbortableInputStream;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.*;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class S3RemoteMirrorTest {

    @Mock
    private S3Client s3Client;

    private S3RemoteMirror mirror;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        mirror = new S3RemoteMirror(s3Client, "bucket", "go-cache");
    }

    private static ResponseInputStream<GetObjectResponse> response(Map<String, String> metadata, byte[] data,
                                                                   AtomicBoolean closed) {
        InputStream in = new ByteArrayInputStream(data) {
            @Override
            public void close() {
                closed.set(true);
            }
        };
        return new ResponseInputStream<>(
                GetObjectResponse.builder().contentLength((long) data.length).metadata(metadata).build(),
                AbortableInputStream.create(in));
    }

    @Test
    void put_sendsKeyLengthAndOutputIdMetadata() {
        when(s3Client.putObject(any(PutObjectRequest.class), any(RequestBody.class)))
                .thenReturn(PutObjectResponse.builder().eTag("etag").build());
        byte[] data = "payload".getBytes(StandardCharsets.UTF_8);

        mirror.put("act1", "abcd", data.length, new ByteArrayInputStream(data));

        ArgumentCaptor<PutObjectRequest> req = ArgumentCaptor.forClass(PutObjectRequest.class);
        verify(s3Client).putObject(req.capture(), any(RequestBody.class));
        assertEquals("bucket", req.getValue().bucket());
        assertEquals("go-cache/act1", req.getValue().key());
        assertEquals(7L, req.getValue().contentLength());
        assertEquals(Map.of("outputid", "abcd"), req.getValue().metadata());
        assertEquals(1, mirror.counters().puts());
        assertEquals(7, mirror.counters().totalPutBytes());
    }

    @Test
    void put_emptyObjectSendsConcreteEmptyBody() {
        when(s3Client.putObject(any(PutObjectRequest.class), any(RequestBody.class)))
                .thenReturn(PutObjectResponse.builder().build());

        mirror.put("empty", "00", 0, InputStream.nullInputStream());

        ArgumentCaptor<RequestBody> body = ArgumentCaptor.forClass(RequestBody.class);
        verify(s3Client).putObject(any(PutObjectRequest.class), body.capture());
        assertEquals(Optional.of(0L), body.getValue().optionalContentLength());
    }

    @Test
    void put_failureIsCountedAndWrapped() {
        when(s3Client.putObject(any(PutObjectRequest.class), any(RequestBody.class)))
                .thenThrow(S3Exception.builder().message("S3 error").build());

        RemoteAccessException e = assertThrows(RemoteAccessException.class, () ->
                mirror.put("act1", "abcd", 1, new ByteArrayInputStream(new byte[]{1})));

        assertTrue(e.getMessage().contains("S3 put failed: s3://bucket/go-cache/act1"));
        assertEquals(1, mirror.counters().putErrors());
    }

    @Test
    void get_hitReturnsBodyAndOutputId() throws Exception {
        AtomicBoolean closed = new AtomicBoolean();
        when(s3Client.getObject(any(GetObjectRequest.class)))
                .thenReturn(response(Map.of("outputid", "abcd"), "hello".getBytes(StandardCharsets.UTF_8), closed));

        Optional<RemoteObject> found = mirror.get("act1");

        assertTrue(found.isPresent());
        try (RemoteObject obj = found.get()) {
            assertEquals("abcd", obj.outputId());
            assertEquals(5, obj.size());
            assertEquals("hello", new String(obj.body().readAllBytes(), StandardCharsets.UTF_8));
        }
        assertTrue(closed.get());
        assertEquals(1, mirror.counters().hits());
        assertEquals(5, mirror.counters().totalGetBytes());

        ArgumentCaptor<GetObjectRequest> req = ArgumentCaptor.forClass(GetObjectRequest.class);
        verify(s3Client).getObject(req.capture());
        assertEquals("go-cache/act1", req.getValue().key());
    }

    @Test
    void get_noSuchKeyIsMiss() {
        when(s3Client.getObject(any(GetObjectRequest.class))).thenThrow(NoSuchKeyException.builder().build());

        assertTrue(mirror.get("act1").isEmpty());
        assertEquals(1, mirror.counters().misses());
        assertEquals(0, mirror.counters().getErrors());
    }

    @Test
    void get_serverErrorIsError() {
        S3Exception err = (S3Exception) S3Exception.builder()
                .awsErrorDetails(AwsErrorDetails.builder().errorCode("InternalError").build())
                .statusCode(500)
                .build();
        when(s3Client.getObject(any(GetObjectRequest.class))).thenThrow(err);

        RemoteAccessException e = assertThrows(RemoteAccessException.class, () -> mirror.get("act1"));

        assertSame(err, e.getCause());
        assertEquals(1, mirror.counters().getErrors());
        assertEquals(0, mirror.counters().misses());
    }

    @Test
    void get_missingOutputIdMetadataIsErrorAndClosesBody() {
        AtomicBoolean closed = new AtomicBoolean();
        when(s3Client.getObject(any(GetObjectRequest.class)))
                .thenReturn(response(Map.of(), new byte[]{1, 2}, closed));

        assertThrows(RemoteAccessException.class, () -> mirror.get("act1"));

        assertTrue(closed.get());
        assertEquals(1, mirror.counters().getErrors());
        assertEquals(0, mirror.counters().hits());
    }

    @Test
    void constructor_requiresBucket() {
        assertThrows(IllegalArgumentException.class, () -> new S3RemoteMirror(s3Client, " ", "go-cache"));
    }
}
