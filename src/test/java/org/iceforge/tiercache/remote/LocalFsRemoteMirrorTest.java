package org.iceforge.tiercache.remote;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class LocalFsRemoteMirrorTest {

    @TempDir
    Path base;

    private LocalFsRemoteMirror mirror;

    @BeforeEach
    void setUp() {
        mirror = new LocalFsRemoteMirror(base, "bucket", "go-cache");
    }

    @Test
    void putThenGet_roundTripsBodyAndOutputId() throws Exception {
        byte[] data = "remote-bytes".getBytes(StandardCharsets.UTF_8);
        mirror.put("act1", "abcd", data.length, new ByteArrayInputStream(data));

        Path object = base.toAbsolutePath().resolve("bucket").resolve("go-cache").resolve("act1");
        assertTrue(Files.exists(object));
        assertTrue(Files.exists(object.resolveSibling("act1.meta")));

        Optional<RemoteObject> found = mirror.get("act1");
        assertTrue(found.isPresent());
        try (RemoteObject obj = found.get()) {
            assertEquals("abcd", obj.outputId());
            assertEquals(data.length, obj.size());
            assertArrayEquals(data, obj.body().readAllBytes());
        }
        assertEquals(1, mirror.counters().hits());
    }

    @Test
    void put_emptyObject() throws Exception {
        mirror.put("empty", "00", 0, InputStream.nullInputStream());

        try (RemoteObject obj = mirror.get("empty").orElseThrow()) {
            assertEquals(0, obj.size());
            assertEquals("00", obj.outputId());
        }
    }

    @Test
    void get_absentIsMiss() {
        assertTrue(mirror.get("nope").isEmpty());
        assertEquals(1, mirror.counters().misses());
    }

    @Test
    void get_withoutMetadataIsError() throws Exception {
        mirror.put("act1", "abcd", 1, new ByteArrayInputStream(new byte[]{7}));
        Files.delete(base.toAbsolutePath().resolve("bucket/go-cache/act1.meta"));

        assertThrows(RemoteAccessException.class, () -> mirror.get("act1"));
        assertEquals(1, mirror.counters().getErrors());
    }

    @Test
    void put_sizeMismatchIsErrorAndLeavesNoObject() {
        assertThrows(RemoteAccessException.class, () ->
                mirror.put("act1", "abcd", 5, new ByteArrayInputStream(new byte[]{1, 2})));

        assertEquals(1, mirror.counters().putErrors());
        assertFalse(Files.exists(base.toAbsolutePath().resolve("bucket/go-cache/act1")));
    }

    @Test
    void failedOverwriteKeepsPreviousObjectAndIdentity() throws Exception {
        mirror.put("act", "aaaa", 2, new ByteArrayInputStream("hi".getBytes(StandardCharsets.UTF_8)));

        assertThrows(RemoteAccessException.class, () -> mirror.put("act", "bbbb", 10,
                new ByteArrayInputStream("hello".getBytes(StandardCharsets.UTF_8))));

        try (RemoteObject obj = mirror.get("act").orElseThrow()) {
            assertEquals("aaaa", obj.outputId());
            assertEquals("hi", new String(obj.body().readAllBytes(), StandardCharsets.UTF_8));
        }
        try (Stream<Path> files = Files.list(base.toAbsolutePath().resolve("bucket/go-cache"))) {
            assertThat(files.map(p -> p.getFileName().toString())).noneMatch(n -> n.endsWith(".tmp"));
        }
    }

    @Test
    void failedBodyReadLeavesNoTempFiles() throws Exception {
        InputStream failing = new InputStream() {
            @Override
            public int read() throws IOException {
                throw new IOException("disk read failed");
            }
        };

        assertThrows(RemoteAccessException.class, () -> mirror.put("act", "abcd", 4, failing));

        assertTrue(mirror.get("act").isEmpty());
        try (Stream<Path> files = Files.list(base.toAbsolutePath().resolve("bucket/go-cache"))) {
            assertThat(files).isEmpty();
        }
    }

    @Test
    void overwriteReplacesBodyAndIdentityTogether() throws Exception {
        mirror.put("act", "aaaa", 2, new ByteArrayInputStream(new byte[]{1, 2}));
        mirror.put("act", "bbbb", 3, new ByteArrayInputStream(new byte[]{3, 4, 5}));

        try (RemoteObject obj = mirror.get("act").orElseThrow()) {
            assertEquals("bbbb", obj.outputId());
            assertArrayEquals(new byte[]{3, 4, 5}, obj.body().readAllBytes());
        }
    }

    @Test
    void get_nestedKeyIsMissUntilWritten() throws Exception {
        assertTrue(mirror.get("x/y").isEmpty());

        mirror.put("x/y", "abcd", 1, new ByteArrayInputStream(new byte[]{9}));
        try (RemoteObject obj = mirror.get("x/y").orElseThrow()) {
            assertEquals("abcd", obj.outputId());
        }
    }

    @Test
    void pathFor_rejectsTraversal() {
        assertThrows(IllegalArgumentException.class, () -> mirror.pathFor("../../../../etc/passwd"));
        assertThrows(IllegalArgumentException.class, () -> mirror.pathFor("../other-prefix/act"));
    }
}
