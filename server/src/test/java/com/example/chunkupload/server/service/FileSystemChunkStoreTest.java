package com.example.chunkupload.server.service;

import com.example.chunkupload.server.config.ChunkServerProperties;
import com.example.chunkupload.server.exception.ChecksumMismatchException;
import com.example.chunkupload.server.exception.InvalidRequestException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HexFormat;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileSystemChunkStoreTest {

    @TempDir
    Path storageRoot;

    private ChunkServerProperties properties;
    private ChecksumService checksumService;
    private FileSystemChunkStore store;

    @BeforeEach
    void setUp() throws IOException {
        properties = new ChunkServerProperties();
        properties.setStoragePath(storageRoot.toString());
        properties.setChunkSize(16);
        properties.init();
        checksumService = new ChecksumService();
        store = new FileSystemChunkStore(properties, checksumService);
    }

    @Test
    void listIsEmptyForFreshAreaAndForUnknownArea() throws IOException {
        store.createArea("s1");

        assertThat(store.listChunks("s1")).isEmpty();
        assertThat(store.listChunks("never-created")).isEmpty();
    }

    @Test
    void chunksAreListedInAscendingOrderRegardlessOfArrival() throws IOException {
        store.createArea("s1");
        write("s1", 2, "cc");
        write("s1", 0, "aa");
        write("s1", 1, "bb");

        assertThat(store.listChunks("s1")).containsExactly(0, 1, 2);
    }

    @Test
    void rewritingSameIndexOverwritesWithoutDuplication() throws IOException {
        store.createArea("s1");
        write("s1", 0, "first");
        StoredChunk second = write("s1", 0, "first");

        assertThat(store.listChunks("s1")).containsExactly(0);
        assertThat(second.getSize()).isEqualTo(5);
        assertThat(read("s1", 0)).isEqualTo("first");
    }

    @Test
    void oversizedChunkIsRejectedAndNothingIsLeftBehind() throws IOException {
        store.createArea("s1");

        assertThatThrownBy(() -> store.writeChunk("s1", 0, stream("0123456789abcdefXYZ"), 16, false, null))
                .isInstanceOf(InvalidRequestException.class);

        assertThat(store.listChunks("s1")).isEmpty();
        assertThat(filesIn("s1")).isEmpty();
    }

    @Test
    void exactLengthIsEnforcedWhenRequested() throws IOException {
        store.createArea("s1");

        assertThatThrownBy(() -> store.writeChunk("s1", 0, stream("short"), 16, true, null))
                .isInstanceOf(InvalidRequestException.class);
        assertThat(store.listChunks("s1")).isEmpty();
    }

    @Test
    void checksumMismatchDoesNotExposeChunk() throws IOException {
        store.createArea("s1");
        String wrong = "0".repeat(64);

        assertThatThrownBy(() -> store.writeChunk("s1", 0, stream("payload"), 16, false, wrong))
                .isInstanceOf(ChecksumMismatchException.class);
        assertThat(store.listChunks("s1")).isEmpty();
        assertThat(filesIn("s1")).isEmpty();
    }

    @Test
    void matchingChecksumIsAccepted() throws Exception {
        store.createArea("s1");
        byte[] payload = "payload".getBytes(StandardCharsets.UTF_8);
        String sha = HexFormat.of().formatHex(java.security.MessageDigest.getInstance("SHA-256").digest(payload));

        StoredChunk stored = store.writeChunk("s1", 3, new ByteArrayInputStream(payload), 16, false, sha.toUpperCase());

        assertThat(stored.getSha256()).isEqualTo(sha);
        assertThat(store.listChunks("s1")).containsExactly(3);
    }

    @Test
    void temporaryFilesAreNeverListed() throws IOException {
        store.createArea("s1");
        Files.writeString(storageRoot.resolve("sessions/s1/chunk_4.part.abc.tmp"), "partial");

        assertThat(store.listChunks("s1")).isEmpty();
    }

    @Test
    void writeRecreatesWipedArea() throws IOException {
        store.createArea("s1");
        store.deleteArea("s1");

        write("s1", 0, "again");

        assertThat(store.listChunks("s1")).containsExactly(0);
    }

    @Test
    void deleteAreaRemovesEverything() throws IOException {
        store.createArea("s1");
        write("s1", 0, "aa");
        write("s1", 1, "bb");

        store.deleteArea("s1");

        assertThat(Files.exists(properties.getSessionsPath().resolve("s1"))).isFalse();
        assertThat(store.listChunks("s1")).isEmpty();
    }

    @Test
    void concurrentWritesToDifferentIndicesAllLand() throws Exception {
        store.createArea("s1");
        int chunks = 8;
        ExecutorService pool = Executors.newFixedThreadPool(chunks);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<StoredChunk>> futures = new java.util.ArrayList<>();
            for (int i = 0; i < chunks; i++) {
                final int index = i;
                futures.add(pool.submit(() -> {
                    start.await();
                    return write("s1", index, "chunk-" + index);
                }));
            }
            start.countDown();
            for (Future<StoredChunk> future : futures) {
                future.get();
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(store.listChunks("s1")).containsExactly(0, 1, 2, 3, 4, 5, 6, 7);
        assertThat(read("s1", 5)).isEqualTo("chunk-5");
    }

    private StoredChunk write(String uploadId, int index, String content) throws IOException {
        return store.writeChunk(uploadId, index, stream(content), 16, false, null);
    }

    private String read(String uploadId, int index) throws IOException {
        try (InputStream in = store.openChunk(uploadId, index)) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private List<Path> filesIn(String uploadId) throws IOException {
        try (Stream<Path> files = Files.list(properties.getSessionsPath().resolve(uploadId))) {
            return files.toList();
        }
    }

    private static InputStream stream(String content) {
        return new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8));
    }
}
