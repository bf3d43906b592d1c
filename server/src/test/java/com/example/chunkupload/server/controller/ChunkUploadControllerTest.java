package com.example.chunkupload.server.controller;

import com.example.chunkupload.server.service.FailureInjector;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.ResultActions;

import java.nio.file.Files;
import java.nio.file.Paths;
import java.security.MessageDigest;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class ChunkUploadControllerTest {

    private static final int CHUNK_SIZE = 1024;

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private FailureInjector failureInjector;

    @AfterEach
    void resetInjector() {
        failureInjector.reset();
    }

    @Test
    void fullUploadAssemblesByteIdenticalFile() throws Exception {
        byte[] file = randomBytes(2 * CHUNK_SIZE + 500);
        String id = initiate("scenario.bin", (long) file.length, sha256(file));

        // 일부러 역순 전송
        for (int index = 2; index >= 0; index--) {
            putChunk(id, index, slice(file, index)).andExpect(status().isOk())
                    .andExpect(jsonPath("$.index").value(index));
        }

        mockMvc.perform(get("/upload/{id}/status", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("OPEN"))
                .andExpect(jsonPath("$.chunkSize").value(CHUNK_SIZE))
                .andExpect(jsonPath("$.uploadedChunks", contains(0, 1, 2)));

        MvcResult result = mockMvc.perform(post("/upload/{id}/complete", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("COMPLETED"))
                .andExpect(jsonPath("$.size").value(file.length))
                .andExpect(jsonPath("$.checksum").value(sha256(file)))
                .andReturn();

        String finalPath = json(result).get("finalPath").asText();
        assertThat(Files.readAllBytes(Paths.get(finalPath))).isEqualTo(file);

        mockMvc.perform(get("/api/files/{id}/download", id))
                .andExpect(status().isOk())
                .andExpect(content().bytes(file));
    }

    @Test
    void repeatedChunkIsIdempotent() throws Exception {
        byte[] file = randomBytes(CHUNK_SIZE + 10);
        String id = initiate("dup.bin", (long) file.length, null);

        putChunk(id, 0, slice(file, 0)).andExpect(status().isOk());
        putChunk(id, 0, slice(file, 0)).andExpect(status().isOk());
        putChunk(id, 1, slice(file, 1)).andExpect(status().isOk());

        mockMvc.perform(get("/upload/{id}/status", id))
                .andExpect(jsonPath("$.uploadedChunks", contains(0, 1)));
        mockMvc.perform(post("/upload/{id}/complete", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.size").value(file.length));
    }

    @Test
    void unknownSessionIsNotFoundButEmptySessionIsNot() throws Exception {
        mockMvc.perform(get("/upload/{id}/status", "no-such-session"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("NOT_FOUND"));
        putChunk("no-such-session", 0, new byte[]{1}).andExpect(status().isNotFound());
        mockMvc.perform(post("/upload/{id}/complete", "no-such-session"))
                .andExpect(status().isNotFound());

        String id = initiate("empty.bin", 100L, null);
        mockMvc.perform(get("/upload/{id}/status", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.uploadedChunks", empty()));
    }

    @Test
    void completeWithMissingChunkIsConflictAndSessionStaysOpen() throws Exception {
        byte[] file = randomBytes(3 * CHUNK_SIZE);
        String id = initiate("gap.bin", (long) file.length, null);
        putChunk(id, 0, slice(file, 0)).andExpect(status().isOk());
        putChunk(id, 2, slice(file, 2)).andExpect(status().isOk());

        mockMvc.perform(post("/upload/{id}/complete", id))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("ASSEMBLY_INCOMPLETE"));
        mockMvc.perform(get("/upload/{id}/status", id))
                .andExpect(jsonPath("$.status").value("OPEN"))
                .andExpect(jsonPath("$.uploadedChunks", contains(0, 2)));
        mockMvc.perform(get("/api/files/{id}/download", id))
                .andExpect(status().isConflict());
    }

    @Test
    void zeroByteFileUsesOneEmptyChunk() throws Exception {
        String id = initiate("empty.txt", 0L, sha256(new byte[0]));
        putChunk(id, 0, new byte[0]).andExpect(status().isOk())
                .andExpect(jsonPath("$.size").value(0));

        mockMvc.perform(post("/upload/{id}/complete", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.size").value(0));
    }

    @Test
    void completedSessionRejectsChunksAndRepeatsResult() throws Exception {
        byte[] file = randomBytes(10);
        String id = initiate("done.bin", 10L, null);
        putChunk(id, 0, file).andExpect(status().isOk());

        String first = mockMvc.perform(post("/upload/{id}/complete", id))
                .andExpect(status().isOk()).andReturn().getResponse().getContentAsString();
        String second = mockMvc.perform(post("/upload/{id}/complete", id))
                .andExpect(status().isOk()).andReturn().getResponse().getContentAsString();

        assertThat(second).isEqualTo(first);
        putChunk(id, 0, file)
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("SESSION_COMPLETED"));
        mockMvc.perform(get("/upload/{id}/status", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("COMPLETED"))
                .andExpect(jsonPath("$.uploadedChunks", empty()));
    }

    @Test
    void wholeFileChecksumMismatchIsUnprocessable() throws Exception {
        String id = initiate("bad.bin", 4L, "1".repeat(64));
        putChunk(id, 0, new byte[]{1, 2, 3, 4}).andExpect(status().isOk());

        mockMvc.perform(post("/upload/{id}/complete", id))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error").value("CHECKSUM_MISMATCH"));
    }

    @Test
    void chunkChecksumHeaderIsVerified() throws Exception {
        byte[] chunk = new byte[]{9, 8, 7};
        String id = initiate("hdr.bin", 3L, null);

        mockMvc.perform(put("/upload/{id}/chunk/{index}", id, 0)
                        .contentType(MediaType.APPLICATION_OCTET_STREAM)
                        .header(ChunkUploadController.CHUNK_SHA256_HEADER, "2".repeat(64))
                        .content(chunk))
                .andExpect(status().isUnprocessableEntity());

        mockMvc.perform(put("/upload/{id}/chunk/{index}", id, 0)
                        .contentType(MediaType.APPLICATION_OCTET_STREAM)
                        .header(ChunkUploadController.CHUNK_SHA256_HEADER, sha256(chunk))
                        .content(chunk))
                .andExpect(status().isOk());
    }

    @Test
    void invalidChunksAreBadRequests() throws Exception {
        String id = initiate("range.bin", 100L, null);

        putChunk(id, 1, new byte[10])
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_CHUNK"));
        putChunk(id, 0, new byte[99]).andExpect(status().isBadRequest());
        mockMvc.perform(put("/upload/{id}/chunk/{index}", id, 0)
                        .contentType(MediaType.TEXT_PLAIN)
                        .content("hello"))
                .andExpect(status().isUnsupportedMediaType());
    }

    @Test
    void initiateValidation() throws Exception {
        mockMvc.perform(post("/upload/initiate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"filename\":\"x.bin\",\"fileSize\":10}"))
                .andExpect(status().isCreated())
                .andExpect(header().exists("Location"))
                .andExpect(jsonPath("$.chunkSize").value(CHUNK_SIZE));

        mockMvc.perform(post("/upload/initiate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"filename\":\"a/b.bin\"}"))
                .andExpect(status().isBadRequest());
        mockMvc.perform(post("/upload/initiate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"filename\":\"big.bin\",\"fileSize\":999999999}"))
                .andExpect(status().isPayloadTooLarge());
    }

    @Test
    void injectedFailuresReturnServiceUnavailableThenRecover() throws Exception {
        String id = initiate("flaky.bin", 3L, null);
        mockMvc.perform(post("/api/debug/fail-next-chunks").param("count", "2"))
                .andExpect(status().isOk());

        putChunk(id, 0, new byte[]{1, 2, 3})
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error").value("INJECTED_FAILURE"));
        putChunk(id, 0, new byte[]{1, 2, 3}).andExpect(status().isServiceUnavailable());
        putChunk(id, 0, new byte[]{1, 2, 3}).andExpect(status().isOk());

        mockMvc.perform(get("/api/debug/status"))
                .andExpect(jsonPath("$.remainingChunkFailures").value(0));
    }

    private String initiate(String filename, Long fileSize, String checksum) throws Exception {
        StringBuilder body = new StringBuilder("{\"filename\":\"").append(filename).append('"');
        if (fileSize != null) {
            body.append(",\"fileSize\":").append(fileSize);
        }
        if (checksum != null) {
            body.append(",\"checksum\":\"").append(checksum).append('"');
        }
        body.append('}');

        MvcResult result = mockMvc.perform(post("/upload/initiate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body.toString()))
                .andExpect(status().isCreated())
                .andReturn();
        return json(result).get("uploadId").asText();
    }

    private ResultActions putChunk(String id, int index, byte[] data)
            throws Exception {
        return mockMvc.perform(put("/upload/{id}/chunk/{index}", id, index)
                .contentType(MediaType.APPLICATION_OCTET_STREAM)
                .content(data));
    }

    private JsonNode json(MvcResult result) throws Exception {
        return objectMapper.readTree(result.getResponse().getContentAsString());
    }

    private static byte[] slice(byte[] file, int index) {
        int from = index * CHUNK_SIZE;
        return Arrays.copyOfRange(file, from, Math.min(file.length, from + CHUNK_SIZE));
    }

    private static byte[] randomBytes(int size) {
        byte[] data = new byte[size];
        new Random(size).nextBytes(data);
        return data;
    }

    private static String sha256(byte[] data) throws Exception {
        return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(data));
    }
}
