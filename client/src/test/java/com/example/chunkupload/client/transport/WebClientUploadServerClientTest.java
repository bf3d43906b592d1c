package com.example.chunkupload.client.transport;

import com.example.chunkupload.client.dto.ChunkAckResponse;
import com.example.chunkupload.client.dto.CompleteResponse;
import com.example.chunkupload.client.dto.InitiateResponse;
import com.example.chunkupload.client.dto.UploadStatusResponse;
import com.example.chunkupload.client.exception.SessionNotFoundException;
import com.example.chunkupload.client.exception.TransientTransportException;
import com.example.chunkupload.client.exception.UploadRejectedException;
import com.github.tomakehurst.wiremock.WireMockServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.binaryEqualTo;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.equalToJson;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.okJson;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.put;
import static com.github.tomakehurst.wiremock.client.WireMock.putRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.wireMockConfig;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WebClientUploadServerClientTest {

    private WireMockServer wireMock;
    private WebClientUploadServerClient client;

    @BeforeEach
    void setUp() {
        wireMock = new WireMockServer(wireMockConfig().dynamicPort());
        wireMock.start();
        client = new WebClientUploadServerClient(webClient(wireMock.baseUrl(), Duration.ofSeconds(5)));
    }

    @AfterEach
    void tearDown() {
        wireMock.stop();
    }

    @Test
    void initiatePostsMetadataAndReadsSession() {
        wireMock.stubFor(post(urlEqualTo("/upload/initiate"))
                .willReturn(aResponse().withStatus(201)
                        .withHeader("Content-Type", "application/json")
                        .withBody("{\"uploadId\":\"abc\",\"chunkSize\":10485760}")));

        InitiateResponse response = client.initiate("log.bin", 25L, "ff".repeat(32));

        assertThat(response.getUploadId()).isEqualTo("abc");
        assertThat(response.getChunkSize()).isEqualTo(10485760);
        wireMock.verify(postRequestedFor(urlEqualTo("/upload/initiate"))
                .withRequestBody(equalToJson(
                        "{\"filename\":\"log.bin\",\"fileSize\":25,\"checksum\":\"" + "ff".repeat(32) + "\"}")));
    }

    @Test
    void statusReadsAcceptedIndices() {
        wireMock.stubFor(get(urlEqualTo("/upload/abc/status"))
                .willReturn(okJson("{\"uploadId\":\"abc\",\"status\":\"OPEN\",\"chunkSize\":4,\"uploadedChunks\":[0,2]}")));

        UploadStatusResponse status = client.getStatus("abc");

        assertThat(status.isCompleted()).isFalse();
        assertThat(status.getUploadedChunks()).containsExactly(0, 2);
    }

    @Test
    void putSendsRawBytesWithChecksumHeader() {
        byte[] data = {1, 2, 3, 4};
        wireMock.stubFor(put(urlEqualTo("/upload/abc/chunk/3"))
                .willReturn(okJson("{\"uploadId\":\"abc\",\"index\":3,\"size\":4}")));

        ChunkAckResponse ack = client.putChunk("abc", 3, data, "deadbeef");

        assertThat(ack.getSize()).isEqualTo(4);
        wireMock.verify(putRequestedFor(urlEqualTo("/upload/abc/chunk/3"))
                .withHeader("Content-Type", equalTo("application/octet-stream"))
                .withHeader(WebClientUploadServerClient.CHUNK_SHA256_HEADER, equalTo("deadbeef"))
                .withRequestBody(binaryEqualTo(data)));
    }

    @Test
    void completeReturnsArtifactLocation() {
        wireMock.stubFor(post(urlEqualTo("/upload/abc/complete"))
                .willReturn(okJson("{\"uploadId\":\"abc\",\"status\":\"COMPLETED\","
                        + "\"finalPath\":\"/data/completed/abc__log.bin\",\"size\":25,\"checksum\":\"00\"}")));

        CompleteResponse response = client.complete("abc");

        assertThat(response.getFinalPath()).isEqualTo("/data/completed/abc__log.bin");
        assertThat(response.getSize()).isEqualTo(25);
    }

    @Test
    void notFoundMapsToSessionNotFound() {
        wireMock.stubFor(get(urlEqualTo("/upload/gone/status"))
                .willReturn(aResponse().withStatus(404)
                        .withHeader("Content-Type", "application/json")
                        .withBody("{\"error\":\"NOT_FOUND\",\"message\":\"없음\"}")));

        assertThatThrownBy(() -> client.getStatus("gone"))
                .isInstanceOfSatisfying(SessionNotFoundException.class,
                        e -> assertThat(e.getUploadId()).isEqualTo("gone"));
    }

    @Test
    void serverErrorsAreTransient() {
        wireMock.stubFor(put(urlEqualTo("/upload/abc/chunk/0"))
                .willReturn(aResponse().withStatus(503)
                        .withHeader("Content-Type", "application/json")
                        .withBody("{\"error\":\"INJECTED_FAILURE\",\"message\":\"시뮬레이션\"}")));
        wireMock.stubFor(post(urlEqualTo("/upload/abc/complete"))
                .willReturn(aResponse().withStatus(500).withBody("boom")));

        assertThatThrownBy(() -> client.putChunk("abc", 0, new byte[]{1}, null))
                .isInstanceOfSatisfying(TransientTransportException.class,
                        e -> assertThat(e.getStatusCode()).isEqualTo(503));
        assertThatThrownBy(() -> client.complete("abc"))
                .isInstanceOf(TransientTransportException.class);
    }

    @Test
    void clientErrorsAreRejectionsWithErrorCode() {
        wireMock.stubFor(post(urlEqualTo("/upload/abc/complete"))
                .willReturn(aResponse().withStatus(409)
                        .withHeader("Content-Type", "application/json")
                        .withBody("{\"error\":\"ASSEMBLY_INCOMPLETE\",\"message\":\"missing=[1]\"}")));
        wireMock.stubFor(put(urlEqualTo("/upload/abc/chunk/0"))
                .willReturn(aResponse().withStatus(409)
                        .withHeader("Content-Type", "application/json")
                        .withBody("{\"error\":\"SESSION_COMPLETED\",\"message\":\"done\"}")));

        assertThatThrownBy(() -> client.complete("abc"))
                .isInstanceOfSatisfying(UploadRejectedException.class, e -> {
                    assertThat(e.getStatusCode()).isEqualTo(409);
                    assertThat(e.getErrorCode()).isEqualTo(UploadRejectedException.ASSEMBLY_INCOMPLETE);
                });
        assertThatThrownBy(() -> client.putChunk("abc", 0, new byte[]{1}, null))
                .isInstanceOfSatisfying(UploadRejectedException.class,
                        e -> assertThat(e.isSessionCompleted()).isTrue());
    }

    @Test
    void slowResponseTimesOutAsTransient() {
        WebClientUploadServerClient impatient =
                new WebClientUploadServerClient(webClient(wireMock.baseUrl(), Duration.ofMillis(200)));
        wireMock.stubFor(get(urlEqualTo("/upload/slow/status"))
                .willReturn(okJson("{}").withFixedDelay(2000)));

        assertThatThrownBy(() -> impatient.getStatus("slow"))
                .isInstanceOf(TransientTransportException.class);
    }

    @Test
    void refusedConnectionIsTransient() {
        String baseUrl = wireMock.baseUrl();
        wireMock.stop();
        WebClientUploadServerClient offline = new WebClientUploadServerClient(webClient(baseUrl, Duration.ofSeconds(2)));

        assertThatThrownBy(() -> offline.initiate("a.bin", 1L, null))
                .isInstanceOf(TransientTransportException.class);
    }

    private static WebClient webClient(String baseUrl, Duration timeout) {
        return WebClient.builder()
                .baseUrl(baseUrl)
                .clientConnector(new ReactorClientHttpConnector(HttpClient.create().responseTimeout(timeout)))
                .build();
    }
}
