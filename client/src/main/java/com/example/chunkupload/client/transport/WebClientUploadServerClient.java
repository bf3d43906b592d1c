package com.example.chunkupload.client.transport;

import com.example.chunkupload.client.dto.ChunkAckResponse;
import com.example.chunkupload.client.dto.CompleteResponse;
import com.example.chunkupload.client.dto.ErrorResponse;
import com.example.chunkupload.client.dto.InitiateRequest;
import com.example.chunkupload.client.dto.InitiateResponse;
import com.example.chunkupload.client.dto.UploadStatusResponse;
import com.example.chunkupload.client.exception.SessionNotFoundException;
import com.example.chunkupload.client.exception.TransientTransportException;
import com.example.chunkupload.client.exception.UploadRejectedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

/**
 * WebClient 기반 업로드 서버 호출 구현.
 *
 * <pre>
 * POST /upload/initiate                  {filename, fileSize, checksum} → {uploadId, chunkSize}
 * GET  /upload/{id}/status               → {uploadId, status, chunkSize, uploadedChunks}
 * PUT  /upload/{id}/chunk/{index}        application/octet-stream, X-Chunk-Sha256 → {uploadId, index, size}
 * POST /upload/{id}/complete             → {uploadId, status, finalPath, size, checksum}
 * </pre>
 *
 * <p>재시도는 하지 않습니다. 호출 1회 = HTTP 요청 1회이고, 재시도 여부는 RetryPolicy가 결정합니다.</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WebClientUploadServerClient implements UploadServerClient {

    public static final String CHUNK_SHA256_HEADER = "X-Chunk-Sha256";

    private final WebClient webClient;

    @Override
    public InitiateResponse initiate(String fileName, long fileSize, String checksum) {
        log.debug("=== [INITIATE] fileName={}, fileSize={}, checksum={} ===", fileName, fileSize, checksum);

        InitiateRequest request = InitiateRequest.builder()
                .filename(fileName)
                .fileSize(fileSize)
                .checksum(checksum)
                .build();

        return call("세션 생성", null, webClient.post()
                .uri("/upload/initiate")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(request)
                .retrieve()
                .onStatus(HttpStatusCode::isError, response -> toError(response, null))
                .bodyToMono(InitiateResponse.class));
    }

    @Override
    public UploadStatusResponse getStatus(String uploadId) {
        return call("상태 조회", uploadId, webClient.get()
                .uri("/upload/{uploadId}/status", uploadId)
                .retrieve()
                .onStatus(HttpStatusCode::isError, response -> toError(response, uploadId))
                .bodyToMono(UploadStatusResponse.class));
    }

    @Override
    public ChunkAckResponse putChunk(String uploadId, int index, byte[] data, String chunkSha256) {
        log.debug("=== [PUT CHUNK] uploadId={}, index={}, size={} ===", uploadId, index, data.length);

        WebClient.RequestBodySpec spec = webClient.put()
                .uri("/upload/{uploadId}/chunk/{index}", uploadId, index)
                .contentType(MediaType.APPLICATION_OCTET_STREAM);
        if (chunkSha256 != null) {
            spec = spec.header(CHUNK_SHA256_HEADER, chunkSha256);
        }

        return call("청크 전송", uploadId, spec
                .bodyValue(data)
                .retrieve()
                .onStatus(HttpStatusCode::isError, response -> toError(response, uploadId))
                .bodyToMono(ChunkAckResponse.class));
    }

    @Override
    public CompleteResponse complete(String uploadId) {
        return call("완료 요청", uploadId, webClient.post()
                .uri("/upload/{uploadId}/complete", uploadId)
                .retrieve()
                .onStatus(HttpStatusCode::isError, response -> toError(response, uploadId))
                .bodyToMono(CompleteResponse.class));
    }

    /**
     * 요청을 동기로 실행합니다. 응답을 받지 못한 경우(연결 거부, 타임아웃)는 일시적 오류로 변환합니다.
     */
    private <T> T call(String operation, String uploadId, Mono<T> request) {
        T body;
        try {
            body = request.block();
        } catch (WebClientRequestException e) {
            log.warn("=== [TRANSPORT] {} 요청 실패 uploadId={}: {} ===", operation, uploadId, e.getMessage());
            throw new TransientTransportException(operation + " 요청 실패: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            // 응답 본문을 읽는 중 끊긴 연결은 block()이 감싸서 던짐
            Throwable cause = Exceptions.unwrap(e);
            if (cause instanceof IOException || cause instanceof TimeoutException) {
                log.warn("=== [TRANSPORT] {} 응답 수신 실패 uploadId={}: {} ===", operation, uploadId, cause.toString());
                throw new TransientTransportException(operation + " 응답 수신 실패: " + cause, cause);
            }
            throw e;
        }
        if (body == null) {
            throw new TransientTransportException(operation + " 응답 본문이 비어 있습니다.", HttpStatus.OK.value());
        }
        return body;
    }

    /**
     * 오류 응답을 클라이언트 예외로 변환합니다.
     */
    private Mono<? extends Throwable> toError(ClientResponse response, String uploadId) {
        HttpStatusCode status = response.statusCode();
        return response.bodyToMono(ErrorResponse.class)
                .onErrorResume(e -> Mono.empty())
                .defaultIfEmpty(new ErrorResponse(null, null))
                .map(error -> toException(status.value(), error, uploadId));
    }

    private RuntimeException toException(int status, ErrorResponse error, String uploadId) {
        log.warn("=== [TRANSPORT] 오류 응답 status={}, error={}, message={} ===",
                status, error.getError(), error.getMessage());
        if (status == HttpStatus.NOT_FOUND.value()) {
            return new SessionNotFoundException(uploadId);
        }
        if (status >= 500) {
            return new TransientTransportException(String.format(
                    "서버 오류 [%d %s]: %s", status, error.getError(), error.getMessage()), status);
        }
        return new UploadRejectedException(status, error.getError(), error.getMessage());
    }
}
