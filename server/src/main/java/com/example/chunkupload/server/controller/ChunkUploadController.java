package com.example.chunkupload.server.controller;

import com.example.chunkupload.server.dto.ChunkAckResponse;
import com.example.chunkupload.server.dto.CompleteResponse;
import com.example.chunkupload.server.dto.ErrorResponse;
import com.example.chunkupload.server.dto.InitiateRequest;
import com.example.chunkupload.server.dto.InitiateResponse;
import com.example.chunkupload.server.dto.UploadStatusResponse;
import com.example.chunkupload.server.entity.UploadSession;
import com.example.chunkupload.server.exception.AssemblyIncompleteException;
import com.example.chunkupload.server.exception.ChecksumMismatchException;
import com.example.chunkupload.server.exception.InvalidRequestException;
import com.example.chunkupload.server.exception.SessionCompletedException;
import com.example.chunkupload.server.exception.SessionNotFoundException;
import com.example.chunkupload.server.exception.UploadTooLargeException;
import com.example.chunkupload.server.service.FailureInjector;
import com.example.chunkupload.server.service.SessionSnapshot;
import com.example.chunkupload.server.service.StoredChunk;
import com.example.chunkupload.server.service.UploadSessionService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.net.URI;
import java.util.List;

/**
 * 청크 업로드 프로토콜 컨트롤러.
 *
 * <h3>프로토콜 요약:</h3>
 * <ul>
 *   <li><b>POST /upload/initiate</b> - 세션 생성, uploadId와 고정 chunkSize 반환</li>
 *   <li><b>GET /upload/{id}/status</b> - 서버가 보관 중인 청크 인덱스 목록 (재개 시 기준값)</li>
 *   <li><b>PUT /upload/{id}/chunk/{index}</b> - 청크 본문 수신 (Content-Type: application/octet-stream)</li>
 *   <li><b>POST /upload/{id}/complete</b> - 누락 검사 후 조립, 최종 파일 위치 반환</li>
 * </ul>
 *
 * <p>알 수 없는 uploadId는 모든 엔드포인트에서 404이고,
 * 청크가 하나도 없는 세션의 status는 200 + 빈 목록입니다. 두 경우를 섞어 쓰지 않습니다.</p>
 */
@Slf4j
@RestController
@RequestMapping("/upload")
@RequiredArgsConstructor
public class ChunkUploadController {

    /** 선택 헤더: 청크 본문의 SHA-256 */
    public static final String CHUNK_SHA256_HEADER = "X-Chunk-Sha256";

    private final UploadSessionService uploadSessionService;
    private final FailureInjector failureInjector;

    // ==================== POST /upload/initiate ====================

    @PostMapping("/initiate")
    public ResponseEntity<?> initiate(@Valid @RequestBody InitiateRequest request) {
        log.info("=== [INITIATE] 세션 생성 요청 filename={}, fileSize={} ===",
                request.getFilename(), request.getFileSize());

        try {
            UploadSession session = uploadSessionService.initiate(
                    request.getFilename(), request.getFileSize(), request.getChecksum());

            return ResponseEntity.created(URI.create("/upload/" + session.getUploadId()))
                    .body(InitiateResponse.builder()
                            .uploadId(session.getUploadId())
                            .chunkSize(session.getChunkSize())
                            .build());

        } catch (InvalidRequestException e) {
            log.warn("=== [INITIATE] 잘못된 요청: {} ===", e.getMessage());
            return error(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", e.getMessage());

        } catch (UploadTooLargeException e) {
            log.warn("=== [INITIATE] 파일 크기 초과: {} ===", e.getMessage());
            return error(HttpStatus.PAYLOAD_TOO_LARGE, "UPLOAD_TOO_LARGE", e.getMessage());

        } catch (IOException e) {
            log.error("=== [INITIATE] 세션 생성 실패: {} ===", e.getMessage(), e);
            return error(HttpStatus.INTERNAL_SERVER_ERROR, "STORAGE_ERROR", "업로드 세션 생성 실패: " + e.getMessage());
        }
    }

    // ==================== GET /upload/{uploadId}/status ====================

    @GetMapping("/{uploadId}/status")
    public ResponseEntity<?> status(@PathVariable String uploadId) {
        log.debug("=== [STATUS] 수신 청크 조회 uploadId={} ===", uploadId);

        try {
            SessionSnapshot snapshot = uploadSessionService.snapshot(uploadId);
            UploadSession session = snapshot.getSession();
            List<Integer> accepted = snapshot.getAcceptedChunks();

            log.info("=== [STATUS] uploadId={}, status={}, uploadedChunks={} ===",
                    uploadId, session.getStatus(), accepted.size());

            return ResponseEntity.ok(UploadStatusResponse.builder()
                    .uploadId(uploadId)
                    .status(session.getStatus().name())
                    .chunkSize(session.getChunkSize())
                    .uploadedChunks(accepted)
                    .build());

        } catch (SessionNotFoundException e) {
            log.warn("=== [STATUS] 세션 없음 uploadId={} ===", uploadId);
            return error(HttpStatus.NOT_FOUND, "NOT_FOUND", e.getMessage());

        } catch (IOException e) {
            log.error("=== [STATUS] 청크 목록 조회 실패 uploadId={}: {} ===", uploadId, e.getMessage(), e);
            return error(HttpStatus.INTERNAL_SERVER_ERROR, "STORAGE_ERROR", e.getMessage());
        }
    }

    // ==================== PUT /upload/{uploadId}/chunk/{index} ====================

    @PutMapping("/{uploadId}/chunk/{index}")
    public ResponseEntity<?> putChunk(
            @PathVariable String uploadId,
            @PathVariable int index,
            @RequestHeader(value = CHUNK_SHA256_HEADER, required = false) String chunkSha256,
            HttpServletRequest request) {

        log.debug("=== [CHUNK] 청크 수신 요청 uploadId={}, index={}, Content-Length={} ===",
                uploadId, index, request.getContentLengthLong());

        if (!isOctetStream(request.getContentType())) {
            log.warn("=== [CHUNK] 잘못된 Content-Type: {} ===", request.getContentType());
            return error(HttpStatus.UNSUPPORTED_MEDIA_TYPE, "UNSUPPORTED_MEDIA_TYPE",
                    "Content-Type은 application/octet-stream이어야 합니다.");
        }

        if (failureInjector.shouldFailChunk()) {
            log.warn("=== [CHUNK] 장애 시뮬레이션! uploadId={}, index={} 에 대해 503 응답 반환 ===", uploadId, index);
            return error(HttpStatus.SERVICE_UNAVAILABLE, "INJECTED_FAILURE", "시뮬레이션: 서버 장애 발생!");
        }

        try {
            StoredChunk stored = uploadSessionService.putChunk(uploadId, index, request.getInputStream(), chunkSha256);

            return ResponseEntity.ok(ChunkAckResponse.builder()
                    .uploadId(uploadId)
                    .index(stored.getIndex())
                    .size(stored.getSize())
                    .build());

        } catch (SessionNotFoundException e) {
            log.warn("=== [CHUNK] 세션 없음 uploadId={} ===", uploadId);
            return error(HttpStatus.NOT_FOUND, "NOT_FOUND", e.getMessage());

        } catch (SessionCompletedException e) {
            log.warn("=== [CHUNK] 완료된 세션에 청크 전송 uploadId={}, index={} ===", uploadId, index);
            return error(HttpStatus.CONFLICT, "SESSION_COMPLETED", e.getMessage());

        } catch (InvalidRequestException e) {
            log.warn("=== [CHUNK] 잘못된 청크 uploadId={}: {} ===", uploadId, e.getMessage());
            return error(HttpStatus.BAD_REQUEST, "INVALID_CHUNK", e.getMessage());

        } catch (ChecksumMismatchException e) {
            return error(HttpStatus.UNPROCESSABLE_ENTITY, "CHECKSUM_MISMATCH", e.getMessage());

        } catch (IOException e) {
            log.error("=== [CHUNK] 청크 저장 실패 uploadId={}, index={}: {} ===", uploadId, index, e.getMessage(), e);
            return error(HttpStatus.INTERNAL_SERVER_ERROR, "STORAGE_ERROR", "청크 저장 중 오류 발생: " + e.getMessage());
        }
    }

    // ==================== POST /upload/{uploadId}/complete ====================

    @PostMapping("/{uploadId}/complete")
    public ResponseEntity<?> complete(@PathVariable String uploadId) {
        log.info("=== [COMPLETE] 완료 요청 uploadId={} ===", uploadId);

        try {
            UploadSession session = uploadSessionService.complete(uploadId);

            return ResponseEntity.ok(CompleteResponse.builder()
                    .uploadId(uploadId)
                    .status(session.getStatus().name())
                    .finalPath(session.getFinalPath())
                    .size(session.getFinalSize())
                    .checksum(session.getFinalChecksum())
                    .build());

        } catch (SessionNotFoundException e) {
            log.warn("=== [COMPLETE] 세션 없음 uploadId={} ===", uploadId);
            return error(HttpStatus.NOT_FOUND, "NOT_FOUND", e.getMessage());

        } catch (AssemblyIncompleteException e) {
            log.warn("=== [COMPLETE] 조립 불가 uploadId={}: {} ===", uploadId, e.getMessage());
            return error(HttpStatus.CONFLICT, "ASSEMBLY_INCOMPLETE", e.getMessage());

        } catch (ChecksumMismatchException e) {
            return error(HttpStatus.UNPROCESSABLE_ENTITY, "CHECKSUM_MISMATCH", e.getMessage());

        } catch (IOException e) {
            log.error("=== [COMPLETE] 조립 실패 uploadId={}: {} ===", uploadId, e.getMessage(), e);
            return error(HttpStatus.INTERNAL_SERVER_ERROR, "STORAGE_ERROR", "조립 중 오류 발생: " + e.getMessage());
        }
    }

    private static boolean isOctetStream(String contentType) {
        if (contentType == null) {
            return false;
        }
        try {
            return MediaType.APPLICATION_OCTET_STREAM.isCompatibleWith(MediaType.parseMediaType(contentType));
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private static ResponseEntity<ErrorResponse> error(HttpStatus status, String code, String message) {
        return ResponseEntity.status(status).body(new ErrorResponse(code, message));
    }
}
