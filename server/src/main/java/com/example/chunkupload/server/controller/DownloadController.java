package com.example.chunkupload.server.controller;

import com.example.chunkupload.server.entity.UploadSession;
import com.example.chunkupload.server.exception.SessionNotFoundException;
import com.example.chunkupload.server.service.UploadSessionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * 조립 완료 파일 다운로드 컨트롤러.
 * <p>
 * 상태가 COMPLETED인 세션의 최종 파일만 다운로드를 허용합니다.
 * </p>
 */
@Slf4j
@RestController
@RequestMapping("/api/files")
@RequiredArgsConstructor
public class DownloadController {

    private final UploadSessionService uploadSessionService;

    @GetMapping("/{uploadId}/download")
    public ResponseEntity<Resource> downloadFile(@PathVariable String uploadId) {
        log.info("=== [DOWNLOAD] 파일 다운로드 요청 uploadId={} ===", uploadId);

        try {
            UploadSession session = uploadSessionService.getSession(uploadId);

            if (!session.isCompleted()) {
                log.warn("=== [DOWNLOAD] 미완료 세션 다운로드 시도 uploadId={}, status={} ===",
                        uploadId, session.getStatus());
                return ResponseEntity.status(HttpStatus.CONFLICT).build();
            }

            Path filePath = Paths.get(session.getFinalPath());
            if (!Files.exists(filePath)) {
                log.error("=== [DOWNLOAD] 디스크에 파일 없음 uploadId={}, path={} ===", uploadId, filePath);
                return ResponseEntity.notFound().build();
            }

            // 파일명 URL 인코딩 (한글 파일명 지원)
            String encodedFileName = URLEncoder.encode(session.getFileName(), StandardCharsets.UTF_8)
                    .replace("+", "%20");

            return ResponseEntity.ok()
                    .contentType(MediaType.APPLICATION_OCTET_STREAM)
                    .contentLength(session.getFinalSize())
                    .header(HttpHeaders.CONTENT_DISPOSITION,
                            "attachment; filename=\"" + encodedFileName + "\"; " +
                                    "filename*=UTF-8''" + encodedFileName)
                    .body(new FileSystemResource(filePath));

        } catch (SessionNotFoundException e) {
            log.warn("=== [DOWNLOAD] 세션 없음 uploadId={} ===", uploadId);
            return ResponseEntity.notFound().build();
        }
    }
}
