package com.example.chunkupload.server.config;

import jakarta.annotation.PostConstruct;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * 청크 업로드 서버 핵심 설정.
 * <p>
 * - storagePath: 세션별 청크와 최종 파일이 저장될 로컬 디스크 경로
 * - chunkSize: 세션 생성 시 클라이언트에 내려주는 고정 청크 크기 (기본 10MB)
 * - maxUploadSize: 세션 생성 시 선언 가능한 최대 파일 크기 (기본 10GB)
 * </p>
 */
@Slf4j
@Getter
@Setter
@ConfigurationProperties(prefix = "chunk")
public class ChunkServerProperties {

    /** 업로드 저장 루트 디렉토리 */
    private String storagePath = "./uploads";

    /** 청크 크기 (바이트). 세션 생성 이후에는 변경되지 않습니다. */
    private int chunkSize = 10 * 1024 * 1024;

    /** 최대 업로드 크기 (바이트). 기본값: 10GB */
    private long maxUploadSize = 10L * 1024 * 1024 * 1024;

    /**
     * 서버 시작 시 세션/완료 디렉토리가 존재하지 않으면 자동 생성합니다.
     */
    @PostConstruct
    public void init() throws IOException {
        if (chunkSize <= 0) {
            throw new IllegalStateException("chunk.chunk-size는 0보다 커야 합니다: " + chunkSize);
        }
        Files.createDirectories(getSessionsPath());
        Files.createDirectories(getCompletedPath());
        log.info("=== [CHUNK CONFIG] 저장 디렉토리 확인 완료: {} ===", Paths.get(storagePath).toAbsolutePath());
        log.info("=== [CHUNK CONFIG] 청크 크기: {} bytes, 최대 업로드 크기: {} MB ===",
                chunkSize, maxUploadSize / (1024 * 1024));
    }

    /** 진행 중인 세션의 청크 디렉토리 루트 */
    public Path getSessionsPath() {
        return Paths.get(storagePath).resolve("sessions");
    }

    /** 조립이 끝난 최종 파일 디렉토리 */
    public Path getCompletedPath() {
        return Paths.get(storagePath).resolve("completed");
    }
}
