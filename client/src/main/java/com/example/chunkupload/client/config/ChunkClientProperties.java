package com.example.chunkupload.client.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * 청크 업로드 클라이언트 기본 설정 프로퍼티
 *
 * <p>application.yml의 "chunk" 접두사 아래 설정을 바인딩합니다.</p>
 *
 * <pre>
 * chunk:
 *   server-url: http://localhost:9000     # 업로드 서버 주소 (--server=... 로 덮어쓰기)
 *   progress-suffix: .uploadmeta.json     # 원본 파일 옆에 생기는 진행 상태 파일 접미사
 *   request-timeout: 60s                  # 요청 1회당 응답 대기 시간
 * </pre>
 *
 * <p>청크 크기는 클라이언트가 정하지 않습니다. 세션 생성 시 서버가 내려준 값을 사용합니다.</p>
 */
@Data
@Validated
@ConfigurationProperties(prefix = "chunk")
public class ChunkClientProperties {

    /** 업로드 서버 Base URL */
    @NotBlank
    private String serverUrl = "http://localhost:9000";

    /** 진행 상태 파일 접미사 (원본 경로 + 접미사) */
    @NotBlank
    private String progressSuffix = ".uploadmeta.json";

    /**
     * 요청 1회 응답 타임아웃.
     * 멈춘 요청도 이 시간이 지나면 실패로 끝나고 재시도 백오프로 넘어갑니다.
     */
    @NotNull
    private Duration requestTimeout = Duration.ofSeconds(60);
}
