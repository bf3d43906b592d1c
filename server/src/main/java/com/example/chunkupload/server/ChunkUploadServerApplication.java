package com.example.chunkupload.server;

import com.example.chunkupload.server.config.ChunkServerProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * 청크 업로드 서버 애플리케이션.
 * <p>
 * 대용량 파일을 고정 크기 청크로 나누어 받는 재개 가능한(Resumable) 업로드 서버입니다.
 * 청크는 인덱스 단위로 저장되므로 순서와 관계없이, 여러 번 도착해도 안전합니다.
 * </p>
 * <ul>
 *   <li>POST /upload/initiate - 업로드 세션 생성</li>
 *   <li>GET /upload/{uploadId}/status - 수신 완료된 청크 인덱스 조회</li>
 *   <li>PUT /upload/{uploadId}/chunk/{index} - 청크 데이터 수신</li>
 *   <li>POST /upload/{uploadId}/complete - 청크 조립 및 최종 파일 생성</li>
 * </ul>
 */
@SpringBootApplication
@EnableConfigurationProperties(ChunkServerProperties.class)
public class ChunkUploadServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChunkUploadServerApplication.class, args);
    }
}
