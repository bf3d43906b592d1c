package com.example.chunkupload.client.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 세션 생성 요청 본문 (POST /upload/initiate).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InitiateRequest {

    private String filename;

    private Long fileSize;

    /** 원본 파일 전체의 SHA-256 */
    private String checksum;
}
