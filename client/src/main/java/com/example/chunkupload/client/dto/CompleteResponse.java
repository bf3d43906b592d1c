package com.example.chunkupload.client.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 조립 완료 응답 (POST /upload/{id}/complete).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompleteResponse {

    private String uploadId;

    private String status;

    /** 서버 측 최종 파일 경로 */
    private String finalPath;

    private long size;

    /** 서버가 계산한 최종 파일 SHA-256 */
    private String checksum;
}
