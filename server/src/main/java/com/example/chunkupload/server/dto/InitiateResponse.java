package com.example.chunkupload.server.dto;

import lombok.Builder;
import lombok.Data;

/**
 * 업로드 세션 생성 응답. 클라이언트는 이 chunkSize로 파일을 나눠야 합니다.
 */
@Data
@Builder
public class InitiateResponse {

    private String uploadId;

    private int chunkSize;
}
