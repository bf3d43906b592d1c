package com.example.chunkupload.client.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 세션 생성 응답. chunkSize는 세션이 끝날 때까지 바뀌지 않습니다.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InitiateResponse {

    private String uploadId;

    private int chunkSize;
}
