package com.example.chunkupload.server.dto;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * 수신 완료 청크 조회 응답.
 *
 * <pre>
 * {
 *   "uploadId": "a1b2c3d4-...",
 *   "status": "OPEN",
 *   "chunkSize": 10485760,
 *   "uploadedChunks": [0, 1]
 * }
 * </pre>
 */
@Data
@Builder
public class UploadStatusResponse {

    private String uploadId;

    /** OPEN 또는 COMPLETED */
    private String status;

    private int chunkSize;

    /** 오름차순 인덱스 목록 */
    private List<Integer> uploadedChunks;
}
