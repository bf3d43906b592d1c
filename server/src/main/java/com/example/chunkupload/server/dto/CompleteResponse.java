package com.example.chunkupload.server.dto;

import lombok.Builder;
import lombok.Data;

/**
 * 업로드 완료(조립) 응답.
 */
@Data
@Builder
public class CompleteResponse {

    private String uploadId;

    /** 항상 "COMPLETED" */
    private String status;

    /** 조립된 최종 파일 위치 */
    private String finalPath;

    private long size;

    /** 최종 파일 SHA-256 */
    private String checksum;
}
