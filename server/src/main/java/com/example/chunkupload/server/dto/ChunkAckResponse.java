package com.example.chunkupload.server.dto;

import lombok.Builder;
import lombok.Data;

/**
 * 청크 수신 확인 응답.
 */
@Data
@Builder
public class ChunkAckResponse {

    private String uploadId;

    private int index;

    private long size;
}
