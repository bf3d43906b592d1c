package com.example.chunkupload.client.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChunkAckResponse {

    private String uploadId;

    private int index;

    private long size;
}
