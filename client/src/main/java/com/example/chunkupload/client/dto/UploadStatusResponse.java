package com.example.chunkupload.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 서버가 보관 중인 청크 목록 (GET /upload/{id}/status).
 * 이어받기 시 로컬 진행 상태보다 이 값을 우선합니다.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UploadStatusResponse {

    public static final String STATUS_COMPLETED = "COMPLETED";

    private String uploadId;

    private String status;

    private int chunkSize;

    @Builder.Default
    private List<Integer> uploadedChunks = new ArrayList<>();

    @JsonIgnore
    public boolean isCompleted() {
        return STATUS_COMPLETED.equals(status);
    }
}
