package com.example.chunkupload.client.progress;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * 원본 파일 하나와 서버 세션 하나를 연결하는 로컬 진행 상태.
 *
 * <pre>
 * {
 *   "sessionId": "a1b2c3d4-...",
 *   "chunkSize": 10485760,
 *   "fileSize": 26214400,
 *   "fileName": "flight-log.bin",
 *   "fileChecksum": "e3b0c442...",
 *   "uploadedChunks": [0, 1],
 *   "updatedAt": "2026-10-19T09:12:44.120Z"
 * }
 * </pre>
 *
 * <p>uploadedChunks는 참고용입니다. 이어받기 시에는 항상 서버의 status 응답을 기준으로 합니다.</p>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProgressRecord {

    private String sessionId;

    private int chunkSize;

    private long fileSize;

    private String fileName;

    /** 세션 생성 당시 원본 파일의 SHA-256 */
    private String fileChecksum;

    @Builder.Default
    private SortedSet<Integer> uploadedChunks = new TreeSet<>();

    private Instant updatedAt;

    /** 필수 항목이 모두 채워져 있는지 확인합니다. */
    @JsonIgnore
    public boolean isWellFormed() {
        return sessionId != null && !sessionId.isBlank()
                && chunkSize > 0
                && fileSize >= 0
                && fileChecksum != null && !fileChecksum.isBlank()
                && uploadedChunks != null;
    }
}
