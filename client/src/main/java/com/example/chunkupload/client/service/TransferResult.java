package com.example.chunkupload.client.service;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * 전송 1회 실행 결과.
 */
@Getter
@Builder
@ToString
public class TransferResult {

    private final TransferOutcome outcome;

    /** 실행이 끝난 시점의 상태 */
    private final TransferState finalState;

    private final String sessionId;

    private final long totalChunks;

    /** 이번 실행에서 새로 보낸 청크 수 */
    private final int chunksSent;

    /** 서버 측 최종 파일 경로 (완료 시에만) */
    private final String finalPath;

    /** 서버가 계산한 최종 파일 SHA-256 (완료 시에만) */
    private final String checksum;

    private final String message;

    public boolean isCompleted() {
        return outcome == TransferOutcome.COMPLETED;
    }
}
