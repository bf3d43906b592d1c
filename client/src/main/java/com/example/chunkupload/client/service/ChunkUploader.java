package com.example.chunkupload.client.service;

import com.example.chunkupload.client.dto.ChunkAckResponse;
import com.example.chunkupload.client.exception.ChunkUploadFailedException;
import com.example.chunkupload.client.exception.TransientTransportException;
import com.example.chunkupload.client.retry.RetryPolicy;
import com.example.chunkupload.client.transport.UploadServerClient;
import com.example.chunkupload.client.util.ChecksumCalculator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 청크 하나를 전송합니다. 세션 상태나 진행 상태 파일은 다루지 않습니다.
 *
 * <p>일시적 오류는 {@link RetryPolicy}의 백오프 스케줄대로 재시도하고,
 * 모두 실패하면 {@link ChunkUploadFailedException}을 던집니다. 호출자는 이 청크를 건너뛰면 안 됩니다.</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ChunkUploader {

    private final UploadServerClient serverClient;
    private final RetryPolicy retryPolicy;

    /**
     * @param sessionId 서버 세션 ID
     * @param index     청크 인덱스
     * @param data      청크 바이트 (마지막 청크만 chunkSize보다 짧을 수 있음)
     * @return 서버 수신 확인
     * @throws ChunkUploadFailedException 재시도 횟수를 모두 소진한 경우
     */
    public ChunkAckResponse upload(String sessionId, int index, byte[] data) {
        String chunkSha256 = ChecksumCalculator.sha256(data);
        log.debug("=== [CHUNK] 전송 시작 sessionId={}, index={}, size={} ===", sessionId, index, data.length);

        try {
            ChunkAckResponse ack = retryPolicy.execute("청크 " + index + " 전송",
                    () -> serverClient.putChunk(sessionId, index, data, chunkSha256));
            log.info("=== [CHUNK] 전송 완료 sessionId={}, index={}, size={} ===", sessionId, index, ack.getSize());
            return ack;
        } catch (TransientTransportException e) {
            throw new ChunkUploadFailedException(index, retryPolicy.maxAttempts(), e);
        }
    }
}
