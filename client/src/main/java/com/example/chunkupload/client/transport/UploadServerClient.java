package com.example.chunkupload.client.transport;

import com.example.chunkupload.client.dto.ChunkAckResponse;
import com.example.chunkupload.client.dto.CompleteResponse;
import com.example.chunkupload.client.dto.InitiateResponse;
import com.example.chunkupload.client.dto.UploadStatusResponse;

/**
 * 업로드 서버 호출 인터페이스.
 * <p>
 * 구현체는 응답을 다음 예외로 변환합니다.
 * </p>
 * <ul>
 *   <li>404 → {@link com.example.chunkupload.client.exception.SessionNotFoundException}</li>
 *   <li>5xx, 연결 실패, 타임아웃 → {@link com.example.chunkupload.client.exception.TransientTransportException}</li>
 *   <li>그 밖의 4xx → {@link com.example.chunkupload.client.exception.UploadRejectedException}</li>
 * </ul>
 */
public interface UploadServerClient {

    InitiateResponse initiate(String fileName, long fileSize, String checksum);

    UploadStatusResponse getStatus(String uploadId);

    /**
     * @param chunkSha256 청크 본문의 SHA-256 (X-Chunk-Sha256 헤더, null이면 생략)
     */
    ChunkAckResponse putChunk(String uploadId, int index, byte[] data, String chunkSha256);

    CompleteResponse complete(String uploadId);
}
