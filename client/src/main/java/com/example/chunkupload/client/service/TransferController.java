package com.example.chunkupload.client.service;

import com.example.chunkupload.client.dto.CompleteResponse;
import com.example.chunkupload.client.dto.InitiateResponse;
import com.example.chunkupload.client.dto.UploadStatusResponse;
import com.example.chunkupload.client.exception.ChunkUploadFailedException;
import com.example.chunkupload.client.exception.SessionNotFoundException;
import com.example.chunkupload.client.exception.TransientTransportException;
import com.example.chunkupload.client.exception.UploadRejectedException;
import com.example.chunkupload.client.progress.ProgressRecord;
import com.example.chunkupload.client.progress.ProgressStore;
import com.example.chunkupload.client.retry.RetryPolicy;
import com.example.chunkupload.client.transport.UploadServerClient;
import com.example.chunkupload.client.util.ChecksumCalculator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * 파일 1개의 전송 전체를 진행합니다.
 *
 * <h3>전송 흐름:</h3>
 * <ol>
 *   <li>원본 파일 SHA-256 계산</li>
 *   <li>진행 상태 로드 → 체크섬/크기가 다르면 버리고 새 세션(FRESH), 같으면 이어받기(RESUMED)</li>
 *   <li>FRESH: 세션 생성 후 즉시 진행 상태 저장</li>
 *   <li>RESUMED: 서버에 수신 청크 목록 조회. 로컬 기록은 믿지 않음.
 *       404면 진행 상태를 버리고 FRESH로, COMPLETED면 바로 완료 요청으로</li>
 *   <li>[0, totalChunks) 중 서버에 없는 청크만 순서대로 전송, 청크마다 진행 상태 저장</li>
 *   <li>모두 전송되면 완료 요청. 성공 시에만 진행 상태 삭제</li>
 * </ol>
 *
 * <p>어느 단계에서 멈춰도 같은 명령을 다시 실행하면 이어받습니다.
 * 메모리에는 한 번에 청크 하나만 올립니다.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TransferController {

    private final UploadServerClient serverClient;
    private final ChunkUploader chunkUploader;
    private final RetryPolicy retryPolicy;
    private final ProgressStore progressStore;

    /**
     * @param source    업로드할 파일
     * @param maxChunks 이번 실행에서 새로 보낼 최대 청크 수 (null이면 제한 없음)
     * @return 실행 결과
     * @throws IOException 원본 파일 읽기나 진행 상태 파일 쓰기 실패
     */
    public TransferResult transfer(Path source, Integer maxChunks) throws IOException {
        TransferState state = TransferState.START;
        long fileSize = Files.size(source);
        String fileName = source.getFileName().toString();
        log.info("=== [TRANSFER] {} file={}, size={} bytes, maxChunks={} ===", state, source, fileSize, maxChunks);

        String fileChecksum = ChecksumCalculator.calculateSha256(source);

        ProgressRecord record = loadValidProgress(source, fileSize, fileChecksum);
        SortedSet<Integer> accepted = new TreeSet<>();
        boolean serverCompleted = false;

        // === 이어받기: 서버의 수신 목록이 기준 ===
        if (record != null) {
            state = TransferState.RESUMED;
            String sessionId = record.getSessionId();
            log.info("=== [TRANSFER] {} sessionId={}, 로컬 기록 청크={} ===",
                    state, sessionId, record.getUploadedChunks());
            try {
                UploadStatusResponse status = retryPolicy.execute("상태 조회",
                        () -> serverClient.getStatus(sessionId));
                if (status.getChunkSize() != record.getChunkSize()) {
                    log.warn("=== [TRANSFER] 서버 chunkSize가 기록과 다름 (server={}, local={}), 새 세션으로 시작 ===",
                            status.getChunkSize(), record.getChunkSize());
                    progressStore.clear(source);
                    record = null;
                } else if (status.isCompleted()) {
                    log.info("=== [TRANSFER] 서버에서 이미 완료된 세션 sessionId={} ===", sessionId);
                    serverCompleted = true;
                } else {
                    accepted.addAll(status.getUploadedChunks());
                    log.info("=== [TRANSFER] 서버 수신 청크={} ===", accepted);
                }
            } catch (SessionNotFoundException e) {
                log.warn("=== [TRANSFER] 서버에 세션이 없어 진행 상태를 버리고 새로 시작합니다 sessionId={} ===", sessionId);
                progressStore.clear(source);
                record = null;
            } catch (TransientTransportException | UploadRejectedException e) {
                return aborted(state, sessionId, -1, 0, "상태 조회 실패: " + e.getMessage());
            }
        }

        // === 새 세션 ===
        if (record == null) {
            state = TransferState.FRESH;
            InitiateResponse created;
            try {
                created = retryPolicy.execute("세션 생성",
                        () -> serverClient.initiate(fileName, fileSize, fileChecksum));
            } catch (TransientTransportException | UploadRejectedException e) {
                return aborted(state, null, -1, 0, "세션 생성 실패: " + e.getMessage());
            }

            record = ProgressRecord.builder()
                    .sessionId(created.getUploadId())
                    .chunkSize(created.getChunkSize())
                    .fileSize(fileSize)
                    .fileName(fileName)
                    .fileChecksum(fileChecksum)
                    .build();
            progressStore.persist(source, record);
            accepted.clear();
            log.info("=== [TRANSFER] {} sessionId={}, chunkSize={} ===", state, created.getUploadId(), created.getChunkSize());
        }

        String sessionId = record.getSessionId();
        int chunkSize = record.getChunkSize();
        long totalChunks = totalChunks(fileSize, chunkSize);
        int sent = 0;

        // === 누락 청크 전송 ===
        if (!serverCompleted) {
            state = TransferState.TRANSFERRING;
            record.setUploadedChunks(new TreeSet<>(accepted));
            progressStore.persist(source, record);
            log.info("=== [TRANSFER] {} sessionId={}, totalChunks={}, 남은 청크={} ===",
                    state, sessionId, totalChunks, totalChunks - accepted.size());

            try (FileChannel channel = FileChannel.open(source, StandardOpenOption.READ)) {
                for (int index = 0; index < totalChunks; index++) {
                    if (accepted.contains(index)) {
                        continue;
                    }
                    if (maxChunks != null && sent >= maxChunks) {
                        log.info("=== [TRANSFER] 최대 전송 청크 수 도달 ({}), 진행 상태 유지 후 중단 ===", maxChunks);
                        return incomplete(state, sessionId, totalChunks, sent,
                                "최대 전송 청크 수(" + maxChunks + ")에 도달했습니다.");
                    }

                    byte[] data = readChunk(channel, index, chunkSize, fileSize);
                    try {
                        chunkUploader.upload(sessionId, index, data);
                    } catch (ChunkUploadFailedException e) {
                        return aborted(TransferState.ABORTED, sessionId, totalChunks, sent, e.getMessage());
                    } catch (SessionNotFoundException e) {
                        // 다음 실행은 새 세션으로 시작
                        progressStore.clear(source);
                        return aborted(TransferState.ABORTED, sessionId, totalChunks, sent, e.getMessage());
                    } catch (UploadRejectedException e) {
                        if (e.isSessionCompleted()) {
                            log.info("=== [TRANSFER] 서버에서 이미 완료된 세션, 완료 요청으로 이동 ===");
                            break;
                        }
                        return aborted(TransferState.ABORTED, sessionId, totalChunks, sent, e.getMessage());
                    }

                    accepted.add(index);
                    record.getUploadedChunks().add(index);
                    progressStore.persist(source, record);
                    sent++;
                }
            }
        }

        // === 완료 요청 ===
        state = TransferState.COMPLETING;
        log.info("=== [TRANSFER] {} sessionId={} ===", state, sessionId);
        CompleteResponse completed;
        try {
            completed = retryPolicy.execute("완료 요청", () -> serverClient.complete(sessionId));
        } catch (SessionNotFoundException e) {
            progressStore.clear(source);
            return incomplete(TransferState.TRANSFERRING, sessionId, totalChunks, sent, e.getMessage());
        } catch (TransientTransportException | UploadRejectedException e) {
            log.warn("=== [TRANSFER] 완료 요청 실패, 진행 상태 유지: {} ===", e.getMessage());
            return incomplete(TransferState.TRANSFERRING, sessionId, totalChunks, sent, e.getMessage());
        }

        progressStore.clear(source);
        state = TransferState.DONE;
        log.info("=== [TRANSFER] {} sessionId={}, finalPath={}, size={}, sha256={} ===",
                state, sessionId, completed.getFinalPath(), completed.getSize(), completed.getChecksum());

        return TransferResult.builder()
                .outcome(TransferOutcome.COMPLETED)
                .finalState(state)
                .sessionId(sessionId)
                .totalChunks(totalChunks)
                .chunksSent(sent)
                .finalPath(completed.getFinalPath())
                .checksum(completed.getChecksum())
                .message("업로드가 완료되었습니다.")
                .build();
    }

    /**
     * 0바이트 파일도 빈 청크 1개로 전송합니다.
     */
    static long totalChunks(long fileSize, int chunkSize) {
        return Math.max(1, (fileSize + chunkSize - 1) / chunkSize);
    }

    private ProgressRecord loadValidProgress(Path source, long fileSize, String fileChecksum) throws IOException {
        Optional<ProgressRecord> loaded = progressStore.load(source);
        if (loaded.isEmpty()) {
            return null;
        }
        Optional<ProgressRecord> valid = progressStore.validate(loaded.get(), fileSize, fileChecksum);
        if (valid.isEmpty()) {
            progressStore.clear(source);
        }
        return valid.orElse(null);
    }

    /**
     * [index * chunkSize, min(fileSize, (index + 1) * chunkSize)) 구간을 읽습니다.
     */
    private static byte[] readChunk(FileChannel channel, int index, int chunkSize, long fileSize) throws IOException {
        long offset = (long) index * chunkSize;
        int length = (int) Math.max(0, Math.min(chunkSize, fileSize - offset));
        ByteBuffer buffer = ByteBuffer.allocate(length);
        while (buffer.hasRemaining()) {
            int read = channel.read(buffer, offset + buffer.position());
            if (read < 0) {
                throw new EOFException(String.format(
                        "전송 도중 파일이 짧아졌습니다: index=%d, expected=%d, read=%d", index, length, buffer.position()));
            }
        }
        return buffer.array();
    }

    private TransferResult incomplete(TransferState state, String sessionId, long totalChunks, int sent,
                                      String message) {
        return TransferResult.builder()
                .outcome(TransferOutcome.INCOMPLETE)
                .finalState(state)
                .sessionId(sessionId)
                .totalChunks(totalChunks)
                .chunksSent(sent)
                .message(message)
                .build();
    }

    private TransferResult aborted(TransferState state, String sessionId, long totalChunks, int sent,
                                   String message) {
        log.error("=== [TRANSFER] 중단 ({}) sessionId={}, 이번 실행 전송={}: {} ===", state, sessionId, sent, message);
        return incomplete(TransferState.ABORTED, sessionId, totalChunks, sent, message);
    }
}
