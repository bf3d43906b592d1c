package com.example.chunkupload.server.service;

import com.example.chunkupload.server.config.ChunkServerProperties;
import com.example.chunkupload.server.entity.SessionStatus;
import com.example.chunkupload.server.entity.UploadSession;
import com.example.chunkupload.server.exception.ChecksumMismatchException;
import com.example.chunkupload.server.exception.InvalidRequestException;
import com.example.chunkupload.server.exception.SessionCompletedException;
import com.example.chunkupload.server.exception.SessionNotFoundException;
import com.example.chunkupload.server.exception.UploadTooLargeException;
import com.example.chunkupload.server.repository.UploadSessionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 업로드 세션 핵심 비즈니스 로직 서비스.
 * <p>
 * - 세션 생성 (POST /upload/initiate)
 * - 청크 수신 (PUT /upload/{id}/chunk/{index})
 * - 수신 인덱스 조회 (GET /upload/{id}/status)
 * - 조립 및 완료 처리 (POST /upload/{id}/complete)
 * </p>
 * <p>
 * 세션마다 ReentrantReadWriteLock을 하나씩 둡니다.
 * 청크 쓰기는 읽기 잠금을 공유하므로 서로 막지 않고,
 * 완료 처리만 쓰기 잠금으로 직렬화되어 조립 중 청크 읽기와 삭제가 섞이지 않습니다.
 * </p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UploadSessionService {

    private final ChunkServerProperties properties;
    private final UploadSessionRepository sessionRepository;
    private final ChunkStore chunkStore;
    private final ChunkAssembler chunkAssembler;

    private final ConcurrentMap<String, ReentrantReadWriteLock> sessionLocks = new ConcurrentHashMap<>();

    /**
     * 새 업로드 세션을 생성합니다.
     *
     * @param fileName 원본 파일명
     * @param fileSize 전체 파일 크기 (모르면 null)
     * @param checksum 전체 파일 SHA-256 (없으면 null)
     * @return 저장된 세션
     */
    public UploadSession initiate(String fileName, Long fileSize, String checksum) throws IOException {
        validateFileName(fileName);
        if (fileSize != null && fileSize > properties.getMaxUploadSize()) {
            throw new UploadTooLargeException(fileSize, properties.getMaxUploadSize());
        }

        String uploadId = UUID.randomUUID().toString();
        chunkStore.createArea(uploadId);

        UploadSession session = UploadSession.builder()
                .uploadId(uploadId)
                .fileName(fileName)
                .chunkSize(properties.getChunkSize())
                .fileSize(fileSize)
                .status(SessionStatus.OPEN)
                .checksum(checksum == null || checksum.isBlank() ? null : checksum.toLowerCase())
                .checksumVerified(false)
                .build();

        sessionRepository.save(session);
        log.info("=== [SESSION] 세션 생성 uploadId={}, fileName={}, fileSize={}, chunkSize={} ===",
                uploadId, fileName, fileSize, session.getChunkSize());
        return session;
    }

    /**
     * 세션을 조회합니다.
     *
     * @throws SessionNotFoundException 존재하지 않는 uploadId
     */
    public UploadSession getSession(String uploadId) {
        return sessionRepository.findById(uploadId)
                .orElseThrow(() -> new SessionNotFoundException(uploadId));
    }

    /**
     * 현재 저장이 끝난 청크 인덱스 목록(오름차순)을 반환합니다.
     * 알 수 없는 세션은 SessionNotFoundException, 청크가 없는 세션은 빈 목록입니다.
     * 완료된 세션은 청크 저장소가 삭제되었으므로 항상 빈 목록입니다.
     */
    public List<Integer> listAccepted(String uploadId) throws IOException {
        return snapshot(uploadId).getAcceptedChunks();
    }

    /**
     * 세션 상태와 수신 청크 목록을 읽기 잠금 안에서 한 번에 읽습니다.
     * 조회 도중 완료 처리가 끝나 OPEN 상태에 빈 목록이 붙는 일이 없습니다.
     */
    public SessionSnapshot snapshot(String uploadId) throws IOException {
        ReentrantReadWriteLock sessionLock = lockFor(uploadId);
        Lock lock = sessionLock.readLock();
        lock.lock();
        try {
            UploadSession session = getSession(uploadId);
            if (session.isCompleted()) {
                releaseLock(uploadId, sessionLock);
                return new SessionSnapshot(session, Collections.emptyList());
            }
            return new SessionSnapshot(session, chunkStore.listChunks(uploadId));
        } finally {
            lock.unlock();
        }
    }

    /**
     * 청크를 저장합니다. 같은 인덱스를 다시 보내면 덮어씁니다.
     *
     * @param uploadId       세션 ID
     * @param index          청크 인덱스
     * @param data           청크 데이터 스트림
     * @param expectedSha256 X-Chunk-Sha256 헤더 값 (선택)
     */
    public StoredChunk putChunk(String uploadId, int index, InputStream data, String expectedSha256)
            throws IOException {
        ReentrantReadWriteLock sessionLock = lockFor(uploadId);
        Lock lock = sessionLock.readLock();
        lock.lock();
        try {
            UploadSession session = getSession(uploadId);
            if (session.isCompleted()) {
                releaseLock(uploadId, sessionLock);
                throw new SessionCompletedException(uploadId);
            }
            if (index < 0) {
                throw new InvalidRequestException("청크 인덱스는 0 이상이어야 합니다: index=" + index);
            }

            long maxBytes = session.getChunkSize();
            boolean exact = false;
            if (session.getFileSize() != null) {
                long totalChunks = session.getTotalChunks();
                if (index >= totalChunks) {
                    throw new InvalidRequestException(String.format(
                            "청크 인덱스 범위 초과: index=%d, totalChunks=%d", index, totalChunks));
                }
                maxBytes = Math.min(session.getChunkSize(), session.getFileSize() - (long) index * session.getChunkSize());
                exact = true;
            }

            StoredChunk stored = chunkStore.writeChunk(uploadId, index, data, maxBytes, exact, expectedSha256);
            log.info("=== [SESSION] 청크 수신 uploadId={}, index={}, size={} ===", uploadId, index, stored.getSize());
            return stored;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 청크를 조립하고 세션을 완료 처리합니다.
     * <p>
     * 이미 완료된 세션이면 기존 결과를 그대로 반환합니다.
     * 조립이 실패하면 세션은 OPEN으로 남고 청크도 그대로 유지됩니다.
     * </p>
     */
    public UploadSession complete(String uploadId) throws IOException {
        ReentrantReadWriteLock sessionLock = lockFor(uploadId);
        Lock lock = sessionLock.writeLock();
        lock.lock();
        try {
            UploadSession session = getSession(uploadId);
            if (session.isCompleted()) {
                releaseLock(uploadId, sessionLock);
                log.info("=== [SESSION] 이미 완료된 세션, 기존 결과 반환 uploadId={} ===", uploadId);
                return session;
            }

            AssemblyResult result;
            try {
                result = chunkAssembler.assemble(session);
            } catch (ChecksumMismatchException e) {
                session.setChecksumVerified(false);
                sessionRepository.save(session);
                throw e;
            }

            session.setStatus(SessionStatus.COMPLETED);
            session.setFinalPath(result.getFinalPath().toAbsolutePath().toString());
            session.setFinalSize(result.getSize());
            session.setFinalChecksum(result.getSha256());
            session.setChecksumVerified(true);
            sessionRepository.save(session);

            try {
                chunkStore.deleteArea(uploadId);
            } catch (IOException e) {
                // 최종 파일과 완료 상태는 이미 확정되었으므로 남은 청크는 경고만 남김
                log.warn("=== [SESSION] 청크 디렉토리 삭제 실패 uploadId={}: {} ===", uploadId, e.getMessage());
            }

            log.info("=== [SESSION] 업로드 완료! uploadId={}, finalPath={}, size={} ===",
                    uploadId, session.getFinalPath(), session.getFinalSize());
            releaseLock(uploadId, sessionLock);
            return session;
        } finally {
            lock.unlock();
        }
    }

    /** 진행 중인 세션 수 (디버그 조회용) */
    public long countOpenSessions() {
        return sessionRepository.findByStatus(SessionStatus.OPEN).size();
    }

    /** 잠금을 보유 중인 세션 수 (진행 중인 세션만 남아야 함) */
    int lockedSessionCount() {
        return sessionLocks.size();
    }

    /**
     * 세션 잠금을 가져옵니다. 존재하지 않는 세션이면 잠금을 만들지 않고 SessionNotFoundException을 던집니다.
     */
    private ReentrantReadWriteLock lockFor(String uploadId) {
        if (!sessionRepository.existsById(uploadId)) {
            throw new SessionNotFoundException(uploadId);
        }
        return sessionLocks.computeIfAbsent(uploadId, id -> new ReentrantReadWriteLock());
    }

    /**
     * 완료된 세션의 잠금 항목을 제거합니다. 완료 이후의 요청은 상태만 읽습니다.
     */
    private void releaseLock(String uploadId, ReentrantReadWriteLock sessionLock) {
        sessionLocks.remove(uploadId, sessionLock);
    }

    /**
     * 파일명 검증. 최종 파일명이 {uploadId}__{fileName}이므로 경로 구분자나 상위 경로가 있으면 거부합니다.
     */
    private void validateFileName(String fileName) {
        if (fileName == null || fileName.isBlank()) {
            throw new InvalidRequestException("파일명은 필수입니다.");
        }
        if (fileName.contains("/") || fileName.contains("\\") || fileName.equals(".") || fileName.equals("..")
                || fileName.indexOf('\0') >= 0) {
            throw new InvalidRequestException("허용되지 않는 파일명입니다: " + fileName);
        }
    }
}
