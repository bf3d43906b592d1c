package com.example.chunkupload.server.service;

import com.example.chunkupload.server.config.ChunkServerProperties;
import com.example.chunkupload.server.entity.UploadSession;
import com.example.chunkupload.server.exception.AssemblyIncompleteException;
import com.example.chunkupload.server.exception.ChecksumMismatchException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.security.DigestOutputStream;
import java.security.MessageDigest;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 청크 조립기.
 * <p>
 * 세션에 저장된 청크를 인덱스 오름차순으로 이어붙여 최종 파일을 만듭니다.
 * </p>
 * <ol>
 *   <li>저장된 인덱스가 [0, totalChunks) 범위를 빠짐없이, 정확히 덮는지 검사</li>
 *   <li>파일 크기가 선언된 세션이면 각 청크 길이도 검사 (마지막 청크만 짧을 수 있음)</li>
 *   <li>{uploadId}__{fileName}.assembling 임시 파일에 이어쓰기 (SHA-256 동시 계산)</li>
 *   <li>클라이언트 체크섬이 있으면 비교, 불일치 시 임시 파일 삭제</li>
 *   <li>전체 기록이 끝난 후에만 최종 이름으로 rename</li>
 * </ol>
 * <p>조립 도중 실패해도 최종 이름으로는 부분 파일이 절대 노출되지 않습니다.</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ChunkAssembler {

    private static final String TEMP_SUFFIX = ".assembling";

    private final ChunkStore chunkStore;
    private final ChecksumService checksumService;
    private final ChunkServerProperties properties;

    /**
     * 세션의 청크를 조립합니다.
     *
     * @param session 조립할 세션 (OPEN 상태)
     * @return 조립 결과
     * @throws AssemblyIncompleteException 누락되었거나 길이가 맞지 않는 청크가 있는 경우
     * @throws ChecksumMismatchException   최종 파일 체크섬이 클라이언트 값과 다른 경우
     */
    public AssemblyResult assemble(UploadSession session) throws IOException {
        String uploadId = session.getUploadId();
        List<Integer> stored = chunkStore.listChunks(uploadId);
        int totalChunks = verifyCoverage(session, stored);

        Path finalPath = artifactPath(session);
        Path tempPath = finalPath.resolveSibling(finalPath.getFileName() + TEMP_SUFFIX);

        log.info("=== [ASSEMBLER] 조립 시작 uploadId={}, totalChunks={}, target={} ===",
                uploadId, totalChunks, finalPath);

        MessageDigest digest = checksumService.newDigest();
        long totalBytes = 0;
        boolean exposed = false;

        try {
            try (OutputStream out = new DigestOutputStream(Files.newOutputStream(tempPath,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE), digest)) {
                for (int index = 0; index < totalChunks; index++) {
                    try (InputStream in = chunkStore.openChunk(uploadId, index)) {
                        totalBytes += in.transferTo(out);
                    }
                }
            }

            String sha256 = checksumService.toHex(digest);
            if (!checksumService.matches(session.getChecksum(), sha256)) {
                log.warn("=== [ASSEMBLER] 최종 파일 체크섬 불일치! uploadId={}, expected={}, actual={} ===",
                        uploadId, session.getChecksum(), sha256);
                throw new ChecksumMismatchException(session.getChecksum(), sha256);
            }

            FileSystemChunkStore.moveAtomically(tempPath, finalPath);
            exposed = true;

            log.info("=== [ASSEMBLER] 조립 완료 uploadId={}, size={}, sha256={} ===", uploadId, totalBytes, sha256);

            return AssemblyResult.builder()
                    .finalPath(finalPath)
                    .size(totalBytes)
                    .sha256(sha256)
                    .totalChunks(totalChunks)
                    .build();
        } finally {
            if (!exposed) {
                Files.deleteIfExists(tempPath);
            }
        }
    }

    /**
     * 최종 파일 경로. uploadId를 접두어로 붙여 다른 세션과 이름이 겹치지 않게 합니다.
     */
    public Path artifactPath(UploadSession session) {
        return properties.getCompletedPath().resolve(session.getUploadId() + "__" + session.getFileName());
    }

    /**
     * 청크 인덱스 커버리지를 검사하고 totalChunks를 반환합니다.
     */
    private int verifyCoverage(UploadSession session, List<Integer> stored) throws IOException {
        String uploadId = session.getUploadId();

        long declared = session.getTotalChunks();
        long totalChunks;
        if (declared > 0) {
            totalChunks = declared;
        } else if (stored.isEmpty()) {
            // 파일 크기가 선언되지 않았으면 최소 1개의 청크가 있어야 함
            totalChunks = 1;
        } else {
            totalChunks = stored.get(stored.size() - 1) + 1L;
        }

        Set<Integer> present = new HashSet<>(stored);
        List<Integer> missing = new ArrayList<>();
        for (int index = 0; index < totalChunks; index++) {
            if (!present.contains(index)) {
                missing.add(index);
            }
        }
        if (!missing.isEmpty()) {
            log.warn("=== [ASSEMBLER] 누락 청크 존재 uploadId={}, missing={} ===", uploadId, missing);
            throw new AssemblyIncompleteException(String.format(
                    "청크가 모두 수신되지 않았습니다: %d/%d, missing=%s",
                    totalChunks - missing.size(), totalChunks, missing), missing);
        }

        if (stored.size() != totalChunks) {
            throw new AssemblyIncompleteException(String.format(
                    "선언된 범위를 벗어난 청크가 있습니다: totalChunks=%d, stored=%s", totalChunks, stored),
                    List.of());
        }

        if (session.getFileSize() != null) {
            long fileSize = session.getFileSize();
            for (int index = 0; index < totalChunks; index++) {
                long expected = Math.min(session.getChunkSize(), fileSize - (long) index * session.getChunkSize());
                long actual = chunkStore.chunkLength(uploadId, index);
                if (actual != expected) {
                    log.warn("=== [ASSEMBLER] 청크 길이 불일치 uploadId={}, index={}, expected={}, actual={} ===",
                            uploadId, index, expected, actual);
                    throw new AssemblyIncompleteException(String.format(
                            "청크 길이가 맞지 않습니다: index=%d, expected=%d, actual=%d", index, expected, actual),
                            List.of(index));
                }
            }
        }

        return (int) totalChunks;
    }
}
