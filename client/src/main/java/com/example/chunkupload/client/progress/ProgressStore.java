package com.example.chunkupload.client.progress;

import com.example.chunkupload.client.config.ChunkClientProperties;
import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.Optional;

/**
 * 진행 상태 파일 저장소.
 *
 * <p>원본 파일 옆에 {@code <원본 경로>.uploadmeta.json} 파일 하나를 둡니다.
 * 원본 파일 경로당 진행 상태는 항상 하나뿐입니다.</p>
 *
 * <ol>
 *   <li>load: 파일이 없거나, 깨졌거나, 필수 항목이 빠졌으면 "없음"으로 취급 (WARN 로그)</li>
 *   <li>validate: 체크섬이나 크기가 현재 파일과 다르면 버림 (파일이 바뀌었으므로 새 세션 필요)</li>
 *   <li>persist: 같은 디렉토리의 임시 파일에 쓰고 원자적으로 교체. 중간에 죽어도 이전 버전 또는 새 버전만 남음</li>
 *   <li>clear: 서버가 완료를 확인한 뒤에만 호출</li>
 * </ol>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ProgressStore {

    private final ObjectMapper objectMapper;
    private final ChunkClientProperties clientProperties;

    public Path progressPath(Path source) {
        return source.resolveSibling(source.getFileName() + clientProperties.getProgressSuffix());
    }

    /**
     * 저장된 진행 상태를 읽습니다.
     *
     * @return 읽을 수 있는 진행 상태, 없거나 깨졌으면 empty
     * @throws IOException 파일은 있는데 디스크에서 읽지 못한 경우
     */
    public Optional<ProgressRecord> load(Path source) throws IOException {
        Path path = progressPath(source);
        byte[] content;
        try {
            content = Files.readAllBytes(path);
        } catch (NoSuchFileException e) {
            log.debug("=== [PROGRESS] 진행 상태 파일 없음: {} ===", path);
            return Optional.empty();
        }

        ProgressRecord record;
        try {
            record = objectMapper.readValue(content, ProgressRecord.class);
        } catch (JacksonException e) {
            log.warn("=== [PROGRESS] 진행 상태 파일이 손상되어 무시합니다: {} ({}) ===", path, e.getOriginalMessage());
            return Optional.empty();
        }

        if (record == null || !record.isWellFormed()) {
            log.warn("=== [PROGRESS] 진행 상태 파일에 필수 항목이 없어 무시합니다: {} ===", path);
            return Optional.empty();
        }

        log.info("=== [PROGRESS] 진행 상태 로드 sessionId={}, uploadedChunks={} ===",
                record.getSessionId(), record.getUploadedChunks().size());
        return Optional.of(record);
    }

    /**
     * 진행 상태가 현재 파일에 그대로 쓸 수 있는지 확인합니다.
     *
     * @return 재사용 가능하면 record, 파일이 바뀌었으면 empty
     */
    public Optional<ProgressRecord> validate(ProgressRecord record, long currentSize, String currentChecksum) {
        if (!record.getFileChecksum().equalsIgnoreCase(currentChecksum)) {
            log.warn("=== [PROGRESS] 파일 내용이 바뀌어 진행 상태를 버립니다. stored={}, current={} ===",
                    record.getFileChecksum(), currentChecksum);
            return Optional.empty();
        }
        if (record.getFileSize() != currentSize) {
            log.warn("=== [PROGRESS] 파일 크기가 바뀌어 진행 상태를 버립니다. stored={}, current={} ===",
                    record.getFileSize(), currentSize);
            return Optional.empty();
        }
        return Optional.of(record);
    }

    /**
     * 진행 상태를 원자적으로 저장합니다.
     */
    public void persist(Path source, ProgressRecord record) throws IOException {
        Path path = progressPath(source);
        record.setUpdatedAt(Instant.now());

        Path temp = Files.createTempFile(path.toAbsolutePath().getParent(), path.getFileName().toString(), ".tmp");
        boolean moved = false;
        try {
            Files.write(temp, objectMapper.writeValueAsBytes(record));
            try {
                Files.move(temp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.warn("=== [PROGRESS] 원자적 이동 미지원, 일반 이동으로 대체: {} ===", path);
                Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
            }
            moved = true;
            log.debug("=== [PROGRESS] 진행 상태 저장 sessionId={}, uploadedChunks={} ===",
                    record.getSessionId(), record.getUploadedChunks());
        } finally {
            if (!moved) {
                Files.deleteIfExists(temp);
            }
        }
    }

    public void clear(Path source) throws IOException {
        Path path = progressPath(source);
        if (Files.deleteIfExists(path)) {
            log.info("=== [PROGRESS] 진행 상태 삭제: {} ===", path);
        }
    }
}
