package com.example.chunkupload.server.service;

import com.example.chunkupload.server.config.ChunkServerProperties;
import com.example.chunkupload.server.exception.ChecksumMismatchException;
import com.example.chunkupload.server.exception.InvalidRequestException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.channels.ReadableByteChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.security.MessageDigest;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * 로컬 디스크 기반 청크 저장소.
 * <p>
 * 디렉토리 구조:
 * <pre>
 * {storagePath}/sessions/{uploadId}/chunk_0.part
 * {storagePath}/sessions/{uploadId}/chunk_1.part
 * {storagePath}/sessions/{uploadId}/chunk_1.part.{uuid}.tmp   (기록 중인 임시 파일)
 * </pre>
 * </p>
 * <p>
 * 청크마다 별도 파일이므로 서로 다른 인덱스의 쓰기는 잠금 없이 병행됩니다.
 * 기록은 고유한 임시 파일에 끝까지 쓴 뒤 rename으로 교체하므로,
 * 목록 조회나 조립 중인 쪽에서 반쯤 기록된 청크가 보이지 않습니다.
 * </p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FileSystemChunkStore implements ChunkStore {

    private static final Pattern CHUNK_FILE = Pattern.compile("chunk_(\\d+)\\.part");

    private static final int BUFFER_SIZE = 8192;

    private final ChunkServerProperties properties;
    private final ChecksumService checksumService;

    @Override
    public void createArea(String uploadId) throws IOException {
        Path dir = areaPath(uploadId);
        Files.createDirectories(dir);
        log.debug("=== [CHUNK STORE] 청크 디렉토리 생성: {} ===", dir);
    }

    @Override
    public StoredChunk writeChunk(String uploadId, int index, InputStream data, long maxBytes, boolean exact,
                                  String expectedSha256) throws IOException {
        Path dir = areaPath(uploadId);
        // 서버 저장소가 지워진 경우에도 세션이 살아있으면 다시 받을 수 있도록 재생성
        Files.createDirectories(dir);

        Path target = chunkPath(uploadId, index);
        Path temp = dir.resolve(target.getFileName() + "." + UUID.randomUUID() + ".tmp");

        MessageDigest digest = checksumService.newDigest();
        long bytesWritten = 0;
        boolean promoted = false;

        try {
            try (FileChannel out = FileChannel.open(temp, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
                ReadableByteChannel in = Channels.newChannel(data);
                ByteBuffer buffer = ByteBuffer.allocate(BUFFER_SIZE);

                while (in.read(buffer) != -1) {
                    buffer.flip();
                    bytesWritten += buffer.remaining();
                    if (bytesWritten > maxBytes) {
                        throw new InvalidRequestException(String.format(
                                "청크 크기 초과: index=%d, max=%d bytes", index, maxBytes));
                    }
                    digest.update(buffer.duplicate());
                    while (buffer.hasRemaining()) {
                        out.write(buffer);
                    }
                    buffer.clear();
                }
                out.force(true);
            }

            if (exact && bytesWritten != maxBytes) {
                throw new InvalidRequestException(String.format(
                        "청크 길이 불일치: index=%d, expected=%d, actual=%d", index, maxBytes, bytesWritten));
            }

            String actualSha256 = checksumService.toHex(digest);
            if (!checksumService.matches(expectedSha256, actualSha256)) {
                log.warn("=== [CHUNK STORE] 청크 체크섬 불일치 uploadId={}, index={} ===", uploadId, index);
                throw new ChecksumMismatchException(expectedSha256, actualSha256);
            }

            moveAtomically(temp, target);
            promoted = true;

            log.debug("=== [CHUNK STORE] 청크 저장 완료 uploadId={}, index={}, size={} ===",
                    uploadId, index, bytesWritten);
            return new StoredChunk(index, bytesWritten, actualSha256);

        } finally {
            if (!promoted) {
                Files.deleteIfExists(temp);
            }
        }
    }

    @Override
    public List<Integer> listChunks(String uploadId) throws IOException {
        Path dir = areaPath(uploadId);
        List<Integer> indices = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir)) {
            for (Path path : stream) {
                Matcher matcher = CHUNK_FILE.matcher(path.getFileName().toString());
                if (matcher.matches()) {
                    try {
                        indices.add(Integer.parseInt(matcher.group(1)));
                    } catch (NumberFormatException e) {
                        log.warn("=== [CHUNK STORE] 인덱스 해석 불가 파일 무시: {} ===", path);
                    }
                }
            }
        } catch (NoSuchFileException e) {
            // 아직 만들어지지 않았거나 완료 처리로 이미 삭제된 디렉토리
            log.debug("=== [CHUNK STORE] 청크 디렉토리 없음 uploadId={} ===", uploadId);
            return Collections.emptyList();
        }
        Collections.sort(indices);
        return indices;
    }

    @Override
    public long chunkLength(String uploadId, int index) throws IOException {
        return Files.size(chunkPath(uploadId, index));
    }

    @Override
    public InputStream openChunk(String uploadId, int index) throws IOException {
        return Files.newInputStream(chunkPath(uploadId, index));
    }

    @Override
    public void deleteArea(String uploadId) throws IOException {
        Path dir = areaPath(uploadId);
        if (!Files.exists(dir)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(dir)) {
            List<Path> ordered = paths.sorted(Comparator.reverseOrder()).toList();
            for (Path path : ordered) {
                Files.deleteIfExists(path);
            }
        }
        log.info("=== [CHUNK STORE] 청크 디렉토리 삭제: {} ===", dir);
    }

    private Path areaPath(String uploadId) {
        return properties.getSessionsPath().resolve(uploadId);
    }

    private Path chunkPath(String uploadId, int index) {
        return areaPath(uploadId).resolve("chunk_" + index + ".part");
    }

    /**
     * 임시 파일을 최종 이름으로 교체합니다.
     * 같은 디렉토리 안의 rename이므로 대부분의 파일시스템에서 원자적으로 처리됩니다.
     */
    static void moveAtomically(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("=== [CHUNK STORE] 원자적 이동 미지원, 일반 이동으로 대체: {} ===", target);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
