package com.example.chunkupload.client.util;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 체크섬 계산 유틸리티
 *
 * <h3>체크섬의 역할:</h3>
 * <ul>
 *   <li>원본 파일 전체 체크섬은 세션 생성 시 서버로 보내 조립 결과와 비교</li>
 *   <li>같은 값이 진행 상태 파일에도 저장되어, 이어받기 전에 파일이 바뀌었는지 판별</li>
 *   <li>청크별 체크섬은 X-Chunk-Sha256 헤더로 보내 서버가 수신 즉시 검증</li>
 * </ul>
 *
 * <p>파일은 8KB 버퍼 단위로 읽으므로 대용량 파일도 메모리 부담이 없습니다.</p>
 */
@Slf4j
public class ChecksumCalculator {

    private static final int BUFFER_SIZE = 8192; // 8KB

    private ChecksumCalculator() {
        throw new UnsupportedOperationException("유틸리티 클래스는 인스턴스를 생성할 수 없습니다.");
    }

    /**
     * 파일 전체의 SHA-256 체크섬을 계산합니다.
     *
     * @param filePath 체크섬을 계산할 파일
     * @return SHA-256 해시의 16진수 문자열 (소문자 64자)
     * @throws IOException 파일 읽기 실패
     */
    public static String calculateSha256(Path filePath) throws IOException {
        log.debug("=== [CHECKSUM] 체크섬 계산 시작: file={} ===", filePath);

        MessageDigest digest = newDigest();
        try (InputStream in = Files.newInputStream(filePath)) {
            byte[] buffer = new byte[BUFFER_SIZE];
            int bytesRead;
            while ((bytesRead = in.read(buffer)) != -1) {
                digest.update(buffer, 0, bytesRead);
            }
        }

        String hexHash = HexFormat.of().formatHex(digest.digest());
        log.info("=== [CHECKSUM] file={}, sha256={} ===", filePath.getFileName(), hexHash);
        return hexHash;
    }

    /**
     * 메모리에 있는 청크의 SHA-256 체크섬을 계산합니다.
     */
    public static String sha256(byte[] data) {
        return HexFormat.of().formatHex(newDigest().digest(data));
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            // SHA-256은 모든 JVM이 지원해야 하는 알고리즘
            log.error("=== [CHECKSUM ERROR] SHA-256 알고리즘을 사용할 수 없습니다 ===", e);
            throw new IllegalStateException("SHA-256 알고리즘을 사용할 수 없습니다.", e);
        }
    }
}
