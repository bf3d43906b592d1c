package com.example.chunkupload.server.service;

import org.springframework.stereotype.Service;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 체크섬 계산/비교 서비스.
 * <p>
 * 청크 수신 시 X-Chunk-Sha256 헤더 검증과, 조립 완료 후 최종 파일 무결성 검증에 사용합니다.
 * </p>
 */
@Service
public class ChecksumService {

    /**
     * 새 SHA-256 MessageDigest 인스턴스를 생성합니다.
     * 스트리밍 중 누적 계산이 필요한 곳(청크 저장, 조립)에서 사용합니다.
     */
    public MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 알고리즘을 사용할 수 없습니다.", e);
        }
    }

    /** 누적된 digest를 16진수 문자열로 변환합니다. */
    public String toHex(MessageDigest digest) {
        return HexFormat.of().formatHex(digest.digest());
    }

    /**
     * 기대값과 실제값을 비교합니다 (대소문자 무시).
     * 기대값이 없으면 검증을 생략하고 true를 반환합니다.
     */
    public boolean matches(String expected, String actual) {
        if (expected == null || expected.isBlank()) {
            return true;
        }
        return expected.equalsIgnoreCase(actual);
    }
}
