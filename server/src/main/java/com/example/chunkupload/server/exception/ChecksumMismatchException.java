package com.example.chunkupload.server.exception;

/**
 * 청크 또는 최종 파일의 SHA-256이 클라이언트가 제공한 값과 다른 경우 (422).
 */
public class ChecksumMismatchException extends RuntimeException {

    public ChecksumMismatchException(String expected, String actual) {
        super(String.format("체크섬 불일치: expected=%s, actual=%s", expected, actual));
    }
}
