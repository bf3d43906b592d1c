package com.example.chunkupload.server.exception;

/**
 * 선언된 파일 크기가 chunk.max-upload-size를 넘는 경우 (413).
 */
public class UploadTooLargeException extends RuntimeException {

    public UploadTooLargeException(long requested, long max) {
        super(String.format("파일 크기가 최대 허용 크기를 초과합니다: requested=%d, max=%d", requested, max));
    }
}
