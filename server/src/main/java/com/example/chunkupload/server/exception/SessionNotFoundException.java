package com.example.chunkupload.server.exception;

/**
 * 존재하지 않는 uploadId로 요청한 경우 (404).
 */
public class SessionNotFoundException extends RuntimeException {

    public SessionNotFoundException(String uploadId) {
        super("업로드 세션을 찾을 수 없습니다: uploadId=" + uploadId);
    }
}
