package com.example.chunkupload.server.exception;

/**
 * 이미 조립이 끝난 세션에 청크를 보낸 경우 (409).
 */
public class SessionCompletedException extends RuntimeException {

    public SessionCompletedException(String uploadId) {
        super("이미 완료된 업로드 세션입니다: uploadId=" + uploadId);
    }
}
