package com.example.chunkupload.client.exception;

/**
 * 서버가 세션을 모른다고 응답한 경우 (404). 재시도하지 않습니다.
 * 이어받기 중이면 로컬 진행 상태를 버리고 새 세션으로 시작합니다.
 */
public class SessionNotFoundException extends RuntimeException {

    private final String uploadId;

    public SessionNotFoundException(String uploadId) {
        super("서버에 업로드 세션이 없습니다: uploadId=" + uploadId);
        this.uploadId = uploadId;
    }

    public String getUploadId() {
        return uploadId;
    }
}
