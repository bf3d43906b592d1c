package com.example.chunkupload.client.exception;

/**
 * 서버가 404 이외의 4xx로 요청을 거절한 경우. 같은 요청을 반복해도 결과가 같으므로 재시도하지 않습니다.
 */
public class UploadRejectedException extends RuntimeException {

    public static final String SESSION_COMPLETED = "SESSION_COMPLETED";
    public static final String ASSEMBLY_INCOMPLETE = "ASSEMBLY_INCOMPLETE";

    private final int statusCode;
    private final String errorCode;

    public UploadRejectedException(int statusCode, String errorCode, String message) {
        super(String.format("서버가 요청을 거절했습니다 [%d %s]: %s", statusCode, errorCode, message));
        this.statusCode = statusCode;
        this.errorCode = errorCode;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public boolean isSessionCompleted() {
        return SESSION_COMPLETED.equals(errorCode);
    }
}
