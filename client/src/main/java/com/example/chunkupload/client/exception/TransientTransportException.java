package com.example.chunkupload.client.exception;

/**
 * 연결 실패, 타임아웃, 5xx 응답처럼 다시 시도하면 성공할 수 있는 오류.
 * 재시도 정책이 잡아서 백오프 후 다시 시도합니다.
 */
public class TransientTransportException extends RuntimeException {

    private final int statusCode;

    public TransientTransportException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public TransientTransportException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    /** HTTP 상태 코드. 응답 자체를 받지 못했으면 -1 */
    public int getStatusCode() {
        return statusCode;
    }
}
