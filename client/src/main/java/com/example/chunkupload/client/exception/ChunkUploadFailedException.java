package com.example.chunkupload.client.exception;

/**
 * 한 청크의 재시도가 모두 실패한 경우. 이번 실행은 중단되지만 다음 실행에서 이어받을 수 있습니다.
 */
public class ChunkUploadFailedException extends RuntimeException {

    private final int index;
    private final int attempts;

    public ChunkUploadFailedException(int index, int attempts, Throwable cause) {
        super(String.format("청크 전송 실패: index=%d, attempts=%d, cause=%s", index, attempts, cause.getMessage()),
                cause);
        this.index = index;
        this.attempts = attempts;
    }

    public int getIndex() {
        return index;
    }

    public int getAttempts() {
        return attempts;
    }
}
