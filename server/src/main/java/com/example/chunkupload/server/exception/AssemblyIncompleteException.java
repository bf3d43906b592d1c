package com.example.chunkupload.server.exception;

import java.util.List;

/**
 * 완료 요청 시 [0, totalChunks) 범위의 청크가 모두 모이지 않은 경우 (409).
 * 세션은 OPEN 상태로 유지되어 추가 청크 업로드가 가능합니다.
 */
public class AssemblyIncompleteException extends RuntimeException {

    private final List<Integer> missingChunks;

    public AssemblyIncompleteException(String message, List<Integer> missingChunks) {
        super(message);
        this.missingChunks = List.copyOf(missingChunks);
    }

    public List<Integer> getMissingChunks() {
        return missingChunks;
    }
}
