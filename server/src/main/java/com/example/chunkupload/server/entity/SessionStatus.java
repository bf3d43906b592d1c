package com.example.chunkupload.server.entity;

/**
 * 업로드 세션 상태.
 */
public enum SessionStatus {
    /** 청크 수신 중 */
    OPEN,
    /** 조립 완료, 청크 저장소 삭제됨 */
    COMPLETED
}
