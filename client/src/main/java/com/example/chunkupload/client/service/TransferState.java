package com.example.chunkupload.client.service;

/**
 * 전송 상태.
 * <pre>
 * START → FRESH | RESUMED → TRANSFERRING → COMPLETING → DONE
 *                            TRANSFERRING → ABORTED (재실행 시 이어받기 가능)
 * </pre>
 */
public enum TransferState {
    START,
    FRESH,
    RESUMED,
    TRANSFERRING,
    COMPLETING,
    DONE,
    ABORTED
}
