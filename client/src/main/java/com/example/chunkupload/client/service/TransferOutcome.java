package com.example.chunkupload.client.service;

public enum TransferOutcome {
    /** 서버가 조립을 확인함 */
    COMPLETED,
    /** 아직 끝나지 않음. 같은 명령을 다시 실행하면 이어받음 */
    INCOMPLETE
}
