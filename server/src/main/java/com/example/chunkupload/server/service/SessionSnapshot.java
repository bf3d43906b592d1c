package com.example.chunkupload.server.service;

import com.example.chunkupload.server.entity.UploadSession;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.List;

/**
 * 한 시점의 세션 상태와 수신 청크 목록.
 * 같은 잠금 구간에서 함께 읽으므로 상태와 목록이 서로 어긋나지 않습니다.
 */
@Getter
@RequiredArgsConstructor
public class SessionSnapshot {

    private final UploadSession session;

    /** 오름차순 인덱스 목록. 완료된 세션은 빈 목록 */
    private final List<Integer> acceptedChunks;
}
