package com.example.chunkupload.server.service;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 저장이 끝난 청크 한 개의 정보.
 */
@Getter
@RequiredArgsConstructor
public class StoredChunk {

    private final int index;

    /** 바이트 크기 */
    private final long size;

    /** 청크 데이터의 SHA-256 (16진수) */
    private final String sha256;
}
