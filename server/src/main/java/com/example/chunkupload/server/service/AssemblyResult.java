package com.example.chunkupload.server.service;

import lombok.Builder;
import lombok.Getter;

import java.nio.file.Path;

/**
 * 조립 결과: 최종 파일 위치, 크기, SHA-256.
 */
@Getter
@Builder
public class AssemblyResult {

    private final Path finalPath;

    private final long size;

    private final String sha256;

    private final int totalChunks;
}
