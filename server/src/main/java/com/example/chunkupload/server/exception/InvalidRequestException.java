package com.example.chunkupload.server.exception;

/**
 * 인덱스 범위, 청크 크기, 파일명 등 요청 자체가 잘못된 경우 (400).
 */
public class InvalidRequestException extends RuntimeException {

    public InvalidRequestException(String message) {
        super(message);
    }
}
