package com.example.chunkupload.server.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 오류 응답 본문.
 * error 값: NOT_FOUND, SESSION_COMPLETED, ASSEMBLY_INCOMPLETE, INVALID_REQUEST,
 * CHECKSUM_MISMATCH, UPLOAD_TOO_LARGE, UNSUPPORTED_MEDIA_TYPE, STORAGE_ERROR, INJECTED_FAILURE
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ErrorResponse {

    private String error;

    private String message;
}
