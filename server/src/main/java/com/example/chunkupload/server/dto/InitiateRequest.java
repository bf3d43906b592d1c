package com.example.chunkupload.server.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 업로드 세션 생성 요청.
 *
 * <pre>
 * POST /upload/initiate
 * {
 *   "filename": "flight-log.bin",
 *   "fileSize": 26214400,
 *   "checksum": "e3b0c442..."
 * }
 * </pre>
 *
 * <p>fileSize와 checksum은 선택입니다. fileSize가 있으면 청크 인덱스 범위와 길이를 수신 시점에 검사하고,
 * checksum이 있으면 조립 후 최종 파일과 비교합니다.</p>
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class InitiateRequest {

    @NotBlank(message = "filename은 필수입니다.")
    private String filename;

    @PositiveOrZero(message = "fileSize는 0 이상이어야 합니다.")
    private Long fileSize;

    /** SHA-256 16진수 64자 */
    @Pattern(regexp = "^[0-9a-fA-F]{64}$", message = "checksum은 SHA-256 16진수 문자열이어야 합니다.")
    private String checksum;
}
