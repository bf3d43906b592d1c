package com.example.chunkupload.client.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 서버 오류 응답 본문. error는 NOT_FOUND, ASSEMBLY_INCOMPLETE 같은 코드입니다.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ErrorResponse {

    private String error;

    private String message;
}
