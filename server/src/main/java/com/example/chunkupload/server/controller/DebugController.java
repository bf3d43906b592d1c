package com.example.chunkupload.server.controller;

import com.example.chunkupload.server.service.FailureInjector;
import com.example.chunkupload.server.service.UploadSessionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

/**
 * 디버그/시연용 장애 시뮬레이션 컨트롤러.
 * <p>
 * 사용 시나리오:
 * 1. POST /api/debug/fail-next-chunks?count=2 → 다음 청크 요청 2회 실패 예약
 * 2. 클라이언트가 청크 전송 → 서버가 503 반환 → 클라이언트 백오프 후 재시도
 * 3. 세 번째 시도에서 수신 성공
 * </p>
 */
@Slf4j
@RestController
@RequestMapping("/api/debug")
@RequiredArgsConstructor
public class DebugController {

    private final FailureInjector failureInjector;
    private final UploadSessionService uploadSessionService;

    @PostMapping("/fail-next-chunks")
    public ResponseEntity<String> failNextChunks(@RequestParam(defaultValue = "1") int count) {
        failureInjector.failNextChunks(count);
        return ResponseEntity.ok("다음 청크 요청 " + count + "회 실패 예정");
    }

    @PostMapping("/reset")
    public ResponseEntity<String> reset() {
        failureInjector.reset();
        return ResponseEntity.ok("디버그 상태 초기화 완료");
    }

    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> getStatus() {
        Map<String, Object> status = new HashMap<>();
        status.put("remainingChunkFailures", failureInjector.remaining());
        status.put("openSessions", uploadSessionService.countOpenSessions());
        log.debug("=== [DEBUG] 디버그 상태 조회: {} ===", status);
        return ResponseEntity.ok(status);
    }
}
