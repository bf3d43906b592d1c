package com.example.chunkupload.server.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * 시연/테스트용 장애 주입기.
 * <p>
 * 예약된 횟수만큼 다음 청크 수신 요청을 503으로 실패시킵니다.
 * 클라이언트의 재시도(백오프) 동작을 실제 서버를 상대로 확인할 때 사용합니다.
 * </p>
 */
@Slf4j
@Component
public class FailureInjector {

    private final AtomicInteger remainingFailures = new AtomicInteger();

    /** 다음 청크 요청 count회를 실패시키도록 예약합니다. */
    public void failNextChunks(int count) {
        remainingFailures.set(Math.max(0, count));
        log.warn("=== [DEBUG] 다음 청크 요청 {}회 실패 예정! ===", count);
    }

    /**
     * 이번 요청을 실패시켜야 하는지 확인합니다.
     * 남은 횟수가 있으면 1 감소시키고 true를 반환합니다.
     */
    public boolean shouldFailChunk() {
        return remainingFailures.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0;
    }

    public int remaining() {
        return remainingFailures.get();
    }

    public void reset() {
        remainingFailures.set(0);
        log.info("=== [DEBUG] 장애 시뮬레이션 초기화 ===");
    }
}
