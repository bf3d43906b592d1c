package com.example.chunkupload.client.retry;

import com.example.chunkupload.client.config.RetryProperties;
import com.example.chunkupload.client.exception.TransientTransportException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.function.Supplier;

/**
 * 백오프 스케줄 기반 재시도 정책.
 *
 * <p><b>재시도 규칙:</b></p>
 * <ul>
 *   <li>최대 시도 횟수 = chunk.retry.backoff 목록 길이 + 1 (첫 시도 + 대기 시간마다 재시도 1회)</li>
 *   <li>n번째 시도가 {@link TransientTransportException}으로 실패하면 n번째 대기 후 재시도</li>
 *   <li>마지막 시도 실패 후에는 대기하지 않고 마지막 예외를 그대로 던짐</li>
 *   <li>그 밖의 예외(404, 4xx 거절)는 재시도하지 않고 즉시 전파</li>
 * </ul>
 *
 * <p>서버 쪽 청크 쓰기는 인덱스 단위로 멱등이므로 같은 요청을 몇 번 반복해도 안전합니다.</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RetryPolicy {

    private final RetryProperties retryProperties;
    private final Sleeper sleeper;

    public int maxAttempts() {
        return retryProperties.getBackoff().size() + 1;
    }

    /**
     * 작업을 실행하고, 일시적 오류면 스케줄에 따라 재시도합니다.
     *
     * @param operation 로그용 작업 이름
     * @param action    HTTP 호출 1회
     * @return 첫 번째 성공 결과
     * @throws TransientTransportException 모든 시도가 실패한 경우 마지막 오류
     */
    public <T> T execute(String operation, Supplier<T> action) {
        List<Duration> backoff = retryProperties.getBackoff();
        int maxAttempts = maxAttempts();

        for (int attempt = 1; ; attempt++) {
            try {
                T result = action.get();
                if (attempt > 1) {
                    log.info("=== [RETRY] {} 성공 (attempt {}/{}) ===", operation, attempt, maxAttempts);
                }
                return result;
            } catch (TransientTransportException e) {
                if (attempt >= maxAttempts) {
                    log.error("=== [RETRY] {} 최대 재시도 횟수 초과 ({}회): {} ===", operation, maxAttempts, e.getMessage());
                    throw e;
                }

                Duration delay = backoff.get(attempt - 1);
                log.warn("=== [RETRY] {} 실패 (attempt {}/{}), {}ms 후 재시도: {} ===",
                        operation, attempt, maxAttempts, delay.toMillis(), e.getMessage());
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    e.addSuppressed(ie);
                    throw e;
                }
            }
        }
    }
}
