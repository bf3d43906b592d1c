package com.example.chunkupload.client.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * 재시도 정책 설정 프로퍼티
 *
 * <p>application.yml의 "chunk.retry" 접두사 아래 설정을 바인딩합니다.</p>
 *
 * <pre>
 * chunk.retry:
 *   backoff: 1s,2s,5s,10s     # 대기 시간 목록
 * </pre>
 *
 * <p><b>백오프 스케줄:</b></p>
 * <ul>
 *   <li>최대 시도 횟수 = 목록 길이 + 1 (기본 5회), 모든 대기 시간이 한 번씩 사용됨</li>
 *   <li>n번째 시도가 실패하면 n번째 대기 시간만큼 쉬고 다시 시도</li>
 *   <li>마지막 시도가 실패하면 대기 없이 바로 실패 처리</li>
 * </ul>
 */
@Data
@ConfigurationProperties(prefix = "chunk.retry")
public class RetryProperties {

    private List<Duration> backoff = new ArrayList<>(List.of(
            Duration.ofSeconds(1),
            Duration.ofSeconds(2),
            Duration.ofSeconds(5),
            Duration.ofSeconds(10)));
}
