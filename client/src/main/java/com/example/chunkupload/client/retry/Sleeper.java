package com.example.chunkupload.client.retry;

import java.time.Duration;

/**
 * 재시도 대기. 테스트에서는 실제로 기다리지 않고 대기 시간만 기록하는 구현으로 바꿔 끼웁니다.
 */
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;
}
