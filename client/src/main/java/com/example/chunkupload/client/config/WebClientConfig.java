package com.example.chunkupload.client.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

/**
 * WebClient 설정 클래스
 *
 * <p>업로드 서버와의 HTTP 통신을 위한 WebClient를 구성합니다.</p>
 *
 * <h3>주요 설정:</h3>
 * <ul>
 *   <li><b>Base URL:</b> chunk.server-url (CLI의 --server 옵션으로 덮어쓸 수 있음)</li>
 *   <li><b>응답 타임아웃:</b> chunk.request-timeout (기본 60초)</li>
 *   <li><b>응답 버퍼:</b> 1MB - 응답은 JSON뿐이라 크지 않음</li>
 * </ul>
 *
 * <p>이 클래스는 {@link EnableConfigurationProperties}를 통해
 * 클라이언트 프로퍼티 클래스를 등록하는 중앙 설정 역할도 합니다.</p>
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
@EnableConfigurationProperties({
        ChunkClientProperties.class,
        RetryProperties.class
})
public class WebClientConfig {

    private static final int MAX_RESPONSE_BUFFER = 1024 * 1024;

    private final ChunkClientProperties clientProperties;

    @Bean
    public WebClient webClient() {
        ExchangeStrategies strategies = ExchangeStrategies.builder()
                .codecs(configurer -> configurer
                        .defaultCodecs()
                        .maxInMemorySize(MAX_RESPONSE_BUFFER))
                .build();

        // 응답이 오지 않는 요청도 반드시 끝나야 재시도로 넘어갈 수 있음
        HttpClient httpClient = HttpClient.create()
                .responseTimeout(clientProperties.getRequestTimeout());

        log.info("=== [WEBCLIENT CONFIG] baseUrl={}, requestTimeout={} ===",
                clientProperties.getServerUrl(), clientProperties.getRequestTimeout());

        return WebClient.builder()
                .baseUrl(clientProperties.getServerUrl())
                .exchangeStrategies(strategies)
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .filter(logRequest())
                .filter(logResponse())
                .build();
    }

    /**
     * HTTP 요청 로깅 필터
     * 모든 나가는 요청의 메서드와 URL을 DEBUG 레벨로 기록합니다.
     */
    private ExchangeFilterFunction logRequest() {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            log.debug("=== [HTTP REQUEST] {} {} ===", clientRequest.method(), clientRequest.url());
            return Mono.just(clientRequest);
        });
    }

    private ExchangeFilterFunction logResponse() {
        return ExchangeFilterFunction.ofResponseProcessor(clientResponse -> {
            log.debug("=== [HTTP RESPONSE] status={} ===", clientResponse.statusCode());
            return Mono.just(clientResponse);
        });
    }
}
