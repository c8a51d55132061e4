package com.geoinsights.metacatalog.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.web.reactive.function.client.WebClient;
import tools.jackson.databind.json.JsonMapper;

import java.time.Clock;

/**
 * 파이프라인 공용 Bean 설정.
 *
 * <p>시각({@link Clock}), JSON 파서, 원격 요청용 {@link WebClient}를 한 곳에서 등록해
 * 테스트에서 교체하기 쉽게 한다.</p>
 */
@Configuration
public class CatalogConfig {

    /**
     * 레코드 insert_date 부여에 사용하는 시계(UTC).
     *
     * @return UTC 시스템 시계
     */
    @Bean
    public Clock catalogClock() {
        return Clock.systemUTC();
    }

    /**
     * 메타데이터 JSON 문서 파싱용 매퍼.
     *
     * @return 기본 설정 JsonMapper
     */
    @Bean
    @Primary
    public JsonMapper catalogJsonMapper() {
        return JsonMapper.builder().build();
    }

    /**
     * 하베스트/POST 요청용 WebClient.
     *
     * <p>응답 문서(ExceptionReport 포함)를 문자열로 받기 위해 버퍼 한도를 넉넉히 잡는다.</p>
     *
     * @return WebClient
     */
    @Bean
    public WebClient catalogWebClient() {
        return WebClient.builder()
                .codecs(c -> c.defaultCodecs().maxInMemorySize(16 * 1024 * 1024))
                .build();
    }
}
