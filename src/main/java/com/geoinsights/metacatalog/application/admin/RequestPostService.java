package com.geoinsights.metacatalog.application.admin;

import com.geoinsights.metacatalog.application.common.error.CatalogAdminException;
import com.geoinsights.metacatalog.application.common.error.ErrorCodes;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

/**
 * XML 요청 파일을 서비스 URL로 POST하고 응답 본문을 돌려준다.
 */
@Service
public class RequestPostService {

    private final WebClient webClient;

    public RequestPostService(WebClient webClient) {
        this.webClient = webClient;
    }

    /**
     * @param url     대상 URL
     * @param xmlFile 요청 본문 파일
     * @param timeout 대기 시간
     * @return 응답 본문
     */
    public Mono<String> post(String url, Path xmlFile, Duration timeout) {
        return Mono.fromCallable(() -> read(xmlFile))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(body -> webClient.post()
                        .uri(url)
                        .contentType(MediaType.APPLICATION_XML)
                        .bodyValue(body)
                        .retrieve()
                        .bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .timeout(timeout)
                        .onErrorMap(e -> new CatalogAdminException(
                                "ERROR: HTTP POST to " + url + " failed: " + e.getMessage(), ErrorCodes.HTTP_POST_FAILED, e)));
    }

    private static String read(Path xmlFile) {
        try {
            return Files.readString(xmlFile);
        } catch (IOException e) {
            throw new CatalogAdminException("ERROR: Could not read " + xmlFile + ": " + e, ErrorCodes.IO_ERROR, e);
        }
    }
}
