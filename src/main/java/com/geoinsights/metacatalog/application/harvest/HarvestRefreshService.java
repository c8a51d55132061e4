package com.geoinsights.metacatalog.application.harvest;

import com.geoinsights.metacatalog.application.catalog.repository.CatalogRepository;
import com.geoinsights.metacatalog.application.catalog.repository.RecordFilter;
import com.geoinsights.metacatalog.infrastructure.persistence.r2dbc.row.RecordRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * 하베스트된(출처가 local이 아닌) 레코드마다 원본 재수집을 요청하는 서비스입니다.
 * <p>
 * 요청은 한 번에 하나씩 보내며, 개별 실패는 로그로 남기고 다음 레코드를 계속 처리합니다.
 */
@Service
public class HarvestRefreshService {

    private static final Logger log = LoggerFactory.getLogger(HarvestRefreshService.class);

    static final String ISO_GMD_NS = "http://www.isotc211.org/2005/gmd";
    static final String ISO_GMD_SCHEMA = "http://www.isotc211.org/schemas/2005/gmd/";

    private final CatalogRepository repository;
    private final HarvestClient client;

    public HarvestRefreshService(CatalogRepository repository, HarvestClient client) {
        this.repository = repository;
        this.client = client;
    }

    /**
     * @param endpointUrl 재수집 요청을 받을 카탈로그 서비스 URL
     * @return 요청/성공/실패 건수
     */
    public Mono<HarvestReport> refreshHarvested(String endpointUrl) {
        return repository.query(RecordFilter.nonLocal(), Integer.MAX_VALUE)
                .flatMap(page -> {
                    if (page.matched() == 0 || page.records().isEmpty()) {
                        log.info("No harvested records");
                        return Mono.just(HarvestReport.empty());
                    }

                    return Flux.fromIterable(page.records())
                            .concatMap(r -> harvestOne(endpointUrl, r))
                            .reduce(HarvestReport.empty(), (acc, ok) -> new HarvestReport(
                                    acc.requested() + 1,
                                    acc.succeeded() + (ok ? 1 : 0),
                                    acc.failed() + (ok ? 0 : 1)));
                })
                .doOnNext(report -> log.info("Harvest refresh finished: requested={}, succeeded={}, failed={}",
                        report.requested(), report.succeeded(), report.failed()));
    }

    /**
     * 저장된 스키마 값을 Harvest 요청의 ResourceType 값으로 바꾼다.
     * ISO 19139 네임스페이스는 스키마 위치 URL로 치환한다.
     */
    static String resourceType(String schemaUri) {
        return ISO_GMD_NS.equals(schemaUri) ? ISO_GMD_SCHEMA : schemaUri;
    }

    private Mono<Boolean> harvestOne(String endpointUrl, RecordRow record) {
        String source = record.metadataSource();
        log.info("Harvesting {} ({})", source, record.identifier());

        return client.harvest(endpointUrl, source, resourceType(record.schemaUri()))
                .doOnNext(response -> log.debug("Harvest response for {}: {}", source, response))
                .thenReturn(true)
                .onErrorResume(e -> {
                    log.error("Could not harvest {}: {}", source, e.getMessage(), e);
                    return Mono.just(false);
                });
    }
}
