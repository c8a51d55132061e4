package com.geoinsights.metacatalog.application.sync;

import com.geoinsights.metacatalog.application.catalog.repository.CatalogRepository;
import com.geoinsights.metacatalog.application.catalog.repository.InsertResult;
import com.geoinsights.metacatalog.application.catalog.repository.RecordFilter;
import com.geoinsights.metacatalog.application.catalog.repository.UpdateResult;
import com.geoinsights.metacatalog.application.common.error.CatalogAdminException;
import com.geoinsights.metacatalog.application.common.error.ErrorCodes;
import com.geoinsights.metacatalog.infrastructure.input.document.DecodedDocument;
import com.geoinsights.metacatalog.infrastructure.input.document.DocumentDecoder;
import com.geoinsights.metacatalog.infrastructure.input.document.DocumentSourceScanner;
import com.geoinsights.metacatalog.infrastructure.mapper.RecordExtractionException;
import com.geoinsights.metacatalog.infrastructure.mapper.RecordExtractor;
import com.geoinsights.metacatalog.infrastructure.persistence.r2dbc.row.RecordRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * 문서 파일들을 카탈로그 저장소에 동기화(insert, 충돌 시 선택적 update)하는 서비스입니다.
 * <p>
 * 파일은 입력 순서대로 하나씩 처리하며, 한 파일의 실패는 해당 파일에서 끝나고
 * 배치 전체를 중단시키지 않습니다. 여러 레코드를 묶는 트랜잭션은 사용하지 않습니다.
 */
@Service
public class RecordSyncService {

    private static final Logger log = LoggerFactory.getLogger(RecordSyncService.class);

    private final DocumentSourceScanner scanner;
    private final DocumentDecoder decoder;
    private final RecordExtractor extractor;
    private final CatalogRepository repository;

    /** insert 시각 기준 시계 */
    private final Clock clock;

    public RecordSyncService(
            DocumentSourceScanner scanner,
            DocumentDecoder decoder,
            RecordExtractor extractor,
            CatalogRepository repository,
            Clock clock
    ) {
        this.scanner = scanner;
        this.decoder = decoder;
        this.extractor = extractor;
        this.repository = repository;
        this.clock = clock;
    }

    /**
     * 경로(파일 또는 디렉터리)의 문서를 적재합니다.
     * <p>
     * 경로 존재 여부와 저장소 연결을 먼저 확인하며, 이 단계의 실패는 호출자에게 그대로 전파됩니다.
     *
     * @param path        파일 또는 디렉터리
     * @param recursive   하위 디렉터리 포함 여부
     * @param forceUpdate 식별자 충돌 시 덮어쓸지 여부
     * @return 적재 결과
     * @throws CatalogAdminException 경로가 없는 경우(PATH_NOT_FOUND)
     */
    public Mono<SyncReport> load(Path path, boolean recursive, boolean forceUpdate) {
        if (!Files.exists(path)) {
            return Mono.error(new CatalogAdminException("ERROR: Path does not exist: " + path, ErrorCodes.PATH_NOT_FOUND));
        }

        return repository.count(RecordFilter.all())
                .doOnNext(n -> log.debug("Catalog reachable, {} records stored", n))
                .then(Mono.fromCallable(() -> scan(path, recursive)).subscribeOn(Schedulers.boundedElastic()))
                .flatMap(files -> synchronize(files, forceUpdate))
                .doOnNext(report -> log.info(
                        "Load finished: processed={}, inserted={}, updated={}, skipped={}, failed={}",
                        report.processedFiles().size(),
                        report.count(SyncOutcome.INSERTED),
                        report.count(SyncOutcome.UPDATED),
                        report.skipped(),
                        report.count(SyncOutcome.FAILED_STORAGE)));
    }

    /**
     * 파일 목록을 순서대로 동기화합니다.
     *
     * @param files       파일 목록
     * @param forceUpdate 식별자 충돌 시 덮어쓸지 여부
     * @return 파일별 결과
     */
    public Mono<SyncReport> synchronize(List<Path> files, boolean forceUpdate) {
        int total = files.size();
        return Flux.fromIterable(files)
                .index()
                .concatMap(t -> processFile(t.getT2(), t.getT1() + 1, total, forceUpdate))
                .collectList()
                .map(SyncReport::new);
    }

    private List<Path> scan(Path path, boolean recursive) {
        try {
            return scanner.scan(path, recursive);
        } catch (IOException e) {
            throw new CatalogAdminException("ERROR: Could not read " + path + ": " + e.getMessage(), ErrorCodes.IO_ERROR, e);
        }
    }

    /**
     * 파일 하나: 디코딩 → 추출 → 레코드별 저장.
     */
    private Mono<FileResult> processFile(Path file, long position, int total, boolean forceUpdate) {
        log.info("Processing file {} ({} of {})", file, position, total);

        return Mono.fromCallable(() -> decoder.decode(file))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(doc -> {
                    if (doc instanceof DecodedDocument.Failed failed) {
                        log.error("Skipping {}: {} ({})", file, failed.reason(), failed.kind(), failed.cause());
                        return Mono.just(single(file, SyncOutcome.SKIPPED_DECODE_ERROR));
                    }

                    List<RecordRow> records;
                    try {
                        records = extractor.extract(doc);
                    } catch (RecordExtractionException e) {
                        log.error("Could not extract records from {}: {}", file, e.getMessage(), e);
                        return Mono.just(single(file, SyncOutcome.SKIPPED_EXTRACT_ERROR));
                    }

                    if (records.isEmpty()) {
                        log.warn("No records found in {}", file);
                        return Mono.just(new FileResult(file, List.of()));
                    }

                    return Flux.fromIterable(records)
                            .concatMap(r -> store(r, forceUpdate))
                            .collectList()
                            .map(outcomes -> new FileResult(file, outcomes));
                })
                .onErrorResume(RuntimeException.class, e -> {
                    log.error("Unexpected error processing {}: {}", file, e.toString(), e);
                    return Mono.just(single(file, SyncOutcome.SKIPPED_EXTRACT_ERROR));
                });
    }

    /**
     * insert를 시도하고, 충돌이면 forceUpdate일 때만 update 합니다.
     */
    private Mono<RecordOutcome> store(RecordRow record, boolean forceUpdate) {
        String now = Instant.now(clock).truncatedTo(ChronoUnit.SECONDS).toString();

        return repository.insert(record, RecordRow.LOCAL_SOURCE, now)
                .flatMap(result -> {
                    if (result instanceof InsertResult.Inserted) {
                        log.debug("Inserted {}", record.identifier());
                        return Mono.just(new RecordOutcome(record.identifier(), SyncOutcome.INSERTED));
                    }
                    if (result instanceof InsertResult.Failed failed) {
                        log.error("Could not insert {}: {}", record.identifier(), failed.error().message(),
                                failed.error().cause());
                        return Mono.just(new RecordOutcome(record.identifier(), SyncOutcome.FAILED_STORAGE));
                    }
                    if (!forceUpdate) {
                        log.warn("Skipping {}: record already exists", record.identifier());
                        return Mono.just(new RecordOutcome(record.identifier(), SyncOutcome.SKIPPED_CONFLICT));
                    }
                    return update(record);
                });
    }

    private Mono<RecordOutcome> update(RecordRow record) {
        return repository.update(record)
                .map(result -> {
                    if (result instanceof UpdateResult.Updated) {
                        log.info("Updated existing record {}", record.identifier());
                        return new RecordOutcome(record.identifier(), SyncOutcome.UPDATED);
                    }
                    if (result instanceof UpdateResult.Failed failed) {
                        log.error("Could not update {}: {}", record.identifier(), failed.error().message(),
                                failed.error().cause());
                    } else {
                        log.error("Could not update {}: record disappeared before update", record.identifier());
                    }
                    return new RecordOutcome(record.identifier(), SyncOutcome.FAILED_STORAGE);
                });
    }

    private static FileResult single(Path file, SyncOutcome outcome) {
        return new FileResult(file, List.of(new RecordOutcome(null, outcome)));
    }
}
