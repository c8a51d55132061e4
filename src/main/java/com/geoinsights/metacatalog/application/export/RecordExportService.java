package com.geoinsights.metacatalog.application.export;

import com.geoinsights.metacatalog.application.catalog.repository.CatalogRepository;
import com.geoinsights.metacatalog.application.catalog.repository.RecordFilter;
import com.geoinsights.metacatalog.application.common.error.CatalogAdminException;
import com.geoinsights.metacatalog.application.common.error.ErrorCodes;
import com.geoinsights.metacatalog.infrastructure.persistence.r2dbc.row.RecordRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

import static com.geoinsights.metacatalog.infrastructure.input.document.FileNameUtils.declaredCharset;
import static com.geoinsights.metacatalog.infrastructure.input.document.FileNameUtils.secureFilename;
import static com.geoinsights.metacatalog.infrastructure.input.document.FileNameUtils.sha256Hex;
import static com.geoinsights.metacatalog.infrastructure.input.document.FileNameUtils.withXmlDeclaration;

/**
 * 저장된 모든 레코드를 레코드당 파일 하나로 내보내는 서비스입니다.
 * <p>
 * 파일명은 식별자를 안전한 이름으로 바꾼 값이며 출력 디렉터리를 벗어나지 않습니다.
 * 레코드 하나의 쓰기 실패는 로그를 남기고 다음 레코드로 넘어갑니다.
 */
@Service
public class RecordExportService {

    private static final Logger log = LoggerFactory.getLogger(RecordExportService.class);

    private final CatalogRepository repository;

    public RecordExportService(CatalogRepository repository) {
        this.repository = repository;
    }

    /**
     * @param outputDir 출력 디렉터리 (없으면 생성)
     * @return 완전히 기록된 파일 경로 집합
     * @throws CatalogAdminException 출력 디렉터리를 만들 수 없는 경우(EXPORT_DIR_UNAVAILABLE)
     */
    public Mono<Set<Path>> export(Path outputDir) {
        return Mono.fromCallable(() -> prepare(outputDir))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(dir -> {
                    Set<Path> written = new LinkedHashSet<>();
                    return repository.stream(RecordFilter.all())
                            .<Path>concatMap(r -> Mono.fromCallable(() -> write(dir, r, written))
                                    .subscribeOn(Schedulers.boundedElastic()))
                            .doOnNext(written::add)
                            .then(Mono.fromSupplier(() -> written));
                })
                .map(written -> {
                    log.info("Exported {} records to {}", written.size(), outputDir);
                    return written;
                });
    }

    private Path prepare(Path outputDir) {
        try {
            return Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new CatalogAdminException("ERROR: Could not create output directory " + outputDir + ": " + e,
                    ErrorCodes.EXPORT_DIR_UNAVAILABLE, e);
        }
    }

    /**
     * 레코드 하나를 기록합니다. 실패하면 부분 파일을 지우고 null(= 결과 제외)을 반환합니다.
     * <p>
     * XML은 선언된 encoding으로 기록하고, 선언이 없으면 UTF-8 선언을 붙여 UTF-8로 기록합니다.
     *
     * @param written 이번 내보내기에서 이미 기록한 파일 (파일명 충돌 판정용)
     */
    private Path write(Path dir, RecordRow record, Set<Path> written) {
        Path target = target(dir, record, written);

        String raw = Objects.toString(record.rawDocument(), "");
        String content = record.isJson() ? raw : withXmlDeclaration(raw);
        Charset charset = record.isJson() ? StandardCharsets.UTF_8 : declaredCharset(content);

        log.info("Processing {}", record.identifier());
        try {
            Files.writeString(target, content, charset);
            return target;
        } catch (IOException e) {
            log.error("Error writing {} to disk: {}", record.identifier(), e.toString(), e);
            try {
                Files.deleteIfExists(target);
            } catch (IOException cleanup) {
                log.warn("Could not remove partial file {}: {}", target, cleanup.toString());
            }
            return null;
        }
    }

    /**
     * 안전한 파일명 경로. 다른 식별자가 같은 이름으로 바뀐 경우 식별자 해시 앞 8자리를 붙입니다.
     */
    private static Path target(Path dir, RecordRow record, Set<Path> written) {
        String ext = record.isJson() ? "json" : "xml";
        String name = secureFilename(record.identifier());
        Path target = dir.resolve(name + "." + ext);
        if (!written.contains(target)) {
            return target;
        }
        Path renamed = dir.resolve(name + "_" + sha256Hex(record.identifier()).substring(0, 8) + "." + ext);
        log.warn("File name {} already used in this export, writing {} to {}",
                target.getFileName(), record.identifier(), renamed.getFileName());
        return renamed;
    }
}
