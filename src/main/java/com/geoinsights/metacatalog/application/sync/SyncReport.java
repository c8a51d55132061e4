package com.geoinsights.metacatalog.application.sync;

import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 적재 배치 결과. 저장되지 않고 호출자에게 반환/로그로만 남는다.
 *
 * @param files 입력 순서대로의 파일별 결과
 */
public record SyncReport(List<FileResult> files) {

    /** 완전히 처리된 파일 집합 (입력 순서 유지) */
    public Set<Path> processedFiles() {
        return files.stream()
                .filter(FileResult::processed)
                .map(FileResult::path)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    /** 특정 결과의 레코드(또는 파일) 건수 */
    public long count(SyncOutcome outcome) {
        return files.stream()
                .flatMap(f -> f.outcomes().stream())
                .filter(o -> o.outcome() == outcome)
                .count();
    }

    /** 건너뛴 건수 (디코딩/추출 실패, 충돌) */
    public long skipped() {
        return count(SyncOutcome.SKIPPED_DECODE_ERROR)
                + count(SyncOutcome.SKIPPED_EXTRACT_ERROR)
                + count(SyncOutcome.SKIPPED_CONFLICT);
    }
}
