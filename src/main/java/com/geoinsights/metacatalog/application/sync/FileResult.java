package com.geoinsights.metacatalog.application.sync;

import java.nio.file.Path;
import java.util.List;

/**
 * 파일 하나의 적재 결과.
 *
 * @param path     파일 경로
 * @param outcomes 레코드별 결과 (파일 단위 실패면 식별자 없는 결과 하나)
 */
public record FileResult(Path path, List<RecordOutcome> outcomes) {

    /**
     * 레코드가 하나 이상 나왔고 모두 저장(INSERTED/UPDATED)된 경우에만 처리 완료로 본다.
     */
    public boolean processed() {
        return !outcomes.isEmpty()
                && outcomes.stream().allMatch(o -> o.outcome().isStored());
    }
}
