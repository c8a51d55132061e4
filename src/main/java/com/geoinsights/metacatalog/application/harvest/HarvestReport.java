package com.geoinsights.metacatalog.application.harvest;

/**
 * 하베스트 갱신 결과.
 *
 * @param requested 요청 건수
 * @param succeeded 성공 건수
 * @param failed    실패 건수
 */
public record HarvestReport(int requested, int succeeded, int failed) {

    public static HarvestReport empty() {
        return new HarvestReport(0, 0, 0);
    }
}
