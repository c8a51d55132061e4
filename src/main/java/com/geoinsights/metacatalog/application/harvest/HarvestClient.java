package com.geoinsights.metacatalog.application.harvest;

import reactor.core.publisher.Mono;

/**
 * 카탈로그 서비스에 원격 원본의 재수집(Harvest)을 요청하는 클라이언트.
 */
public interface HarvestClient {

    /**
     * @param endpointUrl  요청을 받을 카탈로그 서비스 URL
     * @param source       재수집할 원본 URL
     * @param resourceType 원본 문서 스키마(resource type)
     * @return 서비스 응답 본문
     * @throws RemoteHarvestException (Mono 오류로) 요청이 실패한 경우
     */
    Mono<String> harvest(String endpointUrl, String source, String resourceType);
}
