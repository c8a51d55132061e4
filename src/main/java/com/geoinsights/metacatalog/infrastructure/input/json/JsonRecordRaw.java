package com.geoinsights.metacatalog.infrastructure.input.json;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import tools.jackson.databind.JsonNode;

import java.util.List;

/**
 * OGC API Records GeoJSON 문서(Feature 또는 FeatureCollection)를 매핑하기 위한 원본 DTO입니다.
 * <p>
 * 알 수 없는 필드는 무시하며, FeatureCollection의 각 feature는 원문 보존을 위해 트리 그대로 받습니다.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class JsonRecordRaw {

    public static final String FEATURE = "Feature";
    public static final String FEATURE_COLLECTION = "FeatureCollection";

    /** GeoJSON 타입 (Feature / FeatureCollection) */
    @JsonProperty("type")
    public String type;

    /** 레코드 식별자 */
    @JsonProperty("id")
    public String id;

    /** 서술 속성 */
    @JsonProperty("properties")
    public Properties properties;

    /** 관련 링크 */
    @JsonProperty("links")
    public List<Link> links;

    /** FeatureCollection의 구성 feature들 */
    @JsonProperty("features")
    public List<JsonNode> features;

    /** Feature.properties */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Properties {

        @JsonProperty("title")
        public String title;

        @JsonProperty("description")
        public String description;

        /** 자원 유형 (예: dataset) */
        @JsonProperty("type")
        public String type;

        @JsonProperty("keywords")
        public List<String> keywords;

        @JsonProperty("language")
        public String language;

        /** 마지막 수정 시각 */
        @JsonProperty("updated")
        public String updated;
    }

    /** links 배열의 원소 */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Link {

        @JsonProperty("href")
        public String href;

        @JsonProperty("rel")
        public String rel;
    }
}
