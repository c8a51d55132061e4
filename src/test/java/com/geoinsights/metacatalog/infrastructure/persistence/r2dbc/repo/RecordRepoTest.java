package com.geoinsights.metacatalog.infrastructure.persistence.r2dbc.repo;

import com.geoinsights.metacatalog.application.catalog.repository.InsertResult;
import com.geoinsights.metacatalog.application.catalog.repository.RecordFilter;
import com.geoinsights.metacatalog.application.catalog.repository.UpdateResult;
import com.geoinsights.metacatalog.infrastructure.persistence.r2dbc.row.RecordRow;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.test.context.ActiveProfiles;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * {@link RecordRepo} 통합 테스트.
 *
 * <p>insert/충돌 판별, update 시 출처·insert 시각 보존, 조건 조회/삭제/건수 동작을 검증한다.</p>
 */
@DisplayName("record repo 테스트")
@SpringBootTest
@ActiveProfiles("test")
class RecordRepoTest {

    @Autowired
    RecordRepo repo;
    @Autowired
    DatabaseClient db;

    /**
     * 각 테스트 실행 전 레코드 테이블을 비운다.
     */
    @BeforeEach
    void clean() {
        StepVerifier.create(db.sql("DELETE FROM records").fetch().rowsUpdated())
                .expectNextCount(1).verifyComplete();
    }

    static RecordRow record(String id, String title) {
        return new RecordRow(id, "csw:Record", "http://www.opengis.net/cat/csw/2.0.2",
                null, null, "<csw:Record>" + title + "</csw:Record>", RecordRow.XML_CONTENT_TYPE,
                title, null, "en", title, null, null, null, null, null, null);
    }

    @DisplayName("신규 식별자는 Inserted, 출처와 insert 시각이 저장됨")
    @Test
    void insert_new() {
        StepVerifier.create(repo.insert(record("a", "t1"), "local", "2024-01-01T00:00:00Z"))
                .expectNext(new InsertResult.Inserted("a"))
                .verifyComplete();

        StepVerifier.create(repo.findByIdentifier("a"))
                .assertNext(r -> {
                    assertThat(r.metadataSource()).isEqualTo("local");
                    assertThat(r.insertDate()).isEqualTo("2024-01-01T00:00:00Z");
                    assertThat(r.title()).isEqualTo("t1");
                    assertThat(r.abstractText()).isNull();
                })
                .verifyComplete();
    }

    @DisplayName("같은 식별자를 다시 insert하면 Conflict, 기존 행은 그대로")
    @Test
    void insert_duplicate_conflict() {
        StepVerifier.create(repo.insert(record("a", "t1"), "local", "2024-01-01T00:00:00Z"))
                .expectNextCount(1).verifyComplete();

        StepVerifier.create(repo.insert(record("a", "t2"), "local", "2024-02-02T00:00:00Z"))
                .expectNext(new InsertResult.Conflict("a"))
                .verifyComplete();

        StepVerifier.create(repo.findByIdentifier("a").map(RecordRow::title))
                .expectNext("t1").verifyComplete();
    }

    @DisplayName("중복 외 저장 오류는 Failed로 DB 메시지를 전달")
    @Test
    void insert_otherError_failed() {
        RecordRow tooLong = new RecordRow("b", "x".repeat(200), "s", null, null, "<a/>",
                RecordRow.XML_CONTENT_TYPE, null, null, null, null, null, null, null, null, null, null);

        StepVerifier.create(repo.insert(tooLong, "local", "2024-01-01T00:00:00Z"))
                .assertNext(res -> {
                    assertThat(res).isInstanceOf(InsertResult.Failed.class);
                    assertThat(((InsertResult.Failed) res).error().message()).isNotBlank();
                })
                .verifyComplete();
    }

    @DisplayName("update는 내용만 바꾸고 mdsource/insert_date는 보존")
    @Test
    void update_preservesProvenance() {
        StepVerifier.create(repo.insert(record("a", "t1"), "http://remote/csw", "2024-01-01T00:00:00Z"))
                .expectNextCount(1).verifyComplete();

        StepVerifier.create(repo.update(record("a", "t2").withProvenance("local", "2030-01-01T00:00:00Z")))
                .expectNext(new UpdateResult.Updated("a"))
                .verifyComplete();

        StepVerifier.create(repo.findByIdentifier("a"))
                .assertNext(r -> {
                    assertThat(r.title()).isEqualTo("t2");
                    assertThat(r.rawDocument()).contains("t2");
                    assertThat(r.metadataSource()).isEqualTo("http://remote/csw");
                    assertThat(r.insertDate()).isEqualTo("2024-01-01T00:00:00Z");
                })
                .verifyComplete();
    }

    @DisplayName("없는 식별자 update는 NotFound")
    @Test
    void update_missing_notFound() {
        StepVerifier.create(repo.update(record("zz", "t")))
                .expectNext(new UpdateResult.NotFound("zz"))
                .verifyComplete();
    }

    @DisplayName("nonLocal 조회는 하베스트 레코드만, 식별자 순, maxResults 제한")
    @Test
    void query_nonLocal() {
        StepVerifier.create(repo.insert(record("c", "t"), "http://h1", "2024-01-01T00:00:00Z")
                        .then(repo.insert(record("a", "t"), "local", "2024-01-01T00:00:00Z"))
                        .then(repo.insert(record("b", "t"), "http://h2", "2024-01-01T00:00:00Z"))
                        .then(repo.insert(record("d", "t"), "http://h3", "2024-01-01T00:00:00Z")))
                .expectNextCount(1).verifyComplete();

        StepVerifier.create(repo.query(RecordFilter.nonLocal(), 2))
                .assertNext(page -> {
                    assertThat(page.matched()).isEqualTo(3);
                    assertThat(page.records()).extracting(RecordRow::identifier).containsExactly("b", "c");
                })
                .verifyComplete();
    }

    @DisplayName("stream은 전체를 식별자 순으로, delete(all)은 전부 삭제")
    @Test
    void stream_and_deleteAll() {
        StepVerifier.create(repo.insert(record("b", "t"), "local", "2024-01-01T00:00:00Z")
                        .then(repo.insert(record("a", "t"), "http://h", "2024-01-01T00:00:00Z")))
                .expectNextCount(1).verifyComplete();

        StepVerifier.create(repo.stream(RecordFilter.all()).map(RecordRow::identifier))
                .expectNext("a", "b")
                .verifyComplete();

        StepVerifier.create(repo.delete(RecordFilter.all()))
                .expectNext(2L).verifyComplete();
        StepVerifier.create(repo.count(RecordFilter.all()))
                .expectNext(0L).verifyComplete();
    }

    @DisplayName("식별자 단건 삭제")
    @Test
    void delete_byIdentifier() {
        StepVerifier.create(repo.insert(record("a", "t"), "local", "2024-01-01T00:00:00Z")
                        .then(repo.insert(record("b", "t"), "local", "2024-01-01T00:00:00Z")))
                .expectNextCount(1).verifyComplete();

        StepVerifier.create(repo.delete(RecordFilter.identifier("a")))
                .expectNext(1L).verifyComplete();
        StepVerifier.create(repo.count(RecordFilter.source("local")))
                .expectNext(1L).verifyComplete();
        StepVerifier.create(repo.findByIdentifier("a"))
                .verifyComplete();
    }
}
