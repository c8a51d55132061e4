package com.geoinsights.metacatalog.infrastructure.persistence.r2dbc.repo;

import com.geoinsights.metacatalog.application.catalog.repository.CatalogRepository;
import com.geoinsights.metacatalog.application.catalog.repository.InsertResult;
import com.geoinsights.metacatalog.application.catalog.repository.RecordFilter;
import com.geoinsights.metacatalog.application.catalog.repository.RecordPage;
import com.geoinsights.metacatalog.application.catalog.repository.StorageError;
import com.geoinsights.metacatalog.application.catalog.repository.UpdateResult;
import com.geoinsights.metacatalog.config.CatalogProperties;
import com.geoinsights.metacatalog.infrastructure.persistence.r2dbc.TableSqlSupport;
import com.geoinsights.metacatalog.infrastructure.persistence.r2dbc.row.RecordRow;
import io.r2dbc.spi.Row;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * 레코드 테이블에 대한 insert/update/delete/조회 기능을 제공하는 Repository입니다.
 * <p>
 * 식별자 중복은 드라이버 오류 코드를 Spring이 변환한 {@link DuplicateKeyException}으로만 판별하며,
 * 오류 메시지 문자열은 검사하지 않습니다.
 */
@Component
public class RecordRepo extends TableSqlSupport implements CatalogRepository {

    private static final String COLUMNS = """
            identifier, typename, schema_uri, mdsource, insert_date,
            xml, metadata_type, anytext, metadata, language,
            title, abstract, keywords, resource_type, date_modified,
            wkt_geometry, links""";

    /**
     * @param db    R2DBC DatabaseClient
     * @param props 카탈로그 설정(테이블명)
     */
    public RecordRepo(DatabaseClient db, CatalogProperties props) {
        super(db, props.repository().table());
    }

    @Override
    public Mono<InsertResult> insert(RecordRow row, String source, String insertDate) {
        RecordRow r = row.withProvenance(source, insertDate);

        String sql = """
            INSERT INTO %s (%s) VALUES (
              :identifier, :typename, :schema_uri, :mdsource, :insert_date,
              :xml, :metadata_type, :anytext, :metadata, :language,
              :title, :abstract, :keywords, :resource_type, :date_modified,
              :wkt_geometry, :links
            )
        """.formatted(table, COLUMNS);

        DatabaseClient.GenericExecuteSpec spec = db.sql(sql)
                .bind("identifier", r.identifier())
                .bind("mdsource", r.metadataSource())
                .bind("insert_date", r.insertDate());
        spec = bindContent(spec, r);

        return spec.fetch().rowsUpdated()
                .<InsertResult>map(n -> new InsertResult.Inserted(r.identifier()))
                .onErrorResume(DuplicateKeyException.class,
                        e -> Mono.just(new InsertResult.Conflict(r.identifier())))
                .onErrorResume(DataAccessException.class,
                        e -> Mono.just(new InsertResult.Failed(r.identifier(), StorageError.of(e))));
    }

    @Override
    public Mono<UpdateResult> update(RecordRow row) {
        String sql = """
            UPDATE %s SET
              typename = :typename,
              schema_uri = :schema_uri,
              xml = :xml,
              metadata_type = :metadata_type,
              anytext = :anytext,
              metadata = :metadata,
              language = :language,
              title = :title,
              abstract = :abstract,
              keywords = :keywords,
              resource_type = :resource_type,
              date_modified = :date_modified,
              wkt_geometry = :wkt_geometry,
              links = :links
            WHERE identifier = :identifier
        """.formatted(table);

        DatabaseClient.GenericExecuteSpec spec = db.sql(sql).bind("identifier", row.identifier());
        spec = bindContent(spec, row);

        return spec.fetch().rowsUpdated()
                .<UpdateResult>map(n -> n > 0
                        ? new UpdateResult.Updated(row.identifier())
                        : new UpdateResult.NotFound(row.identifier()))
                .onErrorResume(DataAccessException.class,
                        e -> Mono.just(new UpdateResult.Failed(row.identifier(), StorageError.of(e))));
    }

    @Override
    public Mono<Long> delete(RecordFilter filter) {
        DatabaseClient.GenericExecuteSpec spec = db.sql("DELETE FROM " + table + whereClause(filter));
        return bindFilter(spec, filter).fetch().rowsUpdated();
    }

    @Override
    public Mono<RecordPage> query(RecordFilter filter, int maxResults) {
        String sql = "SELECT " + COLUMNS + " FROM " + table + whereClause(filter)
                + " ORDER BY identifier LIMIT :limit";

        Mono<List<RecordRow>> records = bindFilter(db.sql(sql), filter)
                .bind("limit", maxResults)
                .map((row, meta) -> toRecord(row))
                .all()
                .collectList();

        return count(filter).zipWith(records, RecordPage::new);
    }

    @Override
    public Flux<RecordRow> stream(RecordFilter filter) {
        String sql = "SELECT " + COLUMNS + " FROM " + table + whereClause(filter) + " ORDER BY identifier";
        return bindFilter(db.sql(sql), filter)
                .map((row, meta) -> toRecord(row))
                .all();
    }

    @Override
    public Mono<Long> count(RecordFilter filter) {
        String sql = "SELECT COUNT(*) AS c FROM " + table + whereClause(filter);
        return bindFilter(db.sql(sql), filter)
                .map((row, meta) -> row.get("c", Long.class))
                .one()
                .defaultIfEmpty(0L);
    }

    @Override
    public Mono<RecordRow> findByIdentifier(String identifier) {
        RecordFilter filter = RecordFilter.identifier(identifier);
        String sql = "SELECT " + COLUMNS + " FROM " + table + whereClause(filter);
        return bindFilter(db.sql(sql), filter)
                .map((row, meta) -> toRecord(row))
                .one();
    }

    /**
     * insert/update 공통 내용 컬럼을 바인딩합니다.
     *
     * @param spec 바인딩 대상 spec
     * @param r    레코드
     * @return 바인딩이 적용된 spec
     */
    private DatabaseClient.GenericExecuteSpec bindContent(DatabaseClient.GenericExecuteSpec spec, RecordRow r) {
        spec = spec.bind("typename", r.typeName())
                .bind("schema_uri", r.schemaUri())
                .bind("xml", r.rawDocument());

        spec = bindOrNull(spec, "metadata_type", r.contentType(), String.class);
        spec = bindOrNull(spec, "anytext", r.anyText(), String.class);
        spec = bindOrNull(spec, "metadata", r.metadata(), String.class);
        spec = bindOrNull(spec, "language", r.language(), String.class);
        spec = bindOrNull(spec, "title", r.title(), String.class);
        spec = bindOrNull(spec, "abstract", r.abstractText(), String.class);
        spec = bindOrNull(spec, "keywords", r.keywords(), String.class);
        spec = bindOrNull(spec, "resource_type", r.resourceType(), String.class);
        spec = bindOrNull(spec, "date_modified", r.dateModified(), String.class);
        spec = bindOrNull(spec, "wkt_geometry", r.wktGeometry(), String.class);
        spec = bindOrNull(spec, "links", r.links(), String.class);
        return spec;
    }

    private RecordRow toRecord(Row row) {
        return new RecordRow(
                row.get("identifier", String.class),
                row.get("typename", String.class),
                row.get("schema_uri", String.class),
                row.get("mdsource", String.class),
                row.get("insert_date", String.class),
                row.get("xml", String.class),
                row.get("metadata_type", String.class),
                row.get("anytext", String.class),
                row.get("metadata", String.class),
                row.get("language", String.class),
                row.get("title", String.class),
                row.get("abstract", String.class),
                row.get("keywords", String.class),
                row.get("resource_type", String.class),
                row.get("date_modified", String.class),
                row.get("wkt_geometry", String.class),
                row.get("links", String.class)
        );
    }
}
