package com.geoinsights.metacatalog.application.harvest;

import com.geoinsights.metacatalog.application.catalog.repository.CatalogRepository;
import com.geoinsights.metacatalog.application.catalog.repository.RecordFilter;
import com.geoinsights.metacatalog.application.catalog.repository.RecordPage;
import com.geoinsights.metacatalog.infrastructure.persistence.r2dbc.row.RecordRow;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * {@link HarvestRefreshService} 단위 테스트.
 */
@DisplayName("하베스트 갱신 테스트")
class HarvestRefreshServiceTest {

    static final String ENDPOINT = "http://localhost:8000/csw";

    CatalogRepository repository;
    HarvestClient client;
    HarvestRefreshService service;

    @BeforeEach
    void setUp() {
        repository = mock(CatalogRepository.class);
        client = mock(HarvestClient.class);
        service = new HarvestRefreshService(repository, client);
    }

    static RecordRow harvested(String id, String source, String schema) {
        return new RecordRow(id, "csw:Record", schema, source, "2024-01-01T00:00:00Z", "<a/>",
                RecordRow.XML_CONTENT_TYPE, null, null, null, null, null, null, null, null, null, null);
    }

    @DisplayName("하베스트된 레코드가 없으면 원격 호출 없이 빈 결과")
    @Test
    void refresh_noHarvested_noRemoteCall() {
        when(repository.query(any(), anyInt())).thenReturn(Mono.just(new RecordPage(0, List.of())));

        StepVerifier.create(service.refreshHarvested(ENDPOINT))
                .expectNext(HarvestReport.empty())
                .verifyComplete();

        verify(repository).query(eq(RecordFilter.nonLocal()), anyInt());
        verifyNoInteractions(client);
    }

    @DisplayName("중간 실패가 있어도 나머지를 순서대로 요청하고 건수를 집계")
    @Test
    void refresh_continuesAfterFailure() {
        when(repository.query(any(), anyInt())).thenReturn(Mono.just(new RecordPage(3, List.of(
                harvested("a", "http://s1/csw", "http://www.opengis.net/cat/csw/2.0.2"),
                harvested("b", "http://s2/csw", "http://www.opengis.net/cat/csw/2.0.2"),
                harvested("c", "http://s3/csw", "http://www.opengis.net/cat/csw/2.0.2")))));
        when(client.harvest(anyString(), anyString(), anyString())).thenReturn(Mono.just("<ok/>"));
        when(client.harvest(anyString(), eq("http://s2/csw"), anyString()))
                .thenReturn(Mono.error(new RemoteHarvestException("boom")));

        StepVerifier.create(service.refreshHarvested(ENDPOINT))
                .expectNext(new HarvestReport(3, 2, 1))
                .verifyComplete();

        InOrder inOrder = inOrder(client);
        inOrder.verify(client).harvest(eq(ENDPOINT), eq("http://s1/csw"), anyString());
        inOrder.verify(client).harvest(eq(ENDPOINT), eq("http://s2/csw"), anyString());
        inOrder.verify(client).harvest(eq(ENDPOINT), eq("http://s3/csw"), anyString());
    }

    @DisplayName("ISO 19139 네임스페이스는 스키마 위치 URL로 바꿔 요청")
    @Test
    void refresh_normalizesIsoSchema() {
        when(repository.query(any(), anyInt())).thenReturn(Mono.just(new RecordPage(1, List.of(
                harvested("iso", "http://s/iso.xml", "http://www.isotc211.org/2005/gmd")))));
        when(client.harvest(anyString(), anyString(), anyString())).thenReturn(Mono.just(""));

        StepVerifier.create(service.refreshHarvested(ENDPOINT))
                .expectNext(new HarvestReport(1, 1, 0))
                .verifyComplete();

        verify(client).harvest(ENDPOINT, "http://s/iso.xml", "http://www.isotc211.org/schemas/2005/gmd/");
    }
}
