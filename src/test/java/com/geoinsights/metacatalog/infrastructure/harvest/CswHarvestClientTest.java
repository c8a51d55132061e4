package com.geoinsights.metacatalog.infrastructure.harvest;

import com.geoinsights.metacatalog.application.harvest.RemoteHarvestException;
import com.geoinsights.metacatalog.config.CatalogProperties;
import com.geoinsights.metacatalog.infrastructure.input.document.SecureXml;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.w3c.dom.Document;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * {@link CswHarvestClient} 단위 테스트.
 *
 * <p>WebClient의 ExchangeFunction을 스텁으로 바꿔 네트워크 없이 요청/응답 처리를 검증한다.</p>
 */
@DisplayName("CSW Harvest 클라이언트 테스트")
class CswHarvestClientTest {

    static CatalogProperties props(Duration timeout) {
        return new CatalogProperties(
                new CatalogProperties.Repository("records", CatalogProperties.Dialect.H2),
                new CatalogProperties.Server("http://localhost:8000/csw"),
                new CatalogProperties.Harvest(timeout));
    }

    static CswHarvestClient client(HttpStatus status, String body, AtomicReference<ClientRequest> captured) {
        WebClient webClient = WebClient.builder()
                .exchangeFunction(req -> {
                    captured.set(req);
                    return Mono.just(ClientResponse.create(status)
                            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_XML_VALUE)
                            .body(body)
                            .build());
                })
                .build();
        return new CswHarvestClient(webClient, props(Duration.ofSeconds(5)));
    }

    @DisplayName("성공 응답은 본문을 그대로 반환, XML POST로 전송")
    @Test
    void harvest_success() {
        AtomicReference<ClientRequest> captured = new AtomicReference<>();
        CswHarvestClient client = client(HttpStatus.OK, "<csw:HarvestResponse/>", captured);

        StepVerifier.create(client.harvest("http://localhost:8000/csw", "http://src/csw",
                        "http://www.opengis.net/cat/csw/2.0.2"))
                .expectNext("<csw:HarvestResponse/>")
                .verifyComplete();

        assertThat(captured.get().method()).isEqualTo(HttpMethod.POST);
        assertThat(captured.get().url().toString()).isEqualTo("http://localhost:8000/csw");
        assertThat(captured.get().headers().getContentType()).isEqualTo(MediaType.APPLICATION_XML);
    }

    @DisplayName("ows:ExceptionReport 응답은 RemoteHarvestException")
    @Test
    void harvest_exceptionReport() {
        String report = "<ows:ExceptionReport xmlns:ows=\"http://www.opengis.net/ows\" version=\"1.0.0\">"
                + "<ows:Exception exceptionCode=\"NoApplicableCode\">"
                + "<ows:ExceptionText>Harvest failed: source unreachable</ows:ExceptionText>"
                + "</ows:Exception></ows:ExceptionReport>";
        CswHarvestClient client = client(HttpStatus.OK, report, new AtomicReference<>());

        StepVerifier.create(client.harvest("http://localhost:8000/csw", "http://src/csw", "x"))
                .expectErrorSatisfies(e -> {
                    assertThat(e).isInstanceOf(RemoteHarvestException.class);
                    assertThat(e.getMessage()).contains("source unreachable");
                })
                .verify();
    }

    @DisplayName("2xx가 아닌 응답은 RemoteHarvestException")
    @Test
    void harvest_httpError() {
        CswHarvestClient client = client(HttpStatus.INTERNAL_SERVER_ERROR, "oops", new AtomicReference<>());

        StepVerifier.create(client.harvest("http://localhost:8000/csw", "http://src/csw", "x"))
                .expectError(RemoteHarvestException.class)
                .verify();
    }

    @DisplayName("타임아웃은 RemoteHarvestException")
    @Test
    void harvest_timeout() {
        WebClient webClient = WebClient.builder()
                .exchangeFunction(req -> Mono.never())
                .build();
        CswHarvestClient client = new CswHarvestClient(webClient, props(Duration.ofMillis(100)));

        StepVerifier.create(client.harvest("http://localhost:8000/csw", "http://src/csw", "x"))
                .expectError(RemoteHarvestException.class)
                .verify(Duration.ofSeconds(5));
    }

    @DisplayName("Harvest 요청 문서는 Source/ResourceType/ResourceFormat을 담고 특수문자를 이스케이프")
    @Test
    void harvestRequest_document() throws Exception {
        String xml = CswHarvestClient.harvestRequest("http://src/csw?a=1&b=2", "http://www.isotc211.org/schemas/2005/gmd/");

        Document doc = SecureXml.parse(xml.getBytes(StandardCharsets.UTF_8));
        assertThat(doc.getDocumentElement().getLocalName()).isEqualTo("Harvest");
        assertThat(doc.getDocumentElement().getNamespaceURI()).isEqualTo(CswHarvestClient.CSW_NS);
        assertThat(doc.getDocumentElement().getAttribute("service")).isEqualTo("CSW");
        assertThat(doc.getElementsByTagNameNS(CswHarvestClient.CSW_NS, "Source").item(0).getTextContent())
                .isEqualTo("http://src/csw?a=1&b=2");
        assertThat(doc.getElementsByTagNameNS(CswHarvestClient.CSW_NS, "ResourceType").item(0).getTextContent())
                .isEqualTo("http://www.isotc211.org/schemas/2005/gmd/");
        assertThat(doc.getElementsByTagNameNS(CswHarvestClient.CSW_NS, "ResourceFormat").item(0).getTextContent())
                .isEqualTo("application/xml");
    }
}
