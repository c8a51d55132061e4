package com.geoinsights.metacatalog.infrastructure.harvest;

import com.geoinsights.metacatalog.application.harvest.HarvestClient;
import com.geoinsights.metacatalog.application.harvest.RemoteHarvestException;
import com.geoinsights.metacatalog.config.CatalogProperties;
import com.geoinsights.metacatalog.infrastructure.input.document.SecureXml;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;
import reactor.core.publisher.Mono;

import javax.xml.stream.XMLOutputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * CSW 2.0.2 {@code Harvest} 요청을 POST로 보내는 {@link HarvestClient} 구현체입니다.
 * <p>
 * 2xx가 아닌 응답, 시간 초과, {@code ows:ExceptionReport} 응답은 모두 {@link RemoteHarvestException}으로 처리합니다.
 */
@Component
public class CswHarvestClient implements HarvestClient {

    private static final Logger log = LoggerFactory.getLogger(CswHarvestClient.class);

    static final String CSW_NS = "http://www.opengis.net/cat/csw/2.0.2";
    static final String OWS_NS = "http://www.opengis.net/ows";
    static final String RESOURCE_FORMAT = "application/xml";

    private final WebClient webClient;

    /** 요청 하나의 최대 대기 시간 */
    private final Duration timeout;

    public CswHarvestClient(WebClient webClient, CatalogProperties props) {
        this.webClient = webClient;
        this.timeout = props.harvest().timeout();
    }

    @Override
    public Mono<String> harvest(String endpointUrl, String source, String resourceType) {
        String body;
        try {
            body = harvestRequest(source, resourceType);
        } catch (XMLStreamException e) {
            return Mono.error(new RemoteHarvestException("Could not build Harvest request for " + source, e));
        }

        return webClient.post()
                .uri(endpointUrl)
                .contentType(MediaType.APPLICATION_XML)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(String.class)
                .defaultIfEmpty("")
                .timeout(timeout)
                .flatMap(response -> {
                    String error = exceptionText(response);
                    return error == null
                            ? Mono.just(response)
                            : Mono.<String>error(new RemoteHarvestException("Harvest of " + source + " rejected: " + error));
                })
                .onErrorMap(e -> !(e instanceof RemoteHarvestException),
                        e -> new RemoteHarvestException("Harvest request to " + endpointUrl + " failed: " + e.getMessage(), e));
    }

    /**
     * {@code csw:Harvest} 요청 문서를 만든다.
     */
    static String harvestRequest(String source, String resourceType) throws XMLStreamException {
        StringWriter out = new StringWriter();
        XMLStreamWriter w = XMLOutputFactory.newInstance().createXMLStreamWriter(out);

        w.writeStartDocument(StandardCharsets.UTF_8.name(), "1.0");
        w.writeStartElement("csw", "Harvest", CSW_NS);
        w.writeNamespace("csw", CSW_NS);
        w.writeAttribute("service", "CSW");
        w.writeAttribute("version", "2.0.2");

        element(w, "Source", source);
        element(w, "ResourceType", resourceType);
        element(w, "ResourceFormat", RESOURCE_FORMAT);

        w.writeEndElement();
        w.writeEndDocument();
        w.close();
        return out.toString();
    }

    private static void element(XMLStreamWriter w, String name, String text) throws XMLStreamException {
        w.writeStartElement("csw", name, CSW_NS);
        w.writeCharacters(text == null ? "" : text);
        w.writeEndElement();
    }

    /**
     * 응답이 {@code ows:ExceptionReport}면 예외 메시지를, 아니면 null을 반환한다.
     */
    static String exceptionText(String response) {
        if (response == null || !response.contains("ExceptionReport")) {
            return null;
        }
        try {
            Document doc = SecureXml.parse(response.getBytes(StandardCharsets.UTF_8));
            Element root = doc.getDocumentElement();
            if (!"ExceptionReport".equals(root.getLocalName())) {
                return null;
            }
            NodeList texts = root.getElementsByTagNameNS(OWS_NS, "ExceptionText");
            return texts.getLength() > 0 ? texts.item(0).getTextContent().trim() : "ExceptionReport";
        } catch (Exception e) {
            log.debug("Harvest response is not parseable XML: {}", e.toString());
            return null;
        }
    }
}
