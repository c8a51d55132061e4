package com.geoinsights.metacatalog.application.export;

import com.geoinsights.metacatalog.application.catalog.repository.CatalogRepository;
import com.geoinsights.metacatalog.application.catalog.repository.RecordFilter;
import com.geoinsights.metacatalog.application.common.error.CatalogAdminException;
import com.geoinsights.metacatalog.application.common.error.ErrorCodes;
import com.geoinsights.metacatalog.infrastructure.persistence.r2dbc.row.RecordRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import javax.xml.stream.XMLOutputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamWriter;
import java.io.IOException;
import java.io.OutputStream;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * 저장된 레코드마다 GetRepositoryItem URL 하나를 담은 XML sitemap을 생성합니다.
 */
@Service
public class SitemapService {

    private static final Logger log = LoggerFactory.getLogger(SitemapService.class);

    static final String SITEMAP_NS = "http://www.sitemaps.org/schemas/sitemap/0.9";
    static final String XSI_NS = "http://www.w3.org/2001/XMLSchema-instance";
    static final String SCHEMA_LOCATION = SITEMAP_NS + " " + SITEMAP_NS + "/sitemap.xsd";

    private final CatalogRepository repository;

    public SitemapService(CatalogRepository repository) {
        this.repository = repository;
    }

    /**
     * @param serverUrl  서비스 기본 URL
     * @param outputFile 출력 파일
     * @return 기록한 url 항목 수
     */
    public Mono<Long> generate(String serverUrl, Path outputFile) {
        return repository.stream(RecordFilter.all())
                .map(RecordRow::identifier)
                .collectList()
                .flatMap(ids -> Mono.fromCallable(() -> write(serverUrl, outputFile, ids))
                        .subscribeOn(Schedulers.boundedElastic()));
    }

    /** 레코드 하나의 GetRepositoryItem URL */
    static String itemUrl(String serverUrl, String identifier) {
        return serverUrl + "?service=CSW&version=2.0.2&request=GetRepositoryItem&id="
                + URLEncoder.encode(identifier, StandardCharsets.UTF_8);
    }

    private long write(String serverUrl, Path outputFile, List<String> ids) {
        try {
            Path parent = outputFile.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);

            try (OutputStream out = Files.newOutputStream(outputFile)) {
                XMLStreamWriter w = XMLOutputFactory.newInstance().createXMLStreamWriter(out, "UTF-8");
                w.writeStartDocument("UTF-8", "1.0");
                w.writeCharacters("\n");
                w.writeStartElement("urlset");
                w.writeDefaultNamespace(SITEMAP_NS);
                w.writeNamespace("xsi", XSI_NS);
                w.writeAttribute("xsi", XSI_NS, "schemaLocation", SCHEMA_LOCATION);

                for (String id : ids) {
                    w.writeStartElement("url");
                    w.writeStartElement("loc");
                    w.writeCharacters(itemUrl(serverUrl, id));
                    w.writeEndElement();
                    w.writeEndElement();
                }

                w.writeEndElement();
                w.writeEndDocument();
                w.flush();
                w.close();
            }
        } catch (IOException | XMLStreamException e) {
            throw new CatalogAdminException("ERROR: Could not write sitemap " + outputFile + ": " + e.getMessage(),
                    ErrorCodes.IO_ERROR, e);
        }

        log.info("Sitemap with {} entries written to {}", ids.size(), outputFile);
        return (long) ids.size();
    }
}
