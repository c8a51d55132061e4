package com.geoinsights.metacatalog.infrastructure.input.document;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.w3c.dom.Document;
import org.xml.sax.SAXException;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 파일 하나를 읽어 JSON 또는 XML 문서로 디코딩한다.
 *
 * <p>JSON 파싱을 먼저 시도하고, 실패하면 XML로 파싱한다.
 * 어떤 실패도 예외로 던지지 않고 {@link DecodedDocument.Failed}로 돌려준다.</p>
 */
@Component
public class DocumentDecoder {

    private static final Logger log = LoggerFactory.getLogger(DocumentDecoder.class);

    /** JSON 파서 */
    private final ObjectMapper mapper;

    public DocumentDecoder(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * @param file 문서 파일
     * @return Json / Xml / Failed
     */
    public DecodedDocument decode(Path file) {
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(file);
        } catch (Exception e) {
            return new DecodedDocument.Failed(file, DecodedDocument.FailureKind.DECODE_FAILURE,
                    "Could not read " + file + ": " + e, e);
        }
        String text = new String(bytes, StandardCharsets.UTF_8);

        JsonNode tree = readJson(text);
        if (tree != null) {
            return new DecodedDocument.Json(file, tree, text);
        }

        try {
            Document doc = SecureXml.parse(bytes);
            return new DecodedDocument.Xml(file, doc, xmlText(bytes, doc));
        } catch (SAXException e) {
            return new DecodedDocument.Failed(file, DecodedDocument.FailureKind.MALFORMED_DOCUMENT,
                    "XML document is not well-formed: " + e.getMessage(), e);
        } catch (Exception e) {
            return new DecodedDocument.Failed(file, DecodedDocument.FailureKind.DECODE_FAILURE,
                    "Unexpected error decoding " + file + ": " + e, e);
        }
    }

    /**
     * 파서가 실제로 사용한 인코딩으로 원문을 복원한다. 알 수 없으면 UTF-8.
     *
     * @param bytes 원본 바이트
     * @param doc   파싱된 문서
     * @return 원문 텍스트
     */
    private static String xmlText(byte[] bytes, Document doc) {
        String encoding = doc.getInputEncoding();
        if (encoding == null) {
            return new String(bytes, StandardCharsets.UTF_8);
        }
        try {
            return new String(bytes, Charset.forName(encoding));
        } catch (IllegalArgumentException e) {
            log.debug("Unknown input encoding {}, reading as UTF-8", encoding);
            return new String(bytes, StandardCharsets.UTF_8);
        }
    }

    /**
     * JSON으로 파싱되면 트리를, 아니면 null을 반환한다.
     *
     * @param text 문서 텍스트
     * @return JSON 트리 또는 null
     */
    private JsonNode readJson(String text) {
        try {
            JsonNode tree = mapper.readTree(text);
            return tree == null || tree.isMissingNode() ? null : tree;
        } catch (JacksonException e) {
            log.trace("Not a JSON document, falling back to XML: {}", e.getOriginalMessage());
            return null;
        }
    }
}
