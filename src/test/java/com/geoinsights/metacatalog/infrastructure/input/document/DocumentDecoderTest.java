package com.geoinsights.metacatalog.infrastructure.input.document;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import tools.jackson.databind.json.JsonMapper;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * {@link DocumentDecoder} 단위 테스트.
 *
 * <p>JSON 우선 파싱, XML 폴백, 실패 분류(MALFORMED_DOCUMENT / DECODE_FAILURE)를 검증한다.</p>
 */
@DisplayName("문서 디코딩 테스트")
class DocumentDecoderTest {

    private final DocumentDecoder decoder = new DocumentDecoder(JsonMapper.builder().build());

    @TempDir
    Path dir;

    @DisplayName("JSON 객체는 Json으로 디코딩되고 원문을 보존")
    @Test
    void decode_json() throws Exception {
        String text = "{\"id\":\"a\",\"type\":\"Feature\"}";
        Path f = Files.writeString(dir.resolve("a.json"), text);

        DecodedDocument doc = decoder.decode(f);

        assertThat(doc).isInstanceOf(DecodedDocument.Json.class);
        DecodedDocument.Json json = (DecodedDocument.Json) doc;
        assertThat(json.text()).isEqualTo(text);
        assertThat(json.tree().isObject()).isTrue();
    }

    @DisplayName("JSON이 아니면 XML로 디코딩 (네임스페이스 인식)")
    @Test
    void decode_xml() throws Exception {
        Path f = Files.writeString(dir.resolve("a.xml"),
                "<csw:Record xmlns:csw=\"http://www.opengis.net/cat/csw/2.0.2\"/>");

        DecodedDocument doc = decoder.decode(f);

        assertThat(doc).isInstanceOf(DecodedDocument.Xml.class);
        DecodedDocument.Xml xml = (DecodedDocument.Xml) doc;
        assertThat(xml.document().getDocumentElement().getLocalName()).isEqualTo("Record");
        assertThat(xml.document().getDocumentElement().getNamespaceURI())
                .isEqualTo("http://www.opengis.net/cat/csw/2.0.2");
    }

    @DisplayName("ISO-8859-1로 선언된 XML은 원문도 같은 인코딩으로 복원")
    @Test
    void decode_latin1Xml_keepsText() throws Exception {
        String text = "<?xml version=\"1.0\" encoding=\"ISO-8859-1\"?>\n<title>Caf\u00e9</title>";
        Path f = Files.write(dir.resolve("latin1.xml"), text.getBytes(StandardCharsets.ISO_8859_1));

        DecodedDocument doc = decoder.decode(f);

        assertThat(doc).isInstanceOf(DecodedDocument.Xml.class);
        DecodedDocument.Xml xml = (DecodedDocument.Xml) doc;
        assertThat(xml.document().getDocumentElement().getTextContent()).isEqualTo("Caf\u00e9");
        assertThat(xml.text()).isEqualTo(text);
    }

    @DisplayName("well-formed가 아닌 XML은 MALFORMED_DOCUMENT")
    @Test
    void decode_malformed() throws Exception {
        Path f = Files.writeString(dir.resolve("bad.xml"), "<root><unclosed></root>");

        DecodedDocument doc = decoder.decode(f);

        assertThat(doc).isInstanceOf(DecodedDocument.Failed.class);
        assertThat(((DecodedDocument.Failed) doc).kind()).isEqualTo(DecodedDocument.FailureKind.MALFORMED_DOCUMENT);
    }

    @DisplayName("DOCTYPE 선언(외부 엔티티 포함)은 거부")
    @Test
    void decode_doctype_rejected() throws Exception {
        Path f = Files.writeString(dir.resolve("xxe.xml"),
                "<?xml version=\"1.0\"?><!DOCTYPE r [<!ENTITY x SYSTEM \"file:///etc/passwd\">]><r>&x;</r>");

        DecodedDocument doc = decoder.decode(f);

        assertThat(doc).isInstanceOf(DecodedDocument.Failed.class);
        assertThat(((DecodedDocument.Failed) doc).kind()).isEqualTo(DecodedDocument.FailureKind.MALFORMED_DOCUMENT);
    }

    @DisplayName("읽을 수 없는 파일은 예외 대신 DECODE_FAILURE")
    @Test
    void decode_unreadable() {
        DecodedDocument doc = decoder.decode(dir.resolve("missing.xml"));

        assertThat(doc).isInstanceOf(DecodedDocument.Failed.class);
        DecodedDocument.Failed failed = (DecodedDocument.Failed) doc;
        assertThat(failed.kind()).isEqualTo(DecodedDocument.FailureKind.DECODE_FAILURE);
        assertThat(failed.cause()).isNotNull();
    }
}
