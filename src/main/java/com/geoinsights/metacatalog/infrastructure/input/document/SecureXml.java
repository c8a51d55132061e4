package com.geoinsights.metacatalog.infrastructure.input.document;

import org.w3c.dom.Document;
import org.w3c.dom.Node;
import org.xml.sax.SAXException;
import org.xml.sax.helpers.DefaultHandler;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.StringWriter;

/**
 * 신뢰할 수 없는 XML 입력용 파서/직렬화 유틸.
 *
 * <p>DOCTYPE 선언과 외부 엔티티를 허용하지 않는다.</p>
 */
public final class SecureXml {
    private SecureXml() {}

    /**
     * 네임스페이스 인식, DOCTYPE 금지 설정의 {@link DocumentBuilder}를 만든다.
     *
     * @return DocumentBuilder
     * @throws ParserConfigurationException 파서 기능 설정 실패 시
     */
    public static DocumentBuilder newDocumentBuilder() throws ParserConfigurationException {
        DocumentBuilderFactory f = DocumentBuilderFactory.newInstance();
        f.setNamespaceAware(true);
        f.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
        f.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
        f.setFeature("http://xml.org/sax/features/external-general-entities", false);
        f.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
        f.setXIncludeAware(false);
        f.setExpandEntityReferences(false);

        DocumentBuilder builder = f.newDocumentBuilder();
        // 기본 핸들러는 stderr로 출력하므로 교체 (fatal은 예외로 올라옴)
        builder.setErrorHandler(new DefaultHandler());
        return builder;
    }

    /**
     * 바이트 배열을 XML DOM으로 파싱한다.
     *
     * @param bytes XML 바이트
     * @return DOM
     * @throws SAXException                 well-formed가 아닌 경우
     * @throws IOException                  읽기 실패 시
     * @throws ParserConfigurationException 파서 설정 실패 시
     */
    public static Document parse(byte[] bytes) throws SAXException, IOException, ParserConfigurationException {
        return newDocumentBuilder().parse(new ByteArrayInputStream(bytes));
    }

    /**
     * DOM 노드를 XML 선언 없이 문자열로 직렬화한다.
     *
     * @param node 노드
     * @return XML 텍스트
     * @throws TransformerException 직렬화 실패 시
     */
    public static String serialize(Node node) throws TransformerException {
        TransformerFactory tf = TransformerFactory.newInstance();
        tf.setAttribute(XMLConstants.ACCESS_EXTERNAL_DTD, "");
        tf.setAttribute(XMLConstants.ACCESS_EXTERNAL_STYLESHEET, "");
        Transformer t = tf.newTransformer();
        t.setOutputProperty(OutputKeys.OMIT_XML_DECLARATION, "yes");
        t.setOutputProperty(OutputKeys.ENCODING, "UTF-8");

        StringWriter out = new StringWriter();
        t.transform(new DOMSource(node), new StreamResult(out));
        return out.toString();
    }
}
