package com.geoinsights.metacatalog.infrastructure.mapper;

import com.geoinsights.metacatalog.infrastructure.input.document.DecodedDocument;
import com.geoinsights.metacatalog.infrastructure.input.document.SecureXml;
import com.geoinsights.metacatalog.infrastructure.input.json.JsonRecordRaw;
import com.geoinsights.metacatalog.infrastructure.persistence.r2dbc.row.RecordRow;
import org.springframework.stereotype.Component;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;

import javax.xml.transform.TransformerException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 지원하는 메타데이터 방언(dialect)별로 문서를 {@link RecordRow}로 변환한다.
 *
 * <ul>
 *     <li>CSW 2.0.2 {@code csw:Record} (Dublin Core)</li>
 *     <li>ISO 19139 {@code gmd:MD_Metadata}</li>
 *     <li>{@code csw:GetRecordsResponse} / {@code csw:GetRecordByIdResponse} 응답 봉투</li>
 *     <li>OGC API Records GeoJSON {@code Feature} / {@code FeatureCollection}</li>
 * </ul>
 *
 * <p>방언별 전체 매핑 테이블이 아니라 식별/요약에 필요한 필드만 채운다.</p>
 */
@Component
public class DialectRecordExtractor implements RecordExtractor {

    static final String CSW_NS = "http://www.opengis.net/cat/csw/2.0.2";
    static final String DC_NS = "http://purl.org/dc/elements/1.1/";
    static final String DCT_NS = "http://purl.org/dc/terms/";
    static final String OWS_NS = "http://www.opengis.net/ows";
    static final String GMD_NS = "http://www.isotc211.org/2005/gmd";
    static final String OGCAPI_RECORDS_SCHEMA = "http://www.opengis.net/spec/ogcapi-records-1/1.0";

    static final String CSW_RECORD_TYPE = "csw:Record";
    static final String GMD_RECORD_TYPE = "gmd:MD_Metadata";
    static final String JSON_RECORD_TYPE = "item";

    /** JSON 트리 → DTO 변환, feature 원문 직렬화 */
    private final ObjectMapper mapper;

    public DialectRecordExtractor(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public List<RecordRow> extract(DecodedDocument document) throws RecordExtractionException {
        if (document instanceof DecodedDocument.Xml xml) {
            return extractXml(xml);
        }
        if (document instanceof DecodedDocument.Json json) {
            return extractJson(json);
        }
        throw new RecordExtractionException("Document was not decoded: " + document.source());
    }

    /* =========================
     * XML
     * ========================= */

    private List<RecordRow> extractXml(DecodedDocument.Xml xml) throws RecordExtractionException {
        Element root = xml.document().getDocumentElement();

        if (is(root, CSW_NS, "Record")) {
            return List.of(dublinCore(root, xml.text()));
        }
        if (is(root, GMD_NS, "MD_Metadata")) {
            return List.of(iso19139(root, xml.text()));
        }
        if (is(root, CSW_NS, "GetRecordsResponse") || is(root, CSW_NS, "GetRecordByIdResponse")) {
            List<Element> found = new ArrayList<>();
            collectRecords(root, found);

            List<RecordRow> out = new ArrayList<>(found.size());
            for (Element el : found) {
                String raw = serialize(el);
                out.add(is(el, CSW_NS, "Record") ? dublinCore(el, raw) : iso19139(el, raw));
            }
            return out;
        }

        throw new RecordExtractionException("Unsupported XML document root: {"
                + root.getNamespaceURI() + "}" + root.getLocalName());
    }

    /**
     * 응답 봉투 안의 레코드 요소를 문서 순서대로 모은다. 레코드 요소 내부로는 내려가지 않는다.
     */
    private void collectRecords(Element parent, List<Element> out) {
        for (Node n = parent.getFirstChild(); n != null; n = n.getNextSibling()) {
            if (!(n instanceof Element el)) continue;
            if (is(el, CSW_NS, "Record") || is(el, GMD_NS, "MD_Metadata")) {
                out.add(el);
            } else {
                collectRecords(el, out);
            }
        }
    }

    private RecordRow dublinCore(Element rec, String raw) throws RecordExtractionException {
        String identifier = requireIdentifier(firstText(rec, DC_NS, "identifier"));

        String abstractText = firstNonNull(firstText(rec, DCT_NS, "abstract"), firstText(rec, DC_NS, "description"));
        String modified = firstNonNull(firstText(rec, DCT_NS, "modified"), firstText(rec, DC_NS, "date"));

        String wkt = null;
        Element bbox = firstElement(rec, OWS_NS, "BoundingBox");
        if (bbox != null) {
            double[] lower = corner(firstText(bbox, OWS_NS, "LowerCorner"));
            double[] upper = corner(firstText(bbox, OWS_NS, "UpperCorner"));
            if (lower != null && upper != null) {
                wkt = bboxToWktPolygon(lower[0], lower[1], upper[0], upper[1]);
            }
        }

        return new RecordRow(
                identifier,
                CSW_RECORD_TYPE,
                CSW_NS,
                null,
                null,
                raw,
                RecordRow.XML_CONTENT_TYPE,
                normalizeSpace(rec.getTextContent()),
                null,
                firstText(rec, DC_NS, "language"),
                firstText(rec, DC_NS, "title"),
                abstractText,
                joinOrNull(allTexts(rec, DC_NS, "subject")),
                firstText(rec, DC_NS, "type"),
                modified,
                wkt,
                joinOrNull(allTexts(rec, DCT_NS, "references"))
        );
    }

    private RecordRow iso19139(Element md, String raw) throws RecordExtractionException {
        String identifier = requireIdentifier(firstText(md, GMD_NS, "fileIdentifier"));

        String resourceType = null;
        Element level = firstElement(md, GMD_NS, "hierarchyLevel");
        if (level != null) {
            Element code = firstElement(level, GMD_NS, "MD_ScopeCode");
            resourceType = code != null && !code.getAttribute("codeListValue").isBlank()
                    ? code.getAttribute("codeListValue")
                    : trimToNull(level.getTextContent());
        }

        String language = null;
        Element lang = firstElement(md, GMD_NS, "language");
        if (lang != null) {
            Element code = firstElement(lang, GMD_NS, "LanguageCode");
            language = code != null && !code.getAttribute("codeListValue").isBlank()
                    ? code.getAttribute("codeListValue")
                    : trimToNull(lang.getTextContent());
        }

        String wkt = null;
        Element box = firstElement(md, GMD_NS, "EX_GeographicBoundingBox");
        if (box != null) {
            Double west = number(firstText(box, GMD_NS, "westBoundLongitude"));
            Double south = number(firstText(box, GMD_NS, "southBoundLatitude"));
            Double east = number(firstText(box, GMD_NS, "eastBoundLongitude"));
            Double north = number(firstText(box, GMD_NS, "northBoundLatitude"));
            if (west != null && south != null && east != null && north != null) {
                wkt = bboxToWktPolygon(west, south, east, north);
            }
        }

        return new RecordRow(
                identifier,
                GMD_RECORD_TYPE,
                GMD_NS,
                null,
                null,
                raw,
                RecordRow.XML_CONTENT_TYPE,
                normalizeSpace(md.getTextContent()),
                null,
                language,
                firstText(md, GMD_NS, "title"),
                firstText(md, GMD_NS, "abstract"),
                joinOrNull(allTexts(md, GMD_NS, "keyword")),
                resourceType,
                firstText(md, GMD_NS, "dateStamp"),
                wkt,
                joinOrNull(allTexts(md, GMD_NS, "URL"))
        );
    }

    /* =========================
     * JSON
     * ========================= */

    private List<RecordRow> extractJson(DecodedDocument.Json json) throws RecordExtractionException {
        if (!json.tree().isObject()) {
            throw new RecordExtractionException("JSON document is not an object: " + json.source());
        }

        JsonRecordRaw raw = toRaw(json.tree());
        if (JsonRecordRaw.FEATURE.equals(raw.type)) {
            return List.of(feature(raw, json.text()));
        }
        if (JsonRecordRaw.FEATURE_COLLECTION.equals(raw.type)) {
            List<RecordRow> out = new ArrayList<>();
            for (JsonNode f : raw.features == null ? List.<JsonNode>of() : raw.features) {
                String text;
                try {
                    text = mapper.writeValueAsString(f);
                } catch (JacksonException e) {
                    throw new RecordExtractionException("Could not serialize feature", e);
                }
                out.add(feature(toRaw(f), text));
            }
            return out;
        }

        throw new RecordExtractionException("Unsupported JSON document type: " + raw.type);
    }

    private JsonRecordRaw toRaw(JsonNode node) throws RecordExtractionException {
        if (node == null || !node.isObject()) {
            throw new RecordExtractionException("JSON feature is not an object: "
                    + (node == null ? "missing" : node.getNodeType()));
        }
        try {
            return mapper.treeToValue(node, JsonRecordRaw.class);
        } catch (JacksonException e) {
            throw new RecordExtractionException("JSON document does not match the record layout: "
                    + e.getOriginalMessage(), e);
        }
    }

    private RecordRow feature(JsonRecordRaw f, String text) throws RecordExtractionException {
        String identifier = requireIdentifier(f.id);
        JsonRecordRaw.Properties p = f.properties != null ? f.properties : new JsonRecordRaw.Properties();

        String keywords = p.keywords == null ? null : joinOrNull(p.keywords);
        String links = f.links == null ? null : joinOrNull(f.links.stream()
                .filter(Objects::nonNull)
                .map(l -> l.href)
                .collect(Collectors.toList()));

        String anyText = normalizeSpace(Stream.of(p.title, p.description, keywords)
                .filter(Objects::nonNull)
                .collect(Collectors.joining(" ")));

        return new RecordRow(
                identifier,
                JSON_RECORD_TYPE,
                OGCAPI_RECORDS_SCHEMA,
                null,
                null,
                text,
                RecordRow.JSON_CONTENT_TYPE,
                anyText,
                text,
                p.language,
                p.title,
                p.description,
                keywords,
                p.type,
                p.updated,
                null,
                links
        );
    }

    /* =========================
     * helpers
     * ========================= */

    /**
     * 경계 상자를 닫힌 WKT 폴리곤으로 변환한다. 좌표는 소수점 둘째 자리까지.
     */
    static String bboxToWktPolygon(double minx, double miny, double maxx, double maxy) {
        return String.format(Locale.ROOT,
                "POLYGON((%.2f %.2f, %.2f %.2f, %.2f %.2f, %.2f %.2f, %.2f %.2f))",
                minx, miny, minx, maxy, maxx, maxy, maxx, miny, minx, miny);
    }

    private static boolean is(Element el, String ns, String localName) {
        return ns.equals(el.getNamespaceURI()) && localName.equals(el.getLocalName());
    }

    private static Element firstElement(Element scope, String ns, String localName) {
        NodeList nodes = scope.getElementsByTagNameNS(ns, localName);
        return nodes.getLength() == 0 ? null : (Element) nodes.item(0);
    }

    private static String firstText(Element scope, String ns, String localName) {
        Element el = firstElement(scope, ns, localName);
        return el == null ? null : trimToNull(el.getTextContent());
    }

    private static List<String> allTexts(Element scope, String ns, String localName) {
        NodeList nodes = scope.getElementsByTagNameNS(ns, localName);
        List<String> out = new ArrayList<>(nodes.getLength());
        for (int i = 0; i < nodes.getLength(); i++) {
            String s = trimToNull(nodes.item(i).getTextContent());
            if (s != null) out.add(s);
        }
        return out;
    }

    private static String serialize(Element el) throws RecordExtractionException {
        try {
            return SecureXml.serialize(el);
        } catch (TransformerException e) {
            throw new RecordExtractionException("Could not serialize " + el.getLocalName(), e);
        }
    }

    private static String requireIdentifier(String identifier) throws RecordExtractionException {
        String id = trimToNull(identifier);
        if (id == null) {
            throw new RecordExtractionException("Record has no identifier");
        }
        return id;
    }

    private static double[] corner(String s) {
        if (s == null) return null;
        String[] parts = s.trim().split("\\s+");
        if (parts.length < 2) return null;
        Double x = number(parts[0]);
        Double y = number(parts[1]);
        return x == null || y == null ? null : new double[]{x, y};
    }

    private static Double number(String s) {
        if (s == null) return null;
        try {
            return Double.parseDouble(s.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String joinOrNull(List<String> values) {
        List<String> kept = values.stream()
                .map(DialectRecordExtractor::trimToNull)
                .filter(Objects::nonNull)
                .collect(Collectors.toList());
        return kept.isEmpty() ? null : String.join(",", kept);
    }

    private static String firstNonNull(String a, String b) {
        return a != null ? a : b;
    }

    private static String trimToNull(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }

    private static String normalizeSpace(String s) {
        return s == null ? null : trimToNull(s.replaceAll("\\s+", " "));
    }
}
