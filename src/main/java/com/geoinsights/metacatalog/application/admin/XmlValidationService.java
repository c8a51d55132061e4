package com.geoinsights.metacatalog.application.admin;

import com.geoinsights.metacatalog.application.common.error.CatalogAdminException;
import com.geoinsights.metacatalog.application.common.error.ErrorCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.transform.stream.StreamSource;
import javax.xml.validation.Schema;
import javax.xml.validation.SchemaFactory;
import javax.xml.validation.Validator;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * XML 문서를 XML Schema(XSD)로 검증한다.
 *
 * <p>DTD는 읽지 않으며, 스키마의 import/include는 로컬 파일만 허용한다.</p>
 */
@Service
public class XmlValidationService {

    private static final Logger log = LoggerFactory.getLogger(XmlValidationService.class);

    /**
     * @param xml 검증할 문서
     * @param xsd 스키마 파일
     * @throws CatalogAdminException 문서가 유효하지 않거나(INVALID_XML) 읽을 수 없는 경우(IO_ERROR)
     */
    public void validate(Path xml, Path xsd) {
        log.info("Validating {} against schema {}", xml, xsd);
        for (Path p : new Path[]{xml, xsd}) {
            if (!Files.isRegularFile(p)) {
                throw new CatalogAdminException("ERROR: File not found: " + p, ErrorCodes.IO_ERROR);
            }
        }
        try {
            SchemaFactory factory = SchemaFactory.newInstance(XMLConstants.W3C_XML_SCHEMA_NS_URI);
            factory.setProperty(XMLConstants.ACCESS_EXTERNAL_DTD, "");
            factory.setProperty(XMLConstants.ACCESS_EXTERNAL_SCHEMA, "file");
            Schema schema = factory.newSchema(xsd.toFile());

            Validator validator = schema.newValidator();
            validator.setProperty(XMLConstants.ACCESS_EXTERNAL_DTD, "");
            validator.setProperty(XMLConstants.ACCESS_EXTERNAL_SCHEMA, "");
            validator.validate(new StreamSource(xml.toFile()));
        } catch (SAXException e) {
            throw new CatalogAdminException("ERROR: " + e.getMessage(), ErrorCodes.INVALID_XML, e);
        } catch (IOException e) {
            throw new CatalogAdminException("ERROR: Could not read " + xml + ": " + e, ErrorCodes.IO_ERROR, e);
        }
    }
}
