package io.reloop.core.validation.coverage;

import io.reloop.core.validation.evaluator.EvaluatorException;
import io.reloop.core.validation.rule.CoverageScope;
import java.io.IOException;
import java.io.StringReader;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import org.w3c.dom.Element;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

/// Parses Cobertura XML reports.
///
/// Reads the rate attributes of the root `<coverage>` element and scales them to a
/// percentage. `branch-rate` serves the branches scope; every other scope uses
/// `line-rate`, since Cobertura reports carry no function or statement totals.
///
/// @implNote The DTD referenced by real Cobertura reports is never fetched and
/// external entities are not resolved.
public final class CoberturaReportParser implements CoverageReportParser {

    @Override
    public double percentage(String content, CoverageScope scope) throws EvaluatorException {
        Element root = parse(content).getDocumentElement();
        if (!"coverage".equals(root.getTagName())) {
            throw new EvaluatorException(
                    "Not a Cobertura report: root element is <" + root.getTagName() + ">");
        }

        String attribute = scope == CoverageScope.BRANCHES ? "branch-rate" : "line-rate";
        String value = root.getAttribute(attribute);
        if (value.isBlank()) {
            throw new EvaluatorException("Cobertura report has no " + attribute + " attribute");
        }
        try {
            return Double.parseDouble(value) * 100.0;
        } catch (NumberFormatException e) {
            throw new EvaluatorException("Malformed " + attribute + ": " + value, e);
        }
    }

    private static org.w3c.dom.Document parse(String content) throws EvaluatorException {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setFeature(
                    "http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
            factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
            factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setExpandEntityReferences(false);
            DocumentBuilder builder = factory.newDocumentBuilder();
            return builder.parse(new InputSource(new StringReader(content)));
        } catch (ParserConfigurationException | SAXException | IOException e) {
            throw new EvaluatorException("Unparseable Cobertura report: " + e.getMessage(), e);
        }
    }
}
