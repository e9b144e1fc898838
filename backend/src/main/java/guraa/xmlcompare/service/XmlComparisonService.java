package guraa.xmlcompare.service;

import guraa.xmlcompare.exception.ValidationException;
import guraa.xmlcompare.exception.XmlParseException;
import guraa.xmlcompare.model.CompareRequest;
import guraa.xmlcompare.model.ComparisonResult;
import guraa.xmlcompare.model.FlattenedDocument;
import guraa.xmlcompare.model.IgnoreRules;
import guraa.xmlcompare.util.InputValidator;
import guraa.xmlcompare.xml.XmlFlattener;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Service for comparing two XML documents given as text.
 * Both documents are validated and flattened before the diff engine runs;
 * nothing is cached between calls.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class XmlComparisonService {

    private final XmlFlattener flattener;
    private final XmlDiffEngine diffEngine;

    /**
     * Compare the two documents of a request.
     *
     * @param request The comparison request
     * @return The comparison result
     * @throws ValidationException If either document is empty or not XML
     * @throws XmlParseException If either document is malformed
     */
    public ComparisonResult compare(CompareRequest request) throws ValidationException, XmlParseException {
        return compareDocuments(request.getXml1(), request.getXml2(), request.toIgnoreRules());
    }

    /**
     * Compare two documents.
     *
     * @param xml1 The expected document
     * @param xml2 The actual document
     * @param rules The ignore rules, may be null
     * @return The comparison result
     * @throws ValidationException If either document is empty or not XML
     * @throws XmlParseException If either document is malformed
     */
    public ComparisonResult compareDocuments(String xml1, String xml2, IgnoreRules rules)
            throws ValidationException, XmlParseException {
        InputValidator.validateXmlContent(xml1, "XML1");
        InputValidator.validateXmlContent(xml2, "XML2");

        FlattenedDocument doc1 = flattener.flatten(xml1);
        FlattenedDocument doc2 = flattener.flatten(xml2);

        ComparisonResult result = diffEngine.compare(doc1, doc2, rules);
        log.info("Comparison finished: matched={}, ratio={}, {} differences",
                result.isMatched(), String.format("%.3f", result.getMatchRatio()), result.getDiffs().size());
        return result;
    }
}
