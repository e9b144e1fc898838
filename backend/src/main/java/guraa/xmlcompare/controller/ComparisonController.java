package guraa.xmlcompare.controller;

import guraa.xmlcompare.exception.AuthenticationException;
import guraa.xmlcompare.exception.DocumentFetchException;
import guraa.xmlcompare.exception.ValidationException;
import guraa.xmlcompare.exception.XmlParseException;
import guraa.xmlcompare.model.BatchCompareRequest;
import guraa.xmlcompare.model.BatchComparisonResult;
import guraa.xmlcompare.model.BatchUrlCompareRequest;
import guraa.xmlcompare.model.CompareRequest;
import guraa.xmlcompare.model.ComparisonResult;
import guraa.xmlcompare.model.UrlCompareRequest;
import guraa.xmlcompare.service.BatchComparisonService;
import guraa.xmlcompare.service.DifferenceReportFormatter;
import guraa.xmlcompare.service.UrlComparisonService;
import guraa.xmlcompare.service.XmlComparisonService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;

/**
 * Controller for XML comparison operations.
 */
@Slf4j
@RestController
@RequestMapping("/api/compare")
@RequiredArgsConstructor
public class ComparisonController {

    private final XmlComparisonService comparisonService;
    private final UrlComparisonService urlComparisonService;
    private final BatchComparisonService batchComparisonService;
    private final DifferenceReportFormatter reportFormatter;

    /**
     * Compare two inline XML documents.
     *
     * @param request The comparison request
     * @return The comparison result
     */
    @PostMapping("/xml")
    public ResponseEntity<ComparisonResult> compareXml(@RequestBody CompareRequest request)
            throws ValidationException, XmlParseException {
        log.info("Received XML comparison request");
        return ResponseEntity.ok(comparisonService.compare(request));
    }

    /**
     * Compare two inline XML documents and return a plain-text report.
     *
     * @param request The comparison request
     * @return The report
     */
    @PostMapping("/xml/report")
    public ResponseEntity<String> compareXmlReport(@RequestBody CompareRequest request)
            throws ValidationException, XmlParseException {
        log.info("Received XML comparison report request");
        ComparisonResult result = comparisonService.compare(request);
        return ResponseEntity.ok()
                .contentType(MediaType.TEXT_PLAIN)
                .body(reportFormatter.format(result));
    }

    @PostMapping("/xml/batch")
    public ResponseEntity<BatchComparisonResult> compareXmlBatch(@RequestBody BatchCompareRequest request) {
        log.info("Received XML batch comparison request");
        return ResponseEntity.ok(batchComparisonService.runInlineBatch(
                request.getComparisons() == null ? new ArrayList<>() : request.getComparisons()));
    }

    /**
     * Fetch and compare the documents served at two URLs.
     *
     * @param request The comparison request
     * @return The comparison result
     */
    @PostMapping("/url")
    public ResponseEntity<ComparisonResult> compareUrls(@RequestBody UrlCompareRequest request)
            throws ValidationException, AuthenticationException, DocumentFetchException, XmlParseException {
        log.info("Received URL comparison request: {} vs {}", request.getUrl1(), request.getUrl2());
        return ResponseEntity.ok(urlComparisonService.compare(request));
    }

    @PostMapping("/url/batch")
    public ResponseEntity<BatchComparisonResult> compareUrlBatch(@RequestBody BatchUrlCompareRequest request) {
        log.info("Received URL batch comparison request");
        return ResponseEntity.ok(batchComparisonService.runUrlBatch(
                request.getComparisons() == null ? new ArrayList<>() : request.getComparisons()));
    }
}
