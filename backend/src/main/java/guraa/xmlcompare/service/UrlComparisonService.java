package guraa.xmlcompare.service;

import guraa.xmlcompare.exception.AuthenticationException;
import guraa.xmlcompare.exception.DocumentFetchException;
import guraa.xmlcompare.exception.ValidationException;
import guraa.xmlcompare.exception.XmlParseException;
import guraa.xmlcompare.model.AuthCredentials;
import guraa.xmlcompare.model.ComparisonResult;
import guraa.xmlcompare.model.UrlCompareRequest;
import guraa.xmlcompare.session.Session;
import guraa.xmlcompare.source.DocumentSource;
import guraa.xmlcompare.util.InputValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Compares the documents served at two URLs.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UrlComparisonService {

    private final DocumentSource documentSource;
    private final XmlComparisonService comparisonService;

    /**
     * Fetch both documents of a request and compare them.
     * A supplied session id is used as is; otherwise, if credentials are
     * given, one login is made against {@code url1} and its session is used
     * for both fetches.
     *
     * @param request The request
     * @return The comparison result
     * @throws ValidationException If a URL is invalid or a fetched document is not XML
     * @throws AuthenticationException If the login fails
     * @throws DocumentFetchException If either document cannot be fetched
     * @throws XmlParseException If either document is malformed
     */
    public ComparisonResult compare(UrlCompareRequest request) throws ValidationException,
            AuthenticationException, DocumentFetchException, XmlParseException {
        InputValidator.validateUrl(request.getUrl1());
        InputValidator.validateUrl(request.getUrl2());

        String sessionId = resolveSession(request);

        log.debug("Fetching {} and {}", request.getUrl1(), request.getUrl2());
        String xml1 = documentSource.fetch(request.getUrl1(), sessionId);
        String xml2 = documentSource.fetch(request.getUrl2(), sessionId);

        return comparisonService.compareDocuments(xml1, xml2, request.toIgnoreRules());
    }

    private String resolveSession(UrlCompareRequest request) throws AuthenticationException {
        if (request.getSessionId() != null) {
            return request.getSessionId();
        }
        AuthCredentials credentials = request.getCredentials();
        if (credentials == null) {
            return null;
        }
        Session session = documentSource.authenticate(request.getUrl1(),
                credentials.getUsername(), credentials.getPassword());
        return session.getId();
    }
}
