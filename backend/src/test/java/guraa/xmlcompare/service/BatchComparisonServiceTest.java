package guraa.xmlcompare.service;

import guraa.xmlcompare.config.AppProperties;
import guraa.xmlcompare.exception.AuthenticationException;
import guraa.xmlcompare.exception.DocumentFetchException;
import guraa.xmlcompare.model.AuthCredentials;
import guraa.xmlcompare.model.BatchComparisonResult;
import guraa.xmlcompare.model.CompareRequest;
import guraa.xmlcompare.model.ComparisonResult;
import guraa.xmlcompare.model.UrlCompareRequest;
import guraa.xmlcompare.session.Session;
import guraa.xmlcompare.source.DocumentSource;
import guraa.xmlcompare.xml.XmlFlattener;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class BatchComparisonServiceTest {

    private DocumentSource documentSource;
    private ExecutorService executor;
    private BatchComparisonService batchService;

    @BeforeEach
    void setUp() {
        documentSource = mock(DocumentSource.class);
        executor = Executors.newFixedThreadPool(4);
        XmlComparisonService comparisonService = new XmlComparisonService(new XmlFlattener(new AppProperties()), new XmlDiffEngine());
        batchService = new BatchComparisonService(comparisonService,
                new UrlComparisonService(documentSource, comparisonService), executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void inlineBatchKeepsOrderAndIsolatesFailures() {
        List<CompareRequest> requests = List.of(
                inline("<a>1</a>", "<a>1</a>"),
                inline("<a><b></a>", "<a/>"),
                inline("<a>1</a>", "<a>2</a>"),
                inline("", "<a/>"));

        BatchComparisonResult batch = batchService.runInlineBatch(requests);

        assertEquals(4, batch.getTotal());
        assertEquals(2, batch.getSuccessful());
        assertEquals(2, batch.getFailed());
        assertEquals(4, batch.getResults().size());

        assertTrue(batch.getResults().get(0).isMatched());
        assertPlaceholder(batch.getResults().get(1));
        assertEquals(1, batch.getResults().get(2).getDiffs().size());
        assertPlaceholder(batch.getResults().get(3));
    }

    @Test
    void emptyInlineBatch() {
        BatchComparisonResult batch = batchService.runInlineBatch(List.of());

        assertEquals(0, batch.getTotal());
        assertTrue(batch.getResults().isEmpty());
    }

    @Test
    void urlBatchReturnsResultsInSubmissionOrder() throws Exception {
        when(documentSource.fetch(eq("http://slow/1"), any())).thenAnswer(inv -> {
            Thread.sleep(300);
            return "<doc>slow</doc>";
        });
        when(documentSource.fetch(eq("http://slow/2"), any())).thenReturn("<doc>slow</doc>");
        when(documentSource.fetch(eq("http://fast/1"), any())).thenReturn("<doc>fast</doc>");
        when(documentSource.fetch(eq("http://fast/2"), any())).thenReturn("<doc>other</doc>");

        BatchComparisonResult batch = batchService.runUrlBatch(List.of(
                url("http://slow/1", "http://slow/2"),
                url("http://fast/1", "http://fast/2")));

        assertEquals(2, batch.getTotal());
        assertEquals(2, batch.getSuccessful());
        assertTrue(batch.getResults().get(0).isMatched());
        assertFalse(batch.getResults().get(1).isMatched());
    }

    @Test
    void failingUrlYieldsPlaceholderOnlyForItsItem() throws Exception {
        when(documentSource.fetch(eq("http://ok/1"), any())).thenReturn("<a/>");
        when(documentSource.fetch(eq("http://ok/2"), any())).thenReturn("<a/>");
        when(documentSource.fetch(eq("http://down/1"), any()))
                .thenThrow(new DocumentFetchException("http://down/1", "HTTP 503"));

        BatchComparisonResult batch = batchService.runUrlBatch(List.of(
                url("http://ok/1", "http://ok/2"),
                url("http://down/1", "http://ok/2"),
                url("ftp://nope", "http://ok/2")));

        assertEquals(3, batch.getTotal());
        assertEquals(1, batch.getSuccessful());
        assertEquals(2, batch.getFailed());
        assertTrue(batch.getResults().get(0).isMatched());
        assertPlaceholder(batch.getResults().get(1));
        assertPlaceholder(batch.getResults().get(2));
    }

    @Test
    void credentialsLogInOnceAgainstTheFirstUrl() throws Exception {
        Session session = Session.create("http://host/a", List.of("sid=1"), Duration.ofHours(1));
        when(documentSource.authenticate("http://host/a", "user", "pw")).thenReturn(session);
        when(documentSource.fetch(anyString(), eq(session.getId()))).thenReturn("<a/>");

        UrlCompareRequest request = url("http://host/a", "http://host/b");
        request.setCredentials(new AuthCredentials("user", "pw"));

        BatchComparisonResult batch = batchService.runUrlBatch(List.of(request));

        assertEquals(1, batch.getSuccessful());
        verify(documentSource, times(1)).authenticate("http://host/a", "user", "pw");
        verify(documentSource).fetch("http://host/a", session.getId());
        verify(documentSource).fetch("http://host/b", session.getId());
    }

    @Test
    void suppliedSessionSkipsLogin() throws Exception {
        when(documentSource.fetch(anyString(), eq("existing"))).thenReturn("<a/>");

        UrlCompareRequest request = url("http://host/a", "http://host/b");
        request.setSessionId("existing");
        request.setCredentials(new AuthCredentials("user", "pw"));

        assertEquals(1, batchService.runUrlBatch(List.of(request)).getSuccessful());
        verify(documentSource, never()).authenticate(anyString(), anyString(), anyString());
    }

    @Test
    void rejectedLoginYieldsPlaceholder() throws Exception {
        when(documentSource.authenticate(anyString(), anyString(), anyString()))
                .thenThrow(new AuthenticationException("HTTP 401"));

        UrlCompareRequest request = url("http://host/a", "http://host/b");
        request.setCredentials(new AuthCredentials("user", "bad"));

        BatchComparisonResult batch = batchService.runUrlBatch(List.of(request));

        assertEquals(1, batch.getFailed());
        assertPlaceholder(batch.getResults().get(0));
        verify(documentSource, never()).fetch(anyString(), any());
    }

    private static void assertPlaceholder(ComparisonResult result) {
        assertFalse(result.isMatched());
        assertEquals(0.0, result.getMatchRatio());
        assertTrue(result.getDiffs().isEmpty());
        assertEquals(0, result.getTotalElements());
        assertEquals(0, result.getMatchedElements());
    }

    private static CompareRequest inline(String xml1, String xml2) {
        return CompareRequest.builder().xml1(xml1).xml2(xml2).build();
    }

    private static UrlCompareRequest url(String url1, String url2) {
        return UrlCompareRequest.builder().url1(url1).url2(url2).build();
    }
}
