package guraa.xmlcompare.service;

import guraa.xmlcompare.model.BatchComparisonResult;
import guraa.xmlcompare.model.CompareRequest;
import guraa.xmlcompare.model.ComparisonResult;
import guraa.xmlcompare.model.UrlCompareRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Runs many comparisons and collects their results in submission order.
 * A failing item never fails the batch: it is logged and represented by a
 * placeholder result.
 */
@Slf4j
@Service
public class BatchComparisonService {

    private final XmlComparisonService comparisonService;
    private final UrlComparisonService urlComparisonService;
    private final ExecutorService comparisonExecutor;

    public BatchComparisonService(XmlComparisonService comparisonService,
                                  UrlComparisonService urlComparisonService,
                                  @Qualifier("comparisonExecutor") ExecutorService comparisonExecutor) {
        this.comparisonService = comparisonService;
        this.urlComparisonService = urlComparisonService;
        this.comparisonExecutor = comparisonExecutor;
    }

    /**
     * Compare inline document pairs one after the other on the calling thread.
     *
     * @param requests The comparisons
     * @return The batch result
     */
    public BatchComparisonResult runInlineBatch(List<CompareRequest> requests) {
        log.info("Starting inline batch of {} comparisons", requests.size());

        List<Optional<ComparisonResult>> outcomes = new ArrayList<>(requests.size());
        for (int i = 0; i < requests.size(); i++) {
            try {
                outcomes.add(Optional.of(comparisonService.compare(requests.get(i))));
            } catch (Exception e) {
                log.warn("Inline comparison {} failed: {}", i, e.getMessage());
                outcomes.add(Optional.empty());
            }
        }

        return summarize(outcomes);
    }

    /**
     * Fetch and compare URL pairs on the comparison pool. All items run to
     * completion; results are joined in submission order.
     *
     * @param requests The comparisons
     * @return The batch result
     */
    public BatchComparisonResult runUrlBatch(List<UrlCompareRequest> requests) {
        log.info("Starting URL batch of {} comparisons", requests.size());

        List<CompletableFuture<Optional<ComparisonResult>>> futures = new ArrayList<>(requests.size());
        for (int i = 0; i < requests.size(); i++) {
            final int index = i;
            final UrlCompareRequest request = requests.get(i);
            futures.add(CompletableFuture.supplyAsync(() -> compareUrlsSafely(index, request), comparisonExecutor));
        }

        List<Optional<ComparisonResult>> outcomes = new ArrayList<>(futures.size());
        for (int i = 0; i < futures.size(); i++) {
            try {
                outcomes.add(futures.get(i).join());
            } catch (Exception e) {
                log.error("URL comparison task {} did not complete: {}", i, e.getMessage(), e);
                outcomes.add(Optional.empty());
            }
        }

        return summarize(outcomes);
    }

    private Optional<ComparisonResult> compareUrlsSafely(int index, UrlCompareRequest request) {
        try {
            return Optional.of(urlComparisonService.compare(request));
        } catch (Exception e) {
            log.warn("URL comparison {} ({} vs {}) failed: {}",
                    index, request.getUrl1(), request.getUrl2(), e.getMessage());
            return Optional.empty();
        }
    }

    private BatchComparisonResult summarize(List<Optional<ComparisonResult>> outcomes) {
        List<ComparisonResult> results = new ArrayList<>(outcomes.size());
        int successful = 0;
        for (Optional<ComparisonResult> outcome : outcomes) {
            if (outcome.isPresent()) {
                results.add(outcome.get());
                successful++;
            } else {
                results.add(ComparisonResult.placeholder());
            }
        }
        int failed = outcomes.size() - successful;

        log.info("Batch finished: {} total, {} successful, {} failed", outcomes.size(), successful, failed);
        return BatchComparisonResult.builder()
                .results(results)
                .total(outcomes.size())
                .successful(successful)
                .failed(failed)
                .build();
    }
}
