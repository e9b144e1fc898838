package guraa.xmlcompare.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of a batch run. Results are in the same order as the submitted
 * comparisons; failed items are represented by placeholder results.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchComparisonResult {

    @Builder.Default
    private List<ComparisonResult> results = new ArrayList<>();

    private int total;

    private int successful;

    private int failed;
}
