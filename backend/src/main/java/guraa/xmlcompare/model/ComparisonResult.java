package guraa.xmlcompare.model;

import guraa.xmlcompare.model.difference.DiffType;
import guraa.xmlcompare.model.difference.XmlDifference;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of comparing two XML documents.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ComparisonResult {

    /**
     * True if and only if no difference was found.
     */
    private boolean matched;

    /**
     * Matched elements divided by total elements, in [0, 1].
     */
    private double matchRatio;

    @Builder.Default
    private List<XmlDifference> diffs = new ArrayList<>();

    /**
     * The larger of the two documents' element counts.
     */
    private int totalElements;

    private int matchedElements;

    /**
     * Create the zero-value result that stands in for a failed batch item.
     *
     * @return A placeholder result
     */
    public static ComparisonResult placeholder() {
        return ComparisonResult.builder()
                .matched(false)
                .matchRatio(0.0)
                .totalElements(0)
                .matchedElements(0)
                .build();
    }

    /**
     * Get the number of differences of a given kind.
     *
     * @param type The diff type
     * @return The count
     */
    public long countByType(DiffType type) {
        return diffs.stream()
                .filter(diff -> diff.getDiffType() == type)
                .count();
    }
}
