package guraa.xmlcompare.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Batch of inline comparisons.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BatchCompareRequest {
    private List<CompareRequest> comparisons = new ArrayList<>();
}
