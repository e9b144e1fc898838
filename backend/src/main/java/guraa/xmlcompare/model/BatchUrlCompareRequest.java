package guraa.xmlcompare.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Batch of URL-sourced comparisons.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BatchUrlCompareRequest {
    private List<UrlCompareRequest> comparisons = new ArrayList<>();
}
