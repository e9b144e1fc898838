package guraa.xmlcompare.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Request to compare two inline XML documents.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompareRequest {
    private String xml1;
    private String xml2;
    private List<String> ignorePaths;
    private List<String> ignoreProperties;

    public IgnoreRules toIgnoreRules() {
        return IgnoreRules.of(ignorePaths, ignoreProperties);
    }
}
