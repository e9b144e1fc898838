package guraa.xmlcompare.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * The exclusions active for one comparison.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IgnoreRules {

    /**
     * Path patterns: exact paths, wildcard suffix patterns ({@code /a/*})
     * or trailing-slash prefixes ({@code /a/}).
     */
    @Builder.Default
    private List<String> ignorePaths = new ArrayList<>();

    /**
     * Names matched against attribute keys and element tag names.
     */
    @Builder.Default
    private Set<String> ignoreProperties = new LinkedHashSet<>();

    /**
     * Build rules from optional request lists; null lists mean no rule.
     *
     * @param ignorePaths Path patterns, may be null
     * @param ignoreProperties Property names, may be null
     * @return The ignore rules
     */
    public static IgnoreRules of(List<String> ignorePaths, List<String> ignoreProperties) {
        return IgnoreRules.builder()
                .ignorePaths(ignorePaths == null ? new ArrayList<>() : new ArrayList<>(ignorePaths))
                .ignoreProperties(ignoreProperties == null ? new LinkedHashSet<>() : new LinkedHashSet<>(ignoreProperties))
                .build();
    }

    public static IgnoreRules none() {
        return IgnoreRules.builder().build();
    }
}
