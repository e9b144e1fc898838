package guraa.xmlcompare.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Request to compare the XML documents served at two URLs.
 * Either an existing session id or credentials may be given; credentials
 * are used to log in against {@code url1} once for the pair.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UrlCompareRequest {
    private String url1;
    private String url2;
    private List<String> ignorePaths;
    private List<String> ignoreProperties;
    private AuthCredentials credentials;
    private String sessionId;

    public IgnoreRules toIgnoreRules() {
        return IgnoreRules.of(ignorePaths, ignoreProperties);
    }
}
