package guraa.xmlcompare.util;

import java.util.Collection;

/**
 * Utility class deciding whether a path or property is excluded by ignore rules.
 * Patterns are plain strings; the only wildcard is a single trailing {@code *}.
 */
public final class IgnoreRuleMatcher {

    private IgnoreRuleMatcher() {
    }

    /**
     * Check a structural path against a list of ignore patterns.
     *
     * @param path The structural path, e.g. {@code /root/child}
     * @param patterns The ignore path patterns, may be null
     * @return true if any pattern matches
     */
    public static boolean pathIsIgnored(String path, Collection<String> patterns) {
        if (path == null || patterns == null || patterns.isEmpty()) {
            return false;
        }
        for (String pattern : patterns) {
            if (pathMatches(path, pattern)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Check a single pattern.
     * <ul>
     *     <li>exact equality matches;</li>
     *     <li>{@code prefix*} matches any path starting with {@code prefix};</li>
     *     <li>{@code prefix/} matches any path below {@code prefix}, and the path
     *     {@code prefix} itself without its trailing slash;</li>
     *     <li>anything else matches nothing.</li>
     * </ul>
     *
     * @param path The structural path
     * @param pattern The ignore pattern
     * @return true if the pattern matches the path
     */
    public static boolean pathMatches(String path, String pattern) {
        if (pattern == null || path == null) {
            return false;
        }
        if (pattern.equals(path)) {
            return true;
        }
        if (pattern.endsWith("*")) {
            return path.startsWith(pattern.substring(0, pattern.length() - 1));
        }
        if (pattern.endsWith("/")) {
            return path.startsWith(pattern) || (path + "/").startsWith(pattern);
        }
        return false;
    }

    /**
     * Check an attribute key or tag name against the ignored property names.
     *
     * @param name The attribute key or tag name
     * @param properties The ignored property names, may be null
     * @return true if the name is ignored
     */
    public static boolean propertyIsIgnored(String name, Collection<String> properties) {
        return name != null && properties != null && properties.contains(name);
    }
}
