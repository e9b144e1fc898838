package guraa.xmlcompare.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A single element of a flattened XML document.
 * The element keeps its own attributes and text but no children; its place in
 * the tree is described only by its structural path and ordinal.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class XmlElement {

    /**
     * The tag name, including any namespace prefix as written.
     */
    private String name;

    /**
     * The attributes in document order.
     */
    @Builder.Default
    private Map<String, String> attributes = new LinkedHashMap<>();

    /**
     * The trimmed text content, or null when the element has none.
     */
    private String content;

    /**
     * Slash-delimited chain of ancestor tag names ending with this element's name.
     */
    private String path;

    /**
     * Zero-based position among the elements of the same document sharing this path.
     */
    private int ordinal;

    /**
     * Get the path used when reporting differences for this element.
     * The first element at a path is reported by the bare path, later ones
     * get a one-based index suffix.
     *
     * @return The display path
     */
    public String getDisplayPath() {
        return ordinal == 0 ? path : path + "[" + (ordinal + 1) + "]";
    }
}
