package guraa.xmlcompare.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Path-addressable view of a parsed XML document.
 * Elements are held in document order; a secondary index maps each structural
 * path to the positions of the elements sharing it, so elements with repeated
 * sibling tags stay individually addressable by (path, ordinal).
 */
public class FlattenedDocument {

    private final List<XmlElement> elements = new ArrayList<>();
    private final Map<String, List<Integer>> pathIndex = new HashMap<>();

    /**
     * Append an element, assigning its ordinal from the elements already
     * recorded at the same path.
     *
     * @param element The element to add; its path must be set
     * @return The added element
     */
    public XmlElement add(XmlElement element) {
        List<Integer> positions = pathIndex.computeIfAbsent(element.getPath(), p -> new ArrayList<>());
        element.setOrdinal(positions.size());
        positions.add(elements.size());
        elements.add(element);
        return element;
    }

    /**
     * Find the element at a path and ordinal.
     *
     * @param path The structural path
     * @param ordinal The zero-based ordinal
     * @return The element, or null if this document has no such element
     */
    public XmlElement get(String path, int ordinal) {
        List<Integer> positions = pathIndex.get(path);
        if (positions == null || ordinal < 0 || ordinal >= positions.size()) {
            return null;
        }
        return elements.get(positions.get(ordinal));
    }

    /**
     * Find the counterpart of an element from another document.
     *
     * @param other An element of another document
     * @return The element with the same path and ordinal, or null
     */
    public XmlElement counterpartOf(XmlElement other) {
        return get(other.getPath(), other.getOrdinal());
    }

    public boolean contains(String path, int ordinal) {
        return get(path, ordinal) != null;
    }

    public List<XmlElement> getElements() {
        return Collections.unmodifiableList(elements);
    }

    public int size() {
        return elements.size();
    }
}
