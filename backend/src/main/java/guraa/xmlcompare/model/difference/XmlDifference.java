package guraa.xmlcompare.model.difference;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

/**
 * Base class for all differences between two XML documents.
 * The set of subclasses is closed: one per {@link DiffType}. Code that needs to
 * treat every kind goes through {@link #accept(XmlDifferenceVisitor)}.
 */
@Data
@SuperBuilder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public abstract class XmlDifference {

    /**
     * The path of the element the difference was found at.
     */
    private String path;

    /**
     * A human-readable description of the difference.
     */
    private String message;

    /**
     * Get the kind of this difference.
     *
     * @return The diff type
     */
    public abstract DiffType getDiffType();

    /**
     * Get the rendering of the value found in the first document.
     *
     * @return The expected value, or null if the first document has none
     */
    public abstract String getExpected();

    /**
     * Get the rendering of the value found in the second document.
     *
     * @return The actual value, or null if the second document has none
     */
    public abstract String getActual();

    public abstract <R> R accept(XmlDifferenceVisitor<R> visitor);
}
