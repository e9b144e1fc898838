package guraa.xmlcompare.model.difference;

import com.fasterxml.jackson.annotation.JsonIgnore;
import guraa.xmlcompare.model.XmlElement;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

/**
 * An element of the first document with no counterpart in the second.
 */
@Data
@SuperBuilder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(callSuper = true)
public class ElementMissingDifference extends XmlDifference {

    @JsonIgnore
    private XmlElement expectedElement;

    @Override
    public DiffType getDiffType() {
        return DiffType.ELEMENT_MISSING;
    }

    @Override
    public String getExpected() {
        return expectedElement == null ? null : expectedElement.toString();
    }

    @Override
    public String getActual() {
        return null;
    }

    @Override
    public <R> R accept(XmlDifferenceVisitor<R> visitor) {
        return visitor.visitElementMissing(this);
    }
}
