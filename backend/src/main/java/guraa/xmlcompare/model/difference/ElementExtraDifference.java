package guraa.xmlcompare.model.difference;

import com.fasterxml.jackson.annotation.JsonIgnore;
import guraa.xmlcompare.model.XmlElement;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

/**
 * An element of the second document with no counterpart in the first.
 */
@Data
@SuperBuilder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(callSuper = true)
public class ElementExtraDifference extends XmlDifference {

    @JsonIgnore
    private XmlElement actualElement;

    @Override
    public DiffType getDiffType() {
        return DiffType.ELEMENT_EXTRA;
    }

    @Override
    public String getExpected() {
        return null;
    }

    @Override
    public String getActual() {
        return actualElement == null ? null : actualElement.toString();
    }

    @Override
    public <R> R accept(XmlDifferenceVisitor<R> visitor) {
        return visitor.visitElementExtra(this);
    }
}
