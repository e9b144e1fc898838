package guraa.xmlcompare.model.difference;

import com.fasterxml.jackson.annotation.JsonIgnore;
import guraa.xmlcompare.model.XmlElement;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

/**
 * Two elements aligned at the same position that are not the same element,
 * reported when no finer-grained difference explains it.
 */
@Data
@SuperBuilder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(callSuper = true)
public class StructureDifference extends XmlDifference {

    @JsonIgnore
    private XmlElement expectedElement;

    @JsonIgnore
    private XmlElement actualElement;

    @Override
    public DiffType getDiffType() {
        return DiffType.STRUCTURE_DIFFERENT;
    }

    @Override
    public String getExpected() {
        return expectedElement == null ? null : expectedElement.toString();
    }

    @Override
    public String getActual() {
        return actualElement == null ? null : actualElement.toString();
    }

    @Override
    public <R> R accept(XmlDifferenceVisitor<R> visitor) {
        return visitor.visitStructure(this);
    }
}
