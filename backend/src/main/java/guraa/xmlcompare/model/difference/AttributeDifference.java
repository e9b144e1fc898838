package guraa.xmlcompare.model.difference;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

/**
 * An attribute that differs between two matched elements, or that only one
 * of them carries.
 */
@Data
@SuperBuilder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(callSuper = true)
public class AttributeDifference extends XmlDifference {

    @JsonIgnore
    private String attributeName;

    /**
     * The value in the first document, null when the attribute is extra.
     */
    @JsonIgnore
    private String expectedValue;

    /**
     * The value in the second document, null when the attribute is missing.
     */
    @JsonIgnore
    private String actualValue;

    @Override
    public DiffType getDiffType() {
        return DiffType.ATTRIBUTE_DIFFERENT;
    }

    @Override
    public String getExpected() {
        return expectedValue == null ? null : attributeName + "=" + expectedValue;
    }

    @Override
    public String getActual() {
        return actualValue == null ? null : attributeName + "=" + actualValue;
    }

    @JsonIgnore
    public boolean isMissing() {
        return actualValue == null;
    }

    @JsonIgnore
    public boolean isExtra() {
        return expectedValue == null;
    }

    @Override
    public <R> R accept(XmlDifferenceVisitor<R> visitor) {
        return visitor.visitAttribute(this);
    }
}
