package guraa.xmlcompare.model.difference;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

/**
 * Text content that differs between two matched elements.
 */
@Data
@SuperBuilder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(callSuper = true)
public class ContentDifference extends XmlDifference {

    @JsonIgnore
    private String expectedContent;

    @JsonIgnore
    private String actualContent;

    @Override
    public DiffType getDiffType() {
        return DiffType.CONTENT_DIFFERENT;
    }

    @Override
    public String getExpected() {
        return expectedContent;
    }

    @Override
    public String getActual() {
        return actualContent;
    }

    @Override
    public <R> R accept(XmlDifferenceVisitor<R> visitor) {
        return visitor.visitContent(this);
    }
}
