package guraa.xmlcompare.model.difference;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The kinds of difference the diff engine reports.
 */
public enum DiffType {
    @JsonProperty("ElementMissing")
    ELEMENT_MISSING,

    @JsonProperty("ElementExtra")
    ELEMENT_EXTRA,

    @JsonProperty("AttributeDifferent")
    ATTRIBUTE_DIFFERENT,

    @JsonProperty("ContentDifferent")
    CONTENT_DIFFERENT,

    @JsonProperty("StructureDifferent")
    STRUCTURE_DIFFERENT
}
