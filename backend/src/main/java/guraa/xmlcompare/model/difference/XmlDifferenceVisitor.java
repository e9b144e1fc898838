package guraa.xmlcompare.model.difference;

/**
 * Exhaustive handler over the difference kinds.
 *
 * @param <R> The result type
 */
public interface XmlDifferenceVisitor<R> {

    R visitElementMissing(ElementMissingDifference difference);

    R visitElementExtra(ElementExtraDifference difference);

    R visitAttribute(AttributeDifference difference);

    R visitContent(ContentDifference difference);

    R visitStructure(StructureDifference difference);
}
