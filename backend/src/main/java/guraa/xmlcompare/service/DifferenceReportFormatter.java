package guraa.xmlcompare.service;

import guraa.xmlcompare.model.ComparisonResult;
import guraa.xmlcompare.model.difference.AttributeDifference;
import guraa.xmlcompare.model.difference.ContentDifference;
import guraa.xmlcompare.model.difference.DiffType;
import guraa.xmlcompare.model.difference.ElementExtraDifference;
import guraa.xmlcompare.model.difference.ElementMissingDifference;
import guraa.xmlcompare.model.difference.StructureDifference;
import guraa.xmlcompare.model.difference.XmlDifference;
import guraa.xmlcompare.model.difference.XmlDifferenceVisitor;
import org.springframework.stereotype.Service;

import java.util.Locale;

/**
 * Renders a comparison result as a plain-text report.
 */
@Service
public class DifferenceReportFormatter {

    private static final String RULE = "==========================================================";

    private final XmlDifferenceVisitor<String> lineRenderer = new LineRenderer();

    /**
     * Generate a report for a comparison result.
     *
     * @param result The comparison result
     * @return The report text
     */
    public String format(ComparisonResult result) {
        StringBuilder report = new StringBuilder();
        report.append(RULE).append('\n');
        report.append("XML comparison report").append('\n');
        report.append(RULE).append('\n');
        report.append("Matched: ").append(result.isMatched() ? "yes" : "no").append('\n');
        report.append(String.format(Locale.ROOT, "Match ratio: %.2f%% (%d of %d elements)%n",
                result.getMatchRatio() * 100, result.getMatchedElements(), result.getTotalElements()));
        report.append("Differences: ").append(result.getDiffs().size()).append('\n');

        for (DiffType type : DiffType.values()) {
            long count = result.countByType(type);
            if (count > 0) {
                report.append("  ").append(label(type)).append(": ").append(count).append('\n');
            }
        }

        if (!result.getDiffs().isEmpty()) {
            report.append('\n');
            int n = 1;
            for (XmlDifference diff : result.getDiffs()) {
                report.append(n++).append(". ").append(formatLine(diff)).append('\n');
            }
        }
        return report.toString();
    }

    /**
     * Render a single difference as one line.
     *
     * @param difference The difference
     * @return The line, without a trailing newline
     */
    public String formatLine(XmlDifference difference) {
        return difference.accept(lineRenderer);
    }

    private static String label(DiffType type) {
        switch (type) {
            case ELEMENT_MISSING:
                return "Missing elements";
            case ELEMENT_EXTRA:
                return "Extra elements";
            case ATTRIBUTE_DIFFERENT:
                return "Attribute differences";
            case CONTENT_DIFFERENT:
                return "Content differences";
            case STRUCTURE_DIFFERENT:
                return "Structure differences";
            default:
                return type.name();
        }
    }

    private static class LineRenderer implements XmlDifferenceVisitor<String> {

        @Override
        public String visitElementMissing(ElementMissingDifference difference) {
            return "[MISSING] " + difference.getPath();
        }

        @Override
        public String visitElementExtra(ElementExtraDifference difference) {
            return "[EXTRA] " + difference.getPath();
        }

        @Override
        public String visitAttribute(AttributeDifference difference) {
            String prefix = "[ATTRIBUTE] " + difference.getPath() + " @" + difference.getAttributeName() + ": ";
            if (difference.isMissing()) {
                return prefix + "'" + difference.getExpectedValue() + "' missing in second document";
            }
            if (difference.isExtra()) {
                return prefix + "'" + difference.getActualValue() + "' only in second document";
            }
            return prefix + "'" + difference.getExpectedValue() + "' -> '" + difference.getActualValue() + "'";
        }

        @Override
        public String visitContent(ContentDifference difference) {
            return "[CONTENT] " + difference.getPath() + ": '"
                    + nullToEmpty(difference.getExpectedContent()) + "' -> '"
                    + nullToEmpty(difference.getActualContent()) + "'";
        }

        @Override
        public String visitStructure(StructureDifference difference) {
            return "[STRUCTURE] " + difference.getPath() + ": <"
                    + difference.getExpectedElement().getName() + "> -> <"
                    + difference.getActualElement().getName() + ">";
        }

        private static String nullToEmpty(String s) {
            return s == null ? "" : s;
        }
    }
}
