package guraa.xmlcompare.service;

import guraa.xmlcompare.config.AppProperties;
import guraa.xmlcompare.model.ComparisonResult;
import guraa.xmlcompare.xml.XmlFlattener;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DifferenceReportFormatterTest {

    private final XmlComparisonService comparisonService =
            new XmlComparisonService(new XmlFlattener(new AppProperties()), new XmlDiffEngine());
    private final DifferenceReportFormatter formatter = new DifferenceReportFormatter();

    @Test
    void reportListsEveryDifference() throws Exception {
        ComparisonResult result = comparisonService.compareDocuments(
                "<CVAMapping date=\"20250819\">test</CVAMapping>",
                "<CVAMapping date=\"20250818\">test2</CVAMapping>", null);

        String report = formatter.format(result);

        assertTrue(report.contains("Matched: no"));
        assertTrue(report.contains("Match ratio: 0.00% (0 of 1 elements)"));
        assertTrue(report.contains("Content differences: 1"));
        assertTrue(report.contains("Attribute differences: 1"));
        assertTrue(report.contains("1. [CONTENT] /CVAMapping: 'test' -> 'test2'"));
        assertTrue(report.contains("2. [ATTRIBUTE] /CVAMapping @date: '20250819' -> '20250818'"));
    }

    @Test
    void matchingReportHasNoDifferenceLines() throws Exception {
        ComparisonResult result = comparisonService.compareDocuments("<a/>", "<a/>", null);

        String report = formatter.format(result);

        assertTrue(report.contains("Matched: yes"));
        assertTrue(report.contains("Differences: 0"));
        assertFalse(report.contains("1. "));
    }

    @Test
    void missingAndExtraLines() throws Exception {
        ComparisonResult result = comparisonService.compareDocuments("<r><a/></r>", "<r><b/></r>", null);

        assertEquals("[MISSING] /r/a", formatter.formatLine(result.getDiffs().get(0)));
        assertEquals("[EXTRA] /r/b", formatter.formatLine(result.getDiffs().get(1)));
    }
}
