package guraa.xmlcompare.service;

import guraa.xmlcompare.model.ComparisonResult;
import guraa.xmlcompare.model.FlattenedDocument;
import guraa.xmlcompare.model.IgnoreRules;
import guraa.xmlcompare.model.XmlElement;
import guraa.xmlcompare.model.difference.AttributeDifference;
import guraa.xmlcompare.model.difference.ContentDifference;
import guraa.xmlcompare.model.difference.ElementExtraDifference;
import guraa.xmlcompare.model.difference.ElementMissingDifference;
import guraa.xmlcompare.model.difference.StructureDifference;
import guraa.xmlcompare.model.difference.XmlDifference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import static guraa.xmlcompare.util.IgnoreRuleMatcher.pathIsIgnored;
import static guraa.xmlcompare.util.IgnoreRuleMatcher.propertyIsIgnored;

/**
 * Classifies the differences between two flattened documents.
 * <p>
 * Elements are aligned by structural path and ordinal. Every applicable
 * difference of an element is reported, not only the first one found.
 * The engine holds no state and does no I/O.
 */
@Slf4j
@Component
public class XmlDiffEngine {

    /**
     * Compare two flattened documents.
     *
     * @param doc1 The expected document
     * @param doc2 The actual document
     * @param rules The ignore rules
     * @return The comparison result
     */
    public ComparisonResult compare(FlattenedDocument doc1, FlattenedDocument doc2, IgnoreRules rules) {
        IgnoreRules ignore = rules == null ? IgnoreRules.none() : rules;

        List<XmlDifference> diffs = new ArrayList<>();
        int matchedElements = 0;
        // approximation, not the size of the union of both documents
        int totalElements = Math.max(doc1.size(), doc2.size());

        for (XmlElement element1 : doc1.getElements()) {
            if (isExcluded(element1, ignore)) {
                matchedElements++;
                continue;
            }

            XmlElement element2 = doc2.counterpartOf(element1);
            if (element2 == null) {
                diffs.add(ElementMissingDifference.builder()
                        .path(element1.getDisplayPath())
                        .expectedElement(element1)
                        .message("Element missing in second XML")
                        .build());
                continue;
            }

            List<XmlDifference> elementDiffs = compareElements(element1, element2, ignore);
            if (elementDiffs.isEmpty()) {
                matchedElements++;
            } else {
                diffs.addAll(elementDiffs);
            }
        }

        for (XmlElement element2 : doc2.getElements()) {
            if (!doc1.contains(element2.getPath(), element2.getOrdinal())) {
                diffs.add(ElementExtraDifference.builder()
                        .path(element2.getDisplayPath())
                        .actualElement(element2)
                        .message("Extra element in second XML")
                        .build());
            }
        }

        double matchRatio = totalElements > 0 ? (double) matchedElements / totalElements : 1.0;

        log.debug("Compared {} vs {} elements: {} matched, {} differences",
                doc1.size(), doc2.size(), matchedElements, diffs.size());

        return ComparisonResult.builder()
                .matched(diffs.isEmpty())
                .matchRatio(matchRatio)
                .diffs(diffs)
                .totalElements(totalElements)
                .matchedElements(matchedElements)
                .build();
    }

    /**
     * An ignored path or an ignored tag name excludes the whole element,
     * which then counts as matched.
     */
    private boolean isExcluded(XmlElement element, IgnoreRules ignore) {
        return pathIsIgnored(element.getPath(), ignore.getIgnorePaths())
                || propertyIsIgnored(element.getName(), ignore.getIgnoreProperties());
    }

    /**
     * Compare two aligned elements.
     *
     * @param element1 The element from the first document
     * @param element2 The element at the same path and ordinal in the second document
     * @param ignore The ignore rules
     * @return All differences found, empty if the elements match
     */
    List<XmlDifference> compareElements(XmlElement element1, XmlElement element2, IgnoreRules ignore) {
        List<XmlDifference> diffs = new ArrayList<>();
        String path = element1.getDisplayPath();

        boolean contentIgnored = propertyIsIgnored(element1.getName(), ignore.getIgnoreProperties())
                || propertyIsIgnored(element2.getName(), ignore.getIgnoreProperties());
        if (!contentIgnored && !Objects.equals(element1.getContent(), element2.getContent())) {
            diffs.add(ContentDifference.builder()
                    .path(path)
                    .expectedContent(element1.getContent())
                    .actualContent(element2.getContent())
                    .message("Content differs")
                    .build());
        }

        Map<String, String> attributes1 = element1.getAttributes();
        Map<String, String> attributes2 = element2.getAttributes();

        for (Map.Entry<String, String> attribute : attributes1.entrySet()) {
            String key = attribute.getKey();
            if (propertyIsIgnored(key, ignore.getIgnoreProperties())) {
                continue;
            }
            String value2 = attributes2.get(key);
            if (value2 == null) {
                diffs.add(AttributeDifference.builder()
                        .path(path)
                        .attributeName(key)
                        .expectedValue(attribute.getValue())
                        .message("Attribute '" + key + "' missing in second XML")
                        .build());
            } else if (!value2.equals(attribute.getValue())) {
                diffs.add(AttributeDifference.builder()
                        .path(path)
                        .attributeName(key)
                        .expectedValue(attribute.getValue())
                        .actualValue(value2)
                        .message("Attribute '" + key + "' differs")
                        .build());
            }
        }

        for (Map.Entry<String, String> attribute : attributes2.entrySet()) {
            String key = attribute.getKey();
            if (!propertyIsIgnored(key, ignore.getIgnoreProperties()) && !attributes1.containsKey(key)) {
                diffs.add(AttributeDifference.builder()
                        .path(path)
                        .attributeName(key)
                        .actualValue(attribute.getValue())
                        .message("Extra attribute '" + key + "' in second XML")
                        .build());
            }
        }

        if (diffs.isEmpty() && !Objects.equals(element1.getName(), element2.getName())) {
            diffs.add(StructureDifference.builder()
                    .path(path)
                    .expectedElement(element1)
                    .actualElement(element2)
                    .message("Element structure differs")
                    .build());
        }

        return diffs;
    }
}
