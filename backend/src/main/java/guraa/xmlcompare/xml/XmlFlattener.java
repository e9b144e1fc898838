package guraa.xmlcompare.xml;

import com.ctc.wstx.api.WstxInputProperties;
import com.ctc.wstx.exc.WstxLazyException;
import com.ctc.wstx.stax.WstxInputFactory;
import guraa.xmlcompare.config.AppProperties;
import guraa.xmlcompare.exception.XmlParseException;
import guraa.xmlcompare.model.FlattenedDocument;
import guraa.xmlcompare.model.XmlElement;
import lombok.extern.slf4j.Slf4j;
import org.codehaus.stax2.XMLInputFactory2;
import org.codehaus.stax2.XMLStreamReader2;
import org.springframework.stereotype.Component;

import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import java.io.StringReader;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parses an XML document into a {@link FlattenedDocument} in a single streaming pass.
 * <p>
 * Each start tag produces one {@link XmlElement} keyed by the chain of ancestor
 * tag names. The reader is not namespace aware: prefixed names are kept as
 * written and namespace declarations are ordinary attributes.
 * <p>
 * Thread-safe: one {@link XMLInputFactory2} per thread.
 */
@Slf4j
@Component
public class XmlFlattener {

    private final ThreadLocal<XMLInputFactory2> factory;

    public XmlFlattener(AppProperties appProperties) {
        AppProperties.Xml limits = appProperties.getXml();
        this.factory = ThreadLocal.withInitial(() -> {
            XMLInputFactory2 f = new WstxInputFactory();
            f.setProperty(XMLInputFactory.SUPPORT_DTD, Boolean.FALSE);
            f.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, Boolean.FALSE);
            f.setProperty(XMLInputFactory.IS_NAMESPACE_AWARE, Boolean.FALSE);
            // one event per contiguous text run, CDATA included
            f.setProperty(XMLInputFactory.IS_COALESCING, Boolean.TRUE);
            f.setProperty(WstxInputProperties.P_MAX_ELEMENT_DEPTH, limits.getMaxElementDepth());
            f.setProperty(WstxInputProperties.P_MAX_ATTRIBUTES_PER_ELEMENT, limits.getMaxAttributesPerElement());
            f.setProperty(WstxInputProperties.P_MAX_ATTRIBUTE_SIZE, limits.getMaxAttributeSize());
            f.setXMLResolver((publicId, systemId, baseURI, ns) -> null);
            return f;
        });
    }

    /**
     * Flatten an XML document.
     *
     * @param xml The document text
     * @return The flattened document
     * @throws XmlParseException If the tokenizer reports an error; no partial result is returned
     */
    public FlattenedDocument flatten(String xml) throws XmlParseException {
        XMLStreamReader2 r = null;
        try {
            r = (XMLStreamReader2) factory.get().createXMLStreamReader(new StringReader(xml));

            FlattenedDocument document = new FlattenedDocument();
            Deque<XmlElement> open = new ArrayDeque<>();

            while (r.hasNext()) {
                int event = r.next();
                switch (event) {
                    case XMLStreamConstants.START_ELEMENT:
                        open.push(onStart(r, document, open.peek()));
                        break;
                    case XMLStreamConstants.CHARACTERS:
                    case XMLStreamConstants.CDATA:
                        onText(r, open.peek());
                        break;
                    case XMLStreamConstants.END_ELEMENT:
                        open.pop();
                        break;
                    default:
                        break;
                }
            }

            log.debug("Flattened XML document into {} elements", document.size());
            return document;
        } catch (XMLStreamException e) {
            throw new XmlParseException(e.getMessage(), e);
        } catch (WstxLazyException e) {
            // text content is tokenized lazily, so errors inside it surface unchecked
            throw new XmlParseException(e.getMessage(), e);
        } finally {
            closeQuietly(r);
        }
    }

    private XmlElement onStart(XMLStreamReader2 r, FlattenedDocument document, XmlElement parent) {
        String name = qualifiedName(r.getPrefix(), r.getLocalName());
        String path = parent == null ? "/" + name : parent.getPath() + "/" + name;

        Map<String, String> attributes = new LinkedHashMap<>();
        for (int i = 0; i < r.getAttributeCount(); i++) {
            attributes.put(qualifiedName(r.getAttributePrefix(i), r.getAttributeLocalName(i)),
                    r.getAttributeValue(i));
        }

        return document.add(XmlElement.builder()
                .name(name)
                .attributes(attributes)
                .path(path)
                .build());
    }

    /**
     * The last non-blank text run of an element wins.
     */
    private void onText(XMLStreamReader2 r, XmlElement current) {
        if (current == null) {
            return;
        }
        String text = r.getText().trim();
        if (!text.isEmpty()) {
            current.setContent(text);
        }
    }

    private static String qualifiedName(String prefix, String localName) {
        return prefix == null || prefix.isEmpty() ? localName : prefix + ":" + localName;
    }

    private static void closeQuietly(XMLStreamReader2 r) {
        if (r == null) {
            return;
        }
        try {
            r.close();
        } catch (XMLStreamException e) {
            log.debug("Failed to close XML reader: {}", e.getMessage());
        }
    }
}
