package guraa.xmlcompare.exception;

/**
 * Thrown when a document cannot be tokenized. Carries the lexical error
 * reported by the underlying parser.
 */
public class XmlParseException extends XmlCompareException {

    public XmlParseException(String message, Throwable cause) {
        super("XML parsing error: " + message, cause);
    }
}
