package guraa.xmlcompare.exception;

/**
 * Thrown for input rejected before any parsing or network work happens:
 * empty documents, text that does not look like XML, malformed URLs.
 */
public class ValidationException extends XmlCompareException {

    public ValidationException(String message) {
        super("Validation error: " + message);
    }
}
