package guraa.xmlcompare.exception;

/**
 * Base class for all failures a comparison can surface to its caller.
 */
public abstract class XmlCompareException extends Exception {

    protected XmlCompareException(String message) {
        super(message);
    }

    protected XmlCompareException(String message, Throwable cause) {
        super(message, cause);
    }
}
