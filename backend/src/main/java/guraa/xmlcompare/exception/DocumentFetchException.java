package guraa.xmlcompare.exception;

/**
 * Thrown when a remote document could not be retrieved.
 */
public class DocumentFetchException extends XmlCompareException {

    private final String url;

    public DocumentFetchException(String url, String message) {
        super("Failed to fetch XML from " + url + ": " + message);
        this.url = url;
    }

    public DocumentFetchException(String url, String message, Throwable cause) {
        super("Failed to fetch XML from " + url + ": " + message, cause);
        this.url = url;
    }

    public String getUrl() {
        return url;
    }
}
