package guraa.xmlcompare.util;

import guraa.xmlcompare.exception.ValidationException;

/**
 * Cheap checks run before a document is parsed or a URL is contacted.
 */
public final class InputValidator {

    private InputValidator() {
    }

    /**
     * Reject empty input and input that cannot be XML.
     *
     * @param xml The raw document text
     * @param label Name of the field, used in the error message
     * @throws ValidationException If the content is empty or does not start with '<'
     */
    public static void validateXmlContent(String xml, String label) throws ValidationException {
        if (xml == null || xml.trim().isEmpty()) {
            throw new ValidationException(label + " content cannot be empty");
        }
        if (!xml.trim().startsWith("<")) {
            throw new ValidationException(label + " is not in XML format");
        }
    }

    /**
     * Only absolute http and https URLs are fetched.
     *
     * @param url The URL
     * @throws ValidationException If the URL is missing or uses another scheme
     */
    public static void validateUrl(String url) throws ValidationException {
        if (url == null || url.isBlank()) {
            throw new ValidationException("URL cannot be empty");
        }
        if (!url.startsWith("http://") && !url.startsWith("https://")) {
            throw new ValidationException("Invalid URL: " + url);
        }
    }
}
