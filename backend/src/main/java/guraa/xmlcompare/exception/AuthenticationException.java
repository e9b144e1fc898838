package guraa.xmlcompare.exception;

public class AuthenticationException extends XmlCompareException {

    public AuthenticationException(String message) {
        super("Authentication failed: " + message);
    }

    public AuthenticationException(String message, Throwable cause) {
        super("Authentication failed: " + message, cause);
    }
}
