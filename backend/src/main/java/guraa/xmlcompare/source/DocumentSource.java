package guraa.xmlcompare.source;

import guraa.xmlcompare.exception.AuthenticationException;
import guraa.xmlcompare.exception.DocumentFetchException;
import guraa.xmlcompare.session.Session;

/**
 * Where URL-sourced documents come from.
 */
public interface DocumentSource {

    /**
     * Download the document served at a URL.
     *
     * @param url The document URL
     * @param sessionId An authenticated session to send cookies from, may be null
     * @return The document text
     * @throws DocumentFetchException If the request fails or the host answers with a non-success status
     */
    String fetch(String url, String sessionId) throws DocumentFetchException;

    /**
     * Log in to a host and keep the resulting session for later fetches.
     *
     * @param url The login URL
     * @param username The user name
     * @param password The password
     * @return The new session, already stored
     * @throws AuthenticationException If the host rejects the login or cannot be reached
     */
    Session authenticate(String url, String username, String password) throws AuthenticationException;
}
