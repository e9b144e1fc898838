package guraa.xmlcompare.service;

import guraa.xmlcompare.exception.AuthenticationException;
import guraa.xmlcompare.exception.ValidationException;
import guraa.xmlcompare.model.LoginRequest;
import guraa.xmlcompare.model.LoginResponse;
import guraa.xmlcompare.session.Session;
import guraa.xmlcompare.session.SessionStore;
import guraa.xmlcompare.source.DocumentSource;
import guraa.xmlcompare.util.InputValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;

/**
 * Login and logout against remote document hosts.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuthService {

    private final DocumentSource documentSource;
    private final SessionStore sessionStore;

    /**
     * Log in to a document host.
     *
     * @param request The login request
     * @return The new session's id, cookies and expiry
     * @throws ValidationException If the URL is not http(s)
     * @throws AuthenticationException If the host rejects the login
     */
    public LoginResponse login(LoginRequest request) throws ValidationException, AuthenticationException {
        InputValidator.validateUrl(request.getUrl());
        if (request.getUsername() == null || request.getUsername().isBlank()) {
            throw new ValidationException("Username cannot be empty");
        }

        Session session = documentSource.authenticate(request.getUrl(), request.getUsername(), request.getPassword());
        return LoginResponse.builder()
                .sessionId(session.getId())
                .cookies(new ArrayList<>(session.getCookies()))
                .expiresAt(session.getExpiresAt())
                .build();
    }

    /**
     * End a session.
     *
     * @param sessionId The session id
     * @return true if the session existed
     */
    public boolean logout(String sessionId) {
        boolean removed = sessionStore.remove(sessionId);
        if (removed) {
            log.info("Session {} logged out", sessionId);
        } else {
            log.debug("Logout of unknown session {}", sessionId);
        }
        return removed;
    }
}
