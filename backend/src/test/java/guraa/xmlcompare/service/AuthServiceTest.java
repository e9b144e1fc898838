package guraa.xmlcompare.service;

import guraa.xmlcompare.exception.AuthenticationException;
import guraa.xmlcompare.exception.ValidationException;
import guraa.xmlcompare.model.LoginRequest;
import guraa.xmlcompare.model.LoginResponse;
import guraa.xmlcompare.session.Session;
import guraa.xmlcompare.session.SessionStore;
import guraa.xmlcompare.source.DocumentSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AuthServiceTest {

    private DocumentSource documentSource;
    private SessionStore sessionStore;
    private AuthService authService;

    @BeforeEach
    void setUp() {
        documentSource = mock(DocumentSource.class);
        sessionStore = new SessionStore();
        authService = new AuthService(documentSource, sessionStore);
    }

    @Test
    void loginReturnsTheSession() throws Exception {
        Session session = Session.create("https://host/login", List.of("SID=1"), Duration.ofHours(1));
        when(documentSource.authenticate("https://host/login", "bob", "pw")).thenReturn(session);

        LoginResponse response = authService.login(new LoginRequest("https://host/login", "bob", "pw"));

        assertEquals(session.getId(), response.getSessionId());
        assertEquals(List.of("SID=1"), response.getCookies());
        assertEquals(session.getExpiresAt(), response.getExpiresAt());
    }

    @Test
    void loginRejectsNonHttpUrls() throws Exception {
        assertThrows(ValidationException.class,
                () -> authService.login(new LoginRequest("file:///etc/passwd", "bob", "pw")));
        verify(documentSource, never()).authenticate(anyString(), anyString(), anyString());
    }

    @Test
    void loginFailurePropagates() throws Exception {
        when(documentSource.authenticate(anyString(), anyString(), anyString()))
                .thenThrow(new AuthenticationException("HTTP 403"));

        assertThrows(AuthenticationException.class,
                () -> authService.login(new LoginRequest("http://host/login", "bob", "pw")));
    }

    @Test
    void logoutRemovesKnownSessionsOnly() {
        Session session = Session.create("http://host/login", List.of(), Duration.ofHours(1));
        sessionStore.put(session);

        assertTrue(authService.logout(session.getId()));
        assertFalse(sessionStore.find(session.getId()).isPresent());
        assertFalse(authService.logout(session.getId()));
    }
}
