package guraa.xmlcompare.controller;

import guraa.xmlcompare.exception.AuthenticationException;
import guraa.xmlcompare.exception.ValidationException;
import guraa.xmlcompare.model.LoginRequest;
import guraa.xmlcompare.model.LoginResponse;
import guraa.xmlcompare.service.AuthService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

/**
 * Controller for logging in to and out of remote document hosts.
 */
@Slf4j
@RestController
@RequestMapping("/api/auth")
@RequiredArgsConstructor
public class AuthController {

    private final AuthService authService;

    @PostMapping("/login")
    public ResponseEntity<LoginResponse> login(@RequestBody LoginRequest request)
            throws ValidationException, AuthenticationException {
        log.info("Login request for {} at {}", request.getUsername(), request.getUrl());
        return ResponseEntity.ok(authService.login(request));
    }

    /**
     * End a session.
     *
     * @param sessionId The session id
     * @return 200 if the session was removed, 404 if it was unknown
     */
    @PostMapping("/logout/{sessionId}")
    public ResponseEntity<Map<String, Object>> logout(@PathVariable String sessionId) {
        Map<String, Object> response = new HashMap<>();
        if (authService.logout(sessionId)) {
            response.put("status", "logged_out");
            return ResponseEntity.ok(response);
        }
        response.put("error", "Session not found: " + sessionId);
        response.put("status", HttpStatus.NOT_FOUND.value());
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(response);
    }
}
