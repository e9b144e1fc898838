package guraa.xmlcompare.controller;

import guraa.xmlcompare.config.AppProperties;
import guraa.xmlcompare.exception.AuthenticationException;
import guraa.xmlcompare.model.LoginResponse;
import guraa.xmlcompare.service.AuthService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = {AuthController.class, HealthController.class})
@Import(AppProperties.class)
class AuthControllerTest {

    @Autowired MockMvc mvc;
    @MockBean AuthService authService;

    @Test
    void loginReturnsTheSession() throws Exception {
        when(authService.login(any())).thenReturn(LoginResponse.builder()
                .sessionId("s-1")
                .cookies(List.of("SID=1"))
                .expiresAt(Instant.parse("2030-01-01T00:00:00Z"))
                .build());

        mvc.perform(post("/api/auth/login").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"url\":\"http://host/login\",\"username\":\"bob\",\"password\":\"pw\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.session_id").value("s-1"))
                .andExpect(jsonPath("$.cookies[0]").value("SID=1"))
                .andExpect(jsonPath("$.expires_at").value("2030-01-01T00:00:00Z"));
    }

    @Test
    void rejectedLoginIsUnauthorized() throws Exception {
        when(authService.login(any())).thenThrow(new AuthenticationException("HTTP 401"));

        mvc.perform(post("/api/auth/login").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"url\":\"http://host/login\",\"username\":\"bob\",\"password\":\"bad\"}"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.status").value(401))
                .andExpect(jsonPath("$.error").value("Authentication failed: HTTP 401"));
    }

    @Test
    void logoutOfKnownSession() throws Exception {
        when(authService.logout("s-1")).thenReturn(true);

        mvc.perform(post("/api/auth/logout/s-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("logged_out"));
    }

    @Test
    void logoutOfUnknownSessionIsNotFound() throws Exception {
        when(authService.logout("nope")).thenReturn(false);

        mvc.perform(post("/api/auth/logout/nope"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.status").value(404));
    }

    @Test
    void healthIsUp() throws Exception {
        mvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"));
    }
}
