package guraa.xmlcompare.source;

import guraa.xmlcompare.config.AppProperties;
import guraa.xmlcompare.exception.AuthenticationException;
import guraa.xmlcompare.exception.DocumentFetchException;
import guraa.xmlcompare.session.Session;
import guraa.xmlcompare.session.SessionStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * {@link DocumentSource} over plain HTTP(S).
 * Logins post a form with {@code username} and {@code password}; the
 * {@code Set-Cookie} headers of the answer become the session cookies and are
 * sent back on every fetch made with that session.
 */
@Slf4j
@Component
public class HttpDocumentSource implements DocumentSource {

    private final RestTemplate restTemplate;
    private final SessionStore sessionStore;
    private final Duration sessionTtl;

    public HttpDocumentSource(RestTemplate documentRestTemplate,
                              SessionStore sessionStore,
                              AppProperties appProperties) {
        this.restTemplate = documentRestTemplate;
        this.sessionStore = sessionStore;
        this.sessionTtl = appProperties.getSession().getTtl();
    }

    @Override
    public String fetch(String url, String sessionId) throws DocumentFetchException {
        HttpHeaders headers = new HttpHeaders();
        headers.setAccept(List.of(MediaType.APPLICATION_XML, MediaType.TEXT_XML, MediaType.ALL));

        if (sessionId != null) {
            Optional<Session> session = sessionStore.find(sessionId);
            if (session.isPresent()) {
                String cookieHeader = toCookieHeader(session.get().getCookies());
                if (!cookieHeader.isEmpty()) {
                    headers.set(HttpHeaders.COOKIE, cookieHeader);
                }
            } else {
                log.warn("Session {} not found or expired, fetching {} without cookies", sessionId, url);
            }
        }

        try {
            log.debug("Fetching XML from {}", url);
            ResponseEntity<byte[]> response = restTemplate.exchange(url, HttpMethod.GET,
                    new HttpEntity<>(headers), byte[].class);
            if (!response.getStatusCode().is2xxSuccessful()) {
                throw new DocumentFetchException(url, "HTTP " + response.getStatusCodeValue());
            }
            return decode(response.getBody(), response.getHeaders().getContentType());
        } catch (HttpStatusCodeException e) {
            throw new DocumentFetchException(url, "HTTP " + e.getRawStatusCode(), e);
        } catch (RestClientException e) {
            throw new DocumentFetchException(url, e.getMessage(), e);
        }
    }

    @Override
    public Session authenticate(String url, String username, String password) throws AuthenticationException {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);

        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("username", username);
        form.add("password", password);

        ResponseEntity<String> response;
        try {
            log.info("Authenticating user {} against {}", username, url);
            response = restTemplate.exchange(url, HttpMethod.POST, new HttpEntity<>(form, headers), String.class);
        } catch (HttpStatusCodeException e) {
            throw new AuthenticationException("login at " + url + " answered HTTP " + e.getRawStatusCode(), e);
        } catch (RestClientException e) {
            throw new AuthenticationException("login at " + url + " failed: " + e.getMessage(), e);
        }

        if (!response.getStatusCode().is2xxSuccessful()) {
            throw new AuthenticationException("login at " + url + " answered HTTP " + response.getStatusCodeValue());
        }

        List<String> cookies = response.getHeaders().get(HttpHeaders.SET_COOKIE);
        Session session = Session.create(url, cookies == null ? new ArrayList<>() : cookies, sessionTtl);
        sessionStore.put(session);

        log.info("Created session {} for {} ({} cookies, expires {})",
                session.getId(), url, session.getCookies().size(), session.getExpiresAt());
        return session;
    }

    /**
     * Decode a response body with the charset of its content type, or UTF-8
     * when the content type names none. A leading byte order mark is dropped.
     */
    static String decode(byte[] body, MediaType contentType) {
        if (body == null) {
            return "";
        }
        Charset charset = contentType != null && contentType.getCharset() != null
                ? contentType.getCharset()
                : StandardCharsets.UTF_8;
        String text = new String(body, charset);
        return text.startsWith("\uFEFF") ? text.substring(1) : text;
    }

    /**
     * Turn {@code Set-Cookie} values into a single {@code Cookie} header,
     * keeping only the name=value pair of each.
     */
    static String toCookieHeader(List<String> setCookies) {
        return setCookies.stream()
                .map(c -> {
                    int semicolon = c.indexOf(';');
                    return (semicolon >= 0 ? c.substring(0, semicolon) : c).trim();
                })
                .filter(c -> !c.isEmpty())
                .collect(Collectors.joining("; "));
    }
}
