package guraa.xmlcompare.session;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * An authenticated session against a remote document host: the cookies
 * handed out at login and the instant after which they are discarded.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Session {

    private String id;

    /**
     * The login URL the session was created against.
     */
    private String url;

    @Builder.Default
    private List<String> cookies = new ArrayList<>();

    private Instant createdAt;

    private Instant expiresAt;

    /**
     * Create a new session with a random id.
     *
     * @param url The login URL
     * @param cookies The cookies returned by the login call
     * @param ttl How long the session stays valid
     * @return The session
     */
    public static Session create(String url, List<String> cookies, Duration ttl) {
        Instant now = Instant.now();
        return Session.builder()
                .id(UUID.randomUUID().toString())
                .url(url)
                .cookies(new ArrayList<>(cookies))
                .createdAt(now)
                .expiresAt(now.plus(ttl))
                .build();
    }

    public boolean isExpired() {
        return isExpiredAt(Instant.now());
    }

    public boolean isExpiredAt(Instant instant) {
        return instant.isAfter(expiresAt);
    }
}
