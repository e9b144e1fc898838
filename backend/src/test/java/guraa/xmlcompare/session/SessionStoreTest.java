package guraa.xmlcompare.session;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SessionStoreTest {

    private final SessionStore store = new SessionStore();

    @Test
    void storedSessionCanBeFound() {
        Session session = Session.create("http://host/login", List.of("sid=1"), Duration.ofHours(1));
        store.put(session);

        assertTrue(store.find(session.getId()).isPresent());
        assertEquals(List.of("sid=1"), store.find(session.getId()).get().getCookies());
    }

    @Test
    void expiredSessionIsNotReturned() {
        store.put(expiredSession("old"));

        assertFalse(store.find("old").isPresent());
        assertFalse(store.find(null).isPresent());
    }

    @Test
    void sweepRemovesOnlyExpiredSessions() {
        Session live = Session.create("http://host/login", List.of(), Duration.ofHours(1));
        store.put(live);
        store.put(expiredSession("old-1"));
        store.put(expiredSession("old-2"));

        assertEquals(2, store.sweepExpired(Instant.now()));
        assertEquals(1, store.size());
        assertTrue(store.find(live.getId()).isPresent());
    }

    @Test
    void removeReportsWhetherTheSessionExisted() {
        Session session = Session.create("http://host/login", List.of(), Duration.ofHours(1));
        store.put(session);

        assertTrue(store.remove(session.getId()));
        assertFalse(store.remove(session.getId()));
        assertFalse(store.remove("unknown"));
    }

    private static Session expiredSession(String id) {
        Instant past = Instant.now().minus(Duration.ofHours(2));
        return Session.builder()
                .id(id)
                .url("http://host/login")
                .createdAt(past)
                .expiresAt(past.plus(Duration.ofHours(1)))
                .build();
    }
}
