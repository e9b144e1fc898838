package guraa.xmlcompare.session;

import guraa.xmlcompare.config.AppProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import javax.annotation.PostConstruct;
import javax.annotation.PreDestroy;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;

/**
 * Periodically removes expired sessions from the {@link SessionStore}.
 * The sweep is scheduled on startup and its handle is cancelled on shutdown.
 */
@Slf4j
@Service
public class SessionCleanupService {

    private final SessionStore sessionStore;
    private final TaskScheduler taskScheduler;
    private final Duration sweepInterval;

    private ScheduledFuture<?> sweepHandle;

    public SessionCleanupService(SessionStore sessionStore,
                                 @Qualifier("sessionSweepScheduler") TaskScheduler taskScheduler,
                                 AppProperties appProperties) {
        this.sessionStore = sessionStore;
        this.taskScheduler = taskScheduler;
        this.sweepInterval = appProperties.getSession().getSweepInterval();
    }

    @PostConstruct
    public synchronized void start() {
        if (sweepHandle != null) {
            return;
        }
        sweepHandle = taskScheduler.scheduleAtFixedRate(this::cleanupExpiredSessions,
                Instant.now().plus(sweepInterval), sweepInterval);
        log.info("Session cleanup scheduled every {}", sweepInterval);
    }

    /**
     * Remove expired sessions now.
     *
     * @return The number of sessions removed
     */
    public int cleanupExpiredSessions() {
        try {
            int removed = sessionStore.sweepExpired(Instant.now());
            if (removed > 0) {
                log.info("Removed {} expired sessions, {} remaining", removed, sessionStore.size());
            } else {
                log.debug("No expired sessions to clean up");
            }
            return removed;
        } catch (Exception e) {
            log.error("Error during session cleanup", e);
            return 0;
        }
    }

    @PreDestroy
    public synchronized void stop() {
        if (sweepHandle != null) {
            sweepHandle.cancel(false);
            sweepHandle = null;
            log.info("Session cleanup stopped");
        }
    }

    public synchronized boolean isRunning() {
        return sweepHandle != null && !sweepHandle.isCancelled();
    }
}
