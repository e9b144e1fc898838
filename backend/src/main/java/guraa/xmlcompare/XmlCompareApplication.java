package guraa.xmlcompare;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;

import java.time.Duration;
import java.time.Instant;

/**
 * Main application class for XML Compare.
 */
@Slf4j
@SpringBootApplication
public class XmlCompareApplication {

    public static void main(String[] args) {
        Instant startTime = Instant.now();

        SpringApplication.run(XmlCompareApplication.class, args);

        logStartupInfo(Duration.between(startTime, Instant.now()));
    }

    /**
     * Log information about the application startup.
     *
     * @param startupTime The time taken to start up
     */
    private static void logStartupInfo(Duration startupTime) {
        log.info("==========================================================");
        log.info("XML Compare application started in {}.{}s",
                startupTime.toSecondsPart(), String.format("%03d", startupTime.toMillisPart()));
        log.info("  Java: {}", System.getProperty("java.version"));
        log.info("  Available processors: {}", Runtime.getRuntime().availableProcessors());
        log.info("==========================================================");
    }

    @EventListener
    public void onApplicationEvent(ContextClosedEvent event) {
        log.info("Application is shutting down");
    }
}
