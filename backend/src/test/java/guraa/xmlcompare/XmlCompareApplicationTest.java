package guraa.xmlcompare;

import guraa.xmlcompare.session.SessionCleanupService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest
class XmlCompareApplicationTest {

    @Autowired SessionCleanupService sessionCleanupService;

    @Test
    void contextLoadsAndStartsTheSessionSweep() {
        assertTrue(sessionCleanupService.isRunning());
    }
}
