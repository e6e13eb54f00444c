package io.pollrunr;

import io.pollrunr.cron.CronScheduler;
import io.pollrunr.cron.TaskView;
import io.pollrunr.http.ResilientHttpClient;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(
        webEnvironment = SpringBootTest.WebEnvironment.NONE,
        properties = {
                "pollrunr.api.host=https://api.test",
                "pollrunr.scheduler.zone=UTC",
                "pollrunr.watches.server-open.enabled=true"
        })
class PollRunrApplicationTest {

    @Autowired
    private CronScheduler scheduler;

    @Autowired
    private ResilientHttpClient httpClient;

    @Test
    void shouldRegisterConfiguredWatchesOnStartup() {
        var names = scheduler.listTasks().stream().map(TaskView::name).toList();

        assertEquals(2, names.size());
        assertTrue(names.contains("skill-change"));
        assertTrue(names.contains("server-open"));
        assertNull(scheduler.getTask("server-maintenance"));
        assertEquals("*/20 8-18 * * *", scheduler.getTask("server-open").cron());
    }

    @Test
    void shouldNotOpenHttpSessionBeforeFirstRequest() {
        assertFalse(httpClient.isOpen());
        assertEquals(3, httpClient.getPolicy().maxRetries());
    }
}
