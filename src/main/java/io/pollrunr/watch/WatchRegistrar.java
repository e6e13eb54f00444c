package io.pollrunr.watch;

import io.pollrunr.config.PollRunrProperties;
import io.pollrunr.cron.CronScheduler;
import io.pollrunr.http.ResilientHttpClient;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Host lifecycle hooks: registers every enabled {@link Watch} with the scheduler once the
 * application is ready, and on shutdown stops the scheduler before closing the HTTP session.
 */
@Component
public class WatchRegistrar {

    private static final Logger log = LoggerFactory.getLogger(WatchRegistrar.class);

    private final CronScheduler scheduler;
    private final ResilientHttpClient httpClient;
    private final List<Watch> watches;
    private final PollRunrProperties properties;

    public WatchRegistrar(CronScheduler scheduler, ResilientHttpClient httpClient, List<Watch> watches,
                          PollRunrProperties properties) {
        this.scheduler = scheduler;
        this.httpClient = httpClient;
        this.watches = watches;
        this.properties = properties;
    }

    /**
     * Registers the enabled watches. A malformed cron expression fails startup.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void registerWatches() {
        int registered = 0;
        for (Watch watch : watches) {
            PollRunrProperties.WatchConfig config = properties.watch(watch.name());
            boolean enabled = config.enabled() != null ? config.enabled() : watch.enabledByDefault();
            if (!enabled) {
                log.info("Watch '{}' disabled via configuration", watch.name());
                continue;
            }
            String cron = config.cron() != null && !config.cron().isBlank() ? config.cron() : watch.defaultCron();
            scheduler.addTask(watch.name(), WatchRegistrar::pollScheduled, cron, watch);
            registered++;
        }
        log.info("Registered {} of {} watch(es)", registered, watches.size());
    }

    @PreDestroy
    public void shutdown() {
        log.info("Shutting down: stopping scheduler and closing HTTP session");
        scheduler.stop();
        httpClient.close();
    }

    /**
     * Scheduled entry point; the watch is the single bound argument.
     */
    static void pollScheduled(List<Object> boundArgs) {
        Watch watch = (Watch) boundArgs.get(0);
        watch.poll(null);
    }
}
