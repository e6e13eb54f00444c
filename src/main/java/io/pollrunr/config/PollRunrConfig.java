package io.pollrunr.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.pollrunr.channel.DeliveryChannel;
import io.pollrunr.channel.LoggingDeliveryChannel;
import io.pollrunr.cron.CronScheduler;
import io.pollrunr.http.ResilientHttpClient;
import io.pollrunr.support.Sleeper;
import io.pollrunr.watch.ApiEndpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the scheduler, the shared HTTP client and the API endpoint from {@link PollRunrProperties}.
 */
@Configuration
@EnableConfigurationProperties(PollRunrProperties.class)
public class PollRunrConfig {

    private static final Logger log = LoggerFactory.getLogger(PollRunrConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.SYSTEM;
    }

    @Bean
    public CronScheduler cronScheduler(Clock clock, Sleeper sleeper, PollRunrProperties properties) {
        log.info("Cron scheduler evaluating expressions in zone {}", properties.scheduler().zoneId());
        return new CronScheduler(clock, sleeper, properties.scheduler().zoneId());
    }

    @Bean
    public ResilientHttpClient resilientHttpClient(PollRunrProperties properties, ObjectMapper objectMapper,
                                                   Sleeper sleeper) {
        return new ResilientHttpClient(properties.http(), objectMapper, sleeper);
    }

    @Bean
    public ApiEndpoint apiEndpoint(PollRunrProperties properties) {
        if (properties.api().host().isBlank()) {
            log.warn("pollrunr.api.host is not set; API requests will fail");
        }
        return new ApiEndpoint(properties.api().host(), properties.api().params());
    }

    @Bean
    public DeliveryChannel deliveryChannel() {
        return new LoggingDeliveryChannel();
    }
}
