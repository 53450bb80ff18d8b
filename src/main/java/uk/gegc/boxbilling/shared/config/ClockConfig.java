package uk.gegc.boxbilling.shared.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.ZoneId;

/**
 * Single source of time for the billing engine. Trial expiry, grace-period deadlines, retry schedules
 * and billing periods are all computed from this bean.
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock clock(@Value("${app.timezone:UTC}") String timezone) {
        return Clock.system(zoneOf(timezone));
    }

    static ZoneId zoneOf(String timezone) {
        if (!StringUtils.hasText(timezone)) {
            return ZoneId.of("UTC");
        }
        try {
            return ZoneId.of(timezone.trim());
        } catch (DateTimeException e) {
            throw new IllegalStateException("app.timezone '" + timezone + "' is not a valid zone id", e);
        }
    }
}
