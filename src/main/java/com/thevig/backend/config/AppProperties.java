package com.thevig.backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    private Draft draft = new Draft();

    @Data
    public static class Draft {
        private Defaults defaults = new Defaults();
        private TimeoutSweep timeoutSweep = new TimeoutSweep();
        private Lock lock = new Lock();
        private Broadcast broadcast = new Broadcast();
        private int maxRounds = 50;
    }

    /**
     * Values written into a pool's draft settings when the first draft is created.
     */
    @Data
    public static class Defaults {
        private int pickTimeSeconds = 86400;
        private int reminderMinutes = 720;
        private boolean autoSkipEnabled = true;
        private int autoSkipAfterSeconds = 86400;
        private int breakBetweenRoundsSeconds = 0;
    }

    @Data
    public static class TimeoutSweep {
        private boolean enabled = true;
        private long fixedDelayMs = 60000;
        private long initialDelayMs = 15000;
    }

    @Data
    public static class Lock {
        private long waitMs = 2000;
        private long leaseMs = 10000;
    }

    @Data
    public static class Broadcast {
        private boolean enabled = true;
        private String channelPrefix = "draft:";
    }
}
