package com.bracketeer.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Runtime limits and switches for bracket construction, result propagation and scheduling.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "bracketeer")
public class BracketeerRuntimeProperties {

    private Progression progression = new Progression();
    private Scheduling scheduling = new Scheduling();

    @Getter
    @Setter
    public static class Progression {
        /**
         * Upper bound on bye resolutions per stage item before the fixpoint loop gives up.
         */
        private int maxByeIterations = 4096;
    }

    @Getter
    @Setter
    public static class Scheduling {
        private boolean enabled = true;
    }
}
