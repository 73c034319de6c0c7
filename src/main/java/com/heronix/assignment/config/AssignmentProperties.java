package com.heronix.assignment.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

import com.heronix.assignment.model.enums.CompletionPolicy;
import com.heronix.assignment.model.enums.RateLimitScope;

import lombok.Data;

/**
 * Configuration properties for Heronix Assignment.
 *
 * @author Heronix Development Team
 */
@Data
@ConfigurationProperties(prefix = "heronix.assignment")
public class AssignmentProperties {

    /**
     * Provider quota protection
     */
    private RateLimitConfig rateLimit = new RateLimitConfig();

    /**
     * Batch sizing
     */
    private BatchConfig batch = new BatchConfig();

    /**
     * Async operation handling
     */
    private CompletionConfig completion = new CompletionConfig();

    /**
     * Archive / unarchive / remove
     */
    private ActionsConfig actions = new ActionsConfig();

    @Data
    public static class RateLimitConfig {
        /**
         * Interval between PATCH calls (provider limit 20/min, 3.5s gives ~17/min)
         */
        private Duration patchInterval = Duration.ofMillis(3500);

        /**
         * Interval between POST calls (provider limit 25/min, 2.6s gives ~23/min)
         */
        private Duration postInterval = Duration.ofMillis(2600);

        /**
         * SEQUENCE: one gate per call sequence. PROCESS: one gate per rate class shared by all runs.
         */
        private RateLimitScope scope = RateLimitScope.SEQUENCE;
    }

    @Data
    public static class BatchConfig {
        /**
         * Maximum devices per API call (provider ceiling is 25)
         */
        private int maxSize = 25;
    }

    @Data
    public static class CompletionConfig {
        /**
         * Maximum time to poll one async operation
         */
        private Duration timeout = Duration.ofSeconds(300);

        /**
         * What to do with async handles of application, subscription and tag batches
         */
        private CompletionPolicy patchPolicy = CompletionPolicy.TRUST_PROVIDER;
    }

    @Data
    public static class ActionsConfig {
        /**
         * Pace action batches through the PATCH gate
         */
        private boolean rateLimited = false;

        /**
         * Also sync subscriptions when resyncing after an action
         */
        private boolean syncSubscriptions = false;
    }
}
