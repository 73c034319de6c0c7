package com.heronix.assignment.config;

import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.heronix.assignment.adapter.DeviceManagerPort;
import com.heronix.assignment.model.enums.RateClass;
import com.heronix.assignment.model.enums.RateLimitScope;
import com.heronix.assignment.ratelimit.RateGateFactory;
import com.heronix.assignment.ratelimit.Sleeper;
import com.heronix.assignment.service.batch.BatchPlanner;
import com.heronix.assignment.service.executor.CompletionWaiter;
import com.heronix.assignment.service.executor.DeviceCreationExecutor;
import com.heronix.assignment.service.executor.FireThenPollExecutor;

import lombok.extern.slf4j.Slf4j;

/**
 * Wires rate gates, batch planning and executors from {@link AssignmentProperties}.
 *
 * The device manager is required. Lookup and sync ports are optional and are
 * resolved by the services themselves.
 *
 * @author Heronix Development Team
 */
@Configuration
@Slf4j
public class AssignmentConfig {

    @Bean
    public Sleeper rateGateSleeper() {
        return Sleeper.SYSTEM;
    }

    @Bean
    public RateGateFactory rateGateFactory(AssignmentProperties properties, Sleeper sleeper) {
        AssignmentProperties.RateLimitConfig rateLimit = properties.getRateLimit();

        Map<RateClass, Duration> intervals = new EnumMap<>(RateClass.class);
        intervals.put(RateClass.PATCH, rateLimit.getPatchInterval());
        intervals.put(RateClass.POST, rateLimit.getPostInterval());

        log.info("Rate gates: scope={}, PATCH every {}ms, POST every {}ms",
                rateLimit.getScope(), rateLimit.getPatchInterval().toMillis(), rateLimit.getPostInterval().toMillis());

        if (rateLimit.getScope() == RateLimitScope.PROCESS) {
            return RateGateFactory.shared(intervals, sleeper, Clock.systemUTC());
        }
        return RateGateFactory.perSequence(intervals, sleeper);
    }

    @Bean
    public BatchPlanner batchPlanner(AssignmentProperties properties) {
        return new BatchPlanner(properties.getBatch().getMaxSize());
    }

    @Bean
    public CompletionWaiter completionWaiter(DeviceManagerPort deviceManager, AssignmentProperties properties) {
        return new CompletionWaiter(deviceManager, properties.getCompletion().getTimeout());
    }

    @Bean
    public FireThenPollExecutor fireThenPollExecutor(DeviceManagerPort deviceManager,
                                                     BatchPlanner batchPlanner,
                                                     RateGateFactory rateGateFactory,
                                                     CompletionWaiter completionWaiter,
                                                     AssignmentProperties properties) {
        return new FireThenPollExecutor(deviceManager, batchPlanner, rateGateFactory, completionWaiter,
                properties.getCompletion().getPatchPolicy());
    }

    @Bean
    public DeviceCreationExecutor deviceCreationExecutor(DeviceManagerPort deviceManager,
                                                         RateGateFactory rateGateFactory,
                                                         CompletionWaiter completionWaiter) {
        return new DeviceCreationExecutor(deviceManager, rateGateFactory, completionWaiter);
    }
}
