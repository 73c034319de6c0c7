package com.heronix.assignment;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

import com.heronix.assignment.config.AssignmentProperties;

/**
 * Heronix Assignment - bulk device assignment against a device-management API.
 *
 * Reconciles a list of devices with the platform inventory and pushes
 * subscription, application/region, tag and lifecycle changes through the
 * provider's per-minute call quotas.
 *
 * A {@link com.heronix.assignment.adapter.DeviceManagerPort} bean must be
 * supplied by the deployment; lookup and sync ports are optional.
 */
@SpringBootApplication
@EnableConfigurationProperties(AssignmentProperties.class)
public class AssignmentApplication {

    public static void main(String[] args) {
        SpringApplication.run(AssignmentApplication.class, args);
    }
}
