package com.heronix.assignment.service.batch;

import java.util.UUID;

/**
 * Application assignment target. The provider needs the region together with
 * the application, so both form one grouping key.
 */
public record ApplicationTarget(UUID applicationId, String region) {
}
