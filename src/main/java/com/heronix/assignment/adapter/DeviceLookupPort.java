package com.heronix.assignment.adapter;

import java.util.List;

import com.heronix.assignment.model.domain.DeviceAssignment;

/**
 * Read access to the local device inventory.
 */
public interface DeviceLookupPort {

    /**
     * Find devices by serial number. Serials that are not in inventory are
     * simply absent from the result.
     */
    List<DeviceAssignment> findBySerials(List<String> serials);
}
