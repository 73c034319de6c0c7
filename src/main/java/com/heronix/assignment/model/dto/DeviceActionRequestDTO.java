package com.heronix.assignment.model.dto;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import com.heronix.assignment.model.enums.WorkflowAction;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request to archive, unarchive or remove devices.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DeviceActionRequestDTO {

    @NotNull
    private WorkflowAction action;

    @NotEmpty
    @Valid
    @Builder.Default
    private List<DeviceRef> devices = new ArrayList<>();

    @Builder.Default
    private boolean waitForCompletion = true;

    @Builder.Default
    private boolean syncAfter = true;

    /**
     * Device reference. Devices without an id are skipped and counted.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class DeviceRef {

        @NotBlank
        private String serialNumber;

        private UUID deviceId;
    }
}
