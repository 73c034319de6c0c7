package com.heronix.assignment.model.dto;

import java.util.ArrayList;
import java.util.List;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request to apply assignments.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ApplyRequestDTO {

    @NotEmpty
    @Valid
    @Builder.Default
    private List<DeviceSelectionDTO> devices = new ArrayList<>();

    @Builder.Default
    private boolean waitForCompletion = true;
}
