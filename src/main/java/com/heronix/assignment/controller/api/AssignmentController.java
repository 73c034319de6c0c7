package com.heronix.assignment.controller.api;

import java.util.List;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.heronix.assignment.exception.InvalidWorkflowActionException;
import com.heronix.assignment.model.domain.ActionResult;
import com.heronix.assignment.model.domain.ApplyResult;
import com.heronix.assignment.model.domain.DeviceAssignment;
import com.heronix.assignment.model.dto.ApplyRequestDTO;
import com.heronix.assignment.model.dto.DeviceActionRequestDTO;
import com.heronix.assignment.model.dto.DeviceSelectionDTO;
import com.heronix.assignment.service.AssignmentOrchestrationService;
import com.heronix.assignment.service.DeviceActionService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * REST API for device assignment and device actions.
 *
 * Both endpoints run synchronously; a large assignment run takes minutes
 * because of provider rate limiting.
 */
@RestController
@RequestMapping("/api/v1/assignments")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Device Assignment", description = "Bulk subscription, application, tag and lifecycle changes")
public class AssignmentController {

    private final AssignmentOrchestrationService orchestrationService;
    private final DeviceActionService deviceActionService;

    @PostMapping("/apply")
    @Operation(summary = "Apply assignments",
            description = "Create missing devices and fill in missing applications, subscriptions and tags")
    @ApiResponse(responseCode = "200", description = "Workflow finished; inspect operations for failures")
    public ResponseEntity<ApplyResult> apply(@Valid @RequestBody ApplyRequestDTO request) {
        log.info("API: Applying assignments to {} devices", request.getDevices().size());

        List<DeviceAssignment> assignments = request.getDevices().stream()
                .map(AssignmentController::toAssignment)
                .toList();

        return ResponseEntity.ok(orchestrationService.execute(assignments, request.isWaitForCompletion()));
    }

    @PostMapping("/actions")
    @Operation(summary = "Device action", description = "Archive, unarchive or remove devices")
    @ApiResponse(responseCode = "200", description = "Action finished; inspect operations for failures")
    @ApiResponse(responseCode = "400", description = "Action is not a device action")
    public ResponseEntity<ActionResult> action(@Valid @RequestBody DeviceActionRequestDTO request) {
        log.info("API: Running {} for {} devices", request.getAction(), request.getDevices().size());

        List<DeviceAssignment> devices = request.getDevices().stream()
                .map(ref -> DeviceAssignment.builder()
                        .serialNumber(ref.getSerialNumber())
                        .deviceId(ref.getDeviceId())
                        .build())
                .toList();

        return ResponseEntity.ok(deviceActionService.execute(
                request.getAction(), devices, request.isWaitForCompletion(), request.isSyncAfter()));
    }

    @ExceptionHandler(InvalidWorkflowActionException.class)
    public ResponseEntity<ErrorResponse> handleInvalidAction(InvalidWorkflowActionException e) {
        log.warn("Rejected device action: {}", e.getMessage());
        return ResponseEntity.badRequest().body(new ErrorResponse(e.getMessage()));
    }

    static DeviceAssignment toAssignment(DeviceSelectionDTO dto) {
        return DeviceAssignment.builder()
                .serialNumber(dto.getSerialNumber())
                .macAddress(dto.getMacAddress())
                .rowNumber(dto.getRowNumber())
                .deviceId(dto.getDeviceId())
                .deviceType(dto.getDeviceType())
                .model(dto.getModel())
                .region(dto.getRegion())
                .currentSubscriptionId(dto.getCurrentSubscriptionId())
                .currentSubscriptionKey(dto.getCurrentSubscriptionKey())
                .currentApplicationId(dto.getCurrentApplicationId())
                .currentTags(dto.getCurrentTags())
                .selectedSubscriptionId(dto.getSelectedSubscriptionId())
                .selectedApplicationId(dto.getSelectedApplicationId())
                .selectedRegion(dto.getSelectedRegion())
                .selectedTags(dto.getSelectedTags())
                .keepCurrentSubscription(dto.isKeepCurrentSubscription())
                .keepCurrentApplication(dto.isKeepCurrentApplication())
                .keepCurrentTags(dto.isKeepCurrentTags())
                .build();
    }

    // ========================================================================
    // RESPONSE TYPES
    // ========================================================================

    public record ErrorResponse(String error) {}
}
