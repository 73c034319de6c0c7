package com.heronix.assignment.controller.api;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import com.heronix.assignment.exception.InvalidWorkflowActionException;
import com.heronix.assignment.model.domain.ActionResult;
import com.heronix.assignment.model.domain.ApplyResult;
import com.heronix.assignment.model.domain.DeviceAssignment;
import com.heronix.assignment.model.domain.OperationResult;
import com.heronix.assignment.model.dto.DeviceSelectionDTO;
import com.heronix.assignment.model.enums.OperationType;
import com.heronix.assignment.model.enums.WorkflowAction;
import com.heronix.assignment.service.AssignmentOrchestrationService;
import com.heronix.assignment.service.DeviceActionService;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(AssignmentController.class)
class AssignmentControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private AssignmentOrchestrationService orchestrationService;

    @MockBean
    private DeviceActionService deviceActionService;

    @Test
    @SuppressWarnings("unchecked")
    void apply_snakeCaseRequest_mappedToAssignments() throws Exception {
        // Arrange
        UUID deviceId = UUID.randomUUID();
        UUID app = UUID.randomUUID();
        ApplyResult result = ApplyResult.builder()
                .success(true)
                .applicationsAssigned(1)
                .operation(OperationResult.success(OperationType.APPLICATION, List.of(deviceId), List.of("SN-1"), "op-1"))
                .newDeviceAdded("NEW-1")
                .build();
        when(orchestrationService.execute(anyList(), anyBoolean())).thenReturn(result);

        String body = """
                {
                  "devices": [
                    {
                      "serial_number": "SN-1",
                      "device_id": "%s",
                      "selected_application_id": "%s",
                      "selected_region": "us-west",
                      "selected_tags": {"env": "prod"},
                      "keep_current_subscription": true
                    },
                    {"serial_number": "NEW-1", "mac_address": "00:11:22:33:44:55"}
                  ],
                  "wait_for_completion": false
                }
                """.formatted(deviceId, app);

        // Act & Assert
        mockMvc.perform(post("/api/v1/assignments/apply")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.applications_assigned").value(1))
                .andExpect(jsonPath("$.new_devices_added[0]").value("NEW-1"))
                .andExpect(jsonPath("$.operations[0].operation_type").value("application"))
                .andExpect(jsonPath("$.operations[0].operation_url").value("op-1"));

        ArgumentCaptor<List<DeviceAssignment>> captor = ArgumentCaptor.forClass(List.class);
        verify(orchestrationService).execute(captor.capture(), eq(false));
        List<DeviceAssignment> assignments = captor.getValue();
        assertEquals(2, assignments.size());
        assertEquals(deviceId, assignments.get(0).getDeviceId());
        assertEquals(app, assignments.get(0).getSelectedApplicationId());
        assertEquals(Map.of("env", "prod"), assignments.get(0).getSelectedTags());
        assertTrue(assignments.get(0).isKeepCurrentSubscription());
        assertTrue(assignments.get(1).needsCreation());
        assertEquals("00:11:22:33:44:55", assignments.get(1).getMacAddress());
    }

    @Test
    void apply_noDevices_badRequest() throws Exception {
        mockMvc.perform(post("/api/v1/assignments/apply")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"devices\": []}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(orchestrationService);
    }

    @Test
    void action_archive_delegatesWithFlags() throws Exception {
        // Arrange
        UUID deviceId = UUID.randomUUID();
        ActionResult result = ActionResult.builder()
                .success(true)
                .action(WorkflowAction.ARCHIVE)
                .devicesProcessed(2)
                .devicesSucceeded(1)
                .devicesSkipped(1)
                .build();
        when(deviceActionService.execute(eq(WorkflowAction.ARCHIVE), anyList(), eq(false), eq(true)))
                .thenReturn(result);

        String body = """
                {
                  "action": "ARCHIVE",
                  "devices": [
                    {"serial_number": "SN-1", "device_id": "%s"},
                    {"serial_number": "SN-2"}
                  ],
                  "wait_for_completion": false
                }
                """.formatted(deviceId);

        // Act & Assert
        mockMvc.perform(post("/api/v1/assignments/actions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.action").value("archive"))
                .andExpect(jsonPath("$.devices_skipped").value(1))
                .andExpect(jsonPath("$.devices_succeeded").value(1));
    }

    @Test
    void action_assign_badRequest() throws Exception {
        when(deviceActionService.execute(eq(WorkflowAction.ASSIGN), anyList(), anyBoolean(), anyBoolean()))
                .thenThrow(new InvalidWorkflowActionException(WorkflowAction.ASSIGN, "Action assign is not a device action"));

        mockMvc.perform(post("/api/v1/assignments/actions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"action\": \"assign\", \"devices\": [{\"serial_number\": \"SN-1\"}]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Action assign is not a device action"));
    }

    @Test
    void action_unknownAction_badRequest() throws Exception {
        mockMvc.perform(post("/api/v1/assignments/actions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"action\": \"explode\", \"devices\": [{\"serial_number\": \"SN-1\"}]}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(deviceActionService);
    }

    @Test
    void toAssignment_copiesCurrentState() {
        UUID sub = UUID.randomUUID();
        DeviceSelectionDTO dto = DeviceSelectionDTO.builder()
                .serialNumber("SN-9")
                .rowNumber(9)
                .deviceId(UUID.randomUUID())
                .currentSubscriptionId(sub)
                .currentSubscriptionKey("KEY-1")
                .selectedSubscriptionId(UUID.randomUUID())
                .build();

        DeviceAssignment assignment = AssignmentController.toAssignment(dto);

        assertEquals(9, assignment.getRowNumber());
        assertEquals(sub, assignment.getCurrentSubscriptionId());
        assertEquals("KEY-1", assignment.getCurrentSubscriptionKey());
        assertFalse(assignment.needsSubscriptionPatch());
    }
}
