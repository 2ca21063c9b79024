package com.nosota.mescrow.tests;

import com.fasterxml.jackson.core.type.TypeReference;
import com.nosota.mescrow.TestBase;
import com.nosota.mescrow.api.ApiHeaders;
import com.nosota.mescrow.api.model.UserRole;
import com.nosota.mescrow.api.request.CreateMilestoneRequest;
import com.nosota.mescrow.api.request.UpdateMilestoneRequest;
import com.nosota.mescrow.api.response.MilestoneResponse;
import com.nosota.mescrow.model.Contract;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MvcResult;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@DisplayName("Milestone API Tests")
public class MilestoneControllerTest extends TestBase {

    private UUID clientId;
    private UUID freelancerId;
    private Contract contract;

    @BeforeEach
    void setUp() throws Exception {
        clientId = registerUser(UserRole.CLIENT);
        freelancerId = registerUser(UserRole.FREELANCER);
        contract = createActiveContract(clientId, freelancerId);
    }

    @Test
    @DisplayName("MAPI-001: Create, list and update milestones")
    void testCreateListUpdate() throws Exception {
        UUID milestoneId = createMilestone("Wireframes", "120.50");

        MvcResult listResult = mockMvc.perform(get("/api/v1/milestones/contract/{contractId}", contract.getId())
                        .header(ApiHeaders.USER_ID, freelancerId))
                .andExpect(status().isOk())
                .andReturn();
        List<MilestoneResponse> milestones = objectMapper.readValue(listResult.getResponse().getContentAsString(),
                new TypeReference<>() {});
        assertThat(milestones).hasSize(1);
        assertThat(milestones.get(0).amount()).isEqualByComparingTo("120.50");
        assertThat(milestones.get(0).sequence()).isEqualTo(1);

        mockMvc.perform(put("/api/v1/milestones/{milestoneId}", milestoneId)
                        .header(ApiHeaders.USER_ID, clientId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(
                                new UpdateMilestoneRequest("Wireframes v2", null, null, null))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.title").value("Wireframes v2"))
                .andExpect(jsonPath("$.status").value("PENDING"));
    }

    @Test
    @DisplayName("MAPI-002: Invalid transitions map to 409, wrong party to 403")
    void testTransitionErrors() throws Exception {
        UUID milestoneId = createMilestone("Wireframes", "50.00");

        mockMvc.perform(post("/api/v1/milestones/{milestoneId}/submit", milestoneId)
                        .header(ApiHeaders.USER_ID, freelancerId))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("INVALID_STATE_TRANSITION"));

        mockMvc.perform(post("/api/v1/milestones/{milestoneId}/start", milestoneId)
                        .header(ApiHeaders.USER_ID, clientId))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("USER_NOT_AUTHORIZED"));
    }

    @Test
    @DisplayName("MAPI-003: Override is honoured for administrators only")
    void testOverride() throws Exception {
        UUID milestoneId = createMilestone("Wireframes", "50.00");

        mockMvc.perform(post("/api/v1/milestones/{milestoneId}/submit", milestoneId)
                        .header(ApiHeaders.USER_ID, freelancerId)
                        .header(ApiHeaders.USER_ROLE, "FREELANCER")
                        .param("override", "true"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("ADMIN_REQUIRED"));

        mockMvc.perform(post("/api/v1/milestones/{milestoneId}/submit", milestoneId)
                        .header(ApiHeaders.USER_ID, freelancerId)
                        .header(ApiHeaders.USER_ROLE, "ADMIN")
                        .param("override", "true"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("SUBMITTED"));
    }

    @Test
    @DisplayName("MAPI-004: Deletion handshake over HTTP")
    void testDeletion() throws Exception {
        UUID milestoneId = createMilestone("Wireframes", "50.00");

        mockMvc.perform(post("/api/v1/milestones/{milestoneId}/accept-deletion", milestoneId)
                        .header(ApiHeaders.USER_ID, freelancerId))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("NO_DELETION_REQUEST"));

        mockMvc.perform(post("/api/v1/milestones/{milestoneId}/request-deletion", milestoneId)
                        .header(ApiHeaders.USER_ID, clientId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.deletionRequestedAt").exists());
        mockMvc.perform(post("/api/v1/milestones/{milestoneId}/accept-deletion", milestoneId)
                        .header(ApiHeaders.USER_ID, freelancerId))
                .andExpect(status().isOk());

        mockMvc.perform(get("/api/v1/milestones/{milestoneId}", milestoneId)
                        .header(ApiHeaders.USER_ID, clientId))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("MILESTONE_NOT_FOUND"));
    }

    @Test
    @DisplayName("MAPI-005: Request validation")
    void testValidation() throws Exception {
        CreateMilestoneRequest tooSmall = new CreateMilestoneRequest(contract.getId(), "Tiny", null,
                new BigDecimal("5.00"), LocalDateTime.now().plusDays(3));

        mockMvc.perform(post("/api/v1/milestones")
                        .header(ApiHeaders.USER_ID, clientId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(tooSmall)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));
    }

    private UUID createMilestone(String title, String amount) throws Exception {
        CreateMilestoneRequest request = new CreateMilestoneRequest(contract.getId(), title, "Details",
                new BigDecimal(amount), LocalDateTime.now().plusDays(10));
        MvcResult result = mockMvc.perform(post("/api/v1/milestones")
                        .header(ApiHeaders.USER_ID, clientId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.status").value("PENDING"))
                .andReturn();
        return objectMapper.readValue(result.getResponse().getContentAsString(), MilestoneResponse.class).id();
    }
}
