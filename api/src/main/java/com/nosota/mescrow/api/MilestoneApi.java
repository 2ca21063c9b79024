package com.nosota.mescrow.api;

import com.nosota.mescrow.api.model.UserRole;
import com.nosota.mescrow.api.request.CreateMilestoneRequest;
import com.nosota.mescrow.api.request.UpdateMilestoneRequest;
import com.nosota.mescrow.api.response.MilestoneResponse;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * Milestone lifecycle API.
 *
 * <p>Status transition endpoints accept {@code override=true} to skip the transition table.
 * The override is honoured only for callers with the ADMIN role; contract membership and
 * role checks still apply.
 *
 * <p>Deletion is a two-step handshake: the client requests it, the freelancer accepts it.
 */
@RequestMapping("/api/v1/milestones")
public interface MilestoneApi {

    @PostMapping
    ResponseEntity<MilestoneResponse> createMilestone(
            @RequestHeader(ApiHeaders.USER_ID) UUID userId,
            @RequestBody @Valid CreateMilestoneRequest request) throws Exception;

    @GetMapping("/contract/{contractId}")
    ResponseEntity<List<MilestoneResponse>> getMilestones(
            @RequestHeader(ApiHeaders.USER_ID) UUID userId,
            @PathVariable("contractId") UUID contractId) throws Exception;

    @GetMapping("/{milestoneId}")
    ResponseEntity<MilestoneResponse> getMilestone(
            @RequestHeader(ApiHeaders.USER_ID) UUID userId,
            @PathVariable("milestoneId") UUID milestoneId) throws Exception;

    @PutMapping("/{milestoneId}")
    ResponseEntity<MilestoneResponse> updateMilestone(
            @RequestHeader(ApiHeaders.USER_ID) UUID userId,
            @PathVariable("milestoneId") UUID milestoneId,
            @RequestBody @Valid UpdateMilestoneRequest request) throws Exception;

    @PostMapping("/{milestoneId}/start")
    ResponseEntity<MilestoneResponse> startMilestone(
            @RequestHeader(ApiHeaders.USER_ID) UUID userId,
            @RequestHeader(value = ApiHeaders.USER_ROLE, required = false) UserRole role,
            @PathVariable("milestoneId") UUID milestoneId,
            @RequestParam(value = "override", defaultValue = "false") boolean override) throws Exception;

    @PostMapping("/{milestoneId}/submit")
    ResponseEntity<MilestoneResponse> submitMilestone(
            @RequestHeader(ApiHeaders.USER_ID) UUID userId,
            @RequestHeader(value = ApiHeaders.USER_ROLE, required = false) UserRole role,
            @PathVariable("milestoneId") UUID milestoneId,
            @RequestParam(value = "override", defaultValue = "false") boolean override) throws Exception;

    @PostMapping("/{milestoneId}/approve-by-freelancer")
    ResponseEntity<MilestoneResponse> approveByFreelancer(
            @RequestHeader(ApiHeaders.USER_ID) UUID userId,
            @RequestHeader(value = ApiHeaders.USER_ROLE, required = false) UserRole role,
            @PathVariable("milestoneId") UUID milestoneId,
            @RequestParam(value = "override", defaultValue = "false") boolean override) throws Exception;

    @PostMapping("/{milestoneId}/reject")
    ResponseEntity<MilestoneResponse> rejectMilestone(
            @RequestHeader(ApiHeaders.USER_ID) UUID userId,
            @RequestHeader(value = ApiHeaders.USER_ROLE, required = false) UserRole role,
            @PathVariable("milestoneId") UUID milestoneId,
            @RequestParam(value = "override", defaultValue = "false") boolean override) throws Exception;

    @PostMapping("/{milestoneId}/dispute")
    ResponseEntity<MilestoneResponse> disputeMilestone(
            @RequestHeader(ApiHeaders.USER_ID) UUID userId,
            @RequestHeader(value = ApiHeaders.USER_ROLE, required = false) UserRole role,
            @PathVariable("milestoneId") UUID milestoneId,
            @RequestParam(value = "override", defaultValue = "false") boolean override) throws Exception;

    /**
     * Marks an approved milestone as paid and releases its amount from escrow to the freelancer.
     */
    @PostMapping("/{milestoneId}/pay")
    ResponseEntity<MilestoneResponse> payMilestone(
            @RequestHeader(ApiHeaders.USER_ID) UUID userId,
            @RequestHeader(value = ApiHeaders.USER_ROLE, required = false) UserRole role,
            @PathVariable("milestoneId") UUID milestoneId,
            @RequestParam(value = "override", defaultValue = "false") boolean override) throws Exception;

    @PostMapping("/{milestoneId}/approve-by-client")
    ResponseEntity<MilestoneResponse> approveWorkByClient(
            @RequestHeader(ApiHeaders.USER_ID) UUID userId,
            @RequestHeader(value = ApiHeaders.USER_ROLE, required = false) UserRole role,
            @PathVariable("milestoneId") UUID milestoneId,
            @RequestParam(value = "override", defaultValue = "false") boolean override) throws Exception;

    @PostMapping("/{milestoneId}/cancel")
    ResponseEntity<MilestoneResponse> cancelMilestone(
            @RequestHeader(ApiHeaders.USER_ID) UUID userId,
            @RequestHeader(value = ApiHeaders.USER_ROLE, required = false) UserRole role,
            @PathVariable("milestoneId") UUID milestoneId,
            @RequestParam(value = "override", defaultValue = "false") boolean override) throws Exception;

    @PostMapping("/{milestoneId}/request-deletion")
    ResponseEntity<MilestoneResponse> requestDeletion(
            @RequestHeader(ApiHeaders.USER_ID) UUID userId,
            @PathVariable("milestoneId") UUID milestoneId) throws Exception;

    /**
     * Deletes the milestone. Fails with NO_DELETION_REQUEST unless the client requested deletion first.
     *
     * @return the deleted milestone as it was before deletion
     */
    @PostMapping("/{milestoneId}/accept-deletion")
    ResponseEntity<MilestoneResponse> acceptRequestDeletion(
            @RequestHeader(ApiHeaders.USER_ID) UUID userId,
            @PathVariable("milestoneId") UUID milestoneId) throws Exception;
}
