package com.nosota.mescrow.controller;

import com.nosota.mescrow.api.MilestoneApi;
import com.nosota.mescrow.api.model.UserRole;
import com.nosota.mescrow.api.request.CreateMilestoneRequest;
import com.nosota.mescrow.api.request.UpdateMilestoneRequest;
import com.nosota.mescrow.api.response.MilestoneResponse;
import com.nosota.mescrow.error.UnauthorizedPartyException;
import com.nosota.mescrow.mapper.LedgerMapper;
import com.nosota.mescrow.mapper.MinorUnits;
import com.nosota.mescrow.model.Milestone;
import com.nosota.mescrow.service.MilestoneService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * REST controller for milestones.
 *
 * <p>{@code override=true} is honoured only for ADMIN callers and is turned into the
 * {@code allowUnchecked} argument of {@link MilestoneService}.
 */
@RestController
@Validated
@RequiredArgsConstructor
@Slf4j
public class MilestoneController implements MilestoneApi {

    private final MilestoneService milestoneService;

    @Override
    public ResponseEntity<MilestoneResponse> createMilestone(UUID userId, CreateMilestoneRequest request)
            throws Exception {
        Milestone milestone = milestoneService.createMilestone(
                userId,
                request.contractId(),
                request.title(),
                request.description(),
                MinorUnits.toMinor(request.amount()),
                request.dueDate()
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(LedgerMapper.INSTANCE.toResponse(milestone));
    }

    @Override
    public ResponseEntity<List<MilestoneResponse>> getMilestones(UUID userId, UUID contractId) throws Exception {
        List<Milestone> milestones = milestoneService.getMilestones(contractId, userId);
        return ResponseEntity.ok(LedgerMapper.INSTANCE.toMilestoneResponseList(milestones));
    }

    @Override
    public ResponseEntity<MilestoneResponse> getMilestone(UUID userId, UUID milestoneId) throws Exception {
        return ok(milestoneService.getMilestone(milestoneId, userId));
    }

    @Override
    public ResponseEntity<MilestoneResponse> updateMilestone(UUID userId, UUID milestoneId,
                                                             UpdateMilestoneRequest request) throws Exception {
        Long amount = request.amount() != null ? MinorUnits.toMinor(request.amount()) : null;
        return ok(milestoneService.updateMilestone(milestoneId, userId, request.title(), request.description(),
                amount, request.dueDate()));
    }

    @Override
    public ResponseEntity<MilestoneResponse> startMilestone(UUID userId, UserRole role, UUID milestoneId,
                                                            boolean override) throws Exception {
        return ok(milestoneService.startMilestone(milestoneId, userId, allowUnchecked(role, override)));
    }

    @Override
    public ResponseEntity<MilestoneResponse> submitMilestone(UUID userId, UserRole role, UUID milestoneId,
                                                             boolean override) throws Exception {
        return ok(milestoneService.submitMilestone(milestoneId, userId, allowUnchecked(role, override)));
    }

    @Override
    public ResponseEntity<MilestoneResponse> approveByFreelancer(UUID userId, UserRole role, UUID milestoneId,
                                                                 boolean override) throws Exception {
        return ok(milestoneService.approveByFreelancer(milestoneId, userId, allowUnchecked(role, override)));
    }

    @Override
    public ResponseEntity<MilestoneResponse> rejectMilestone(UUID userId, UserRole role, UUID milestoneId,
                                                             boolean override) throws Exception {
        return ok(milestoneService.rejectMilestone(milestoneId, userId, allowUnchecked(role, override)));
    }

    @Override
    public ResponseEntity<MilestoneResponse> disputeMilestone(UUID userId, UserRole role, UUID milestoneId,
                                                              boolean override) throws Exception {
        return ok(milestoneService.disputeMilestone(milestoneId, userId, allowUnchecked(role, override)));
    }

    @Override
    public ResponseEntity<MilestoneResponse> payMilestone(UUID userId, UserRole role, UUID milestoneId,
                                                          boolean override) throws Exception {
        return ok(milestoneService.payMilestone(milestoneId, userId, allowUnchecked(role, override)));
    }

    @Override
    public ResponseEntity<MilestoneResponse> approveWorkByClient(UUID userId, UserRole role, UUID milestoneId,
                                                                 boolean override) throws Exception {
        return ok(milestoneService.approveWorkByClient(milestoneId, userId, allowUnchecked(role, override)));
    }

    @Override
    public ResponseEntity<MilestoneResponse> cancelMilestone(UUID userId, UserRole role, UUID milestoneId,
                                                             boolean override) throws Exception {
        return ok(milestoneService.cancelMilestone(milestoneId, userId, allowUnchecked(role, override)));
    }

    @Override
    public ResponseEntity<MilestoneResponse> requestDeletion(UUID userId, UUID milestoneId) throws Exception {
        return ok(milestoneService.requestDeletion(milestoneId, userId));
    }

    @Override
    public ResponseEntity<MilestoneResponse> acceptRequestDeletion(UUID userId, UUID milestoneId) throws Exception {
        return ok(milestoneService.acceptRequestDeletion(milestoneId, userId));
    }

    private static ResponseEntity<MilestoneResponse> ok(Milestone milestone) {
        return ResponseEntity.ok(LedgerMapper.INSTANCE.toResponse(milestone));
    }

    private static boolean allowUnchecked(UserRole role, boolean override) throws UnauthorizedPartyException {
        if (!override) {
            return false;
        }
        if (role != UserRole.ADMIN) {
            throw new UnauthorizedPartyException("ADMIN_REQUIRED", "Only administrators can override transitions");
        }
        return true;
    }
}
