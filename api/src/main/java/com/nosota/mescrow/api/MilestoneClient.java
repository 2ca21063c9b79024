package com.nosota.mescrow.api;

import com.nosota.mescrow.api.model.UserRole;
import com.nosota.mescrow.api.request.CreateMilestoneRequest;
import com.nosota.mescrow.api.request.UpdateMilestoneRequest;
import com.nosota.mescrow.api.response.MilestoneResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;
import java.util.UUID;

/**
 * WebClient-based implementation of MilestoneApi.
 *
 * <p>Not a Spring @Component; register it as a bean the same way as {@link FinanceClient}.
 */
@RequiredArgsConstructor
@Slf4j
public class MilestoneClient implements MilestoneApi {

    private static final String BASE = "/api/v1/milestones";

    private final WebClient webClient;

    @Override
    public ResponseEntity<MilestoneResponse> createMilestone(UUID userId, CreateMilestoneRequest request) {
        log.debug("Calling createMilestone: contractId={}, amount={}", request.contractId(), request.amount());

        return webClient.post()
                .uri(BASE)
                .header(ApiHeaders.USER_ID, userId.toString())
                .bodyValue(request)
                .retrieve()
                .toEntity(MilestoneResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<List<MilestoneResponse>> getMilestones(UUID userId, UUID contractId) {
        log.debug("Calling getMilestones: contractId={}", contractId);

        return webClient.get()
                .uri(BASE + "/contract/{contractId}", contractId)
                .header(ApiHeaders.USER_ID, userId.toString())
                .retrieve()
                .toEntity(new ParameterizedTypeReference<List<MilestoneResponse>>() {})
                .block();
    }

    @Override
    public ResponseEntity<MilestoneResponse> getMilestone(UUID userId, UUID milestoneId) {
        log.debug("Calling getMilestone: milestoneId={}", milestoneId);

        return webClient.get()
                .uri(BASE + "/{milestoneId}", milestoneId)
                .header(ApiHeaders.USER_ID, userId.toString())
                .retrieve()
                .toEntity(MilestoneResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<MilestoneResponse> updateMilestone(UUID userId, UUID milestoneId,
                                                             UpdateMilestoneRequest request) {
        log.debug("Calling updateMilestone: milestoneId={}", milestoneId);

        return webClient.put()
                .uri(BASE + "/{milestoneId}", milestoneId)
                .header(ApiHeaders.USER_ID, userId.toString())
                .bodyValue(request)
                .retrieve()
                .toEntity(MilestoneResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<MilestoneResponse> startMilestone(UUID userId, UserRole role, UUID milestoneId,
                                                            boolean override) {
        return transition(userId, role, milestoneId, "start", override);
    }

    @Override
    public ResponseEntity<MilestoneResponse> submitMilestone(UUID userId, UserRole role, UUID milestoneId,
                                                             boolean override) {
        return transition(userId, role, milestoneId, "submit", override);
    }

    @Override
    public ResponseEntity<MilestoneResponse> approveByFreelancer(UUID userId, UserRole role, UUID milestoneId,
                                                                 boolean override) {
        return transition(userId, role, milestoneId, "approve-by-freelancer", override);
    }

    @Override
    public ResponseEntity<MilestoneResponse> rejectMilestone(UUID userId, UserRole role, UUID milestoneId,
                                                             boolean override) {
        return transition(userId, role, milestoneId, "reject", override);
    }

    @Override
    public ResponseEntity<MilestoneResponse> disputeMilestone(UUID userId, UserRole role, UUID milestoneId,
                                                              boolean override) {
        return transition(userId, role, milestoneId, "dispute", override);
    }

    @Override
    public ResponseEntity<MilestoneResponse> payMilestone(UUID userId, UserRole role, UUID milestoneId,
                                                          boolean override) {
        return transition(userId, role, milestoneId, "pay", override);
    }

    @Override
    public ResponseEntity<MilestoneResponse> approveWorkByClient(UUID userId, UserRole role, UUID milestoneId,
                                                                 boolean override) {
        return transition(userId, role, milestoneId, "approve-by-client", override);
    }

    @Override
    public ResponseEntity<MilestoneResponse> cancelMilestone(UUID userId, UserRole role, UUID milestoneId,
                                                             boolean override) {
        return transition(userId, role, milestoneId, "cancel", override);
    }

    @Override
    public ResponseEntity<MilestoneResponse> requestDeletion(UUID userId, UUID milestoneId) {
        return transition(userId, null, milestoneId, "request-deletion", false);
    }

    @Override
    public ResponseEntity<MilestoneResponse> acceptRequestDeletion(UUID userId, UUID milestoneId) {
        return transition(userId, null, milestoneId, "accept-deletion", false);
    }

    private ResponseEntity<MilestoneResponse> transition(UUID userId, UserRole role, UUID milestoneId,
                                                         String action, boolean override) {
        log.debug("Calling milestone {}: milestoneId={}, userId={}, override={}",
                action, milestoneId, userId, override);

        return webClient.post()
                .uri(uriBuilder -> {
                    uriBuilder.path(BASE + "/{milestoneId}/" + action);
                    if (override) {
                        uriBuilder.queryParam("override", true);
                    }
                    return uriBuilder.build(milestoneId);
                })
                .headers(headers -> {
                    headers.set(ApiHeaders.USER_ID, userId.toString());
                    if (role != null) {
                        headers.set(ApiHeaders.USER_ROLE, role.name());
                    }
                })
                .retrieve()
                .toEntity(MilestoneResponse.class)
                .block();
    }
}
