package com.nosota.mescrow.service;

import com.nosota.mescrow.model.Contract;
import com.nosota.mescrow.model.Milestone;

/**
 * A milestone loaded for modification together with its validated parent contract.
 */
public record MilestoneContext(Milestone milestone, Contract contract) {
}
