package com.nosota.mescrow.error;

import java.util.UUID;

/**
 * The freelancer tried to accept the deletion of a milestone the client never asked to delete.
 */
public class NoDeletionRequestException extends DomainException {

    public NoDeletionRequestException(UUID milestoneId) {
        super(ErrorKind.NO_DELETION_REQUEST, "NO_DELETION_REQUEST",
                "No deletion request found for milestone " + milestoneId);
    }
}
