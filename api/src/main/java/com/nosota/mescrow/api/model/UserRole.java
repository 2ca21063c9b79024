package com.nosota.mescrow.api.model;

/**
 * Marketplace role of a user, as asserted by the gateway in the {@code X-User-Role} header.
 */
public enum UserRole {
    CLIENT,
    FREELANCER,
    ADMIN
}
