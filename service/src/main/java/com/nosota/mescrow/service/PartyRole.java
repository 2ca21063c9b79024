package com.nosota.mescrow.service;

/**
 * Which side of a contract an operation requires.
 */
public enum PartyRole {
    CLIENT,
    FREELANCER,
    /**
     * Client or freelancer.
     */
    EITHER
}
