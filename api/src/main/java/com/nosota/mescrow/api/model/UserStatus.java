package com.nosota.mescrow.api.model;

public enum UserStatus {
    ACTIVE,
    SUSPENDED,
    BANNED
}
