package com.memorygraph.shared.model;

import java.time.Instant;

public record AccessGrant(
    String id,
    String nodeId,
    String grantingOwner,
    String receivingOwner,
    Instant expiresAt,
    boolean canModify
) {
    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
