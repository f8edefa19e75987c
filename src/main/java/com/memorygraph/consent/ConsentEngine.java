package com.memorygraph.consent;

import com.memorygraph.shared.Deadlines;
import com.memorygraph.shared.model.AccessGrant;
import com.memorygraph.shared.model.ConsentLevel;
import com.memorygraph.shared.model.MemoryNode;
import com.memorygraph.shared.model.Outcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.UUID;

/**
 * Decides who may read or modify a node. Every decision is evaluated against the grant
 * table at call time; nothing about a past decision is cached, so revocation and expiry
 * take effect on the next call.
 */
public class ConsentEngine {

    private static final Logger log = LoggerFactory.getLogger(ConsentEngine.class);

    private final GrantTable grants;
    private final Clock clock;

    public ConsentEngine(GrantTable grants, Clock clock) {
        this.grants = grants;
        this.clock = clock;
    }

    public boolean canRead(MemoryNode node, String requester) {
        if (requester == null) return false;
        if (requester.equals(node.owner())) return true;
        return switch (node.consent()) {
            case PUBLIC -> true;
            // grants are only honoured when issued by the current owner
            case SHARED, RESTRICTED -> grants.hasActive(node.id(), node.owner(), requester, false, clock.instant());
            case PRIVATE -> false;
        };
    }

    /** Owner, or a non-owner holding an unexpired modify grant on a non-private node. */
    public boolean canModify(MemoryNode node, String requester) {
        if (requester == null) return false;
        if (requester.equals(node.owner())) return true;
        if (node.consent() == ConsentLevel.PRIVATE) return false;
        return grants.hasActive(node.id(), node.owner(), requester, true, clock.instant());
    }

    public Outcome<AccessGrant> grant(MemoryNode node, String grantingOwner, String receivingOwner,
                                      Duration ttl, boolean canModify) {
        if (grantingOwner == null || !grantingOwner.equals(node.owner())) {
            return Outcome.forbidden("Only the owner of " + node.id() + " may grant access");
        }
        if (receivingOwner == null || receivingOwner.isBlank()) {
            return Outcome.invalid("receiving owner must not be empty");
        }
        if (receivingOwner.equals(grantingOwner)) {
            return Outcome.invalid("owner cannot grant access to itself");
        }
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            return Outcome.invalid("grant ttl must be positive");
        }
        var expiresAt = Deadlines.after(clock.instant(), ttl);
        if (expiresAt.isEmpty()) {
            return Outcome.invalid("grant ttl is too large: " + ttl);
        }
        var grant = new AccessGrant(UUID.randomUUID().toString(), node.id(), grantingOwner, receivingOwner,
                expiresAt.get(), canModify);
        grants.add(grant);
        log.debug("Grant {} on {}: {} -> {} (modify={})",
                grant.id(), node.id(), grantingOwner, receivingOwner, canModify);
        return Outcome.ok(grant);
    }

    public Outcome<Void> revoke(String grantId, String requester) {
        var grant = grants.find(grantId);
        if (grant.isEmpty()) return Outcome.notFound("No such grant: " + grantId);
        if (!grant.get().grantingOwner().equals(requester)) {
            return Outcome.forbidden("Only the granting owner may revoke " + grantId);
        }
        grants.remove(grantId);
        return Outcome.ok(null);
    }
}
