package io.hivemesh.voting;

import java.util.List;

/**
 * Session summary together with its audit view. {@code result} stays null while the
 * session is open.
 */
public record SessionResults(
        SessionView session,
        VotingResult result,
        List<VoteRecord> votes,
        List<AuditEntry> auditTrail,
        String auditHash,
        boolean verified
) {
}
