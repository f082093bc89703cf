package io.hivemesh.voting;

import io.hivemesh.model.Ballot;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

final class VoteAuditTrailTest {

    @Test
    void chainLinksEachEntryToItsPredecessor() {
        VoteAuditTrail trail = new VoteAuditTrail();
        String first = trail.append(VoteRecord.signed("s1", "a1", Ballot.choice("A", 0.9, 2), 1_000L, null));
        String second = trail.append(VoteRecord.signed("s1", "a2", Ballot.choice("B", 0.4, 1), 2_000L, null));

        List<AuditEntry> entries = trail.entries("s1");
        Assertions.assertEquals(2, entries.size());
        Assertions.assertEquals(VoteAuditTrail.GENESIS_HASH, entries.get(0).previousHash());
        Assertions.assertEquals(first, entries.get(1).previousHash());
        Assertions.assertEquals(second, trail.headHash("s1"));
        Assertions.assertTrue(trail.verify("s1"));
    }

    @Test
    void rewrittenEntryBreaksVerification() {
        VoteAuditTrail trail = new VoteAuditTrail();
        trail.append(VoteRecord.signed("s1", "a1", Ballot.choice("A", 0.9, 2), 1_000L, null));
        trail.append(VoteRecord.signed("s1", "a2", Ballot.choice("B", 0.4, 1), 2_000L, null));

        AuditEntry original = trail.chain("s1").get(0);
        String forged = original.vote().replace("\"A\"", "\"B\"");
        trail.chain("s1").set(0, new AuditEntry(original.sequence(), original.sessionId(), original.agentId(),
                forged, original.recordedAt(), original.previousHash(), original.hash()));

        Assertions.assertFalse(trail.verify("s1"));
    }

    @Test
    void overwrittenCastsStayInChainButLatestWins() {
        VoteAuditTrail trail = new VoteAuditTrail();
        trail.append(VoteRecord.signed("s1", "a1", Ballot.choice("A", 0.9, 2), 1_000L, null));
        VoteRecord changed = VoteRecord.signed("s1", "a1", Ballot.choice("B", 0.9, 2), 3_000L, null);
        trail.append(changed);

        Assertions.assertEquals(2, trail.entries("s1").size());
        Assertions.assertEquals(changed.canonicalJson(), trail.latestVotes("s1").get("a1"));
    }

    @Test
    void unknownSessionDoesNotVerify() {
        VoteAuditTrail trail = new VoteAuditTrail();

        Assertions.assertFalse(trail.verify("missing"));
        Assertions.assertEquals(List.of(), trail.entries("missing"));
        Assertions.assertEquals(VoteAuditTrail.GENESIS_HASH, trail.headHash("missing"));
    }

    @Test
    void signatureDependsOnSecret() {
        Ballot ballot = Ballot.choice("A", 0.9, 2);
        VoteRecord plain = VoteRecord.signed("s1", "a1", ballot, 1_000L, null);
        VoteRecord keyed = VoteRecord.signed("s1", "a1", ballot, 1_000L, "hive-secret");

        Assertions.assertNotEquals(plain.signature(), keyed.signature());
        Assertions.assertTrue(keyed.signatureValid("hive-secret"));
        Assertions.assertFalse(keyed.signatureValid("other-secret"));
        Assertions.assertTrue(plain.signatureValid(""));
    }
}
