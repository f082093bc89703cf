package io.hivemesh.voting;

import io.hivemesh.model.Ballot;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

final class QuorumValidationTest {

    @Test
    void defaultRequiresHalfOfAgents() {
        List<VoteRecord> votes = List.of(vote("a", 1.0, 1), vote("b", 1.0, 1));

        Assertions.assertTrue(QuorumValidation.evaluate(QuorumRequirements.defaults(), votes, 4).met());
        Assertions.assertFalse(QuorumValidation.evaluate(QuorumRequirements.defaults(), votes, 5).met());
    }

    @Test
    void participationExactlyAtThresholdIsMet() {
        List<VoteRecord> fourteen = new ArrayList<>();
        for (int i = 0; i < 14; i++) {
            fourteen.add(vote("a" + i, 1.0, 1));
        }
        QuorumRequirements requirements = new QuorumRequirements(0.14, 0.0, 0, 4);

        QuorumValidation atThreshold = QuorumValidation.evaluate(requirements, fourteen, 100);
        QuorumValidation belowThreshold = QuorumValidation.evaluate(requirements, fourteen.subList(0, 13), 100);

        Assertions.assertTrue(atThreshold.met(), String.valueOf(atThreshold.failures()));
        Assertions.assertEquals(0.14, atThreshold.participationRate(), 1e-12);
        Assertions.assertFalse(belowThreshold.participationMet());
    }

    @Test
    void noVotesNeverMeetQuorum() {
        QuorumValidation quorum = QuorumValidation.evaluate(new QuorumRequirements(0.0, 0.0, 0, 4), List.of(), 0);

        Assertions.assertFalse(quorum.met());
        Assertions.assertFalse(quorum.participationMet());
        Assertions.assertEquals(0.0, quorum.participationRate(), 1e-9);
    }

    @Test
    void reportsEachFailedTier() {
        List<VoteRecord> votes = List.of(vote("a", 0.2, 5), vote("b", 0.4, 1));

        QuorumValidation quorum = QuorumValidation.evaluate(new QuorumRequirements(0.5, 0.5, 2, 4), votes, 3);

        Assertions.assertTrue(quorum.participationMet());
        Assertions.assertFalse(quorum.confidenceMet());
        Assertions.assertFalse(quorum.expertsMet());
        Assertions.assertEquals(1, quorum.expertVotes());
        Assertions.assertEquals(0.3, quorum.meanConfidence(), 1e-9);
        Assertions.assertEquals(2, quorum.failures().size());
    }

    @Test
    void requirementsAreRangeChecked() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> new QuorumRequirements(1.2, 0.0, 0, 4));
        Assertions.assertThrows(IllegalArgumentException.class, () -> new QuorumRequirements(0.5, -0.1, 0, 4));
        Assertions.assertThrows(IllegalArgumentException.class, () -> new QuorumRequirements(0.5, 0.0, -1, 4));
    }

    private static VoteRecord vote(String agent, double confidence, int level) {
        return new VoteRecord("s", agent, Ballot.choice("A", confidence, level), 1L, "sig");
    }
}
