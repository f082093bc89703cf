package io.hivemesh.voting;

import io.hivemesh.model.Ballot;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

final class ConfidenceWeightedAlgorithmTest {
    private static final TallyContext CONTEXT = new TallyContext(List.of("A", "B"), 0.75, 100, new Random(1));

    @Test
    void sumsConfidencePerChoice() {
        List<VoteRecord> votes = List.of(
                vote("a1", Ballot.choice("A", 0.9, 1)),
                vote("a2", Ballot.choice("A", 0.8, 1)),
                vote("a3", Ballot.choice("B", 0.5, 1))
        );

        TallyResult result = new ConfidenceWeightedAlgorithm().tally(votes, CONTEXT);

        Assertions.assertEquals("A", result.winner());
        Assertions.assertEquals(1.7, result.tally().get("A"), 1e-9);
        Assertions.assertEquals(0.5, result.tally().get("B"), 1e-9);
        Assertions.assertEquals(1.7 / 2.2, result.winnerShare(), 1e-9);
    }

    @Test
    void missingConfidenceWeighsOne() {
        List<VoteRecord> votes = List.of(
                vote("a1", new Ballot("B", null, null, null, null)),
                vote("a2", Ballot.choice("A", 0.6, 1)),
                vote("a3", Ballot.choice("A", 0.3, 1))
        );

        TallyResult result = new ConfidenceWeightedAlgorithm().tally(votes, CONTEXT);

        Assertions.assertEquals("B", result.winner());
        Assertions.assertEquals(1.0, result.tally().get("B"), 1e-9);
    }

    private static VoteRecord vote(String agent, Ballot ballot) {
        return new VoteRecord("s", agent, ballot, 1_000L, "sig");
    }
}
