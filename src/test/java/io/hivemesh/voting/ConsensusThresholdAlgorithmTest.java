package io.hivemesh.voting;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

final class ConsensusThresholdAlgorithmTest {
    private static final TallyContext CONTEXT = new TallyContext(List.of("A", "B", "C"), 0.75, 100, new Random(1));

    @Test
    void threeOfFourReachesConsensus() {
        TallyResult result = new ConsensusThresholdAlgorithm()
                .tally(SimpleMajorityAlgorithmTest.votes("A", "A", "B", "A"), CONTEXT);

        Assertions.assertEquals("A", result.winner());
        Assertions.assertTrue(result.consensus().consensusReached());
        Assertions.assertEquals(ConsensusOutcome.CONSENSUS_ACHIEVED, result.consensus().outcome());
        Assertions.assertEquals(0.75, result.consensus().share(), 1e-9);
    }

    @Test
    void pluralityWithoutConsensusStillNamesWinner() {
        TallyResult result = new ConsensusThresholdAlgorithm()
                .tally(SimpleMajorityAlgorithmTest.votes("A", "B", "A", "C"), CONTEXT);

        Assertions.assertEquals("A", result.winner());
        Assertions.assertFalse(result.consensus().consensusReached());
        Assertions.assertEquals(ConsensusOutcome.NO_CONSENSUS, result.consensus().outcome());
        Assertions.assertEquals(0.75, result.consensus().requiredThreshold(), 1e-9);
    }
}
