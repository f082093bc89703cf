package io.hivemesh.routing;

import io.hivemesh.model.Ballot;
import io.hivemesh.model.BrainstormPayload;
import io.hivemesh.model.Envelope;
import io.hivemesh.model.MessageType;
import io.hivemesh.model.ResultKind;
import io.hivemesh.model.ResultPayload;
import io.hivemesh.model.TaskPayload;
import io.hivemesh.model.VotingAnnouncement;
import io.hivemesh.model.AlgorithmType;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

final class EnvelopeValidatorTest {
    private final EnvelopeValidator validator = new EnvelopeValidator();

    @Test
    void acceptsCompleteTask() {
        Envelope envelope = new Envelope("m1", MessageType.TASK, "leader", 10L,
                new TaskPayload("Title", null, null, "leader", 10L, null, null, null, null));

        Assertions.assertDoesNotThrow(() -> validator.validate(envelope));
    }

    @Test
    void collectsEveryProblem() {
        Envelope envelope = new Envelope(null, MessageType.TASK, " ", 0L,
                new TaskPayload("", null, null, null, null, null, -1, null, null));

        EnvelopeValidationException error = Assertions.assertThrows(EnvelopeValidationException.class,
                () -> validator.validate(envelope));

        Assertions.assertEquals(5, error.problems().size());
    }

    @Test
    void missingPayloadIsInvalid() {
        Envelope envelope = new Envelope("m2", MessageType.STATUS, "agent", 10L, null);

        EnvelopeValidationException error = Assertions.assertThrows(EnvelopeValidationException.class,
                () -> validator.validate(envelope));

        Assertions.assertTrue(error.problems().contains("status body is required"));
    }

    @Test
    void voteNeedsSessionAndBallot() {
        ResultPayload vote = new ResultPayload(ResultKind.VOTE, "task-1", null, "cast", null, "agent", 10L, null, null);
        Envelope envelope = new Envelope("m3", MessageType.RESULT, "agent", 10L, vote);

        EnvelopeValidationException error = Assertions.assertThrows(EnvelopeValidationException.class,
                () -> validator.validate(envelope));

        Assertions.assertEquals(2, error.problems().size());

        Envelope ok = new Envelope("m4", MessageType.RESULT, "agent", 10L,
                ResultPayload.vote("s-1", Ballot.choice("A", 1.0, 1), "agent", 10L));
        Assertions.assertDoesNotThrow(() -> validator.validate(ok));
    }

    @Test
    void votingAnnouncementNeedsTwoOptions() {
        BrainstormPayload message = new BrainstormPayload("s-1", "topic", "q", "leader", List.of(),
                new VotingAnnouncement(List.of("only"), AlgorithmType.SIMPLE_MAJORITY, 100L, null), "replies.leader");
        Envelope envelope = new Envelope("m5", MessageType.BRAINSTORM, "leader", 10L, message);

        Assertions.assertThrows(EnvelopeValidationException.class, () -> validator.validate(envelope));
    }

    @Test
    void blankReplyInboxIsRejected() {
        BrainstormPayload message = new BrainstormPayload("s-2", "topic", "q", "leader", List.of(), null, " ");
        Envelope envelope = new Envelope("m6", MessageType.BRAINSTORM, "leader", 10L, message);

        EnvelopeValidationException error = Assertions.assertThrows(EnvelopeValidationException.class,
                () -> validator.validate(envelope));
        Assertions.assertTrue(error.getMessage().contains("replyTo"));
    }
}
