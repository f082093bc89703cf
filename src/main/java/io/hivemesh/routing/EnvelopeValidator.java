package io.hivemesh.routing;

import io.hivemesh.model.BrainstormPayload;
import io.hivemesh.model.Envelope;
import io.hivemesh.model.ResultKind;
import io.hivemesh.model.ResultPayload;
import io.hivemesh.model.StatusPayload;
import io.hivemesh.model.TaskPayload;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-type required-field checks, run before any handler sees the envelope.
 */
public final class EnvelopeValidator {

    public void validate(Envelope envelope) {
        List<String> problems = new ArrayList<>();
        if (isBlank(envelope.id())) {
            problems.add("id is required");
        }
        if (isBlank(envelope.from())) {
            problems.add("from is required");
        }
        if (envelope.timestamp() <= 0L) {
            problems.add("timestamp must be positive");
        }
        if (envelope.payload() == null) {
            problems.add(envelope.type().payloadField() + " body is required");
        } else {
            switch (envelope.type()) {
                case TASK -> checkTask((TaskPayload) envelope.payload(), problems);
                case BRAINSTORM -> checkBrainstorm((BrainstormPayload) envelope.payload(), problems);
                case RESULT -> checkResult((ResultPayload) envelope.payload(), problems);
                case STATUS -> checkStatus((StatusPayload) envelope.payload(), problems);
            }
        }
        if (!problems.isEmpty()) {
            throw new EnvelopeValidationException(
                    "Invalid " + envelope.type().wireName() + " envelope " + envelope.id() + ": " + String.join("; ", problems),
                    problems
            );
        }
    }

    private void checkTask(TaskPayload task, List<String> problems) {
        if (isBlank(task.title())) {
            problems.add("task.title is required");
        }
        if (task.retryCount() != null && task.retryCount() < 0) {
            problems.add("task.retryCount must not be negative");
        }
    }

    private void checkBrainstorm(BrainstormPayload message, List<String> problems) {
        if (isBlank(message.sessionId())) {
            problems.add("message.sessionId is required");
        }
        if (message.voting() != null) {
            List<String> options = message.voting().options();
            if (options == null || options.size() < 2) {
                problems.add("message.voting.options needs at least two entries");
            }
        }
        if (message.replyTo() != null && message.replyTo().isBlank()) {
            problems.add("message.replyTo must not be blank");
        }
    }

    private void checkResult(ResultPayload result, List<String> problems) {
        if (isBlank(result.taskId()) && isBlank(result.sessionId())) {
            problems.add("result.taskId or result.sessionId is required");
        }
        if (isBlank(result.status())) {
            problems.add("result.status is required");
        }
        if (result.effectiveKind() == ResultKind.VOTE) {
            if (isBlank(result.sessionId())) {
                problems.add("vote result needs result.sessionId");
            }
            if (result.ballot() == null) {
                problems.add("vote result needs result.ballot");
            }
        }
    }

    private void checkStatus(StatusPayload status, List<String> problems) {
        if (isBlank(status.event())) {
            problems.add("status.event is required");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
