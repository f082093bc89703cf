package io.hivemesh.agent;

/**
 * Task logic reported failure. Subject to the delivery retry policy.
 */
public class TaskExecutionException extends RuntimeException {
    private final String taskId;

    public TaskExecutionException(String taskId, String message) {
        super(message);
        this.taskId = taskId;
    }

    public TaskExecutionException(String taskId, String message, Throwable cause) {
        super(message, cause);
        this.taskId = taskId;
    }

    public String taskId() {
        return taskId;
    }
}
