package io.hivemesh.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

public sealed interface Payload permits TaskPayload, BrainstormPayload, ResultPayload, StatusPayload {
    @JsonIgnore
    MessageType type();
}
