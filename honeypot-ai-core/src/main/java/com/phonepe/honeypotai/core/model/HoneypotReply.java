package com.phonepe.honeypotai.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.Value;

/**
 * Response for a handled request. {@code reply} is null when we do not want to say anything.
 */
@Value
public class HoneypotReply {
    @Getter
    @AllArgsConstructor
    public enum Status {
        SUCCESS("success"),
        ERROR("error"),
        ;

        @JsonValue
        private final String value;
    }

    Status status;

    @JsonInclude(JsonInclude.Include.ALWAYS)
    String reply;

    String error;

    public static HoneypotReply success(final String reply) {
        return new HoneypotReply(Status.SUCCESS, reply, null);
    }

    public static HoneypotReply silent() {
        return success(null);
    }

    public static HoneypotReply error(final String error) {
        return new HoneypotReply(Status.ERROR, null, error);
    }
}
