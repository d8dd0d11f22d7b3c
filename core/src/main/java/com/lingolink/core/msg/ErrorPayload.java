package com.lingolink.core.msg;

import lombok.Value;

/**
 * Payload of an {@code error} frame.
 */
@Value
public class ErrorPayload {
    /**
     * One of {@link Events.ErrorCodes}.
     */
    String code;
    String message;
}
