package com.phonepe.honeypotai.core.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Optional channel information sent along with a request
 */
@Value
@Builder
@Jacksonized
public class RequestMetadata {
    String channel;
    String language;
    String locale;
}
