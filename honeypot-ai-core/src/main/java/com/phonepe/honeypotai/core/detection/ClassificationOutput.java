package com.phonepe.honeypotai.core.detection;

import com.fasterxml.jackson.annotation.JsonClassDescription;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;
import lombok.Value;

/**
 * Shape of the structured output requested from the model when classifying a message
 */
@Value
@JsonClassDescription("Scam classification of a single message")
public class ClassificationOutput {
    @JsonProperty("is_scam")
    @JsonPropertyDescription("true if the message is part of a scam")
    boolean scam;

    @JsonPropertyDescription("Confidence between 0.0 and 1.0")
    double confidence;

    @JsonPropertyDescription("One line explanation")
    String reason;
}
