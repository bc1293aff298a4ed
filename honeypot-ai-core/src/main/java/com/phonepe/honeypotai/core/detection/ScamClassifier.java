package com.phonepe.honeypotai.core.detection;

import com.phonepe.honeypotai.core.model.Message;

import java.util.List;

/**
 * Classifies a message given the conversation that preceded it
 */
public interface ScamClassifier {
    String name();

    ClassificationResult classify(final String text, final List<Message> history);
}
