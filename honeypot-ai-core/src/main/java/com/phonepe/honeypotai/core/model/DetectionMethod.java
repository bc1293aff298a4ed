package com.phonepe.honeypotai.core.model;

/**
 * Tier that produced a verdict
 */
public enum DetectionMethod {
    LLM,
    RULE_FALLBACK,
}
