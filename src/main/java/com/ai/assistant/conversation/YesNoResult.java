package com.ai.assistant.conversation;

/**
 * Result of matching a reply against a step's affirmative and negative token sets.
 */
public enum YesNoResult {
    YES,
    NO,
    UNKNOWN
}
