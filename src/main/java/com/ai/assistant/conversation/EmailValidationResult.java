package com.ai.assistant.conversation;

/**
 * Verdict on a user-typed address, with an optional corrected address to offer back.
 */
public record EmailValidationResult(boolean valid, String errorMessage, String suggestedCorrection) {

    public static EmailValidationResult ok() {
        return new EmailValidationResult(true, null, null);
    }

    public static EmailValidationResult invalid(String errorMessage, String suggestedCorrection) {
        return new EmailValidationResult(false, errorMessage, suggestedCorrection);
    }

    public boolean hasSuggestion() {
        return suggestedCorrection != null && !suggestedCorrection.isBlank();
    }
}
