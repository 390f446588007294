package com.ai.assistant.conversation;

import java.util.Objects;

/**
 * Outcome of intent classification for one message. Confidence is clamped to [0, 1].
 */
public final class IntentResult {

    private final Intent intent;
    private final double confidence;

    public IntentResult(Intent intent, double confidence) {
        this.intent = intent != null ? intent : Intent.UNKNOWN;
        this.confidence = Double.isNaN(confidence) ? 0.0 : Math.max(0.0, Math.min(1.0, confidence));
    }

    public Intent getIntent() {
        return intent;
    }

    public double getConfidence() {
        return confidence;
    }

    public static IntentResult of(Intent intent, double confidence) {
        return new IntentResult(intent, confidence);
    }

    public static IntentResult unknown(double confidence) {
        return new IntentResult(Intent.UNKNOWN, confidence);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IntentResult)) return false;
        IntentResult that = (IntentResult) o;
        return Double.compare(that.confidence, confidence) == 0 && intent == that.intent;
    }

    @Override
    public int hashCode() {
        return Objects.hash(intent, confidence);
    }

    @Override
    public String toString() {
        return intent.code() + "(" + String.format("%.2f", confidence) + ")";
    }
}
