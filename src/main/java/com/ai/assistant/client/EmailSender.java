package com.ai.assistant.client;

public interface EmailSender {

    /** Never throws; failures come back with {@code success == false}. */
    SendResult send(String to, String subject, String body);

    record SendResult(boolean success, String error) {

        public static SendResult sent() {
            return new SendResult(true, null);
        }

        public static SendResult failed(String error) {
            return new SendResult(false, error);
        }
    }
}
