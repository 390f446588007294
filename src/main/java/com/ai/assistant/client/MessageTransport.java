package com.ai.assistant.client;

/**
 * Outbound side of the chat channel. Fire-and-forget: implementations log delivery
 * failures and never throw.
 */
public interface MessageTransport {

    void deliver(String recipientId, String text);
}
