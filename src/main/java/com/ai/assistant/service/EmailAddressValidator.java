package com.ai.assistant.service;

import com.ai.assistant.conversation.EmailValidationResult;

public interface EmailAddressValidator {

    EmailValidationResult validate(String address);
}
