package com.example.udahub.llm;

import com.example.udahub.failure.CollaboratorFailureException;
import com.example.udahub.failure.CollaboratorKind;

public class ReasoningUnavailableException extends CollaboratorFailureException {

    private final String errorType;

    public ReasoningUnavailableException(String message, String errorType, Throwable cause) {
        super(CollaboratorKind.REASONING_ENGINE, message, cause);
        this.errorType = errorType;
    }

    public String errorType() {
        return errorType;
    }
}
