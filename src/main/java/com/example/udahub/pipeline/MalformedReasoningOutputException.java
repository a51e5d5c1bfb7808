package com.example.udahub.pipeline;

import com.example.udahub.failure.CollaboratorFailureException;
import com.example.udahub.failure.CollaboratorKind;

public class MalformedReasoningOutputException extends CollaboratorFailureException {

    public MalformedReasoningOutputException(String stage, String message) {
        super(CollaboratorKind.REASONING_ENGINE, "Malformed " + stage + " output: " + message);
    }

    public MalformedReasoningOutputException(String stage, String message, Throwable cause) {
        super(CollaboratorKind.REASONING_ENGINE, "Malformed " + stage + " output: " + message, cause);
    }
}
