package com.mead.oncology.exception;

import lombok.Getter;

import java.util.List;

/**
 * The guideline knowledge base failed validation. Fatal: the service must not start serving with it.
 */
@Getter
public class MalformedKnowledgeBaseException extends IllegalStateException {

    private final List<String> violations;

    public MalformedKnowledgeBaseException(String source, List<String> violations) {
        super("Malformed knowledge base " + source + ": " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public MalformedKnowledgeBaseException(String message, Throwable cause) {
        super(message, cause);
        this.violations = List.of(message);
    }
}
