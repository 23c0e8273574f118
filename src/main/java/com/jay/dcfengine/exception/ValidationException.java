package com.jay.dcfengine.exception;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Raised by the pre-computation gate when one or more inputs violate a precondition.
 * Each violation names the failing field.
 */
public class ValidationException extends ValuationException {

    public record Violation(String field, String message) {
        @Override
        public String toString() {
            return field + ": " + message;
        }
    }

    private final List<Violation> violations;

    public ValidationException(List<Violation> violations) {
        super("Validation failed — " + violations.stream()
            .map(Violation::toString)
            .collect(Collectors.joining("; ")));
        this.violations = List.copyOf(violations);
    }

    public List<Violation> getViolations() {
        return violations;
    }

    public List<String> getFields() {
        return violations.stream().map(Violation::field).toList();
    }
}
