package com.dealereye.eventmodel;

import java.util.List;

/**
 * Outcome of checking a domain event or a raw primitive. All problems are reported at once.
 *
 * @param valid whether no problem was found
 * @param errors one message per problem, empty when valid
 */
public record ValidationResult(boolean valid, List<String> errors) {

    private static final ValidationResult OK = new ValidationResult(true, List.of());

    public static ValidationResult ok() {
        return OK;
    }

    public static ValidationResult fail(List<String> errors) {
        return new ValidationResult(false, List.copyOf(errors));
    }
}
