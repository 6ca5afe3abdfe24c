package org.patternlab.core;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Contract failure raised by pattern components.
 *
 * <p>Every failure carries a {@link Category} telling callers whether they passed a missing or
 * invalid collaborator ({@link Category#INVALID_ARGUMENT}) or referred to something the
 * component does not hold ({@link Category#NOT_FOUND}), plus a reason code naming the exact
 * contract. Messages read {@code [REASON_CODE] details}.</p>
 */
@Getter
@Accessors(fluent = true)
public final class PatternContractException extends RuntimeException {

    /**
     * Coarse failure kind shared by all components.
     */
    public enum Category {
        /**
         * A required collaborator or argument was absent or outside its domain.
         */
        INVALID_ARGUMENT,

        /**
         * The referenced observer, strategy, or format is not known to the component.
         */
        NOT_FOUND
    }

    private final Category category;
    private final String reasonCode;

    public PatternContractException(Category category, String reasonCode, String message) {
        this(category, reasonCode, message, null);
    }

    public PatternContractException(Category category, String reasonCode, String message, Throwable cause) {
        super(formatMessage(reasonCode, message), cause);
        this.category = Objects.requireNonNull(category, "category");
        this.reasonCode = reasonCode;
    }

    /**
     * Shorthand for an {@link Category#INVALID_ARGUMENT} failure.
     */
    public static PatternContractException invalidArgument(String reasonCode, String message) {
        return new PatternContractException(Category.INVALID_ARGUMENT, reasonCode, message);
    }

    /**
     * Shorthand for a {@link Category#NOT_FOUND} failure.
     */
    public static PatternContractException notFound(String reasonCode, String message) {
        return new PatternContractException(Category.NOT_FOUND, reasonCode, message);
    }

    public boolean isNotFound() {
        return category == Category.NOT_FOUND;
    }

    private static String formatMessage(String reasonCode, String message) {
        String code = Objects.requireNonNull(reasonCode, "reasonCode");
        if (code.isBlank()) {
            throw new IllegalArgumentException("reasonCode must be non-blank");
        }
        return "[" + code + "] " + Objects.requireNonNull(message, "message");
    }
}
