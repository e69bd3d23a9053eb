package co.fanki.flowgraph.shared;

import java.util.Collection;

/**
 * Argument checks shared by the flow graph and knowledge graph models.
 *
 * <p>Every check throws {@link IllegalArgumentException}, except
 * {@link #requireDomain(boolean, String)} which signals a violated model
 * invariant through a {@link DomainException}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class Preconditions {

    private Preconditions() {
    }

    /**
     * Ensures that a reference is not null.
     *
     * @param reference the reference to check
     * @param message the exception message if null
     * @param <T> the type of the reference
     * @return the non-null reference
     * @throws IllegalArgumentException if reference is null
     */
    public static <T> T requireNonNull(final T reference, final String message) {
        if (reference == null) {
            throw new IllegalArgumentException(message);
        }
        return reference;
    }

    /**
     * Ensures that a string is neither null nor blank.
     *
     * @param value the string to check
     * @param message the exception message if null or blank
     * @return the string, untouched
     * @throws IllegalArgumentException if value is null or blank
     */
    public static String requireNonBlank(final String value,
            final String message) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(message);
        }
        return value;
    }

    /**
     * Ensures that a collection is neither null nor empty.
     *
     * @param values the collection to check
     * @param message the exception message if null or empty
     * @param <C> the collection type
     * @return the collection, untouched
     * @throws IllegalArgumentException if values is null or empty
     */
    public static <C extends Collection<?>> C requireNonEmpty(
            final C values, final String message) {
        if (values == null || values.isEmpty()) {
            throw new IllegalArgumentException(message);
        }
        return values;
    }

    /**
     * Ensures that a condition holds.
     *
     * @param condition the condition to check
     * @param message the exception message if false
     * @throws IllegalArgumentException if condition is false
     */
    public static void require(final boolean condition, final String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }

    /**
     * Ensures that a model invariant holds.
     *
     * @param condition the invariant to check
     * @param message the exception message if false
     * @throws DomainException if condition is false
     */
    public static void requireDomain(final boolean condition,
            final String message) {
        if (!condition) {
            throw new DomainException(message);
        }
    }

    /**
     * Ensures that a number is zero or greater, as block ordinals and
     * operation indexes must be.
     *
     * @param value the number to check
     * @param message the exception message if negative
     * @return the number, untouched
     * @throws IllegalArgumentException if value is negative
     */
    public static int requireNonNegative(final int value, final String message) {
        if (value < 0) {
            throw new IllegalArgumentException(message);
        }
        return value;
    }

}
