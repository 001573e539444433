package im.arun.menubuilder.validation;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of an operation that can be refused for an expected, user-correctable
 * reason. A failed outcome means the operation did not happen.
 *
 * @param <T> value produced on success ({@link Void} when there is none)
 */
public final class Outcome<T> {

    private final T value;
    private final RuleViolation violation;
    private final String detail;

    private Outcome(T value, RuleViolation violation, String detail) {
        this.value = value;
        this.violation = violation;
        this.detail = detail;
    }

    public static <T> Outcome<T> success(T value) {
        return new Outcome<>(value, null, null);
    }

    public static Outcome<Void> done() {
        return new Outcome<>(null, null, null);
    }

    public static <T> Outcome<T> failure(RuleViolation violation) {
        return failure(violation, violation.getDescription());
    }

    public static <T> Outcome<T> failure(RuleViolation violation, String detail) {
        Objects.requireNonNull(violation, "violation");
        return new Outcome<>(null, violation, detail);
    }

    public boolean isSuccess() {
        return violation == null;
    }

    public boolean isFailure() {
        return violation != null;
    }

    public boolean failedWith(RuleViolation expected) {
        return violation == expected;
    }

    /**
     * @throws IllegalStateException if the operation failed
     */
    public T getValue() {
        if (violation != null) {
            throw new IllegalStateException("Operation failed with " + violation + ": " + detail);
        }
        return value;
    }

    public Optional<RuleViolation> getViolation() {
        return Optional.ofNullable(violation);
    }

    public String getDetail() {
        return detail;
    }

    /**
     * Re-type a failure so it can be returned from an operation with a different value type.
     */
    public <U> Outcome<U> asFailure() {
        if (violation == null) {
            throw new IllegalStateException("Outcome is a success");
        }
        return new Outcome<>(null, violation, detail);
    }

    @Override
    public String toString() {
        return isSuccess() ? "Outcome.success(" + value + ")" : "Outcome.failure(" + violation + ": " + detail + ")";
    }
}
