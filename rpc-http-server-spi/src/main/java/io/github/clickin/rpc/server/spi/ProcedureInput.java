package io.github.clickin.rpc.server.spi;

import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Input of a single procedure call.
 *
 * <p>Distinguishes "no input was sent" ({@link Absent}) from "the input is JSON {@code null}"
 * ({@link Present} holding {@code null}).
 */
public sealed interface ProcedureInput permits ProcedureInput.Absent, ProcedureInput.Present {

    /** No input was provided. */
    record Absent() implements ProcedureInput {}

    /** An input value was provided; {@code value} may be {@code null} for JSON {@code null}. */
    record Present(Object value) implements ProcedureInput {}

    static ProcedureInput absent() {
        return new Absent();
    }

    static ProcedureInput of(Object value) {
        return new Present(value);
    }

    default boolean isPresent() {
        return this instanceof Present;
    }

    /**
     * Returns the value, or {@code null} when absent or JSON {@code null}.
     * Use {@link #isPresent()} to tell those two apart.
     */
    default Object valueOrNull() {
        return this instanceof Present present ? present.value() : null;
    }

    /**
     * Applies {@code transform} to a present value; an absent input stays absent.
     */
    default ProcedureInput map(UnaryOperator<Object> transform) {
        Objects.requireNonNull(transform, "transform");
        return this instanceof Present present ? new Present(transform.apply(present.value())) : this;
    }
}
