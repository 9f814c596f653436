package io.github.eutro.flowssa.core.passes.meta;

import io.github.eutro.flowssa.core.ast.Literal;
import org.jetbrains.annotations.Nullable;

import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * A value of the constant propagation lattice: {@link #UNKNOWN}, a {@link #constant(Object) constant},
 * or {@link #NOT_CONSTANT}.
 * <p>
 * Values only ever move down the lattice: {@code UNKNOWN ⊑ constant(v) ⊑ NOT_CONSTANT}.
 * Different constants are incomparable.
 */
public final class LatticeValue {
    /**
     * Not analysed yet.
     */
    public static final LatticeValue UNKNOWN = new LatticeValue(State.UNKNOWN, null);
    /**
     * May take more than one value.
     */
    public static final LatticeValue NOT_CONSTANT = new LatticeValue(State.NOT_CONSTANT, null);

    /**
     * The state of a lattice value.
     */
    public enum State {
        UNKNOWN,
        CONSTANT,
        NOT_CONSTANT,
    }

    private final State state;
    @Nullable
    private final Object value;

    private LatticeValue(State state, @Nullable Object value) {
        this.state = state;
        this.value = value;
    }

    /**
     * Get the lattice value of a constant.
     *
     * @param value The constant, of a type a {@link Literal} may hold.
     * @return The lattice value.
     */
    public static LatticeValue constant(@Nullable Object value) {
        return new LatticeValue(State.CONSTANT, value);
    }

    public State getState() {
        return state;
    }

    public boolean isUnknown() {
        return state == State.UNKNOWN;
    }

    public boolean isConstant() {
        return state == State.CONSTANT;
    }

    public boolean isNotConstant() {
        return state == State.NOT_CONSTANT;
    }

    /**
     * Get the constant value.
     *
     * @return The value.
     * @throws NoSuchElementException If this is not a constant.
     */
    public @Nullable Object getValue() {
        if (state != State.CONSTANT) throw new NoSuchElementException(this + " is not a constant");
        return value;
    }

    /**
     * Compute the greatest lower bound of this and another value.
     *
     * @param other The other value.
     * @return The meet.
     */
    public LatticeValue meet(LatticeValue other) {
        if (state == State.UNKNOWN) return other;
        if (other.state == State.UNKNOWN) return this;
        if (state == State.NOT_CONSTANT || other.state == State.NOT_CONSTANT) return NOT_CONSTANT;
        return Objects.equals(value, other.value) ? this : NOT_CONSTANT;
    }

    /**
     * Whether moving from this value to {@code other} is a forward move.
     *
     * @param other The other value.
     * @return Whether {@code this ⊑ other}.
     */
    public boolean isBelowOrEqual(LatticeValue other) {
        return state == State.UNKNOWN
                || other.state == State.NOT_CONSTANT
                || this.equals(other);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        LatticeValue that = (LatticeValue) o;
        return state == that.state && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(state, value);
    }

    @Override
    public String toString() {
        switch (state) {
            case UNKNOWN:
                return "Unknown";
            case NOT_CONSTANT:
                return "NotConstant";
            default:
                return "Constant(" + new Literal(value) + ")";
        }
    }
}
