package net.littleredcomputer.prover.logic;

import java.util.Objects;
import java.util.function.UnaryOperator;

public final class Equality extends Formula {
    private final Term left;
    private final Term right;

    Equality(Term left, Term right) {
        this.left = Objects.requireNonNull(left);
        this.right = Objects.requireNonNull(right);
    }

    public Term left() {
        return left;
    }

    public Term right() {
        return right;
    }

    @Override
    public Connective connective() {
        return Connective.EQUALS;
    }

    @Override
    public Formula mapTerms(UnaryOperator<Term> f) {
        return new Equality(f.apply(left), f.apply(right));
    }

    @Override
    int precedence() {
        return 5;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Equality)) return false;
        Equality e = (Equality) o;
        return left.equals(e.left) && right.equals(e.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(left, right, "=");
    }

    @Override
    public String toString() {
        return left + " = " + right;
    }
}
