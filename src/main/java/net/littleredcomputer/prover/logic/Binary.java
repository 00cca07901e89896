package net.littleredcomputer.prover.logic;

import java.util.Objects;
import java.util.function.UnaryOperator;

public final class Binary extends Formula {
    private final Connective connective;
    private final Formula left;
    private final Formula right;

    Binary(Connective connective, Formula left, Formula right) {
        switch (connective) {
            case AND:
            case OR:
            case IMPLIES:
            case IFF:
                break;
            default:
                throw new IllegalArgumentException("not a binary connective: " + connective);
        }
        this.connective = connective;
        this.left = Objects.requireNonNull(left);
        this.right = Objects.requireNonNull(right);
    }

    public Formula left() {
        return left;
    }

    public Formula right() {
        return right;
    }

    @Override
    public Connective connective() {
        return connective;
    }

    @Override
    public Formula mapTerms(UnaryOperator<Term> f) {
        return new Binary(connective, left.mapTerms(f), right.mapTerms(f));
    }

    @Override
    int precedence() {
        switch (connective) {
            case IFF: return 1;
            case IMPLIES: return 2;
            case OR: return 3;
            default: return 4;
        }
    }

    private String symbol() {
        switch (connective) {
            case IFF: return " <=> ";
            case IMPLIES: return " => ";
            case OR: return " | ";
            default: return " & ";
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Binary)) return false;
        Binary b = (Binary) o;
        return connective == b.connective && left.equals(b.left) && right.equals(b.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(connective, left, right);
    }

    @Override
    public String toString() {
        // Operators associate to the right, so only the left operand needs brackets at equal precedence.
        int p = precedence();
        return parenthesize(left, p + 1) + symbol() + parenthesize(right, p);
    }
}
