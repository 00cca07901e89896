package net.littleredcomputer.prover.logic;

import java.util.Objects;
import java.util.function.UnaryOperator;

public final class Not extends Formula {
    private final Formula operand;

    Not(Formula operand) {
        this.operand = Objects.requireNonNull(operand);
    }

    public Formula operand() {
        return operand;
    }

    @Override
    public Connective connective() {
        return Connective.NOT;
    }

    @Override
    public Formula mapTerms(UnaryOperator<Term> f) {
        return new Not(operand.mapTerms(f));
    }

    @Override
    int precedence() {
        return 5;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || o instanceof Not && operand.equals(((Not) o).operand);
    }

    @Override
    public int hashCode() {
        return 31 * operand.hashCode() + 1;
    }

    @Override
    public String toString() {
        // Equalities print without brackets, so ~a = b would be ambiguous to a reader.
        if (operand.connective() == Connective.EQUALS) return "~(" + operand + ")";
        return "~" + parenthesize(operand, 5);
    }
}
