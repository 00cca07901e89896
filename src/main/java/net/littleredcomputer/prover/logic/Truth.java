package net.littleredcomputer.prover.logic;

import java.util.function.UnaryOperator;

final class Truth extends Formula {
    private final boolean value;

    Truth(boolean value) {
        this.value = value;
    }

    @Override
    public Connective connective() {
        return value ? Connective.TRUE : Connective.FALSE;
    }

    @Override
    public Formula mapTerms(UnaryOperator<Term> f) {
        return this;
    }

    @Override
    int precedence() {
        return 5;
    }

    @Override
    public String toString() {
        return value ? "true" : "false";
    }
}
