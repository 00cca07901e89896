package net.littleredcomputer.prover.logic;

import java.util.Objects;
import java.util.function.UnaryOperator;

/** The knowledge modality: the agent knows the body formula. */
public final class Knows extends Formula {
    private final Term agent;
    private final Formula body;

    Knows(Term agent, Formula body) {
        this.agent = Objects.requireNonNull(agent);
        this.body = Objects.requireNonNull(body);
    }

    public Term agent() {
        return agent;
    }

    public Formula body() {
        return body;
    }

    @Override
    public Connective connective() {
        return Connective.KNOWS;
    }

    @Override
    public Formula mapTerms(UnaryOperator<Term> f) {
        return new Knows(f.apply(agent), body.mapTerms(f));
    }

    @Override
    int precedence() {
        return 5;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Knows)) return false;
        Knows k = (Knows) o;
        return agent.equals(k.agent) && body.equals(k.body);
    }

    @Override
    public int hashCode() {
        return Objects.hash(agent, body, "knows");
    }

    @Override
    public String toString() {
        return "knows(" + agent + ", " + body + ")";
    }
}
