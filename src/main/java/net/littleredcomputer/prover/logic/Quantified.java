package net.littleredcomputer.prover.logic;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

import java.util.Objects;
import java.util.function.UnaryOperator;

/** Universal or existential quantification over a list of variables. */
public final class Quantified extends Formula {
    private final Connective connective;
    private final ImmutableList<Variable> variables;
    private final Formula body;

    Quantified(Connective connective, ImmutableList<Variable> variables, Formula body) {
        if (connective != Connective.FORALL && connective != Connective.EXISTS) {
            throw new IllegalArgumentException("not a quantifier: " + connective);
        }
        this.connective = connective;
        this.variables = variables;
        this.body = Objects.requireNonNull(body);
    }

    public ImmutableList<Variable> variables() {
        return variables;
    }

    public Formula body() {
        return body;
    }

    /** @return the same quantifier over the remaining variables, once the first has been peeled off */
    public Quantified rest() {
        if (variables.isEmpty()) throw new IllegalStateException("no variables left to peel off");
        return new Quantified(connective, variables.subList(1, variables.size()), body);
    }

    @Override
    public Connective connective() {
        return connective;
    }

    @Override
    public Formula mapTerms(UnaryOperator<Term> f) {
        ImmutableList.Builder<Variable> vs = ImmutableList.builderWithExpectedSize(variables.size());
        for (Variable v : variables) {
            Term t = f.apply(v);
            if (!(t instanceof Variable)) throw new IllegalStateException("bound variable " + v + " mapped to " + t);
            vs.add((Variable) t);
        }
        return new Quantified(connective, vs.build(), body.mapTerms(f));
    }

    @Override
    int precedence() {
        return 5;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Quantified)) return false;
        Quantified q = (Quantified) o;
        return connective == q.connective && variables.equals(q.variables) && body.equals(q.body);
    }

    @Override
    public int hashCode() {
        return Objects.hash(connective, variables, body);
    }

    @Override
    public String toString() {
        return (connective == Connective.FORALL ? "all" : "ext") + "([" + Joiner.on(", ").join(variables) + "], " + body + ")";
    }
}
