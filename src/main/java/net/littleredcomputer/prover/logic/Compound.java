package net.littleredcomputer.prover.logic;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;

/**
 * A function symbol applied to an ordered list of terms. Constants are compounds with no
 * arguments. Under the unique-names assumption two compounds denote the same individual
 * only if they are structurally identical.
 */
public final class Compound extends Term {
    private static final Joiner commaJoiner = Joiner.on(", ");
    private final String functor;
    private final ImmutableList<Term> args;

    private Compound(String functor, ImmutableList<Term> args) {
        if (functor == null || functor.isEmpty()) throw new IllegalArgumentException("functor must be named");
        this.functor = functor;
        this.args = args;
    }

    public static Compound constant(String name) {
        return new Compound(name, ImmutableList.of());
    }

    public static Compound of(String functor, Term... args) {
        return new Compound(functor, ImmutableList.copyOf(args));
    }

    public static Compound of(String functor, List<? extends Term> args) {
        return new Compound(functor, ImmutableList.copyOf(args));
    }

    public String functor() {
        return functor;
    }

    public ImmutableList<Term> args() {
        return args;
    }

    public int arity() {
        return args.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Compound)) return false;
        Compound c = (Compound) o;
        return functor.equals(c.functor) && args.equals(c.args);
    }

    @Override
    public int hashCode() {
        return Objects.hash(functor, args);
    }

    @Override
    public String toString() {
        if (args.isEmpty()) return functor;
        return functor + "(" + commaJoiner.join(args) + ")";
    }
}
