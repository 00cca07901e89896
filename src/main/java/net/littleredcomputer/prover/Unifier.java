package net.littleredcomputer.prover;

import com.google.common.collect.ImmutableList;
import net.littleredcomputer.prover.logic.Compound;
import net.littleredcomputer.prover.logic.Term;
import net.littleredcomputer.prover.logic.Variable;

import javax.annotation.CheckReturnValue;
import java.util.Optional;

/**
 * Syntactic unification with occurs check over the bindings held in a {@link Trail}. Under
 * the rigid-term and unique-names assumptions this is also how equality is decided: two
 * terms may denote the same individual exactly when they unify.
 */
public class Unifier {
    private final Trail trail;

    public Unifier(Trail trail) {
        this.trail = trail;
    }

    /**
     * Make a and b identical, subject to the binding veto. On failure some bindings may
     * already have been made; the caller is expected to hold a choice point and pop it.
     */
    @CheckReturnValue
    public boolean unify(Term a, Term b) {
        return unify(a, b, true);
    }

    /**
     * Compute the bindings that would make a and b identical, without leaving any of them in
     * force. The veto is not consulted.
     *
     * @return empty if the terms cannot be unified; an empty list if they are already identical
     */
    @CheckReturnValue
    public Optional<ImmutableList<Binding>> unifiable(Term a, Term b) {
        trail.push();
        int mark = trail.size();
        ImmutableList<Binding> bindings = unify(a, b, false) ? trail.bindingsSince(mark) : null;
        trail.pop();
        return Optional.ofNullable(bindings);
    }

    private boolean unify(Term a, Term b, boolean veto) {
        a = trail.walk(a);
        b = trail.walk(b);
        if (a == b) return true;
        if (a instanceof Variable) return bind((Variable) a, b, veto);
        if (b instanceof Variable) return bind((Variable) b, a, veto);
        Compound ca = (Compound) a;
        Compound cb = (Compound) b;
        if (!ca.functor().equals(cb.functor()) || ca.arity() != cb.arity()) return false;
        for (int i = 0; i < ca.arity(); ++i) {
            if (!unify(ca.args().get(i), cb.args().get(i), veto)) return false;
        }
        return true;
    }

    private boolean bind(Variable v, Term t, boolean veto) {
        if (occurs(v, t)) return false;
        if (veto && trail.vetoes(v, t)) return false;
        trail.bind(v, t);
        return true;
    }

    boolean occurs(Variable v, Term t) {
        t = trail.walk(t);
        if (t == v) return true;
        if (t instanceof Variable) return false;
        for (Term a : ((Compound) t).args()) {
            if (occurs(v, a)) return true;
        }
        return false;
    }
}
