package net.littleredcomputer.prover;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import net.littleredcomputer.prover.logic.Compound;
import net.littleredcomputer.prover.logic.Formula;
import net.littleredcomputer.prover.logic.Term;
import net.littleredcomputer.prover.logic.Variable;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Copies terms and formulas, replacing each unbound variable by a fresh one. Bound variables
 * are first replaced by their values. The same source variable always maps to the same copy
 * for the lifetime of the renamer, so several related structures can be copied consistently.
 * Variables in the preserved set are left as they are. A copy inherits the veto tags of its
 * source, themselves renamed.
 */
final class Renamer implements UnaryOperator<Term> {
    private final Trail trail;
    private final Set<Variable> preserved;
    private final Map<Variable, Variable> copies = new HashMap<>();

    Renamer(Trail trail, Set<Variable> preserved) {
        this.trail = trail;
        this.preserved = preserved;
    }

    Renamer(Trail trail) {
        this(trail, ImmutableSet.of());
    }

    @Override
    public Term apply(Term t) {
        t = trail.walk(t);
        if (t instanceof Variable) return rename((Variable) t);
        Compound c = (Compound) t;
        if (c.arity() == 0) return c;
        List<Term> args = new ArrayList<>(c.arity());
        for (Term a : c.args()) args.add(apply(a));
        return Compound.of(c.functor(), args);
    }

    Variable rename(Variable v) {
        if (preserved.contains(v)) return v;
        Variable copy = copies.get(v);
        if (copy == null) {
            copy = Variable.fresh();
            // Registered before the tags are copied: a tag may mention v itself.
            copies.put(v, copy);
            ImmutableList<Term> tags = trail.siblings(v);
            if (!tags.isEmpty()) {
                List<Term> renamed = new ArrayList<>(tags.size());
                for (Term s : tags) renamed.add(apply(s));
                trail.tag(copy, renamed);
            }
        }
        return copy;
    }

    Formula apply(Formula f) {
        return f.mapTerms(this);
    }

    Disequality apply(Disequality d) {
        return new Disequality(apply(d.left()), apply(d.right()));
    }
}
