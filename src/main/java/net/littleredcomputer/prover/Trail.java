package net.littleredcomputer.prover;

import com.google.common.collect.ImmutableList;
import gnu.trove.stack.TIntStack;
import gnu.trove.stack.array.TIntArrayStack;
import net.littleredcomputer.prover.logic.Compound;
import net.littleredcomputer.prover.logic.Formula;
import net.littleredcomputer.prover.logic.Term;
import net.littleredcomputer.prover.logic.Variable;

import javax.annotation.CheckReturnValue;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The variable bindings of one proof attempt. Bindings are recorded in the order they are
 * made so that they can be rolled back: {@link #push()} opens a choice point and
 * {@link #pop()} undoes everything bound since the matching push. {@link #popTo(int)} closes a
 * choice point together with any opened after it, whether or not they were popped.
 *
 * <p>The trail also carries the veto side-table: a variable may be tagged with the
 * instance variables of earlier copies of the same universal formula, and may not be bound
 * to the value any of them already has.
 */
public class Trail {
    private final Map<Variable, Term> values = new HashMap<>();
    private final List<Variable> bound = new ArrayList<>();
    private final TIntStack marks = new TIntArrayStack();
    private final Map<Variable, ImmutableList<Term>> siblings = new HashMap<>();

    /** @return the level of the new choice point, for {@link #popTo(int)} */
    public int push() {
        marks.push(bound.size());
        return marks.size() - 1;
    }

    public void pop() {
        undo(marks.pop());
    }

    public void popTo(int level) {
        int mark = bound.size();
        while (marks.size() > level) mark = marks.pop();
        undo(mark);
    }

    public void reset() {
        undo(0);
        marks.clear();
        siblings.clear();
    }

    private void undo(int mark) {
        for (int i = bound.size() - 1; i >= mark; --i) values.remove(bound.remove(i));
    }

    public int size() {
        return bound.size();
    }

    int choicePoints() {
        return marks.size();
    }

    ImmutableList<Binding> bindingsSince(int mark) {
        ImmutableList.Builder<Binding> b = ImmutableList.builder();
        for (int i = mark; i < bound.size(); ++i) {
            Variable v = bound.get(i);
            b.add(new Binding(v, values.get(v)));
        }
        return b.build();
    }

    void bind(Variable v, Term t) {
        if (values.containsKey(v)) throw new IllegalStateException(v + " is already bound");
        values.put(v, t);
        bound.add(v);
    }

    boolean isBound(Variable v) {
        return values.containsKey(v);
    }

    public Term walk(Term t) {
        while (t instanceof Variable) {
            Term u = values.get(t);
            if (u == null) break;
            t = u;
        }
        return t;
    }

    /** @return t with every bound variable, at any depth, replaced by its value */
    public Term resolve(Term t) {
        t = walk(t);
        if (t instanceof Variable) return t;
        Compound c = (Compound) t;
        if (c.arity() == 0) return c;
        List<Term> args = new ArrayList<>(c.arity());
        for (Term a : c.args()) args.add(resolve(a));
        return Compound.of(c.functor(), args);
    }

    public Formula resolve(Formula f) {
        return f.mapTerms(this::resolve);
    }

    public boolean identical(Term a, Term b) {
        return resolve(a).equals(resolve(b));
    }

    /**
     * Record that v was produced by re-instantiating a universal formula whose earlier
     * instances are the given terms.
     */
    public void tag(Variable v, List<? extends Term> earlier) {
        if (!earlier.isEmpty()) siblings.put(v, ImmutableList.copyOf(earlier));
    }

    ImmutableList<Term> siblings(Variable v) {
        ImmutableList<Term> s = siblings.get(v);
        return s == null ? ImmutableList.of() : s;
    }

    /** @return true if binding v to t would duplicate the value of one of v's siblings */
    @CheckReturnValue
    public boolean vetoes(Variable v, Term t) {
        ImmutableList<Term> s = siblings.get(v);
        if (s == null) return false;
        Term value = resolve(t);
        for (Term sibling : s) {
            if (resolve(sibling).equals(value)) return true;
        }
        return false;
    }
}
