package net.littleredcomputer.prover;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import net.littleredcomputer.prover.logic.Atom;
import net.littleredcomputer.prover.logic.Formula;
import net.littleredcomputer.prover.logic.Term;
import net.littleredcomputer.prover.logic.Variable;

import java.util.Collection;
import java.util.List;

/**
 * The state of one branch of a tableau. Instances are immutable; every change produces a new
 * tableau, so a choice point can return to an earlier branch state simply by keeping a
 * reference to it. Lists that grow during expansion keep their newest element first.
 */
public final class Tableau {
    private static final Joiner lineJoiner = Joiner.on("\n    ");
    private final ImmutableList<Formula> worklist;
    private final ImmutableList<Atom> trueLiterals;
    private final ImmutableList<Atom> falseLiterals;
    private final ImmutableList<Disequality> disequalities;
    private final ImmutableList<Formula> axioms;
    private final ImmutableList<Modality> necessity;
    private final ImmutableList<Modality> possibility;
    private final ImmutableList<Universal> universals;
    private final ImmutableSet<Variable> freeVariables;

    private Tableau(ImmutableList<Formula> worklist,
                    ImmutableList<Atom> trueLiterals,
                    ImmutableList<Atom> falseLiterals,
                    ImmutableList<Disequality> disequalities,
                    ImmutableList<Formula> axioms,
                    ImmutableList<Modality> necessity,
                    ImmutableList<Modality> possibility,
                    ImmutableList<Universal> universals,
                    ImmutableSet<Variable> freeVariables) {
        this.worklist = worklist;
        this.trueLiterals = trueLiterals;
        this.falseLiterals = falseLiterals;
        this.disequalities = disequalities;
        this.axioms = axioms;
        this.necessity = necessity;
        this.possibility = possibility;
        this.universals = universals;
        this.freeVariables = freeVariables;
    }

    /** @return the tableau for the actual world of a proof attempt: every axiom is pending */
    public static Tableau initial(List<Formula> axioms) {
        ImmutableList<Formula> a = ImmutableList.copyOf(axioms);
        return new Tableau(a, ImmutableList.of(), ImmutableList.of(), ImmutableList.of(), a,
                ImmutableList.of(), ImmutableList.of(), ImmutableList.of(), ImmutableSet.of());
    }

    static Tableau world(ImmutableList<Formula> worklist,
                         ImmutableList<Disequality> disequalities,
                         ImmutableList<Formula> axioms,
                         ImmutableSet<Variable> freeVariables) {
        return new Tableau(worklist, ImmutableList.of(), ImmutableList.of(), disequalities, axioms,
                ImmutableList.of(), ImmutableList.of(), ImmutableList.of(), freeVariables);
    }

    private static <T> ImmutableList<T> cons(T head, ImmutableList<T> tail) {
        return ImmutableList.<T>builder().add(head).addAll(tail).build();
    }

    public ImmutableList<Formula> worklist() {
        return worklist;
    }

    public boolean hasWork() {
        return !worklist.isEmpty();
    }

    public Formula next() {
        if (worklist.isEmpty()) throw new IllegalStateException("worklist is empty");
        return worklist.get(0);
    }

    public Tableau pop() {
        if (worklist.isEmpty()) throw new IllegalStateException("worklist is empty");
        return new Tableau(worklist.subList(1, worklist.size()), trueLiterals, falseLiterals, disequalities,
                axioms, necessity, possibility, universals, freeVariables);
    }

    public Tableau push(Formula f) {
        return new Tableau(cons(f, worklist), trueLiterals, falseLiterals, disequalities,
                axioms, necessity, possibility, universals, freeVariables);
    }

    public ImmutableList<Atom> trueLiterals() {
        return trueLiterals;
    }

    public ImmutableList<Atom> falseLiterals() {
        return falseLiterals;
    }

    public ImmutableList<Atom> literals(boolean positive) {
        return positive ? trueLiterals : falseLiterals;
    }

    public Tableau withLiteral(Atom a, boolean positive) {
        return positive
                ? new Tableau(worklist, cons(a, trueLiterals), falseLiterals, disequalities,
                        axioms, necessity, possibility, universals, freeVariables)
                : new Tableau(worklist, trueLiterals, cons(a, falseLiterals), disequalities,
                        axioms, necessity, possibility, universals, freeVariables);
    }

    public ImmutableList<Disequality> disequalities() {
        return disequalities;
    }

    /** @return this tableau with additional disequality obligations, placed ahead of the existing ones */
    public Tableau withDisequalities(Collection<Disequality> added) {
        if (added.isEmpty()) return this;
        ImmutableList<Disequality> d = ImmutableList.<Disequality>builder().addAll(added).addAll(disequalities).build();
        return new Tableau(worklist, trueLiterals, falseLiterals, d,
                axioms, necessity, possibility, universals, freeVariables);
    }

    public Tableau replaceDisequalities(ImmutableList<Disequality> d) {
        return new Tableau(worklist, trueLiterals, falseLiterals, d,
                axioms, necessity, possibility, universals, freeVariables);
    }

    public ImmutableList<Formula> axioms() {
        return axioms;
    }

    ImmutableList<Modality> necessity() {
        return necessity;
    }

    ImmutableList<Modality> possibility() {
        return possibility;
    }

    public Tableau withNecessity(Term agent, Formula f) {
        return new Tableau(worklist, trueLiterals, falseLiterals, disequalities,
                axioms, cons(new Modality(agent, f), necessity), possibility, universals, freeVariables);
    }

    public Tableau withPossibility(Term agent, Formula f) {
        return new Tableau(worklist, trueLiterals, falseLiterals, disequalities,
                axioms, necessity, cons(new Modality(agent, f), possibility), universals, freeVariables);
    }

    ImmutableList<Universal> universals() {
        return universals;
    }

    public ImmutableSet<Variable> freeVariables() {
        return freeVariables;
    }

    Tableau withUniversal(Universal u, Variable instance) {
        return new Tableau(worklist, trueLiterals, falseLiterals, disequalities, axioms, necessity, possibility,
                cons(u, universals), ImmutableSet.<Variable>builder().addAll(freeVariables).add(instance).build());
    }

    /**
     * Replace the registered universals after some of them have been instantiated again,
     * queueing the new instances behind any pending work.
     */
    Tableau withRefreshedUniversals(ImmutableList<Universal> refreshed,
                                    List<Formula> instances,
                                    Collection<Variable> instanceVariables) {
        return new Tableau(
                ImmutableList.<Formula>builder().addAll(worklist).addAll(instances).build(),
                trueLiterals, falseLiterals, disequalities, axioms, necessity, possibility, refreshed,
                ImmutableSet.<Variable>builder().addAll(freeVariables).addAll(instanceVariables).build());
    }

    @Override
    public String toString() {
        StringBuilder s = new StringBuilder();
        section(s, "worklist", worklist);
        section(s, "true", trueLiterals);
        section(s, "false", falseLiterals);
        section(s, "disequalities", disequalities);
        section(s, "necessity", necessity);
        section(s, "possibility", possibility);
        section(s, "universals", universals);
        s.append("free variables: ").append(freeVariables);
        return s.toString();
    }

    private static void section(StringBuilder s, String name, List<?> items) {
        s.append(name).append(':');
        if (!items.isEmpty()) s.append("\n    ").append(lineJoiner.join(items));
        s.append('\n');
    }
}
