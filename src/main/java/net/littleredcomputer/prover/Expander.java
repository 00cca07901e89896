package net.littleredcomputer.prover;

import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Ordering;
import net.littleredcomputer.prover.logic.Atom;
import net.littleredcomputer.prover.logic.Binary;
import net.littleredcomputer.prover.logic.Equality;
import net.littleredcomputer.prover.logic.Formula;
import net.littleredcomputer.prover.logic.Knows;
import net.littleredcomputer.prover.logic.Not;
import net.littleredcomputer.prover.logic.Quantified;
import net.littleredcomputer.prover.logic.Term;
import net.littleredcomputer.prover.logic.Variable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.message.FormattedMessage;

import javax.annotation.CheckReturnValue;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.function.Supplier;

/**
 * Expands formulas on tableau branches, depth first.
 *
 * <p>Expansion produces its results in order, one at a time, as the caller pulls them from
 * {@link Results}. Every choice point is an alternative that is tried only when the previous
 * one is done with, so a result is returned up the stack to whoever asked for it. All closed
 * results of a rule come before its open result.
 *
 * <p>Each expander owns the bindings of one proof attempt, and gives up on any branch that
 * nests deeper than its depth limit; {@link #depthLimitExceeded()} reports whether that
 * happened.
 */
public class Expander {
    private static final Logger log = LogManager.getFormatterLogger(Expander.class);
    private static final ImmutableList<Disequality> none = ImmutableList.of();
    final int logCheckSteps = 10000;
    private final Trail trail = new Trail();
    private final Unifier unifier = new Unifier(trail);
    private final int depthLimit;
    private boolean depthLimitExceeded = false;
    private int maxDepth = 0;
    private long stepCount = 0;
    private long lastStepCount;
    private Duration logInterval = Duration.ofMillis(1000);
    private Instant lastLogTime = Instant.EPOCH;
    private final Stopwatch stopwatch = Stopwatch.createUnstarted();

    public enum Trace {EXPAND, LITERAL, UNIVERSAL, WORLD}
    private EnumSet<Trace> tracing = EnumSet.noneOf(Trace.class);

    public Expander(int depthLimit) {
        if (depthLimit < 1) throw new IllegalArgumentException("depth limit must be positive");
        this.depthLimit = depthLimit;
    }

    public Expander setLogInterval(Duration interval) {
        logInterval = interval;
        return this;
    }

    public Expander setTracing(Set<Trace> categories) {
        tracing = categories.isEmpty() ? EnumSet.noneOf(Trace.class) : EnumSet.copyOf(categories);
        return this;
    }

    public boolean depthLimitExceeded() {
        return depthLimitExceeded;
    }

    public int maxDepth() {
        return maxDepth;
    }

    public long stepCount() {
        return stepCount;
    }

    Trail trail() {
        return trail;
    }

    /**
     * Try to show that the formula is inconsistent with the axioms, which hold in every
     * world. Bindings made along the way are discarded before returning.
     *
     * @return the first result of expanding the formula on a fresh branch
     */
    public Result refute(List<Formula> axioms, Formula f) {
        start();
        try {
            Result r = expand(f, Tableau.initial(axioms)).next();
            return r == null ? Result.OPEN : r;
        } finally {
            trail.reset();
            stopwatch.stop();
        }
    }

    public Results expand(Formula f, Tableau tbl) {
        return expand(f, tbl, 1);
    }

    private void start() {
        if (!stopwatch.isRunning()) stopwatch.start();
        lastLogTime = Instant.now();
        lastStepCount = stepCount;
    }

    private void maybeReportProgress(int depth) {
        if (Thread.currentThread().isInterrupted()) throw new CancellationException("expansion interrupted");
        Instant now = Instant.now();
        Duration tween = Duration.between(lastLogTime, now);
        if (tween.compareTo(logInterval) < 0) return;
        final double perSec = 1e3 * (stepCount - lastStepCount) / Math.max(1, tween.toMillis());
        log.info(() -> new FormattedMessage("limit %d: %d steps %s %.0f/sec depth %d (max %d) %d bindings",
                depthLimit, stepCount, stopwatch, perSec, depth, maxDepth, trail.size()));
        lastLogTime = now;
        lastStepCount = stepCount;
    }

    private Results expand(Formula f, Tableau tbl, int depth) {
        if (depth > depthLimit) {
            depthLimitExceeded = true;
            return Results.none();
        }
        if (depth > maxDepth) maxDepth = depth;
        if (++stepCount % logCheckSteps == 0) maybeReportProgress(depth);
        if (tracing.contains(Trace.EXPAND)) log.trace("%4d %s", depth, trail.resolve(f));
        Optional<Formula> rewritten = Normalizer.rewrite(f);
        if (rewritten.isPresent()) return expand(rewritten.get(), tbl, depth + 1);
        switch (f.connective()) {
            case FORALL:
                return expandUniversal((Quantified) f, tbl, depth);
            case KNOWS: {
                Knows kn = (Knows) f;
                return expand(Formula.TRUE, tbl.withNecessity(kn.agent(), kn.body()), depth + 1);
            }
            case OR:
                return new Disjunction((Binary) f, tbl, depth);
            case AND: {
                Binary b = (Binary) f;
                return expand(b.left(), tbl.push(b.right()), depth + 1);
            }
            case NOT: {
                Formula operand = ((Not) f).operand();
                if (operand.connective() == Formula.Connective.KNOWS) {
                    Knows kn = (Knows) operand;
                    return expand(Formula.TRUE, tbl.withPossibility(kn.agent(), Formula.not(kn.body())), depth + 1);
                }
                return new Literal(f, tbl, depth);
            }
            default:
                return new Literal(f, tbl, depth);
        }
    }

    private Results expandUniversal(Quantified q, Tableau tbl, int depth) {
        if (q.variables().isEmpty()) return expand(q.body(), tbl, depth + 1);
        Universal u = new Universal(q.variables().get(0), q.rest());
        Renamer r = new Renamer(trail, tbl.freeVariables());
        Variable v = r.rename(u.variable());
        Formula instance = r.apply(u.body());
        if (tracing.contains(Trace.UNIVERSAL)) log.trace("%4d instantiate %s as %s", depth, q, instance);
        return expand(instance, tbl.withUniversal(u.withInstance(v), v), depth + 1);
    }

    /**
     * Both disjuncts must close, the right one under the obligations incurred by the left. The
     * right disjunct is expanded here, once the left has handed back a closed result, and not
     * from inside the left's expansion.
     */
    private final class Disjunction implements Results {
        private final Binary or;
        private final Tableau tbl;
        private final int depth;
        private final Results left;
        private Result closedLeft;
        private Results right;

        Disjunction(Binary or, Tableau tbl, int depth) {
            this.or = or;
            this.tbl = tbl;
            this.depth = depth;
            left = expand(or.left(), tbl, depth + 1);
        }

        @Override
        public Result next() {
            while (true) {
                if (right != null) {
                    for (Result r = right.next(); r != null; r = right.next()) {
                        if (r.isClosed()) return Result.closed(ImmutableList.<Disequality>builder()
                                .addAll(closedLeft.disequalities()).addAll(r.disequalities()).build());
                    }
                    right = null;
                }
                Result l = left.next();
                if (l == null) return null;
                if (!l.isClosed()) return Result.OPEN;
                closedLeft = l;
                right = expand(or.right(), tbl.withDisequalities(l.disequalities()), depth + 1);
            }
        }
    }

    /**
     * The ways of adding a literal to the branch, each tried under its own choice point. An
     * alternative that leaves the branch open carries on with the rest of it; once all are
     * exhausted, one last open result follows.
     */
    private final class Literal implements Results {
        private final int depth;
        private final Iterator<Supplier<Extension>> alternatives;
        private Results current;
        private int level = -1;
        private boolean finished = false;

        Literal(Formula literal, Tableau tbl, int depth) {
            if (tracing.contains(Trace.LITERAL)) log.trace("%4d literal %s", depth, trail.resolve(literal));
            this.depth = depth;
            alternatives = addLiteral(literal, tbl).iterator();
        }

        @Override
        public Result next() {
            while (true) {
                if (current != null) {
                    Result r = current.next();
                    if (r != null) return r;
                    current = null;
                }
                if (level >= 0) {
                    trail.popTo(level);
                    level = -1;
                }
                if (!alternatives.hasNext()) {
                    if (finished) return null;
                    finished = true;
                    return Result.OPEN;
                }
                level = trail.push();
                Extension e = alternatives.next().get();
                if (e == null) continue;
                current = e.tableau == null ? Results.of(e.result) : resume(e.tableau, depth);
            }
        }
    }

    /**
     * Carry on with a branch that a literal left open: expand the next pending formula; if
     * there is none, instantiate universals again, then look into other worlds.
     */
    private Results resume(Tableau tbl, int depth) {
        if (tbl.hasWork()) return expand(tbl.next(), tbl.pop(), depth + 1);
        Tableau refreshed = refreshUniversals(tbl, depth);
        if (refreshed.hasWork()) return expand(refreshed.next(), refreshed.pop(), depth + 1);
        if (refuteWorlds(tbl, depth)) return Results.of(Result.closed());
        refreshed = refreshUniversals(tbl, depth);
        if (refreshed.hasWork()) return expand(refreshed.next(), refreshed.pop(), depth + 1);
        return Results.of(Result.OPEN);
    }

    /**
     * Instantiate afresh every universal whose newest instance variable has been bound. Each
     * new instance variable may not take the value of any earlier one.
     */
    private Tableau refreshUniversals(Tableau tbl, int depth) {
        ImmutableList.Builder<Universal> universals = ImmutableList.builder();
        List<Formula> instances = new ArrayList<>();
        List<Variable> variables = new ArrayList<>();
        for (Universal u : tbl.universals()) {
            if (!u.isUsedUp(trail)) {
                universals.add(u);
                continue;
            }
            Renamer r = new Renamer(trail, tbl.freeVariables());
            Variable v = r.rename(u.variable());
            trail.tag(v, u.instances());
            Formula instance = r.apply(u.body());
            if (tracing.contains(Trace.UNIVERSAL)) log.trace("%4d refresh %s as %s", depth, u, instance);
            universals.add(u.withInstance(v));
            instances.add(instance);
            variables.add(v);
        }
        if (instances.isEmpty()) return tbl;
        return tbl.withRefreshedUniversals(universals.build(), instances, variables);
    }

    private boolean refuteWorlds(Tableau tbl, int depth) {
        for (Tableau world : worlds(tbl)) {
            if (tracing.contains(Trace.WORLD)) log.trace("%4d entering world\n%s", depth, world);
            Result r = firstResult(Formula.TRUE, world, depth + 1);
            if (tracing.contains(Trace.WORLD)) log.trace("%4d world is %s", depth, r);
            if (r.isClosed()) return true;
        }
        return false;
    }

    /**
     * The worlds to examine, in order: one for each possibility, newest first, holding the
     * possible formula together with everything the same agent knows; then, for each agent
     * that knows something but considers nothing in particular possible, one world holding
     * what it knows. Every world also holds the axioms.
     */
    private List<Tableau> worlds(Tableau tbl) {
        List<Tableau> worlds = new ArrayList<>();
        for (Modality p : tbl.possibility()) {
            ImmutableList.Builder<Formula> seed = ImmutableList.builder();
            seed.add(p.formula()).addAll(knownBy(tbl, p.agent())).addAll(tbl.axioms());
            worlds.add(snapshot(tbl, seed.build()));
        }
        List<Term> agents = new ArrayList<>();
        for (Modality n : tbl.necessity()) {
            Term agent = trail.resolve(n.agent());
            if (agents.contains(agent)) continue;
            if (tbl.possibility().stream().anyMatch(p -> trail.identical(p.agent(), agent))) continue;
            agents.add(agent);
        }
        agents.sort(Ordering.usingToString());
        for (Term agent : agents) {
            ImmutableList.Builder<Formula> seed = ImmutableList.builder();
            seed.addAll(knownBy(tbl, agent)).addAll(tbl.axioms());
            worlds.add(snapshot(tbl, seed.build()));
        }
        return worlds;
    }

    private List<Formula> knownBy(Tableau tbl, Term agent) {
        List<Formula> known = new ArrayList<>();
        for (Modality n : tbl.necessity()) {
            if (trail.identical(n.agent(), agent)) known.add(n.formula());
        }
        return known;
    }

    /**
     * Build a world from the given formulas and the branch's obligations, with every unbound
     * variable replaced by a fresh copy so that nothing decided in the world binds the branch.
     */
    private Tableau snapshot(Tableau tbl, ImmutableList<Formula> seed) {
        Renamer r = new Renamer(trail);
        ImmutableList.Builder<Formula> worklist = ImmutableList.builder();
        for (Formula f : seed) worklist.add(r.apply(f));
        ImmutableList.Builder<Disequality> disequalities = ImmutableList.builder();
        for (Disequality d : tbl.disequalities()) disequalities.add(r.apply(d));
        ImmutableSet.Builder<Variable> free = ImmutableSet.builder();
        for (Variable v : tbl.freeVariables()) {
            Term t = r.apply(v);
            if (t instanceof Variable) free.add((Variable) t);
        }
        return Tableau.world(worklist.build(), disequalities.build(), tbl.axioms(), free.build());
    }

    /** Expand f, keep only its first result, and undo whatever bindings that result required. */
    private Result firstResult(Formula f, Tableau tbl, int depth) {
        int level = trail.push();
        Result r = expand(f, tbl, depth).next();
        trail.popTo(level);
        return r == null ? Result.OPEN : r;
    }

    /** The outcome of adding a literal to a branch: closed, or open with an updated tableau. */
    private static final class Extension {
        final Result result;
        final Tableau tableau;

        private Extension(Result result, Tableau tableau) {
            this.result = result;
            this.tableau = tableau;
        }

        static Extension closed(ImmutableList<Disequality> disequalities) {
            return new Extension(Result.closed(disequalities), null);
        }

        static Extension open(Tableau tbl) {
            return new Extension(Result.OPEN, tbl);
        }
    }

    private static List<Supplier<Extension>> only(Extension e) {
        return ImmutableList.of(() -> e);
    }

    /**
     * @return the alternatives for adding the literal, in the order they are to be tried. An
     * alternative may make bindings, and yields null if they are refused.
     */
    private List<Supplier<Extension>> addLiteral(Formula literal, Tableau tbl) {
        switch (literal.connective()) {
            case TRUE:
                return only(Extension.open(tbl));
            case FALSE:
                return only(Extension.closed(none));
            case ATOM:
                return addAtom((Atom) literal, true, tbl);
            case EQUALS:
                return addEquality((Equality) literal, tbl);
            case NOT:
                Formula operand = ((Not) literal).operand();
                switch (operand.connective()) {
                    case TRUE:
                        return only(Extension.closed(none));
                    case FALSE:
                        return only(Extension.open(tbl));
                    case ATOM:
                        return addAtom((Atom) operand, false, tbl);
                    case EQUALS:
                        return addDisequality((Equality) operand, tbl);
                    default:
                        break;
                }
                break;
            default:
                break;
        }
        throw new IllegalStateException("not a literal: " + literal);
    }

    private List<Supplier<Extension>> addAtom(Atom atom, boolean positive, Tableau tbl) {
        Term term = atom.asTerm();
        Set<ImmutableList<Binding>> candidates = new LinkedHashSet<>();
        for (Atom other : tbl.literals(!positive)) {
            Optional<ImmutableList<Binding>> u = unifier.unifiable(term, other.asTerm());
            if (!u.isPresent()) continue;
            // Already contradicted as it stands: no other alternative can do better.
            if (u.get().isEmpty()) return only(Extension.closed(none));
            candidates.add(u.get());
        }
        List<Supplier<Extension>> alternatives = new ArrayList<>();
        for (ImmutableList<Binding> bindings : candidates) {
            alternatives.add(() -> applyBindings(tbl, bindings).isPresent() ? Extension.closed(none) : null);
        }
        boolean present = tbl.literals(positive).stream().anyMatch(same -> trail.identical(term, same.asTerm()));
        Extension open = Extension.open(present ? tbl : tbl.withLiteral(atom, positive));
        alternatives.add(() -> open);
        return alternatives;
    }

    private List<Supplier<Extension>> addEquality(Equality eq, Tableau tbl) {
        Optional<ImmutableList<Binding>> u = unifier.unifiable(eq.left(), eq.right());
        if (!u.isPresent()) return only(Extension.closed(none));
        ImmutableList<Binding> bindings = u.get();
        if (bindings.isEmpty()) return only(Extension.open(tbl));
        List<Supplier<Extension>> alternatives = new ArrayList<>();
        for (Binding b : bindings) {
            Extension closed = Extension.closed(ImmutableList.of(b.forbidden()));
            alternatives.add(() -> closed);
        }
        alternatives.add(() -> applyBindings(tbl, bindings).map(Extension::open).orElse(null));
        return alternatives;
    }

    private List<Supplier<Extension>> addDisequality(Equality eq, Tableau tbl) {
        Optional<ImmutableList<Binding>> u = unifier.unifiable(eq.left(), eq.right());
        if (!u.isPresent()) return only(Extension.open(tbl));
        ImmutableList<Binding> bindings = u.get();
        if (bindings.isEmpty()) return only(Extension.closed(none));
        Extension recorded = Extension.open(tbl.withDisequalities(ImmutableList.of(new Disequality(eq.left(), eq.right()))));
        return ImmutableList.of(
                () -> applyBindings(tbl, bindings).isPresent() ? Extension.closed(none) : null,
                () -> recorded);
    }

    /**
     * Make the bindings, then recheck the branch's disequalities: those that can no longer be
     * violated are dropped. The caller must hold a choice point.
     *
     * @return empty if a binding is vetoed or some disequality has become an equality
     */
    @CheckReturnValue
    Optional<Tableau> applyBindings(Tableau tbl, List<Binding> bindings) {
        for (Binding b : bindings) {
            if (!unifier.unify(b.variable(), b.value())) return Optional.empty();
        }
        ImmutableList.Builder<Disequality> kept = ImmutableList.builder();
        for (Disequality d : tbl.disequalities()) {
            Optional<ImmutableList<Binding>> u = unifier.unifiable(d.left(), d.right());
            if (!u.isPresent()) continue;
            if (u.get().isEmpty()) return Optional.empty();
            kept.add(d);
        }
        return Optional.of(tbl.replaceDisequalities(kept.build()));
    }
}
