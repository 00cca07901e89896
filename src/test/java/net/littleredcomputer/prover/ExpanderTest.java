package net.littleredcomputer.prover;

import com.google.common.collect.ImmutableList;
import net.littleredcomputer.prover.logic.Compound;
import net.littleredcomputer.prover.logic.Formula;
import net.littleredcomputer.prover.logic.Term;
import net.littleredcomputer.prover.logic.Variable;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import static com.github.npathai.hamcrestopt.OptionalMatchers.isEmpty;
import static com.github.npathai.hamcrestopt.OptionalMatchers.isPresent;
import static net.littleredcomputer.prover.logic.Formula.parse;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.CoreMatchers.notNullValue;
import static org.hamcrest.Matchers.everyItem;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.hasItem;
import static org.junit.Assert.assertThat;

public class ExpanderTest {
    private final Expander expander = new Expander(100);

    /** Every result of expanding f on an empty branch, in order. */
    private List<String> results(String f) {
        List<String> results = new ArrayList<>();
        Results rs = expander.expand(parse(f), Tableau.initial(ImmutableList.of()));
        for (Result r = rs.next(); r != null; r = rs.next()) results.add(r.toString());
        return results;
    }

    private static Result firstClosed(Results rs) {
        for (Result r = rs.next(); r != null; r = rs.next()) {
            if (r.isClosed()) return r;
        }
        return null;
    }

    @Test
    public void closedResultsComeFirst() {
        List<String> r = results("X = a");
        assertThat(r.get(0), is("closed[X ~= a]"));
        assertThat(r, hasItem("open"));
    }

    @Test
    public void rejectedResultsLeaveNoBindings() {
        results("f(X, Y) = f(a, b) & p(X)");
        assertThat(expander.trail().size(), is(0));
        assertThat(expander.trail().choicePoints(), is(0));
    }

    @Test
    public void acceptedResultKeepsBindings() {
        Formula f = parse("p(X) & ~p(a)");
        assertThat(firstClosed(expander.expand(f, Tableau.initial(ImmutableList.of()))), notNullValue());
        assertThat(expander.trail().size(), is(1));
    }

    @Test
    public void contradiction() {
        assertThat(results("p & ~p").get(0), is("closed[]"));
        assertThat(results("false").get(0), is("closed[]"));
        assertThat(results("~(a = a)").get(0), is("closed[]"));
    }

    @Test
    public void consistentBranchIsOpen() {
        assertThat(results("p & ~q"), everyItem(is("open")));
        assertThat(results("~(a = b)"), everyItem(is("open")));
    }

    @Test
    public void disjunctionNeedsBothSidesClosed() {
        assertThat(expander.refute(ImmutableList.of(parse("~p")), parse("p | q")).isClosed(), is(false));
        assertThat(expander.refute(ImmutableList.of(parse("~p"), parse("~q")), parse("p | q")).isClosed(), is(true));
    }

    @Test
    public void disjunctionCollectsObligations() {
        Result r = expander.refute(ImmutableList.of(), parse("X = a | X = b"));
        assertThat(r.toString(), is("closed[X ~= a, X ~= b]"));
    }

    @Test
    public void depthLimit() {
        Expander shallow = new Expander(3);
        Result r = shallow.refute(ImmutableList.of(), parse("p & q & r & ~p"));
        assertThat(r.isClosed(), is(false));
        assertThat(shallow.depthLimitExceeded(), is(true));
        assertThat(new Expander(20).refute(ImmutableList.of(), parse("p & q & r & ~p")).isClosed(), is(true));
    }

    @Test
    public void refuteResetsTrail() {
        expander.refute(ImmutableList.of(), parse("p(X) & ~p(a)"));
        assertThat(expander.trail().size(), is(0));
    }

    @Test
    public void possibleWorldClosesBranch() {
        assertThat(expander.refute(ImmutableList.of(), parse("knows(ann, p) & ~knows(ann, p | q)")).isClosed(), is(true));
        assertThat(expander.refute(ImmutableList.of(), parse("knows(ann, p) & ~knows(bob, p)")).isClosed(), is(false));
    }

    @Test
    public void worldsDoNotBindTheActualWorld() {
        Results rs = expander.expand(parse("~knows(ann, ~p(X)) & knows(ann, ~p(a))"), Tableau.initial(ImmutableList.of()));
        Result first = rs.next();
        assertThat(first.isClosed(), is(true));
        assertThat(expander.trail().size(), is(0));
    }

    @Test
    public void bindingMayNotViolateADisequality() {
        List<String> r = results("~(X = a) & p(X) & ~p(a)");
        assertThat(r.get(0), is("closed[]"));
        assertThat(Collections.frequency(r, "closed[]"), is(1));
        assertThat(r.subList(1, r.size()), everyItem(is("open")));
    }

    @Test
    public void settledDisequalitiesAreDropped() {
        Variable x = new Variable("X");
        Variable y = new Variable("Y");
        Term a = Compound.constant("a");
        Term b = Compound.constant("b");
        Unifier unifier = new Unifier(expander.trail());
        Tableau tbl = Tableau.initial(ImmutableList.of())
                .withDisequalities(ImmutableList.of(new Disequality(x, a), new Disequality(y, b)));

        expander.trail().push();
        Optional<Tableau> bound = expander.applyBindings(tbl, unifier.unifiable(x, b).get());
        assertThat(bound, isPresent());
        assertThat(bound.get().disequalities().toString(), is("[Y ~= b]"));
        expander.trail().pop();

        expander.trail().push();
        assertThat(expander.applyBindings(tbl, unifier.unifiable(y, b).get()), isEmpty());
        expander.trail().pop();
    }

    @Test
    public void refreshedInstancesTakeDistinctValues() {
        // q(a) & q(b) needs the rule twice: the second copy has to take the other constant.
        List<Formula> axioms = ImmutableList.of(parse("p(a)"), parse("p(b)"), parse("all([X], p(X) => q(X))"));
        Result r = expander.expand(parse("~q(a) | ~q(b)"), Tableau.initial(axioms)).next();
        assertThat(r.isClosed(), is(true));
        Trail trail = expander.trail();
        int refreshed = 0;
        for (Binding binding : trail.bindingsSince(0)) {
            Term value = trail.resolve(binding.variable());
            for (Term earlier : trail.siblings(binding.variable())) {
                assertThat(trail.resolve(earlier), not(value));
                ++refreshed;
            }
        }
        assertThat(refreshed, greaterThan(0));
    }

    @Test
    public void equivalentComplementsAreTriedOnce() {
        // Once Y = a, both stored complements unify with p(X) through the same binding.
        List<String> r = results("~p(a) & ~p(Y) & Y = a & p(X)");
        assertThat(r.get(0), is("closed[Y ~= a]"));
        assertThat(Collections.frequency(r, "closed[]"), is(1));
    }
}
