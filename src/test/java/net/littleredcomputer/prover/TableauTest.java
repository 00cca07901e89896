package net.littleredcomputer.prover;

import com.google.common.collect.ImmutableList;
import net.littleredcomputer.prover.logic.Atom;
import net.littleredcomputer.prover.logic.Compound;
import net.littleredcomputer.prover.logic.Formula;
import net.littleredcomputer.prover.logic.Variable;
import org.junit.Test;

import static net.littleredcomputer.prover.logic.Formula.parse;
import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.junit.Assert.assertThat;

public class TableauTest {
    private final Formula p = parse("p");
    private final Formula q = parse("q");

    @Test
    public void initialHoldsAxiomsAsWork() {
        Tableau t = Tableau.initial(ImmutableList.of(p, q));
        assertThat(t.worklist(), contains(p, q));
        assertThat(t.axioms(), contains(p, q));
        assertThat(t.trueLiterals(), is(empty()));
        assertThat(t.freeVariables(), is(empty()));
    }

    @Test
    public void worklistIsLastInFirstOut() {
        Formula r = parse("r");
        Tableau t = Tableau.initial(ImmutableList.of(p)).push(q).push(r);
        assertThat(t.next(), is(r));
        assertThat(t.pop().next(), is(q));
        assertThat(t.pop().pop().pop().hasWork(), is(false));
    }

    @Test
    public void updatesReturnCopies() {
        Tableau t = Tableau.initial(ImmutableList.of());
        Tableau u = t.withLiteral((Atom) p, true)
                .withLiteral((Atom) q, false)
                .withDisequalities(ImmutableList.of(new Disequality(new Variable("X"), Compound.constant("a"))))
                .withNecessity(Compound.constant("ann"), p)
                .withPossibility(Compound.constant("bob"), q);
        assertThat(t.trueLiterals(), is(empty()));
        assertThat(t.disequalities(), is(empty()));
        assertThat(t.necessity(), is(empty()));
        assertThat(u.literals(true), contains((Atom) p));
        assertThat(u.literals(false), contains((Atom) q));
        assertThat(u.disequalities().size(), is(1));
        assertThat(u.necessity().get(0).toString(), is("ann: p"));
        assertThat(u.possibility().get(0).toString(), is("bob: q"));
    }

    @Test
    public void newestLiteralFirst() {
        Atom a = (Atom) parse("p(a)");
        Atom b = (Atom) parse("p(b)");
        Tableau t = Tableau.initial(ImmutableList.of()).withLiteral(a, true).withLiteral(b, true);
        assertThat(t.trueLiterals(), contains(b, a));
    }

    @Test
    public void universalRegistersInstanceVariable() {
        Variable x = new Variable("X");
        Variable v = Variable.fresh();
        Universal u = new Universal(x, parse("p"));
        Tableau t = Tableau.initial(ImmutableList.of()).withUniversal(u.withInstance(v), v);
        assertThat(t.freeVariables(), contains(v));
        assertThat(t.universals().get(0).instances(), contains(v));
    }

    @Test(expected = IllegalStateException.class)
    public void popEmpty() {
        Tableau.initial(ImmutableList.of()).pop();
    }

    @Test
    public void dump() {
        Tableau t = Tableau.initial(ImmutableList.of(p)).withLiteral((Atom) q, false);
        String s = t.toString();
        assertThat(s, containsString("worklist:\n    p\n"));
        assertThat(s, containsString("false:\n    q\n"));
        assertThat(s, containsString("true:\n"));
    }
}
