package net.littleredcomputer.prover;

import com.google.common.collect.ImmutableList;
import net.littleredcomputer.prover.logic.Compound;
import net.littleredcomputer.prover.logic.Term;
import net.littleredcomputer.prover.logic.Variable;
import org.junit.Test;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.junit.Assert.assertThat;

public class TrailTest {
    private final Trail trail = new Trail();
    private final Variable x = new Variable("X");
    private final Variable y = new Variable("Y");
    private final Term a = Compound.constant("a");
    private final Term b = Compound.constant("b");

    @Test
    public void walkAndResolve() {
        trail.bind(x, y);
        trail.bind(y, a);
        assertThat(trail.walk(x), is(a));
        assertThat(trail.resolve(Compound.of("f", x, Compound.of("g", y))).toString(), is("f(a, g(a))"));
        assertThat(trail.identical(x, y), is(true));
    }

    @Test
    public void unboundVariableWalksToItself() {
        assertThat(trail.walk(x), sameInstance(x));
        assertThat(trail.isBound(x), is(false));
    }

    @Test
    public void popUndoesToMark() {
        trail.bind(x, a);
        trail.push();
        trail.bind(y, b);
        assertThat(trail.size(), is(2));
        trail.pop();
        assertThat(trail.isBound(x), is(true));
        assertThat(trail.isBound(y), is(false));
        assertThat(trail.choicePoints(), is(0));
    }

    @Test
    public void popToClosesLaterChoicePoints() {
        trail.push();
        int level = trail.push();
        trail.bind(x, a);
        trail.push();
        trail.push();
        trail.bind(y, b);
        trail.popTo(level);
        assertThat(trail.choicePoints(), is(1));
        assertThat(trail.size(), is(0));
        trail.popTo(level);
        assertThat(trail.choicePoints(), is(1));
        trail.pop();
        assertThat(trail.choicePoints(), is(0));
    }

    @Test
    public void reset() {
        trail.push();
        trail.bind(x, a);
        trail.tag(y, ImmutableList.of(x));
        trail.reset();
        assertThat(trail.size(), is(0));
        assertThat(trail.choicePoints(), is(0));
        assertThat(trail.vetoes(y, a), is(false));
    }

    @Test
    public void vetoComparesResolvedValues() {
        Variable z = new Variable("Z");
        trail.tag(z, ImmutableList.of(x, y));
        assertThat(trail.vetoes(z, a), is(false));
        trail.bind(x, Compound.of("f", y));
        trail.bind(y, a);
        assertThat(trail.vetoes(z, a), is(true));
        assertThat(trail.vetoes(z, Compound.of("f", a)), is(true));
        assertThat(trail.vetoes(z, b), is(false));
        assertThat(trail.vetoes(x, a), is(false));
    }

    @Test(expected = IllegalStateException.class)
    public void bindingTwiceIsAnError() {
        trail.bind(x, a);
        trail.bind(x, b);
    }
}
