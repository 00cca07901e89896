package net.littleredcomputer.prover;

import com.google.common.collect.ImmutableList;
import net.littleredcomputer.prover.logic.Compound;
import net.littleredcomputer.prover.logic.Term;
import net.littleredcomputer.prover.logic.Variable;
import org.junit.Test;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static com.github.npathai.hamcrestopt.OptionalMatchers.isEmpty;
import static com.github.npathai.hamcrestopt.OptionalMatchers.isPresent;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.junit.Assert.assertThat;

public class UnifierTest {
    private final Trail trail = new Trail();
    private final Unifier unifier = new Unifier(trail);
    private final Variable x = new Variable("X");
    private final Variable y = new Variable("Y");
    private final Term a = Compound.constant("a");
    private final Term b = Compound.constant("b");

    private static Term f(Term... args) {
        return Compound.of("f", args);
    }

    private static List<String> strings(Optional<ImmutableList<Binding>> bindings) {
        return bindings.get().stream().map(Binding::toString).collect(Collectors.toList());
    }

    @Test
    public void unify() {
        assertThat(unifier.unify(f(x, b), f(a, y)), is(true));
        assertThat(trail.resolve(x), is(a));
        assertThat(trail.resolve(y), is(b));
    }

    @Test
    public void clash() {
        assertThat(unifier.unifiable(a, b), isEmpty());
        assertThat(unifier.unifiable(f(a), Compound.of("g", a)), isEmpty());
        assertThat(unifier.unifiable(f(a), f(a, a)), isEmpty());
    }

    @Test
    public void occursCheck() {
        assertThat(unifier.unifiable(x, f(x)), isEmpty());
        assertThat(unifier.unifiable(f(x, y), f(y, f(x))), isEmpty());
    }

    @Test
    public void unifiableLeavesNoBindings() {
        assertThat(strings(unifier.unifiable(f(x, y), f(y, a))), contains("X = Y", "Y = a"));
        assertThat(trail.size(), is(0));
        assertThat(trail.choicePoints(), is(0));
    }

    @Test
    public void identicalTermsNeedNoBindings() {
        assertThat(unifier.unifiable(f(x, a), f(x, a)), isPresent());
        assertThat(unifier.unifiable(f(x, a), f(x, a)).get(), is(empty()));
        trail.push();
        assertThat(unifier.unify(x, b), is(true));
        assertThat(unifier.unifiable(f(x), f(b)).get(), is(empty()));
        trail.pop();
        assertThat(unifier.unifiable(f(x), f(b)).get().size(), is(1));
    }

    @Test
    public void vetoBlocksRepeatedValue() {
        Variable z = new Variable("Z");
        trail.tag(z, ImmutableList.of(x));
        assertThat(unifier.unify(x, a), is(true));
        trail.push();
        assertThat(unifier.unify(f(z), f(a)), is(false));
        trail.pop();
        assertThat(unifier.unify(f(z), f(b)), is(true));
    }

    @Test
    public void unifiableIgnoresVeto() {
        Variable z = new Variable("Z");
        trail.tag(z, ImmutableList.of(x));
        assertThat(unifier.unify(x, a), is(true));
        assertThat(strings(unifier.unifiable(z, a)), contains("Z = a"));
    }
}
