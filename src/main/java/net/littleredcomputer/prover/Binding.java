package net.littleredcomputer.prover;

import net.littleredcomputer.prover.logic.Term;
import net.littleredcomputer.prover.logic.Variable;

/** One variable assignment produced by unification. */
public final class Binding {
    private final Variable variable;
    private final Term value;

    Binding(Variable variable, Term value) {
        this.variable = variable;
        this.value = value;
    }

    public Variable variable() {
        return variable;
    }

    public Term value() {
        return value;
    }

    public Disequality forbidden() {
        return new Disequality(variable, value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Binding)) return false;
        Binding b = (Binding) o;
        return variable.equals(b.variable) && value.equals(b.value);
    }

    @Override
    public int hashCode() {
        return 31 * variable.hashCode() + value.hashCode();
    }

    @Override
    public String toString() {
        return variable + " = " + value;
    }
}
