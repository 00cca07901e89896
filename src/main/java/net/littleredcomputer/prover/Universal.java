package net.littleredcomputer.prover;

import com.google.common.collect.ImmutableList;
import net.littleredcomputer.prover.logic.Formula;
import net.littleredcomputer.prover.logic.Variable;

/**
 * A universally quantified formula that has been instantiated on a branch: the variable
 * peeled off the quantifier, the remaining body, and every variable it has been instantiated
 * with so far, newest first.
 */
final class Universal {
    private final Variable variable;
    private final Formula body;
    private final ImmutableList<Variable> instances;

    Universal(Variable variable, Formula body) {
        this(variable, body, ImmutableList.of());
    }

    private Universal(Variable variable, Formula body, ImmutableList<Variable> instances) {
        this.variable = variable;
        this.body = body;
        this.instances = instances;
    }

    Variable variable() {
        return variable;
    }

    Formula body() {
        return body;
    }

    ImmutableList<Variable> instances() {
        return instances;
    }

    Universal withInstance(Variable v) {
        return new Universal(variable, body, ImmutableList.<Variable>builder().add(v).addAll(instances).build());
    }

    /** @return true if the newest instance variable has been bound, so another copy may help */
    boolean isUsedUp(Trail trail) {
        return !instances.isEmpty() && !(trail.walk(instances.get(0)) instanceof Variable);
    }

    @Override
    public String toString() {
        return "all([" + variable + "], " + body + ") " + instances;
    }
}
