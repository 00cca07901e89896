package net.littleredcomputer.prover;

import net.littleredcomputer.prover.logic.Formula;
import net.littleredcomputer.prover.logic.Term;

/** A formula that must hold in all (necessity) or some (possibility) worlds an agent considers possible. */
final class Modality {
    private final Term agent;
    private final Formula formula;

    Modality(Term agent, Formula formula) {
        this.agent = agent;
        this.formula = formula;
    }

    Term agent() {
        return agent;
    }

    Formula formula() {
        return formula;
    }

    @Override
    public String toString() {
        return agent + ": " + formula;
    }
}
