package net.littleredcomputer.prover;

import net.littleredcomputer.prover.logic.Formula;

/**
 * Thrown when an existential quantifier appears in positive scope (including a negated
 * universal). Such formulas must be rewritten by the caller, for example into a finite
 * disjunction over the known individuals.
 */
public class UnsupportedQuantifierException extends IllegalArgumentException {
    private final Formula formula;

    public UnsupportedQuantifierException(Formula formula) {
        super("existential quantification in positive scope is not supported: " + formula);
        this.formula = formula;
    }

    public Formula formula() {
        return formula;
    }
}
