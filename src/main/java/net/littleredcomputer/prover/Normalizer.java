package net.littleredcomputer.prover;

import net.littleredcomputer.prover.logic.Binary;
import net.littleredcomputer.prover.logic.Formula;
import net.littleredcomputer.prover.logic.Not;
import net.littleredcomputer.prover.logic.Quantified;

import java.util.Optional;

import static net.littleredcomputer.prover.logic.Formula.and;
import static net.littleredcomputer.prover.logic.Formula.not;
import static net.littleredcomputer.prover.logic.Formula.or;

/**
 * Rewrites formulas toward the primitive connectives the expander handles directly:
 * conjunction, disjunction, universal quantification, knowledge, and literals.
 */
public final class Normalizer {
    private Normalizer() {}

    /**
     * Apply one rewrite step at the top of the formula.
     *
     * @return the rewritten formula, or empty if f is already primitive at the top
     * @throws UnsupportedQuantifierException if f is an existential, or a negated universal
     */
    public static Optional<Formula> rewrite(Formula f) {
        switch (f.connective()) {
            case IMPLIES: {
                Binary b = (Binary) f;
                return Optional.of(or(not(b.left()), b.right()));
            }
            case IFF: {
                Binary b = (Binary) f;
                return Optional.of(or(and(b.left(), b.right()), and(not(b.left()), not(b.right()))));
            }
            case EXISTS:
                throw new UnsupportedQuantifierException(f);
            case NOT:
                return rewriteNegation(f, ((Not) f).operand());
            default:
                return Optional.empty();
        }
    }

    private static Optional<Formula> rewriteNegation(Formula f, Formula operand) {
        switch (operand.connective()) {
            case NOT:
                return Optional.of(((Not) operand).operand());
            case AND: {
                Binary b = (Binary) operand;
                return Optional.of(or(not(b.left()), not(b.right())));
            }
            case OR: {
                Binary b = (Binary) operand;
                return Optional.of(and(not(b.left()), not(b.right())));
            }
            case IMPLIES: {
                Binary b = (Binary) operand;
                return Optional.of(and(b.left(), not(b.right())));
            }
            case IFF: {
                Binary b = (Binary) operand;
                return Optional.of(and(or(not(b.left()), not(b.right())), or(b.left(), b.right())));
            }
            case EXISTS: {
                Quantified q = (Quantified) operand;
                return Optional.of(Formula.all(q.variables(), not(q.body())));
            }
            case FORALL:
                throw new UnsupportedQuantifierException(f);
            default:
                return Optional.empty();
        }
    }
}
