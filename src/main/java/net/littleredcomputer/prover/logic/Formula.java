package net.littleredcomputer.prover.logic;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * A formula of multi-agent epistemic first-order logic. Formulas are immutable trees tagged
 * by their {@link Connective}; the static factories below are the usual way to build them,
 * and {@link FormulaParser} reads the same syntax that {@link #toString()} prints.
 */
public abstract class Formula {
    public enum Connective {
        TRUE,
        FALSE,
        ATOM,
        EQUALS,
        NOT,
        AND,
        OR,
        IMPLIES,
        IFF,
        FORALL,
        EXISTS,
        KNOWS,
    }

    public static final Formula TRUE = new Truth(true);
    public static final Formula FALSE = new Truth(false);

    Formula() {}

    public abstract Connective connective();

    /**
     * Apply f to every term in the formula, including agent terms and the variables bound
     * by quantifiers. When f is applied to a bound variable it must return a variable.
     */
    public abstract Formula mapTerms(UnaryOperator<Term> f);

    abstract int precedence();

    /** @return true if this formula is a literal atom rather than a compound expression */
    public boolean isAtom() {
        switch (connective()) {
            case TRUE:
            case FALSE:
            case ATOM:
            case EQUALS:
                return true;
            default:
                return false;
        }
    }

    public boolean isLiteral() {
        return isAtom() || connective() == Connective.NOT && ((Not) this).operand().isAtom();
    }

    String parenthesize(Formula f, int minimum) {
        return f.precedence() < minimum ? "(" + f + ")" : f.toString();
    }

    public static Formula atom(String predicate, Term... args) {
        return new Atom(predicate, ImmutableList.copyOf(args));
    }

    public static Formula equal(Term left, Term right) {
        return new Equality(left, right);
    }

    public static Formula not(Formula f) {
        return new Not(f);
    }

    public static Formula and(Formula left, Formula right) {
        return new Binary(Connective.AND, left, right);
    }

    public static Formula or(Formula left, Formula right) {
        return new Binary(Connective.OR, left, right);
    }

    public static Formula implies(Formula left, Formula right) {
        return new Binary(Connective.IMPLIES, left, right);
    }

    public static Formula iff(Formula left, Formula right) {
        return new Binary(Connective.IFF, left, right);
    }

    public static Formula all(List<Variable> variables, Formula body) {
        return new Quantified(Connective.FORALL, ImmutableList.copyOf(variables), body);
    }

    public static Formula all(Variable v, Formula body) {
        return all(ImmutableList.of(v), body);
    }

    public static Formula exists(List<Variable> variables, Formula body) {
        return new Quantified(Connective.EXISTS, ImmutableList.copyOf(variables), body);
    }

    public static Formula exists(Variable v, Formula body) {
        return exists(ImmutableList.of(v), body);
    }

    public static Formula knows(Term agent, Formula body) {
        return new Knows(agent, body);
    }

    public static Formula knows(String agent, Formula body) {
        return new Knows(Compound.constant(agent), body);
    }

    public static Formula parse(String text) {
        return FormulaParser.parse(text);
    }
}
