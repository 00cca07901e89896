package net.littleredcomputer.prover.logic;

import com.google.common.collect.ImmutableList;

import java.io.BufferedReader;
import java.io.Reader;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads formulas written in the syntax printed by {@link Formula#toString()}:
 *
 * <pre>
 *   true  false  p  p(a, f(X))  A = B  ~F  F &amp; G  F | G  F =&gt; G  F &lt;=&gt; G
 *   all([X, Y], F)  ext([X], F)  knows(agent, F)
 * </pre>
 *
 * Names beginning with an upper-case letter or underscore are variables; each distinct
 * name denotes one variable throughout the formula being parsed. From loosest to tightest
 * the binary operators are {@code <=>}, {@code =>}, {@code |}, {@code &}; all of them
 * associate to the right.
 */
public class FormulaParser {
    private static final Pattern tokenRe = Pattern.compile("\\s*(<=>|=>|[=~&|(),\\[\\]]|[A-Za-z0-9_]+)");
    private static final Pattern blankRe = Pattern.compile("\\s*");
    private final String text;
    private final List<String> tokens = new ArrayList<>();
    private final Map<String, Variable> variables = new HashMap<>();
    private int pos = 0;

    private FormulaParser(String text) {
        this.text = text;
        Matcher m = tokenRe.matcher(text);
        int at = 0;
        while (at < text.length()) {
            m.region(at, text.length());
            if (!m.lookingAt()) {
                if (blankRe.matcher(text.substring(at)).matches()) break;
                throw new IllegalArgumentException("unexpected character at offset " + at + " in: " + text);
            }
            tokens.add(m.group(1));
            at = m.end();
        }
    }

    public static Formula parse(String text) {
        FormulaParser p = new FormulaParser(text);
        if (p.tokens.isEmpty()) throw new IllegalArgumentException("empty formula");
        Formula f = p.formula();
        if (p.pos != p.tokens.size()) p.fail("trailing input");
        return f;
    }

    /**
     * Reads one formula per line. Blank lines and lines beginning with {@code %} are skipped.
     * Variables are scoped to the line on which they appear.
     */
    public static ImmutableList<Formula> parseAll(Reader r) {
        ImmutableList.Builder<Formula> b = ImmutableList.builder();
        new BufferedReader(r).lines()
                .map(String::trim)
                .filter(s -> !s.isEmpty() && !s.startsWith("%"))
                .forEach(line -> b.add(parse(line)));
        return b.build();
    }

    public static ImmutableList<Formula> parseAll(String text) {
        return parseAll(new StringReader(text));
    }

    private Formula formula() {
        Formula left = implication();
        if (accept("<=>")) return Formula.iff(left, formula());
        return left;
    }

    private Formula implication() {
        Formula left = disjunction();
        if (accept("=>")) return Formula.implies(left, implication());
        return left;
    }

    private Formula disjunction() {
        Formula left = conjunction();
        if (accept("|")) return Formula.or(left, disjunction());
        return left;
    }

    private Formula conjunction() {
        Formula left = unary();
        if (accept("&")) return Formula.and(left, conjunction());
        return left;
    }

    private Formula unary() {
        if (accept("~")) return Formula.not(unary());
        return primary();
    }

    private Formula primary() {
        if (accept("(")) {
            Formula f = formula();
            expect(")");
            return f;
        }
        String word = peek();
        boolean call = "(".equals(peek(1));
        if (!call && word.equals("true")) {
            ++pos;
            return Formula.TRUE;
        }
        if (!call && word.equals("false")) {
            ++pos;
            return Formula.FALSE;
        }
        if (call && (word.equals("all") || word.equals("ext"))) {
            pos += 2;
            expect("[");
            ImmutableList.Builder<Variable> vs = ImmutableList.builder();
            if (!accept("]")) {
                do {
                    Term t = term();
                    if (!(t instanceof Variable)) fail("quantifier must bind variables, not " + t);
                    vs.add((Variable) t);
                } while (accept(","));
                expect("]");
            }
            expect(",");
            Formula body = formula();
            expect(")");
            return word.equals("all") ? Formula.all(vs.build(), body) : Formula.exists(vs.build(), body);
        }
        if (call && word.equals("knows")) {
            pos += 2;
            Term agent = term();
            expect(",");
            Formula body = formula();
            expect(")");
            return Formula.knows(agent, body);
        }
        Term t = term();
        if (accept("=")) return Formula.equal(t, term());
        if (t instanceof Variable) fail("a variable cannot stand for a formula: " + t);
        Compound c = (Compound) t;
        return new Atom(c.functor(), c.args());
    }

    private Term term() {
        String name = peek();
        if (!Character.isLetterOrDigit(name.charAt(0)) && name.charAt(0) != '_') fail("expected a term");
        ++pos;
        if (Character.isUpperCase(name.charAt(0)) || name.charAt(0) == '_') {
            return variables.computeIfAbsent(name, Variable::new);
        }
        if (!accept("(")) return Compound.constant(name);
        List<Term> args = new ArrayList<>();
        do {
            args.add(term());
        } while (accept(","));
        expect(")");
        return Compound.of(name, args);
    }

    private String peek() {
        return peek(0);
    }

    private String peek(int ahead) {
        if (pos + ahead >= tokens.size()) {
            if (ahead == 0) fail("unexpected end of input");
            return null;
        }
        return tokens.get(pos + ahead);
    }

    private boolean accept(String token) {
        if (pos < tokens.size() && tokens.get(pos).equals(token)) {
            ++pos;
            return true;
        }
        return false;
    }

    private void expect(String token) {
        if (!accept(token)) fail("expected '" + token + "'");
    }

    private void fail(String message) {
        String where = pos < tokens.size() ? "at '" + tokens.get(pos) + "'" : "at end";
        throw new IllegalArgumentException(message + " " + where + " in: " + text);
    }
}
