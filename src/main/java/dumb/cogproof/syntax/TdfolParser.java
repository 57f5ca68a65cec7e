package dumb.cogproof.syntax;

import dumb.cogproof.Formula;
import dumb.cogproof.Signature;
import dumb.cogproof.Span;
import dumb.cogproof.Term;
import dumb.cogproof.ValidationException;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static dumb.cogproof.syntax.TdfolParser.Tok.*;

/**
 * Recursive-descent parser for the native infix syntax.
 * <p>
 * Precedence from loosest: {@code <->}, {@code ->} (right associative), {@code |}, {@code &}, unary.
 * Quantifier bodies extend as far right as possible. An identifier bound by an enclosing quantifier
 * is a variable, {@code ?x} is a free variable, and any other identifier in term position is a constant.
 */
public class TdfolParser {

    private static final Map<String, Formula.TemporalOp> TEMPORAL = new HashMap<>();
    private static final Map<String, Formula.ModalOp> MODAL = new HashMap<>();
    private static final Map<String, Formula.DeonticOp> DEONTIC = new HashMap<>();
    private static final Map<String, Formula.CognitiveOp> COGNITIVE = new HashMap<>();
    private static final Set<Tok> RELOPS = Set.of(EQ, NEQ, LT, GT, LE, GE);
    private static final Set<Tok> TERM_OPS = Set.of(PLUS, MINUS, STAR, SLASH, EQ, NEQ, LT, GT, LE, GE);

    static {
        Arrays.stream(Formula.TemporalOp.values()).forEach(o -> TEMPORAL.put(o.keyword, o));
        Arrays.stream(Formula.ModalOp.values()).forEach(o -> MODAL.put(o.keyword, o));
        Arrays.stream(Formula.DeonticOp.values()).forEach(o -> DEONTIC.put(o.keyword, o));
        Arrays.stream(Formula.CognitiveOp.values()).forEach(o -> COGNITIVE.put(o.keyword, o));
    }

    private final String src;
    private final List<Token> toks;
    private final Signature signature;
    private final boolean patterns;
    private final Limits limits;
    private final List<String> scope = new ArrayList<>();
    private final Set<String> boundNames = new HashSet<>();
    private final List<Token> constUses = new ArrayList<>();
    private final List<Symbol> symbols = new ArrayList<>();
    private int pos;
    private int depth;

    private TdfolParser(String src, Signature signature, boolean patterns, Limits limits) throws ValidationException {
        if (src.length() > limits.maxLength)
            throw new ValidationException("input of " + src.length() + " characters exceeds the limit of " + limits.maxLength);
        this.src = src;
        this.signature = signature;
        this.patterns = patterns;
        this.limits = limits;
        this.toks = lex(src);
    }

    public static Formula parse(String text) throws ValidationException {
        return parse(text, new Signature(), Limits.DEFAULT);
    }

    public static Formula parse(String text, Signature signature) throws ValidationException {
        return parse(text, signature, Limits.DEFAULT);
    }

    public static Formula parse(String text, Signature signature, Limits limits) throws ValidationException {
        return new TdfolParser(text, signature, false, limits).parseAll();
    }

    /** Parses a rule pattern: single Greek letters denote formula metavariables. */
    public static Formula parsePattern(String text) throws ValidationException {
        return new TdfolParser(text, new Signature(), true, Limits.DEFAULT).parseAll();
    }

    public static Term parseTerm(String text) throws ValidationException {
        var p = new TdfolParser(text, new Signature(), false, Limits.DEFAULT);
        var t = p.arith();
        p.expect(EOF, "end of input");
        p.checkSymbols();
        return t;
    }

    static boolean metaName(String name) {
        return name.length() == 1 && Character.UnicodeScript.of(name.charAt(0)) == Character.UnicodeScript.GREEK
                && Character.isLowerCase(name.charAt(0));
    }

    private Formula parseAll() throws ValidationException {
        var f = formula();
        expect(EOF, "end of input");
        for (var use : constUses) {
            if (boundNames.contains(use.text))
                throw error("variable '" + use.text + "' is used outside the scope of the quantifier that binds it", use);
        }
        checkSymbols();
        return f;
    }

    private void checkSymbols() throws ValidationException {
        for (var s : symbols) {
            if (s.predicate) signature.predicate(s.name, s.arity, span(s.token));
            else signature.function(s.name, s.arity, span(s.token));
        }
    }

    private Formula formula() throws ValidationException {
        var l = implication();
        while (at(IFF) || at(XOR)) {
            var xor = next().type == XOR;
            var r = implication();
            l = xor ? Formula.not(Formula.iff(l, r)) : Formula.iff(l, r);
        }
        return l;
    }

    private Formula implication() throws ValidationException {
        var l = disjunction();
        if (accept(IMPLIES)) return Formula.implies(l, implication());
        return l;
    }

    private Formula disjunction() throws ValidationException {
        var l = conjunction();
        while (accept(OR)) l = Formula.or(l, conjunction());
        return l;
    }

    private Formula conjunction() throws ValidationException {
        var l = unary();
        while (accept(AND)) l = Formula.and(l, unary());
        return l;
    }

    private Formula unary() throws ValidationException {
        enter();
        try {
            if (accept(NOT)) return Formula.not(unary());
            if (accept(BOX)) return Formula.necessary(unary());
            if (accept(DIAMOND)) return Formula.possible(unary());
            if (at(FORALL) || at(EXISTS) || atKeyword("forall") || atKeyword("exists")) return quantifier();
            return primary();
        } finally {
            depth--;
        }
    }

    private boolean atKeyword(String k) {
        return at(IDENT) && peek().text.equals(k) && peek(1).type == IDENT;
    }

    private Formula quantifier() throws ValidationException {
        var t = next();
        var kind = t.type == FORALL || t.text.equals("forall") ? Formula.Quantifier.FORALL : Formula.Quantifier.EXISTS;
        var names = new ArrayList<String>();
        do {
            var v = expect(IDENT, "quantified variable");
            if (isKeyword(v.text))
                throw error("reserved word '" + v.text + "' cannot name a variable", v);
            names.add(v.text);
            accept(COMMA);
        } while (at(IDENT));
        expect(DOT, "'.' after quantified variables");
        names.forEach(n -> {
            scope.add(n);
            boundNames.add(n);
        });
        var body = formula();
        for (var i = names.size() - 1; i >= 0; i--) {
            scope.remove(scope.size() - 1);
            body = new Formula.Quant(kind, names.get(i), body);
        }
        return body;
    }

    private static boolean isKeyword(String s) {
        return s.equals("forall") || s.equals("exists") || TEMPORAL.containsKey(s) || MODAL.containsKey(s)
                || DEONTIC.containsKey(s) || COGNITIVE.containsKey(s);
    }

    private Formula primary() throws ValidationException {
        var t = peek();
        if (t.type == LPAREN) return parenthesized();
        if (t.type == IDENT && (peek(1).type == LPAREN || peek(1).type == LBRACK) && isKeyword(t.text)) return operator();
        if (t.type == IDENT && patterns && metaName(t.text) && peek(1).type != LPAREN) {
            next();
            return Formula.meta(t.text);
        }
        if (t.type == EOF) throw error("expected a formula but reached end of input", t);
        return comparisonOrAtom();
    }

    private Formula parenthesized() throws ValidationException {
        var mark = mark();
        ValidationException formulaError;
        try {
            next();
            var f = formula();
            expect(RPAREN, "')'");
            if (!TERM_OPS.contains(peek().type)) return f;
            formulaError = null;
        } catch (ValidationException e) {
            formulaError = e;
        }
        reset(mark);
        try {
            return comparisonOrAtom();
        } catch (ValidationException e) {
            if (formulaError == null) throw e;
            throw formulaError.span().start() >= e.span().start() ? formulaError : e;
        }
    }

    private Formula operator() throws ValidationException {
        var t = next();
        var k = t.text;
        if (TEMPORAL.containsKey(k)) {
            var op = TEMPORAL.get(k);
            expect(LPAREN, "'(' after " + k);
            var a = formula();
            Formula b = null;
            if (op.arity == 2) {
                expect(COMMA, "',' between the operands of " + k);
                b = formula();
            }
            expect(RPAREN, "')'");
            return new Formula.Temporal(op, a, b);
        }
        if (MODAL.containsKey(k)) {
            expect(LPAREN, "'(' after " + k);
            var a = formula();
            expect(RPAREN, "')'");
            return new Formula.Modal(MODAL.get(k), a);
        }
        var agent = accept(LBRACK) ? agent() : null;
        expect(LPAREN, "'(' after " + k);
        var body = formula();
        expect(RPAREN, "')'");
        if (DEONTIC.containsKey(k)) {
            var op = DEONTIC.get(k);
            return new Formula.Deontic(op, agent != null ? agent : Formula.defaultAgent(body), body);
        }
        var op = COGNITIVE.get(k);
        if (op != Formula.CognitiveOp.COMMON_KNOWLEDGE && agent == null)
            throw error(k + " requires an agent, as in " + k + "[agent](...)", t);
        return Formula.cognitive(op, agent != null ? agent : Formula.EVERYONE, body);
    }

    private Term agent() throws ValidationException {
        var a = arith();
        expect(RBRACK, "']' after agent");
        return a;
    }

    private Formula comparisonOrAtom() throws ValidationException {
        var start = peek();
        var uses = constUses.size();
        var syms = symbols.size();
        var l = arith();
        if (RELOPS.contains(peek().type)) {
            var op = next();
            var r = arith();
            var symbol = op.type == NEQ ? "=" : op.text;
            var p = Formula.pred(symbol, l, r);
            return op.type == NEQ ? Formula.not(p) : p;
        }
        if (l instanceof Term.Fn fn && !fn.arithmetic() && symbols.size() > syms) {
            symbols.remove(symbols.size() - 1);
            symbols.add(new Symbol(fn.symbol(), fn.args().size(), true, start));
            return new Formula.Pred(fn.symbol(), fn.args());
        }
        if (l instanceof Term.Const c && !c.numeric() && constUses.size() > uses) {
            constUses.remove(constUses.size() - 1);
            symbols.add(new Symbol(c.name(), 0, true, start));
            return new Formula.Pred(c.name(), List.of());
        }
        if (l instanceof Term.Var v)
            throw error("variable '" + (v.isFree() ? "?" : "") + v.name() + "' cannot stand for a formula", start);
        throw error("expected a comparison operator after the term", peek());
    }

    private Term arith() throws ValidationException {
        var l = product();
        while (at(PLUS) || at(MINUS)) {
            var op = next();
            var r = product();
            l = Term.Fn.of(op.text, l, r);
        }
        return l;
    }

    private Term product() throws ValidationException {
        var l = termAtom();
        while (at(STAR) || at(SLASH)) {
            var op = next();
            var r = termAtom();
            l = Term.Fn.of(op.text, l, r);
        }
        return l;
    }

    private Term termAtom() throws ValidationException {
        enter();
        try {
            var t = next();
            switch (t.type) {
                case NUMBER:
                    return Term.Const.of(t.text);
                case MINUS:
                    if (at(NUMBER)) return Term.Const.of("-" + next().text);
                    throw error("expected a number after '-'", peek());
                case VAR:
                    return Term.Var.free(t.text);
                case STRING:
                case IDENT: {
                    if (at(LPAREN)) {
                        next();
                        var args = new ArrayList<Term>();
                        do {
                            args.add(arith());
                        } while (accept(COMMA));
                        expect(RPAREN, "')' to close the arguments of " + t.text);
                        symbols.add(new Symbol(t.text, args.size(), false, t));
                        return new Term.Fn(t.text, args);
                    }
                    if (t.type == IDENT) {
                        var i = scope.lastIndexOf(t.text);
                        if (i >= 0) return Term.Var.bound(t.text, scope.size() - 1 - i);
                        constUses.add(t);
                    }
                    return Term.Const.of(t.text);
                }
                case LPAREN: {
                    var inner = arith();
                    expect(RPAREN, "')'");
                    return inner;
                }
                case EOF:
                    throw error("expected a term but reached end of input", t);
                default:
                    throw error("expected a term but found '" + t.text + "'", t);
            }
        } finally {
            depth--;
        }
    }

    private void enter() throws ValidationException {
        if (++depth > limits.maxDepth) {
            depth--;
            throw error("formula nesting exceeds the limit of " + limits.maxDepth, peek());
        }
    }

    private Mark mark() {
        return new Mark(pos, scope.size(), constUses.size(), symbols.size(), Set.copyOf(boundNames));
    }

    private void reset(Mark m) {
        pos = m.pos;
        while (scope.size() > m.scope) scope.remove(scope.size() - 1);
        while (constUses.size() > m.uses) constUses.remove(constUses.size() - 1);
        while (symbols.size() > m.symbols) symbols.remove(symbols.size() - 1);
        boundNames.retainAll(m.bound);
    }

    private Token peek() {
        return toks.get(pos);
    }

    private Token peek(int ahead) {
        return toks.get(Math.min(pos + ahead, toks.size() - 1));
    }

    private Token next() {
        var t = toks.get(pos);
        if (t.type != EOF) pos++;
        return t;
    }

    private boolean at(Tok type) {
        return peek().type == type;
    }

    private boolean accept(Tok type) {
        if (!at(type)) return false;
        next();
        return true;
    }

    private Token expect(Tok type, String what) throws ValidationException {
        var t = peek();
        if (t.type != type)
            throw error("expected " + what + " but found " + (t.type == EOF ? "end of input" : "'" + t.text + "'"), t);
        return next();
    }

    private Span span(Token t) {
        return Span.at(src, t.start, t.end);
    }

    private ValidationException error(String message, Token t) {
        var from = Math.max(0, t.start - 20);
        var to = Math.min(src.length(), t.end + 20);
        return new ValidationException(message, span(t), src.substring(from, to).strip());
    }

    static List<Token> lex(String s) throws ValidationException {
        var out = new ArrayList<Token>();
        var i = 0;
        var n = s.length();
        while (i < n) {
            var c = s.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
                continue;
            }
            var start = i;
            if (Character.isLetter(c) || c == '_') {
                while (i < n && (Character.isLetterOrDigit(s.charAt(i)) || s.charAt(i) == '_')) i++;
                out.add(new Token(IDENT, s.substring(start, i), start, i));
            } else if (Character.isDigit(c)) {
                while (i < n && Character.isDigit(s.charAt(i))) i++;
                if (i + 1 < n && s.charAt(i) == '.' && Character.isDigit(s.charAt(i + 1))) {
                    i++;
                    while (i < n && Character.isDigit(s.charAt(i))) i++;
                }
                out.add(new Token(NUMBER, s.substring(start, i), start, i));
            } else if (c == '?') {
                i++;
                while (i < n && (Character.isLetterOrDigit(s.charAt(i)) || s.charAt(i) == '_')) i++;
                if (i == start + 1)
                    throw new ValidationException("'?' must be followed by a variable name", Span.at(s, start, i), "?");
                out.add(new Token(VAR, s.substring(start + 1, i), start, i));
            } else if (c == '"') {
                var sb = new StringBuilder();
                i++;
                while (true) {
                    if (i >= n) throw new ValidationException("unterminated string literal", Span.at(s, start, n), s.substring(start));
                    var d = s.charAt(i++);
                    if (d == '"') break;
                    if (d == '\\' && i < n) d = s.charAt(i++);
                    sb.append(d);
                }
                out.add(new Token(STRING, sb.toString(), start, i));
            } else {
                var op = operator(s, i);
                if (op == null)
                    throw new ValidationException("unexpected character '" + c + "'", Span.at(s, i, i + 1), String.valueOf(c));
                i += op.length();
                out.add(new Token(op.type, s.substring(start, i), start, i));
            }
        }
        out.add(new Token(EOF, "", n, n));
        return out;
    }

    private static final List<Op> OPERATORS = List.of(
            new Op("<->", IFF), new Op("<=>", IFF), new Op("->", IMPLIES), new Op("=>", IMPLIES),
            new Op("<=", LE), new Op(">=", GE), new Op("!=", NEQ),
            new Op("(", LPAREN), new Op(")", RPAREN), new Op("[", LBRACK), new Op("]", RBRACK),
            new Op(",", COMMA), new Op(".", DOT), new Op("~", NOT), new Op("!", NOT), new Op("¬", NOT),
            new Op("&", AND), new Op("^", AND), new Op("∧", AND), new Op("|", OR), new Op("∨", OR),
            new Op("→", IMPLIES), new Op("↔", IFF), new Op("⊕", XOR), new Op("∀", FORALL), new Op("∃", EXISTS),
            new Op("□", BOX), new Op("◇", DIAMOND), new Op("◊", DIAMOND),
            new Op("+", PLUS), new Op("-", MINUS), new Op("*", STAR), new Op("/", SLASH),
            new Op("=", EQ), new Op("<", LT), new Op(">", GT));

    @Nullable
    private static Op operator(String s, int i) {
        for (var op : OPERATORS) if (s.startsWith(op.text, i)) return op;
        return null;
    }

    enum Tok {
        IDENT, NUMBER, STRING, VAR, LPAREN, RPAREN, LBRACK, RBRACK, COMMA, DOT, NOT, AND, OR, IMPLIES, IFF, XOR,
        FORALL, EXISTS, BOX, DIAMOND, PLUS, MINUS, STAR, SLASH, EQ, NEQ, LT, GT, LE, GE, EOF
    }

    record Token(Tok type, String text, int start, int end) {
    }

    private record Op(String text, Tok type) {
        int length() {
            return text.length();
        }
    }

    private record Symbol(String name, int arity, boolean predicate, Token token) {
    }

    private record Mark(int pos, int scope, int uses, int symbols, Set<String> bound) {
    }

    /** Bounds on accepted input. */
    public record Limits(int maxLength, int maxDepth) {
        public static final Limits DEFAULT = new Limits(100_000, 256);
    }
}
