package dumb.cogproof.syntax;

import dumb.cogproof.Span;
import dumb.cogproof.ValidationException;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

import static java.util.Objects.requireNonNull;

/** Reads KIF-style s-expressions with {@code ;} line comments, {@code ?var} variables and string literals. */
public class SExprReader {
    private static final int CONTEXT_BUFFER_SIZE = 50;
    private final String text;
    private final StringBuilder contextBuffer = new StringBuilder(CONTEXT_BUFFER_SIZE);
    private int charPos = 0;
    private int line = 1;
    private int col = 1;

    private SExprReader(String text) {
        this.text = text;
    }

    public static List<SExpr> read(String text) throws ValidationException {
        var reader = new SExprReader(text);
        var exprs = new ArrayList<SExpr>();
        reader.skipWhitespaceAndComments();
        while (reader.peek() != -1) {
            exprs.add(reader.parseExpr());
            reader.skipWhitespaceAndComments();
        }
        return exprs;
    }

    public static SExpr readOne(String text) throws ValidationException {
        var exprs = read(text);
        if (exprs.size() != 1)
            throw new ValidationException("expected exactly one expression but found " + exprs.size(), Span.at(text, 0, text.length()), "");
        return exprs.get(0);
    }

    private int peek() {
        return charPos < text.length() ? text.charAt(charPos) : -1;
    }

    private int consumeChar() {
        var c = peek();
        if (c != -1) {
            charPos++;
            if (contextBuffer.length() >= CONTEXT_BUFFER_SIZE) contextBuffer.deleteCharAt(0);
            contextBuffer.append((char) c);
            if (c == '\n') {
                line++;
                col = 1;
            } else {
                col++;
            }
        }
        return c;
    }

    private void consumeChar(char expected) throws ValidationException {
        var actual = consumeChar();
        if (actual != expected)
            throw createParseException("Expected '" + expected + "'", actual == -1 ? "EOF" : "'" + (char) actual + "'");
    }

    private void skipWhitespaceAndComments() {
        while (true) {
            var c = peek();
            if (c == -1) return;
            if (Character.isWhitespace(c)) {
                consumeChar();
            } else if (c == ';') {
                while (peek() != '\n' && peek() != -1) consumeChar();
            } else {
                return;
            }
        }
    }

    private SExpr parseExpr() throws ValidationException {
        skipWhitespaceAndComments();
        var c = peek();
        if (c == -1) throw createParseException("Unexpected EOF while parsing expression");
        return switch (c) {
            case '(' -> parseList();
            case ')' -> throw createParseException("Unexpected ')'");
            case '"' -> parseStringAtom();
            case '?' -> parseVariable();
            default -> parseSymbolAtom();
        };
    }

    private SExpr.Lst parseList() throws ValidationException {
        var start = charPos;
        consumeChar('(');
        var items = new ArrayList<SExpr>();
        skipWhitespaceAndComments();
        while (peek() != ')') {
            if (peek() == -1) throw createParseException("Unexpected EOF inside list");
            items.add(parseExpr());
            skipWhitespaceAndComments();
        }
        consumeChar(')');
        return new SExpr.Lst(items, Span.at(text, start, charPos));
    }

    private SExpr.Str parseStringAtom() throws ValidationException {
        var start = charPos;
        consumeChar('"');
        var sb = new StringBuilder();
        while (peek() != '"') {
            if (peek() == -1) throw createParseException("Unexpected EOF inside string literal");
            if (peek() == '\\') {
                consumeChar('\\');
                var escaped = consumeChar();
                switch (escaped) {
                    case '"' -> sb.append('"');
                    case '\\' -> sb.append('\\');
                    case 'n' -> sb.append('\n');
                    case 't' -> sb.append('\t');
                    default -> throw createParseException("Invalid escape sequence '\\" + (char) escaped + "'");
                }
            } else {
                sb.append((char) consumeChar());
            }
        }
        consumeChar('"');
        return new SExpr.Str(sb.toString(), Span.at(text, start, charPos));
    }

    private SExpr.VarRef parseVariable() throws ValidationException {
        var start = charPos;
        consumeChar('?');
        var c = peek();
        if (c == -1 || !Character.isLetterOrDigit(c) && c != '_')
            throw createParseException("Variable name must start with '?' followed by letter, digit or '_'");
        var sb = new StringBuilder();
        while (peek() != -1 && symbolChar(peek())) sb.append((char) consumeChar());
        return new SExpr.VarRef(sb.toString(), Span.at(text, start, charPos));
    }

    private SExpr.Sym parseSymbolAtom() throws ValidationException {
        var start = charPos;
        var sb = new StringBuilder();
        while (peek() != -1 && symbolChar(peek())) sb.append((char) consumeChar());
        if (sb.length() == 0) throw createParseException("Unexpected character '" + (char) peek() + "'");
        return new SExpr.Sym(sb.toString(), Span.at(text, start, charPos));
    }

    private static boolean symbolChar(int c) {
        return !Character.isWhitespace(c) && c != '(' && c != ')' && c != '"' && c != ';';
    }

    private ValidationException createParseException(String message) {
        return createParseException(message, null);
    }

    private ValidationException createParseException(String message, @Nullable String foundToken) {
        var foundInfo = foundToken != null ? " found " + foundToken : "";
        return new ValidationException(message + foundInfo, new Span(charPos, charPos, line, col), contextBuffer.toString());
    }

    public sealed interface SExpr permits SExpr.Sym, SExpr.Str, SExpr.VarRef, SExpr.Lst {
        Span span();

        record Sym(String name, Span span) implements SExpr {
            public Sym {
                requireNonNull(name);
            }
        }

        record Str(String value, Span span) implements SExpr {
        }

        record VarRef(String name, Span span) implements SExpr {
        }

        record Lst(List<SExpr> items, Span span) implements SExpr {
            public Lst {
                items = List.copyOf(items);
            }

            @Nullable
            public String head() {
                return !items.isEmpty() && items.get(0) instanceof Sym s ? s.name() : null;
            }

            public int size() {
                return items.size();
            }

            public SExpr get(int i) {
                return items.get(i);
            }
        }
    }
}
