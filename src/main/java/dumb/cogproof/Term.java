package dumb.cogproof;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static java.util.Objects.requireNonNull;

/**
 * First-order terms. Bound variables carry their de Bruijn index and compare by index only;
 * free variables carry index -1 and compare by name.
 */
sealed public interface Term permits Term.Var, Term.Const, Term.Fn {

    Set<String> ARITHMETIC = Set.of("+", "-", "*", "/");

    Pattern IDENTIFIER = Pattern.compile("[\\p{L}_][\\p{L}\\p{N}_]*");
    Pattern NUMBER = Pattern.compile("-?\\d+(\\.\\d+)?");

    static Term replaceVars(Term t, Function<Var, Term> f) {
        if (t instanceof Var v) return f.apply(v);
        if (t instanceof Fn fn) {
            var changed = false;
            var args = new ArrayList<Term>(fn.args().size());
            for (var a : fn.args()) {
                var b = replaceVars(a, f);
                changed |= b != a;
                args.add(b);
            }
            return changed ? new Fn(fn.symbol(), args) : fn;
        }
        return t;
    }

    /** Raises every bound index by {@code by}, for moving a term under additional binders. */
    static Term shift(Term t, int by) {
        return by == 0 ? t : replaceVars(t, v -> v.isFree() ? v : Var.bound(v.name(), v.index() + by));
    }

    /** Native TDFOL rendering. */
    default String text() {
        return Formula.Printer.print(this);
    }

    int weight();

    /** True when the term contains no variables at all. */
    boolean ground();

    /** True when the term refers to a binder at or above the given depth, i.e. would escape it. */
    boolean loose(int depth);

    default Stream<Term> subterms() {
        return Stream.of(this);
    }

    default Set<Var> freeVars() {
        return subterms().filter(t -> t instanceof Var v && v.isFree()).map(Var.class::cast).collect(Collectors.toUnmodifiableSet());
    }

    record Var(String name, int index) implements Term {

        public Var {
            requireNonNull(name);
            if (name.isEmpty()) throw new IllegalArgumentException("Variable name must not be empty");
            if (index < -1) throw new IllegalArgumentException("Invalid de Bruijn index: " + index);
        }

        public static Var free(String name) {
            return new Var(name, -1);
        }

        public static Var bound(String name, int index) {
            return new Var(name, index);
        }

        public boolean isFree() {
            return index < 0;
        }

        @Override
        public int weight() {
            return 1;
        }

        @Override
        public boolean ground() {
            return false;
        }

        @Override
        public boolean loose(int depth) {
            return !isFree() && index >= depth;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Var v)) return false;
            return isFree() ? v.isFree() && name.equals(v.name) : !v.isFree() && index == v.index;
        }

        @Override
        public int hashCode() {
            return isFree() ? name.hashCode() : 31 * index + 17;
        }

        @Override
        public String toString() {
            return isFree() ? "?" + name : name + "#" + index;
        }
    }

    record Const(String name) implements Term {
        private static final Map<String, Const> internCache = new ConcurrentHashMap<>(256);

        public Const {
            requireNonNull(name);
            if (name.isEmpty()) throw new IllegalArgumentException("Constant name must not be empty");
        }

        public static Const of(String name) {
            return internCache.computeIfAbsent(name, Const::new);
        }

        public static Const of(long n) {
            return of(Long.toString(n));
        }

        public boolean numeric() {
            return NUMBER.matcher(name).matches();
        }

        public boolean identifier() {
            return IDENTIFIER.matcher(name).matches();
        }

        @Override
        public int weight() {
            return 1;
        }

        @Override
        public boolean ground() {
            return true;
        }

        @Override
        public boolean loose(int depth) {
            return false;
        }

        @Override
        public String toString() {
            return name;
        }
    }

    record Fn(String symbol, List<Term> args) implements Term {

        public Fn {
            requireNonNull(symbol);
            args = List.copyOf(args);
            if (args.isEmpty()) throw new IllegalArgumentException("Function application needs arguments: " + symbol);
        }

        public static Fn of(String symbol, Term... args) {
            return new Fn(symbol, List.of(args));
        }

        public boolean arithmetic() {
            return args.size() == 2 && ARITHMETIC.contains(symbol);
        }

        @Override
        public int weight() {
            return 1 + args.stream().mapToInt(Term::weight).sum();
        }

        @Override
        public boolean ground() {
            return args.stream().allMatch(Term::ground);
        }

        @Override
        public boolean loose(int depth) {
            return args.stream().anyMatch(a -> a.loose(depth));
        }

        @Override
        public Stream<Term> subterms() {
            return Stream.concat(Stream.of(this), args.stream().flatMap(Term::subterms));
        }

        @Override
        public String toString() {
            return symbol + args;
        }
    }
}
