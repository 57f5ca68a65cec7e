package dumb.cogproof;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Immutable fact set. {@link #extend} layers a new snapshot over this one and shares everything
 * below it, so a search can keep every earlier snapshot while its successors grow.
 * Facts are identified by content hash: alpha-equivalent and reordered formulas are one fact.
 */
public final class KnowledgeBase {

    public static final KnowledgeBase EMPTY = new KnowledgeBase(null, List.of());

    private final @Nullable KnowledgeBase parent;
    private final List<Formula> delta;
    private final Map<ContentHash, Formula> byHash;
    private final Map<String, List<Formula>> byHead;
    private final int size, layers;

    private KnowledgeBase(@Nullable KnowledgeBase parent, List<Formula> delta) {
        this.parent = parent;
        this.delta = List.copyOf(delta);
        this.byHash = new HashMap<>(delta.size() * 2);
        this.byHead = new HashMap<>();
        for (var f : this.delta) {
            byHash.put(f.hash(), f);
            byHead.computeIfAbsent(head(f), k -> new ArrayList<>()).add(f);
        }
        this.size = (parent == null ? 0 : parent.size) + delta.size();
        this.layers = parent == null ? 0 : parent.layers + 1;
    }

    public static KnowledgeBase of(Collection<? extends Formula> facts) {
        return EMPTY.extend(facts);
    }

    /**
     * Index key of a formula's outermost operator: predicate symbol and arity, or node kind and operator.
     * Metavariables have no key.
     */
    @Nullable
    public static String head(Formula f) {
        if (f instanceof Formula.Meta) return null;
        if (f instanceof Formula.Pred p) return p.symbol + "/" + p.arity();
        return f.getClass().getSimpleName() + ":" + f.label();
    }

    /** A snapshot holding these facts in addition; facts already present are skipped, and with nothing new this snapshot is returned. */
    public KnowledgeBase extend(Collection<? extends Formula> facts) {
        var fresh = new ArrayList<Formula>(facts.size());
        var seen = new HashMap<ContentHash, Formula>();
        for (var f : facts) {
            var h = f.hash();
            if (!contains(h) && seen.putIfAbsent(h, f) == null) fresh.add(f);
        }
        if (fresh.isEmpty()) return this;
        return new KnowledgeBase(this == EMPTY ? null : this, fresh);
    }

    public boolean contains(Formula f) {
        return contains(f.hash());
    }

    public boolean contains(ContentHash h) {
        return get(h) != null;
    }

    @Nullable
    public Formula get(ContentHash h) {
        for (var k = this; k != null; k = k.parent) {
            var f = k.byHash.get(h);
            if (f != null) return f;
        }
        return null;
    }

    /** Facts added by the newest layer. */
    public List<Formula> delta() {
        return delta;
    }

    /** The snapshot this one extends; {@link #EMPTY} for the first layer. */
    public KnowledgeBase parent() {
        return parent == null ? EMPTY : parent;
    }

    public Stream<Formula> facts() {
        return parent == null ? delta.stream() : Stream.concat(parent.facts(), delta.stream());
    }

    /** Facts whose outermost operator has the given key; all facts for a null key. */
    public Stream<Formula> withHead(@Nullable String head) {
        if (head == null) return facts();
        var own = byHead.getOrDefault(head, List.of()).stream();
        return parent == null ? own : Stream.concat(parent.withHead(head), own);
    }

    public int size() {
        return size;
    }

    public int layers() {
        return layers;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    @Override
    public String toString() {
        return "KnowledgeBase{" + size + " facts, " + layers + " layers}";
    }
}
