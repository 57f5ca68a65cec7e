package dumb.cogproof.reason;

import dumb.cogproof.AbstractProverTest;
import dumb.cogproof.ProofStatus;
import dumb.cogproof.modal.ModalSystem;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RuleLibraryTest extends AbstractProverTest {

    @Test
    void standardLibraryIsShared() {
        assertSame(RuleLibrary.standard(), RuleLibrary.standard());
    }

    @Test
    void indexesByNameAndCategory() {
        var lib = RuleLibrary.standard();
        assertEquals("modus_ponens", lib.rules(RuleCategory.BASIC).get(0).name());
        assertNotNull(lib.rule("deontic_d_axiom"));
        assertEquals(RuleCategory.COGNITIVE, lib.rule("knowledge_implies_belief").category());
        assertNull(lib.rule("no_such_rule"));
        var total = 0;
        for (var c : RuleCategory.values()) total += lib.rules(c).size();
        assertEquals(lib.size(), total);
    }

    @Test
    void modalAxiomsDependOnTheSystem() {
        var t = RuleLibrary.standard().rule("modal_t_axiom");
        assertFalse(t.enabled(ModalSystem.K));
        assertTrue(t.enabled(ModalSystem.T));
        assertTrue(t.enabled(ModalSystem.S5));
        assertTrue(RuleLibrary.standard().rule("modal_k_axiom").enabled(ModalSystem.K));
    }

    @Test
    void restrictKeepsOnlyTheGivenCategories() {
        var lib = RuleLibrary.standard().restrict(Set.of(RuleCategory.DEONTIC));
        assertFalse(lib.rules().isEmpty());
        assertTrue(lib.rules().stream().allMatch(r -> r.category() == RuleCategory.DEONTIC));
        assertTrue(lib.rules(RuleCategory.BASIC).isEmpty());
        assertTrue(lib.size() < RuleLibrary.standard().size());
    }

    @Test
    void conclusionsWithFreshMetavariablesAreGoalDirected() {
        var lib = RuleLibrary.builder()
                .rule(RuleCategory.BASIC, "weaken", "φ | ψ", "φ")
                .rule(RuleCategory.BASIC, "mp", "ψ", "φ", "φ -> ψ")
                .build();
        assertTrue(lib.rule("weaken").goalDirected());
        assertFalse(lib.rule("mp").goalDirected());
    }

    @Test
    void rejectsDuplicateNames() {
        var b = RuleLibrary.builder()
                .rule(RuleCategory.BASIC, "mp", "ψ", "φ", "φ -> ψ")
                .rule(RuleCategory.BASIC, "mp", "φ", "φ & ψ");
        assertThrows(IllegalArgumentException.class, b::build);
    }

    @Test
    void rejectsMalformedPatterns() {
        assertThrows(IllegalStateException.class,
                () -> RuleLibrary.builder().rule(RuleCategory.BASIC, "broken", "φ &", "φ"));
    }

    @Test
    void customLibraryDrivesTheProver() {
        var lib = RuleLibrary.builder().rule(RuleCategory.BASIC, "detach", "ψ", "φ", "φ -> ψ").build();
        var r = new NativeProver(lib).prove(parse("q"), kb("p", "p -> q"), ProverConfig.DEFAULT);
        assertStatus(ProofStatus.PROVED, r);
        assertEquals("detach", lastStep(r).ruleName());
    }
}
