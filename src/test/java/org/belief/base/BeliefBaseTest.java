package org.belief.base;

import org.belief.cnf.CNFFormula;
import org.belief.formula.Formula;
import org.belief.formula.MalformedFormulaException;
import org.belief.parser.FormulaReader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BeliefBaseTest {

    private BeliefBase base;

    @BeforeEach
    void setUp() {
        base = new BeliefBase();
    }

    @Test
    void expansionIsUnconditionalEvenForContradictions() {
        base.expand(f("p"));
        base.expand(f("~p"));

        assertEquals(2, base.size());
        assertFalse(base.isConsistent());
        assertTrue(base.entails(f("q")));
    }

    @Test
    void expansionUsesDefaultEntrenchmentAndIncreasingSequence() {
        Belief first = base.expand(f("p"));
        Belief second = base.expand(f("q"), 10);

        assertEquals(BeliefBase.DEFAULT_ENTRENCHMENT, first.getEntrenchment());
        assertEquals(10, second.getEntrenchment());
        assertTrue(first.getSequence() < second.getSequence());
    }

    @Test
    void showListsBeliefsInInsertionOrder() {
        base.expand(f("p"), 10);
        base.expand(f("q"), 80);
        base.expand(f("p >> q"), 60);

        List<BeliefBase.Entry> entries = base.show();

        assertEquals(List.of(
                new BeliefBase.Entry(f("p"), 10),
                new BeliefBase.Entry(f("q"), 80),
                new BeliefBase.Entry(f("p >> q"), 60)), entries);
        assertThrows(UnsupportedOperationException.class, () -> entries.add(new BeliefBase.Entry(f("r"), 1)));
    }

    @Test
    void removeDropsOnlyFirstStructurallyEqualBelief() {
        base.expand(f("p & q"), 10);
        base.expand(f("r"), 20);
        base.expand(f("q & p"), 30);

        Belief removed = base.remove(f("q & p"));

        assertEquals(10, removed.getEntrenchment());
        assertEquals(2, base.size());
        assertEquals(30, base.getEntrenchment(f("p & q")));
    }

    @Test
    void removeAllDropsEveryMatch() {
        base.expand(f("p"));
        base.expand(f("q"));
        base.expand(f("p"));

        assertEquals(2, base.removeAll(f("p")));
        assertEquals(List.of(new BeliefBase.Entry(f("q"), BeliefBase.DEFAULT_ENTRENCHMENT)), base.show());
    }

    @Test
    void updateReplacesInPlaceKeepingSequence() {
        Belief original = base.expand(f("p"), 10);
        base.expand(f("q"), 80);

        Belief updated = base.update(f("p"), f("~p"), 40);

        assertEquals(original.getSequence(), updated.getSequence());
        assertEquals(f("~p"), base.show().get(0).getFormula());
        assertEquals(40, base.getEntrenchment(f("~p")));
        assertFalse(base.contains(f("p")));
    }

    @Test
    void updateWithoutEntrenchmentKeepsTheOldOne() {
        base.expand(f("q"), 80);

        base.update(f("q"), f("r"));

        assertEquals(80, base.getEntrenchment(f("r")));
    }

    @Test
    void missingBeliefsAreReportedAndBaseIsUnchanged() {
        base.expand(f("p"));

        BeliefNotFoundException notFound = assertThrows(BeliefNotFoundException.class, () -> base.remove(f("q")));
        assertEquals(f("q"), notFound.getFormula());
        assertThrows(BeliefNotFoundException.class, () -> base.update(f("q"), f("r"), 1));
        assertThrows(BeliefNotFoundException.class, () -> base.getEntrenchment(f("q")));
        assertThrows(MalformedFormulaException.class, () -> base.update(f("p"), null, 1));
        assertThrows(MalformedFormulaException.class, () -> base.remove(null));

        assertEquals(List.of(new BeliefBase.Entry(f("p"), BeliefBase.DEFAULT_ENTRENCHMENT)), base.show());
    }

    @Test
    void removeBeliefsIsAllOrNothing() {
        Belief p = base.expand(f("p"));
        base.expand(f("q"));
        Belief foreign = new BeliefBase().expand(f("q"));

        assertThrows(BeliefNotFoundException.class, () -> base.removeBeliefs(List.of(p, foreign)));
        assertEquals(2, base.size());

        base.removeBeliefs(List.of(p));
        assertEquals(List.of(new BeliefBase.Entry(f("q"), BeliefBase.DEFAULT_ENTRENCHMENT)), base.show());
    }

    @Test
    void replaceBeliefsRemovesAndAppendsInOneStep() {
        Belief p = base.expand(f("p"), 30);
        base.expand(f("p >> q"), 50);
        Belief foreign = new BeliefBase().expand(f("r"));
        long modifications = base.getModificationCount();
        CNFFormula cnf = base.getEngine().getConverter().toCNF(f("~q"));

        assertThrows(BeliefNotFoundException.class,
                () -> base.replaceBeliefs(List.of(p, foreign), f("~q"), cnf, 40));
        assertEquals(2, base.size());
        assertEquals(modifications, base.getModificationCount());

        Belief added = base.replaceBeliefs(List.of(p), f("~q"), cnf, 40);

        assertEquals(List.of(
                new BeliefBase.Entry(f("p >> q"), 50),
                new BeliefBase.Entry(f("~q"), 40)), base.show());
        assertTrue(added.getSequence() > p.getSequence());
        assertEquals(modifications + 1, base.getModificationCount());
    }

    @Test
    void emptyBaseIsConsistentAndEntailsOnlyTautologies() {
        assertTrue(base.isEmpty());
        assertTrue(base.isConsistent());
        assertTrue(base.entails(f("p | ~p")));
        assertFalse(base.entails(f("p")));
    }

    @Test
    void clearEmptiesTheBase() {
        base.expand(f("p"));
        base.clear();

        assertTrue(base.isEmpty());
        assertTrue(base.clauses().isEmpty());
    }

    private static Formula f(String text) {
        return FormulaReader.read(text);
    }
}
