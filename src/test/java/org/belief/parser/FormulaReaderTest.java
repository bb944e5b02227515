package org.belief.parser;

import org.belief.formula.Formula;
import org.belief.formula.MalformedFormulaException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FormulaReaderTest {

    private final Formula p = Formula.atom("p");
    private final Formula q = Formula.atom("q");
    private final Formula r = Formula.atom("r");

    @Test
    void readsAtomsWithUnderscoresAndDigits() {
        assertEquals(Formula.atom("rain_2"), FormulaReader.read("  rain_2 "));
    }

    @Test
    void negationBindsTighterThanConjunction() {
        assertEquals(Formula.and(Formula.not(p), q), FormulaReader.read("~p & q"));
        assertEquals(Formula.not(Formula.not(p)), FormulaReader.read("~~p"));
    }

    @Test
    void precedenceFollowsOperatorOrder() {
        assertEquals(Formula.or(p, Formula.and(q, r)), FormulaReader.read("p | q & r"));
        assertEquals(Formula.implies(Formula.or(p, q), r), FormulaReader.read("p | q >> r"));
        assertEquals(Formula.iff(Formula.implies(p, q), r), FormulaReader.read("p >> q <<>> r"));
    }

    @Test
    void binaryOperatorsAssociateToTheLeft() {
        assertEquals(Formula.implies(Formula.implies(p, q), r), FormulaReader.read("p >> q >> r"));
        assertEquals(Formula.iff(Formula.iff(p, q), r), FormulaReader.read("p <<>> q <<>> r"));
        assertEquals(Formula.implies(p, Formula.implies(q, r)), FormulaReader.read("p >> (q >> r)"));
    }

    @Test
    void chainsOfSameOperatorBecomeOneNode() {
        Formula conjunction = FormulaReader.read("p & q & r");

        assertEquals(Formula.Type.AND, conjunction.type);
        assertEquals(3, conjunction.operands.size());
    }

    @Test
    void rejectsEmptyAndMalformedInput() {
        assertThrows(MalformedFormulaException.class, () -> FormulaReader.read(""));
        assertThrows(MalformedFormulaException.class, () -> FormulaReader.read("   "));
        assertThrows(MalformedFormulaException.class, () -> FormulaReader.read(null));
        assertThrows(MalformedFormulaException.class, () -> FormulaReader.read("p &"));
        assertThrows(MalformedFormulaException.class, () -> FormulaReader.read("(p | q"));
        assertThrows(MalformedFormulaException.class, () -> FormulaReader.read("p q"));

        MalformedFormulaException error = assertThrows(MalformedFormulaException.class,
                () -> FormulaReader.read("p $ q"));
        assertTrue(error.getMessage().startsWith("Errore di sintassi"), error.getMessage());
    }
}
