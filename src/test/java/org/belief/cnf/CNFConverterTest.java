package org.belief.cnf;

import org.belief.formula.Formula;
import org.belief.formula.MalformedFormulaException;
import org.belief.formula.RandomFormulas;
import org.belief.parser.FormulaReader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CNFConverterTest {

    private static final List<String> ATOMS = List.of("a", "b", "c");

    private CNFConverter converter;

    @BeforeEach
    void setUp() {
        converter = new CNFConverter();
    }

    @Test
    void convertsImplicationToSingleClause() {
        CNFFormula cnf = converter.toCNF(FormulaReader.read("p >> r"));

        assertEquals(CNFFormula.of(Clause.of(Literal.negative("p"), Literal.positive("r"))), cnf);
        assertEquals("(~p | r)", cnf.toString());
    }

    @Test
    void pushesNegationsThroughDeMorgan() {
        CNFFormula cnf = converter.toCNF(FormulaReader.read("~(p | ~q)"));

        assertEquals(CNFFormula.of(Clause.of(Literal.negative("p")), Clause.of(Literal.positive("q"))), cnf);
    }

    @Test
    void distributesDisjunctionOverConjunction() {
        CNFFormula cnf = converter.toCNF(FormulaReader.read("p | q & r"));

        assertEquals(2, cnf.size());
        assertTrue(cnf.clauses().contains(Clause.of(Literal.positive("p"), Literal.positive("q"))));
        assertTrue(cnf.clauses().contains(Clause.of(Literal.positive("p"), Literal.positive("r"))));
    }

    @Test
    void keepsTautologiesUnlessSimplifying() {
        Formula excludedMiddle = FormulaReader.read("p | ~p");

        assertEquals(1, converter.toCNF(excludedMiddle).size());
        assertTrue(converter.toCNF(excludedMiddle, true).isEmpty());
        assertTrue(new CNFConverter(true).toCNF(excludedMiddle).isEmpty());
        assertEquals("TRUE", new CNFConverter(true).toCNF(excludedMiddle).toString());
    }

    @Test
    void rejectsMissingFormula() {
        assertThrows(MalformedFormulaException.class, () -> converter.toCNF(null));
    }

    @Test
    void randomFormulasAreEquivalentToTheirCnf() {
        RandomFormulas generator = new RandomFormulas(42L, ATOMS);
        List<Map<String, Boolean>> assignments = RandomFormulas.assignments(ATOMS);

        for (int n = 0; n < 300; n++) {
            Formula formula = generator.next(3);
            CNFFormula cnf = converter.toCNF(formula);
            CNFFormula simplified = converter.toCNF(formula, true);

            for (Map<String, Boolean> assignment : assignments) {
                boolean expected = formula.evaluate(assignment);
                assertEquals(expected, cnf.evaluate(assignment), formula + " sotto " + assignment);
                assertEquals(expected, simplified.evaluate(assignment), formula + " sotto " + assignment);
            }
        }
    }

    @Test
    void interruptedThreadStopsDistribution() {
        List<Formula> disjuncts = new ArrayList<>();
        for (int i = 1; i <= 12; i++) {
            disjuncts.add(Formula.and(Formula.atom("a" + i), Formula.atom("b" + i)));
        }
        Formula exponential = Formula.or(disjuncts);

        Thread.currentThread().interrupt();
        try {
            assertThrows(ConversionInterruptedException.class, () -> converter.toCNF(exponential));
        } finally {
            Thread.interrupted();
        }

        assertEquals(4096, converter.toCNF(exponential).size());
    }

    @Test
    void conjunctionMergesClausesWithoutDuplicates() {
        CNFFormula first = converter.toCNF(FormulaReader.read("p & q"));
        CNFFormula second = converter.toCNF(FormulaReader.read("q & r"));

        CNFFormula union = CNFFormula.conjunction(List.of(first, second));

        assertEquals(3, union.size());
        assertEquals(first.union(second), union);
        assertFalse(union.containsEmptyClause());
    }
}
