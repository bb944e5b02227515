package org.belief.resolution;

import org.belief.cnf.CNFFormula;
import org.belief.cnf.Clause;
import org.belief.cnf.Literal;
import org.belief.formula.Formula;
import org.belief.formula.MalformedFormulaException;
import org.belief.formula.RandomFormulas;
import org.belief.parser.FormulaReader;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ResolutionEngineTest {

    private static final List<String> ATOMS = List.of("a", "b", "c", "d");

    private final ResolutionEngine engine = new ResolutionEngine();

    @Test
    void modusPonensIsEntailed() {
        CNFFormula base = clausesOf("p", "p >> q");

        assertTrue(engine.entails(base, FormulaReader.read("q")));
        assertFalse(engine.entails(base, FormulaReader.read("r")));
        assertFalse(engine.entails(base, FormulaReader.read("~q")));
    }

    @Test
    void emptyBaseEntailsOnlyTautologies() {
        assertTrue(engine.entails(CNFFormula.TRUE, FormulaReader.read("p | ~p")));
        assertTrue(engine.entails(CNFFormula.TRUE, FormulaReader.read("(p >> q) <<>> (~q >> ~p)")));
        assertFalse(engine.entails(CNFFormula.TRUE, FormulaReader.read("p")));
    }

    @Test
    void inconsistentBaseEntailsEverything() {
        CNFFormula base = clausesOf("p", "~p");

        assertTrue(engine.entails(base, FormulaReader.read("q & ~q")));
        assertFalse(engine.isSatisfiable(base));
    }

    @Test
    void emptyClauseAmongPremisesIsRefutedWithoutSteps() {
        ResolutionResult result = engine.refute(CNFFormula.of(Clause.of(Literal.positive("p")), Clause.EMPTY));

        assertTrue(result.isEmptyClauseDerived());
        assertTrue(result.getProof().isEmpty());
        assertEquals("La clausola vuota [] è presente tra le premesse", result.formatProof());
    }

    @Test
    void proofEndsWithEmptyClauseAndUsesOnlyKnownClauses() {
        ResolutionResult result = engine.prove(clausesOf("p", "p >> q", "q >> r"), FormulaReader.read("r"));

        assertTrue(result.isEmptyClauseDerived());
        List<ResolutionStep> proof = result.getProof();
        assertFalse(proof.isEmpty());
        assertTrue(proof.get(proof.size() - 1).getResolvent().isEmpty());

        List<Clause> available = new ArrayList<>(clausesOf("p", "p >> q", "q >> r", "~r").clauses());
        for (ResolutionStep step : proof) {
            assertTrue(available.contains(step.getFirst()), step.toString());
            assertTrue(available.contains(step.getSecond()), step.toString());
            available.add(step.getResolvent());
        }
        assertTrue(result.formatProof().contains("[]"));
    }

    @Test
    void saturationReportsNoProof() {
        ResolutionResult result = engine.prove(clausesOf("p | q"), FormulaReader.read("p"));

        assertFalse(result.isEmptyClauseDerived());
        assertTrue(result.getProof().isEmpty());
        assertTrue(result.getPasses() >= 1);
        assertEquals("Nessuna prova: punto fisso raggiunto senza derivare []", result.formatProof());
    }

    @Test
    void recognisesTautologies() {
        assertTrue(engine.isTautology(FormulaReader.read("p | ~p")));
        assertTrue(engine.isTautology(FormulaReader.read("p >> (q >> p)")));
        assertFalse(engine.isTautology(FormulaReader.read("p >> q")));
    }

    @Test
    void rejectsMissingGoal() {
        assertThrows(MalformedFormulaException.class, () -> engine.entails(CNFFormula.TRUE, null));
    }

    @Test
    void interruptedThreadStopsSaturation() {
        CNFFormula base = clausesOf("p | q", "~p | r");
        Formula goal = FormulaReader.read("s");

        Thread.currentThread().interrupt();
        try {
            assertThrows(ResolutionInterruptedException.class, () -> engine.entails(base, goal));
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void agreesWithTruthTablesWithAndWithoutSubsumption() {
        ResolutionEngine withoutSubsumption = new ResolutionEngine(false);
        RandomFormulas generator = new RandomFormulas(7L, ATOMS);
        List<Map<String, Boolean>> assignments = RandomFormulas.assignments(ATOMS);

        for (int n = 0; n < 150; n++) {
            List<Formula> premises = new ArrayList<>();
            int count = 1 + generator.nextInt(3);
            for (int i = 0; i < count; i++) {
                premises.add(generator.next(2));
            }
            Formula goal = generator.next(2);

            boolean expected = true;
            for (Map<String, Boolean> assignment : assignments) {
                boolean premisesHold = premises.stream().allMatch(premise -> premise.evaluate(assignment));
                if (premisesHold && !goal.evaluate(assignment)) {
                    expected = false;
                    break;
                }
            }

            CNFFormula base = CNFFormula.TRUE;
            for (Formula premise : premises) {
                base = base.union(engine.getConverter().toCNF(premise));
            }
            String description = premises + " |= " + goal;
            assertEquals(expected, engine.entails(base, goal), description);
            assertEquals(expected, withoutSubsumption.entails(base, goal), description);
        }
    }

    private CNFFormula clausesOf(String... formulas) {
        CNFFormula result = CNFFormula.TRUE;
        for (String formula : formulas) {
            result = result.union(engine.getConverter().toCNF(FormulaReader.read(formula)));
        }
        return result;
    }
}
