package org.belief.resolution;

import org.belief.cnf.CNFConverter;
import org.belief.cnf.CNFFormula;
import org.belief.cnf.Clause;
import org.belief.formula.Formula;
import org.belief.formula.MalformedFormulaException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * MOTORE DI RISOLUZIONE - Decisione dell'implicazione logica per refutazione
 *
 * Per verificare KB ⊨ φ si nega l'obiettivo, lo si converte in CNF e lo si unisce
 * alle clausole della base. L'insieme risultante viene saturato con la regola di
 * risoluzione binaria: se si deriva la clausola vuota [] l'obiettivo è implicato,
 * se si raggiunge un punto fisso senza derivarla non lo è.
 *
 * PROPRIETÀ:
 * - Corretto e completo per refutazione nella logica proposizionale
 * - Terminazione garantita: il vocabolario di atomi è finito, quindi anche lo
 *   spazio delle clausole; le clausole già viste non vengono rielaborate
 * - Risolventi tautologici scartati
 * - Sussunzione in avanti opzionale: un risolvente che è sovrainsieme di una
 *   clausola già mantenuta viene scartato senza alterare l'esito
 *
 * Il motore non solleva errori di dominio: l'esito è sempre un booleano definito.
 * L'unica eccezione è {@link ResolutionInterruptedException} in caso di
 * interruzione del thread.
 */
public class ResolutionEngine {

    private static final Logger LOGGER = Logger.getLogger(ResolutionEngine.class.getName());

    private final CNFConverter converter;

    /** Abilita la sussunzione in avanti dei risolventi */
    private final boolean subsumption;

    //region COSTRUZIONE

    public ResolutionEngine() {
        this(true);
    }

    public ResolutionEngine(boolean subsumption) {
        this(new CNFConverter(), subsumption);
    }

    public ResolutionEngine(CNFConverter converter, boolean subsumption) {
        if (converter == null) {
            throw new IllegalArgumentException("CNFConverter non può essere null");
        }
        this.converter = converter;
        this.subsumption = subsumption;
    }

    //endregion

    //region INTERFACCIA PUBBLICA

    /**
     * Decide se le clausole implicano l'obiettivo.
     *
     * @param clauses base di conoscenza in CNF
     * @param goal formula da verificare
     * @return true se clauses ⊨ goal
     */
    public boolean entails(CNFFormula clauses, Formula goal) {
        return prove(clauses, goal).isEmptyClauseDerived();
    }

    /**
     * Come {@link #entails(CNFFormula, Formula)} ma restituisce anche prova e statistiche.
     *
     * @throws MalformedFormulaException se goal è null
     */
    public ResolutionResult prove(CNFFormula clauses, Formula goal) {
        if (clauses == null) {
            throw new IllegalArgumentException("Insieme clausole non può essere null");
        }
        if (goal == null) {
            throw new MalformedFormulaException("Formula obiettivo mancante");
        }

        CNFFormula negatedGoal = converter.toCNF(goal.negate());
        LOGGER.fine("Obiettivo negato in CNF: " + negatedGoal);

        ResolutionResult result = refute(clauses.union(negatedGoal));
        LOGGER.fine("Verifica implicazione di " + goal + ": " + result);
        return result;
    }

    /**
     * @return true se l'insieme di clausole ammette un modello
     */
    public boolean isSatisfiable(CNFFormula clauses) {
        if (clauses == null) {
            throw new IllegalArgumentException("Insieme clausole non può essere null");
        }
        return !refute(clauses).isEmptyClauseDerived();
    }

    /**
     * Una formula è tautologica se è implicata dall'insieme vuoto di clausole.
     */
    public boolean isTautology(Formula formula) {
        return entails(CNFFormula.TRUE, formula);
    }

    public CNFConverter getConverter() {
        return converter;
    }

    //endregion

    //region SATURAZIONE

    /**
     * Satura l'insieme di clausole con la risoluzione binaria.
     *
     * ALGORITMO:
     * 1. Le clausole in input (non tautologiche, senza duplicati) formano W
     * 2. Ad ogni passata si risolvono le coppie in cui almeno una clausola è
     *    stata aggiunta nella passata precedente
     * 3. [] derivata → refutazione riuscita; nessuna clausola nuova → punto fisso
     *
     * @param input clausole da refutare
     * @return esito con prova e statistiche
     */
    public ResolutionResult refute(CNFFormula input) {
        List<Clause> retained = new ArrayList<>();
        Set<Clause> seen = new HashSet<>();
        Map<Clause, ResolutionStep> derivations = new HashMap<>();

        for (Clause clause : input.clauses()) {
            if (clause.isEmpty()) {
                LOGGER.fine("Clausola vuota presente tra le premesse");
                return ResolutionResult.refuted(List.of(), 0, 0, 0);
            }
            if (!clause.isTautology() && seen.add(clause)) {
                retained.add(clause);
            }
        }

        int passes = 0;
        int generated = 0;
        int processed = 0;

        while (processed < retained.size()) {
            passes++;
            int end = retained.size();
            LOGGER.finest("Passata " + passes + ": " + (end - processed) + " clausole nuove su " + end);

            for (int i = processed; i < end; i++) {
                checkInterrupted();
                Clause current = retained.get(i);

                for (int j = 0; j < i; j++) {
                    checkInterrupted();
                    Clause partner = retained.get(j);

                    for (Clause resolvent : current.resolveWith(partner)) {
                        generated++;
                        ResolutionStep step = new ResolutionStep(current, partner, resolvent);

                        if (resolvent.isEmpty()) {
                            List<ResolutionStep> proof = reconstructProof(step, derivations);
                            LOGGER.fine("Clausola vuota [] derivata dopo " + generated + " risolventi");
                            return ResolutionResult.refuted(proof, passes, generated, retained.size());
                        }

                        if (resolvent.isTautology() || seen.contains(resolvent)) {
                            continue;
                        }
                        if (subsumption && isSubsumed(resolvent, retained)) {
                            LOGGER.finest("Risolvente sussunto scartato: " + resolvent);
                            continue;
                        }

                        seen.add(resolvent);
                        retained.add(resolvent);
                        derivations.put(resolvent, step);
                    }
                }
            }

            processed = end;
        }

        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine(String.format("Punto fisso raggiunto: %d passate, %d risolventi, %d clausole",
                    passes, generated, retained.size()));
        }
        return ResolutionResult.saturated(passes, generated, retained.size());
    }

    private static boolean isSubsumed(Clause candidate, List<Clause> retained) {
        for (Clause clause : retained) {
            if (clause.subsumes(candidate)) {
                return true;
            }
        }
        return false;
    }

    private static void checkInterrupted() {
        if (Thread.currentThread().isInterrupted()) {
            throw new ResolutionInterruptedException("Saturazione interrotta");
        }
    }

    //endregion

    //region RICOSTRUZIONE PROVA

    /**
     * Ricostruisce i passi che portano a [] visitando le derivazioni a ritroso:
     * ogni clausola derivata compare dopo i passi che producono le sue genitrici.
     */
    private static List<ResolutionStep> reconstructProof(ResolutionStep last,
                                                         Map<Clause, ResolutionStep> derivations) {
        Set<ResolutionStep> ordered = new LinkedHashSet<>();
        collectSteps(last, derivations, ordered);
        return new ArrayList<>(ordered);
    }

    private static void collectSteps(ResolutionStep step, Map<Clause, ResolutionStep> derivations,
                                     Set<ResolutionStep> ordered) {
        if (ordered.contains(step)) {
            return;
        }
        ResolutionStep firstOrigin = derivations.get(step.getFirst());
        if (firstOrigin != null) {
            collectSteps(firstOrigin, derivations, ordered);
        }
        ResolutionStep secondOrigin = derivations.get(step.getSecond());
        if (secondOrigin != null) {
            collectSteps(secondOrigin, derivations, ordered);
        }
        ordered.add(step);
    }

    //endregion
}
