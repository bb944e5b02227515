package org.belief.revision;

import org.belief.base.Belief;
import org.belief.base.BeliefBase;
import org.belief.cnf.CNFFormula;
import org.belief.formula.Formula;
import org.belief.formula.MalformedFormulaException;
import org.belief.resolution.ResolutionEngine;
import org.belief.resolution.ResolutionInterruptedException;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.logging.Logger;

/**
 * MOTORE DI CONTRAZIONE E REVISIONE - Cambiamento di credenze secondo AGM
 *
 * CONTRAZIONE (politica greedy per radicamento):
 * 1. Se la base non implica φ → nessuna modifica
 * 2. Se φ è una tautologia → {@link VacuousTargetException}, base invariata
 * 3. Finché la base implica φ: rimuove la credenza minima secondo l'ordine
 *    iniettato (default {@link EntrenchmentOrdering}) e ricontrolla
 *
 * Le rimozioni sono calcolate su una copia di lavoro e applicate alla base in
 * un unico passo, così un'interruzione a metà non lascia la base modificata.
 * La revisione applica insieme rimozioni ed espansione.
 * La politica non cerca il sottoinsieme minimo di rimozioni: può rimuovere più
 * credenze dello stretto necessario.
 *
 * REVISIONE (identità di Levi): contract(~φ) seguita da expand(φ). Se φ è
 * insoddisfacibile la contrazione è saltata e φ viene comunque aggiunta: il
 * postulato di Successo prevale su quello di Consistenza.
 */
public class RevisionEngine {

    private static final Logger LOGGER = Logger.getLogger(RevisionEngine.class.getName());

    private final ResolutionEngine engine;
    private final Comparator<Belief> ordering;

    //region COSTRUZIONE

    public RevisionEngine() {
        this(new ResolutionEngine(), EntrenchmentOrdering.INSTANCE);
    }

    public RevisionEngine(ResolutionEngine engine) {
        this(engine, EntrenchmentOrdering.INSTANCE);
    }

    /**
     * @param engine motore di risoluzione per le verifiche d'implicazione
     * @param ordering ordine di rimozione: la credenza minima viene rimossa per prima
     */
    public RevisionEngine(ResolutionEngine engine, Comparator<Belief> ordering) {
        if (engine == null || ordering == null) {
            throw new IllegalArgumentException("Motore di risoluzione e ordinamento non possono essere null");
        }
        this.engine = engine;
        this.ordering = ordering;
    }

    //endregion

    //region ESPANSIONE

    public Belief expand(BeliefBase base, Formula formula) {
        return base.expand(formula);
    }

    public Belief expand(BeliefBase base, Formula formula, int entrenchment) {
        return base.expand(formula, entrenchment);
    }

    //endregion

    //region CONTRAZIONE

    /**
     * Rimuove credenze finché la base non implica più l'obiettivo.
     *
     * @param base base da contrarre
     * @param target formula da non implicare più
     * @return credenze rimosse, nell'ordine di scelta
     * @throws VacuousTargetException se l'obiettivo è una tautologia
     * @throws MalformedFormulaException se l'obiettivo è mancante
     */
    public ContractionResult contract(BeliefBase base, Formula target) {
        if (base == null) {
            throw new IllegalArgumentException("Base di credenze non può essere null");
        }
        if (target == null) {
            throw new MalformedFormulaException("Formula da contrarre mancante");
        }

        List<Belief> removed = selectRemovals(base, target);
        if (removed.isEmpty()) {
            return ContractionResult.unchanged(target);
        }

        checkInterrupted();
        base.removeBeliefs(removed);
        LOGGER.info("Contrazione di " + target + " completata: " + removed.size() + " credenze rimosse");
        return new ContractionResult(target, removed);
    }

    /**
     * Calcola, su una copia di lavoro, le credenze da rimuovere perché la base
     * non implichi più l'obiettivo. Non modifica la base.
     *
     * @return credenze da rimuovere nell'ordine di scelta, vuota se l'obiettivo
     *         non è implicato
     * @throws VacuousTargetException se l'obiettivo implicato è una tautologia
     */
    private List<Belief> selectRemovals(BeliefBase base, Formula target) {
        List<Belief> remaining = new ArrayList<>(base.beliefs());
        if (!engine.entails(conjunction(remaining), target)) {
            LOGGER.fine("Contrazione di " + target + " senza effetti: obiettivo non implicato");
            return new ArrayList<>();
        }

        if (engine.isTautology(target)) {
            LOGGER.warning("Contrazione rifiutata, obiettivo tautologico: " + target);
            throw new VacuousTargetException(target);
        }

        List<Belief> removed = new ArrayList<>();
        do {
            Belief victim = selectVictim(remaining);
            remaining.remove(victim);
            removed.add(victim);
            LOGGER.fine("Selezionata per la rimozione: " + victim);
        } while (engine.entails(conjunction(remaining), target));

        return removed;
    }

    /**
     * Credenza minima secondo l'ordine di rimozione.
     */
    private Belief selectVictim(List<Belief> remaining) {
        if (remaining.isEmpty()) {
            throw new IllegalStateException("Base esaurita ma l'obiettivo risulta ancora implicato");
        }
        Belief victim = remaining.get(0);
        for (Belief candidate : remaining) {
            if (ordering.compare(candidate, victim) < 0) {
                victim = candidate;
            }
        }
        return victim;
    }

    private static CNFFormula conjunction(List<Belief> beliefs) {
        List<CNFFormula> formulas = new ArrayList<>();
        for (Belief belief : beliefs) {
            formulas.add(belief.getCnf());
        }
        return CNFFormula.conjunction(formulas);
    }

    //endregion

    //region REVISIONE

    /**
     * Revisione con radicamento di default.
     */
    public ContractionResult revise(BeliefBase base, Formula formula) {
        return revise(base, formula, BeliefBase.DEFAULT_ENTRENCHMENT);
    }

    /**
     * Revisione: contrazione di ~φ, poi espansione con φ.
     *
     * @param base base da rivedere
     * @param formula nuova credenza φ
     * @param entrenchment radicamento della nuova credenza
     * @return esito della contrazione di ~φ (credenze rimosse)
     * @throws MalformedFormulaException se la formula è mancante
     */
    public ContractionResult revise(BeliefBase base, Formula formula, int entrenchment) {
        if (base == null) {
            throw new IllegalArgumentException("Base di credenze non può essere null");
        }
        if (formula == null) {
            throw new MalformedFormulaException("Formula di revisione mancante");
        }

        // CNF calcolata prima di qualunque modifica: la base cambia solo nel commit finale
        CNFFormula cnf = engine.getConverter().toCNF(formula);
        Formula negation = formula.negate();
        List<Belief> removed;

        if (engine.isTautology(negation)) {
            // φ insoddisfacibile: ~φ non è contraibile, si aggiunge comunque φ
            LOGGER.warning("Revisione con formula insoddisfacibile, contrazione saltata: " + formula);
            removed = new ArrayList<>();
        } else {
            removed = selectRemovals(base, negation);
        }

        checkInterrupted();
        base.replaceBeliefs(removed, formula, cnf, entrenchment);
        LOGGER.info("Revisione con " + formula + " completata: " + removed.size() + " credenze rimosse");
        return new ContractionResult(negation, removed);
    }

    /**
     * Ultimo punto di cancellazione prima del commit sulla base.
     */
    private static void checkInterrupted() {
        if (Thread.currentThread().isInterrupted()) {
            throw new ResolutionInterruptedException("Operazione interrotta prima del commit");
        }
    }

    //endregion
}
