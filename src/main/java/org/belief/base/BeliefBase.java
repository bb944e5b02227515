package org.belief.base;

import org.belief.cnf.CNFFormula;
import org.belief.formula.Formula;
import org.belief.formula.MalformedFormulaException;
import org.belief.resolution.ResolutionEngine;
import org.belief.resolution.ResolutionResult;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * BASE DI CREDENZE - Sequenza ordinata di credenze con grado di radicamento
 *
 * Possiede in esclusiva i propri record {@link Belief}. Nessuna operazione
 * elimina duplicati o verifica la consistenza implicitamente: l'espansione è
 * l'operazione primitiva e incondizionata.
 *
 * CICLO DI VITA:
 * - Creata vuota
 * - Modificata solo da expand, remove, update (e dalle contrazioni e revisioni
 *   che passano per {@link #removeBeliefs(Collection)} e
 *   {@link #replaceBeliefs(Collection, Formula, CNFFormula, int)})
 * - Mai persistita
 *
 * ATOMICITÀ: ogni operazione fallita lascia la base invariata. Ogni modifica
 * riuscita incrementa {@link #getModificationCount()}.
 *
 * CORRISPONDENZA FORMULE: remove, update e getEntrenchment cercano la prima
 * credenza, in ordine di inserimento, la cui formula è strutturalmente uguale a
 * quella data (vedi {@link Formula#equals(Object)}).
 *
 * Non è thread-safe: le modifiche devono provenire da un thread alla volta.
 */
public class BeliefBase {

    private static final Logger LOGGER = Logger.getLogger(BeliefBase.class.getName());

    /** Radicamento assegnato quando il chiamante non lo specifica */
    public static final int DEFAULT_ENTRENCHMENT = 50;

    //region ATTRIBUTI

    /**
     * Credenze in ordine di inserimento.
     * Invariante: nessun elemento null, numeri d'ordine distinti.
     */
    private final List<Belief> beliefs = new ArrayList<>();

    /**
     * Motore usato per convertire le formule e per le verifiche d'implicazione.
     */
    private final ResolutionEngine engine;

    /** Prossimo numero d'ordine di inserimento */
    private long nextSequence;

    /** Numero di modifiche riuscite dalla creazione */
    private long modificationCount;

    //endregion

    //region COSTRUZIONE

    public BeliefBase() {
        this(new ResolutionEngine());
    }

    /**
     * @param engine motore di risoluzione condiviso con il motore di revisione
     * @throws IllegalArgumentException se engine è null
     */
    public BeliefBase(ResolutionEngine engine) {
        if (engine == null) {
            throw new IllegalArgumentException("ResolutionEngine non può essere null");
        }
        this.engine = engine;
    }

    //endregion

    //region ESPANSIONE E RIMOZIONE

    /**
     * Espansione con radicamento di default.
     *
     * @see #expand(Formula, int)
     */
    public Belief expand(Formula formula) {
        return expand(formula, DEFAULT_ENTRENCHMENT);
    }

    /**
     * Aggiunge in coda una nuova credenza senza alcun controllo di implicazione
     * o consistenza, anche se contraddice le credenze esistenti.
     *
     * @param formula formula da credere
     * @param entrenchment grado di radicamento
     * @return la credenza aggiunta
     * @throws MalformedFormulaException se la formula è mancante
     */
    public Belief expand(Formula formula, int entrenchment) {
        CNFFormula cnf = engine.getConverter().toCNF(formula);
        Belief belief = append(formula, cnf, entrenchment);
        modificationCount++;

        LOGGER.fine("Base espansa con: " + belief);
        return belief;
    }

    /**
     * Rimuove la prima credenza, in ordine di inserimento, la cui formula è
     * strutturalmente uguale a quella data. Le eventuali altre credenze uguali
     * restano nella base (vedi {@link #removeAll(Formula)}).
     *
     * VALIDAZIONI APPLICATE:
     * • Formula non null
     * • Almeno una credenza con formula strutturalmente uguale
     *
     * INVARIANTI:
     * • L'ordine relativo delle credenze restanti non cambia
     * • In caso di errore la base resta invariata
     *
     * @param formula formula da rimuovere
     * @return la credenza rimossa
     * @throws BeliefNotFoundException se nessuna credenza corrisponde
     * @throws MalformedFormulaException se la formula è mancante
     */
    public Belief remove(Formula formula) {
        int index = indexOf(formula);
        Belief removed = beliefs.remove(index);
        modificationCount++;

        LOGGER.fine("Credenza rimossa: " + removed);
        return removed;
    }

    /**
     * Rimuove tutte le credenze la cui formula è strutturalmente uguale a
     * quella data, qualunque sia il loro radicamento.
     *
     * VALIDAZIONI APPLICATE:
     * • Formula non null
     * • Almeno una credenza corrispondente (verificata prima di rimuovere)
     *
     * INVARIANTI:
     * • Dopo la chiamata nessuna credenza della base è uguale a formula
     * • L'ordine relativo delle credenze restanti non cambia
     *
     * @param formula formula da rimuovere
     * @return numero di credenze rimosse (almeno una)
     * @throws BeliefNotFoundException se nessuna credenza corrisponde
     * @throws MalformedFormulaException se la formula è mancante
     */
    public int removeAll(Formula formula) {
        indexOf(formula);
        int before = beliefs.size();
        beliefs.removeIf(belief -> belief.getFormula().equals(formula));
        int removed = before - beliefs.size();
        modificationCount++;

        LOGGER.info("Rimosse " + removed + " credenze uguali a: " + formula);
        return removed;
    }

    /**
     * Rimuove esattamente i record indicati (confronto per identità), tutti o
     * nessuno.
     *
     * @param toRemove credenze appartenenti a questa base
     * @throws BeliefNotFoundException se uno dei record non appartiene alla base
     */
    public void removeBeliefs(Collection<Belief> toRemove) {
        Set<Belief> targets = requireOwned(toRemove);
        if (targets.isEmpty()) {
            return;
        }

        beliefs.removeIf(targets::contains);
        modificationCount++;
        LOGGER.fine("Rimosse " + targets.size() + " credenze");
    }

    /**
     * Rimuove i record indicati e aggiunge in coda una nuova credenza in un
     * unico passo. La CNF è calcolata dal chiamante prima del commit, così
     * nessuna elaborazione lunga avviene a base parzialmente modificata.
     *
     * VALIDAZIONI APPLICATE:
     * • Tutti i record da rimuovere appartengono alla base
     * • Formula e CNF non null
     *
     * @param toRemove credenze appartenenti a questa base
     * @param formula formula da aggiungere
     * @param cnf forma normale congiuntiva di formula
     * @param entrenchment radicamento della nuova credenza
     * @return la credenza aggiunta
     * @throws BeliefNotFoundException se uno dei record non appartiene alla base
     * @throws MalformedFormulaException se formula o CNF mancano
     */
    public Belief replaceBeliefs(Collection<Belief> toRemove, Formula formula, CNFFormula cnf, int entrenchment) {
        if (formula == null || cnf == null) {
            throw new MalformedFormulaException("Formula da aggiungere o sua CNF mancante");
        }
        Set<Belief> targets = requireOwned(toRemove);

        beliefs.removeIf(targets::contains);
        Belief added = append(formula, cnf, entrenchment);
        modificationCount++;

        LOGGER.fine("Rimosse " + targets.size() + " credenze, aggiunta: " + added);
        return added;
    }

    /**
     * Svuota la base.
     */
    public void clear() {
        beliefs.clear();
        modificationCount++;
        LOGGER.info("Base di credenze svuotata");
    }

    //endregion

    //region AGGIORNAMENTO E INTERROGAZIONE

    /**
     * @return radicamento della prima credenza uguale a formula
     * @throws BeliefNotFoundException se assente
     */
    public int getEntrenchment(Formula formula) {
        return beliefs.get(indexOf(formula)).getEntrenchment();
    }

    /**
     * Sostituisce sul posto la prima credenza uguale a {@code oldFormula},
     * mantenendo posizione e numero d'ordine di inserimento.
     *
     * @return la nuova credenza
     * @throws BeliefNotFoundException se oldFormula è assente
     * @throws MalformedFormulaException se newFormula è mancante
     */
    public Belief update(Formula oldFormula, Formula newFormula, int entrenchment) {
        int index = indexOf(oldFormula);
        CNFFormula cnf = engine.getConverter().toCNF(newFormula);

        Belief previous = beliefs.get(index);
        Belief replacement = new Belief(newFormula, cnf, entrenchment, previous.getSequence());
        beliefs.set(index, replacement);
        modificationCount++;

        LOGGER.fine("Credenza aggiornata: " + previous + " → " + replacement);
        return replacement;
    }

    /**
     * Aggiornamento che mantiene il radicamento della credenza sostituita.
     */
    public Belief update(Formula oldFormula, Formula newFormula) {
        return update(oldFormula, newFormula, getEntrenchment(oldFormula));
    }

    public boolean contains(Formula formula) {
        return findIndex(formula) >= 0;
    }

    /**
     * Istantanea in sola lettura delle coppie (formula, radicamento), in ordine
     * di inserimento.
     */
    public List<Entry> show() {
        List<Entry> entries = new ArrayList<>();
        for (Belief belief : beliefs) {
            entries.add(new Entry(belief.getFormula(), belief.getEntrenchment()));
        }
        return Collections.unmodifiableList(entries);
    }

    /**
     * @return vista immutabile delle credenze, in ordine di inserimento
     */
    public List<Belief> beliefs() {
        return Collections.unmodifiableList(new ArrayList<>(beliefs));
    }

    /**
     * @return congiunzione delle forme CNF di tutte le credenze
     */
    public CNFFormula clauses() {
        List<CNFFormula> formulas = new ArrayList<>();
        for (Belief belief : beliefs) {
            formulas.add(belief.getCnf());
        }
        return CNFFormula.conjunction(formulas);
    }

    public int size() {
        return beliefs.size();
    }

    public boolean isEmpty() {
        return beliefs.isEmpty();
    }

    /**
     * @return numero di modifiche riuscite, utile per sapere se un'operazione
     *         interrotta ha comunque modificato la base
     */
    public long getModificationCount() {
        return modificationCount;
    }

    public ResolutionEngine getEngine() {
        return engine;
    }

    //endregion

    //region IMPLICAZIONE

    /**
     * @return true se la base implica la formula
     */
    public boolean entails(Formula formula) {
        return engine.entails(clauses(), formula);
    }

    /**
     * Verifica d'implicazione con prova e statistiche.
     */
    public ResolutionResult prove(Formula formula) {
        return engine.prove(clauses(), formula);
    }

    /**
     * @return true se la base non permette di derivare la contraddizione
     */
    public boolean isConsistent() {
        return engine.isSatisfiable(clauses());
    }

    //endregion

    //region SUPPORTO

    private Belief append(Formula formula, CNFFormula cnf, int entrenchment) {
        Belief belief = new Belief(formula, cnf, entrenchment, nextSequence++);
        beliefs.add(belief);
        return belief;
    }

    /**
     * Verifica che tutti i record appartengano alla base.
     *
     * @return i record come insieme per identità
     */
    private Set<Belief> requireOwned(Collection<Belief> toRemove) {
        if (toRemove == null) {
            throw new IllegalArgumentException("Collezione credenze da rimuovere non può essere null");
        }
        Set<Belief> targets = Collections.newSetFromMap(new IdentityHashMap<>());
        targets.addAll(toRemove);

        Set<Belief> present = Collections.newSetFromMap(new IdentityHashMap<>());
        present.addAll(beliefs);
        for (Belief target : targets) {
            if (!present.contains(target)) {
                throw new BeliefNotFoundException(target.getFormula());
            }
        }
        return targets;
    }

    private int indexOf(Formula formula) {
        int index = findIndex(formula);
        if (index < 0) {
            throw new BeliefNotFoundException(formula);
        }
        return index;
    }

    private int findIndex(Formula formula) {
        if (formula == null) {
            throw new MalformedFormulaException("Formula da cercare mancante");
        }
        for (int i = 0; i < beliefs.size(); i++) {
            if (beliefs.get(i).getFormula().equals(formula)) {
                return i;
            }
        }
        return -1;
    }

    //endregion

    /**
     * Voce dell'istantanea restituita da {@link #show()}: formula originale e
     * radicamento. Immutabile.
     */
    public static final class Entry {

        private final Formula formula;
        private final int entrenchment;

        public Entry(Formula formula, int entrenchment) {
            if (formula == null) {
                throw new IllegalArgumentException("Formula della voce non può essere null");
            }
            this.formula = formula;
            this.entrenchment = entrenchment;
        }

        public Formula getFormula() {
            return formula;
        }

        public int getEntrenchment() {
            return entrenchment;
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj) return true;
            if (obj == null || getClass() != obj.getClass()) return false;

            Entry other = (Entry) obj;
            return entrenchment == other.entrenchment && formula.equals(other.formula);
        }

        @Override
        public int hashCode() {
            return 31 * formula.hashCode() + entrenchment;
        }

        @Override
        public String toString() {
            return formula + " [radicamento: " + entrenchment + "]";
        }
    }
}
