package org.belief.base;

import org.belief.cnf.CNFFormula;
import org.belief.formula.Formula;

/**
 * CREDENZA - Formula creduta con il suo grado di radicamento
 *
 * Record immutabile posseduto da una sola {@link BeliefBase}. Conserva la
 * formula originale per la visualizzazione e la sua forma CNF per il
 * ragionamento.
 *
 * UGUAGLIANZA: due credenze sono uguali se coincidono formula, CNF, radicamento
 * e numero d'ordine. La base confronta però i propri record per identità.
 */
public final class Belief {

    //region ATTRIBUTI

    /**
     * Formula come scritta dall'utente.
     * Invariante: non null.
     */
    private final Formula formula;

    /**
     * Forma normale congiuntiva di {@link #formula}.
     * Invariante: non null, logicamente equivalente alla formula.
     */
    private final CNFFormula cnf;

    /**
     * Grado di radicamento: più basso significa rimossa prima in contrazione.
     */
    private final int entrenchment;

    /**
     * Numero d'ordine assegnato dalla base all'inserimento, usato per gli
     * spareggi a parità di radicamento.
     */
    private final long sequence;

    //endregion

    /**
     * VALIDAZIONI APPLICATE:
     * • Formula e CNF non null
     *
     * @param formula formula originale
     * @param cnf forma normale congiuntiva della formula
     * @param entrenchment grado di radicamento
     * @param sequence numero d'ordine di inserimento
     * @throws IllegalArgumentException se formula o CNF mancano
     */
    public Belief(Formula formula, CNFFormula cnf, int entrenchment, long sequence) {
        if (formula == null || cnf == null) {
            throw new IllegalArgumentException("Formula e CNF della credenza non possono essere null");
        }
        this.formula = formula;
        this.cnf = cnf;
        this.entrenchment = entrenchment;
        this.sequence = sequence;
    }

    //region ACCESSO

    public Formula getFormula() {
        return formula;
    }

    public CNFFormula getCnf() {
        return cnf;
    }

    public int getEntrenchment() {
        return entrenchment;
    }

    public long getSequence() {
        return sequence;
    }

    //endregion

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        Belief other = (Belief) obj;
        return entrenchment == other.entrenchment
                && sequence == other.sequence
                && formula.equals(other.formula)
                && cnf.equals(other.cnf);
    }

    @Override
    public int hashCode() {
        int result = formula.hashCode();
        result = 31 * result + cnf.hashCode();
        result = 31 * result + entrenchment;
        result = 31 * result + Long.hashCode(sequence);
        return result;
    }

    @Override
    public String toString() {
        return formula + " [radicamento: " + entrenchment + "]";
    }
}
