package org.belief.cnf;

/**
 * LETTERALE - Variabile atomica con polarità
 *
 * Unità minima di una clausola: {@code p} (positivo) oppure {@code ~p} (negato).
 * Immutabile, confrontabile e utilizzabile come chiave in insiemi ordinati.
 *
 * ORDINAMENTO:
 * • Per nome della variabile (ordine alfabetico)
 * • A parità di variabile, il positivo precede il negato
 */
public final class Literal implements Comparable<Literal> {

    //region ATTRIBUTI

    /**
     * Nome della variabile proposizionale.
     * Invariante: non null e non vuoto.
     */
    private final String atom;

    /**
     * Polarità del letterale.
     * • true: letterale positivo (p)
     * • false: letterale negato (~p)
     */
    private final boolean positive;

    //endregion

    //region COSTRUZIONE

    /**
     * Costruisce un letterale validando il nome della variabile.
     *
     * VALIDAZIONI APPLICATE:
     * • Nome variabile non null e non vuoto
     *
     * @param atom nome della variabile proposizionale
     * @param positive true per il letterale positivo, false per quello negato
     * @throws IllegalArgumentException se il nome è null o vuoto
     */
    public Literal(String atom, boolean positive) {
        if (atom == null || atom.trim().isEmpty()) {
            throw new IllegalArgumentException("Nome variabile del letterale non può essere null o vuoto");
        }
        this.atom = atom;
        this.positive = positive;
    }

    public static Literal positive(String atom) {
        return new Literal(atom, true);
    }

    public static Literal negative(String atom) {
        return new Literal(atom, false);
    }

    //endregion

    //region OPERAZIONI

    /**
     * @return il letterale complementare (stesso atomo, polarità opposta)
     */
    public Literal complement() {
        return new Literal(atom, !positive);
    }

    /**
     * @return true se other ha la stessa variabile e polarità opposta
     */
    public boolean isComplementOf(Literal other) {
        return other != null && atom.equals(other.atom) && positive != other.positive;
    }

    //endregion

    //region ACCESSO

    /**
     * @return nome della variabile proposizionale
     */
    public String getAtom() {
        return atom;
    }

    /**
     * @return true se il letterale è positivo
     */
    public boolean isPositive() {
        return positive;
    }

    //endregion

    //region CONFRONTO E RAPPRESENTAZIONE

    @Override
    public int compareTo(Literal other) {
        int byAtom = atom.compareTo(other.atom);
        if (byAtom != 0) {
            return byAtom;
        }
        return Boolean.compare(other.positive, positive);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        Literal other = (Literal) obj;
        return positive == other.positive && atom.equals(other.atom);
    }

    @Override
    public int hashCode() {
        return 31 * atom.hashCode() + Boolean.hashCode(positive);
    }

    @Override
    public String toString() {
        return positive ? atom : "~" + atom;
    }

    //endregion
}
