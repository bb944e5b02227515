package org.belief.cnf;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.StringJoiner;
import java.util.TreeSet;

/**
 * CLAUSOLA - Insieme di letterali interpretato come disgiunzione
 *
 * I duplicati collassano. La clausola vuota [] rappresenta la contraddizione ed
 * è l'obiettivo della refutazione. I letterali sono mantenuti ordinati per avere
 * una rappresentazione testuale stabile.
 *
 * OPERAZIONI PER LA RISOLUZIONE:
 * • Riconoscimento tautologie (p | ~p | ...)
 * • Sussunzione (inclusione tra insiemi di letterali)
 * • Calcolo di tutti i risolventi con un'altra clausola
 */
public final class Clause {

    /** La clausola vuota [] (falso). */
    public static final Clause EMPTY = new Clause(Collections.emptyList());

    /**
     * Letterali della clausola, ordinati secondo {@link Literal#compareTo(Literal)}.
     * Invariante: insieme immutabile, senza elementi null.
     */
    private final SortedSet<Literal> literals;

    //region COSTRUZIONE

    /**
     * Costruisce la clausola copiando i letterali in un insieme ordinato.
     *
     * VALIDAZIONI APPLICATE:
     * • Collezione non null
     * • Nessun letterale null (verificato prima della copia ordinata)
     *
     * @param literals letterali della clausola, anche con ripetizioni
     * @throws IllegalArgumentException se la collezione o un letterale è null
     */
    private Clause(Collection<Literal> literals) {
        if (literals == null) {
            throw new IllegalArgumentException("Insieme letterali non può essere null");
        }
        for (Literal literal : literals) {
            if (literal == null) {
                throw new IllegalArgumentException("Clausola non può contenere letterali null");
            }
        }
        this.literals = Collections.unmodifiableSortedSet(new TreeSet<>(literals));
    }

    public static Clause of(Literal... literals) {
        if (literals == null) {
            throw new IllegalArgumentException("Insieme letterali non può essere null");
        }
        return new Clause(Arrays.asList(literals));
    }

    public static Clause of(Collection<Literal> literals) {
        return new Clause(literals);
    }

    //endregion

    //region OPERAZIONI

    public boolean isEmpty() {
        return literals.isEmpty();
    }

    public int size() {
        return literals.size();
    }

    public boolean contains(Literal literal) {
        return literal != null && literals.contains(literal);
    }

    /**
     * Una clausola è tautologica se contiene un letterale e il suo complemento.
     * La clausola vuota non è tautologica.
     */
    public boolean isTautology() {
        for (Literal literal : literals) {
            if (literal.isPositive() && literals.contains(literal.complement())) {
                return true;
            }
        }
        return false;
    }

    /**
     * Verifica la sussunzione: questa clausola sussume {@code other} se tutti i
     * suoi letterali compaiono in {@code other}. La clausola vuota sussume
     * qualunque clausola.
     */
    public boolean subsumes(Clause other) {
        return literals.size() <= other.literals.size() && other.literals.containsAll(literals);
    }

    /**
     * Calcola tutti i risolventi con un'altra clausola, uno per ogni coppia di
     * letterali complementari: (C1 \ {l}) ∪ (C2 \ {~l}).
     *
     * @param other seconda clausola
     * @return risolventi, lista vuota se non ci sono letterali complementari
     */
    public List<Clause> resolveWith(Clause other) {
        List<Clause> resolvents = new ArrayList<>();
        for (Literal literal : literals) {
            Literal complement = literal.complement();
            if (!other.literals.contains(complement)) {
                continue;
            }
            List<Literal> resolvent = new ArrayList<>();
            for (Literal ownLiteral : literals) {
                if (!ownLiteral.equals(literal)) {
                    resolvent.add(ownLiteral);
                }
            }
            for (Literal otherLiteral : other.literals) {
                if (!otherLiteral.equals(complement)) {
                    resolvent.add(otherLiteral);
                }
            }
            resolvents.add(new Clause(resolvent));
        }
        return resolvents;
    }

    //endregion

    //region ACCESSO

    /**
     * @return vista immutabile dei letterali, in ordine
     */
    public SortedSet<Literal> getLiterals() {
        return literals;
    }

    //endregion

    //region CONFRONTO E RAPPRESENTAZIONE

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        return literals.equals(((Clause) obj).literals);
    }

    @Override
    public int hashCode() {
        return literals.hashCode();
    }

    @Override
    public String toString() {
        if (literals.isEmpty()) {
            return "[]";
        }
        if (literals.size() == 1) {
            return literals.first().toString();
        }
        StringJoiner joiner = new StringJoiner(" | ", "(", ")");
        for (Literal literal : literals) {
            joiner.add(literal.toString());
        }
        return joiner.toString();
    }

    //endregion
}
