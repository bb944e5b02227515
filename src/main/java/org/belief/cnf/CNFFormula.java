package org.belief.cnf;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.StringJoiner;
import java.util.TreeSet;

/**
 * FORMULA CNF - Congiunzione immutabile di clausole
 *
 * Rappresentazione insiemistica della Forma Normale Congiuntiva: associatività,
 * commutatività e idempotenza di AND e OR sono garantite dalla struttura stessa.
 * L'insieme vuoto di clausole è la tautologia (TRUE).
 *
 * INVARIANTI MANTENUTE:
 * - Insieme clausole immutabile dopo costruzione
 * - Ordine di inserimento preservato per output riproducibile
 * - Nessuna clausola null
 */
public final class CNFFormula {

    /** Congiunzione vuota: sempre vera. */
    public static final CNFFormula TRUE = new CNFFormula(Collections.emptySet());

    private final Set<Clause> clauses;

    //region COSTRUZIONE

    public CNFFormula(Collection<Clause> clauses) {
        if (clauses == null) {
            throw new IllegalArgumentException("Collezione clausole non può essere null");
        }
        if (clauses.contains(null)) {
            throw new IllegalArgumentException("Formula CNF non può contenere clausole null");
        }
        this.clauses = Collections.unmodifiableSet(new LinkedHashSet<>(clauses));
    }

    public static CNFFormula of(Clause... clauses) {
        return new CNFFormula(Arrays.asList(clauses));
    }

    /**
     * Congiunge più formule CNF in un'unica formula (unione delle clausole).
     */
    public static CNFFormula conjunction(Collection<CNFFormula> formulas) {
        Set<Clause> union = new LinkedHashSet<>();
        for (CNFFormula formula : formulas) {
            union.addAll(formula.clauses);
        }
        return new CNFFormula(union);
    }

    //endregion

    //region OPERAZIONI

    public CNFFormula union(CNFFormula other) {
        Set<Clause> union = new LinkedHashSet<>(clauses);
        union.addAll(other.clauses);
        return new CNFFormula(union);
    }

    /**
     * @return copia della formula senza clausole tautologiche
     */
    public CNFFormula withoutTautologies() {
        Set<Clause> kept = new LinkedHashSet<>();
        for (Clause clause : clauses) {
            if (!clause.isTautology()) {
                kept.add(clause);
            }
        }
        return new CNFFormula(kept);
    }

    public boolean containsEmptyClause() {
        return clauses.contains(Clause.EMPTY);
    }

    /**
     * Variabili atomiche distinte, in ordine alfabetico.
     */
    public Set<String> atoms() {
        Set<String> atoms = new TreeSet<>();
        for (Clause clause : clauses) {
            for (Literal literal : clause.getLiterals()) {
                atoms.add(literal.getAtom());
            }
        }
        return atoms;
    }

    /**
     * Valuta la congiunzione sotto un assegnamento; atomi assenti valgono false.
     */
    public boolean evaluate(Map<String, Boolean> assignment) {
        for (Clause clause : clauses) {
            boolean satisfied = false;
            for (Literal literal : clause.getLiterals()) {
                boolean value = Boolean.TRUE.equals(assignment.get(literal.getAtom()));
                if (value == literal.isPositive()) {
                    satisfied = true;
                    break;
                }
            }
            if (!satisfied) {
                return false;
            }
        }
        return true;
    }

    //endregion

    //region INTERFACCIA PUBBLICA

    /**
     * @return vista immutabile delle clausole, in ordine di inserimento
     */
    public Set<Clause> clauses() {
        return clauses;
    }

    public int size() {
        return clauses.size();
    }

    public boolean isEmpty() {
        return clauses.isEmpty();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        return clauses.equals(((CNFFormula) obj).clauses);
    }

    @Override
    public int hashCode() {
        return clauses.hashCode();
    }

    @Override
    public String toString() {
        if (clauses.isEmpty()) {
            return "TRUE";
        }
        StringJoiner joiner = new StringJoiner(" & ");
        for (Clause clause : clauses) {
            joiner.add(clause.toString());
        }
        return joiner.toString();
    }

    //endregion
}
