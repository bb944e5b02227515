package org.belief.formula;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * FORMULA PROPOSIZIONALE - Albero sintattico immutabile
 *
 * Rappresenta una formula della logica proposizionale come albero con un insieme
 * chiuso di tipi di nodo. Ogni operazione sull'albero (normalizzazione, stampa,
 * valutazione) esegue uno switch esaustivo su {@link Type}.
 *
 * TIPI DI NODO:
 * - ATOM: variabile proposizionale (p, q, rain, ...)
 * - NOT: negazione unaria (~A)
 * - AND / OR: congiunzione e disgiunzione n-arie (A & B & C)
 * - IMPLIES: implicazione binaria ordinata (A >> B)
 * - IFF: biimplicazione binaria simmetrica (A <<>> B)
 *
 * INVARIANTI:
 * - Nessun operando null, nessun nome di atomo vuoto o non alfanumerico
 * - Struttura immutabile: le formule possono essere condivise liberamente
 * - Uguaglianza strutturale commutativa per AND, OR e IFF
 */
public final class Formula {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    //region TIPI E STRUTTURA DATI

    /**
     * Tipi di nodi supportati nella rappresentazione ad albero.
     */
    public enum Type {
        ATOM,       // Variabile atomica: p, q, r
        NOT,        // Negazione: ~A
        AND,        // Congiunzione: A & B
        OR,         // Disgiunzione: A | B
        IMPLIES,    // Implicazione: A >> B
        IFF         // Biimplicazione: A <<>> B
    }

    /** Tipo del nodo corrente nell'albero */
    public final Type type;

    /** Nome della variabile atomica (solo per nodi ATOM) */
    public final String atom;

    /** Operando singolo (solo per nodi NOT) */
    public final Formula operand;

    /** Operandi (AND e OR: almeno uno; IMPLIES e IFF: esattamente due) */
    public final List<Formula> operands;

    //endregion

    //region COSTRUZIONE

    private Formula(Type type, String atom, Formula operand, List<Formula> operands) {
        this.type = type;
        this.atom = atom;
        this.operand = operand;
        this.operands = operands;
    }

    /**
     * Costruisce nodo foglia per variabile atomica.
     *
     * @param name nome della variabile proposizionale (identificatore alfanumerico)
     * @throws MalformedFormulaException se il nome è null, vuoto o non è un identificatore
     */
    public static Formula atom(String name) {
        if (name == null || name.trim().isEmpty()) {
            throw new MalformedFormulaException("Nome variabile atomica non può essere null o vuoto");
        }
        String trimmed = name.trim();
        if (!IDENTIFIER.matcher(trimmed).matches()) {
            throw new MalformedFormulaException("Nome variabile atomica non valido: '" + trimmed + "'");
        }
        return new Formula(Type.ATOM, trimmed, null, null);
    }

    /**
     * Costruisce nodo unario di negazione.
     *
     * @param operand sottoformula da negare
     * @throws MalformedFormulaException se operand è null
     */
    public static Formula not(Formula operand) {
        if (operand == null) {
            throw new MalformedFormulaException("Operando per negazione non può essere null");
        }
        return new Formula(Type.NOT, null, operand, null);
    }

    public static Formula and(Formula... operands) {
        return nary(Type.AND, operands == null ? null : Arrays.asList(operands));
    }

    public static Formula and(List<Formula> operands) {
        return nary(Type.AND, operands);
    }

    public static Formula or(Formula... operands) {
        return nary(Type.OR, operands == null ? null : Arrays.asList(operands));
    }

    public static Formula or(List<Formula> operands) {
        return nary(Type.OR, operands);
    }

    /**
     * Costruisce l'implicazione {@code antecedent >> consequent}.
     */
    public static Formula implies(Formula antecedent, Formula consequent) {
        return binary(Type.IMPLIES, antecedent, consequent);
    }

    /**
     * Costruisce la biimplicazione {@code left <<>> right}.
     */
    public static Formula iff(Formula left, Formula right) {
        return binary(Type.IFF, left, right);
    }

    private static Formula nary(Type type, List<Formula> operands) {
        if (operands == null || operands.isEmpty()) {
            throw new MalformedFormulaException("Lista operandi " + type + " non può essere null o vuota");
        }
        for (Formula operand : operands) {
            if (operand == null) {
                throw new MalformedFormulaException("Lista operandi " + type + " non può contenere elementi null");
            }
        }
        return new Formula(type, null, null, Collections.unmodifiableList(new ArrayList<>(operands)));
    }

    private static Formula binary(Type type, Formula left, Formula right) {
        if (left == null || right == null) {
            throw new MalformedFormulaException("Operandi " + type + " non possono essere null");
        }
        return new Formula(type, null, null, List.of(left, right));
    }

    //endregion

    //region ACCESSO E UTILITÀ

    /**
     * @return la negazione di questa formula, {@code ~this}
     */
    public Formula negate() {
        return not(this);
    }

    /**
     * Primo operando di un nodo binario (antecedente per IMPLIES).
     */
    public Formula left() {
        requireBinary();
        return operands.get(0);
    }

    /**
     * Secondo operando di un nodo binario (conseguente per IMPLIES).
     */
    public Formula right() {
        requireBinary();
        return operands.get(1);
    }

    private void requireBinary() {
        if (type != Type.IMPLIES && type != Type.IFF) {
            throw new IllegalStateException("Nodo " + type + " non è binario");
        }
    }

    /**
     * Raccoglie le variabili atomiche distinte della formula, in ordine alfabetico.
     */
    public Set<String> atoms() {
        Set<String> variables = new TreeSet<>();
        collectAtoms(variables);
        return variables;
    }

    private void collectAtoms(Set<String> variables) {
        switch (type) {
            case ATOM -> variables.add(atom);
            case NOT -> operand.collectAtoms(variables);
            case AND, OR, IMPLIES, IFF -> {
                for (Formula child : operands) {
                    child.collectAtoms(variables);
                }
            }
        }
    }

    /**
     * Valuta la formula sotto un assegnamento di verità.
     * Gli atomi assenti dall'assegnamento valgono false.
     *
     * @param assignment mappa atomo → valore di verità
     * @return valore di verità della formula
     */
    public boolean evaluate(Map<String, Boolean> assignment) {
        return switch (type) {
            case ATOM -> Boolean.TRUE.equals(assignment.get(atom));
            case NOT -> !operand.evaluate(assignment);
            case AND -> {
                for (Formula child : operands) {
                    if (!child.evaluate(assignment)) {
                        yield false;
                    }
                }
                yield true;
            }
            case OR -> {
                for (Formula child : operands) {
                    if (child.evaluate(assignment)) {
                        yield true;
                    }
                }
                yield false;
            }
            case IMPLIES -> !left().evaluate(assignment) || right().evaluate(assignment);
            case IFF -> left().evaluate(assignment) == right().evaluate(assignment);
        };
    }

    /**
     * Calcola la profondità massima dell'albero.
     */
    public int depth() {
        return switch (type) {
            case ATOM -> 0;
            case NOT -> 1 + operand.depth();
            case AND, OR, IMPLIES, IFF -> {
                int maxDepth = 0;
                for (Formula child : operands) {
                    maxDepth = Math.max(maxDepth, child.depth());
                }
                yield 1 + maxDepth;
            }
        };
    }

    //endregion

    //region UGUAGLIANZA E HASH

    /**
     * Uguaglianza strutturale. AND e OR confrontano gli operandi come insiemi,
     * IFF come coppia non ordinata, IMPLIES come coppia ordinata.
     */
    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        Formula other = (Formula) obj;
        if (this.type != other.type) return false;

        return switch (type) {
            case ATOM -> atom.equals(other.atom);
            case NOT -> operand.equals(other.operand);
            case AND, OR -> new HashSet<>(operands).equals(new HashSet<>(other.operands));
            case IMPLIES -> operands.equals(other.operands);
            case IFF -> (left().equals(other.left()) && right().equals(other.right()))
                    || (left().equals(other.right()) && right().equals(other.left()));
        };
    }

    @Override
    public int hashCode() {
        int result = type.hashCode();

        switch (type) {
            case ATOM -> result = 31 * result + atom.hashCode();
            case NOT -> result = 31 * result + operand.hashCode();
            case AND, OR -> result = 31 * result + new HashSet<>(operands).hashCode();
            case IMPLIES -> result = 31 * result + operands.hashCode();
            case IFF -> result = 31 * result + left().hashCode() + right().hashCode();
        }

        return result;
    }

    //endregion

    //region RAPPRESENTAZIONE TESTUALE

    /**
     * Rende la formula nella sintassi di superficie ({@code ~ & | >> <<>>}),
     * con le sole parentesi necessarie perché il testo rianalizzato produca
     * una formula uguale.
     */
    @Override
    public String toString() {
        return switch (type) {
            case ATOM -> atom;
            case NOT -> "~" + wrap(operand, precedence() > operand.precedence());
            case AND -> join(" & ");
            case OR -> join(" | ");
            case IMPLIES -> joinLeftAssociative(" >> ");
            case IFF -> joinLeftAssociative(" <<>> ");
        };
    }

    private String join(String separator) {
        StringBuilder result = new StringBuilder();
        for (int i = 0; i < operands.size(); i++) {
            if (i > 0) {
                result.append(separator);
            }
            Formula child = operands.get(i);
            result.append(wrap(child, child.precedence() <= precedence()));
        }
        return result.toString();
    }

    private String joinLeftAssociative(String separator) {
        Formula left = left();
        Formula right = right();
        return wrap(left, left.precedence() < precedence())
                + separator
                + wrap(right, right.precedence() <= precedence());
    }

    private static String wrap(Formula formula, boolean parenthesize) {
        return parenthesize ? "(" + formula + ")" : formula.toString();
    }

    private int precedence() {
        return switch (type) {
            case IFF -> 1;
            case IMPLIES -> 2;
            case OR -> 3;
            case AND -> 4;
            case NOT -> 5;
            case ATOM -> 6;
        };
    }

    //endregion
}
