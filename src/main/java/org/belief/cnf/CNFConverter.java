package org.belief.cnf;

import org.belief.formula.Formula;
import org.belief.formula.MalformedFormulaException;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * CONVERTITORE CNF - Trasformazione di formule arbitrarie in Forma Normale Congiuntiva
 *
 * Applica in sequenza le trasformazioni che preservano l'equivalenza logica e
 * produce un insieme di clausole pronto per la risoluzione.
 *
 * PIPELINE TRASFORMAZIONE:
 * 1. Eliminazione biimplicazioni: A <<>> B → (A >> B) & (B >> A)
 * 2. Eliminazione implicazioni: A >> B → ~A | B
 * 3. Normalizzazione negazioni (leggi di De Morgan, doppia negazione)
 * 4. Distribuzione OR su AND
 * 5. Appiattimento in insieme di clausole (eventuale rimozione tautologie)
 *
 * Le clausole tautologiche sono mantenute salvo richiesta esplicita di
 * semplificazione: la correttezza della risoluzione non ne dipende.
 */
public class CNFConverter {

    private static final Logger LOGGER = Logger.getLogger(CNFConverter.class.getName());

    /** Se true, le clausole tautologiche vengono scartate */
    private final boolean simplify;

    //region COSTRUZIONE

    public CNFConverter() {
        this(false);
    }

    /**
     * @param simplify true per scartare le clausole tautologiche dal risultato
     */
    public CNFConverter(boolean simplify) {
        this.simplify = simplify;
    }

    //endregion

    //region INTERFACCIA PUBBLICA CONVERSIONE CNF

    /**
     * METODO PRINCIPALE - Converte la formula in Forma Normale Congiuntiva.
     *
     * @param formula albero della formula da convertire
     * @return insieme di clausole logicamente equivalente alla formula
     * @throws MalformedFormulaException se l'albero è mancante
     */
    public CNFFormula toCNF(Formula formula) {
        return toCNF(formula, simplify);
    }

    /**
     * Variante con scelta esplicita della semplificazione.
     *
     * @param formula albero della formula da convertire
     * @param dropTautologies true per scartare le clausole tautologiche
     * @return formula CNF equivalente
     * @throws MalformedFormulaException se l'albero è mancante
     * @throws ConversionInterruptedException se il thread viene interrotto durante la distribuzione
     */
    public CNFFormula toCNF(Formula formula, boolean dropTautologies) {
        if (formula == null) {
            throw new MalformedFormulaException("Albero della formula mancante: impossibile convertire in CNF");
        }

        LOGGER.fine("Inizio conversione CNF per: " + formula);

        // Fasi 1-2: eliminazione operatori derivati
        Formula result = eliminateImplications(formula);
        LOGGER.finest("Dopo eliminazione implicazioni: " + result);

        // Fase 3: forma normale negativa
        result = normalizeNegations(result);
        LOGGER.finest("Dopo normalizzazione negazioni: " + result);

        // Fasi 4-5: distribuzione e appiattimento
        List<Set<Literal>> clauseSets = distributeOrOverAnd(result);

        Set<Clause> clauses = new LinkedHashSet<>();
        for (Set<Literal> literals : clauseSets) {
            Clause clause = Clause.of(literals);
            if (dropTautologies && clause.isTautology()) {
                LOGGER.finest("Clausola tautologica scartata: " + clause);
                continue;
            }
            clauses.add(clause);
        }

        CNFFormula cnf = new CNFFormula(clauses);
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine(String.format("Conversione CNF completata: %s (%d clausole)", cnf, cnf.size()));
        }
        return cnf;
    }

    //endregion

    //region ELIMINAZIONE IMPLICAZIONI E BIIMPLICAZIONI

    /**
     * Riscrive ricorsivamente IMPLIES e IFF in termini di NOT, AND, OR.
     *
     * TRASFORMAZIONI APPLICATE:
     * • A <<>> B → (~A | B) & (~B | A)
     * • A >> B → ~A | B
     */
    private Formula eliminateImplications(Formula formula) {
        return switch (formula.type) {
            case ATOM -> formula;

            case NOT -> Formula.not(eliminateImplications(formula.operand));

            case AND -> Formula.and(eliminateAll(formula.operands));

            case OR -> Formula.or(eliminateAll(formula.operands));

            case IMPLIES -> {
                Formula antecedent = eliminateImplications(formula.left());
                Formula consequent = eliminateImplications(formula.right());
                yield Formula.or(Formula.not(antecedent), consequent);
            }

            case IFF -> {
                Formula left = eliminateImplications(formula.left());
                Formula right = eliminateImplications(formula.right());
                yield Formula.and(
                        Formula.or(Formula.not(left), right),
                        Formula.or(Formula.not(right), left));
            }
        };
    }

    private List<Formula> eliminateAll(List<Formula> operands) {
        List<Formula> rewritten = new ArrayList<>();
        for (Formula operand : operands) {
            rewritten.add(eliminateImplications(operand));
        }
        return rewritten;
    }

    //endregion

    //region NORMALIZZAZIONE NEGAZIONI (LEGGI DE MORGAN)

    /**
     * Spinge le negazioni verso le foglie. Richiede una formula priva di
     * IMPLIES e IFF.
     *
     * TRASFORMAZIONI APPLICATE:
     * • ~(A | B) → ~A & ~B
     * • ~(A & B) → ~A | ~B
     * • ~~A → A
     */
    private Formula normalizeNegations(Formula formula) {
        return switch (formula.type) {
            case ATOM -> formula;

            case NOT -> applyNegationTransformation(formula.operand);

            case AND -> Formula.and(normalizeAll(formula.operands));

            case OR -> Formula.or(normalizeAll(formula.operands));

            case IMPLIES, IFF -> throw new IllegalStateException(
                    "Operatore " + formula.type + " non eliminato prima della normalizzazione");
        };
    }

    /**
     * Normalizza la negazione di {@code inner}.
     */
    private Formula applyNegationTransformation(Formula inner) {
        return switch (inner.type) {
            // ~A rimane ~A (letterale)
            case ATOM -> Formula.not(inner);

            // ~~A → A
            case NOT -> normalizeNegations(inner.operand);

            case AND -> Formula.or(negateAll(inner.operands));

            case OR -> Formula.and(negateAll(inner.operands));

            case IMPLIES, IFF -> throw new IllegalStateException(
                    "Operatore " + inner.type + " non eliminato prima della normalizzazione");
        };
    }

    private List<Formula> normalizeAll(List<Formula> operands) {
        List<Formula> normalized = new ArrayList<>();
        for (Formula operand : operands) {
            normalized.add(normalizeNegations(operand));
        }
        return normalized;
    }

    private List<Formula> negateAll(List<Formula> operands) {
        List<Formula> negated = new ArrayList<>();
        for (Formula operand : operands) {
            negated.add(applyNegationTransformation(operand));
        }
        return negated;
    }

    //endregion

    //region DISTRIBUZIONE OR SU AND

    /**
     * Distribuisce OR su AND producendo direttamente gli insiemi di letterali
     * delle clausole. Richiede una formula in forma normale negativa.
     *
     * PROPRIETÀ DISTRIBUTIVA APPLICATA:
     * • A | (B & C) → (A | B) & (A | C)
     * • (A & B) | (C & D) → (A | C) & (A | D) & (B | C) & (B | D)
     *
     * @return clausole come insiemi di letterali
     */
    private List<Set<Literal>> distributeOrOverAnd(Formula nnf) {
        return switch (nnf.type) {
            case ATOM -> singleClause(Literal.positive(nnf.atom));

            case NOT -> {
                if (nnf.operand.type != Formula.Type.ATOM) {
                    throw new IllegalStateException("Negazione non atomica trovata durante distribuzione: " + nnf);
                }
                yield singleClause(Literal.negative(nnf.operand.atom));
            }

            case AND -> {
                // Congiunzione: unione delle clausole degli operandi
                List<Set<Literal>> clauses = new ArrayList<>();
                for (Formula operand : nnf.operands) {
                    clauses.addAll(distributeOrOverAnd(operand));
                }
                yield clauses;
            }

            case OR -> executeDistributionForOrNode(nnf);

            case IMPLIES, IFF -> throw new IllegalStateException(
                    "Operatore " + nnf.type + " non eliminato prima della distribuzione");
        };
    }

    /**
     * Prodotto cartesiano delle clausole degli operandi di un nodo OR.
     */
    private List<Set<Literal>> executeDistributionForOrNode(Formula orNode) {
        List<Set<Literal>> product = new ArrayList<>();
        product.add(new TreeSet<>());

        for (Formula operand : orNode.operands) {
            List<Set<Literal>> operandClauses = distributeOrOverAnd(operand);
            List<Set<Literal>> extended = new ArrayList<>();

            for (Set<Literal> partial : product) {
                checkInterrupted();
                for (Set<Literal> operandClause : operandClauses) {
                    Set<Literal> combined = new TreeSet<>(partial);
                    combined.addAll(operandClause);
                    extended.add(combined);
                }
            }
            product = extended;
        }

        return product;
    }

    /**
     * La distribuzione può produrre un numero esponenziale di clausole: il
     * prodotto cartesiano si ferma se il thread viene interrotto.
     */
    private static void checkInterrupted() {
        if (Thread.currentThread().isInterrupted()) {
            throw new ConversionInterruptedException("Conversione CNF interrotta");
        }
    }

    private static List<Set<Literal>> singleClause(Literal literal) {
        List<Set<Literal>> clauses = new ArrayList<>();
        Set<Literal> literals = new TreeSet<>();
        literals.add(literal);
        clauses.add(literals);
        return clauses;
    }

    //endregion
}
