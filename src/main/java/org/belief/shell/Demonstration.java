package org.belief.shell;

import org.belief.base.BeliefBase;
import org.belief.formula.Formula;
import org.belief.parser.FormulaReader;
import org.belief.resolution.ResolutionEngine;
import org.belief.revision.ContractionResult;
import org.belief.revision.RevisionEngine;

import java.io.PrintStream;

/**
 * DIMOSTRAZIONE - Scenari guidati sulle operazioni principali
 *
 * 1. Rappresentazione: espansione, aggiornamento, rimozione, radicamento, CNF
 * 2. Implicazione per risoluzione
 * 3. Contrazione guidata dal radicamento
 * 4. Espansione con credenze contraddittorie
 * 5. Revisione completa (contrazione + espansione)
 *
 * Ogni scenario lavora su una base nuova.
 */
public class Demonstration {

    private static final String SEPARATOR = "=".repeat(50);

    private final PrintStream out;
    private final ResolutionEngine engine;
    private final RevisionEngine revision;

    public Demonstration(PrintStream out) {
        this(out, new ResolutionEngine());
    }

    public Demonstration(PrintStream out, ResolutionEngine engine) {
        this.out = out;
        this.engine = engine;
        this.revision = new RevisionEngine(engine);
    }

    /**
     * Esegue tutti gli scenari in sequenza.
     */
    public void run() {
        demonstrateRepresentation();
        demonstrateEntailment();
        demonstrateContraction();
        demonstrateContradictoryExpansion();
        demonstrateRevision();
    }

    //region SCENARI

    private void demonstrateRepresentation() {
        title("1. Rappresentazione della base di credenze");

        BeliefBase base = newBase();
        base.expand(read("p"), 10);
        base.expand(read("q"), 80);
        base.expand(read("p >> q"), 60);
        printBase("Credenze dopo l'espansione:", base);

        out.println("Aggiornamento di 'q' in '~q' con radicamento 40");
        base.update(read("q"), read("~q"), 40);

        out.println("Rimozione di '~q'");
        base.remove(read("~q"));
        printBase("Credenze dopo le modifiche:", base);

        out.println("Radicamento di 'p': " + base.getEntrenchment(read("p")));
        out.println("CNF di 'p >> r': " + engine.getConverter().toCNF(read("p >> r")));
    }

    private void demonstrateEntailment() {
        title("2. Implicazione logica (risoluzione)");

        BeliefBase base = newBase();
        base.expand(read("p"));
        base.expand(read("p >> q"));

        Formula query = read("q");
        out.println("La base implica '" + query + "'?");
        out.println("Risultato: " + (base.entails(query) ? "implicata" : "non implicata"));
        out.print(base.prove(query).formatProof());
    }

    private void demonstrateContraction() {
        title("3. Contrazione");

        BeliefBase base = newBase();
        base.expand(read("p"), 20);
        base.expand(read("p >> q"), 40);
        base.expand(read("q"), 60);
        printBase("Credenze iniziali:", base);

        out.println("Contrazione di 'q': si rimuovono credenze finché q non è più implicata");
        ContractionResult result = revision.contract(base, read("q"));
        out.println("Credenze rimosse: " + result.getRemoved());
        printBase("Credenze dopo la contrazione:", base);
    }

    private void demonstrateContradictoryExpansion() {
        title("4. Espansione");

        BeliefBase base = newBase();
        out.println("Espansione con credenze contraddittorie:");
        base.expand(read("p"));
        base.expand(read("~p"));
        printBase("Credenze attuali:", base);

        out.println("L'espansione non verifica la consistenza: la base è "
                + (base.isConsistent() ? "consistente" : "inconsistente"));
    }

    private void demonstrateRevision() {
        title("5. Revisione completa (contrazione + espansione)");

        BeliefBase base = newBase();
        base.expand(read("p"), 30);
        base.expand(read("p >> q"), 50);
        printBase("Credenze iniziali:", base);

        out.println("Revisione con '~q': si contrae q e poi si aggiunge ~q");
        ContractionResult result = revision.revise(base, read("~q"), 40);
        out.println("Credenze rimosse: " + result.getRemoved());
        printBase("Credenze dopo la revisione:", base);
    }

    //endregion

    //region SUPPORTO

    private BeliefBase newBase() {
        return new BeliefBase(engine);
    }

    private static Formula read(String text) {
        return FormulaReader.read(text);
    }

    private void title(String title) {
        out.println();
        out.println(SEPARATOR);
        out.println(title);
        out.println(SEPARATOR);
    }

    private void printBase(String header, BeliefBase base) {
        out.println(header);
        for (BeliefBase.Entry entry : base.show()) {
            out.println("  - " + entry);
        }
    }

    //endregion
}
