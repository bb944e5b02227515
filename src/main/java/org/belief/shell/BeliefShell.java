package org.belief.shell;

import org.belief.base.Belief;
import org.belief.base.BeliefBase;
import org.belief.formula.Formula;
import org.belief.parser.FormulaReader;
import org.belief.resolution.ResolutionEngine;
import org.belief.resolution.ResolutionResult;
import org.belief.revision.ContractionResult;
import org.belief.revision.RevisionEngine;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * SHELL DELLA BASE DI CREDENZE - Interprete di comandi riga per riga
 *
 * Possiede una propria {@link BeliefBase}: ogni sessione è indipendente.
 * Gli errori di un comando vengono stampati con prefisso [E] e la sessione
 * prosegue. I comandi che interrogano il motore di risoluzione sono eseguiti
 * con timeout; allo scadere il comando viene annullato senza effetti parziali.
 *
 * FORMATO COMANDI:
 * - {@code expand <formula> [radicamento]}
 * - {@code update <vecchia> => <nuova> [radicamento]}
 * - ... (vedi {@link #COMMANDS})
 */
public class BeliefShell {

    private static final Logger LOGGER = Logger.getLogger(BeliefShell.class.getName());

    /** Formula seguita da un radicamento opzionale: "p & q 30" */
    private static final Pattern FORMULA_WITH_ENTRENCHMENT = Pattern.compile("(.+?)(?:\\s+(\\d+))?");

    private static final String UPDATE_SEPARATOR = "=>";
    private static final String PROMPT = "> ";

    /** Comandi disponibili con la rispettiva descrizione */
    static final Map<String, String> COMMANDS;

    static {
        Map<String, String> commands = new LinkedHashMap<>();
        commands.put("expand", "expand <formula> [<radicamento>] - Aggiunge una credenza senza controlli");
        commands.put("revise", "revise <formula> [<radicamento>] - Revisione: contrazione di ~formula ed espansione");
        commands.put("contract", "contract <formula> - Rimuove credenze finché la formula non è più implicata");
        commands.put("entails", "entails <formula> - Verifica se la base implica la formula");
        commands.put("explain", "explain <formula> - Mostra la prova per risoluzione dell'implicazione");
        commands.put("remove", "remove <formula> - Rimuove la prima credenza uguale alla formula");
        commands.put("update", "update <vecchia> => <nuova> [<radicamento>] - Sostituisce una credenza sul posto");
        commands.put("entrenchment", "entrenchment <formula> - Mostra il radicamento di una credenza");
        commands.put("consistent", "consistent - Verifica la consistenza della base");
        commands.put("cnf", "cnf <formula> - Mostra la forma normale congiuntiva della formula");
        commands.put("show", "show - Mostra le credenze della base");
        commands.put("clear", "clear - Svuota la base");
        commands.put("help", "help [<comando>] - Mostra l'elenco dei comandi o l'aiuto di un comando");
        commands.put("exit", "exit - Termina la sessione (anche: quit)");
        COMMANDS = Collections.unmodifiableMap(commands);
    }

    private final ShellConfiguration config;
    private final PrintStream out;
    private final BeliefBase base;
    private final RevisionEngine revision;

    //region COSTRUZIONE

    public BeliefShell(ShellConfiguration config, PrintStream out) {
        if (config == null || out == null) {
            throw new IllegalArgumentException("Configurazione e stream di output non possono essere null");
        }
        this.config = config;
        this.out = out;

        ResolutionEngine engine = new ResolutionEngine(config.isSubsumption());
        this.base = new BeliefBase(engine);
        this.revision = new RevisionEngine(engine);
    }

    //endregion

    //region CICLO PRINCIPALE

    /**
     * Legge ed esegue comandi fino a fine input o a {@code exit}.
     *
     * @param in sorgente dei comandi
     * @param interactive true per mostrare benvenuto e prompt, false per
     *                    ripetere ogni comando letto (modalità script)
     */
    public void run(BufferedReader in, boolean interactive) throws IOException {
        if (interactive) {
            out.println("Benvenuto nell'agente di revisione delle credenze. Digita help per l'elenco dei comandi.");
        }

        while (true) {
            if (interactive) {
                out.print(PROMPT);
                out.flush();
            }

            String line = in.readLine();
            if (line == null) {
                break;
            }

            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }
            if (!interactive) {
                out.println(PROMPT + trimmed);
            }
            if (!execute(trimmed)) {
                return;
            }
        }

        if (interactive) {
            out.println();
        }
    }

    /**
     * Esegue un singolo comando.
     *
     * @param line riga di comando
     * @return false se la sessione deve terminare
     */
    public boolean execute(String line) {
        String trimmed = line.trim();
        if (trimmed.isEmpty()) {
            return true;
        }

        String[] parts = trimmed.split("\\s+", 2);
        String command = parts[0].toLowerCase(Locale.ROOT);
        String argument = parts.length > 1 ? parts[1].trim() : "";

        try {
            switch (command) {
                case "expand" -> handleExpand(argument);
                case "revise" -> handleRevise(argument);
                case "contract" -> handleContract(argument);
                case "entails" -> handleEntails(argument);
                case "explain" -> handleExplain(argument);
                case "remove" -> handleRemove(argument);
                case "update" -> handleUpdate(argument);
                case "entrenchment" -> handleEntrenchment(argument);
                case "consistent" -> handleConsistent();
                case "cnf" -> handleCnf(argument);
                case "show" -> handleShow();
                case "clear" -> handleClear();
                case "help" -> handleHelp(argument);
                case "exit", "quit" -> {
                    out.println("Arrivederci!");
                    return false;
                }
                default -> out.println("[E] Comando sconosciuto: " + command + ". Usa help per l'elenco dei comandi.");
            }
        } catch (IllegalArgumentException | IllegalStateException | NoSuchElementException e) {
            LOGGER.log(Level.FINE, "Comando fallito: " + trimmed, e);
            out.println("[E] " + e.getMessage());
        }
        return true;
    }

    //endregion

    //region GESTIONE COMANDI

    private void handleExpand(String argument) {
        FormulaArgument parsed = parseFormulaArgument(argument);
        revision.expand(base, parsed.getFormula(), parsed.getEntrenchment());
        out.println("[I] Base espansa con: " + parsed.getFormula() + " (radicamento: " + parsed.getEntrenchment() + ")");
    }

    private void handleRevise(String argument) {
        FormulaArgument parsed = parseFormulaArgument(argument);
        ContractionResult result = runWithTimeout(
                () -> revision.revise(base, parsed.getFormula(), parsed.getEntrenchment()));
        if (result == null) {
            return;
        }
        printRemoved(result);
        out.println("[I] Base rivista con: " + parsed.getFormula() + " (radicamento: " + parsed.getEntrenchment() + ")");
    }

    private void handleContract(String argument) {
        Formula target = FormulaReader.read(argument);
        ContractionResult result = runWithTimeout(() -> revision.contract(base, target));
        if (result == null) {
            return;
        }
        if (result.isUnchanged()) {
            out.println("[I] La base non implica " + target + ": nessuna modifica");
        } else {
            printRemoved(result);
            out.println("[I] Contrazione di " + target + " completata");
        }
    }

    private void handleEntails(String argument) {
        Formula formula = FormulaReader.read(argument);
        Boolean entailed = runWithTimeout(() -> base.entails(formula));
        if (entailed == null) {
            return;
        }
        out.println(entailed
                ? "[I] La base implica: " + formula
                : "[I] La base non implica: " + formula);
    }

    private void handleExplain(String argument) {
        Formula formula = FormulaReader.read(argument);
        ResolutionResult result = runWithTimeout(() -> base.prove(formula));
        if (result == null) {
            return;
        }
        if (result.isEmptyClauseDerived()) {
            out.println("[I] La base implica: " + formula);
            out.print(result.formatProof());
            if (result.getProof().isEmpty()) {
                out.println();
            }
        } else {
            out.println("[I] La base non implica: " + formula);
        }
        out.println(String.format("Passate: %d, risolventi generati: %d, clausole mantenute: %d",
                result.getPasses(), result.getResolventsGenerated(), result.getClausesRetained()));
    }

    private void handleRemove(String argument) {
        Formula formula = FormulaReader.read(argument);
        base.remove(formula);
        out.println("[I] Credenza rimossa: " + formula);
    }

    private void handleUpdate(String argument) {
        int separator = argument.indexOf(UPDATE_SEPARATOR);
        if (separator < 0) {
            throw new IllegalArgumentException("Formato: update <vecchia> " + UPDATE_SEPARATOR + " <nuova> [<radicamento>]");
        }
        Formula oldFormula = FormulaReader.read(argument.substring(0, separator));
        String replacement = argument.substring(separator + UPDATE_SEPARATOR.length()).trim();

        Matcher matcher = matchFormulaArgument(replacement);
        Formula newFormula = FormulaReader.read(matcher.group(1));
        Belief updated = matcher.group(2) != null
                ? base.update(oldFormula, newFormula, parseEntrenchment(matcher.group(2)))
                : base.update(oldFormula, newFormula);

        out.println("[I] Credenza aggiornata: " + oldFormula + " → " + updated);
    }

    private void handleEntrenchment(String argument) {
        Formula formula = FormulaReader.read(argument);
        out.println("[I] Radicamento di " + formula + ": " + base.getEntrenchment(formula));
    }

    private void handleConsistent() {
        Boolean consistent = runWithTimeout(base::isConsistent);
        if (consistent == null) {
            return;
        }
        out.println(consistent ? "[I] La base è consistente" : "[I] La base è inconsistente");
    }

    private void handleCnf(String argument) {
        Formula formula = FormulaReader.read(argument);
        out.println("[I] CNF di " + formula + ": " + base.getEngine().getConverter().toCNF(formula));
    }

    private void handleShow() {
        List<BeliefBase.Entry> entries = base.show();
        if (entries.isEmpty()) {
            out.println("La base di credenze è vuota.");
            return;
        }
        out.println("Base di credenze corrente:");
        for (int i = 0; i < entries.size(); i++) {
            BeliefBase.Entry entry = entries.get(i);
            out.println(String.format("  %2d. %-30s [radicamento: %d]",
                    i + 1, entry.getFormula(), entry.getEntrenchment()));
        }
    }

    private void handleClear() {
        base.clear();
        out.println("[I] Base di credenze svuotata");
    }

    private void handleHelp(String argument) {
        if (!argument.isEmpty()) {
            String description = COMMANDS.get(argument.toLowerCase(Locale.ROOT));
            out.println(description != null ? description : "Nessun aiuto disponibile per '" + argument + "'");
            return;
        }
        out.println("Comandi disponibili:");
        for (String description : COMMANDS.values()) {
            out.println("  " + description);
        }
        out.println("Sintassi formule: ~ (not), & (and), | (or), >> (implica), <<>> (equivale), parentesi");
    }

    private void printRemoved(ContractionResult result) {
        for (Belief removed : result.getRemoved()) {
            out.println("    rimossa: " + removed);
        }
    }

    //endregion

    //region SUPPORTO

    /**
     * Esegue un'interrogazione del motore con timeout.
     *
     * Allo scadere il thread di lavoro viene interrotto e si attende che termini
     * davvero prima di tornare al prompt: nessun comando successivo può vedere
     * la base mentre il lavoratore la sta ancora modificando. Le modifiche alla
     * base avvengono in un unico commit finale, quindi dopo la terminazione la
     * base è invariata oppure contiene l'intero risultato dell'operazione.
     *
     * @return risultato del task o null se scaduto il timeout
     */
    private <T> T runWithTimeout(Callable<T> task) {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        long modificationsBefore = base.getModificationCount();

        try {
            Future<T> future = executor.submit(task);
            try {
                return future.get(config.getTimeoutSeconds(), TimeUnit.SECONDS);
            } catch (TimeoutException e) {
                if (!future.cancel(true)) {
                    // Completato tra lo scadere del timeout e la cancellazione
                    return future.get();
                }
                awaitWorkerTermination(executor);
                reportTimeout(modificationsBefore);
                return null;
            }

        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IllegalStateException("Errore durante l'esecuzione del comando", cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Esecuzione del comando interrotta", e);
        } finally {
            executor.shutdownNow();
            awaitWorkerTermination(executor);
        }
    }

    private void reportTimeout(long modificationsBefore) {
        if (base.getModificationCount() == modificationsBefore) {
            out.println("[W] Timeout raggiunto dopo " + config.getTimeoutSeconds() + " secondi: base invariata");
        } else {
            out.println("[W] Timeout raggiunto dopo " + config.getTimeoutSeconds()
                    + " secondi durante il salvataggio: operazione completata");
        }
    }

    /**
     * Attende senza limite la fine del thread di lavoro già interrotto.
     */
    private void awaitWorkerTermination(ExecutorService executor) {
        executor.shutdownNow();
        try {
            while (!executor.awaitTermination(1, TimeUnit.SECONDS)) {
                LOGGER.warning("Il thread di lavoro non è ancora terminato, attesa in corso");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private FormulaArgument parseFormulaArgument(String argument) {
        Matcher matcher = matchFormulaArgument(argument);
        Formula formula = FormulaReader.read(matcher.group(1));
        int entrenchment = matcher.group(2) != null
                ? parseEntrenchment(matcher.group(2))
                : config.getDefaultEntrenchment();
        return new FormulaArgument(formula, entrenchment);
    }

    private static Matcher matchFormulaArgument(String argument) {
        Matcher matcher = FORMULA_WITH_ENTRENCHMENT.matcher(argument.trim());
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Formato: <formula> [<radicamento>]");
        }
        return matcher;
    }

    private static int parseEntrenchment(String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Radicamento non valido: " + value, e);
        }
    }

    public BeliefBase getBase() {
        return base;
    }

    /**
     * Formula con il radicamento richiesto (o quello di default).
     */
    private static final class FormulaArgument {

        private final Formula formula;
        private final int entrenchment;

        FormulaArgument(Formula formula, int entrenchment) {
            this.formula = formula;
            this.entrenchment = entrenchment;
        }

        Formula getFormula() {
            return formula;
        }

        int getEntrenchment() {
            return entrenchment;
        }
    }

    //endregion
}
