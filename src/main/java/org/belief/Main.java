package org.belief;

import org.belief.shell.BeliefShell;
import org.belief.shell.Demonstration;
import org.belief.shell.ShellConfiguration;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.logging.LogManager;

/**
 * AGENTE DI REVISIONE DELLE CREDENZE
 *
 * PIPELINE:
 * 1. INPUT: comandi da terminale o da file di script
 * 2. PARSING: formule in notazione infissa → albero (ANTLR)
 * 3. CONVERSIONE IN CNF delle credenze
 * 4. RAGIONAMENTO: implicazione per risoluzione, contrazione per radicamento,
 *    revisione con l'identità di Levi
 *
 * MODALITÀ OPERATIVE:
 * - Interattiva (default): shell su standard input
 * - Script (-f): esegue i comandi del file
 * - Dimostrazione (-demo): scenari guidati
 */
public final class Main {

    private static final String LOGGING_CONFIG_PROPERTY = "java.util.logging.config.file";
    private static final String LOGGING_CONFIG_RESOURCE = "/logging.properties";

    private Main() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //region PUNTO PRINCIPALE

    public static void main(String[] args) {
        System.out.println("---> AVVIO AGENTE DI REVISIONE DELLE CREDENZE <---");

        try {
            configureLogging();

            ShellConfiguration config = parseAndValidateArguments(args);
            if (config == null) {
                return;
            }

            if (config.isHelpRequested()) {
                printApplicationHelp();
            } else if (config.isDemoMode()) {
                System.out.println("[I] Modalità: Dimostrazione");
                new Demonstration(System.out).run();
            } else if (config.isScriptMode()) {
                System.out.println("[I] Modalità: Script " + config.getScriptPath());
                runScript(config);
            } else {
                runInteractive(config);
            }

        } catch (Exception e) {
            handleGlobalError(e);
        } finally {
            System.out.println("---> FINE ESECUZIONE <---");
        }
    }

    private static ShellConfiguration parseAndValidateArguments(String[] args) {
        try {
            return ShellConfiguration.fromArguments(args);
        } catch (IllegalArgumentException e) {
            System.out.println("[E] " + e.getMessage());
            System.out.println("Usa -h per visualizzare l'help.");
            return null;
        }
    }

    private static void handleGlobalError(Exception e) {
        System.out.println("[E] Errore critico nell'applicazione: " + e.getMessage());
        System.out.println("Controllare i log per dettagli completi.");
        System.exit(1);
    }

    //endregion

    //region MODALITÀ

    private static void runScript(ShellConfiguration config) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(Paths.get(config.getScriptPath()), StandardCharsets.UTF_8)) {
            new BeliefShell(config, System.out).run(reader, false);
        }
    }

    private static void runInteractive(ShellConfiguration config) throws IOException {
        BufferedReader reader = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        new BeliefShell(config, System.out).run(reader, true);
    }

    //endregion

    //region CONFIGURAZIONE

    /**
     * Carica la configurazione di logging dal classpath, salvo che sia già
     * indicata con la proprietà di sistema.
     */
    private static void configureLogging() throws IOException {
        if (System.getProperty(LOGGING_CONFIG_PROPERTY) != null) {
            return;
        }
        try (InputStream config = Main.class.getResourceAsStream(LOGGING_CONFIG_RESOURCE)) {
            if (config != null) {
                LogManager.getLogManager().readConfiguration(config);
            }
        }
    }

    private static void printApplicationHelp() {
        System.out.println("\n::>> AGENTE DI REVISIONE DELLE CREDENZE <<::");
        System.out.println("Base di credenze proposizionale con implicazione per risoluzione,");
        System.out.println("contrazione guidata dal radicamento e revisione AGM\n");

        System.out.println("UTILIZZO:");
        System.out.println("  java -jar belief-revision.jar [opzioni]\n");

        System.out.println("OPZIONI:");
        System.out.println("  -h             Mostra questo help");
        System.out.println("  -f <file>      Esegue i comandi contenuti nel file");
        System.out.println("  -demo          Esegue la dimostrazione degli scenari principali");
        System.out.println("  -t <secondi>   Timeout per comando (min: " + ShellConfiguration.MIN_TIMEOUT_SECONDS
                + ", default: " + ShellConfiguration.DEFAULT_TIMEOUT_SECONDS + ")");
        System.out.println("  -e <n>         Radicamento di default per expand e revise");
        System.out.println("  -nosub         Disabilita la sussunzione nella risoluzione\n");

        System.out.println("SINTASSI FORMULE:");
        System.out.println("  ~ (not)  & (and)  | (or)  >> (implica)  <<>> (equivale)  ( )");
        System.out.println("  Precedenza decrescente: ~, &, |, >>, <<>>; operatori binari associativi a sinistra\n");

        System.out.println("ESEMPI:");
        System.out.println("  java -jar belief-revision.jar");
        System.out.println("  java -jar belief-revision.jar -f comandi.txt -t 30");
        System.out.println("  java -jar belief-revision.jar -demo");
    }

    //endregion
}
