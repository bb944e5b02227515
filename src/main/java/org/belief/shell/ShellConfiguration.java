package org.belief.shell;

import org.belief.base.BeliefBase;

import java.io.File;

/**
 * Configurazione validata della shell, immutabile.
 *
 * PARAMETRI SUPPORTATI:
 * -h: Mostra help e termina
 * -f <file>: Esegue i comandi contenuti nel file (esclusivo con -demo)
 * -t <sec>: Timeout per i comandi che interrogano il motore di risoluzione
 * -e <n>: Radicamento di default per expand e revise
 * -demo: Esegue la dimostrazione degli scenari principali
 * -nosub: Disabilita la sussunzione in avanti nella risoluzione
 */
public final class ShellConfiguration {

    //region COSTANTI

    static final String HELP_PARAM = "-h";
    static final String FILE_PARAM = "-f";
    static final String TIMEOUT_PARAM = "-t";
    static final String ENTRENCHMENT_PARAM = "-e";
    static final String DEMO_PARAM = "-demo";
    static final String NO_SUBSUMPTION_PARAM = "-nosub";

    public static final int DEFAULT_TIMEOUT_SECONDS = 10;
    public static final int MIN_TIMEOUT_SECONDS = 1;

    //endregion

    //region ATTRIBUTI

    private final boolean helpRequested;
    private final String scriptPath;
    private final boolean demoMode;
    private final int timeoutSeconds;
    private final int defaultEntrenchment;
    private final boolean subsumption;

    //endregion

    ShellConfiguration(boolean helpRequested, String scriptPath, boolean demoMode,
                       int timeoutSeconds, int defaultEntrenchment, boolean subsumption) {
        this.helpRequested = helpRequested;
        this.scriptPath = scriptPath;
        this.demoMode = demoMode;
        this.timeoutSeconds = timeoutSeconds;
        this.defaultEntrenchment = defaultEntrenchment;
        this.subsumption = subsumption;
    }

    /**
     * Configurazione di default: shell interattiva.
     */
    public static ShellConfiguration defaults() {
        return new ShellConfiguration(false, null, false, DEFAULT_TIMEOUT_SECONDS,
                BeliefBase.DEFAULT_ENTRENCHMENT, true);
    }

    /**
     * Analizza e valida i parametri della linea di comando.
     *
     * @param args parametri forniti dall'utente
     * @return configurazione validata
     * @throws IllegalArgumentException se i parametri non sono validi
     */
    public static ShellConfiguration fromArguments(String[] args) {
        return new ArgumentParser().parse(args);
    }

    //region ACCESSO

    public boolean isHelpRequested() {
        return helpRequested;
    }

    public String getScriptPath() {
        return scriptPath;
    }

    public boolean isScriptMode() {
        return scriptPath != null;
    }

    public boolean isDemoMode() {
        return demoMode;
    }

    public int getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public int getDefaultEntrenchment() {
        return defaultEntrenchment;
    }

    public boolean isSubsumption() {
        return subsumption;
    }

    //endregion

    /**
     * Parser dei parametri della linea di comando con messaggi d'errore
     * informativi per l'utente.
     */
    private static final class ArgumentParser {

        ShellConfiguration parse(String[] args) {
            boolean helpRequested = false;
            String scriptPath = null;
            boolean demoMode = false;
            int timeoutSeconds = DEFAULT_TIMEOUT_SECONDS;
            int defaultEntrenchment = BeliefBase.DEFAULT_ENTRENCHMENT;
            boolean subsumption = true;

            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case HELP_PARAM -> helpRequested = true;

                    case FILE_PARAM -> {
                        validateExclusiveMode(demoMode, DEMO_PARAM, FILE_PARAM);
                        scriptPath = getNextArgument(args, i, "file di comandi");
                        validateFileExists(scriptPath);
                        i++;
                    }

                    case DEMO_PARAM -> {
                        validateExclusiveMode(scriptPath != null, FILE_PARAM, DEMO_PARAM);
                        demoMode = true;
                    }

                    case TIMEOUT_PARAM -> {
                        timeoutSeconds = parseAndValidateTimeout(getNextArgument(args, i, "timeout"));
                        i++;
                    }

                    case ENTRENCHMENT_PARAM -> {
                        defaultEntrenchment = parseEntrenchment(getNextArgument(args, i, "radicamento"));
                        i++;
                    }

                    case NO_SUBSUMPTION_PARAM -> subsumption = false;

                    default -> throw new IllegalArgumentException("Parametro sconosciuto: " + args[i]);
                }
            }

            return new ShellConfiguration(helpRequested, scriptPath, demoMode,
                    timeoutSeconds, defaultEntrenchment, subsumption);
        }

        private void validateExclusiveMode(boolean otherModeActive, String otherMode, String currentMode) {
            if (otherModeActive) {
                throw new IllegalArgumentException("Parametri " + otherMode + " e " + currentMode
                        + " sono mutualmente esclusivi");
            }
        }

        private String getNextArgument(String[] args, int currentIndex, String argumentType) {
            if (currentIndex + 1 >= args.length) {
                throw new IllegalArgumentException("Valore mancante per " + argumentType
                        + " dopo " + args[currentIndex]);
            }
            return args[currentIndex + 1];
        }

        private int parseAndValidateTimeout(String value) {
            int timeout;
            try {
                timeout = Integer.parseInt(value);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Timeout non numerico: " + value, e);
            }
            if (timeout < MIN_TIMEOUT_SECONDS) {
                throw new IllegalArgumentException("Timeout minimo " + MIN_TIMEOUT_SECONDS
                        + " secondi, ricevuto: " + timeout);
            }
            return timeout;
        }

        private int parseEntrenchment(String value) {
            try {
                int entrenchment = Integer.parseInt(value);
                if (entrenchment < 0) {
                    throw new IllegalArgumentException("Radicamento negativo: " + value);
                }
                return entrenchment;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Radicamento non numerico: " + value, e);
            }
        }

        private void validateFileExists(String filePath) {
            File file = new File(filePath);
            if (!file.isFile()) {
                throw new IllegalArgumentException("File di comandi non trovato: " + filePath);
            }
        }
    }
}
