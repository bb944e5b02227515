package org.belief.formula;

/**
 * Segnala una formula non ben formata: testo vuoto o non analizzabile, albero
 * mancante, nome di atomo non valido o operatore con operandi errati.
 */
public class MalformedFormulaException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public MalformedFormulaException(String message) {
        super(message);
    }

    public MalformedFormulaException(String message, Throwable cause) {
        super(message, cause);
    }
}
