package org.belief.cnf;

/**
 * Conversione CNF interrotta perché il thread chiamante è stato interrotto
 * (tipicamente allo scadere del timeout di un comando).
 */
public class ConversionInterruptedException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ConversionInterruptedException(String message) {
        super(message);
    }
}
