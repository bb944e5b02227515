package org.belief.resolution;

/**
 * Sollevata quando il thread che esegue la saturazione viene interrotto, ad
 * esempio allo scadere di un timeout imposto dal chiamante.
 */
public class ResolutionInterruptedException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ResolutionInterruptedException(String message) {
        super(message);
    }
}
