package org.belief.base;

import org.belief.formula.Formula;

import java.util.NoSuchElementException;

/**
 * Nessuna credenza della base corrisponde alla formula richiesta.
 */
public class BeliefNotFoundException extends NoSuchElementException {

    private static final long serialVersionUID = 1L;

    private final transient Formula formula;

    public BeliefNotFoundException(Formula formula) {
        super("Credenza non trovata: " + formula);
        this.formula = formula;
    }

    public Formula getFormula() {
        return formula;
    }
}
