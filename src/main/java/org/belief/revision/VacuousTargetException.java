package org.belief.revision;

import org.belief.formula.Formula;

/**
 * Contrazione impossibile: l'obiettivo è una tautologia e nessuna rimozione di
 * credenze contingenti può smettere di implicarlo.
 */
public class VacuousTargetException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    private final transient Formula target;

    public VacuousTargetException(Formula target) {
        super("Impossibile contrarre una tautologia: " + target);
        this.target = target;
    }

    public Formula getTarget() {
        return target;
    }
}
