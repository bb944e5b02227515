package org.belief.revision;

import org.belief.base.Belief;
import org.belief.formula.Formula;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Esito di una contrazione: obiettivo e credenze rimosse, nell'ordine in cui
 * sono state scelte.
 */
public final class ContractionResult {

    private final Formula target;
    private final List<Belief> removed;

    public ContractionResult(Formula target, List<Belief> removed) {
        if (target == null || removed == null) {
            throw new IllegalArgumentException("Obiettivo e lista credenze rimosse non possono essere null");
        }
        this.target = target;
        this.removed = Collections.unmodifiableList(new ArrayList<>(removed));
    }

    /**
     * Contrazione senza effetti (obiettivo non implicato).
     */
    public static ContractionResult unchanged(Formula target) {
        return new ContractionResult(target, List.of());
    }

    public Formula getTarget() {
        return target;
    }

    public List<Belief> getRemoved() {
        return removed;
    }

    public boolean isUnchanged() {
        return removed.isEmpty();
    }

    @Override
    public String toString() {
        return "ContractionResult{obiettivo=" + target + ", rimosse=" + removed + "}";
    }
}
