package org.belief.revision;

import org.belief.base.Belief;

import java.util.Comparator;

/**
 * Ordine di rimozione delle credenze durante la contrazione: radicamento
 * crescente, a parità di radicamento la credenza inserita per prima.
 */
public final class EntrenchmentOrdering implements Comparator<Belief> {

    public static final EntrenchmentOrdering INSTANCE = new EntrenchmentOrdering();

    private EntrenchmentOrdering() {
    }

    @Override
    public int compare(Belief first, Belief second) {
        int byEntrenchment = Integer.compare(first.getEntrenchment(), second.getEntrenchment());
        if (byEntrenchment != 0) {
            return byEntrenchment;
        }
        return Long.compare(first.getSequence(), second.getSequence());
    }
}
