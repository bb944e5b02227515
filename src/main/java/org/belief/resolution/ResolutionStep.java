package org.belief.resolution;

import org.belief.cnf.Clause;

/**
 * Passo di risoluzione: due clausole genitrici e il risolvente ottenuto.
 */
public final class ResolutionStep {

    private final Clause first;
    private final Clause second;
    private final Clause resolvent;

    /**
     * @param first prima clausola genitrice
     * @param second seconda clausola genitrice
     * @param resolvent clausola derivata
     * @throws IllegalArgumentException se una delle clausole è null
     */
    public ResolutionStep(Clause first, Clause second, Clause resolvent) {
        if (first == null || second == null || resolvent == null) {
            throw new IllegalArgumentException("Clausole del passo di risoluzione non possono essere null");
        }
        this.first = first;
        this.second = second;
        this.resolvent = resolvent;
    }

    public Clause getFirst() {
        return first;
    }

    public Clause getSecond() {
        return second;
    }

    public Clause getResolvent() {
        return resolvent;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        ResolutionStep other = (ResolutionStep) obj;
        return first.equals(other.first) && second.equals(other.second) && resolvent.equals(other.resolvent);
    }

    @Override
    public int hashCode() {
        int result = first.hashCode();
        result = 31 * result + second.hashCode();
        result = 31 * result + resolvent.hashCode();
        return result;
    }

    @Override
    public String toString() {
        return first + " e " + second + " genera " + resolvent;
    }
}
