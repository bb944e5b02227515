package org.belief.formula;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Generatore deterministico di formule casuali e di assegnamenti per il
 * confronto con le tavole di verità.
 */
public final class RandomFormulas {

    private final Random random;
    private final List<String> atoms;

    public RandomFormulas(long seed, List<String> atoms) {
        this.random = new Random(seed);
        this.atoms = atoms;
    }

    public Formula next(int maxDepth) {
        if (maxDepth == 0 || random.nextInt(4) == 0) {
            return Formula.atom(atoms.get(random.nextInt(atoms.size())));
        }
        return switch (random.nextInt(6)) {
            case 0 -> Formula.not(next(maxDepth - 1));
            case 1 -> Formula.and(next(maxDepth - 1), next(maxDepth - 1));
            case 2 -> Formula.or(next(maxDepth - 1), next(maxDepth - 1));
            case 3 -> Formula.implies(next(maxDepth - 1), next(maxDepth - 1));
            case 4 -> Formula.iff(next(maxDepth - 1), next(maxDepth - 1));
            default -> Formula.or(next(maxDepth - 1), next(maxDepth - 1), next(maxDepth - 1));
        };
    }

    public int nextInt(int bound) {
        return random.nextInt(bound);
    }

    /**
     * Tutti i 2^n assegnamenti delle variabili date.
     */
    public static List<Map<String, Boolean>> assignments(List<String> atoms) {
        List<Map<String, Boolean>> result = new ArrayList<>();
        for (int mask = 0; mask < (1 << atoms.size()); mask++) {
            Map<String, Boolean> assignment = new HashMap<>();
            for (int i = 0; i < atoms.size(); i++) {
                assignment.put(atoms.get(i), (mask & (1 << i)) != 0);
            }
            result.add(assignment);
        }
        return result;
    }
}
