package org.mides.delivery.model;

import java.util.Arrays;

public enum Algorithm {
    DIJKSTRA("dijkstra"),
    A_STAR("a_star"),
    GENETIC("genetic"),
    NEAREST_NEIGHBOR("nearest_neighbor"),
    CONSTRAINT_SOLVER("constraint_solver"),
    /* Any name not listed above */
    UNRECOGNIZED("unrecognized");

    private final String wireName;

    Algorithm(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /* Exact, case-sensitive match on the wire name */
    public static Algorithm fromName(String name) {
        if (name == null)
            return UNRECOGNIZED;

        return Arrays.stream(values())
            .filter(algorithm -> algorithm != UNRECOGNIZED)
            .filter(algorithm -> algorithm.wireName.equals(name))
            .findFirst()
            .orElse(UNRECOGNIZED);
    }
}
