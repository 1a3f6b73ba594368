package org.tableaux.classifier;

/**
 * Stato logico di una formula proposizionale.
 */
public enum VerdictType {
    /** Vera in ogni assegnamento */
    TAUTOLOGY("tautologia"),
    /** Falsa in ogni assegnamento */
    CONTRADICTION("contraddizione"),
    /** Vera in almeno un assegnamento e falsa in almeno un altro */
    CONTINGENCY("contingenza");

    private final String description;

    VerdictType(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
