package org.tableaux.rules;

/**
 * Tipo di espansione prodotta da una regola del tableau.
 */
public enum RuleKind {
    /** Letterale: nessuna ulteriore decomposizione */
    TERMINAL,
    /** Regola α: tutte le conclusioni sullo stesso ramo */
    NON_BRANCHING,
    /** Regola β: un ramo figlio per ciascuna alternativa */
    BRANCHING
}
