package org.tableaux.rules;

import org.tableaux.formula.SignedFormula;

import java.util.List;

/**
 * ESPANSIONE - Risultato dell'applicazione della tabella delle regole a una formula con segno
 *
 * Tre casi mutuamente esclusivi:
 * • TERMINAL: la formula è un letterale, nessuna alternativa
 * • NON_BRANCHING: una sola alternativa, le conclusioni restano sullo stesso ramo
 * • BRANCHING: più alternative, ognuna apre un ramo figlio
 */
public final class Expansion {

    private static final Expansion TERMINAL = new Expansion(RuleKind.TERMINAL, null, List.of());

    private final RuleKind kind;
    private final InferenceRule rule;
    private final List<List<SignedFormula>> alternatives;

    private Expansion(RuleKind kind, InferenceRule rule, List<List<SignedFormula>> alternatives) {
        this.kind = kind;
        this.rule = rule;
        this.alternatives = alternatives;
    }

    static Expansion terminal() {
        return TERMINAL;
    }

    static Expansion of(InferenceRule rule, List<List<SignedFormula>> alternatives) {
        return new Expansion(rule.getKind(), rule, List.copyOf(alternatives));
    }

    public RuleKind getKind() {
        return kind;
    }

    /**
     * @return regola applicata, null per le espansioni terminali
     */
    public InferenceRule getRule() {
        return rule;
    }

    public List<List<SignedFormula>> getAlternatives() {
        return alternatives;
    }

    /**
     * Conclusioni di una regola α.
     *
     * @throws IllegalStateException se l'espansione non è NON_BRANCHING
     */
    public List<SignedFormula> getConclusions() {
        if (kind != RuleKind.NON_BRANCHING) {
            throw new IllegalStateException("Conclusioni uniche disponibili solo per regole α, tipo: " + kind);
        }
        return alternatives.get(0);
    }

    @Override
    public String toString() {
        return kind == RuleKind.TERMINAL ? "TERMINAL" : rule + " " + alternatives;
    }
}
