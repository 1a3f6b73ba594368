package org.tableaux.classifier;

import org.tableaux.formula.PropositionalFormula;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * VERDETTO - Esito della classificazione con relativa spiegazione
 *
 * Contenitore immutabile che associa allo stato logico della formula la
 * spiegazione corrispondente:
 * • Tautologia / contraddizione: insiemi minimi di variabili (cause) la cui
 *   rimozione fa perdere la proprietà
 * • Contingenza: clausole congiuntive minime sotto cui la formula è vera
 *   (true-on) e, separatamente, falsa (false-on)
 *
 * VALIDAZIONI:
 * • Le cause sono ammesse solo per tautologie e contraddizioni
 * • Le clausole testimone sono ammesse solo per le contingenze
 */
public final class Verdict {

    //region ATTRIBUTI CORE

    private final VerdictType type;
    private final PropositionalFormula formula;
    private final List<SortedSet<String>> minimalCauses;
    private final List<ConjunctiveClause> trueOn;
    private final List<ConjunctiveClause> falseOn;

    //endregion

    //region COSTRUZIONE E VALIDAZIONE

    private Verdict(VerdictType type, PropositionalFormula formula, List<SortedSet<String>> minimalCauses,
                    List<ConjunctiveClause> trueOn, List<ConjunctiveClause> falseOn) {
        if (type == null || formula == null) {
            throw new IllegalArgumentException("Tipo del verdetto e formula non possono essere null");
        }
        if (type == VerdictType.CONTINGENCY && !minimalCauses.isEmpty()) {
            throw new IllegalArgumentException("Una contingenza non ha cause minime");
        }
        if (type != VerdictType.CONTINGENCY && (!trueOn.isEmpty() || !falseOn.isEmpty())) {
            throw new IllegalArgumentException("Solo una contingenza ha clausole testimone");
        }

        this.type = type;
        this.formula = formula;
        this.minimalCauses = copyCauses(minimalCauses);
        this.trueOn = List.copyOf(trueOn);
        this.falseOn = List.copyOf(falseOn);
    }

    private static List<SortedSet<String>> copyCauses(List<SortedSet<String>> causes) {
        List<SortedSet<String>> copy = new ArrayList<>();
        for (SortedSet<String> cause : causes) {
            copy.add(Collections.unmodifiableSortedSet(new TreeSet<>(cause)));
        }
        return Collections.unmodifiableList(copy);
    }

    public static Verdict tautology(PropositionalFormula formula, List<SortedSet<String>> minimalCauses) {
        return new Verdict(VerdictType.TAUTOLOGY, formula, minimalCauses, List.of(), List.of());
    }

    public static Verdict contradiction(PropositionalFormula formula, List<SortedSet<String>> minimalCauses) {
        return new Verdict(VerdictType.CONTRADICTION, formula, minimalCauses, List.of(), List.of());
    }

    public static Verdict contingency(PropositionalFormula formula, List<ConjunctiveClause> trueOn,
                                      List<ConjunctiveClause> falseOn) {
        return new Verdict(VerdictType.CONTINGENCY, formula, List.of(), trueOn, falseOn);
    }

    //endregion

    //region ACCESSORI

    public VerdictType getType() {
        return type;
    }

    public PropositionalFormula getFormula() {
        return formula;
    }

    public boolean isTautology() {
        return type == VerdictType.TAUTOLOGY;
    }

    public boolean isContradiction() {
        return type == VerdictType.CONTRADICTION;
    }

    public boolean isContingency() {
        return type == VerdictType.CONTINGENCY;
    }

    /**
     * @return cause minime (vuota per le contingenze)
     */
    public List<SortedSet<String>> getMinimalCauses() {
        return minimalCauses;
    }

    /**
     * @return clausole sufficienti a rendere vera la formula (vuota se non contingente)
     */
    public List<ConjunctiveClause> getTrueOn() {
        return trueOn;
    }

    /**
     * @return clausole sufficienti a rendere falsa la formula (vuota se non contingente)
     */
    public List<ConjunctiveClause> getFalseOn() {
        return falseOn;
    }

    //endregion

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(formula).append(" è una ").append(type.getDescription());
        if (type == VerdictType.CONTINGENCY) {
            sb.append("\n  vera se:  ").append(trueOn);
            sb.append("\n  falsa se: ").append(falseOn);
        } else {
            sb.append("\n  cause minime: ").append(minimalCauses);
        }
        return sb.toString();
    }
}
