package org.tableaux.tableaux;

import org.tableaux.formula.SignedFormula;
import org.tableaux.support.Literal;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * RAMO DEL TABLEAU - Cammino completamente espanso dalla radice a una foglia
 *
 * Contiene, nell'ordine di elaborazione, le formule con segno incontrate lungo il
 * cammino e i letterali a cui si sono ridotte. Il ramo è chiuso se contiene due
 * letterali complementari; un ramo aperto e completamente espanso descrive un
 * assegnamento che soddisfa le formule della radice (le variabili assenti dal
 * ramo restano libere).
 *
 * Oggetto immutabile prodotto da {@link TableauxBuilder}.
 */
public final class Branch {

    private final List<SignedFormula> entries;
    private final List<Literal> literals;
    private final boolean closed;

    /** Letterale che ha chiuso il ramo, null per i rami aperti */
    private final Literal closingLiteral;

    Branch(List<SignedFormula> entries, List<Literal> literals, Literal closingLiteral) {
        this.entries = List.copyOf(entries);
        this.literals = List.copyOf(literals);
        this.closingLiteral = closingLiteral;
        this.closed = closingLiteral != null;
    }

    public List<SignedFormula> getEntries() {
        return entries;
    }

    /**
     * @return letterali distinti del ramo, nell'ordine in cui sono stati raggiunti
     */
    public List<Literal> getLiterals() {
        return literals;
    }

    public boolean isClosed() {
        return closed;
    }

    public boolean isOpen() {
        return !closed;
    }

    public Literal getClosingLiteral() {
        return closingLiteral;
    }

    /**
     * Assegnamento parziale descritto da un ramo aperto.
     *
     * @return valore di verità di ogni variabile presente nel ramo
     * @throws IllegalStateException se il ramo è chiuso
     */
    public Map<String, Boolean> toAssignment() {
        if (closed) {
            throw new IllegalStateException("Un ramo chiuso non descrive alcun assegnamento");
        }
        Map<String, Boolean> assignment = new TreeMap<>();
        for (Literal literal : literals) {
            assignment.put(literal.getName(), literal.isPositive());
        }
        return assignment;
    }

    @Override
    public String toString() {
        return literals + (closed ? " ✗ (chiuso su " + closingLiteral + ")" : " ○");
    }
}
