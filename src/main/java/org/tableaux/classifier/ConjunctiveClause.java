package org.tableaux.classifier;

import org.tableaux.support.Literal;

import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * CLAUSOLA CONGIUNTIVA - Congiunzione di letterali usata come testimone
 *
 * Una clausola testimone di una formula contingente è sufficiente a fissarne il
 * valore di verità: ogni assegnamento che la soddisfa rende la formula vera
 * (lista true-on) oppure falsa (lista false-on).
 *
 * L'ordine dei letterali è quello in cui compaiono sul ramo del tableau da cui la
 * clausola deriva; uguaglianza e sussunzione considerano invece l'insieme.
 */
public final class ConjunctiveClause {

    private final List<Literal> literals;
    private final Set<Literal> literalSet;

    /**
     * @param literals letterali della clausola (non null, senza null)
     * @throws IllegalArgumentException se la lista è null o contiene null
     */
    public ConjunctiveClause(Collection<Literal> literals) {
        if (literals == null) {
            throw new IllegalArgumentException("Letterali della clausola non possono essere null");
        }
        for (Literal literal : literals) {
            if (literal == null) {
                throw new IllegalArgumentException("Letterali della clausola non possono essere null");
            }
        }
        this.literalSet = new LinkedHashSet<>(literals);
        this.literals = List.copyOf(literalSet);
    }

    public static ConjunctiveClause of(Literal... literals) {
        if (literals == null) {
            throw new IllegalArgumentException("Letterali della clausola non possono essere null");
        }
        return new ConjunctiveClause(Arrays.asList(literals));
    }

    public List<Literal> getLiterals() {
        return literals;
    }

    public int size() {
        return literals.size();
    }

    public boolean contains(Literal literal) {
        return literalSet.contains(literal);
    }

    /**
     * @return nomi delle variabili vincolate dalla clausola
     */
    public SortedSet<String> variables() {
        SortedSet<String> names = new TreeSet<>();
        for (Literal literal : literals) {
            names.add(literal.getName());
        }
        return names;
    }

    /**
     * Verifica se questa clausola sussume l'altra: C1 sussume C2 se C1 ⊆ C2.
     * Una clausola congiuntiva più corta è una condizione più debole, e quindi
     * preferibile come testimone.
     */
    public boolean subsumes(ConjunctiveClause other) {
        return other.literalSet.containsAll(this.literalSet);
    }

    /**
     * @param assignment assegnamento che copre tutte le variabili della clausola
     * @return true se tutti i letterali sono soddisfatti
     */
    public boolean isSatisfiedBy(Map<String, Boolean> assignment) {
        for (Literal literal : literals) {
            if (!literal.isSatisfiedBy(assignment)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ConjunctiveClause)) return false;
        return literalSet.equals(((ConjunctiveClause) o).literalSet);
    }

    @Override
    public int hashCode() {
        return literalSet.hashCode();
    }

    @Override
    public String toString() {
        return literals.toString();
    }
}
