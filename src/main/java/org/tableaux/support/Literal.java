package org.tableaux.support;

import java.util.Comparator;
import java.util.Map;
import java.util.Objects;

/**
 * LETTERALE - Variabile proposizionale con polarità
 *
 * Rappresenta l'unità minima di un ramo del tableau e di una clausola testimone:
 * una variabile affermata (a) oppure negata (¬a).
 *
 * INVARIANTI:
 * • Nome variabile non null e non vuoto
 * • Oggetto immutabile, uguaglianza per valore (nome + polarità)
 *
 * COMPLEMENTARIETÀ:
 * • Due letterali sono complementari se hanno lo stesso nome e polarità opposta
 * • Un ramo che contiene una coppia complementare è chiuso
 */
public final class Literal implements Comparable<Literal> {

    private static final Comparator<Literal> ORDER =
            Comparator.comparing(Literal::getName).thenComparing(Literal::isPositive);

    //region ATTRIBUTI CORE

    /** Nome della variabile proposizionale */
    private final String name;

    /**
     * Polarità del letterale.
     * • true: variabile affermata
     * • false: variabile negata
     */
    private final boolean positive;

    //endregion

    //region COSTRUZIONE

    /**
     * Costruisce un letterale validando il nome della variabile.
     *
     * @param name nome variabile (non null, non vuoto)
     * @param positive polarità del letterale
     * @throws IllegalArgumentException se il nome non è valido
     */
    public Literal(String name, boolean positive) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Nome variabile del letterale non può essere null o vuoto");
        }
        this.name = name;
        this.positive = positive;
    }

    public static Literal positive(String name) {
        return new Literal(name, true);
    }

    public static Literal negative(String name) {
        return new Literal(name, false);
    }

    /**
     * Letterale corrispondente a una variabile con segno nel tableau: T(a) → a, F(a) → ¬a.
     */
    public static Literal of(String name, Sign sign) {
        return new Literal(name, sign.asBoolean());
    }

    //endregion

    //region OPERAZIONI LOGICHE

    /**
     * Verifica se due letterali sono contraddittori: stessa variabile, polarità opposta.
     * Funzione totale e priva di effetti collaterali.
     *
     * @param first primo letterale
     * @param second secondo letterale
     * @return true se i letterali sono complementari
     */
    public static boolean contradictory(Literal first, Literal second) {
        return first.name.equals(second.name) && first.positive != second.positive;
    }

    public boolean isComplementaryTo(Literal other) {
        return contradictory(this, other);
    }

    /**
     * @return il letterale complementare
     */
    public Literal negate() {
        return new Literal(name, !positive);
    }

    /**
     * Valuta il letterale rispetto a un assegnamento.
     *
     * @param assignment assegnamento che deve contenere la variabile
     * @return true se il letterale è soddisfatto
     * @throws IllegalArgumentException se la variabile non è assegnata
     */
    public boolean isSatisfiedBy(Map<String, Boolean> assignment) {
        Boolean value = assignment.get(name);
        if (value == null) {
            throw new IllegalArgumentException("Variabile non assegnata: " + name);
        }
        return value == positive;
    }

    public Sign getSign() {
        return Sign.of(positive);
    }

    //endregion

    //region ACCESSORI E UTILITY

    public String getName() {
        return name;
    }

    public boolean isPositive() {
        return positive;
    }

    @Override
    public int compareTo(Literal other) {
        return ORDER.compare(this, other);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Literal)) return false;
        Literal that = (Literal) o;
        return positive == that.positive && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, positive);
    }

    @Override
    public String toString() {
        return positive ? name : FormulaSymbol.NOT.getGlyph() + name;
    }

    //endregion
}
