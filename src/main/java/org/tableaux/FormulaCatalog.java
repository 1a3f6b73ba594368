package org.tableaux;

import java.util.List;

/**
 * CATALOGO FORMULE - Tabella immutabile di formule d'esempio per il driver
 *
 * Raccoglie leggi classiche della logica proposizionale e alcune formule di prova
 * di dimensione crescente. Il catalogo è passato esplicitamente al driver e non è
 * mai consultato dal nucleo di classificazione.
 */
public final class FormulaCatalog {

    private static final FormulaCatalog DEFAULT = new FormulaCatalog(List.of(
            new Entry("Terzo escluso", "a ∨ (¬a)"),
            new Entry("Non contraddizione", "a ∧ (¬a)"),
            new Entry("Contingenza a tre variabili", "((a ∧ b) ∨ c)"),
            new Entry("Contingenza con negazione", "(((¬a) ∧ b) ∨ c)"),
            new Entry("Tautologia con variabile ridondante", "((¬a) ∨ b) ∨ (c ∨ a)"),
            new Entry("Modus ponens", "((a → b) ∧ a) → b"),
            new Entry("Modus tollens", "((a → b) ∧ (¬b)) → (¬a)"),
            new Entry("Contrapposizione", "(a → b) → ((¬b) → (¬a))"),
            new Entry("Doppia negazione", "(a → (¬(¬a))) ∧ ((¬(¬a)) → a)"),
            new Entry("De Morgan", "(¬(a ∧ b)) ↔ ((¬a) ∨ (¬b))"),
            new Entry("Sillogismo ipotetico", "((a → b) ∧ (b → c)) → (a → c)"),
            new Entry("Conseguenza arbitraria", "a → (b → a)"),
            new Entry("Formula composta",
                    "((a ∧ b) ∨ (c ∧ d)) → ((x ∨ y) ∧ (¬(z ∨ ((((a ∧ b) ∧ (c ∧ d)) ∧ (x ∨ y)) ∧ (¬(z ∨ ((a ∧ b) ∧ (c ∧ d))))))))"),
            new Entry("Formula composta estesa",
                    "(((a ∧ b) ∨ (c ∧ d)) → ((x ∨ y) ∧ (¬(z ∨ ((((a ∧ b) ∧ (c ∧ d)) ∧ (x ∨ y)) ∧ (¬(z ∨ ((a ∧ b) ∧ (c ∧ d))))))))) "
                            + "∨ (((a ∧ b) ∨ (c ∧ d)) → ((x ∨ y) ∧ (¬(z ∨ ((((a ∧ b) ∧ (c ∧ d)) ∧ (x ∨ y)) ∧ (¬(z ∨ ((a ∧ b) ∧ (c ∧ d)))))))))")
    ));

    private final List<Entry> entries;

    /**
     * @param entries voci del catalogo (lista non vuota)
     * @throws IllegalArgumentException se la lista è null o vuota
     */
    public FormulaCatalog(List<Entry> entries) {
        if (entries == null || entries.isEmpty()) {
            throw new IllegalArgumentException("Il catalogo deve contenere almeno una formula");
        }
        this.entries = List.copyOf(entries);
    }

    public static FormulaCatalog defaultCatalog() {
        return DEFAULT;
    }

    /**
     * @param index indice della formula (da 0)
     * @return voce del catalogo
     * @throws IllegalArgumentException se l'indice è fuori intervallo
     */
    public Entry get(int index) {
        if (index < 0 || index >= entries.size()) {
            throw new IllegalArgumentException("Indice formula non valido: " + index
                    + " (ammessi 0-" + (entries.size() - 1) + ")");
        }
        return entries.get(index);
    }

    public int size() {
        return entries.size();
    }

    public List<Entry> getEntries() {
        return entries;
    }

    /**
     * Voce del catalogo: nome descrittivo e testo della formula.
     */
    public static final class Entry {

        private final String name;
        private final String formula;

        public Entry(String name, String formula) {
            if (name == null || formula == null) {
                throw new IllegalArgumentException("Nome e formula della voce non possono essere null");
            }
            this.name = name;
            this.formula = formula;
        }

        public String getName() {
            return name;
        }

        public String getFormula() {
            return formula;
        }

        @Override
        public String toString() {
            return name + ": " + formula;
        }
    }
}
