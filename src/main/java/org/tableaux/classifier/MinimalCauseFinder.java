package org.tableaux.classifier;

import org.tableaux.formula.PropositionalFormula;
import org.tableaux.formula.SignedFormula;
import org.tableaux.tableaux.TableauxBuilder;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.logging.Logger;

/**
 * RICERCA CAUSE MINIME - Variabili responsabili di una tautologia o contraddizione
 *
 * Un insieme S di variabili è una causa se, rimuovendo dalla formula ogni occorrenza
 * delle variabili di S (con il connettivo che le racchiude), la formula ridotta non è
 * più una tautologia (risp. contraddizione). Una formula rimossa interamente non ha
 * più alcuna proprietà e conta quindi come proprietà distrutta.
 *
 * ALGORITMO:
 * 1. Enumerazione dei sottoinsiemi di atoms(f) per cardinalità crescente,
 *    in ordine lessicografico all'interno di ciascun livello
 * 2. Scarto dei sottoinsiemi che contengono una causa già trovata
 * 3. Verifica con un solo tableau sulla formula ridotta (F per le tautologie,
 *    T per le contraddizioni)
 *
 * Le cause trovate sono minime per inclusione e vengono riportate tutte, anche
 * quando più cause hanno la stessa cardinalità.
 *
 * COMPLESSITÀ:
 * Esponenziale nel numero di atomi (insieme delle parti). Con firstCauseLevelOnly, o
 * oltre maxCauseSearchAtoms variabili, la ricerca si ferma al primo livello che
 * produce cause.
 */
final class MinimalCauseFinder {

    private static final Logger LOGGER = Logger.getLogger(MinimalCauseFinder.class.getName());

    private final TableauxBuilder builder;
    private final ClassifierConfiguration configuration;

    MinimalCauseFinder(TableauxBuilder builder, ClassifierConfiguration configuration) {
        this.builder = builder;
        this.configuration = configuration;
    }

    /**
     * Calcola le cause minime di una tautologia o contraddizione.
     *
     * @param formula formula già classificata
     * @param type TAUTOLOGY o CONTRADICTION
     * @return cause minime, in ordine di cardinalità e poi lessicografico
     * @throws IllegalArgumentException se il tipo è CONTINGENCY
     */
    List<SortedSet<String>> findMinimalCauses(PropositionalFormula formula, VerdictType type) {
        if (type == VerdictType.CONTINGENCY) {
            throw new IllegalArgumentException("Le cause minime sono definite solo per tautologie e contraddizioni");
        }

        List<String> atoms = new ArrayList<>(formula.atoms());
        boolean firstLevelOnly = configuration.isFirstCauseLevelOnly();
        if (atoms.size() > configuration.getMaxCauseSearchAtoms()) {
            LOGGER.warning("Formula con " + atoms.size() + " variabili oltre il limite di "
                    + configuration.getMaxCauseSearchAtoms() + ": ricerca cause limitata al primo livello");
            firstLevelOnly = true;
        }

        List<SortedSet<String>> causes = new ArrayList<>();
        int examined = 0;

        for (int size = 1; size <= atoms.size(); size++) {
            int[] indices = firstCombination(size);
            do {
                SortedSet<String> candidate = select(atoms, indices);
                if (!containsKnownCause(candidate, causes)) {
                    examined++;
                    if (destroysProperty(formula, candidate, type)) {
                        LOGGER.fine("Causa minima trovata: " + candidate);
                        causes.add(candidate);
                    }
                }
            } while (nextCombination(indices, atoms.size()));

            if (firstLevelOnly && !causes.isEmpty()) {
                break;
            }
        }

        LOGGER.fine("Ricerca cause completata: " + causes.size() + " cause su " + examined + " sottoinsiemi verificati");
        return causes;
    }

    //region VERIFICA DI UN SOTTOINSIEME

    /**
     * @return true se la rimozione del sottoinsieme fa perdere la proprietà
     */
    private boolean destroysProperty(PropositionalFormula formula, SortedSet<String> candidate, VerdictType type) {
        Optional<PropositionalFormula> reduced = formula.without(candidate);
        if (reduced.isEmpty()) {
            return true;
        }
        SignedFormula root = type == VerdictType.TAUTOLOGY
                ? SignedFormula.assumeFalse(reduced.get())
                : SignedFormula.assumeTrue(reduced.get());
        return !builder.build(root).isClosed();
    }

    private static boolean containsKnownCause(SortedSet<String> candidate, List<SortedSet<String>> causes) {
        for (SortedSet<String> cause : causes) {
            if (candidate.containsAll(cause)) {
                return true;
            }
        }
        return false;
    }

    //endregion

    //region ENUMERAZIONE COMBINAZIONI

    private static int[] firstCombination(int size) {
        int[] indices = new int[size];
        for (int i = 0; i < size; i++) {
            indices[i] = i;
        }
        return indices;
    }

    /**
     * Avanza alla combinazione successiva in ordine lessicografico.
     *
     * @return false se la combinazione corrente era l'ultima
     */
    private static boolean nextCombination(int[] indices, int n) {
        int k = indices.length;
        int i = k - 1;
        while (i >= 0 && indices[i] == n - k + i) {
            i--;
        }
        if (i < 0) {
            return false;
        }
        indices[i]++;
        for (int j = i + 1; j < k; j++) {
            indices[j] = indices[j - 1] + 1;
        }
        return true;
    }

    private static SortedSet<String> select(List<String> atoms, int[] indices) {
        SortedSet<String> subset = new TreeSet<>();
        for (int index : indices) {
            subset.add(atoms.get(index));
        }
        return subset;
    }

    //endregion
}
