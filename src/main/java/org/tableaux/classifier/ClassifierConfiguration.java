package org.tableaux.classifier;

/**
 * CONFIGURAZIONE CLASSIFICATORE - Parametri immutabili della ricerca delle cause minime
 *
 * PARAMETRI:
 * • firstCauseLevelOnly: interrompe la ricerca al primo livello di cardinalità che
 *   produce cause (restituisce solo le cause di cardinalità minima)
 * • maxCauseSearchAtoms: oltre questo numero di variabili la ricerca esaustiva viene
 *   comunque limitata al primo livello, essendo esponenziale nel numero di atomi
 */
public final class ClassifierConfiguration {

    public static final int DEFAULT_MAX_CAUSE_SEARCH_ATOMS = 16;

    private static final ClassifierConfiguration DEFAULTS =
            new ClassifierConfiguration(false, DEFAULT_MAX_CAUSE_SEARCH_ATOMS);

    private final boolean firstCauseLevelOnly;
    private final int maxCauseSearchAtoms;

    private ClassifierConfiguration(boolean firstCauseLevelOnly, int maxCauseSearchAtoms) {
        if (maxCauseSearchAtoms < 1) {
            throw new IllegalArgumentException("maxCauseSearchAtoms deve essere >= 1, ricevuto: " + maxCauseSearchAtoms);
        }
        this.firstCauseLevelOnly = firstCauseLevelOnly;
        this.maxCauseSearchAtoms = maxCauseSearchAtoms;
    }

    public static ClassifierConfiguration defaults() {
        return DEFAULTS;
    }

    public ClassifierConfiguration withFirstCauseLevelOnly(boolean value) {
        return new ClassifierConfiguration(value, maxCauseSearchAtoms);
    }

    public ClassifierConfiguration withMaxCauseSearchAtoms(int value) {
        return new ClassifierConfiguration(firstCauseLevelOnly, value);
    }

    public boolean isFirstCauseLevelOnly() {
        return firstCauseLevelOnly;
    }

    public int getMaxCauseSearchAtoms() {
        return maxCauseSearchAtoms;
    }

    @Override
    public String toString() {
        return "ClassifierConfiguration[firstCauseLevelOnly=" + firstCauseLevelOnly
                + ", maxCauseSearchAtoms=" + maxCauseSearchAtoms + "]";
    }
}
