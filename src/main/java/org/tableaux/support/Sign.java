package org.tableaux.support;

/**
 * Segno di una formula nel tableau: la formula è assunta vera (T) o falsa (F).
 */
public enum Sign {

    TRUE("T", true),
    FALSE("F", false);

    private final String label;
    private final boolean value;

    Sign(String label, boolean value) {
        this.label = label;
        this.value = value;
    }

    /**
     * @return il segno opposto (T ↔ F)
     */
    public Sign opposite() {
        return this == TRUE ? FALSE : TRUE;
    }

    /**
     * @return valore di verità assunto dal segno
     */
    public boolean asBoolean() {
        return value;
    }

    public String getLabel() {
        return label;
    }

    public static Sign of(boolean value) {
        return value ? TRUE : FALSE;
    }

    @Override
    public String toString() {
        return label;
    }
}
