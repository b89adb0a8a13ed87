package org.py2smt.translator.api;

import java.util.Objects;

/**
 * Switches that change the shape of the emitted SMT-LIB2.
 *
 * @param strict {@code false} reproduces the legacy layout: {@code let} forms and
 *               statements following a conditional become sibling expressions, and a
 *               missing {@code else} leaves an empty {@code ite} slot.
 *               {@code true} nests everything into a single well-formed term.
 * @param divisionSymbol The SMT-LIB2 function emitted for {@code /}, usually
 *                       {@code /} (real division) or {@code div} (integer division).
 */
public record TranslationOptions(boolean strict, String divisionSymbol) {

    /** Legacy layout with {@code /} for division. */
    public static final TranslationOptions DEFAULT = new TranslationOptions(false, "/");

    public TranslationOptions {
        Objects.requireNonNull(divisionSymbol, "divisionSymbol");
        if (divisionSymbol.isBlank()) {
            throw new IllegalArgumentException("divisionSymbol must not be blank");
        }
    }

    /**
     * @param strict The new layout switch.
     * @return A copy with the given layout.
     */
    public TranslationOptions withStrict(boolean strict) {
        return new TranslationOptions(strict, divisionSymbol);
    }

    /**
     * @param divisionSymbol The new division function name.
     * @return A copy with the given division symbol.
     */
    public TranslationOptions withDivisionSymbol(String divisionSymbol) {
        return new TranslationOptions(strict, divisionSymbol);
    }
}
