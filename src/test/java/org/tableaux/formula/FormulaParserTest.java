package org.tableaux.formula;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.tableaux.formula.PropositionalFormula.and;
import static org.tableaux.formula.PropositionalFormula.atom;
import static org.tableaux.formula.PropositionalFormula.iff;
import static org.tableaux.formula.PropositionalFormula.implies;
import static org.tableaux.formula.PropositionalFormula.not;
import static org.tableaux.formula.PropositionalFormula.or;

import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

public class FormulaParserTest {
    private static final PropositionalFormula A = atom("a");
    private static final PropositionalFormula B = atom("b");
    private static final PropositionalFormula C = atom("c");

    static Stream<Arguments> connectiveSpellings() {
        return Stream.of(
                Arguments.of("¬a", not(A)),
                Arguments.of("~a", not(A)),
                Arguments.of("!a", not(A)),
                Arguments.of("a ∧ b", and(A, B)),
                Arguments.of("a & b", and(A, B)),
                Arguments.of("a /\\ b", and(A, B)),
                Arguments.of("a ∨ b", or(A, B)),
                Arguments.of("a | b", or(A, B)),
                Arguments.of("a \\/ b", or(A, B)),
                Arguments.of("a → b", implies(A, B)),
                Arguments.of("a -> b", implies(A, B)),
                Arguments.of("a >> b", implies(A, B)),
                Arguments.of("a ↔ b", iff(A, B)),
                Arguments.of("a <-> b", iff(A, B)));
    }

    @ParameterizedTest
    @MethodSource("connectiveSpellings")
    public void testConnectiveSpellings(String text, PropositionalFormula expected) {
        assertThat(FormulaParser.parse(text), is(expected));
    }

    @Test
    public void testBracketKindsAreInterchangeable() {
        PropositionalFormula expected = and(A, or(B, C));
        assertThat(FormulaParser.parse("(a & (b | c))"), is(expected));
        assertThat(FormulaParser.parse("[a & {b | c}]"), is(expected));
        assertThat(FormulaParser.parse("{a & [b | c]}"), is(expected));
    }

    @Test
    public void testRedundantParenthesesAndWhitespace() {
        assertThat(FormulaParser.parse("((a))"), is(A));
        assertThat(FormulaParser.parse("  (\ta\n&\r\nb )  "), is(and(A, B)));
    }

    @Test
    public void testIdentifiers() {
        PropositionalFormula formula = FormulaParser.parse("(x_1 & Var2) | _tmp");
        assertThat(formula.atoms(), contains("Var2", "_tmp", "x_1"));
    }

    @Test
    public void testNestedNegation() {
        assertThat(FormulaParser.parse("¬(¬a)"), is(not(not(A))));
        assertThat(FormulaParser.parse("~!a"), is(not(not(A))));
    }

    @ParameterizedTest
    @ValueSource(strings = {"~a | a", "¬a ∧ b", "a & ~b", "!a -> !b", "~a <-> (b | c)"})
    public void testUnparenthesizedNegationBesideBinaryConnectiveIsRejected(String text) {
        assertThrows(FormulaSyntaxException.class, () -> FormulaParser.parse(text));
    }

    @Test
    public void testNegationScopeMadeExplicitByParentheses() {
        assertThat(FormulaParser.parse("(~a) | a"), is(or(not(A), A)));
        assertThat(FormulaParser.parse("~(a | a)"), is(not(or(A, A))));
        assertThat(FormulaParser.parse("~[a | b]"), is(not(or(A, B))));
    }

    @Test
    public void testExampleFormulaShape() {
        PropositionalFormula formula = FormulaParser.parse("((¬a) | b) | (c | a)");
        assertThat(formula, is(or(or(not(A), B), or(C, A))));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "",
            "   ",
            "(a & b",
            "a & b)",
            "(a & b]",
            "[a | b)",
            "a # b",
            "a - b",
            "a &",
            "& a",
            "(¬)",
            "a & b | c",
            "a b",
            "()",
            "a <- b"
    })
    public void testMalformedInputIsRejected(String text) {
        assertThrows(FormulaSyntaxException.class, () -> FormulaParser.parse(text));
    }

    @Test
    public void testErrorPosition() {
        FormulaSyntaxException error = assertThrows(FormulaSyntaxException.class,
                () -> FormulaParser.parse("a # b"));
        assertThat(error.getLine(), is(1));
        assertThat(error.getColumn(), is(2));
    }

    @Test
    public void testNullTextRejected() {
        assertThrows(IllegalArgumentException.class, () -> FormulaParser.parse(null));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "a",
            "((¬a) ∧ b) ∨ c",
            "(a → b) → ((¬b) → (¬a))",
            "(¬(a ∧ b)) ↔ ((¬a) ∨ (¬b))",
            "¬(¬(¬p))"
    })
    public void testRenderedFormulaParsesBackToSameTree(String text) {
        PropositionalFormula formula = FormulaParser.parse(text);
        assertThat(FormulaParser.parse(formula.toString()), is(formula));
    }
}
