package org.tableaux.formula;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.tableaux.support.FormulaSymbol;

public class PropositionalFormulaTest {
    private static PropositionalFormula parse(String text) {
        return FormulaParser.parse(text);
    }

    @Test
    public void testAtomsAreSortedAndDistinct() {
        assertThat(parse("(c | a) & (b -> a)").atoms(), contains("a", "b", "c"));
        assertThrows(UnsupportedOperationException.class, () -> parse("a").atoms().add("z"));
    }

    @Test
    public void testSizeAndDepth() {
        PropositionalFormula formula = parse("(¬a) ∧ b");
        assertThat(formula.size(), is(2));
        assertThat(formula.depth(), is(2));
        assertThat(parse("a").size(), is(0));
        assertThat(parse("a").depth(), is(0));
    }

    @Test
    public void testAccessors() {
        PropositionalFormula formula = parse("a -> (¬b)");
        assertThat(formula.getSymbol(), is(FormulaSymbol.IMPLIES));
        assertThat(formula.getLeft(), is(PropositionalFormula.atom("a")));
        assertThat(formula.getRight().getOperand(), is(PropositionalFormula.atom("b")));
        assertThat(formula.getLeft().isAtom(), is(true));
    }

    @Test
    public void testFactoriesValidateArguments() {
        assertThrows(IllegalArgumentException.class, () -> PropositionalFormula.atom(""));
        assertThrows(IllegalArgumentException.class, () -> PropositionalFormula.not(null));
        assertThrows(IllegalArgumentException.class,
                () -> PropositionalFormula.and(PropositionalFormula.atom("a"), null));
        assertThrows(IllegalArgumentException.class, () -> PropositionalFormula.binary(
                FormulaSymbol.NOT, PropositionalFormula.atom("a"), PropositionalFormula.atom("b")));
    }

    @ParameterizedTest
    @ValueSource(strings = {" ", "1x", "a b", " a", "a-b", "¬a", "x'"})
    public void testAtomNameMustBeIdentifier(String name) {
        assertThrows(IllegalArgumentException.class, () -> PropositionalFormula.atom(name));
    }

    @Test
    public void testBuiltFormulaParsesBackToSameTree() {
        PropositionalFormula formula = PropositionalFormula.implies(
                PropositionalFormula.atom("_x1"),
                PropositionalFormula.not(PropositionalFormula.atom("Var2")));
        assertThat(parse(formula.toString()), is(formula));
    }

    @Test
    public void testEvaluate() {
        PropositionalFormula formula = parse("((¬a) ∧ b) ∨ c");
        assertThat(formula.evaluate(Map.of("a", false, "b", true, "c", false)), is(true));
        assertThat(formula.evaluate(Map.of("a", true, "b", true, "c", false)), is(false));
        assertThat(parse("a <-> b").evaluate(Map.of("a", false, "b", false)), is(true));
        assertThrows(IllegalArgumentException.class, () -> formula.evaluate(Map.of("a", true)));
    }

    @Test
    public void testStructuralEquality() {
        assertThat(parse("a & b").equals(parse("[a ∧ b]")), is(true));
        assertThat(parse("a & b").hashCode(), is(parse("(a /\\ b)").hashCode()));
        assertThat(parse("a & b").equals(parse("b & a")), is(false));
    }

    @Test
    public void testRenderNotations() {
        PropositionalFormula formula = parse("(¬a) ∧ b");
        assertThat(formula.render(Notation.INFIX), is("((¬a) ∧ b)"));
        assertThat(formula.render(Notation.PREFIX), is("∧ ¬a b"));
        assertThat(formula.render(Notation.POSTFIX), is("a¬ b ∧"));
        assertThat(formula.toString(), is("((¬a) ∧ b)"));
    }

    @Test
    public void testWithoutSimplifiesEnclosingConnective() {
        PropositionalFormula formula = parse("((¬a) ∨ b) ∨ (c ∨ a)");
        assertThat(formula.without(Set.of("a")), is(Optional.of(parse("b ∨ c"))));
        assertThat(formula.without(Set.of("b", "c")), is(Optional.of(parse("(¬a) ∨ a"))));
    }

    @Test
    public void testWithoutImplication() {
        PropositionalFormula formula = parse("a → b");
        assertThat(formula.without(Set.of("a")), is(Optional.of(parse("b"))));
        assertThat(formula.without(Set.of("b")), is(Optional.of(parse("¬a"))));
    }

    @Test
    public void testWithoutRemovingEverything() {
        assertThat(parse("a ∧ (¬a)").without(Set.of("a")), is(Optional.empty()));
        assertThat(parse("¬a").without(Set.of("a")), is(Optional.empty()));
    }

    @Test
    public void testWithoutUnrelatedVariableKeepsInstance() {
        PropositionalFormula formula = parse("(a ↔ b) ∧ (¬c)");
        assertThat(formula.without(Set.of("z")).get(), sameInstance(formula));
        assertThat(formula.without(Set.of()).get(), sameInstance(formula));
    }
}
