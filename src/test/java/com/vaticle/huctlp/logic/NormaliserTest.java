/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.huctlp.logic;

import com.vaticle.huctlp.HUCTLp.Dir;
import com.vaticle.huctlp.common.HUCTLpToken;
import com.vaticle.huctlp.pattern.direction.DirFormula;
import com.vaticle.huctlp.pattern.formula.Formula;
import org.junit.Test;

import static com.vaticle.huctlp.HUCTLp.AF;
import static com.vaticle.huctlp.HUCTLp.AG;
import static com.vaticle.huctlp.HUCTLp.AU;
import static com.vaticle.huctlp.HUCTLp.AX;
import static com.vaticle.huctlp.HUCTLp.AwF;
import static com.vaticle.huctlp.HUCTLp.AwX;
import static com.vaticle.huctlp.HUCTLp.EF;
import static com.vaticle.huctlp.HUCTLp.EG;
import static com.vaticle.huctlp.HUCTLp.EU;
import static com.vaticle.huctlp.HUCTLp.EX;
import static com.vaticle.huctlp.HUCTLp.EwF;
import static com.vaticle.huctlp.HUCTLp.EwX;
import static com.vaticle.huctlp.HUCTLp.FALSE;
import static com.vaticle.huctlp.HUCTLp.TRUE;
import static com.vaticle.huctlp.HUCTLp.and;
import static com.vaticle.huctlp.HUCTLp.at;
import static com.vaticle.huctlp.HUCTLp.bind;
import static com.vaticle.huctlp.HUCTLp.constant;
import static com.vaticle.huctlp.HUCTLp.equal;
import static com.vaticle.huctlp.HUCTLp.exists;
import static com.vaticle.huctlp.HUCTLp.forall;
import static com.vaticle.huctlp.HUCTLp.future;
import static com.vaticle.huctlp.HUCTLp.globally;
import static com.vaticle.huctlp.HUCTLp.ge;
import static com.vaticle.huctlp.HUCTLp.implies;
import static com.vaticle.huctlp.HUCTLp.lt;
import static com.vaticle.huctlp.HUCTLp.neq;
import static com.vaticle.huctlp.HUCTLp.next;
import static com.vaticle.huctlp.HUCTLp.not;
import static com.vaticle.huctlp.HUCTLp.or;
import static com.vaticle.huctlp.HUCTLp.reference;
import static com.vaticle.huctlp.HUCTLp.transition;
import static com.vaticle.huctlp.HUCTLp.until;
import static com.vaticle.huctlp.HUCTLp.var;
import static com.vaticle.huctlp.pattern.formula.PathQuantifier.PA;
import static com.vaticle.huctlp.pattern.formula.PathQuantifier.PE;
import static junit.framework.TestCase.assertEquals;

public class NormaliserTest {

    private final Formula p1 = reference("p1");
    private final Formula p2 = reference("p2");
    private final Formula p3 = reference("p3");
    private final Formula p4 = reference("p4");

    private void assertNormalisesTo(Formula expected, Formula formula) {
        Formula normalised = Normaliser.normalise(formula);
        assertEquals(expected, normalised);
        assertEquals(normalised, Normaliser.normalise(normalised));
    }

    private void assertPreserved(Formula formula) {
        assertEquals(formula, Normaliser.normalise(formula));
    }

    @Test
    public void test_nested_operators_with_numeric_and_transition_propositions() {
        Formula f1 = neq(var("var1"), constant(14.3));
        Formula f2 = lt(var("var2"), constant(-15.3));
        Formula d1 = transition("var1", HUCTLpToken.Direction.IN, HUCTLpToken.Sign.NEGATIVE);
        Formula d2 = transition("var2", HUCTLpToken.Direction.OUT, HUCTLpToken.Sign.POSITIVE);

        Formula formula = EF(implies(AF(equal(AU(EX(f1), FALSE), not(d2))), AX(EU(EG(f2), AG(d1)))));
        Formula expected = EU(TRUE, or(
                not(AU(TRUE, or(and(AU(EX(f1), FALSE), not(d2)), and(not(AU(EX(f1), FALSE)), not(not(d2)))))),
                not(EX(not(EU(not(AU(TRUE, not(f2))), not(EU(TRUE, not(d1)))))))
        ));
        assertNormalisesTo(expected, formula);
    }

    @Test
    public void test_nested_operators_over_references() {
        Formula formula = EF(implies(p1, AX(EU(EG(p2), AG(p1)))));
        Formula expected = EU(TRUE, or(not(p1), not(EX(not(EU(not(AU(TRUE, not(p2))), not(EU(TRUE, not(p1)))))))));
        assertNormalisesTo(expected, formula);
    }

    @Test
    public void test_nested_canonical_formula_is_preserved() {
        assertPreserved(EU(and(p1, EX(not(p2))), AU(not(p3), or(p4, p2))));
    }

    @Test
    public void test_equivalence_is_rewritten() {
        assertNormalisesTo(or(and(p1, p2), and(not(p1), not(p2))), equal(p1, p2));
    }

    @Test
    public void test_implication_is_rewritten() {
        assertNormalisesTo(or(not(p1), p2), implies(p1, p2));
    }

    @Test
    public void test_all_globally_is_rewritten() {
        assertNormalisesTo(not(EU(TRUE, not(p1))), AG(p1));
    }

    @Test
    public void test_exists_globally_is_rewritten() {
        assertNormalisesTo(not(AU(TRUE, not(p1))), EG(p1));
    }

    @Test
    public void test_all_future_is_rewritten() {
        assertNormalisesTo(AU(TRUE, p1), AF(p1));
    }

    @Test
    public void test_exists_future_is_rewritten() {
        assertNormalisesTo(EU(TRUE, p1), EF(p1));
    }

    @Test
    public void test_all_next_is_rewritten() {
        assertNormalisesTo(not(EX(not(p1))), AX(p1));
    }

    @Test
    public void test_possibly_quantifiers_are_rewritten_to_their_duals() {
        DirFormula up = Dir.up("x");
        assertNormalisesTo(not(next(PE, not(p1), up)), next(PA, p1, up));
        assertNormalisesTo(not(until(PE, TRUE, not(p1), up)), globally(PA, p1, up));
        assertNormalisesTo(until(PA, TRUE, p1, up), future(PA, p1, up));
    }

    @Test
    public void test_directions_are_kept_by_rewrites() {
        DirFormula up = Dir.up("x");
        assertNormalisesTo(AU(TRUE, p1, up), AF(p1, up));
        assertNormalisesTo(not(EU(TRUE, not(p1), up)), AG(p1, up));
        assertNormalisesTo(not(EX(not(p1), up)), AX(p1, up));
    }

    @Test
    public void test_weak_operators_without_direction_are_strict() {
        assertNormalisesTo(not(EX(not(p1))), AwX(p1, Dir.TRUE));
        assertNormalisesTo(EX(p1), EwX(p1, Dir.TRUE));
        assertNormalisesTo(AU(TRUE, p1), AwF(p1, Dir.TRUE));
        assertNormalisesTo(EU(TRUE, p1), EwF(p1, Dir.TRUE));
    }

    @Test
    public void test_weak_next_with_direction_is_rewritten() {
        DirFormula up = Dir.up("x");
        assertNormalisesTo(not(EX(not(p1), up)), AwX(p1, up));
        assertNormalisesTo(or(EX(p1, up), EX(TRUE, Dir.not(up))), EwX(p1, up));
    }

    @Test
    public void test_weak_future_with_direction_is_rewritten() {
        DirFormula down = Dir.down("y");
        assertNormalisesTo(AU(TRUE, or(p1, EX(TRUE, Dir.not(down))), down), AwF(p1, down));
        assertNormalisesTo(EU(TRUE, or(p1, EX(TRUE, Dir.not(down))), down), EwF(p1, down));
    }

    @Test
    public void test_binders_are_kept_with_normalised_operands() {
        assertNormalisesTo(forall("s", AU(TRUE, p1), not(EU(TRUE, not(p2)))), forall("s", AF(p1), AG(p2)));
        assertNormalisesTo(exists("s", or(not(p1), p2), EX(p3)), exists("s", implies(p1, p2), EX(p3)));
        assertNormalisesTo(bind("s", not(EX(not(at("s", p1))))), bind("s", AX(at("s", p1))));
    }

    @Test
    public void test_until_is_preserved() {
        assertPreserved(AU(p1, p2));
        assertPreserved(EU(p1, p2));
    }

    @Test
    public void test_boolean_connectives_are_preserved() {
        assertPreserved(or(p1, p2));
        assertPreserved(and(p1, p2));
        assertPreserved(not(p1));
    }

    @Test
    public void test_exists_next_is_preserved() {
        assertPreserved(EX(p1));
    }

    @Test
    public void test_atoms_are_preserved() {
        assertPreserved(ge(var("val"), constant(32.2)));
        assertPreserved(TRUE);
        assertPreserved(FALSE);
        assertPreserved(transition("var", HUCTLpToken.Direction.IN, HUCTLpToken.Sign.POSITIVE));
    }

    @Test
    public void test_formula_normalise_delegates_to_normaliser() {
        Formula formula = AG(implies(p1, EF(p2)));
        assertEquals(Normaliser.normalise(formula), formula.normalise());
    }
}
