/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.huctlp.pattern.direction;

import com.vaticle.huctlp.HUCTLp.Dir;
import com.vaticle.huctlp.common.HUCTLpToken;
import org.junit.Test;

import static junit.framework.TestCase.assertEquals;
import static org.junit.Assert.assertNotEquals;

public class DirFormulaTest {

    @Test
    public void test_canonical_text() {
        assertEquals("true", DirFormula.TRUE.toString());
        assertEquals("false", DirFormula.FALSE.toString());
        assertEquals("x+", Dir.up("x").toString());
        assertEquals("y-", Dir.down("y").toString());
        assertEquals("name", Dir.reference("name").toString());
        assertEquals("!x+", Dir.not(Dir.up("x")).toString());
        assertEquals("(x+ && y-)", Dir.and(Dir.up("x"), Dir.down("y")).toString());
        assertEquals("(x+ || y-)", Dir.or(Dir.up("x"), Dir.down("y")).toString());
        assertEquals("(x+ -> y-)", Dir.implies(Dir.up("x"), Dir.down("y")).toString());
        assertEquals("(x+ <-> y-)", Dir.equal(Dir.up("x"), Dir.down("y")).toString());
    }

    @Test
    public void test_equality_is_structural() {
        assertEquals(Dir.and(Dir.up("x"), Dir.TRUE), Dir.and(Dir.up("x"), DirFormula.TRUE));
        assertNotEquals(Dir.up("x"), Dir.down("x"));
        assertNotEquals(Dir.and(Dir.up("x"), Dir.TRUE), Dir.or(Dir.up("x"), Dir.TRUE));
        assertNotEquals(Dir.reference("x"), new DirFormula.Proposition("x", HUCTLpToken.Sign.POSITIVE));
    }

    @Test
    public void test_map_leaves_keeps_operators() {
        DirFormula direction = Dir.implies(Dir.not(Dir.reference("d")), Dir.and(Dir.reference("d"), Dir.FALSE));
        DirFormula mapped = direction.mapLeaves(leaf -> leaf.isReference() ? Dir.up(leaf.asReference().name()) : leaf);
        assertEquals(Dir.implies(Dir.not(Dir.up("d")), Dir.and(Dir.up("d"), Dir.FALSE)), mapped);
    }

    @Test
    public void test_fold_counts_atoms() {
        DirFormula direction = Dir.or(Dir.not(Dir.up("x")), Dir.equal(Dir.TRUE, Dir.down("y")));
        int atoms = direction.<Integer>fold(atom -> 1, (not, inner) -> inner, (bool, left, right) -> left + right);
        assertEquals(3, atoms);
    }

    @Test(expected = IllegalArgumentException.class)
    public void test_negation_is_not_a_binary_operator() {
        new DirFormula.Bool(HUCTLpToken.Logic.NOT, Dir.TRUE, Dir.FALSE);
    }
}
