/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.huctlp;

import com.vaticle.huctlp.HUCTLp.Dir;
import com.vaticle.huctlp.pattern.formula.Formula;
import com.vaticle.huctlp.pattern.formula.PathQuantifier;
import org.junit.Test;

import static com.vaticle.huctlp.HUCTLp.AU;
import static com.vaticle.huctlp.HUCTLp.AX;
import static com.vaticle.huctlp.HUCTLp.EU;
import static com.vaticle.huctlp.HUCTLp.EX;
import static com.vaticle.huctlp.HUCTLp.next;
import static com.vaticle.huctlp.HUCTLp.reference;
import static com.vaticle.huctlp.HUCTLp.until;
import static junit.framework.TestCase.assertEquals;
import static junit.framework.TestCase.assertTrue;

public class HUCTLpTest {

    private final Formula p = reference("p");
    private final Formula q = reference("q");

    @Test
    public void test_until_without_right_direction_is_plain_until() {
        assertEquals(EU(p, q, Dir.up("x")), until(PathQuantifier.E, p, q, Dir.up("x"), Dir.TRUE));
    }

    @Test
    public void test_until_with_right_direction_reaches_through_next() {
        Formula formula = until(PathQuantifier.A, p, q, Dir.up("x"), Dir.down("y"));

        assertEquals(AU(p, AX(q, Dir.down("y")), Dir.up("x")), formula);
        assertEquals("(p {x+}AU ({y-}AX q))", formula.toString());
    }

    @Test
    public void test_right_direction_keeps_possibly_quantifier() {
        Formula formula = until(PathQuantifier.PE, p, q, Dir.TRUE, Dir.up("z"));
        assertEquals(until(PathQuantifier.PE, p, next(PathQuantifier.PE, q, Dir.up("z")), Dir.TRUE), formula);
    }

    @Test
    public void test_builders_without_direction_follow_every_transition() {
        assertTrue(EX(p).direction().isTrue());
        assertTrue(AU(p, q).direction().isTrue());
    }
}
