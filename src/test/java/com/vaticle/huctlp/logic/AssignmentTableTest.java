/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.huctlp.logic;

import com.vaticle.huctlp.common.exception.HUCTLpException;
import org.junit.Test;

import java.util.Arrays;

import static com.vaticle.huctlp.HUCTLp.TRUE;
import static com.vaticle.huctlp.HUCTLp.constant;
import static com.vaticle.huctlp.HUCTLp.not;
import static com.vaticle.huctlp.HUCTLp.reference;
import static com.vaticle.huctlp.common.exception.ErrorMessage.Resolution.DUPLICATE_NAME;
import static junit.framework.TestCase.assertEquals;
import static junit.framework.TestCase.assertSame;
import static junit.framework.TestCase.assertTrue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.Assert.fail;

public class AssignmentTableTest {

    private static Assignment formula(String name, String location) {
        return new Assignment(name, Assignment.Value.of(TRUE), location, false);
    }

    @Test
    public void test_duplicate_names_in_one_table_fail_with_both_locations() {
        try {
            AssignmentTable.of(Arrays.asList(formula("x", "a:1"), formula("y", "a:2"), formula("x", "a:3")));
            fail();
        } catch (HUCTLpException e) {
            assertEquals(DUPLICATE_NAME.code(), e.errorMessage().code());
            assertEquals(Arrays.asList("x", "a:1", "a:3"), e.parameters());
        }
    }

    @Test
    public void test_first_assignment_with_a_duplicate_is_reported() {
        try {
            AssignmentTable.of(Arrays.asList(formula("x", "a:1"), formula("y", "a:2"),
                                             formula("y", "a:3"), formula("x", "a:4")));
            fail();
        } catch (HUCTLpException e) {
            assertEquals(Arrays.asList("x", "a:1", "a:4"), e.parameters());
        }
    }

    @Test
    public void test_merging_tables_defining_the_same_name_fails() {
        AssignmentTable first = new UnitBuilder("first").assign("x", TRUE, 4, false).build().table();
        AssignmentTable second = new UnitBuilder("second").assign("x", not(TRUE), 7, false).build().table();
        try {
            first.merge(second);
            fail();
        } catch (HUCTLpException e) {
            assertEquals(DUPLICATE_NAME.code(), e.errorMessage().code());
            assertEquals(Arrays.asList("x", "first:4", "second:7"), e.parameters());
        }
    }

    @Test
    public void test_merge_keeps_order_and_is_associative() {
        AssignmentTable a = new UnitBuilder("a").assign("p", TRUE, 1, false).alias("q", "p", 2, false).build().table();
        AssignmentTable b = new UnitBuilder("b").assign("e", constant(2.0), 1, false).build().table();
        AssignmentTable c = new UnitBuilder("c").assign("r", not(reference("q")), 1, true).build().table();

        AssignmentTable left = a.merge(b).merge(c);
        AssignmentTable right = a.merge(b.merge(c));

        assertEquals(left, right);
        assertThat(left.toMap().keySet(), contains("p", "q", "e", "r"));
        assertEquals(Sort.ALIAS, left.toMap().get("q").sort());
        assertEquals("c:1", left.toMap().get("r").location());
        assertTrue(left.toMap().get("r").isFlagged());
    }

    @Test
    public void test_empty_table_is_the_merge_identity() {
        AssignmentTable a = new UnitBuilder("a").assign("p", TRUE, 1, false).build().table();
        assertSame(a, a.merge(AssignmentTable.empty()));
        assertSame(a, AssignmentTable.empty().merge(a));
        assertTrue(AssignmentTable.empty().isEmpty());
    }
}
