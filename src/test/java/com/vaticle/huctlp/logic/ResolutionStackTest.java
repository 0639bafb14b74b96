/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.huctlp.logic;

import com.vaticle.huctlp.common.exception.HUCTLpException;
import org.junit.Test;

import java.util.Arrays;

import static com.vaticle.huctlp.common.exception.ErrorMessage.Resolution.CYCLIC_REFERENCE;
import static junit.framework.TestCase.assertEquals;
import static junit.framework.TestCase.assertFalse;
import static junit.framework.TestCase.assertTrue;
import static org.junit.Assert.fail;

public class ResolutionStackTest {

    @Test
    public void test_names_are_popped_in_reverse_order() {
        ResolutionStack stack = new ResolutionStack();
        stack.push("a");
        stack.push("b");

        assertEquals("a -> b", stack.toString());
        assertEquals("b", stack.pop());
        assertFalse(stack.contains("b"));
        assertTrue(stack.contains("a"));
        assertEquals("a", stack.pop());
        assertTrue(stack.isEmpty());
    }

    @Test
    public void test_pushing_a_name_twice_is_a_cycle() {
        ResolutionStack stack = new ResolutionStack();
        stack.push("a");
        stack.push("b");
        try {
            stack.push("a");
            fail();
        } catch (HUCTLpException e) {
            assertEquals(CYCLIC_REFERENCE.code(), e.errorMessage().code());
            assertEquals(Arrays.asList("a"), e.parameters());
        }
    }

    @Test
    public void test_popped_names_may_be_pushed_again() {
        ResolutionStack stack = new ResolutionStack();
        stack.push("a");
        stack.pop();
        stack.push("a");
        assertTrue(stack.contains("a"));
    }
}
