/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.huctlp.common.exception;

import com.vaticle.huctlp.logic.Sort;
import org.junit.Test;

import java.util.Arrays;

import static com.vaticle.huctlp.common.exception.ErrorMessage.Config.CONFIG_FILE_NOT_FOUND;
import static com.vaticle.huctlp.common.exception.ErrorMessage.Resolution.CYCLIC_REFERENCE;
import static com.vaticle.huctlp.common.exception.ErrorMessage.Resolution.SORT_MISMATCH;
import static junit.framework.TestCase.assertEquals;
import static junit.framework.TestCase.assertSame;

public class HUCTLpExceptionTest {

    @Test
    public void test_codes_carry_category_prefix_and_number() {
        assertEquals("RES03", CYCLIC_REFERENCE.code());
        assertEquals("CFG01", CONFIG_FILE_NOT_FOUND.code());
    }

    @Test
    public void test_message_is_formatted_with_parameters() {
        HUCTLpException exception = HUCTLpException.of(SORT_MISMATCH, "e", Sort.FORMULA, Sort.EXPRESSION);

        assertSame(SORT_MISMATCH, exception.errorMessage());
        assertEquals(Arrays.asList("e", "formula", "expression"), exception.parameters());
        assertEquals("[RES04] Invalid Reference Resolution: The name 'e' is expected to be a(n) 'formula', but it is a(n) 'expression'.",
                     exception.getMessage());
    }

    @Test
    public void test_cause_is_kept() {
        IllegalStateException cause = new IllegalStateException("io");
        HUCTLpException exception = HUCTLpException.of(CONFIG_FILE_NOT_FOUND, cause, "huctlp.properties");

        assertSame(cause, exception.getCause());
        assertEquals(CONFIG_FILE_NOT_FOUND.message("huctlp.properties"), exception.getMessage());
    }

    @Test
    public void test_equal_errors_with_equal_parameters_are_equal() {
        assertEquals(HUCTLpException.of(CYCLIC_REFERENCE, "a"), HUCTLpException.of(CYCLIC_REFERENCE, "a"));
    }
}
