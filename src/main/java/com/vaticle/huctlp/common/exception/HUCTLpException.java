/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.huctlp.common.exception;

import com.google.common.collect.ImmutableList;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

public class HUCTLpException extends RuntimeException {

    private final ErrorMessage error;
    private final List<String> parameters;

    private HUCTLpException(ErrorMessage error, Throwable cause, Object... parameters) {
        super(error.message(parameters), cause);
        assert !getMessage().contains("%s");
        this.error = error;
        this.parameters = ImmutableList.copyOf(Arrays.stream(parameters).map(String::valueOf).iterator());
    }

    public static HUCTLpException of(ErrorMessage errorMessage, Object... parameters) {
        return new HUCTLpException(errorMessage, null, parameters);
    }

    public static HUCTLpException of(ErrorMessage errorMessage, Throwable cause, Object... parameters) {
        return new HUCTLpException(errorMessage, cause, parameters);
    }

    public ErrorMessage errorMessage() {
        return error;
    }

    /**
     * The message parameters, rendered as strings, in the order the error template consumes them.
     */
    public List<String> parameters() {
        return parameters;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        HUCTLpException that = (HUCTLpException) o;
        return error.equals(that.error) && parameters.equals(that.parameters);
    }

    @Override
    public int hashCode() {
        return Objects.hash(error, parameters);
    }
}
