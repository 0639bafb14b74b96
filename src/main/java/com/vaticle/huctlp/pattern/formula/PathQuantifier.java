/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.huctlp.pattern.formula;

import com.vaticle.huctlp.common.exception.HUCTLpException;

import static com.vaticle.huctlp.common.exception.ErrorMessage.Internal.ILLEGAL_STATE;

/**
 * Quantifies the paths a temporal operator ranges over: all paths, some path, and their
 * "possibly" counterparts.
 */
public enum PathQuantifier {
    A("A"),
    E("E"),
    PA("pA"),
    PE("pE");

    private final String symbol;

    PathQuantifier(String symbol) {
        this.symbol = symbol;
    }

    public boolean isUniversal() {
        return this == A || this == PA;
    }

    public boolean isExistential() {
        return !isUniversal();
    }

    public PathQuantifier dual() {
        switch (this) {
            case A:
                return E;
            case E:
                return A;
            case PA:
                return PE;
            case PE:
                return PA;
            default:
                throw HUCTLpException.of(ILLEGAL_STATE);
        }
    }

    /**
     * @return the existential quantifier of the same family, which is this quantifier when already existential
     */
    public PathQuantifier existential() {
        return isUniversal() ? dual() : this;
    }

    @Override
    public String toString() {
        return symbol;
    }
}
