/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.huctlp.logic;

/**
 * The kind of value a name is bound to.
 */
public enum Sort {
    ALIAS("alias"),
    EXPRESSION("expression"),
    DIRECTION("direction formula"),
    FORMULA("formula");

    private final String name;

    Sort(String name) {
        this.name = name;
    }

    @Override
    public String toString() {
        return name;
    }
}
