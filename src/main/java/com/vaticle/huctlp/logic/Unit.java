/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.huctlp.logic;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * A single source of assignments, e.g. one file, together with the identifiers of the units it
 * includes.
 */
public class Unit {

    private final String id;
    private final AssignmentTable table;
    private final ImmutableList<String> includes;

    public Unit(String id, AssignmentTable table, List<String> includes) {
        if (id == null) throw new NullPointerException("Null id");
        if (table == null) throw new NullPointerException("Null table");
        this.id = id;
        this.table = table;
        this.includes = ImmutableList.copyOf(includes);
    }

    public String id() {
        return id;
    }

    public AssignmentTable table() {
        return table;
    }

    public ImmutableList<String> includes() {
        return includes;
    }

    @Override
    public String toString() {
        return id;
    }
}
