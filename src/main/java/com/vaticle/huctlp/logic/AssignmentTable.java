/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.huctlp.logic;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.vaticle.huctlp.common.exception.HUCTLpException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.vaticle.huctlp.common.exception.ErrorMessage.Resolution.DUPLICATE_NAME;

/**
 * An ordered set of assignments with pairwise distinct names.
 */
public class AssignmentTable {

    private static final AssignmentTable EMPTY = new AssignmentTable(ImmutableMap.of());

    private final ImmutableMap<String, Assignment> assignments;

    private AssignmentTable(ImmutableMap<String, Assignment> assignments) {
        this.assignments = assignments;
    }

    public static AssignmentTable empty() {
        return EMPTY;
    }

    /**
     * @throws HUCTLpException {@code DUPLICATE_NAME} for the name of the first assignment, in the
     *                         given order, that is assigned again later, with the locations of its
     *                         first two assignments
     */
    public static AssignmentTable of(List<Assignment> assignments) {
        Map<String, List<Assignment>> byName = new LinkedHashMap<>();
        for (Assignment assignment : assignments) {
            byName.computeIfAbsent(assignment.name(), name -> new ArrayList<>()).add(assignment);
        }
        ImmutableMap.Builder<String, Assignment> table = ImmutableMap.builder();
        byName.forEach((name, group) -> {
            if (group.size() > 1) {
                throw HUCTLpException.of(DUPLICATE_NAME, name, group.get(0).location(), group.get(1).location());
            }
            table.put(name, group.get(0));
        });
        return new AssignmentTable(table.build());
    }

    /**
     * @return the assignments of this table followed by the assignments of {@code other}
     */
    public AssignmentTable merge(AssignmentTable other) {
        if (other.isEmpty()) return this;
        else if (isEmpty()) return other;
        return of(ImmutableList.<Assignment>builder().addAll(assignments()).addAll(other.assignments()).build());
    }

    public ImmutableList<Assignment> assignments() {
        return assignments.values().asList();
    }

    public ImmutableMap<String, Assignment> toMap() {
        return assignments;
    }

    public boolean isEmpty() {
        return assignments.isEmpty();
    }

    public int size() {
        return assignments.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return assignments().equals(((AssignmentTable) o).assignments());
    }

    @Override
    public int hashCode() {
        return assignments().hashCode();
    }

    @Override
    public String toString() {
        return assignments().toString();
    }
}
