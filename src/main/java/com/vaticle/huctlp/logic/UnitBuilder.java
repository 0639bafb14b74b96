/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.huctlp.logic;

import com.vaticle.huctlp.common.exception.HUCTLpException;
import com.vaticle.huctlp.pattern.direction.DirFormula;
import com.vaticle.huctlp.pattern.expression.Expression;
import com.vaticle.huctlp.pattern.formula.Formula;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static com.vaticle.huctlp.common.exception.ErrorMessage.Unit.ASSIGNMENT_NAME_MISSING;

/**
 * Collects the assignments and includes of one unit, in the order a parser meets them.
 */
public class UnitBuilder {

    private final String unitId;
    private final List<Assignment> assignments;
    private final Set<String> includes;

    public UnitBuilder(String unitId) {
        if (unitId == null) throw new NullPointerException("Null unit id");
        this.unitId = unitId;
        this.assignments = new ArrayList<>();
        this.includes = new LinkedHashSet<>();
    }

    public UnitBuilder assign(String name, Expression expression, int line, boolean flagged) {
        return add(name, Assignment.Value.of(expression), line, flagged);
    }

    public UnitBuilder assign(String name, DirFormula direction, int line, boolean flagged) {
        return add(name, Assignment.Value.of(direction), line, flagged);
    }

    public UnitBuilder assign(String name, Formula formula, int line, boolean flagged) {
        return add(name, Assignment.Value.of(formula), line, flagged);
    }

    public UnitBuilder alias(String name, String target, int line, boolean flagged) {
        return add(name, Assignment.Value.alias(target), line, flagged);
    }

    public UnitBuilder include(String unitId) {
        includes.add(unitId);
        return this;
    }

    /**
     * @throws HUCTLpException {@code DUPLICATE_NAME} if the unit assigns a name twice
     */
    public Unit build() {
        return new Unit(unitId, AssignmentTable.of(assignments), new ArrayList<>(includes));
    }

    private UnitBuilder add(String name, Assignment.Value value, int line, boolean flagged) {
        if (name == null || name.isEmpty()) throw HUCTLpException.of(ASSIGNMENT_NAME_MISSING, unitId, line);
        assignments.add(new Assignment(name, value, location(line), flagged));
        return this;
    }

    private String location(int line) {
        return unitId + ":" + line;
    }
}
