/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.huctlp.logic;

import com.vaticle.huctlp.common.exception.HUCTLpException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static com.vaticle.huctlp.common.exception.ErrorMessage.Unit.ROOT_UNIT_NOT_FOUND;
import static com.vaticle.huctlp.common.exception.ErrorMessage.Unit.UNIT_NOT_FOUND;

/**
 * Merges units and everything they include, depth first, into a single assignment table. Every unit
 * is merged at most once, so a unit included twice, or included by one of its own includes, does
 * not duplicate its assignments.
 */
public class UnitMerger {

    private static final Logger LOG = LoggerFactory.getLogger(UnitMerger.class);

    private final UnitLoader loader;
    private final Set<String> processed;
    private AssignmentTable merged;

    public UnitMerger(UnitLoader loader) {
        this.loader = loader;
        this.processed = new HashSet<>();
        this.merged = AssignmentTable.empty();
    }

    public static AssignmentTable merge(String rootUnitId, UnitLoader loader) {
        Unit root = loader.load(rootUnitId);
        if (root == null) throw HUCTLpException.of(ROOT_UNIT_NOT_FOUND, rootUnitId);
        return new UnitMerger(loader).add(root).merged();
    }

    public static AssignmentTable merge(List<Unit> units, UnitLoader loader) {
        UnitMerger merger = new UnitMerger(loader);
        units.forEach(merger::add);
        return merger.merged();
    }

    public UnitMerger add(Unit unit) {
        if (!processed.add(unit.id())) {
            LOG.debug("Skipping unit '{}', which is already merged", unit.id());
            return this;
        }
        merged = merged.merge(unit.table());
        for (String include : unit.includes()) {
            if (processed.contains(include)) {
                LOG.debug("Skipping unit '{}' included from '{}', which is already merged", include, unit.id());
                continue;
            }
            Unit included = loader.load(include);
            if (included == null) throw HUCTLpException.of(UNIT_NOT_FOUND, include, unit.id());
            add(included);
        }
        return this;
    }

    public AssignmentTable merged() {
        return merged;
    }
}
