/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.huctlp.logic;

import com.google.common.collect.ImmutableMap;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.vaticle.huctlp.common.config.Config;
import com.vaticle.huctlp.common.exception.HUCTLpException;
import com.vaticle.huctlp.pattern.formula.Formula;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;

import static com.vaticle.huctlp.common.config.ConfigKey.NORMALISER_ENABLED;
import static com.vaticle.huctlp.common.config.ConfigKey.RESOLVER_ONLY_FLAGGED;
import static com.vaticle.huctlp.common.config.ConfigKey.RESOLVER_PARALLELISM;
import static com.vaticle.huctlp.common.exception.ErrorMessage.Config.CONFIG_VALUE_UNEXPECTED;

/**
 * Entry point from units to resolved, and optionally normalised, named formulas.
 */
public class FormulaManager implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(FormulaManager.class);

    private final boolean onlyFlagged;
    private final boolean normalise;
    @Nullable
    private final ExecutorService executor;
    private final ReferenceResolver resolver;

    public FormulaManager() {
        this(Config.create());
    }

    public FormulaManager(Config config) {
        this.onlyFlagged = config.getProperty(RESOLVER_ONLY_FLAGGED);
        this.normalise = config.getProperty(NORMALISER_ENABLED);
        int parallelism = config.getProperty(RESOLVER_PARALLELISM);
        if (parallelism < 1) throw HUCTLpException.of(CONFIG_VALUE_UNEXPECTED, RESOLVER_PARALLELISM, parallelism);
        if (parallelism > 1) {
            ThreadFactory threadFactory = new ThreadFactoryBuilder().setNameFormat("huctlp-resolver-%d").setDaemon(true).build();
            this.executor = Executors.newFixedThreadPool(parallelism, threadFactory);
        } else {
            this.executor = null;
        }
        this.resolver = new ReferenceResolver(executor);
        LOG.debug("Created formula manager with resolver parallelism {}", parallelism);
    }

    public Map<String, Formula> resolve(List<Unit> units) {
        return resolve(units, onlyFlagged);
    }

    /**
     * Resolves the given units. Their includes are looked up among the given units.
     */
    public Map<String, Formula> resolve(List<Unit> units, boolean onlyFlagged) {
        Map<String, Unit> byId = new HashMap<>();
        units.forEach(unit -> byId.putIfAbsent(unit.id(), unit));
        return resolver.resolve(UnitMerger.merge(units, byId::get), onlyFlagged);
    }

    public Map<String, Formula> resolve(String rootUnitId, UnitLoader loader, boolean onlyFlagged) {
        return resolver.resolve(UnitMerger.merge(rootUnitId, loader), onlyFlagged);
    }

    public Formula normalise(Formula formula) {
        return Normaliser.normalise(formula);
    }

    public Map<String, Formula> resolveNormalised(List<Unit> units, boolean onlyFlagged) {
        return normaliseAll(resolve(units, onlyFlagged));
    }

    public Map<String, Formula> resolveNormalised(String rootUnitId, UnitLoader loader, boolean onlyFlagged) {
        return normaliseAll(resolve(rootUnitId, loader, onlyFlagged));
    }

    /**
     * Resolves the given units with the configured flag filter, and normalises the result if the
     * normaliser is enabled.
     */
    public Map<String, Formula> compile(List<Unit> units) {
        Map<String, Formula> resolved = resolve(units, onlyFlagged);
        return normalise ? normaliseAll(resolved) : resolved;
    }

    private Map<String, Formula> normaliseAll(Map<String, Formula> formulas) {
        ImmutableMap.Builder<String, Formula> normalised = ImmutableMap.builder();
        formulas.forEach((name, formula) -> normalised.put(name, Normaliser.normalise(formula)));
        return normalised.build();
    }

    @Override
    public void close() {
        if (executor != null) executor.shutdownNow();
    }
}
