/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.huctlp.logic;

import com.google.common.collect.ImmutableMap;
import com.vaticle.huctlp.common.exception.HUCTLpException;
import com.vaticle.huctlp.pattern.direction.DirFormula;
import com.vaticle.huctlp.pattern.expression.Expression;
import com.vaticle.huctlp.pattern.formula.Atom;
import com.vaticle.huctlp.pattern.formula.Formula;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

import static com.vaticle.huctlp.common.exception.ErrorMessage.Internal.ILLEGAL_STATE;
import static com.vaticle.huctlp.common.exception.ErrorMessage.Internal.UNEXPECTED_FAILURE;
import static com.vaticle.huctlp.common.exception.ErrorMessage.Internal.UNEXPECTED_INTERRUPTION;
import static com.vaticle.huctlp.common.exception.ErrorMessage.Resolution.SORT_MISMATCH;
import static com.vaticle.huctlp.common.exception.ErrorMessage.Resolution.UNDEFINED_REFERENCE;

/**
 * Replaces every reference in an assignment table by the value it names.
 *
 * A pass first closes all aliases, so that every alias holds the value of the first non-alias
 * assignment it leads to. It then resolves the references inside every expression, direction
 * formula and formula, checking that each name is used at a site of its own sort. A name that is
 * still being resolved when it is referenced again is part of a cycle.
 *
 * When an executor is given, the assignments are resolved in parallel during the second phase. Errors
 * are still reported for the first failing assignment in table order.
 */
public class ReferenceResolver {

    private static final Logger LOG = LoggerFactory.getLogger(ReferenceResolver.class);

    @Nullable
    private final ExecutorService executor;

    public ReferenceResolver() {
        this(null);
    }

    public ReferenceResolver(@Nullable ExecutorService executor) {
        this.executor = executor;
    }

    /**
     * @return the resolved formulas of the table, in table order, restricted to the flagged
     * assignments when {@code onlyFlagged} is set
     * @throws HUCTLpException when a name is undefined, cyclic or used at a site of another sort
     */
    public Map<String, Formula> resolve(AssignmentTable table, boolean onlyFlagged) {
        LOG.debug("Resolving {} assignments", table.size());
        return new Pass(table).resolve(onlyFlagged);
    }

    private class Pass {

        private final Map<String, Assignment> working;
        private final Map<String, Expression> expressions;
        private final Map<String, DirFormula> directions;
        private final Map<String, Formula> formulas;

        private Pass(AssignmentTable table) {
            this.working = new LinkedHashMap<>(table.toMap());
            this.expressions = new ConcurrentHashMap<>();
            this.directions = new ConcurrentHashMap<>();
            this.formulas = new ConcurrentHashMap<>();
        }

        private Map<String, Formula> resolve(boolean onlyFlagged) {
            List<String> aliases = new ArrayList<>();
            working.forEach((name, assignment) -> {
                if (assignment.value().isAlias()) aliases.add(name);
            });
            aliases.forEach(name -> resolveAlias(name, new ResolutionStack()));
            LOG.debug("Closed {} aliases", aliases.size());

            List<Assignment> assignments = new ArrayList<>(working.values());
            List<Assignment.Value> resolved = executor == null ? resolveSequentially(assignments) : resolveInParallel(assignments);
            LOG.debug("Resolved references of {} assignments", resolved.size());

            ImmutableMap.Builder<String, Formula> results = ImmutableMap.builder();
            for (int i = 0; i < assignments.size(); i++) {
                Assignment assignment = assignments.get(i);
                if (resolved.get(i).isFormula() && (!onlyFlagged || assignment.isFlagged())) {
                    results.put(assignment.name(), resolved.get(i).asFormula().formula());
                }
            }
            return results.build();
        }

        private Assignment.Value resolveAlias(String name, ResolutionStack stack) {
            Assignment assignment = working.get(name);
            if (!assignment.value().isAlias()) return assignment.value();
            stack.push(name);
            String targetName = assignment.value().asAlias().target();
            Assignment target = working.get(targetName);
            if (target == null) throw HUCTLpException.of(UNDEFINED_REFERENCE, targetName);
            Assignment.Value value = target.value().isAlias() ? resolveAlias(targetName, stack) : target.value();
            working.put(name, assignment.withValue(value));
            stack.pop();
            return value;
        }

        private List<Assignment.Value> resolveSequentially(List<Assignment> assignments) {
            List<Assignment.Value> resolved = new ArrayList<>(assignments.size());
            for (Assignment assignment : assignments) resolved.add(resolveValue(assignment));
            return resolved;
        }

        private List<Assignment.Value> resolveInParallel(List<Assignment> assignments) {
            assert executor != null;
            List<Future<Assignment.Value>> futures = new ArrayList<>(assignments.size());
            for (Assignment assignment : assignments) futures.add(executor.submit(() -> resolveValue(assignment)));
            List<Assignment.Value> resolved = new ArrayList<>(assignments.size());
            try {
                for (int i = 0; i < futures.size(); i++) {
                    resolved.add(await(futures.get(i), assignments.get(i).name()));
                }
            } finally {
                futures.forEach(future -> future.cancel(true));
            }
            return resolved;
        }

        private Assignment.Value await(Future<Assignment.Value> future, String name) {
            try {
                return future.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw HUCTLpException.of(UNEXPECTED_INTERRUPTION, e, name);
            } catch (ExecutionException e) {
                if (e.getCause() instanceof HUCTLpException) throw (HUCTLpException) e.getCause();
                else throw HUCTLpException.of(UNEXPECTED_FAILURE, e.getCause(), name);
            }
        }

        private Assignment.Value resolveValue(Assignment assignment) {
            Assignment.Value value = assignment.value();
            ResolutionStack stack = new ResolutionStack();
            if (value.isExpression()) {
                return Assignment.Value.of(resolveExpression(value.asExpression().expression(), stack));
            } else if (value.isDirection()) {
                return Assignment.Value.of(resolveDirection(value.asDirection().direction(), stack));
            } else if (value.isFormula()) {
                return Assignment.Value.of(resolveFormula(value.asFormula().formula(), stack));
            } else throw HUCTLpException.of(ILLEGAL_STATE);
        }

        private Expression resolveExpression(Expression expression, ResolutionStack stack) {
            return expression.mapLeaves(variable -> {
                String name = variable.name();
                stack.push(name);
                Assignment assignment = working.get(name);
                Expression resolved;
                if (assignment == null) {
                    resolved = variable;
                } else if (!assignment.value().isExpression()) {
                    throw HUCTLpException.of(SORT_MISMATCH, name, Sort.EXPRESSION, assignment.sort());
                } else {
                    resolved = expressions.get(name);
                    if (resolved == null) {
                        resolved = resolveExpression(assignment.value().asExpression().expression(), stack);
                        expressions.putIfAbsent(name, resolved);
                    }
                }
                stack.pop();
                return resolved;
            });
        }

        private DirFormula resolveDirection(DirFormula direction, ResolutionStack stack) {
            return direction.mapLeaves(leaf -> {
                if (!leaf.isReference()) return leaf;
                String name = leaf.asReference().name();
                stack.push(name);
                Assignment assignment = working.get(name);
                if (assignment == null) throw HUCTLpException.of(UNDEFINED_REFERENCE, name);
                DirFormula resolved = directions.get(name);
                if (resolved == null) {
                    resolved = resolveDirection(directionOf(name, assignment), stack);
                    directions.putIfAbsent(name, resolved);
                }
                stack.pop();
                return resolved;
            });
        }

        private DirFormula directionOf(String name, Assignment assignment) {
            if (assignment.value().isDirection()) return assignment.value().asDirection().direction();
            Optional<DirFormula> reinterpreted = assignment.value().isFormula()
                    ? assignment.value().asFormula().formula().asDirFormula()
                    : Optional.empty();
            return reinterpreted.orElseThrow(() -> HUCTLpException.of(SORT_MISMATCH, name, Sort.DIRECTION, assignment.sort()));
        }

        private Formula resolveFormula(Formula formula, ResolutionStack stack) {
            return formula.fold(
                    atom -> resolveAtom(atom, stack),
                    (node, inner) -> resolveDirectionOf(node.rebuild(inner), stack),
                    (node, left, right) -> resolveDirectionOf(node.rebuild(left, right), stack)
            );
        }

        private Formula resolveAtom(Formula atom, ResolutionStack stack) {
            if (atom.isNumeric()) {
                Atom.Numeric numeric = atom.asNumeric();
                return numeric.rebuild(resolveExpression(numeric.left(), stack), resolveExpression(numeric.right(), stack));
            } else if (!atom.isReference()) {
                return atom;
            }

            String name = atom.asReference().name();
            stack.push(name);
            Assignment assignment = working.get(name);
            if (assignment == null) throw HUCTLpException.of(UNDEFINED_REFERENCE, name);
            else if (!assignment.value().isFormula()) {
                throw HUCTLpException.of(SORT_MISMATCH, name, Sort.FORMULA, assignment.sort());
            }
            Formula resolved = formulas.get(name);
            if (resolved == null) {
                resolved = resolveFormula(assignment.value().asFormula().formula(), stack);
                formulas.putIfAbsent(name, resolved);
            }
            stack.pop();
            return resolved;
        }

        private Formula resolveDirectionOf(Formula formula, ResolutionStack stack) {
            if (!formula.isTemporal()) return formula;
            return formula.asTemporal().direction(resolveDirection(formula.asTemporal().direction(), stack));
        }
    }
}
