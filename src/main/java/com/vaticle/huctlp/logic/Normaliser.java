/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.huctlp.logic;

import com.vaticle.huctlp.pattern.direction.DirFormula;
import com.vaticle.huctlp.pattern.formula.Connective.And;
import com.vaticle.huctlp.pattern.formula.Connective.Not;
import com.vaticle.huctlp.pattern.formula.Connective.Or;
import com.vaticle.huctlp.pattern.formula.Formula;
import com.vaticle.huctlp.pattern.formula.PathQuantifier;
import com.vaticle.huctlp.pattern.formula.Temporal;
import com.vaticle.huctlp.pattern.formula.Temporal.Next;
import com.vaticle.huctlp.pattern.formula.Temporal.Until;

import static com.vaticle.huctlp.pattern.formula.Formula.TRUE;

/**
 * Rewrites formulas into the minimal operator basis: atoms, {@code !}, {@code &&}, {@code ||},
 * existential next and until. First-order and hybrid operators are kept, with normalised operands.
 *
 * The rewrite is applied bottom up, so every rewritten node already has normalised children, and the
 * result of a rewrite contains only operators of the basis. Normalisation is therefore idempotent.
 */
public class Normaliser {

    private Normaliser() {}

    public static Formula normalise(Formula formula) {
        return formula.fold(
                atom -> atom,
                (node, inner) -> rewrite(node.rebuild(inner)),
                (node, left, right) -> rewrite(node.rebuild(left, right))
        );
    }

    private static Formula rewrite(Formula formula) {
        if (formula.isImplies()) {
            return new Or(new Not(formula.asImplies().left()), formula.asImplies().right());
        } else if (formula.isEquals()) {
            Formula left = formula.asEquals().left();
            Formula right = formula.asEquals().right();
            return new Or(new And(left, right), new And(new Not(left), new Not(right)));
        } else if (formula.isTemporal()) {
            return rewrite(formula.asTemporal());
        } else {
            return formula;
        }
    }

    private static Formula rewrite(Temporal temporal) {
        if (temporal.isUntil()) return temporal;

        PathQuantifier quantifier = temporal.quantifier();
        DirFormula direction = temporal.direction();
        Formula inner = temporal.asSimple().inner();
        if (temporal.isNext()) {
            if (quantifier.isExistential()) return temporal;
            else return new Not(new Next(quantifier.dual(), new Not(inner), direction));
        } else if (temporal.isFuture()) {
            return new Until(quantifier, TRUE, inner, direction);
        } else if (temporal.isGlobally()) {
            return new Not(new Until(quantifier.dual(), TRUE, new Not(inner), direction));
        } else if (temporal.isWeakNext()) {
            if (direction.isTrue() || quantifier.isUniversal()) {
                return rewrite(new Next(quantifier, inner, direction));
            } else {
                return new Or(new Next(quantifier, inner, direction), leavesDirection(quantifier, direction));
            }
        } else if (temporal.isWeakFuture()) {
            if (direction.isTrue()) return new Until(quantifier, TRUE, inner, direction);
            else return new Until(quantifier, TRUE, new Or(inner, leavesDirection(quantifier.existential(), direction)), direction);
        } else {
            return temporal;
        }
    }

    /**
     * @return a formula holding in states with some successor outside of {@code direction}
     */
    private static Formula leavesDirection(PathQuantifier quantifier, DirFormula direction) {
        return new Next(quantifier, TRUE, new DirFormula.Not(direction));
    }
}
