/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.huctlp;

import com.vaticle.huctlp.common.HUCTLpToken;
import com.vaticle.huctlp.pattern.direction.DirFormula;
import com.vaticle.huctlp.pattern.expression.Expression;
import com.vaticle.huctlp.pattern.formula.Atom;
import com.vaticle.huctlp.pattern.formula.Connective;
import com.vaticle.huctlp.pattern.formula.FirstOrder;
import com.vaticle.huctlp.pattern.formula.Formula;
import com.vaticle.huctlp.pattern.formula.Hybrid;
import com.vaticle.huctlp.pattern.formula.PathQuantifier;
import com.vaticle.huctlp.pattern.formula.Temporal;

import static com.vaticle.huctlp.pattern.formula.PathQuantifier.A;
import static com.vaticle.huctlp.pattern.formula.PathQuantifier.E;

/**
 * Static builders for HUCTLp formulas, expressions and direction formulas, e.g.
 * {@code AG(implies(reference("p"), EF(reference("q"))))}.
 *
 * Temporal builders without a direction follow every transition.
 */
public class HUCTLp {

    public static final Atom.True TRUE = Formula.TRUE;
    public static final Atom.False FALSE = Formula.FALSE;

    private HUCTLp() {}

    // Atoms

    public static Atom.Reference reference(String name) {
        return new Atom.Reference(name);
    }

    public static Atom.Transition transition(String name, HUCTLpToken.Direction direction, HUCTLpToken.Sign flow) {
        return new Atom.Transition(name, direction, flow);
    }

    // Expressions

    public static Expression.Variable var(String name) {
        return new Expression.Variable(name);
    }

    public static Expression.Constant constant(double value) {
        return new Expression.Constant(value);
    }

    public static Expression.Operation plus(Expression left, Expression right) {
        return new Expression.Operation(HUCTLpToken.Arithmetic.PLUS, left, right);
    }

    public static Expression.Operation minus(Expression left, Expression right) {
        return new Expression.Operation(HUCTLpToken.Arithmetic.MINUS, left, right);
    }

    public static Expression.Operation times(Expression left, Expression right) {
        return new Expression.Operation(HUCTLpToken.Arithmetic.TIMES, left, right);
    }

    public static Expression.Operation div(Expression left, Expression right) {
        return new Expression.Operation(HUCTLpToken.Arithmetic.DIV, left, right);
    }

    public static Atom.Numeric eq(Expression left, Expression right) {
        return new Atom.Numeric(left, HUCTLpToken.Comparator.EQ, right);
    }

    public static Atom.Numeric neq(Expression left, Expression right) {
        return new Atom.Numeric(left, HUCTLpToken.Comparator.NEQ, right);
    }

    public static Atom.Numeric lt(Expression left, Expression right) {
        return new Atom.Numeric(left, HUCTLpToken.Comparator.LT, right);
    }

    public static Atom.Numeric le(Expression left, Expression right) {
        return new Atom.Numeric(left, HUCTLpToken.Comparator.LTE, right);
    }

    public static Atom.Numeric gt(Expression left, Expression right) {
        return new Atom.Numeric(left, HUCTLpToken.Comparator.GT, right);
    }

    public static Atom.Numeric ge(Expression left, Expression right) {
        return new Atom.Numeric(left, HUCTLpToken.Comparator.GTE, right);
    }

    // Boolean connectives

    public static Connective.Not not(Formula inner) {
        return new Connective.Not(inner);
    }

    public static Connective.And and(Formula left, Formula right) {
        return new Connective.And(left, right);
    }

    public static Connective.Or or(Formula left, Formula right) {
        return new Connective.Or(left, right);
    }

    public static Connective.Implies implies(Formula left, Formula right) {
        return new Connective.Implies(left, right);
    }

    public static Connective.Equals equal(Formula left, Formula right) {
        return new Connective.Equals(left, right);
    }

    // Temporal operators

    public static Temporal.Next next(PathQuantifier quantifier, Formula inner, DirFormula direction) {
        return new Temporal.Next(quantifier, inner, direction);
    }

    public static Temporal.WeakNext weakNext(PathQuantifier quantifier, Formula inner, DirFormula direction) {
        return new Temporal.WeakNext(quantifier, inner, direction);
    }

    public static Temporal.Future future(PathQuantifier quantifier, Formula inner, DirFormula direction) {
        return new Temporal.Future(quantifier, inner, direction);
    }

    public static Temporal.WeakFuture weakFuture(PathQuantifier quantifier, Formula inner, DirFormula direction) {
        return new Temporal.WeakFuture(quantifier, inner, direction);
    }

    public static Temporal.Globally globally(PathQuantifier quantifier, Formula inner, DirFormula direction) {
        return new Temporal.Globally(quantifier, inner, direction);
    }

    public static Temporal.Until until(PathQuantifier quantifier, Formula path, Formula reach, DirFormula direction) {
        return new Temporal.Until(quantifier, path, reach, direction);
    }

    /**
     * Builds {@code path {left}U{right} reach}: {@code path} holds along {@code left} transitions until
     * a {@code right} transition leads to a state where {@code reach} holds. Without a right direction,
     * or with the direction {@code true}, this is a plain until.
     */
    public static Formula until(PathQuantifier quantifier, Formula path, Formula reach, DirFormula left, DirFormula right) {
        if (right.isTrue()) return new Temporal.Until(quantifier, path, reach, left);
        else return new Temporal.Until(quantifier, path, new Temporal.Next(quantifier, reach, right), left);
    }

    public static Temporal.Next AX(Formula inner) {
        return next(A, inner, DirFormula.TRUE);
    }

    public static Temporal.Next AX(Formula inner, DirFormula direction) {
        return next(A, inner, direction);
    }

    public static Temporal.Next EX(Formula inner) {
        return next(E, inner, DirFormula.TRUE);
    }

    public static Temporal.Next EX(Formula inner, DirFormula direction) {
        return next(E, inner, direction);
    }

    public static Temporal.WeakNext AwX(Formula inner, DirFormula direction) {
        return weakNext(A, inner, direction);
    }

    public static Temporal.WeakNext EwX(Formula inner, DirFormula direction) {
        return weakNext(E, inner, direction);
    }

    public static Temporal.Future AF(Formula inner) {
        return future(A, inner, DirFormula.TRUE);
    }

    public static Temporal.Future AF(Formula inner, DirFormula direction) {
        return future(A, inner, direction);
    }

    public static Temporal.Future EF(Formula inner) {
        return future(E, inner, DirFormula.TRUE);
    }

    public static Temporal.Future EF(Formula inner, DirFormula direction) {
        return future(E, inner, direction);
    }

    public static Temporal.WeakFuture AwF(Formula inner, DirFormula direction) {
        return weakFuture(A, inner, direction);
    }

    public static Temporal.WeakFuture EwF(Formula inner, DirFormula direction) {
        return weakFuture(E, inner, direction);
    }

    public static Temporal.Globally AG(Formula inner) {
        return globally(A, inner, DirFormula.TRUE);
    }

    public static Temporal.Globally AG(Formula inner, DirFormula direction) {
        return globally(A, inner, direction);
    }

    public static Temporal.Globally EG(Formula inner) {
        return globally(E, inner, DirFormula.TRUE);
    }

    public static Temporal.Globally EG(Formula inner, DirFormula direction) {
        return globally(E, inner, direction);
    }

    public static Temporal.Until AU(Formula path, Formula reach) {
        return until(A, path, reach, DirFormula.TRUE);
    }

    public static Temporal.Until AU(Formula path, Formula reach, DirFormula direction) {
        return until(A, path, reach, direction);
    }

    public static Temporal.Until EU(Formula path, Formula reach) {
        return until(E, path, reach, DirFormula.TRUE);
    }

    public static Temporal.Until EU(Formula path, Formula reach, DirFormula direction) {
        return until(E, path, reach, direction);
    }

    // First order and hybrid operators

    public static FirstOrder.ForAll forall(String name, Formula bound, Formula target) {
        return new FirstOrder.ForAll(name, bound, target);
    }

    public static FirstOrder.Exists exists(String name, Formula bound, Formula target) {
        return new FirstOrder.Exists(name, bound, target);
    }

    public static Hybrid.Bind bind(String name, Formula target) {
        return new Hybrid.Bind(name, target);
    }

    public static Hybrid.At at(String name, Formula target) {
        return new Hybrid.At(name, target);
    }

    /**
     * Builders for direction formulas.
     */
    public static class Dir {

        public static final DirFormula TRUE = DirFormula.TRUE;
        public static final DirFormula FALSE = DirFormula.FALSE;

        private Dir() {}

        public static DirFormula.Proposition up(String name) {
            return new DirFormula.Proposition(name, HUCTLpToken.Sign.POSITIVE);
        }

        public static DirFormula.Proposition down(String name) {
            return new DirFormula.Proposition(name, HUCTLpToken.Sign.NEGATIVE);
        }

        public static DirFormula.Reference reference(String name) {
            return new DirFormula.Reference(name);
        }

        public static DirFormula.Not not(DirFormula inner) {
            return new DirFormula.Not(inner);
        }

        public static DirFormula.Bool and(DirFormula left, DirFormula right) {
            return new DirFormula.Bool(HUCTLpToken.Logic.AND, left, right);
        }

        public static DirFormula.Bool or(DirFormula left, DirFormula right) {
            return new DirFormula.Bool(HUCTLpToken.Logic.OR, left, right);
        }

        public static DirFormula.Bool implies(DirFormula left, DirFormula right) {
            return new DirFormula.Bool(HUCTLpToken.Logic.IMPLIES, left, right);
        }

        public static DirFormula.Bool equal(DirFormula left, DirFormula right) {
            return new DirFormula.Bool(HUCTLpToken.Logic.EQUALS, left, right);
        }
    }
}
