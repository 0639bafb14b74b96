/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.huctlp.pattern.expression;

import com.vaticle.huctlp.common.HUCTLpToken;
import com.vaticle.huctlp.common.exception.HUCTLpException;

import java.util.Objects;
import java.util.function.Function;

import static com.vaticle.huctlp.common.HUCTLpToken.Char.PARAN_CLOSE;
import static com.vaticle.huctlp.common.HUCTLpToken.Char.PARAN_OPEN;
import static com.vaticle.huctlp.common.HUCTLpToken.Char.SPACE;
import static com.vaticle.huctlp.common.exception.ErrorMessage.Internal.ILLEGAL_CAST;
import static com.vaticle.huctlp.common.util.Objects.className;

/**
 * An arithmetic expression over model variables and numeric constants. Expressions are the operands
 * of numeric propositions.
 */
public abstract class Expression {

    public boolean isVariable() {
        return false;
    }

    public boolean isConstant() {
        return false;
    }

    public boolean isOperation() {
        return false;
    }

    public Variable asVariable() {
        throw HUCTLpException.of(ILLEGAL_CAST, className(getClass()), className(Variable.class));
    }

    public Constant asConstant() {
        throw HUCTLpException.of(ILLEGAL_CAST, className(getClass()), className(Constant.class));
    }

    public Operation asOperation() {
        throw HUCTLpException.of(ILLEGAL_CAST, className(getClass()), className(Operation.class));
    }

    /**
     * Rebuilds this expression with every variable leaf replaced by the result of {@code leaf}.
     * Constants are kept, operations keep their operator.
     */
    public abstract Expression mapLeaves(Function<Variable, Expression> leaf);

    public Expression substitute(String name, Expression replacement) {
        return mapLeaves(variable -> variable.name().equals(name) ? replacement : variable);
    }

    public static class Variable extends Expression {

        private final String name;

        public Variable(String name) {
            if (name == null) throw new NullPointerException("Null name");
            this.name = name;
        }

        public String name() {
            return name;
        }

        @Override
        public boolean isVariable() {
            return true;
        }

        @Override
        public Variable asVariable() {
            return this;
        }

        @Override
        public Expression mapLeaves(Function<Variable, Expression> leaf) {
            return leaf.apply(this);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            return name.equals(((Variable) o).name);
        }

        @Override
        public int hashCode() {
            return Objects.hash(Variable.class, name);
        }

        @Override
        public String toString() {
            return name;
        }
    }

    public static class Constant extends Expression {

        private final double value;

        public Constant(double value) {
            this.value = value;
        }

        public double value() {
            return value;
        }

        @Override
        public boolean isConstant() {
            return true;
        }

        @Override
        public Constant asConstant() {
            return this;
        }

        @Override
        public Expression mapLeaves(Function<Variable, Expression> leaf) {
            return this;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            return Double.compare(value, ((Constant) o).value) == 0;
        }

        @Override
        public int hashCode() {
            return Objects.hash(Constant.class, value);
        }

        @Override
        public String toString() {
            return Double.toString(value);
        }
    }

    public static class Operation extends Expression {

        private final HUCTLpToken.Arithmetic operator;
        private final Expression left;
        private final Expression right;
        private final int hash;

        public Operation(HUCTLpToken.Arithmetic operator, Expression left, Expression right) {
            if (operator == null) throw new NullPointerException("Null operator");
            if (left == null || right == null) throw new NullPointerException("Null operand");
            this.operator = operator;
            this.left = left;
            this.right = right;
            this.hash = Objects.hash(Operation.class, operator, left, right);
        }

        public HUCTLpToken.Arithmetic operator() {
            return operator;
        }

        public Expression left() {
            return left;
        }

        public Expression right() {
            return right;
        }

        public Operation rebuild(Expression left, Expression right) {
            return new Operation(operator, left, right);
        }

        @Override
        public boolean isOperation() {
            return true;
        }

        @Override
        public Operation asOperation() {
            return this;
        }

        @Override
        public Expression mapLeaves(Function<Variable, Expression> leaf) {
            return rebuild(left.mapLeaves(leaf), right.mapLeaves(leaf));
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Operation that = (Operation) o;
            return this.operator == that.operator && this.left.equals(that.left) && this.right.equals(that.right);
        }

        @Override
        public int hashCode() {
            return hash;
        }

        @Override
        public String toString() {
            return "" + PARAN_OPEN + left + SPACE + operator + SPACE + right + PARAN_CLOSE;
        }
    }
}
