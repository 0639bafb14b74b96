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

import java.util.Objects;

import static com.vaticle.huctlp.common.exception.ErrorMessage.Internal.ILLEGAL_CAST;
import static com.vaticle.huctlp.common.util.Objects.className;

/**
 * A named definition: {@code name = value}, found at {@code location} and optionally flagged for
 * output.
 */
public class Assignment {

    private final String name;
    private final Value value;
    private final String location;
    private final boolean flagged;

    public Assignment(String name, Value value, String location, boolean flagged) {
        if (name == null) throw new NullPointerException("Null name");
        if (value == null) throw new NullPointerException("Null value");
        if (location == null) throw new NullPointerException("Null location");
        this.name = name;
        this.value = value;
        this.location = location;
        this.flagged = flagged;
    }

    public String name() {
        return name;
    }

    public Value value() {
        return value;
    }

    public Sort sort() {
        return value.sort();
    }

    public String location() {
        return location;
    }

    public boolean isFlagged() {
        return flagged;
    }

    public Assignment withValue(Value value) {
        return new Assignment(name, value, location, flagged);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Assignment that = (Assignment) o;
        return this.name.equals(that.name) && this.value.equals(that.value) &&
                this.location.equals(that.location) && this.flagged == that.flagged;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, value, location, flagged);
    }

    @Override
    public String toString() {
        return (flagged ? "#" : "") + name + " = " + value + " @ " + location;
    }

    public abstract static class Value {

        Value() {}

        public static Alias alias(String target) {
            return new Alias(target);
        }

        public static Expr of(Expression expression) {
            return new Expr(expression);
        }

        public static Dir of(DirFormula direction) {
            return new Dir(direction);
        }

        public static Form of(Formula formula) {
            return new Form(formula);
        }

        public abstract Sort sort();

        public boolean isAlias() {
            return false;
        }

        public boolean isExpression() {
            return false;
        }

        public boolean isDirection() {
            return false;
        }

        public boolean isFormula() {
            return false;
        }

        public Alias asAlias() {
            throw HUCTLpException.of(ILLEGAL_CAST, className(getClass()), className(Alias.class));
        }

        public Expr asExpression() {
            throw HUCTLpException.of(ILLEGAL_CAST, className(getClass()), className(Expr.class));
        }

        public Dir asDirection() {
            throw HUCTLpException.of(ILLEGAL_CAST, className(getClass()), className(Dir.class));
        }

        public Form asFormula() {
            throw HUCTLpException.of(ILLEGAL_CAST, className(getClass()), className(Form.class));
        }

        /**
         * A name standing for another name, of any sort.
         */
        public static class Alias extends Value {

            private final String target;

            Alias(String target) {
                if (target == null) throw new NullPointerException("Null target");
                this.target = target;
            }

            public String target() {
                return target;
            }

            @Override
            public Sort sort() {
                return Sort.ALIAS;
            }

            @Override
            public boolean isAlias() {
                return true;
            }

            @Override
            public Alias asAlias() {
                return this;
            }

            @Override
            public boolean equals(Object o) {
                if (this == o) return true;
                if (o == null || getClass() != o.getClass()) return false;
                return target.equals(((Alias) o).target);
            }

            @Override
            public int hashCode() {
                return Objects.hash(Alias.class, target);
            }

            @Override
            public String toString() {
                return target;
            }
        }

        public static class Expr extends Value {

            private final Expression expression;

            Expr(Expression expression) {
                if (expression == null) throw new NullPointerException("Null expression");
                this.expression = expression;
            }

            public Expression expression() {
                return expression;
            }

            @Override
            public Sort sort() {
                return Sort.EXPRESSION;
            }

            @Override
            public boolean isExpression() {
                return true;
            }

            @Override
            public Expr asExpression() {
                return this;
            }

            @Override
            public boolean equals(Object o) {
                if (this == o) return true;
                if (o == null || getClass() != o.getClass()) return false;
                return expression.equals(((Expr) o).expression);
            }

            @Override
            public int hashCode() {
                return Objects.hash(Expr.class, expression);
            }

            @Override
            public String toString() {
                return expression.toString();
            }
        }

        public static class Dir extends Value {

            private final DirFormula direction;

            Dir(DirFormula direction) {
                if (direction == null) throw new NullPointerException("Null direction");
                this.direction = direction;
            }

            public DirFormula direction() {
                return direction;
            }

            @Override
            public Sort sort() {
                return Sort.DIRECTION;
            }

            @Override
            public boolean isDirection() {
                return true;
            }

            @Override
            public Dir asDirection() {
                return this;
            }

            @Override
            public boolean equals(Object o) {
                if (this == o) return true;
                if (o == null || getClass() != o.getClass()) return false;
                return direction.equals(((Dir) o).direction);
            }

            @Override
            public int hashCode() {
                return Objects.hash(Dir.class, direction);
            }

            @Override
            public String toString() {
                return direction.toString();
            }
        }

        public static class Form extends Value {

            private final Formula formula;

            Form(Formula formula) {
                if (formula == null) throw new NullPointerException("Null formula");
                this.formula = formula;
            }

            public Formula formula() {
                return formula;
            }

            @Override
            public Sort sort() {
                return Sort.FORMULA;
            }

            @Override
            public boolean isFormula() {
                return true;
            }

            @Override
            public Form asFormula() {
                return this;
            }

            @Override
            public boolean equals(Object o) {
                if (this == o) return true;
                if (o == null || getClass() != o.getClass()) return false;
                return formula.equals(((Form) o).formula);
            }

            @Override
            public int hashCode() {
                return Objects.hash(Form.class, formula);
            }

            @Override
            public String toString() {
                return formula.toString();
            }
        }
    }
}
