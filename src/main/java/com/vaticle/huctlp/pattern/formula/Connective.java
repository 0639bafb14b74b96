/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.huctlp.pattern.formula;

import com.vaticle.huctlp.common.HUCTLpToken;
import com.vaticle.huctlp.pattern.direction.DirFormula;

import java.util.Objects;
import java.util.Optional;

import static com.vaticle.huctlp.common.HUCTLpToken.Char.PARAN_CLOSE;
import static com.vaticle.huctlp.common.HUCTLpToken.Char.PARAN_OPEN;
import static com.vaticle.huctlp.common.HUCTLpToken.Char.SPACE;
import static com.vaticle.huctlp.common.HUCTLpToken.Logic.AND;
import static com.vaticle.huctlp.common.HUCTLpToken.Logic.EQUALS;
import static com.vaticle.huctlp.common.HUCTLpToken.Logic.IMPLIES;
import static com.vaticle.huctlp.common.HUCTLpToken.Logic.NOT;
import static com.vaticle.huctlp.common.HUCTLpToken.Logic.OR;

public abstract class Connective extends Formula {

    Connective() {}

    public static class Not extends Connective implements Formula.Unary {

        private final Formula inner;
        private final int hash;

        public Not(Formula inner) {
            if (inner == null) throw new NullPointerException("Null inner");
            this.inner = inner;
            this.hash = Objects.hash(Not.class, inner);
        }

        @Override
        public Formula inner() {
            return inner;
        }

        @Override
        public Not rebuild(Formula inner) {
            return new Not(inner);
        }

        @Override
        public boolean isUnary() {
            return true;
        }

        @Override
        public Unary asUnary() {
            return this;
        }

        @Override
        public boolean isNot() {
            return true;
        }

        @Override
        public Not asNot() {
            return this;
        }

        @Override
        String computeString() {
            return NOT.toString() + inner;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            return inner.equals(((Not) o).inner);
        }

        @Override
        public int hashCode() {
            return hash;
        }
    }

    /**
     * A binary boolean connective. Binary connectives over direction-representable operands are
     * themselves direction-representable.
     */
    public abstract static class Bool extends Connective implements Formula.Binary {

        private final HUCTLpToken.Logic operator;
        private final Formula left;
        private final Formula right;
        private final int hash;

        Bool(HUCTLpToken.Logic operator, Formula left, Formula right) {
            if (left == null || right == null) throw new NullPointerException("Null operand");
            this.operator = operator;
            this.left = left;
            this.right = right;
            this.hash = Objects.hash(getClass(), left, right);
        }

        public HUCTLpToken.Logic operator() {
            return operator;
        }

        @Override
        public Formula left() {
            return left;
        }

        @Override
        public Formula right() {
            return right;
        }

        @Override
        public abstract Bool rebuild(Formula left, Formula right);

        @Override
        public boolean isBinary() {
            return true;
        }

        @Override
        public Binary asBinary() {
            return this;
        }

        @Override
        public Optional<DirFormula> asDirFormula() {
            return left.asDirFormula().flatMap(l -> right.asDirFormula().map(r -> new DirFormula.Bool(operator, l, r)));
        }

        @Override
        String computeString() {
            return "" + PARAN_OPEN + left + SPACE + operator + SPACE + right + PARAN_CLOSE;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Bool that = (Bool) o;
            return this.left.equals(that.left) && this.right.equals(that.right);
        }

        @Override
        public int hashCode() {
            return hash;
        }
    }

    public static class And extends Bool {

        public And(Formula left, Formula right) {
            super(AND, left, right);
        }

        @Override
        public And rebuild(Formula left, Formula right) {
            return new And(left, right);
        }

        @Override
        public boolean isAnd() {
            return true;
        }

        @Override
        public And asAnd() {
            return this;
        }
    }

    public static class Or extends Bool {

        public Or(Formula left, Formula right) {
            super(OR, left, right);
        }

        @Override
        public Or rebuild(Formula left, Formula right) {
            return new Or(left, right);
        }

        @Override
        public boolean isOr() {
            return true;
        }

        @Override
        public Or asOr() {
            return this;
        }
    }

    public static class Implies extends Bool {

        public Implies(Formula left, Formula right) {
            super(IMPLIES, left, right);
        }

        @Override
        public Implies rebuild(Formula left, Formula right) {
            return new Implies(left, right);
        }

        @Override
        public boolean isImplies() {
            return true;
        }

        @Override
        public Implies asImplies() {
            return this;
        }
    }

    public static class Equals extends Bool {

        public Equals(Formula left, Formula right) {
            super(EQUALS, left, right);
        }

        @Override
        public Equals rebuild(Formula left, Formula right) {
            return new Equals(left, right);
        }

        @Override
        public boolean isEquals() {
            return true;
        }

        @Override
        public Equals asEquals() {
            return this;
        }
    }
}
