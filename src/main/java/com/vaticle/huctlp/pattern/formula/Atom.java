/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.huctlp.pattern.formula;

import com.vaticle.huctlp.common.HUCTLpToken;
import com.vaticle.huctlp.pattern.direction.DirFormula;
import com.vaticle.huctlp.pattern.expression.Expression;

import java.util.Objects;
import java.util.Optional;

import static com.vaticle.huctlp.common.HUCTLpToken.Char.COLON;
import static com.vaticle.huctlp.common.HUCTLpToken.Char.PARAN_CLOSE;
import static com.vaticle.huctlp.common.HUCTLpToken.Char.PARAN_OPEN;
import static com.vaticle.huctlp.common.HUCTLpToken.Char.SPACE;

/**
 * The leaves of a formula tree.
 */
public abstract class Atom extends Formula {

    Atom() {}

    @Override
    public boolean isAtom() {
        return true;
    }

    public static class True extends Atom {

        True() {}

        @Override
        public boolean isTrue() {
            return true;
        }

        @Override
        public Optional<DirFormula> asDirFormula() {
            return Optional.of(DirFormula.TRUE);
        }

        @Override
        String computeString() {
            return HUCTLpToken.Literal.TRUE.toString();
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof True;
        }

        @Override
        public int hashCode() {
            return True.class.hashCode();
        }
    }

    public static class False extends Atom {

        False() {}

        @Override
        public boolean isFalse() {
            return true;
        }

        @Override
        public Optional<DirFormula> asDirFormula() {
            return Optional.of(DirFormula.FALSE);
        }

        @Override
        String computeString() {
            return HUCTLpToken.Literal.FALSE.toString();
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof False;
        }

        @Override
        public int hashCode() {
            return False.class.hashCode();
        }
    }

    /**
     * A named formula defined by another assignment. References never survive reference resolution.
     */
    public static class Reference extends Atom {

        private final String name;

        public Reference(String name) {
            if (name == null) throw new NullPointerException("Null name");
            this.name = name;
        }

        public String name() {
            return name;
        }

        @Override
        public boolean isReference() {
            return true;
        }

        @Override
        public Reference asReference() {
            return this;
        }

        @Override
        public Optional<DirFormula> asDirFormula() {
            return Optional.of(new DirFormula.Reference(name));
        }

        @Override
        String computeString() {
            return name;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            return name.equals(((Reference) o).name);
        }

        @Override
        public int hashCode() {
            return Objects.hash(Reference.class, name);
        }
    }

    /**
     * Holds in a state when the named transition carries {@code flow} through the {@code direction}
     * facet of that state, e.g. {@code x:in+}.
     */
    public static class Transition extends Atom {

        private final String name;
        private final HUCTLpToken.Direction direction;
        private final HUCTLpToken.Sign flow;

        public Transition(String name, HUCTLpToken.Direction direction, HUCTLpToken.Sign flow) {
            if (name == null) throw new NullPointerException("Null name");
            if (direction == null) throw new NullPointerException("Null direction");
            if (flow == null) throw new NullPointerException("Null flow");
            this.name = name;
            this.direction = direction;
            this.flow = flow;
        }

        public String name() {
            return name;
        }

        public HUCTLpToken.Direction direction() {
            return direction;
        }

        public HUCTLpToken.Sign flow() {
            return flow;
        }

        @Override
        public boolean isTransition() {
            return true;
        }

        @Override
        public Transition asTransition() {
            return this;
        }

        @Override
        String computeString() {
            return name + COLON + direction + flow;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Transition that = (Transition) o;
            return this.name.equals(that.name) && this.direction == that.direction && this.flow == that.flow;
        }

        @Override
        public int hashCode() {
            return Objects.hash(Transition.class, name, direction, flow);
        }
    }

    /**
     * A comparison between two arithmetic expressions.
     */
    public static class Numeric extends Atom {

        private final Expression left;
        private final HUCTLpToken.Comparator comparator;
        private final Expression right;
        private final int hash;

        public Numeric(Expression left, HUCTLpToken.Comparator comparator, Expression right) {
            if (left == null || right == null) throw new NullPointerException("Null operand");
            if (comparator == null) throw new NullPointerException("Null comparator");
            this.left = left;
            this.comparator = comparator;
            this.right = right;
            this.hash = Objects.hash(Numeric.class, left, comparator, right);
        }

        public Expression left() {
            return left;
        }

        public HUCTLpToken.Comparator comparator() {
            return comparator;
        }

        public Expression right() {
            return right;
        }

        public Numeric rebuild(Expression left, Expression right) {
            return new Numeric(left, comparator, right);
        }

        @Override
        public boolean isNumeric() {
            return true;
        }

        @Override
        public Numeric asNumeric() {
            return this;
        }

        @Override
        String computeString() {
            return "" + PARAN_OPEN + left + SPACE + comparator + SPACE + right + PARAN_CLOSE;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Numeric that = (Numeric) o;
            return this.comparator == that.comparator && this.left.equals(that.left) && this.right.equals(that.right);
        }

        @Override
        public int hashCode() {
            return hash;
        }
    }
}
