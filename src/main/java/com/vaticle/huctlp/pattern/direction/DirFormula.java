/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.huctlp.pattern.direction;

import com.vaticle.huctlp.common.HUCTLpToken;
import com.vaticle.huctlp.common.exception.HUCTLpException;

import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.Function;

import static com.vaticle.huctlp.common.HUCTLpToken.Char.PARAN_CLOSE;
import static com.vaticle.huctlp.common.HUCTLpToken.Char.PARAN_OPEN;
import static com.vaticle.huctlp.common.HUCTLpToken.Char.SPACE;
import static com.vaticle.huctlp.common.HUCTLpToken.Logic.NOT;
import static com.vaticle.huctlp.common.exception.ErrorMessage.Internal.ILLEGAL_CAST;
import static com.vaticle.huctlp.common.exception.ErrorMessage.Internal.ILLEGAL_STATE;
import static com.vaticle.huctlp.common.util.Objects.className;

/**
 * A boolean predicate over directional propositions. A direction formula restricts which successor
 * transitions a temporal operator may follow.
 */
public abstract class DirFormula {

    public static final True TRUE = new True();
    public static final False FALSE = new False();

    @FunctionalInterface
    public interface BoolFold<R> {
        R apply(Bool node, R left, R right);
    }

    /**
     * Folds the tree bottom up: {@code atom} receives every leaf, {@code not} and {@code bool} receive
     * their node together with the already folded children.
     */
    public <R> R fold(Function<DirFormula, R> atom, BiFunction<Not, R, R> not, BoolFold<R> bool) {
        if (isNot()) {
            return not.apply(asNot(), asNot().inner().fold(atom, not, bool));
        } else if (isBool()) {
            Bool node = asBool();
            return bool.apply(node, node.left().fold(atom, not, bool), node.right().fold(atom, not, bool));
        } else if (isAtom()) {
            return atom.apply(this);
        } else throw HUCTLpException.of(ILLEGAL_STATE);
    }

    /**
     * Rebuilds this formula with every atom transformed by {@code leaf}. Negations and boolean
     * operations keep their operator.
     */
    public DirFormula mapLeaves(Function<DirFormula, DirFormula> leaf) {
        return fold(leaf, Not::rebuild, Bool::rebuild);
    }

    public boolean isAtom() {
        return false;
    }

    public boolean isTrue() {
        return false;
    }

    public boolean isFalse() {
        return false;
    }

    public boolean isProposition() {
        return false;
    }

    public boolean isReference() {
        return false;
    }

    public boolean isNot() {
        return false;
    }

    public boolean isBool() {
        return false;
    }

    public Proposition asProposition() {
        throw HUCTLpException.of(ILLEGAL_CAST, className(getClass()), className(Proposition.class));
    }

    public Reference asReference() {
        throw HUCTLpException.of(ILLEGAL_CAST, className(getClass()), className(Reference.class));
    }

    public Not asNot() {
        throw HUCTLpException.of(ILLEGAL_CAST, className(getClass()), className(Not.class));
    }

    public Bool asBool() {
        throw HUCTLpException.of(ILLEGAL_CAST, className(getClass()), className(Bool.class));
    }

    public static class True extends DirFormula {

        private True() {}

        @Override
        public boolean isAtom() {
            return true;
        }

        @Override
        public boolean isTrue() {
            return true;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof True;
        }

        @Override
        public int hashCode() {
            return True.class.hashCode();
        }

        @Override
        public String toString() {
            return HUCTLpToken.Literal.TRUE.toString();
        }
    }

    public static class False extends DirFormula {

        private False() {}

        @Override
        public boolean isAtom() {
            return true;
        }

        @Override
        public boolean isFalse() {
            return true;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof False;
        }

        @Override
        public int hashCode() {
            return False.class.hashCode();
        }

        @Override
        public String toString() {
            return HUCTLpToken.Literal.FALSE.toString();
        }
    }

    public static class Proposition extends DirFormula {

        private final String name;
        private final HUCTLpToken.Sign facet;

        public Proposition(String name, HUCTLpToken.Sign facet) {
            if (name == null) throw new NullPointerException("Null name");
            if (facet == null) throw new NullPointerException("Null facet");
            this.name = name;
            this.facet = facet;
        }

        public String name() {
            return name;
        }

        public HUCTLpToken.Sign facet() {
            return facet;
        }

        @Override
        public boolean isAtom() {
            return true;
        }

        @Override
        public boolean isProposition() {
            return true;
        }

        @Override
        public Proposition asProposition() {
            return this;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Proposition that = (Proposition) o;
            return this.name.equals(that.name) && this.facet == that.facet;
        }

        @Override
        public int hashCode() {
            return Objects.hash(Proposition.class, name, facet);
        }

        @Override
        public String toString() {
            return name + facet;
        }
    }

    /**
     * A named direction formula defined elsewhere. References never survive reference resolution.
     */
    public static class Reference extends DirFormula {

        private final String name;

        public Reference(String name) {
            if (name == null) throw new NullPointerException("Null name");
            this.name = name;
        }

        public String name() {
            return name;
        }

        @Override
        public boolean isAtom() {
            return true;
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
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            return this.name.equals(((Reference) o).name);
        }

        @Override
        public int hashCode() {
            return Objects.hash(Reference.class, name);
        }

        @Override
        public String toString() {
            return name;
        }
    }

    public static class Not extends DirFormula {

        private final DirFormula inner;
        private final int hash;

        public Not(DirFormula inner) {
            if (inner == null) throw new NullPointerException("Null inner");
            this.inner = inner;
            this.hash = Objects.hash(Not.class, inner);
        }

        public DirFormula inner() {
            return inner;
        }

        public Not rebuild(DirFormula inner) {
            return new Not(inner);
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
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            return this.inner.equals(((Not) o).inner);
        }

        @Override
        public int hashCode() {
            return hash;
        }

        @Override
        public String toString() {
            return NOT.toString() + inner;
        }
    }

    /**
     * A binary boolean operation: conjunction, disjunction, implication or equivalence.
     */
    public static class Bool extends DirFormula {

        private final HUCTLpToken.Logic operator;
        private final DirFormula left;
        private final DirFormula right;
        private final int hash;

        public Bool(HUCTLpToken.Logic operator, DirFormula left, DirFormula right) {
            if (operator == null || operator == HUCTLpToken.Logic.NOT) {
                throw new IllegalArgumentException("Not a binary operator: " + operator);
            }
            if (left == null || right == null) throw new NullPointerException("Null operand");
            this.operator = operator;
            this.left = left;
            this.right = right;
            this.hash = Objects.hash(Bool.class, operator, left, right);
        }

        public HUCTLpToken.Logic operator() {
            return operator;
        }

        public DirFormula left() {
            return left;
        }

        public DirFormula right() {
            return right;
        }

        public Bool rebuild(DirFormula left, DirFormula right) {
            return new Bool(operator, left, right);
        }

        @Override
        public boolean isBool() {
            return true;
        }

        @Override
        public Bool asBool() {
            return this;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Bool that = (Bool) o;
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
