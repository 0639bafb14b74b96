/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.huctlp.pattern.formula;

import com.vaticle.huctlp.common.HUCTLpToken;
import com.vaticle.huctlp.common.exception.HUCTLpException;
import com.vaticle.huctlp.pattern.direction.DirFormula;

import java.util.Objects;

import static com.vaticle.huctlp.common.HUCTLpToken.Char.CURLY_CLOSE;
import static com.vaticle.huctlp.common.HUCTLpToken.Char.CURLY_OPEN;
import static com.vaticle.huctlp.common.HUCTLpToken.Char.PARAN_CLOSE;
import static com.vaticle.huctlp.common.HUCTLpToken.Char.PARAN_OPEN;
import static com.vaticle.huctlp.common.HUCTLpToken.Char.SPACE;
import static com.vaticle.huctlp.common.exception.ErrorMessage.Internal.ILLEGAL_CAST;
import static com.vaticle.huctlp.common.util.Objects.className;

/**
 * A path operator. Every temporal formula is qualified by a {@link PathQuantifier} and by a
 * {@link DirFormula} restricting the transitions the paths may follow; the direction {@code true}
 * follows every transition.
 */
public abstract class Temporal extends Formula {

    private final HUCTLpToken.Temporal operator;
    private final PathQuantifier quantifier;
    private final DirFormula direction;

    Temporal(HUCTLpToken.Temporal operator, PathQuantifier quantifier, DirFormula direction) {
        if (quantifier == null) throw new NullPointerException("Null quantifier");
        if (direction == null) throw new NullPointerException("Null direction");
        this.operator = operator;
        this.quantifier = quantifier;
        this.direction = direction;
    }

    public HUCTLpToken.Temporal operator() {
        return operator;
    }

    public PathQuantifier quantifier() {
        return quantifier;
    }

    public DirFormula direction() {
        return direction;
    }

    /**
     * @return this operator, with the same quantifier and operands, restricted by {@code direction} instead
     */
    public abstract Temporal direction(DirFormula direction);

    String prefix() {
        return "" + CURLY_OPEN + direction + CURLY_CLOSE + quantifier + operator;
    }

    @Override
    public boolean isTemporal() {
        return true;
    }

    @Override
    public Temporal asTemporal() {
        return this;
    }

    public boolean isNext() {
        return false;
    }

    public boolean isWeakNext() {
        return false;
    }

    public boolean isFuture() {
        return false;
    }

    public boolean isWeakFuture() {
        return false;
    }

    public boolean isGlobally() {
        return false;
    }

    public boolean isUntil() {
        return false;
    }

    public Simple asSimple() {
        throw HUCTLpException.of(ILLEGAL_CAST, className(getClass()), className(Simple.class));
    }

    public Until asUntil() {
        throw HUCTLpException.of(ILLEGAL_CAST, className(getClass()), className(Until.class));
    }

    /**
     * A temporal operator over a single formula.
     */
    public abstract static class Simple extends Temporal implements Formula.Unary {

        private final Formula inner;
        private final int hash;

        Simple(HUCTLpToken.Temporal operator, PathQuantifier quantifier, Formula inner, DirFormula direction) {
            super(operator, quantifier, direction);
            if (inner == null) throw new NullPointerException("Null inner");
            this.inner = inner;
            this.hash = Objects.hash(getClass(), quantifier, inner, direction);
        }

        @Override
        public Formula inner() {
            return inner;
        }

        @Override
        public abstract Simple rebuild(Formula inner);

        @Override
        public boolean isUnary() {
            return true;
        }

        @Override
        public Unary asUnary() {
            return this;
        }

        @Override
        public Simple asSimple() {
            return this;
        }

        @Override
        String computeString() {
            return "" + PARAN_OPEN + prefix() + SPACE + inner + PARAN_CLOSE;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Simple that = (Simple) o;
            return this.quantifier() == that.quantifier() &&
                    this.inner.equals(that.inner) &&
                    this.direction().equals(that.direction());
        }

        @Override
        public int hashCode() {
            return hash;
        }
    }

    public static class Next extends Simple {

        public Next(PathQuantifier quantifier, Formula inner, DirFormula direction) {
            super(HUCTLpToken.Temporal.NEXT, quantifier, inner, direction);
        }

        @Override
        public Next rebuild(Formula inner) {
            return new Next(quantifier(), inner, direction());
        }

        @Override
        public Next direction(DirFormula direction) {
            return new Next(quantifier(), inner(), direction);
        }

        @Override
        public boolean isNext() {
            return true;
        }
    }

    /**
     * Like {@link Next}, but also holds in states without a successor along the direction.
     */
    public static class WeakNext extends Simple {

        public WeakNext(PathQuantifier quantifier, Formula inner, DirFormula direction) {
            super(HUCTLpToken.Temporal.WEAK_NEXT, quantifier, inner, direction);
        }

        @Override
        public WeakNext rebuild(Formula inner) {
            return new WeakNext(quantifier(), inner, direction());
        }

        @Override
        public WeakNext direction(DirFormula direction) {
            return new WeakNext(quantifier(), inner(), direction);
        }

        @Override
        public boolean isWeakNext() {
            return true;
        }
    }

    public static class Future extends Simple {

        public Future(PathQuantifier quantifier, Formula inner, DirFormula direction) {
            super(HUCTLpToken.Temporal.FUTURE, quantifier, inner, direction);
        }

        @Override
        public Future rebuild(Formula inner) {
            return new Future(quantifier(), inner, direction());
        }

        @Override
        public Future direction(DirFormula direction) {
            return new Future(quantifier(), inner(), direction);
        }

        @Override
        public boolean isFuture() {
            return true;
        }
    }

    /**
     * Like {@link Future}, but also holds when the path ends before the inner formula holds.
     */
    public static class WeakFuture extends Simple {

        public WeakFuture(PathQuantifier quantifier, Formula inner, DirFormula direction) {
            super(HUCTLpToken.Temporal.WEAK_FUTURE, quantifier, inner, direction);
        }

        @Override
        public WeakFuture rebuild(Formula inner) {
            return new WeakFuture(quantifier(), inner, direction());
        }

        @Override
        public WeakFuture direction(DirFormula direction) {
            return new WeakFuture(quantifier(), inner(), direction);
        }

        @Override
        public boolean isWeakFuture() {
            return true;
        }
    }

    public static class Globally extends Simple {

        public Globally(PathQuantifier quantifier, Formula inner, DirFormula direction) {
            super(HUCTLpToken.Temporal.GLOBALLY, quantifier, inner, direction);
        }

        @Override
        public Globally rebuild(Formula inner) {
            return new Globally(quantifier(), inner, direction());
        }

        @Override
        public Globally direction(DirFormula direction) {
            return new Globally(quantifier(), inner(), direction);
        }

        @Override
        public boolean isGlobally() {
            return true;
        }
    }

    /**
     * {@code path} holds along the path until {@code reach} holds.
     */
    public static class Until extends Temporal implements Formula.Binary {

        private final Formula path;
        private final Formula reach;
        private final int hash;

        public Until(PathQuantifier quantifier, Formula path, Formula reach, DirFormula direction) {
            super(HUCTLpToken.Temporal.UNTIL, quantifier, direction);
            if (path == null || reach == null) throw new NullPointerException("Null operand");
            this.path = path;
            this.reach = reach;
            this.hash = Objects.hash(Until.class, quantifier, path, reach, direction);
        }

        public Formula path() {
            return path;
        }

        public Formula reach() {
            return reach;
        }

        @Override
        public Formula left() {
            return path;
        }

        @Override
        public Formula right() {
            return reach;
        }

        @Override
        public Until rebuild(Formula path, Formula reach) {
            return new Until(quantifier(), path, reach, direction());
        }

        @Override
        public Until direction(DirFormula direction) {
            return new Until(quantifier(), path, reach, direction);
        }

        @Override
        public boolean isBinary() {
            return true;
        }

        @Override
        public Binary asBinary() {
            return this;
        }

        @Override
        public boolean isUntil() {
            return true;
        }

        @Override
        public Until asUntil() {
            return this;
        }

        @Override
        String computeString() {
            return "" + PARAN_OPEN + path + SPACE + prefix() + SPACE + reach + PARAN_CLOSE;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Until that = (Until) o;
            return this.quantifier() == that.quantifier() &&
                    this.path.equals(that.path) &&
                    this.reach.equals(that.reach) &&
                    this.direction().equals(that.direction());
        }

        @Override
        public int hashCode() {
            return hash;
        }
    }
}
