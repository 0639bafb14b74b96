/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.huctlp.pattern.formula;

import com.vaticle.huctlp.common.HUCTLpToken;

import java.util.Objects;

import static com.vaticle.huctlp.common.HUCTLpToken.Binder.IN;
import static com.vaticle.huctlp.common.HUCTLpToken.Char.COLON;
import static com.vaticle.huctlp.common.HUCTLpToken.Char.PARAN_CLOSE;
import static com.vaticle.huctlp.common.HUCTLpToken.Char.PARAN_OPEN;
import static com.vaticle.huctlp.common.HUCTLpToken.Char.SPACE;

/**
 * Quantification over the states satisfying {@code bound}: {@code (forall x in bound : target)}.
 * The state name {@code name} may be used in {@code target} by the hybrid operators.
 */
public abstract class FirstOrder extends Formula implements Formula.Binary {

    private final HUCTLpToken.Binder binder;
    private final String name;
    private final Formula bound;
    private final Formula target;
    private final int hash;

    FirstOrder(HUCTLpToken.Binder binder, String name, Formula bound, Formula target) {
        if (name == null) throw new NullPointerException("Null name");
        if (bound == null || target == null) throw new NullPointerException("Null operand");
        this.binder = binder;
        this.name = name;
        this.bound = bound;
        this.target = target;
        this.hash = Objects.hash(getClass(), name, bound, target);
    }

    public String name() {
        return name;
    }

    public Formula bound() {
        return bound;
    }

    public Formula target() {
        return target;
    }

    @Override
    public Formula left() {
        return bound;
    }

    @Override
    public Formula right() {
        return target;
    }

    @Override
    public abstract FirstOrder rebuild(Formula bound, Formula target);

    @Override
    public boolean isBinary() {
        return true;
    }

    @Override
    public Binary asBinary() {
        return this;
    }

    @Override
    public boolean isFirstOrder() {
        return true;
    }

    @Override
    public FirstOrder asFirstOrder() {
        return this;
    }

    public boolean isForAll() {
        return false;
    }

    public boolean isExists() {
        return false;
    }

    @Override
    String computeString() {
        return "" + PARAN_OPEN + binder + SPACE + name + SPACE + IN + SPACE + bound + SPACE + COLON + SPACE + target + PARAN_CLOSE;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FirstOrder that = (FirstOrder) o;
        return this.name.equals(that.name) && this.bound.equals(that.bound) && this.target.equals(that.target);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    public static class ForAll extends FirstOrder {

        public ForAll(String name, Formula bound, Formula target) {
            super(HUCTLpToken.Binder.FORALL, name, bound, target);
        }

        @Override
        public ForAll rebuild(Formula bound, Formula target) {
            return new ForAll(name(), bound, target);
        }

        @Override
        public boolean isForAll() {
            return true;
        }
    }

    public static class Exists extends FirstOrder {

        public Exists(String name, Formula bound, Formula target) {
            super(HUCTLpToken.Binder.EXISTS, name, bound, target);
        }

        @Override
        public Exists rebuild(Formula bound, Formula target) {
            return new Exists(name(), bound, target);
        }

        @Override
        public boolean isExists() {
            return true;
        }
    }
}
