/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.huctlp.pattern.formula;

import com.vaticle.huctlp.common.HUCTLpToken;

import java.util.Objects;

import static com.vaticle.huctlp.common.HUCTLpToken.Char.COLON;
import static com.vaticle.huctlp.common.HUCTLpToken.Char.PARAN_CLOSE;
import static com.vaticle.huctlp.common.HUCTLpToken.Char.PARAN_OPEN;
import static com.vaticle.huctlp.common.HUCTLpToken.Char.SPACE;

/**
 * Hybrid operators over named states. {@link Bind} names the current state, {@link At} evaluates its
 * target at a named state.
 */
public abstract class Hybrid extends Formula implements Formula.Unary {

    private final HUCTLpToken.Binder binder;
    private final String name;
    private final Formula target;
    private final int hash;

    Hybrid(HUCTLpToken.Binder binder, String name, Formula target) {
        if (name == null) throw new NullPointerException("Null name");
        if (target == null) throw new NullPointerException("Null target");
        this.binder = binder;
        this.name = name;
        this.target = target;
        this.hash = Objects.hash(getClass(), name, target);
    }

    public String name() {
        return name;
    }

    public Formula target() {
        return target;
    }

    @Override
    public Formula inner() {
        return target;
    }

    @Override
    public abstract Hybrid rebuild(Formula target);

    @Override
    public boolean isUnary() {
        return true;
    }

    @Override
    public Unary asUnary() {
        return this;
    }

    @Override
    public boolean isHybrid() {
        return true;
    }

    @Override
    public Hybrid asHybrid() {
        return this;
    }

    public boolean isBind() {
        return false;
    }

    public boolean isAt() {
        return false;
    }

    @Override
    String computeString() {
        return "" + PARAN_OPEN + binder + SPACE + name + SPACE + COLON + SPACE + target + PARAN_CLOSE;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Hybrid that = (Hybrid) o;
        return this.name.equals(that.name) && this.target.equals(that.target);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    public static class Bind extends Hybrid {

        public Bind(String name, Formula target) {
            super(HUCTLpToken.Binder.BIND, name, target);
        }

        @Override
        public Bind rebuild(Formula target) {
            return new Bind(name(), target);
        }

        @Override
        public boolean isBind() {
            return true;
        }
    }

    public static class At extends Hybrid {

        public At(String name, Formula target) {
            super(HUCTLpToken.Binder.AT, name, target);
        }

        @Override
        public At rebuild(Formula target) {
            return new At(name(), target);
        }

        @Override
        public boolean isAt() {
            return true;
        }
    }
}
