/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.huctlp.pattern.formula;

import com.vaticle.huctlp.common.exception.HUCTLpException;
import com.vaticle.huctlp.logic.Normaliser;
import com.vaticle.huctlp.pattern.direction.DirFormula;

import java.util.Optional;
import java.util.function.Function;

import static com.vaticle.huctlp.common.exception.ErrorMessage.Internal.ILLEGAL_CAST;
import static com.vaticle.huctlp.common.exception.ErrorMessage.Internal.ILLEGAL_STATE;
import static com.vaticle.huctlp.common.util.Objects.className;

/**
 * An HUCTLp formula, evaluated at a state of a transition system.
 *
 * A formula is an atomic proposition ({@link Atom}), a boolean connective ({@link Connective}), a
 * temporal operator qualified by a {@link PathQuantifier} and a {@link DirFormula} ({@link Temporal}),
 * a first-order quantifier over states ({@link FirstOrder}) or a hybrid operator ({@link Hybrid}).
 * Every non-atomic formula is either {@link Unary} or {@link Binary}, and is able to rebuild itself with
 * new children while keeping its own kind, quantifier, direction and bound name.
 *
 * Formulas are immutable values: equality is structural and {@link #toString()} returns the canonical
 * text of the formula.
 */
public abstract class Formula {

    public static final Atom.True TRUE = new Atom.True();
    public static final Atom.False FALSE = new Atom.False();

    private String string;

    Formula() {}

    public interface Unary {

        Formula inner();

        Formula rebuild(Formula inner);
    }

    public interface Binary {

        Formula left();

        Formula right();

        Formula rebuild(Formula left, Formula right);
    }

    @FunctionalInterface
    public interface UnaryFold<R> {
        R apply(Unary node, R inner);
    }

    @FunctionalInterface
    public interface BinaryFold<R> {
        R apply(Binary node, R left, R right);
    }

    /**
     * Folds the formula tree bottom up, visiting every node exactly once. {@code atom} receives the
     * leaves, {@code unary} and {@code binary} receive their node together with the already folded
     * children.
     */
    public <R> R fold(Function<Formula, R> atom, UnaryFold<R> unary, BinaryFold<R> binary) {
        if (isUnary()) {
            Unary node = asUnary();
            return unary.apply(node, node.inner().fold(atom, unary, binary));
        } else if (isBinary()) {
            Binary node = asBinary();
            return binary.apply(node, node.left().fold(atom, unary, binary), node.right().fold(atom, unary, binary));
        } else if (isAtom()) {
            return atom.apply(this);
        } else throw HUCTLpException.of(ILLEGAL_STATE);
    }

    /**
     * Rebuilds the formula with every atom transformed by {@code leaf}.
     */
    public Formula mapLeaves(Function<Formula, Formula> leaf) {
        return fold(leaf, Unary::rebuild, Binary::rebuild);
    }

    /**
     * Reinterprets this formula as a direction formula, when it is built only from {@code true},
     * {@code false}, references and binary boolean connectives.
     */
    public Optional<DirFormula> asDirFormula() {
        return Optional.empty();
    }

    public Formula normalise() {
        return Normaliser.normalise(this);
    }

    abstract String computeString();

    public boolean isAtom() {
        return false;
    }

    public boolean isUnary() {
        return false;
    }

    public boolean isBinary() {
        return false;
    }

    public boolean isTrue() {
        return false;
    }

    public boolean isFalse() {
        return false;
    }

    public boolean isReference() {
        return false;
    }

    public boolean isTransition() {
        return false;
    }

    public boolean isNumeric() {
        return false;
    }

    public boolean isNot() {
        return false;
    }

    public boolean isAnd() {
        return false;
    }

    public boolean isOr() {
        return false;
    }

    public boolean isImplies() {
        return false;
    }

    public boolean isEquals() {
        return false;
    }

    public boolean isTemporal() {
        return false;
    }

    public boolean isFirstOrder() {
        return false;
    }

    public boolean isHybrid() {
        return false;
    }

    public Unary asUnary() {
        throw HUCTLpException.of(ILLEGAL_CAST, className(getClass()), className(Unary.class));
    }

    public Binary asBinary() {
        throw HUCTLpException.of(ILLEGAL_CAST, className(getClass()), className(Binary.class));
    }

    public Atom.Reference asReference() {
        throw HUCTLpException.of(ILLEGAL_CAST, className(getClass()), className(Atom.Reference.class));
    }

    public Atom.Transition asTransition() {
        throw HUCTLpException.of(ILLEGAL_CAST, className(getClass()), className(Atom.Transition.class));
    }

    public Atom.Numeric asNumeric() {
        throw HUCTLpException.of(ILLEGAL_CAST, className(getClass()), className(Atom.Numeric.class));
    }

    public Connective.Not asNot() {
        throw HUCTLpException.of(ILLEGAL_CAST, className(getClass()), className(Connective.Not.class));
    }

    public Connective.And asAnd() {
        throw HUCTLpException.of(ILLEGAL_CAST, className(getClass()), className(Connective.And.class));
    }

    public Connective.Or asOr() {
        throw HUCTLpException.of(ILLEGAL_CAST, className(getClass()), className(Connective.Or.class));
    }

    public Connective.Implies asImplies() {
        throw HUCTLpException.of(ILLEGAL_CAST, className(getClass()), className(Connective.Implies.class));
    }

    public Connective.Equals asEquals() {
        throw HUCTLpException.of(ILLEGAL_CAST, className(getClass()), className(Connective.Equals.class));
    }

    public Temporal asTemporal() {
        throw HUCTLpException.of(ILLEGAL_CAST, className(getClass()), className(Temporal.class));
    }

    public FirstOrder asFirstOrder() {
        throw HUCTLpException.of(ILLEGAL_CAST, className(getClass()), className(FirstOrder.class));
    }

    public Hybrid asHybrid() {
        throw HUCTLpException.of(ILLEGAL_CAST, className(getClass()), className(Hybrid.class));
    }

    @Override
    public abstract boolean equals(Object o);

    @Override
    public abstract int hashCode();

    /**
     * @return the canonical text of this formula, which the grammar parses back into an equal formula
     */
    @Override
    public String toString() {
        if (string == null) string = computeString();
        return string;
    }
}
