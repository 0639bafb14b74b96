/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.huctlp.common;

/**
 * Tokens of the canonical HUCTLp text form. Every {@code toString()} of the formula, direction and
 * expression algebras is assembled from these, so the printed text can be read back by the grammar.
 */
public class HUCTLpToken {

    public enum Char {
        SPACE(" "),
        COLON(":"),
        PARAN_OPEN("("),
        PARAN_CLOSE(")"),
        CURLY_OPEN("{"),
        CURLY_CLOSE("}");

        private final String character;

        Char(String character) {
            this.character = character;
        }

        @Override
        public String toString() {
            return this.character;
        }
    }

    public enum Literal {
        TRUE("true"),
        FALSE("false");

        private final String literal;

        Literal(String literal) {
            this.literal = literal;
        }

        @Override
        public String toString() {
            return this.literal;
        }
    }

    /**
     * Boolean connectives, shared by formulas and direction formulas.
     */
    public enum Logic {
        NOT("!"),
        AND("&&"),
        OR("||"),
        IMPLIES("->"),
        EQUALS("<->");

        private final String operator;

        Logic(String operator) {
            this.operator = operator;
        }

        @Override
        public String toString() {
            return this.operator;
        }
    }

    public enum Arithmetic {
        PLUS("+"),
        MINUS("-"),
        TIMES("*"),
        DIV("/");

        private final String operator;

        Arithmetic(String operator) {
            this.operator = operator;
        }

        @Override
        public String toString() {
            return this.operator;
        }
    }

    public enum Comparator {
        EQ("=="),
        NEQ("!="),
        LT("<"),
        LTE("<="),
        GT(">"),
        GTE(">=");

        private final String comparator;

        Comparator(String comparator) {
            this.comparator = comparator;
        }

        @Override
        public String toString() {
            return this.comparator;
        }
    }

    /**
     * Sign used by transition flows and direction proposition facets.
     */
    public enum Sign {
        POSITIVE("+"),
        NEGATIVE("-");

        private final String sign;

        Sign(String sign) {
            this.sign = sign;
        }

        @Override
        public String toString() {
            return this.sign;
        }
    }

    public enum Direction {
        IN("in"),
        OUT("out");

        private final String direction;

        Direction(String direction) {
            this.direction = direction;
        }

        @Override
        public String toString() {
            return this.direction;
        }
    }

    /**
     * Temporal operator symbols, printed right after the path quantifier ({@code AX}, {@code EwF}).
     */
    public enum Temporal {
        NEXT("X"),
        WEAK_NEXT("wX"),
        FUTURE("F"),
        WEAK_FUTURE("wF"),
        GLOBALLY("G"),
        UNTIL("U");

        private final String symbol;

        Temporal(String symbol) {
            this.symbol = symbol;
        }

        @Override
        public String toString() {
            return this.symbol;
        }
    }

    public enum Binder {
        FORALL("forall"),
        EXISTS("exists"),
        IN("in"),
        BIND("bind"),
        AT("at");

        private final String keyword;

        Binder(String keyword) {
            this.keyword = keyword;
        }

        @Override
        public String toString() {
            return this.keyword;
        }
    }
}
