/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.huctlp.common.exception;

import java.util.HashMap;
import java.util.Map;

public abstract class ErrorMessage {

    private static final Map<String, Map<Integer, ErrorMessage>> knownErrors = new HashMap<>();

    private final String codePrefix;
    private final int codeNumber;
    private final String messagePrefix;
    private final String messageBody;

    private ErrorMessage(String codePrefix, int codeNumber, String messagePrefix, String messageBody) {
        this.codePrefix = codePrefix;
        this.codeNumber = codeNumber;
        this.messagePrefix = messagePrefix;
        this.messageBody = messageBody;

        assert knownErrors.get(codePrefix) == null || knownErrors.get(codePrefix).get(codeNumber) == null;
        knownErrors.computeIfAbsent(codePrefix, p -> new HashMap<>()).put(codeNumber, this);
    }

    public String code() {
        return String.format("%s%02d", codePrefix, codeNumber);
    }

    public String message(Object... parameters) {
        return String.format(toString(), parameters);
    }

    @Override
    public String toString() {
        return String.format("[%s] %s: %s", code(), messagePrefix, messageBody);
    }

    public static class Internal extends ErrorMessage {
        public static final Internal ILLEGAL_STATE =
                new Internal(1, "Illegal internal state!");
        public static final Internal ILLEGAL_CAST =
                new Internal(2, "Illegal casting operation from '%s' to '%s'.");
        public static final Internal UNEXPECTED_INTERRUPTION =
                new Internal(3, "Unexpected thread interruption while resolving '%s'.");
        public static final Internal UNEXPECTED_FAILURE =
                new Internal(4, "Unexpected failure while resolving '%s'.");

        private static final String codePrefix = "INT";
        private static final String messagePrefix = "Invalid Internal State";

        Internal(int number, String message) {
            super(codePrefix, number, messagePrefix, message);
        }
    }

    public static class Resolution extends ErrorMessage {
        public static final Resolution DUPLICATE_NAME =
                new Resolution(1, "Duplicate assignment for '%s' defined in '%s' and '%s'.");
        public static final Resolution UNDEFINED_REFERENCE =
                new Resolution(2, "The name '%s' is referenced but never defined.");
        public static final Resolution CYCLIC_REFERENCE =
                new Resolution(3, "The name '%s' is part of a cyclic definition.");
        public static final Resolution SORT_MISMATCH =
                new Resolution(4, "The name '%s' is expected to be a(n) '%s', but it is a(n) '%s'.");

        private static final String codePrefix = "RES";
        private static final String messagePrefix = "Invalid Reference Resolution";

        Resolution(int number, String message) {
            super(codePrefix, number, messagePrefix, message);
        }
    }

    public static class Unit extends ErrorMessage {
        public static final Unit UNIT_NOT_FOUND =
                new Unit(1, "The unit '%s' included from '%s' could not be loaded.");
        public static final Unit ASSIGNMENT_NAME_MISSING =
                new Unit(2, "An assignment in unit '%s' at line '%s' has no name.");
        public static final Unit ROOT_UNIT_NOT_FOUND =
                new Unit(3, "The root unit '%s' could not be loaded.");

        private static final String codePrefix = "UNT";
        private static final String messagePrefix = "Invalid Unit";

        Unit(int number, String message) {
            super(codePrefix, number, messagePrefix, message);
        }
    }

    public static class Config extends ErrorMessage {
        public static final Config CONFIG_FILE_NOT_FOUND =
                new Config(1, "Could not find/read the configuration file '%s'.");
        public static final Config CONFIG_KEY_MISSING =
                new Config(2, "Required configuration '%s' is missing.");
        public static final Config CONFIG_VALUE_UNEXPECTED =
                new Config(3, "Configuration '%s' received an unexpected value '%s'.");

        private static final String codePrefix = "CFG";
        private static final String messagePrefix = "Invalid Configuration";

        Config(int number, String message) {
            super(codePrefix, number, messagePrefix, message);
        }
    }
}
