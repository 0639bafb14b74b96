/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.huctlp.logic;

import com.vaticle.huctlp.common.exception.HUCTLpException;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;

import static com.vaticle.huctlp.common.exception.ErrorMessage.Internal.ILLEGAL_STATE;
import static com.vaticle.huctlp.common.exception.ErrorMessage.Resolution.CYCLIC_REFERENCE;

/**
 * The names currently being resolved, innermost last. Not thread safe: every resolution task owns its
 * own stack.
 */
public class ResolutionStack {

    private final Deque<String> names;
    private final Set<String> members;

    public ResolutionStack() {
        this.names = new ArrayDeque<>();
        this.members = new HashSet<>();
    }

    /**
     * @throws HUCTLpException {@code CYCLIC_REFERENCE} if {@code name} is already being resolved
     */
    public void push(String name) {
        if (!members.add(name)) throw HUCTLpException.of(CYCLIC_REFERENCE, name);
        names.addLast(name);
    }

    public String pop() {
        if (names.isEmpty()) throw HUCTLpException.of(ILLEGAL_STATE);
        String name = names.removeLast();
        members.remove(name);
        return name;
    }

    public boolean contains(String name) {
        return members.contains(name);
    }

    public boolean isEmpty() {
        return names.isEmpty();
    }

    @Override
    public String toString() {
        return String.join(" -> ", names);
    }
}
