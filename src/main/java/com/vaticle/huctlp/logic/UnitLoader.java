/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.huctlp.logic;

import javax.annotation.Nullable;

@FunctionalInterface
public interface UnitLoader {

    /**
     * @return the unit with the given identifier, or {@code null} if there is none
     */
    @Nullable
    Unit load(String unitId);
}
