/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.huctlp.common.util;

public class Objects {

    public static String className(Class<?> clazz) {
        String className = clazz.getSimpleName();
        if (clazz.getEnclosingClass() != null) className = clazz.getEnclosingClass().getSimpleName() + "." + className;
        return className;
    }
}
