/*
 * Copyright (C) 2021 Vaticle
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 *
 */

package com.vaticle.typematch.common.config;

import javax.annotation.Nullable;

/**
 * System properties understood by TypeMatch
 */
public enum SystemProperty {

    CONFIGURATION_FILE("typematch.conf");

    private final String key;

    SystemProperty(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    /**
     * @return the value of the system property, or null if the system property is not set
     */
    @Nullable
    public String value() {
        return System.getProperty(key);
    }

    public void set(String value) {
        System.setProperty(key, value);
    }

    public void clear() {
        System.clearProperty(key);
    }
}
