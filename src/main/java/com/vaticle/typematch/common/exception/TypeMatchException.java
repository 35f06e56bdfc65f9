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

package com.vaticle.typematch.common.exception;

import java.util.Objects;

public class TypeMatchException extends RuntimeException {

    private final ErrorMessage error;

    private TypeMatchException(ErrorMessage error, Throwable cause) {
        super(error.message(cause.getMessage()), cause);
        this.error = error;
    }

    private TypeMatchException(ErrorMessage error, Object... parameters) {
        super(error.message(parameters));
        assert !getMessage().contains("%s");
        this.error = error;
    }

    public static TypeMatchException of(ErrorMessage errorMessage, Throwable cause) {
        return new TypeMatchException(errorMessage, cause);
    }

    public static TypeMatchException of(ErrorMessage errorMessage, Object... parameters) {
        return new TypeMatchException(errorMessage, parameters);
    }

    public ErrorMessage errorMessage() {
        return error;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TypeMatchException that = (TypeMatchException) o;
        return error.equals(that.error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(error);
    }
}
