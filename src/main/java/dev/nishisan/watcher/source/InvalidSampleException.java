/*
 *  Copyright (C) 2020-2025 Lucas Nishimura <lucas.nishimura at gmail.com>
 *
 *  This program is free software: you can redistribute it and/or modify
 *  it under the terms of the GNU General Public License as published by
 *  the Free Software Foundation, either version 3 of the License, or
 *  (at your option) any later version.
 *
 *  This program is distributed in the hope that it will be useful,
 *  but WITHOUT ANY WARRANTY; without even the implied warranty of
 *  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 *  GNU General Public License for more details.
 *
 *  You should have received a copy of the GNU General Public License
 *  along with this program.  If not, see <https://www.gnu.org/licenses/>
 */

package dev.nishisan.watcher.source;

/**
 * Thrown when a metrics sample is malformed or incomplete. The engine skips the
 * affected container for the current tick and keeps its existing state.
 */
public class InvalidSampleException extends RuntimeException {

    /**
     * Creates an invalid sample exception with the given message.
     *
     * @param message the detail message
     */
    public InvalidSampleException(String message) {
        super(message);
    }

    /**
     * Creates an invalid sample exception with a message and cause.
     *
     * @param message the detail message
     * @param cause   the cause
     */
    public InvalidSampleException(String message, Throwable cause) {
        super(message, cause);
    }
}
