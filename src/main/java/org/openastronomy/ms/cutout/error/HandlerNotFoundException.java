/*
 * Copyright (C) 2020 University of Dundee & Open Microscopy Environment.
 * All rights reserved.
 *
 * This program is free software; you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation; either version 2 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License along
 * with this program; if not, write to the Free Software Foundation, Inc.,
 * 51 Franklin Street, Fifth Floor, Boston, MA 02110-1301 USA.
 */

package org.openastronomy.ms.cutout.error;

import java.util.Set;

import com.google.common.base.Joiner;

/**
 * No handler is registered for the signature of a parameter set.
 */
public class HandlerNotFoundException extends RequestParseException {

    private static final long serialVersionUID = 1L;

    /**
     * @param signature the canonical parameter names that matched no handler
     */
    public HandlerNotFoundException(Set<String> signature) {
        super("no handler for parameters: " + Joiner.on(", ").join(signature));
    }
}
