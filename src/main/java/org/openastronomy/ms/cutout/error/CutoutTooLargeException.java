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

/**
 * The requested region exceeds the configured maximum area.
 */
public class CutoutTooLargeException extends RequestParseException {

    private static final long serialVersionUID = 1L;

    /**
     * @param area the requested area in square degrees
     * @param maximum the largest area permitted in square degrees
     */
    public CutoutTooLargeException(double area, double maximum) {
        super(String.format("requested area %.4f exceeds maximum of %.4f square degrees", area, maximum));
    }
}
