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

package org.openastronomy.ms.cutout.region;

import java.util.Map;

import com.google.common.collect.ImmutableMap;

import org.openastronomy.ms.cutout.error.RequestParseException;
import org.openastronomy.ms.cutout.geom.Angles;

/**
 * The units in which the size of a region may be given.
 */
public enum SizeUnit {
    PIXEL,
    ARCSECOND,
    DEGREE;

    private static final Map<String, SizeUnit> ALIASES = ImmutableMap.<String, SizeUnit>builder()
            .put("px", PIXEL).put("pix", PIXEL).put("pixel", PIXEL).put("pixels", PIXEL)
            .put("arcsec", ARCSECOND).put("arcsecond", ARCSECOND).put("arcseconds", ARCSECOND).put("arsecond", ARCSECOND)
            .put("deg", DEGREE).put("degree", DEGREE).put("degrees", DEGREE)
            .build();

    /**
     * @param name a unit name, matched case-insensitively
     * @return the unit that the name denotes
     * @throws RequestParseException if the name is not recognized
     */
    public static SizeUnit parse(String name) {
        final SizeUnit unit = name == null ? null : ALIASES.get(name.trim().toLowerCase());
        if (unit == null) {
            throw new RequestParseException("unknown unit: " + name);
        }
        return unit;
    }

    /**
     * @return if this unit measures an angle on the sky
     */
    public boolean isAngular() {
        return this != PIXEL;
    }

    /**
     * @param size an angular size in this unit
     * @return the size in arcseconds
     */
    public double toArcsec(double size) {
        switch (this) {
        case ARCSECOND:
            return size;
        case DEGREE:
            return Angles.toArcsec(size);
        default:
            throw new IllegalStateException("pixel size has no fixed angular extent");
        }
    }
}
