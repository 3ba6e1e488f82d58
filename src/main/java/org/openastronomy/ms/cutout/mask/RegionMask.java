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

package org.openastronomy.ms.cutout.mask;

import java.util.function.BiPredicate;

import org.openastronomy.ms.cutout.geom.SkyWcs;

/**
 * The outline of a sky region whose pixels are a subset of its bounding box.
 */
public interface RegionMask {

    /**
     * @param wcs the transform of the pixel frame in which pixels are to be tested
     * @return an <em>X</em>, <em>Y</em> mask reader reporting if a pixel center lies within the region,
     * or {@code null} if the region does not project into the frame
     */
    BiPredicate<Integer, Integer> getMaskReader(SkyWcs wcs);
}
