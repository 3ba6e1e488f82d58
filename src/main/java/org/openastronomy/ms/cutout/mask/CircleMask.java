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

import org.openastronomy.ms.cutout.geom.PixelPoint;
import org.openastronomy.ms.cutout.geom.SkyPoint;
import org.openastronomy.ms.cutout.geom.SkyWcs;

/**
 * A circle on the sky with its radius given in pixels of the frame it is tested in.
 */
public class CircleMask implements RegionMask {

    private final SkyPoint center;
    private final double radius;

    /**
     * @param center the center of the circle
     * @param radius the radius of the circle in pixels
     */
    public CircleMask(SkyPoint center, double radius) {
        this.center = center;
        this.radius = radius;
    }

    @Override
    public BiPredicate<Integer, Integer> getMaskReader(SkyWcs wcs) {
        final PixelPoint centerPixel = wcs.skyToPixel(center);
        if (!centerPixel.isFinite()) {
            return null;
        }
        final double centerX = Math.floor(centerPixel.getX());
        final double centerY = Math.floor(centerPixel.getY());
        final double radiusSquared = radius * radius;
        return (x, y) -> {
            final double dx = x - centerX;
            final double dy = y - centerY;
            return dx * dx + dy * dy <= radiusSquared;
        };
    }
}
