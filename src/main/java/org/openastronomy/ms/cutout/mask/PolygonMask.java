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

import java.util.List;
import java.util.function.BiPredicate;

import com.google.common.collect.ImmutableList;

import org.openastronomy.ms.cutout.geom.PixelPoint;
import org.openastronomy.ms.cutout.geom.SkyPoint;
import org.openastronomy.ms.cutout.geom.SkyWcs;

/**
 * A polygon on the sky given by its vertices, tested by the even-odd rule once projected into a pixel frame.
 */
public class PolygonMask implements RegionMask {

    private final List<SkyPoint> vertices;

    /**
     * @param vertices the vertices of the polygon, at least three
     */
    public PolygonMask(List<SkyPoint> vertices) {
        if (vertices.size() < 3) {
            throw new IllegalArgumentException("polygon requires at least three vertices");
        }
        this.vertices = ImmutableList.copyOf(vertices);
    }

    @Override
    public BiPredicate<Integer, Integer> getMaskReader(SkyWcs wcs) {
        final int count = vertices.size();
        final double[] xs = new double[count];
        final double[] ys = new double[count];
        for (int index = 0; index < count; index++) {
            final PixelPoint vertex = wcs.skyToPixel(vertices.get(index));
            if (!vertex.isFinite()) {
                return null;
            }
            xs[index] = vertex.getX();
            ys[index] = vertex.getY();
        }
        return (x, y) -> {
            boolean isInside = false;
            for (int current = 0, previous = count - 1; current < count; previous = current++) {
                if ((ys[current] > y) != (ys[previous] > y)) {
                    final double crossing = xs[current] + (y - ys[current]) * (xs[previous] - xs[current]) / (ys[previous] - ys[current]);
                    if (x < crossing) {
                        isInside = !isInside;
                    }
                }
            }
            return isInside;
        };
    }
}
