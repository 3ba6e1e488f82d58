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

import java.util.List;

import com.google.common.collect.ImmutableList;

import org.openastronomy.ms.cutout.geom.SkyPoint;
import org.openastronomy.ms.cutout.mask.CircleMask;
import org.openastronomy.ms.cutout.mask.PolygonMask;
import org.openastronomy.ms.cutout.mask.RegionMask;

/**
 * A normalized region of the sky: a center and a box size, with the radius or the vertices retained for shapes
 * that cover less than their box. Immutable.
 */
public final class RegionDescriptor {

    private final ShapeKind kind;
    private final SkyPoint center;
    private final double width;
    private final double height;
    private final SizeUnit unit;
    private final double radius;
    private final List<SkyPoint> vertices;

    private RegionDescriptor(ShapeKind kind, SkyPoint center, double width, double height, SizeUnit unit, double radius,
            List<SkyPoint> vertices) {
        this.kind = kind;
        this.center = center;
        this.width = width;
        this.height = height;
        this.unit = unit;
        this.radius = radius;
        this.vertices = vertices;
    }

    /**
     * @param center the center of the circle
     * @param radius the radius in degrees
     * @return a circular region
     */
    public static RegionDescriptor circle(SkyPoint center, double radius) {
        return new RegionDescriptor(ShapeKind.CIRCLE, center, 2 * radius, 2 * radius, SizeUnit.DEGREE, radius, ImmutableList.of());
    }

    /**
     * @param kind how the box was described
     * @param center the center of the box
     * @param width the width of the box
     * @param height the height of the box
     * @param unit the unit of the width and height
     * @return a rectangular region
     */
    public static RegionDescriptor box(ShapeKind kind, SkyPoint center, double width, double height, SizeUnit unit) {
        return new RegionDescriptor(kind, center, width, height, unit, Double.NaN, ImmutableList.of());
    }

    /**
     * @param vertices the vertices of the polygon
     * @param center the centroid of the polygon
     * @param width the width of the bounding box in degrees
     * @param height the height of the bounding box in degrees
     * @return a polygonal region
     */
    public static RegionDescriptor polygon(List<SkyPoint> vertices, SkyPoint center, double width, double height) {
        return new RegionDescriptor(ShapeKind.POLYGON, center, width, height, SizeUnit.DEGREE, Double.NaN,
                ImmutableList.copyOf(vertices));
    }

    public ShapeKind getKind() {
        return kind;
    }

    public SkyPoint getCenter() {
        return center;
    }

    public double getWidth() {
        return width;
    }

    public double getHeight() {
        return height;
    }

    public SizeUnit getUnit() {
        return unit;
    }

    /**
     * @return the radius in degrees, not a number unless this region is a circle
     */
    public double getRadius() {
        return radius;
    }

    /**
     * @return the vertices, empty unless this region is a polygon
     */
    public List<SkyPoint> getVertices() {
        return vertices;
    }

    /**
     * @param pixelsPerArcsec the pixel scale of the frame in which the mask will be applied
     * @return the outline of this region if it covers less than its box, otherwise {@code null}
     */
    public RegionMask getMask(double pixelsPerArcsec) {
        switch (kind) {
        case CIRCLE:
            return new CircleMask(center, getCircleRadiusPixels(pixelsPerArcsec));
        case POLYGON:
            return new PolygonMask(vertices);
        default:
            return null;
        }
    }

    /**
     * @param pixelsPerArcsec the pixel scale of the frame
     * @return the radius of this circle in whole pixels, not limited to the range of {@code int}
     */
    public double getCircleRadiusPixels(double pixelsPerArcsec) {
        return Math.floor(SizeUnit.DEGREE.toArcsec(radius) * pixelsPerArcsec);
    }

    @Override
    public String toString() {
        final StringBuilder description = new StringBuilder();
        description.append(kind).append(' ').append(center);
        if (kind == ShapeKind.CIRCLE) {
            description.append(" r=").append(radius).append(" deg");
        } else {
            description.append(' ').append(width).append('×').append(height).append(' ').append(unit.name().toLowerCase());
        }
        return description.toString();
    }
}
