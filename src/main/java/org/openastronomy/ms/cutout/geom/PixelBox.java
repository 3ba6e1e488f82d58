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

package org.openastronomy.ms.cutout.geom;

import java.awt.Rectangle;
import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * An integer rectangle of pixels in some pixel frame. Immutable.
 * Pixel {@code (x, y)} covers the area from {@code (x - 0.5, y - 0.5)} to {@code (x + 0.5, y + 0.5)}.
 */
public final class PixelBox {

    private final int x;
    private final int y;
    private final int width;
    private final int height;

    /**
     * Construct a new pixel box.
     * @param x the leftmost pixel column
     * @param y the lowest pixel row
     * @param width the number of columns, not negative
     * @param height the number of rows, not negative
     */
    public PixelBox(int x, int y, int width, int height) {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("box cannot have negative extent: " + width + "×" + height);
        }
        this.x = x;
        this.y = y;
        this.width = width;
        this.height = height;
    }

    /**
     * Construct the box spanning two pixels, inclusive, in whichever order their coordinates come.
     * @param x1 the column of one corner pixel
     * @param y1 the row of one corner pixel
     * @param x2 the column of the opposite corner pixel
     * @param y2 the row of the opposite corner pixel
     * @return the spanning box
     */
    public static PixelBox spanning(int x1, int y1, int x2, int y2) {
        final int minX = Math.min(x1, x2);
        final int minY = Math.min(y1, y2);
        return new PixelBox(minX, minY, Math.max(x1, x2) - minX + 1, Math.max(y1, y2) - minY + 1);
    }

    private static PixelBox fromRectangle(Rectangle rectangle) {
        if (rectangle.isEmpty()) {
            return new PixelBox(rectangle.x, rectangle.y, 0, 0);
        }
        return new PixelBox(rectangle.x, rectangle.y, rectangle.width, rectangle.height);
    }

    private Rectangle toRectangle() {
        return new Rectangle(x, y, width, height);
    }

    public int getX() {
        return x;
    }

    public int getY() {
        return y;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    /**
     * @return one past the rightmost pixel column
     */
    public int getEndX() {
        return x + width;
    }

    /**
     * @return one past the highest pixel row
     */
    public int getEndY() {
        return y + height;
    }

    /**
     * @return if the box covers no pixels
     */
    public boolean isEmpty() {
        return width == 0 || height == 0;
    }

    /**
     * @return the number of pixels covered
     */
    public long getArea() {
        return (long) width * height;
    }

    /**
     * @param column a pixel column
     * @param row a pixel row
     * @return if the pixel lies within this box
     */
    public boolean contains(int column, int row) {
        return column >= x && column < getEndX() && row >= y && row < getEndY();
    }

    /**
     * @param point a pixel position
     * @return if the position lies within the area covered by this box's pixels
     */
    public boolean contains(PixelPoint point) {
        return point.isFinite() && !isEmpty()
                && point.getX() >= x - 0.5 && point.getX() < getEndX() - 0.5
                && point.getY() >= y - 0.5 && point.getY() < getEndY() - 0.5;
    }

    /**
     * @param other another box
     * @return if the other box lies entirely within this box
     */
    public boolean contains(PixelBox other) {
        return other.isEmpty() || (other.x >= x && other.y >= y && other.getEndX() <= getEndX() && other.getEndY() <= getEndY());
    }

    /**
     * @param other another box
     * @return if the two boxes share at least one pixel
     */
    public boolean overlaps(PixelBox other) {
        return !isEmpty() && !other.isEmpty() && toRectangle().intersects(other.toRectangle());
    }

    /**
     * @param other another box
     * @return the pixels common to both boxes, empty if they do not overlap
     */
    public PixelBox intersection(PixelBox other) {
        if (!overlaps(other)) {
            return new PixelBox(x, y, 0, 0);
        }
        return fromRectangle(toRectangle().intersection(other.toRectangle()));
    }

    /**
     * @param other another box
     * @return the smallest box containing both boxes
     */
    public PixelBox union(PixelBox other) {
        if (other.isEmpty()) {
            return this;
        } else if (isEmpty()) {
            return other;
        }
        return fromRectangle(toRectangle().union(other.toRectangle()));
    }

    /**
     * @param dx the columns by which to move
     * @param dy the rows by which to move
     * @return this box moved by the given offset
     */
    public PixelBox shift(int dx, int dy) {
        return new PixelBox(x + dx, y + dy, width, height);
    }

    /**
     * The outer corners of the area covered by this box's pixels, in the order lower-left, lower-right, upper-right, upper-left.
     * @return the four corners
     */
    public List<PixelPoint> getCorners() {
        final double minX = x - 0.5;
        final double minY = y - 0.5;
        final double maxX = getEndX() - 0.5;
        final double maxY = getEndY() - 0.5;
        return ImmutableList.of(new PixelPoint(minX, minY), new PixelPoint(maxX, minY),
                new PixelPoint(maxX, maxY), new PixelPoint(minX, maxY));
    }

    /**
     * @return the position of the center of this box
     */
    public PixelPoint getCenter() {
        return new PixelPoint(x + (width - 1) / 2.0, y + (height - 1) / 2.0);
    }

    @Override
    public boolean equals(Object object) {
        if (this == object) {
            return true;
        }
        if (!(object instanceof PixelBox)) {
            return false;
        }
        final PixelBox other = (PixelBox) object;
        return x == other.x && y == other.y && width == other.width && height == other.height;
    }

    @Override
    public int hashCode() {
        return ((x * 31 + y) * 31 + width) * 31 + height;
    }

    @Override
    public String toString() {
        return "[" + x + ", " + y + " " + width + "×" + height + "]";
    }
}
