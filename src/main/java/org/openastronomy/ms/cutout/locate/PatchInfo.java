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

package org.openastronomy.ms.cutout.locate;

import org.openastronomy.ms.cutout.geom.PixelBox;

/**
 * A patch of a tract: its grid index and the pixels it covers in the tract's frame.
 */
public final class PatchInfo {

    private final int indexX;
    private final int indexY;
    private final PixelBox bounds;

    public PatchInfo(int indexX, int indexY, PixelBox bounds) {
        this.indexX = indexX;
        this.indexY = indexY;
        this.bounds = bounds;
    }

    public int getIndexX() {
        return indexX;
    }

    public int getIndexY() {
        return indexY;
    }

    /**
     * @return the pixels of the patch, including any overlap with neighbouring patches
     */
    public PixelBox getBounds() {
        return bounds;
    }

    @Override
    public String toString() {
        return "patch " + indexX + "," + indexY;
    }
}
