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

package org.openastronomy.ms.cutout.store;

import org.openastronomy.ms.cutout.geom.PixelBox;
import org.openastronomy.ms.cutout.geom.SkyPoint;
import org.openastronomy.ms.cutout.geom.SkyWcs;

/**
 * What is known of a stored tile without reading its pixels.
 */
public class TileMetadata {

    private final TileReference reference;
    private final PixelBox bounds;
    private final SkyWcs wcs;

    /**
     * @param reference the tile's key
     * @param bounds the tile's extent in its own pixel frame
     * @param wcs the tile's coordinate transform, {@code null} if the tile has none
     */
    public TileMetadata(TileReference reference, PixelBox bounds, SkyWcs wcs) {
        this.reference = reference;
        this.bounds = bounds;
        this.wcs = wcs;
    }

    public TileReference getReference() {
        return reference;
    }

    public PixelBox getBounds() {
        return bounds;
    }

    /**
     * @return the tile's coordinate transform, may be {@code null}
     */
    public SkyWcs getWcs() {
        return wcs;
    }

    /**
     * @return the filter band of the tile, may be {@code null}
     */
    public String getFilter() {
        return reference.get("filter");
    }

    /**
     * @return the sky position of the tile's central pixel, or {@code null} if the tile has no transform
     */
    public SkyPoint getCenter() {
        return wcs == null ? null : wcs.pixelToSky(bounds.getCenter());
    }

    @Override
    public String toString() {
        return "tile " + reference + " " + bounds;
    }
}
