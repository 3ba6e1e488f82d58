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

import org.openastronomy.ms.cutout.raster.Raster;

/**
 * A stored tile with its pixels.
 */
public class Tile {

    private final TileMetadata metadata;
    private final Raster raster;

    public Tile(TileMetadata metadata, Raster raster) {
        if (!metadata.getBounds().equals(raster.getBounds())) {
            throw new IllegalArgumentException("raster " + raster.getBounds() + " does not match " + metadata);
        }
        this.metadata = metadata;
        this.raster = raster;
    }

    public TileMetadata getMetadata() {
        return metadata;
    }

    public TileReference getReference() {
        return metadata.getReference();
    }

    /**
     * @return the tile's pixels, not to be modified
     */
    public Raster getRaster() {
        return raster;
    }
}
