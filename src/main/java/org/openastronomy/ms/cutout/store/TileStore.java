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

import java.io.IOException;

/**
 * Provides stored tiles by their key. Implementations must be safe for concurrent use.
 */
public interface TileStore {

    /**
     * @param reference a tile's key
     * @return the tile's metadata
     * @throws org.openastronomy.ms.cutout.error.ImageNotFoundException if there is no such tile
     * @throws IOException if the tile could not be read
     */
    TileMetadata getTileMetadata(TileReference reference) throws IOException;

    /**
     * @param reference a tile's key
     * @return the tile, whose raster is not to be modified
     * @throws org.openastronomy.ms.cutout.error.ImageNotFoundException if there is no such tile
     * @throws IOException if the tile could not be read
     */
    Tile getTile(TileReference reference) throws IOException;
}
