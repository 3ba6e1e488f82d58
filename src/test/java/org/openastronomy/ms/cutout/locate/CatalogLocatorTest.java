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

import java.util.Optional;

import com.google.common.collect.ImmutableList;

import org.openastronomy.ms.cutout.geom.Angles;
import org.openastronomy.ms.cutout.geom.PixelBox;
import org.openastronomy.ms.cutout.geom.PixelPoint;
import org.openastronomy.ms.cutout.geom.SkyPoint;
import org.openastronomy.ms.cutout.geom.TanWcs;
import org.openastronomy.ms.cutout.store.TileMetadata;
import org.openastronomy.ms.cutout.store.TileReference;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Check that the nearest tile containing a position is found.
 */
public class CatalogLocatorTest {

    private static final TileReference WEST_R = TileReference.forField(1, 1, 1, "r");
    private static final TileReference EAST_R = TileReference.forField(1, 1, 2, "r");
    private static final TileReference WEST_G = TileReference.forField(1, 1, 1, "g");
    private static final TileReference UNPLACED = TileReference.forField(1, 1, 3, "r");

    private CatalogLocator locator;

    /**
     * Construct the metadata of a tile of 100×100 pixels at one arcsecond per pixel.
     * @param reference the tile's reference
     * @param ra the right ascension of the tile's center
     * @return the tile's metadata
     */
    private static TileMetadata tileAt(TileReference reference, double ra) {
        final TanWcs wcs = TanWcs.northUp(new SkyPoint(ra, 0), new PixelPoint(49.5, 49.5), 1);
        return new TileMetadata(reference, new PixelBox(0, 0, 100, 100), wcs);
    }

    /**
     * Catalog overlapping tiles, one of them without a coordinate transform.
     */
    @BeforeEach
    public void setupLocator() {
        locator = new CatalogLocator(ImmutableList.of(
                tileAt(WEST_R, 10),
                tileAt(EAST_R, 10 + Angles.toDegrees(60)),
                tileAt(WEST_G, 10),
                new TileMetadata(UNPLACED, new PixelBox(0, 0, 100, 100), null)));
    }

    /**
     * Check that of the tiles containing a position the one whose center is nearest is chosen.
     */
    @Test
    public void testNearest() {
        Assertions.assertEquals(Optional.of(WEST_R), locator.nearestTileContaining(new SkyPoint(10, 0), "r"));
        final SkyPoint between = new SkyPoint(10 + Angles.toDegrees(40), 0);
        Assertions.assertEquals(Optional.of(EAST_R), locator.nearestTileContaining(between, "r"));
        Assertions.assertEquals(Optional.of(EAST_R), locator.nearestTileContaining(between, null));
    }

    /**
     * Check that the filter restricts the search.
     */
    @Test
    public void testFilter() {
        final SkyPoint between = new SkyPoint(10 + Angles.toDegrees(40), 0);
        Assertions.assertEquals(Optional.of(WEST_G), locator.nearestTileContaining(between, "g"));
        Assertions.assertFalse(locator.nearestTileContaining(between, "z").isPresent());
    }

    /**
     * Check that positions beyond every tile find none.
     */
    @Test
    public void testOutside() {
        Assertions.assertFalse(locator.nearestTileContaining(new SkyPoint(11, 0), "r").isPresent());
        Assertions.assertFalse(locator.nearestTileContaining(new SkyPoint(190, 0), null).isPresent());
    }
}
