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
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.openastronomy.ms.cutout.error.ImageNotFoundException;
import org.openastronomy.ms.cutout.error.TileIntegrityException;
import org.openastronomy.ms.cutout.geom.PixelBox;
import org.openastronomy.ms.cutout.geom.PixelPoint;
import org.openastronomy.ms.cutout.geom.SkyPoint;
import org.openastronomy.ms.cutout.geom.TanWcs;
import org.openastronomy.ms.cutout.raster.MaskPlane;
import org.openastronomy.ms.cutout.raster.Raster;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Check that tiles written to a directory may be read back and that damaged tiles are reported as such.
 */
public class FileTileStoreTest {

    private static final TileReference REFERENCE = TileReference.forField(3325, 6, 184, "r");

    @TempDir
    Path directory;

    private FileTileStore store;

    /**
     * Write a tile into a fresh store.
     * @throws IOException unexpected
     */
    @BeforeEach
    public void setupStore() throws IOException {
        store = new FileTileStore(directory);
        final PixelBox bounds = new PixelBox(10, 20, 4, 3);
        final TanWcs wcs = TanWcs.northUp(new SkyPoint(37.6, 0.1), new PixelPoint(11.5, 21), 0.4);
        final Raster raster = new Raster(bounds, wcs);
        for (int y = bounds.getY(); y < bounds.getEndY(); y++) {
            for (int x = bounds.getX(); x < bounds.getEndX(); x++) {
                raster.setPixel(x, y, x * 100 + y, x == 13 ? MaskPlane.EDGE.getBitMask() : 0);
            }
        }
        store.putTile(new Tile(new TileMetadata(REFERENCE, bounds, wcs), raster));
    }

    /**
     * Check that a tile reads back as it was written.
     * @throws IOException unexpected
     */
    @Test
    public void testReadBack() throws IOException {
        final Tile tile = store.getTile(REFERENCE);
        Assertions.assertEquals(REFERENCE, tile.getReference());
        Assertions.assertEquals(new PixelBox(10, 20, 4, 3), tile.getMetadata().getBounds());
        Assertions.assertEquals("r", tile.getMetadata().getFilter());
        final Raster raster = tile.getRaster();
        Assertions.assertEquals(1221, raster.getPixel(12, 21));
        Assertions.assertEquals(MaskPlane.EDGE.getBitMask(), raster.getMask(13, 22));
        Assertions.assertEquals(0, raster.getMask(12, 22));
        final SkyPoint center = tile.getMetadata().getCenter();
        Assertions.assertEquals(37.6, center.getRa(), 1e-9);
        Assertions.assertEquals(0.1, center.getDec(), 1e-9);
        Assertions.assertEquals(0.4, raster.getWcs().getPixelScale().getAsDouble(), 1e-9);
    }

    /**
     * Check that the stored tiles are listed.
     * @throws IOException unexpected
     */
    @Test
    public void testListing() throws IOException {
        Files.write(directory.resolve("dataset.json"), "{}".getBytes(StandardCharsets.UTF_8));
        final List<TileMetadata> tiles = store.listTiles();
        Assertions.assertEquals(1, tiles.size());
        Assertions.assertEquals(REFERENCE, tiles.get(0).getReference());
    }

    /**
     * Check that an absent tile is not found.
     */
    @Test
    public void testAbsent() {
        Assertions.assertThrows(ImageNotFoundException.class, () -> store.getTile(TileReference.forField(3325, 6, 185, "r")));
    }

    /**
     * Check that pixel data of the wrong size is reported as damage.
     * @throws IOException unexpected
     */
    @Test
    public void testTruncatedPixels() throws IOException {
        Files.write(directory.resolve(REFERENCE + ".raw"), new byte[7]);
        Assertions.assertThrows(TileIntegrityException.class, () -> store.getTile(REFERENCE));
    }

    /**
     * Check that unreadable metadata is reported as damage.
     * @throws IOException unexpected
     */
    @Test
    public void testDamagedMetadata() throws IOException {
        Files.write(directory.resolve(REFERENCE + ".json"), "{\"id\": ".getBytes(StandardCharsets.UTF_8));
        Assertions.assertThrows(TileIntegrityException.class, () -> store.getTileMetadata(REFERENCE));
        Assertions.assertTrue(store.listTiles().isEmpty());
    }

    /**
     * Check that metadata that names a different tile is reported as damage.
     * @throws IOException unexpected
     */
    @Test
    public void testMismatchedMetadata() throws IOException {
        final TileReference other = TileReference.forField(3325, 6, 186, "r");
        Files.copy(directory.resolve(REFERENCE + ".json"), directory.resolve(other + ".json"));
        Assertions.assertThrows(TileIntegrityException.class, () -> store.getTileMetadata(other));
    }

    /**
     * Check that a tile need not have a mask nor a coordinate transform.
     * @throws IOException unexpected
     */
    @Test
    public void testMinimalTile() throws IOException {
        final TileReference minimal = TileReference.forField(1, 1, 1, "g");
        final String metadata = "{\"id\": {\"run\": 1, \"camcol\": 1, \"field\": 1, \"filter\": \"g\"}, "
                + "\"bbox\": {\"width\": 2, \"height\": 1}}";
        Files.write(directory.resolve(minimal + ".json"), metadata.getBytes(StandardCharsets.UTF_8));
        Files.write(directory.resolve(minimal + ".raw"), new byte[2 * Float.BYTES]);
        final Tile tile = store.getTile(minimal);
        Assertions.assertNull(tile.getMetadata().getWcs());
        Assertions.assertNull(tile.getMetadata().getCenter());
        Assertions.assertEquals(new PixelBox(0, 0, 2, 1), tile.getMetadata().getBounds());
        Assertions.assertEquals(0, tile.getRaster().countEmpty());
    }
}
