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

package org.openastronomy.ms.cutout.getimage;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import com.google.common.collect.ImmutableList;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import org.openastronomy.ms.cutout.geom.PixelBox;
import org.openastronomy.ms.cutout.geom.PixelPoint;
import org.openastronomy.ms.cutout.geom.SkyPoint;
import org.openastronomy.ms.cutout.geom.TanWcs;
import org.openastronomy.ms.cutout.raster.Raster;
import org.openastronomy.ms.cutout.region.RegionDescriptor;
import org.openastronomy.ms.cutout.region.ShapeKind;
import org.openastronomy.ms.cutout.region.SizeUnit;
import org.openastronomy.ms.cutout.store.FileTileStore;
import org.openastronomy.ms.cutout.store.Tile;
import org.openastronomy.ms.cutout.store.TileMetadata;
import org.openastronomy.ms.cutout.store.TileReference;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Check that datasets are opened from the directories of a store.
 */
public class ImageRepositoryTest {

    private static final SkyPoint CENTER = new SkyPoint(10, 0);
    private static final TanWcs WCS = TanWcs.northUp(CENTER, new PixelPoint(49.5, 49.5), 1);

    @TempDir
    Path root;

    private final CutoutResolver resolver = new CutoutResolver(9.6);

    /**
     * Write a tile with every pixel set to the given value.
     * @param directory the dataset directory
     * @param reference the tile's reference
     * @param bounds the tile's bounds
     * @param value the value of every pixel
     * @throws IOException if the tile could not be written
     */
    private static void writeTile(Path directory, TileReference reference, PixelBox bounds, float value) throws IOException {
        final Raster raster = new Raster(bounds, WCS);
        for (int y = bounds.getY(); y < bounds.getEndY(); y++) {
            for (int x = bounds.getX(); x < bounds.getEndX(); x++) {
                raster.setPixel(x, y, value, 0);
            }
        }
        new FileTileStore(directory).putTile(new Tile(new TileMetadata(reference, bounds, WCS), raster));
    }

    /**
     * Write a dataset of survey fields and a dataset of coadd patches with a sky map.
     * @throws IOException unexpected
     */
    @BeforeEach
    public void setupStore() throws IOException {
        final Path calexp = root.resolve("calexp");
        writeTile(calexp, TileReference.forField(3325, 6, 184, "r"), new PixelBox(0, 0, 100, 100), 3);
        Files.write(calexp.resolve(ImageRepository.DATASET_PROPERTIES),
                new JsonObject().put("scienceId", "field").encode().getBytes(StandardCharsets.UTF_8));
        final Path deepCoadd = root.resolve("deepCoadd");
        for (int patchY = 0; patchY < 2; patchY++) {
            for (int patchX = 0; patchX < 2; patchX++) {
                writeTile(deepCoadd, TileReference.forPatch(0, patchX, patchY, "i"),
                        new PixelBox(50 * patchX, 50 * patchY, 50, 50), 10 * patchX + patchY);
            }
        }
        final JsonObject tract = new JsonObject().put("id", 0).put("wcs", WCS.toJson())
                .put("bbox", new JsonObject().put("width", 100).put("height", 100));
        final JsonObject skyMap = new JsonObject().put("patchSize", new JsonArray().add(50).add(50))
                .put("tracts", new JsonArray().add(tract));
        Files.write(deepCoadd.resolve("skymap.json"), skyMap.encode().getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Check that each directory becomes a dataset with the capabilities that its files offer.
     * @throws IOException unexpected
     */
    @Test
    public void testOpen() throws IOException {
        final ImageRepository repository = ImageRepository.open(root, "skymap.json", 1000000, resolver, null);
        Assertions.assertEquals(ImmutableList.of("calexp", "deepCoadd"), ImmutableList.copyOf(repository.getDatasets()));
        Assertions.assertNull(repository.getImageGetter("raw"));
        final ImageGetter calexp = repository.getImageGetter("calexp");
        Assertions.assertEquals("calexp", calexp.getDataset());
        Assertions.assertEquals(3, calexp.fullFromScienceId(3325260184L).getPixel(0, 0));
        Assertions.assertEquals(3, calexp.fullNearest(CENTER, "r").getPixel(0, 0));
        final ImageGetter deepCoadd = repository.getImageGetter("deepCoadd");
        final RegionDescriptor region = RegionDescriptor.box(ShapeKind.POINT_SIZE, WCS.pixelToSky(new PixelPoint(50, 50)),
                10, 10, SizeUnit.ARCSECOND);
        final Raster mosaic = deepCoadd.cutoutFromSkyMap("deepCoadd", region, "i", new Cancellation());
        Assertions.assertEquals(new PixelBox(45, 45, 11, 11), mosaic.getBounds());
        Assertions.assertEquals(0, mosaic.countEmpty());
        Assertions.assertEquals(0, mosaic.getPixel(45, 45));
        Assertions.assertEquals(11, mosaic.getPixel(55, 55));
    }

    /**
     * Check that a dataset with an unknown science identifier scheme is refused.
     * @throws IOException unexpected
     */
    @Test
    public void testUnknownScheme() throws IOException {
        Files.write(root.resolve("calexp").resolve(ImageRepository.DATASET_PROPERTIES),
                "{\"scienceId\": \"visit\"}".getBytes(StandardCharsets.UTF_8));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> ImageRepository.open(root, "skymap.json", 0, resolver, null));
    }
}
