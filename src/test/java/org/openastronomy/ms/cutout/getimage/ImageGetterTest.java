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

import org.openastronomy.ms.cutout.error.ImageNotFoundException;
import org.openastronomy.ms.cutout.error.RequestParseException;
import org.openastronomy.ms.cutout.geom.PixelBox;
import org.openastronomy.ms.cutout.geom.PixelPoint;
import org.openastronomy.ms.cutout.geom.SkyPoint;
import org.openastronomy.ms.cutout.geom.TanWcs;
import org.openastronomy.ms.cutout.locate.CatalogLocator;
import org.openastronomy.ms.cutout.raster.Raster;
import org.openastronomy.ms.cutout.region.RegionDescriptor;
import org.openastronomy.ms.cutout.region.ShapeKind;
import org.openastronomy.ms.cutout.region.SizeUnit;
import org.openastronomy.ms.cutout.store.ScienceIdScheme;
import org.openastronomy.ms.cutout.store.TileReference;
import org.openastronomy.ms.cutout.stub.TileStoreFake;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import org.mockito.Mockito;

/**
 * Check that the image getter finds the images that requests select.
 * Two tiles cover the same sky in different filters: pixels in filter r have value 1, those in filter g have value 2.
 */
public class ImageGetterTest {

    private static final SkyPoint CENTER = new SkyPoint(10, 0);
    private static final TileReference TILE_R = TileReference.forField(3325, 6, 184, "r");
    private static final TileReference TILE_G = TileReference.forField(3325, 6, 184, "g");

    private TileStoreFake store;
    private CatalogLocator locator;
    private final CutoutResolver resolver = new CutoutResolver(9.6);

    /**
     * Set up the tiles and their catalog.
     */
    @BeforeEach
    public void setupTiles() {
        store = new TileStoreFake();
        final TanWcs wcs = TanWcs.northUp(CENTER, new PixelPoint(49.5, 49.5), 1);
        store.putUniform(TILE_R, new PixelBox(0, 0, 100, 100), wcs, 1);
        store.putUniform(TILE_G, new PixelBox(0, 0, 100, 100), wcs, 2);
        locator = new CatalogLocator(store.listTiles());
    }

    /**
     * @return an image getter for the tiles that has no sky map
     */
    private ImageGetter getImageGetter() {
        return new ImageGetter("calexp", store, locator, ScienceIdScheme.FIELD, resolver, null, null);
    }

    /**
     * Check that whole tiles are found by position, by key and by science identifier.
     * @throws IOException unexpected
     */
    @Test
    public void testFullImages() throws IOException {
        final ImageGetter getter = getImageGetter();
        Assertions.assertEquals(1, getter.fullNearest(CENTER, "r").getPixel(0, 0));
        Assertions.assertEquals(2, getter.fullNearest(CENTER, "g").getPixel(0, 0));
        Assertions.assertEquals(2, getter.fullFromDataId(TILE_G).getPixel(99, 99));
        final Raster fromScienceId = getter.fullFromScienceId(3325260184L);
        Assertions.assertEquals(new PixelBox(0, 0, 100, 100), fromScienceId.getBounds());
        Assertions.assertEquals(1, fromScienceId.getPixel(50, 50));
    }

    /**
     * Check that images that do not exist are not found.
     */
    @Test
    public void testNotFound() {
        final ImageGetter getter = getImageGetter();
        Assertions.assertThrows(ImageNotFoundException.class, () -> getter.fullNearest(new SkyPoint(20, 0), "r"));
        Assertions.assertThrows(ImageNotFoundException.class, () -> getter.fullNearest(CENTER, "z"));
        Assertions.assertThrows(ImageNotFoundException.class, () -> getter.fullFromScienceId(3325260185L));
    }

    /**
     * Check cutouts by position and by key.
     * @throws IOException unexpected
     */
    @Test
    public void testCutouts() throws IOException {
        final ImageGetter getter = getImageGetter();
        final RegionDescriptor region = RegionDescriptor.box(ShapeKind.POINT_SIZE, CENTER, 11, 11, SizeUnit.PIXEL);
        final Raster nearest = getter.cutoutFromNearest(region, "g");
        Assertions.assertEquals(new PixelBox(44, 44, 11, 11), nearest.getBounds());
        Assertions.assertEquals(2, nearest.getPixel(44, 44));
        Assertions.assertEquals(1, getter.getCutout(region, TILE_R).getPixel(50, 50));
        Assertions.assertEquals(1, getter.cutoutFromScienceId(region, 3325260184L).getPixel(50, 50));
    }

    /**
     * Check cutouts of regions given as descriptors.
     * @throws IOException unexpected
     */
    @Test
    public void testCutoutFromPos() throws IOException {
        final ImageGetter getter = getImageGetter();
        final Raster nearest = getter.cutoutFromPos("CIRCLE 10 0 0.001", "g", null);
        Assertions.assertEquals(new PixelBox(46, 46, 7, 7), nearest.getBounds());
        Assertions.assertEquals(2, nearest.getPixel(49, 49));
        Assertions.assertTrue(nearest.isEmpty(46, 46));
        final Raster keyed = getter.cutoutFromPos("BRECT 10 0 5 5 arcsec", null, TILE_R);
        Assertions.assertEquals(new PixelBox(47, 47, 5, 5), keyed.getBounds());
        Assertions.assertEquals(0, keyed.countEmpty());
        Assertions.assertThrows(RequestParseException.class, () -> getter.cutoutFromPos("CIRCLE 10 0", "g", null));
    }

    /**
     * Check that a dataset without a science identifier scheme rejects science identifiers.
     */
    @Test
    public void testNoScienceIds() {
        final ImageGetter getter = new ImageGetter("calexp", store, locator, null, resolver, null, null);
        Assertions.assertThrows(RequestParseException.class, () -> getter.fullFromScienceId(3325260184L));
    }

    /**
     * Check that mosaics are made only from the dataset's own sky map.
     * @throws IOException unexpected
     */
    @Test
    public void testMosaic() throws IOException {
        final RegionDescriptor region = RegionDescriptor.box(ShapeKind.POINT_SIZE, CENTER, 10, 10, SizeUnit.ARCSECOND);
        final Cancellation cancellation = new Cancellation();
        final ImageGetter withoutSkyMap = getImageGetter();
        Assertions.assertThrows(ImageNotFoundException.class, () -> withoutSkyMap.getMosaic(region, "r", cancellation));
        final MosaicStitcher stitcherMock = Mockito.mock(MosaicStitcher.class);
        final Raster mosaic = new Raster(new PixelBox(0, 0, 1, 1), null);
        Mockito.when(stitcherMock.stitch(region, "r", cancellation)).thenReturn(mosaic);
        final ImageGetter getter = new ImageGetter("deepCoadd", store, locator, null, resolver, "deepCoadd_skyMap", stitcherMock);
        Assertions.assertSame(mosaic, getter.cutoutFromSkyMap("deepCoadd_skyMap", region, "r", cancellation));
        Assertions.assertThrows(ImageNotFoundException.class,
                () -> getter.cutoutFromSkyMap("otherSkyMap", region, "r", cancellation));
        Mockito.verify(stitcherMock, Mockito.times(1)).stitch(region, "r", cancellation);
    }
}
