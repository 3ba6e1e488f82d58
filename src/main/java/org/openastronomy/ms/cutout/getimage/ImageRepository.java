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
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.ExecutorService;

import com.google.common.collect.ImmutableSortedMap;

import io.vertx.core.json.JsonObject;

import org.openastronomy.ms.cutout.locate.CatalogLocator;
import org.openastronomy.ms.cutout.locate.GridSkyMap;
import org.openastronomy.ms.cutout.store.CachingTileStore;
import org.openastronomy.ms.cutout.store.FileTileStore;
import org.openastronomy.ms.cutout.store.ScienceIdScheme;
import org.openastronomy.ms.cutout.store.TileStore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The datasets that may be served, by name.
 */
public class ImageRepository {

    private static final Logger LOGGER = LoggerFactory.getLogger(ImageRepository.class);

    public static final String DATASET_PROPERTIES = "dataset.json";

    private final SortedMap<String, ImageGetter> imageGetters;

    /**
     * @param imageGetters the image getters for each dataset, by dataset name
     */
    public ImageRepository(Map<String, ImageGetter> imageGetters) {
        this.imageGetters = ImmutableSortedMap.copyOf(imageGetters);
    }

    /**
     * Open every dataset held in a subdirectory of a file-system tile store.
     * A dataset's {@value #DATASET_PROPERTIES} may give its {@code scienceId} scheme;
     * a dataset whose directory holds a sky map file may be used for mosaics.
     * @param root the directory holding a subdirectory for each dataset
     * @param skyMapFilename the name of the sky map file within a dataset directory
     * @param cachePixels how many pixels to keep cached for each dataset, zero for no cache
     * @param resolver for cutouts from single tiles
     * @param executor for assembling tracts in parallel, may be {@code null}
     * @return the datasets found
     * @throws IOException if the store could not be read
     */
    public static ImageRepository open(Path root, String skyMapFilename, long cachePixels, CutoutResolver resolver,
            ExecutorService executor) throws IOException {
        final SortedMap<String, ImageGetter> imageGetters = new TreeMap<>();
        try (final DirectoryStream<Path> directories = Files.newDirectoryStream(root, Files::isDirectory)) {
            for (final Path directory : directories) {
                final String dataset = directory.getFileName().toString();
                final FileTileStore fileStore = new FileTileStore(directory);
                final TileStore store = cachePixels > 0 ? new CachingTileStore(fileStore, cachePixels) : fileStore;
                final CatalogLocator locator = new CatalogLocator(fileStore.listTiles());
                ScienceIdScheme scienceIdScheme = null;
                final Path propertiesPath = directory.resolve(DATASET_PROPERTIES);
                if (Files.isRegularFile(propertiesPath)) {
                    final JsonObject properties = readJson(propertiesPath);
                    final String scheme = properties.getString("scienceId");
                    if (scheme != null) {
                        try {
                            scienceIdScheme = ScienceIdScheme.valueOf(scheme.toUpperCase());
                        } catch (IllegalArgumentException iae) {
                            final String message = "dataset " + dataset + " has unknown science id scheme " + scheme;
                            LOGGER.error(message);
                            throw new IllegalArgumentException(message, iae);
                        }
                    }
                }
                String skyMapName = null;
                MosaicStitcher stitcher = null;
                final Path skyMapPath = directory.resolve(skyMapFilename);
                if (Files.isRegularFile(skyMapPath)) {
                    final JsonObject skyMapJson = readJson(skyMapPath);
                    skyMapName = skyMapJson.getString("name", dataset);
                    stitcher = new MosaicStitcher(GridSkyMap.fromJson(skyMapJson), store, resolver, new Warper(), executor);
                }
                imageGetters.put(dataset,
                        new ImageGetter(dataset, store, locator, scienceIdScheme, resolver, skyMapName, stitcher));
                LOGGER.info("opened dataset {}{}", dataset, skyMapName == null ? "" : " with sky map " + skyMapName);
            }
        }
        return new ImageRepository(imageGetters);
    }

    private static JsonObject readJson(Path path) throws IOException {
        return new JsonObject(new String(Files.readAllBytes(path), StandardCharsets.UTF_8));
    }

    /**
     * @param dataset the name of a dataset
     * @return the image getter for the dataset, or {@code null} if there is no such dataset
     */
    public ImageGetter getImageGetter(String dataset) {
        return imageGetters.get(dataset);
    }

    /**
     * @return the names of the datasets
     */
    public Iterable<String> getDatasets() {
        return imageGetters.keySet();
    }
}
