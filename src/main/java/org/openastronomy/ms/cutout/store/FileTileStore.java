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
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;

import com.google.common.collect.ImmutableList;

import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;

import org.openastronomy.ms.cutout.error.ImageNotFoundException;
import org.openastronomy.ms.cutout.error.TileIntegrityException;
import org.openastronomy.ms.cutout.geom.PixelBox;
import org.openastronomy.ms.cutout.geom.SkyWcs;
import org.openastronomy.ms.cutout.geom.TanWcs;
import org.openastronomy.ms.cutout.raster.Raster;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tiles of one dataset held as files in a directory. Each tile named by its {@link TileReference} has
 * <ul>
 * <li>{@code <reference>.json} giving {@code id}, {@code bbox} and optionally a tangent-plane {@code wcs},</li>
 * <li>{@code <reference>.raw} of big-endian 32-bit floating-point pixels, row by row from the lowest row,</li>
 * <li>optionally {@code <reference>.mask} of big-endian 32-bit mask words in the same order.</li>
 * </ul>
 */
public class FileTileStore implements TileStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(FileTileStore.class);

    private static final String SUFFIX_METADATA = ".json";
    private static final String SUFFIX_PIXELS = ".raw";
    private static final String SUFFIX_MASK = ".mask";

    private final Path directory;

    /**
     * @param directory the directory holding the tile files
     */
    public FileTileStore(Path directory) {
        this.directory = directory;
    }

    /**
     * @return the directory holding the tile files
     */
    public Path getDirectory() {
        return directory;
    }

    private static PixelBox readBounds(JsonObject bbox) {
        final Integer x = bbox.getInteger("x", 0);
        final Integer y = bbox.getInteger("y", 0);
        final Integer width = bbox.getInteger("width");
        final Integer height = bbox.getInteger("height");
        if (width == null || height == null) {
            throw new IllegalArgumentException("bounding box requires width and height");
        }
        return new PixelBox(x, y, width, height);
    }

    private static JsonObject writeBounds(PixelBox bounds) {
        return new JsonObject().put("x", bounds.getX()).put("y", bounds.getY())
                .put("width", bounds.getWidth()).put("height", bounds.getHeight());
    }

    /**
     * Parse tile metadata from its JSON form.
     * @param json the JSON form of tile metadata
     * @return the tile metadata
     * @throws IllegalArgumentException if the metadata is malformed
     */
    static TileMetadata readMetadata(JsonObject json) {
        final JsonObject id = json.getJsonObject("id");
        final JsonObject bbox = json.getJsonObject("bbox");
        if (id == null || bbox == null) {
            throw new IllegalArgumentException("tile metadata requires id and bbox");
        }
        final JsonObject wcsJson = json.getJsonObject("wcs");
        final SkyWcs wcs = wcsJson == null ? null : TanWcs.fromJson(wcsJson);
        return new TileMetadata(TileReference.of(id.getMap()), readBounds(bbox), wcs);
    }

    private Path pathFor(TileReference reference, String suffix) {
        return directory.resolve(reference + suffix);
    }

    @Override
    public TileMetadata getTileMetadata(TileReference reference) throws IOException {
        final Path path = pathFor(reference, SUFFIX_METADATA);
        if (!Files.isRegularFile(path)) {
            throw new ImageNotFoundException("no tile " + reference);
        }
        final String text = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
        try {
            final TileMetadata metadata = readMetadata(new JsonObject(text));
            if (!metadata.getReference().equals(reference)) {
                throw new TileIntegrityException("metadata for " + reference + " describes " + metadata.getReference());
            }
            return metadata;
        } catch (DecodeException | IllegalArgumentException | ClassCastException e) {
            throw new TileIntegrityException("cannot read metadata for " + reference, e);
        }
    }

    @Override
    public Tile getTile(TileReference reference) throws IOException {
        final TileMetadata metadata = getTileMetadata(reference);
        final PixelBox bounds = metadata.getBounds();
        final int count = Math.toIntExact(bounds.getArea());
        final Path pixelsPath = pathFor(reference, SUFFIX_PIXELS);
        if (!Files.isRegularFile(pixelsPath)) {
            throw new TileIntegrityException("no pixel data for " + reference);
        }
        final byte[] pixelBytes = Files.readAllBytes(pixelsPath);
        if (pixelBytes.length != count * Float.BYTES) {
            throw new TileIntegrityException("pixel data for " + reference + " has " + pixelBytes.length + " bytes, expected "
                    + count * Float.BYTES);
        }
        final float[] pixels = new float[count];
        ByteBuffer.wrap(pixelBytes).asFloatBuffer().get(pixels);
        final int[] mask = new int[count];
        final Path maskPath = pathFor(reference, SUFFIX_MASK);
        if (Files.isRegularFile(maskPath)) {
            final byte[] maskBytes = Files.readAllBytes(maskPath);
            if (maskBytes.length != count * Integer.BYTES) {
                throw new TileIntegrityException("mask for " + reference + " has " + maskBytes.length + " bytes, expected "
                        + count * Integer.BYTES);
            }
            ByteBuffer.wrap(maskBytes).asIntBuffer().get(mask);
        }
        LOGGER.debug("read {}", metadata);
        return new Tile(metadata, new Raster(bounds, metadata.getWcs(), pixels, mask));
    }

    /**
     * Write a tile into this store, replacing any tile of the same reference.
     * @param tile the tile to write, its transform must be a {@link TanWcs} or absent
     * @throws IOException if the tile could not be written
     */
    public void putTile(Tile tile) throws IOException {
        final TileMetadata metadata = tile.getMetadata();
        final JsonObject json = new JsonObject()
                .put("id", new JsonObject(new LinkedHashMap<String, Object>(metadata.getReference().getKeys())))
                .put("bbox", writeBounds(metadata.getBounds()));
        if (metadata.getWcs() instanceof TanWcs) {
            json.put("wcs", ((TanWcs) metadata.getWcs()).toJson());
        } else if (metadata.getWcs() != null) {
            throw new IllegalArgumentException("only tangent-plane transforms can be stored");
        }
        final Raster raster = tile.getRaster();
        final int count = Math.toIntExact(metadata.getBounds().getArea());
        final ByteBuffer pixels = ByteBuffer.allocate(count * Float.BYTES);
        final ByteBuffer mask = ByteBuffer.allocate(count * Integer.BYTES);
        for (int y = raster.getBounds().getY(); y < raster.getBounds().getEndY(); y++) {
            for (int x = raster.getBounds().getX(); x < raster.getBounds().getEndX(); x++) {
                pixels.putFloat(raster.getPixel(x, y));
                mask.putInt(raster.getMask(x, y));
            }
        }
        Files.createDirectories(directory);
        Files.write(pathFor(metadata.getReference(), SUFFIX_PIXELS), pixels.array());
        Files.write(pathFor(metadata.getReference(), SUFFIX_MASK), mask.array());
        Files.write(pathFor(metadata.getReference(), SUFFIX_METADATA), json.encodePrettily().getBytes(StandardCharsets.UTF_8));
        LOGGER.debug("wrote {}", metadata);
    }

    /**
     * Read the metadata of every tile in this store. Unreadable tiles are skipped with a warning.
     * @return the metadata of the tiles in this store
     * @throws IOException if the directory could not be listed
     */
    public List<TileMetadata> listTiles() throws IOException {
        final ImmutableList.Builder<TileMetadata> tiles = ImmutableList.builder();
        if (!Files.isDirectory(directory)) {
            return tiles.build();
        }
        try (final DirectoryStream<Path> paths = Files.newDirectoryStream(directory, "*=*" + SUFFIX_METADATA)) {
            for (final Path path : paths) {
                final String filename = path.getFileName().toString();
                final String name = filename.substring(0, filename.length() - SUFFIX_METADATA.length());
                try {
                    tiles.add(getTileMetadata(TileReference.parse(name)));
                } catch (IllegalArgumentException | TileIntegrityException e) {
                    LOGGER.warn("skipping unreadable tile {}", filename, e);
                }
            }
        }
        return tiles.build();
    }
}
