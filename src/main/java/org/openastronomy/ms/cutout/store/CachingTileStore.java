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
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheLoader;
import com.google.common.cache.LoadingCache;
import com.google.common.cache.Weigher;
import com.google.common.util.concurrent.UncheckedExecutionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps recently used tiles in memory, weighed by their pixel count.
 * Metadata requests pass straight through to the underlying store.
 */
public class CachingTileStore implements TileStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(CachingTileStore.class);

    private final TileStore store;
    private final LoadingCache<TileReference, Tile> cache;

    /**
     * Construct a new caching tile store.
     * @param store the underlying store
     * @param maximumPixels how many pixels the cached tiles may hold in total
     */
    public CachingTileStore(TileStore store, long maximumPixels) {
        this.store = store;
        this.cache = buildTileCache(maximumPixels);
    }

    /**
     * Build the cache for tiles.
     * @param maximumWeight the maximum weight to set for the cache
     * @return the cache
     */
    private LoadingCache<TileReference, Tile> buildTileCache(long maximumWeight) {
        LOGGER.info("weight is {}", maximumWeight);
        return CacheBuilder.newBuilder()
                .weigher(new Weigher<TileReference, Tile>() {
                    @Override
                    public int weigh(TileReference reference, Tile tile) {
                        return (int) Math.min(Integer.MAX_VALUE, tile.getMetadata().getBounds().getArea());
                    }
                })
                .maximumWeight(maximumWeight)
                .expireAfterAccess(1, TimeUnit.MINUTES)
                .recordStats()
                .build(new CacheLoader<TileReference, Tile>() {
                    @Override
                    public Tile load(TileReference reference) throws IOException {
                        LOGGER.debug("cache miss for {}", reference);
                        return store.getTile(reference);
                    }
                });
    }

    @Override
    public TileMetadata getTileMetadata(TileReference reference) throws IOException {
        return store.getTileMetadata(reference);
    }

    @Override
    public Tile getTile(TileReference reference) throws IOException {
        try {
            return cache.get(reference);
        } catch (ExecutionException ee) {
            final Throwable cause = ee.getCause();
            if (cause instanceof IOException) {
                throw (IOException) cause;
            }
            throw new IOException("failed to load " + reference, cause);
        } catch (UncheckedExecutionException uee) {
            final Throwable cause = uee.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw uee;
        }
    }

    /**
     * @return how many tile requests were answered from the cache
     */
    long getHitCount() {
        return cache.stats().hitCount();
    }
}
