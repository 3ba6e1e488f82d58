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

package org.openastronomy.ms.cutout;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Properties;

import com.google.common.collect.ImmutableMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stores the configuration of this microservice.
 */
public class Configuration {

    private static final Logger LOGGER = LoggerFactory.getLogger(Configuration.class);

    public final static String PLACEHOLDER_DB = "{db}";

    /* The prefix of the Java system properties that configure this microservice. */
    public final static String SYSTEM_PROPERTY_PREFIX = "cutout.ms.";

    /* Configuration keys for the map provided to the constructor. */
    public final static String CONF_COMPRESS_ZLIB_LEVEL = "compress.zlib.level";
    public final static String CONF_CUTOUT_AREA_MAX = "cutout.area.max";
    public final static String CONF_DISPATCH_TABLE = "dispatch.table";
    public final static String CONF_MOSAIC_THREADS = "mosaic.threads";
    public final static String CONF_NET_PATH_IMAGE = "net.path.image";
    public final static String CONF_NET_PORT = "net.port";
    public final static String CONF_STORE_ROOT = "store.root";
    public final static String CONF_STORE_SKYMAP = "store.skymap";
    public final static String CONF_TILE_CACHE_SIZE = "tile-cache.size";

    /* Configuration initialized to default values. */
    private int zlibLevel = 6;
    private double cutoutAreaMax = 9.6;
    private String dispatchTable = "handler-table.json";
    private int mosaicThreads = 0;
    private String netPathBase = "/api/image/v1/";
    private String netPath = getRegexForNetPath("/api/image/v1/" + PLACEHOLDER_DB);
    private int netPort = 8080;
    private Path storeRoot = Paths.get("store");
    private String storeSkyMap = "skymap.json";
    private long tileCacheSize = 256 * 1000000L;

    /**
     * Convert the given URI path to a regular expression in which {@link #PLACEHOLDER_DB} matches the database name.
     * @param netPath a URI path, must contain {@link #PLACEHOLDER_DB}
     * @return a corresponding regular expression
     */
    private static final String getRegexForNetPath(String netPath) {
        final int dbIndex = netPath.indexOf(PLACEHOLDER_DB);
        final StringBuilder netPathBuilder = new StringBuilder();
        netPathBuilder.append("\\Q");
        netPathBuilder.append(netPath.substring(0, dbIndex));
        netPathBuilder.append("\\E");
        netPathBuilder.append("([\\w-]+)");
        final String suffix = netPath.substring(dbIndex + PLACEHOLDER_DB.length());
        if (!suffix.isEmpty()) {
            netPathBuilder.append("\\Q");
            netPathBuilder.append(suffix);
            netPathBuilder.append("\\E");
        }
        return netPathBuilder.toString();
    }

    /**
     * Select the configuration from the given properties.
     * @param properties some properties
     * @return the values of those properties whose names bear the {@link #SYSTEM_PROPERTY_PREFIX}, without the prefix
     */
    static Map<String, String> fromProperties(Properties properties) {
        final ImmutableMap.Builder<String, String> configuration = ImmutableMap.builder();
        for (final Map.Entry<Object, Object> property : properties.entrySet()) {
            final Object keyObject = property.getKey();
            final Object valueObject = property.getValue();
            if (keyObject instanceof String && valueObject instanceof String) {
                final String key = (String) keyObject;
                final String value = (String) valueObject;
                if (key.startsWith(SYSTEM_PROPERTY_PREFIX)) {
                    configuration.put(key.substring(SYSTEM_PROPERTY_PREFIX.length()), value);
                }
            }
        }
        return configuration.build();
    }

    /**
     * Construct a new read-only configuration drawn from system properties of the form {@code cutout.ms.*}.
     */
    public Configuration() {
        setConfiguration(fromProperties(System.getProperties()));
    }

    /**
     * Construct a new read-only configuration.
     * @param configuration a map of configuration keys and values, may be empty but must not be {@code null}
     */
    public Configuration(Map<String, String> configuration) {
        setConfiguration(configuration);
    }

    /**
     * @param configuration the configuration keys and values to apply over the current state.
     */
    private void setConfiguration(Map<String, String> configuration) {
        final String zlibLevel = configuration.get(CONF_COMPRESS_ZLIB_LEVEL);
        final String cutoutAreaMax = configuration.get(CONF_CUTOUT_AREA_MAX);
        final String dispatchTable = configuration.get(CONF_DISPATCH_TABLE);
        final String mosaicThreads = configuration.get(CONF_MOSAIC_THREADS);
        final String netPath = configuration.get(CONF_NET_PATH_IMAGE);
        final String netPort = configuration.get(CONF_NET_PORT);
        final String storeRoot = configuration.get(CONF_STORE_ROOT);
        final String storeSkyMap = configuration.get(CONF_STORE_SKYMAP);
        final String tileCacheSize = configuration.get(CONF_TILE_CACHE_SIZE);

        if (zlibLevel != null) {
            try {
                this.zlibLevel = Integer.parseInt(zlibLevel);
            } catch (NumberFormatException nfe) {
                final String message = "deflate compression level must be an integer, not " + zlibLevel;
                LOGGER.error(message);
                throw new IllegalArgumentException(message);
            }
            if (this.zlibLevel < -1 || this.zlibLevel > 9) {
                final String message = "deflate compression level must be from -1 to 9, not " + zlibLevel;
                LOGGER.error(message);
                throw new IllegalArgumentException(message);
            }
        }

        if (cutoutAreaMax != null) {
            try {
                this.cutoutAreaMax = Double.parseDouble(cutoutAreaMax);
            } catch (NumberFormatException nfe) {
                final String message = "maximum cutout area must be a number, not " + cutoutAreaMax;
                LOGGER.error(message);
                throw new IllegalArgumentException(message);
            }
            if (!(this.cutoutAreaMax > 0)) {
                final String message = "maximum cutout area must be positive, not " + cutoutAreaMax;
                LOGGER.error(message);
                throw new IllegalArgumentException(message);
            }
        }

        if (dispatchTable != null) {
            this.dispatchTable = dispatchTable;
        }

        if (mosaicThreads != null) {
            try {
                this.mosaicThreads = Integer.parseInt(mosaicThreads);
            } catch (NumberFormatException nfe) {
                final String message = "mosaic thread count must be an integer, not " + mosaicThreads;
                LOGGER.error(message);
                throw new IllegalArgumentException(message);
            }
            if (this.mosaicThreads < 0) {
                final String message = "mosaic thread count cannot be negative";
                LOGGER.error(message);
                throw new IllegalArgumentException(message);
            }
        }

        if (netPath != null) {
            if (netPath.indexOf('\\') == -1) {
                final int dbIndex = netPath.indexOf(PLACEHOLDER_DB);
                if (dbIndex != -1) {
                    this.netPath = getRegexForNetPath(netPath);
                    this.netPathBase = netPath.substring(0, dbIndex);
                } else {
                    final String message = "URI path must contain " + PLACEHOLDER_DB + " placeholder for database name";
                    LOGGER.error(message);
                    throw new IllegalArgumentException(message);
                }
            } else {
                final String message = "URI path cannot contain backslashes";
                LOGGER.error(message);
                throw new IllegalArgumentException(message);
            }
        }

        if (netPort != null) {
            try {
                this.netPort = Integer.parseInt(netPort);
            } catch (NumberFormatException nfe) {
                final String message = "TCP port must be an integer, not " + netPort;
                LOGGER.error(message);
                throw new IllegalArgumentException(message);
            }
        }

        if (storeRoot != null) {
            this.storeRoot = Paths.get(storeRoot);
        }

        if (storeSkyMap != null) {
            if (storeSkyMap.isEmpty() || storeSkyMap.indexOf('/') != -1) {
                final String message = "sky map must be a file name, not " + storeSkyMap;
                LOGGER.error(message);
                throw new IllegalArgumentException(message);
            }
            this.storeSkyMap = storeSkyMap;
        }

        if (tileCacheSize != null) {
            try {
                this.tileCacheSize = Long.parseLong(tileCacheSize) * 1000000L;
            } catch (NumberFormatException nfe) {
                final String message = "tile cache size must be an integer, not " + tileCacheSize;
                LOGGER.error(message);
                throw new IllegalArgumentException(message);
            }
        }

        LOGGER.info("configured: {} = {}", CONF_COMPRESS_ZLIB_LEVEL, this.zlibLevel);
        LOGGER.info("configured: {} = {}", CONF_CUTOUT_AREA_MAX, this.cutoutAreaMax);
        LOGGER.info("configured: {} = {}", CONF_DISPATCH_TABLE, this.dispatchTable);
        LOGGER.info("configured: {} = {}", CONF_MOSAIC_THREADS, this.mosaicThreads);
        LOGGER.info("configured: {} = {}", CONF_NET_PATH_IMAGE, this.netPath);
        LOGGER.info("configured: {} = {}", CONF_NET_PORT, this.netPort);
        LOGGER.info("configured: {} = {}", CONF_STORE_ROOT, this.storeRoot);
        LOGGER.info("configured: {} = {}", CONF_STORE_SKYMAP, this.storeSkyMap);
        LOGGER.info("configured: {} = {}", CONF_TILE_CACHE_SIZE, this.tileCacheSize);
    }

    /**
     * @return the zlib compression level for rasters
     */
    public int getDeflateLevel() {
        return zlibLevel;
    }

    /**
     * @return the largest region that may be requested, in square degrees
     */
    public double getCutoutAreaMax() {
        return cutoutAreaMax;
    }

    /**
     * @return the file or class-path resource holding the handler table
     */
    public String getDispatchTable() {
        return dispatchTable;
    }

    /**
     * @return how many threads assemble mosaic tracts in parallel, zero for none
     */
    public int getMosaicThreads() {
        return mosaicThreads;
    }

    /**
     * @return the URI path prefix shared by this microservice's endpoints
     */
    public String getNetPathBase() {
        return netPathBase;
    }

    /**
     * @return a regular expression for the image endpoint in which the first group matches the database name
     */
    public String getNetPath() {
        return netPath;
    }

    /**
     * @return the TCP port on which to listen
     */
    public int getServerPort() {
        return netPort;
    }

    /**
     * @return the directory holding a subdirectory for each dataset
     */
    public Path getStoreRoot() {
        return storeRoot;
    }

    /**
     * @return the name of the sky map file in a dataset directory
     */
    public String getStoreSkyMap() {
        return storeSkyMap;
    }

    /**
     * @return how many pixels of each dataset to keep cached
     */
    public long getTileCacheSize() {
        return tileCacheSize;
    }
}
