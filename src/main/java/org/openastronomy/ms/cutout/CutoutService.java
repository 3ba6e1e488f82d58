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

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

import io.vertx.core.AsyncResult;
import io.vertx.core.Verticle;
import io.vertx.core.Vertx;

import org.openastronomy.ms.cutout.dispatch.Dispatcher;
import org.openastronomy.ms.cutout.dispatch.HandlerTable;
import org.openastronomy.ms.cutout.getimage.CutoutResolver;
import org.openastronomy.ms.cutout.getimage.ImageRepository;
import org.openastronomy.ms.cutout.raster.DeflateRasterEncoder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Microservice providing image cutouts and mosaics over a HTTP endpoint.
 */
public class CutoutService {

    private static final Logger LOGGER = LoggerFactory.getLogger(CutoutService.class);

    /**
     * The parts of this microservice that both the HTTP endpoint and the command-line tool use.
     */
    static class Engine {

        final HandlerTable table;
        final Dispatcher dispatcher;
        final ImageRepository repository;
        final DeflateRasterEncoder encoder;
        final ExecutorService executor;

        /**
         * Open the handler table and the tile store.
         * @param configuration the configuration of this microservice
         * @throws IOException if the handler table or the tile store could not be read
         */
        Engine(Configuration configuration) throws IOException {
            this.table = HandlerTable.load(configuration.getDispatchTable());
            this.dispatcher = new Dispatcher(table);
            final int threads = configuration.getMosaicThreads();
            this.executor = threads > 0 ? Executors.newFixedThreadPool(threads,
                    new ThreadFactoryBuilder().setNameFormat("mosaic-%d").setDaemon(true).build()) : null;
            final CutoutResolver resolver = new CutoutResolver(configuration.getCutoutAreaMax());
            this.repository = ImageRepository.open(configuration.getStoreRoot(), configuration.getStoreSkyMap(),
                    configuration.getTileCacheSize(), resolver, executor);
            this.encoder = new DeflateRasterEncoder(configuration.getDeflateLevel());
        }

        /**
         * Release the mosaic threads, if any.
         */
        void close() {
            if (executor != null) {
                executor.shutdownNow();
            }
        }
    }

    /**
     * Load the named property files into the given properties.
     * @param properties the properties to set
     * @param filenames the property files
     * @throws IOException if a file could not be read
     */
    static void loadProperties(Properties properties, String... filenames) throws IOException {
        for (final String filename : filenames) {
            final Properties propertiesNew = new Properties();
            try (final InputStream filestream = new FileInputStream(filename)) {
                propertiesNew.load(filestream);
            }
            properties.putAll(propertiesNew);
        }
    }

    /**
     * Start a verticle that listens on HTTP for image requests and responds with rasters.
     * @param argv filename(s) from which to read configuration beyond current Java system properties
     * @param overrides properties that take precedence over those of the named files
     * @throws IOException if the configuration, the handler table or the tile store could not be loaded
     */
    public static void mainVerticle(String[] argv, Properties overrides) throws IOException {
        /* set system properties from named configuration files */
        final Properties propertiesSystem = System.getProperties();
        loadProperties(propertiesSystem, argv);
        propertiesSystem.putAll(overrides);
        /* determine microservice configuration from system properties */
        final Configuration configuration = new Configuration();
        final Engine engine = new Engine(configuration);
        /* the service endpoints must precede the image endpoint whose pattern would match them */
        final List<HttpHandler> handlers = ImmutableList.of(
                new RequestHandlerForService(configuration, engine.table, engine.repository),
                new RequestHandlerForCutout(configuration, engine.dispatcher, engine.repository, engine.encoder));
        final Vertx vertx = Vertx.vertx();
        final Verticle verticle = new CutoutVerticle(configuration, handlers, engine::close);
        vertx.deployVerticle(verticle, (AsyncResult<String> result) -> {
            if (result.failed()) {
                LOGGER.error("failed to deploy verticle", result.cause());
                engine.close();
                vertx.close();
            }
        });
    }

    /**
     * Reads configuration from Java system properties (may be loaded from configuration files named in arguments)
     * then starts a verticle that listens on HTTP for image requests.
     * @param argv filename(s) from which to read configuration beyond current Java system properties
     * @throws IOException if the configuration could not be loaded
     */
    public static void main(String[] argv) throws IOException {
        mainVerticle(argv, new Properties());
    }
}
