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

import java.util.Map;
import java.util.SortedSet;

import com.google.common.collect.ImmutableMap;

import io.vertx.core.buffer.Buffer;
import io.vertx.core.http.HttpServerResponse;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;

import org.openastronomy.ms.cutout.dispatch.HandlerTable;
import org.openastronomy.ms.cutout.dispatch.ImageOperation;
import org.openastronomy.ms.cutout.getimage.ImageRepository;

/**
 * Describe this microservice over HTTP: whether it is available and which requests it accepts.
 */
public class RequestHandlerForService implements HttpHandler {

    private final String pathBase;
    private final HandlerTable table;
    private final ImageRepository repository;

    /**
     * @param configuration the configuration of this microservice
     * @param table the operations by request signature
     * @param repository the datasets that may be served
     */
    public RequestHandlerForService(Configuration configuration, HandlerTable table, ImageRepository repository) {
        this.pathBase = configuration.getNetPathBase();
        this.table = table;
        this.repository = repository;
    }

    /**
     * Add availability and capabilities handlers. Must be added to the router before the cutout handler.
     * @param router the router for which this can handle requests
     */
    @Override
    public void handleFor(Router router) {
        router.get(pathBase + "availability").handler(this::returnAvailability);
        router.get(pathBase + "capabilities").handler(this::returnCapabilities);
    }

    private static void respondWithJson(HttpServerResponse response, JsonObject responseJson) {
        final Buffer responseBuffer = Buffer.buffer(responseJson.encodePrettily());
        response.putHeader("Content-Type", "application/json; charset=utf-8");
        response.putHeader("Content-Length", Integer.toString(responseBuffer.length()));
        response.end(responseBuffer);
    }

    private JsonArray getDatasets() {
        final JsonArray datasets = new JsonArray();
        for (final String dataset : repository.getDatasets()) {
            datasets.add(dataset);
        }
        return datasets;
    }

    /**
     * Report that the service is up, with the datasets it serves.
     * @param context the routing context
     */
    private void returnAvailability(RoutingContext context) {
        final JsonArray datasets = getDatasets();
        final JsonObject result = new JsonObject(ImmutableMap.of("available", !datasets.isEmpty(), "datasets", datasets));
        respondWithJson(context.response(), result);
    }

    /**
     * Report the parameter signatures that the image endpoint accepts.
     * @param context the routing context
     */
    private void returnCapabilities(RoutingContext context) {
        final JsonArray handlers = new JsonArray();
        for (final Map.Entry<SortedSet<String>, ImageOperation> entry : table.getOperations().entrySet()) {
            final JsonArray params = new JsonArray();
            for (final String param : entry.getKey()) {
                params.add(param);
            }
            handlers.add(new JsonObject().put("handler", entry.getValue().getHandlerName()).put("params", params));
        }
        final JsonObject result = new JsonObject(ImmutableMap.of("handlers", handlers, "datasets", getDatasets()));
        respondWithJson(context.response(), result);
    }
}
