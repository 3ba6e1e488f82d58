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

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.google.common.collect.ImmutableMap;

import io.vertx.core.buffer.Buffer;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.http.HttpServerRequest;
import io.vertx.core.http.HttpServerResponse;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;
import io.vertx.ext.web.handler.BodyHandler;

import org.openastronomy.ms.cutout.dispatch.CanonicalParams;
import org.openastronomy.ms.cutout.dispatch.Dispatcher;
import org.openastronomy.ms.cutout.dispatch.ProtocolVersion;
import org.openastronomy.ms.cutout.error.ImageNotFoundException;
import org.openastronomy.ms.cutout.error.RequestParseException;
import org.openastronomy.ms.cutout.error.TileIntegrityException;
import org.openastronomy.ms.cutout.getimage.Cancellation;
import org.openastronomy.ms.cutout.getimage.ImageGetter;
import org.openastronomy.ms.cutout.getimage.ImageRepository;
import org.openastronomy.ms.cutout.raster.Raster;
import org.openastronomy.ms.cutout.raster.RasterEncoder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Provide image cutouts and mosaics over HTTP. Requests give their parameters in the query or, for POST, in a JSON body.
 * The parameters select the operation, which runs on a worker thread.
 */
public class RequestHandlerForCutout implements HttpHandler {

    private static final Logger LOGGER = LoggerFactory.getLogger(RequestHandlerForCutout.class);

    private final Pattern pattern;
    private final Dispatcher dispatcher;
    private final ImageRepository repository;
    private final RasterEncoder encoder;

    /**
     * Create the HTTP request handler for cutouts.
     * @param configuration the configuration of this microservice
     * @param dispatcher the operations by request signature
     * @param repository the datasets that may be served
     * @param encoder the encoder for the resulting rasters
     */
    public RequestHandlerForCutout(Configuration configuration, Dispatcher dispatcher, ImageRepository repository,
            RasterEncoder encoder) {
        this.pattern = Pattern.compile(configuration.getNetPath());
        this.dispatcher = dispatcher;
        this.repository = repository;
        this.encoder = encoder;
    }

    @Override
    public void handleFor(Router router) {
        LOGGER.info("handling GET and POST requests for router");
        router.getWithRegex(pattern.pattern()).blockingHandler(this::handle);
        router.postWithRegex(pattern.pattern()).handler(BodyHandler.create()).blockingHandler(this::handle);
    }

    /**
     * Construct a HTTP failure response with a JSON body naming the failure.
     * @param response the HTTP response that is to bear the failure
     * @param code the HTTP response code
     * @param exception the name of the kind of failure
     * @param message a message that describes the failure
     */
    private static void fail(HttpServerResponse response, int code, String exception, String message) {
        LOGGER.debug("responding with code {} failure: {}", code, message);
        final JsonObject responseJson = new JsonObject(ImmutableMap.of("exception", exception, "message", String.valueOf(message)));
        final Buffer responseBuffer = Buffer.buffer(responseJson.toString());
        response.setStatusCode(code);
        response.putHeader("Content-Type", "application/json; charset=utf-8");
        response.putHeader("Content-Length", Integer.toString(responseBuffer.length()));
        response.end(responseBuffer);
    }

    /**
     * Gather the request parameters from the query and, for POST, the JSON body.
     * @param context the routing context
     * @return the request parameters
     * @throws RequestParseException if the body is not a JSON object
     */
    private static Map<String, String> getParameters(RoutingContext context) {
        final HttpServerRequest request = context.request();
        final Map<String, String> pathParams = context.pathParams();
        final Map<String, String> parameters = new HashMap<>();
        for (final Map.Entry<String, String> parameter : request.params()) {
            if (pathParams == null || !pathParams.containsKey(parameter.getKey())) {
                parameters.putIfAbsent(parameter.getKey(), parameter.getValue());
            }
        }
        if (request.method() == HttpMethod.POST) {
            final JsonObject body;
            try {
                body = context.getBodyAsJson();
            } catch (DecodeException | ClassCastException e) {
                throw new RequestParseException("request body must be a JSON object", e);
            }
            if (body != null) {
                for (final Map.Entry<String, Object> parameter : body) {
                    if (parameter.getValue() != null) {
                        parameters.put(parameter.getKey(), parameter.getValue().toString());
                    }
                }
            }
        }
        return parameters;
    }

    /**
     * Handle incoming requests for images.
     * @param context the routing context
     */
    private void handle(RoutingContext context) {
        final String requestPath = context.request().path();
        final HttpServerResponse response = context.response();
        final Matcher matcher = pattern.matcher(requestPath);
        if (!matcher.matches()) {
            fail(response, 500, "RoutingException", "regular expression failure in routing HTTP request");
            return;
        }
        final Cancellation cancellation = new Cancellation();
        response.closeHandler(closed -> cancellation.cancel());
        try {
            final Map<String, String> parameters = getParameters(context);
            parameters.putIfAbsent(ProtocolVersion.PARAM_DB, matcher.group(1));
            final Dispatcher.Resolution resolution = dispatcher.resolve(parameters);
            final CanonicalParams params = resolution.getParams();
            if (params.getDataset() == null) {
                throw new RequestParseException("must provide the ds parameter naming a dataset");
            }
            final ImageGetter imageGetter = repository.getImageGetter(params.getDataset());
            if (imageGetter == null) {
                throw new ImageNotFoundException("no dataset " + params.getDataset() + " in " + params.getDatabase());
            }
            final Raster raster = resolution.getOperation().apply(imageGetter, params, cancellation);
            final Buffer body = encoder.encode(raster);
            LOGGER.debug("constructed binary response of size {}", body.length());
            response.putHeader("Content-Type", encoder.getContentType());
            for (final Map.Entry<String, String> header : encoder.describe(raster).entrySet()) {
                response.putHeader(header.getKey(), header.getValue());
            }
            response.putHeader("Content-Length", Integer.toString(body.length()));
            response.end(body);
        } catch (RequestParseException rpe) {
            fail(response, 400, rpe.getClass().getSimpleName(), rpe.getMessage());
        } catch (ImageNotFoundException infe) {
            fail(response, 404, infe.getClass().getSimpleName(), infe.getMessage());
        } catch (TileIntegrityException tie) {
            LOGGER.warn("unusable tile serving path: {}", requestPath, tie);
            fail(response, 500, tie.getClass().getSimpleName(), tie.getMessage());
        } catch (IOException ioe) {
            LOGGER.warn("failed to read tile serving path: {}", requestPath, ioe);
            fail(response, 500, ioe.getClass().getSimpleName(), "failed to read image data");
        } catch (CancellationException ce) {
            LOGGER.debug("abandoned request for path: {}", requestPath);
        } catch (Throwable t) {
            LOGGER.warn("unexpected failure handling path: {}", requestPath, t);
            throw t;
        }
    }
}
