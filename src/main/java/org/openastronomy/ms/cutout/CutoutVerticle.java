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

import java.util.List;

import com.google.common.collect.ImmutableMap;

import io.vertx.core.AsyncResult;
import io.vertx.core.Context;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Verticle;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.http.HttpServer;
import io.vertx.core.http.HttpServerOptions;
import io.vertx.core.http.HttpServerResponse;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serve the registered HTTP endpoints. Requests that no endpoint matches, and failures that escape an endpoint,
 * receive the same JSON error body as the endpoints give.
 */
public class CutoutVerticle implements Verticle {

    private static final Logger LOGGER = LoggerFactory.getLogger(CutoutVerticle.class);

    private final Configuration configuration;
    private final List<HttpHandler> requestHandlers;
    private final Runnable onStop;

    private Vertx vertx;

    @SuppressWarnings("unused")
    private Context context;

    private HttpServer server;

    /**
     * Construct a new verticle.
     * @param configuration the configuration to be set for this verticle
     * @param requestHandlers the handlers that respond to HTTP requests, in order of precedence
     * @param onStop to run once the server has stopped, such as releasing worker threads, may be {@code null}
     */
    public CutoutVerticle(Configuration configuration, List<HttpHandler> requestHandlers, Runnable onStop) {
        this.configuration = configuration;
        this.requestHandlers = requestHandlers;
        this.onStop = onStop;
    }

    @Override
    public Vertx getVertx() {
        return vertx;
    }

    @Override
    public void init(Vertx vertx, Context context) {
        this.vertx = vertx;
        this.context = context;
    }

    /**
     * Respond with a JSON error body unless a response is already under way.
     * @param response the HTTP response
     * @param code the HTTP response code
     * @param exception the name of the kind of failure
     * @param message a message that describes the failure
     */
    private static void respondWithError(HttpServerResponse response, int code, String exception, String message) {
        if (response.ended() || response.headWritten()) {
            return;
        }
        final JsonObject responseJson = new JsonObject(ImmutableMap.of("exception", exception, "message", message));
        final Buffer responseBuffer = Buffer.buffer(responseJson.toString());
        response.setStatusCode(code);
        response.putHeader("Content-Type", "application/json; charset=utf-8");
        response.putHeader("Content-Length", Integer.toString(responseBuffer.length()));
        response.end(responseBuffer);
    }

    /**
     * Handle a request that failed outside the endpoints' own error handling.
     * @param context the routing context of the failed request
     */
    private static void handleFailure(RoutingContext context) {
        final Throwable failure = context.failure();
        final int code = context.statusCode() > 0 ? context.statusCode() : 500;
        if (failure == null) {
            respondWithError(context.response(), code, "HttpException", "request failed with status " + code);
        } else {
            LOGGER.warn("request for {} failed", context.request().path(), failure);
            respondWithError(context.response(), code, failure.getClass().getSimpleName(), "internal failure");
        }
    }

    /**
     * Handle a request that no endpoint matched.
     * @param context the routing context of the unmatched request
     */
    private static void handleUnmatched(RoutingContext context) {
        LOGGER.debug("no endpoint for {} {}", context.request().method(), context.request().path());
        respondWithError(context.response(), 404, "NotFound", "no endpoint at " + context.request().path());
    }

    /**
     * Report the outcome of an asynchronous action.
     * @param promise the promise to set
     * @param result the outcome
     * @param action a description of the action, for use in the log message
     */
    private static void complete(Promise<Void> promise, AsyncResult<?> result, String action) {
        if (result.succeeded()) {
            LOGGER.info("succeeded: {}", action);
            promise.complete();
        } else {
            LOGGER.error("failed: {}", action, result.cause());
            promise.fail(result.cause());
        }
    }

    /**
     * Starts the verticle and listens for HTTP requests.
     * @param promise for reporting the outcome
     */
    @Override
    public void start(Promise<Void> promise) {
        final Router router = Router.router(vertx);
        for (final HttpHandler requestHandler : requestHandlers) {
            requestHandler.handleFor(router);
        }
        router.route().last().handler(CutoutVerticle::handleUnmatched);
        router.route().failureHandler(CutoutVerticle::handleFailure);
        final int port = configuration.getServerPort();
        final HttpServerOptions options = new HttpServerOptions().setPort(port).setHandle100ContinueAutomatically(true);
        server = vertx.createHttpServer(options).requestHandler(router);
        server.listen(result -> complete(promise, result, "listen on TCP port " + port));
    }

    /**
     * Stops the HTTP server then releases the resources that the endpoints used.
     * @param promise for reporting the outcome
     */
    @Override
    public void stop(Promise<Void> promise) {
        server.close(result -> {
            if (onStop != null) {
                onStop.run();
            }
            complete(promise, result, "stop server");
        });
    }

    @Override
    public void start(Future<Void> startFuture) {
        throw new UnsupportedOperationException("obsolete in later Vert.x");
    }

    @Override
    public void stop(Future<Void> stopFuture) {
        throw new UnsupportedOperationException("obsolete in later Vert.x");
    }
}
