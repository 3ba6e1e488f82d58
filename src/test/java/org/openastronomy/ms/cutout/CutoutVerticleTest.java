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

import java.util.Collections;
import java.util.concurrent.atomic.AtomicInteger;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import io.vertx.core.AsyncResult;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpServer;
import io.vertx.core.http.HttpServerOptions;
import io.vertx.ext.web.Router;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.Mockito;
import org.mockito.MockitoAnnotations;

/**
 * Check the start and stop of the HTTP server atop a mock Vert.x instance.
 */
public class CutoutVerticleTest {

    @Mock
    private Vertx vertx;

    @Mock
    private HttpServer server;

    @Mock
    private HttpHandler requestHandler;

    private final AtomicInteger stopCount = new AtomicInteger();

    private CutoutVerticle verticle;

    /**
     * Set up a verticle with one request handler.
     */
    @BeforeEach
    public void mockSetup() {
        MockitoAnnotations.openMocks(this);
        Mockito.when(vertx.createHttpServer(Mockito.any(HttpServerOptions.class))).thenReturn(server);
        Mockito.when(server.requestHandler(Mockito.any())).thenReturn(server);
        final Configuration configuration = new Configuration(ImmutableMap.of(Configuration.CONF_NET_PORT, "8181"));
        verticle = new CutoutVerticle(configuration, ImmutableList.of(requestHandler), stopCount::incrementAndGet);
        verticle.init(vertx, null);
    }

    /**
     * Start the verticle and capture the handler of the server's listening outcome.
     * @param promise the promise for the start's outcome
     * @return the handler of the listening outcome
     */
    private Handler<AsyncResult<HttpServer>> start(Promise<Void> promise) {
        verticle.start(promise);
        Mockito.verify(requestHandler).handleFor(Mockito.any(Router.class));
        final ArgumentCaptor<HttpServerOptions> optionsCaptor = ArgumentCaptor.forClass(HttpServerOptions.class);
        Mockito.verify(vertx).createHttpServer(optionsCaptor.capture());
        Assertions.assertEquals(8181, optionsCaptor.getValue().getPort());
        @SuppressWarnings("unchecked")
        final ArgumentCaptor<Handler<AsyncResult<HttpServer>>> listenCaptor = ArgumentCaptor.forClass(Handler.class);
        Mockito.verify(server).listen(listenCaptor.capture());
        return listenCaptor.getValue();
    }

    /**
     * Check that the verticle starts once the server listens and releases resources once the server stops.
     */
    @Test
    public void testStartStop() {
        final Promise<Void> started = Promise.promise();
        start(started).handle(Future.succeededFuture(server));
        Assertions.assertTrue(started.future().succeeded());
        Assertions.assertEquals(0, stopCount.get());
        final Promise<Void> stopped = Promise.promise();
        verticle.stop(stopped);
        @SuppressWarnings("unchecked")
        final ArgumentCaptor<Handler<AsyncResult<Void>>> closeCaptor = ArgumentCaptor.forClass(Handler.class);
        Mockito.verify(server).close(closeCaptor.capture());
        closeCaptor.getValue().handle(Future.succeededFuture());
        Assertions.assertTrue(stopped.future().succeeded());
        Assertions.assertEquals(1, stopCount.get());
    }

    /**
     * Check that a failure to listen fails the start.
     */
    @Test
    public void testListenFailure() {
        final Promise<Void> started = Promise.promise();
        start(started).handle(Future.failedFuture("port in use"));
        Assertions.assertTrue(started.future().failed());
        Assertions.assertEquals("port in use", started.future().cause().getMessage());
    }

    /**
     * Check that the verticle may be built without handlers or a stop action.
     */
    @Test
    public void testNoHandlers() {
        final CutoutVerticle bare = new CutoutVerticle(new Configuration(Collections.emptyMap()), Collections.emptyList(), null);
        bare.init(vertx, null);
        final Promise<Void> started = Promise.promise();
        bare.start(started);
        @SuppressWarnings("unchecked")
        final ArgumentCaptor<Handler<AsyncResult<HttpServer>>> listenCaptor = ArgumentCaptor.forClass(Handler.class);
        Mockito.verify(server).listen(listenCaptor.capture());
        listenCaptor.getValue().handle(Future.succeededFuture(server));
        final Promise<Void> stopped = Promise.promise();
        bare.stop(stopped);
        @SuppressWarnings("unchecked")
        final ArgumentCaptor<Handler<AsyncResult<Void>>> closeCaptor = ArgumentCaptor.forClass(Handler.class);
        Mockito.verify(server).close(closeCaptor.capture());
        closeCaptor.getValue().handle(Future.succeededFuture());
        Assertions.assertTrue(stopped.future().succeeded());
    }
}
