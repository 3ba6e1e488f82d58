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

package org.openastronomy.ms.cutout.dispatch;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;
import java.util.SortedSet;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.io.ByteStreams;

import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import org.openastronomy.ms.cutout.error.DispatchAmbiguityException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps request signatures, the sorted sets of canonical parameter names, to the operations that serve them.
 * Read from JSON of the form {@code {"handlers": [{"handler": "full_nearest", "params": ["center.x", ...]}, ...]}}.
 */
public class HandlerTable {

    private static final Logger LOGGER = LoggerFactory.getLogger(HandlerTable.class);

    public static final String DEFAULT_RESOURCE = "handler-table.json";

    private final Map<SortedSet<String>, ImageOperation> operations;

    /**
     * Construct a handler table from an immutable copy of the given operations.
     * Collisions between signatures are detected when parsing, see {@link #fromJson(JsonObject)}.
     * @param operations the operation for each signature
     */
    public HandlerTable(Map<SortedSet<String>, ImageOperation> operations) {
        this.operations = ImmutableMap.copyOf(operations);
    }

    /**
     * Parse a handler table from JSON.
     * @param json the JSON form of the table
     * @return the handler table
     * @throws DispatchAmbiguityException if a handler is unknown or two handlers share a signature
     */
    public static HandlerTable fromJson(JsonObject json) {
        final JsonArray handlers = json.getJsonArray("handlers");
        if (handlers == null) {
            throw new DispatchAmbiguityException("handler table has no handlers");
        }
        final Map<SortedSet<String>, ImageOperation> operations = new HashMap<>();
        for (int index = 0; index < handlers.size(); index++) {
            final JsonObject handler = handlers.getJsonObject(index);
            final String handlerName = handler.getString("handler");
            final ImageOperation operation = ImageOperation.forHandlerName(handlerName);
            if (operation == null) {
                throw new DispatchAmbiguityException("unknown handler: " + handlerName);
            }
            final JsonArray params = handler.getJsonArray("params");
            if (params == null || params.isEmpty()) {
                throw new DispatchAmbiguityException("handler " + handlerName + " has no parameters");
            }
            final ImmutableSortedSet.Builder<String> signatureBuilder = ImmutableSortedSet.naturalOrder();
            for (int paramIndex = 0; paramIndex < params.size(); paramIndex++) {
                signatureBuilder.add(params.getString(paramIndex));
            }
            final SortedSet<String> signature = signatureBuilder.build();
            final ImageOperation previous = operations.put(signature, operation);
            if (previous != null) {
                throw new DispatchAmbiguityException("both " + previous.getHandlerName() + " and " + handlerName
                        + " claim parameters " + Joiner.on(", ").join(signature));
            }
        }
        LOGGER.info("loaded {} handler signatures", operations.size());
        return new HandlerTable(operations);
    }

    /**
     * Load a handler table from a file or, failing that, a class-path resource.
     * @param location a file path or resource name
     * @return the handler table
     * @throws IOException if the table could not be read
     */
    public static HandlerTable load(String location) throws IOException {
        final byte[] bytes;
        final Path path = Paths.get(location);
        if (Files.isRegularFile(path)) {
            bytes = Files.readAllBytes(path);
        } else {
            try (final InputStream resource = HandlerTable.class.getClassLoader().getResourceAsStream(location)) {
                if (resource == null) {
                    throw new IOException("cannot find handler table " + location);
                }
                bytes = ByteStreams.toByteArray(resource);
            }
        }
        try {
            return fromJson(new JsonObject(new String(bytes, StandardCharsets.UTF_8)));
        } catch (DecodeException de) {
            throw new IOException("cannot parse handler table " + location, de);
        }
    }

    /**
     * @param signature a sorted set of canonical parameter names
     * @return the operation for exactly that signature, or {@code null} if there is none
     */
    public ImageOperation lookup(SortedSet<String> signature) {
        return operations.get(signature);
    }

    /**
     * @return every signature with its operation
     */
    public Map<SortedSet<String>, ImageOperation> getOperations() {
        return operations;
    }
}
