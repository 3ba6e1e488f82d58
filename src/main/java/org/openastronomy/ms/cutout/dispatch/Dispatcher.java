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

import java.util.Map;

import org.openastronomy.ms.cutout.error.HandlerNotFoundException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Routes a request's parameters to the operation registered for exactly their set of canonical names.
 * Stateless beyond the handler table, so safe for concurrent use.
 */
public class Dispatcher {

    private static final Logger LOGGER = LoggerFactory.getLogger(Dispatcher.class);

    /**
     * An operation with the parameters to apply it to.
     */
    public static class Resolution {

        private final ImageOperation operation;
        private final CanonicalParams params;

        Resolution(ImageOperation operation, CanonicalParams params) {
            this.operation = operation;
            this.params = params;
        }

        public ImageOperation getOperation() {
            return operation;
        }

        public CanonicalParams getParams() {
            return params;
        }
    }

    private final HandlerTable table;

    /**
     * @param table the operations by signature
     */
    public Dispatcher(HandlerTable table) {
        this.table = table;
    }

    /**
     * @return the operations by signature
     */
    public HandlerTable getTable() {
        return table;
    }

    /**
     * Find the operation for a request.
     * @param parameters the request parameters, including the {@code API} marker if any
     * @return the operation and canonical parameters
     * @throws HandlerNotFoundException if no operation matches the parameters
     * @throws org.openastronomy.ms.cutout.error.RequestParseException if a parameter is malformed
     */
    public Resolution resolve(Map<String, String> parameters) {
        final ProtocolVersion protocol = ProtocolVersion.forMarker(parameters.get(ProtocolVersion.PARAM_API));
        final CanonicalParams params = protocol.canonicalize(parameters);
        final ImageOperation operation = table.lookup(params.getSignature());
        if (operation == null) {
            LOGGER.debug("no handler for {}", params);
            throw new HandlerNotFoundException(params.getSignature());
        }
        LOGGER.debug("dispatching {} to {}", params, operation.getHandlerName());
        return new Resolution(operation, params);
    }
}
