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
import java.util.SortedSet;

import com.google.common.collect.ImmutableSortedMap;

import org.openastronomy.ms.cutout.error.RequestParseException;

/**
 * Request parameters after their names have been canonicalized. Immutable.
 * The database and dataset names select where the request is served so are held apart from the parameters.
 */
public final class CanonicalParams {

    private final ProtocolVersion protocol;
    private final String database;
    private final String dataset;
    private final ImmutableSortedMap<String, String> parameters;

    /**
     * @param protocol the protocol variant of the request
     * @param database the database name, may be {@code null}
     * @param dataset the dataset name, may be {@code null}
     * @param parameters the canonical parameter names and values
     */
    public CanonicalParams(ProtocolVersion protocol, String database, String dataset, Map<String, String> parameters) {
        this.protocol = protocol;
        this.database = database;
        this.dataset = dataset;
        this.parameters = ImmutableSortedMap.copyOf(parameters);
    }

    public ProtocolVersion getProtocol() {
        return protocol;
    }

    public String getDatabase() {
        return database;
    }

    public String getDataset() {
        return dataset;
    }

    /**
     * @return the canonical parameter names and values
     */
    public Map<String, String> getParameters() {
        return parameters;
    }

    /**
     * @return the sorted parameter names, by which the request is dispatched
     */
    public SortedSet<String> getSignature() {
        return parameters.keySet();
    }

    public boolean contains(String name) {
        return parameters.containsKey(name);
    }

    /**
     * @param name a parameter name
     * @return the parameter's value, or {@code null} if it is absent
     */
    public String getString(String name) {
        return parameters.get(name);
    }

    /**
     * @param name a parameter name
     * @return the parameter's value
     * @throws RequestParseException if the parameter is absent
     */
    public String getRequired(String name) {
        final String value = parameters.get(name);
        if (value == null) {
            throw new RequestParseException("missing parameter " + name);
        }
        return value;
    }

    /**
     * @param name a parameter name
     * @return the parameter's value as a finite number
     * @throws RequestParseException if the parameter is absent or not a finite number
     */
    public double getDouble(String name) {
        final String value = getRequired(name);
        final double number;
        try {
            number = Double.parseDouble(value);
        } catch (NumberFormatException nfe) {
            throw new RequestParseException("parameter " + name + " must be a number, not " + value, nfe);
        }
        if (!Double.isFinite(number)) {
            throw new RequestParseException("parameter " + name + " must be finite, not " + value);
        }
        return number;
    }

    /**
     * @param name a parameter name
     * @return the parameter's value as an integer
     * @throws RequestParseException if the parameter is absent or not an integer
     */
    public long getLong(String name) {
        final String value = getRequired(name);
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException nfe) {
            throw new RequestParseException("parameter " + name + " must be an integer, not " + value, nfe);
        }
    }

    @Override
    public String toString() {
        return protocol + " " + database + "/" + dataset + " " + parameters;
    }
}
