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

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.google.common.base.Splitter;

import org.openastronomy.ms.cutout.error.RequestParseException;

/**
 * The variants of the image request protocol, each with its own parameter naming.
 * Both canonicalize into the same parameter names so that one handler table serves them.
 */
public enum ProtocolVersion {
    /** named parameters for position, size and image keys */
    DAX {
        @Override
        void renameParameters(Map<String, String> parameters) {
            final String ra = parameters.remove("ra");
            final String dec = parameters.remove("dec");
            if (ra != null) {
                parameters.put(PARAM_CENTER_X, ra);
            }
            if (dec != null) {
                parameters.put(PARAM_CENTER_Y, dec);
            }
            if (ra != null || dec != null) {
                parameters.put(PARAM_CENTER_UNIT, "deg");
                if (!parameters.containsKey("run") && !parameters.containsKey("tract")) {
                    /* without an image key the filter guides the search for the nearest image */
                    final String filter = parameters.remove(PARAM_FILTER);
                    if (filter != null) {
                        parameters.put(PARAM_NEAREST_FILTER, filter);
                    }
                }
            }
            rename(parameters, "sid", PARAM_SCIENCE_ID);
            rename(parameters, "width", PARAM_SIZE_X);
            rename(parameters, "height", PARAM_SIZE_Y);
            rename(parameters, "unit", PARAM_SIZE_UNIT);
            final String patch = parameters.remove("patch");
            if (patch != null) {
                final List<String> patchXY = PATCH_SPLITTER.splitToList(patch);
                if (patchXY.size() != 2) {
                    throw new RequestParseException("patch must be given as x,y, not " + patch);
                }
                try {
                    parameters.put(PARAM_PATCH_X, Integer.toString(Integer.parseInt(patchXY.get(0))));
                    parameters.put(PARAM_PATCH_Y, Integer.toString(Integer.parseInt(patchXY.get(1))));
                } catch (NumberFormatException nfe) {
                    throw new RequestParseException("patch coordinates must be integers, not " + patch, nfe);
                }
            }
            rename(parameters, "POS", PARAM_POS);
        }
    },
    /** a region descriptor and a dotted identifier of database, dataset and filter */
    SODA {
        @Override
        void renameParameters(Map<String, String> parameters) {
            final String id = parameters.remove("ID");
            if (id != null) {
                final List<String> parts = Splitter.on('.').trimResults().splitToList(id);
                if (parts.size() != 3 || parts.contains("")) {
                    throw new RequestParseException("ID must be given as database.dataset.filter, not " + id);
                }
                parameters.put(PARAM_DB, parts.get(0));
                parameters.put(PARAM_DS, parts.get(1));
                parameters.put(PARAM_FILTER, parts.get(2));
            }
            rename(parameters, "POS", PARAM_POS);
        }
    };

    public static final String PARAM_API = "API";
    public static final String PARAM_DB = "db";
    public static final String PARAM_DS = "ds";
    public static final String PARAM_CENTER_X = "center.x";
    public static final String PARAM_CENTER_Y = "center.y";
    public static final String PARAM_CENTER_UNIT = "center.unit";
    public static final String PARAM_SIZE_X = "size.x";
    public static final String PARAM_SIZE_Y = "size.y";
    public static final String PARAM_SIZE_UNIT = "size.unit";
    public static final String PARAM_FILTER = "filter";
    public static final String PARAM_NEAREST_FILTER = "nearest.filter";
    public static final String PARAM_SCIENCE_ID = "science_id";
    public static final String PARAM_PATCH_X = "patch_x";
    public static final String PARAM_PATCH_Y = "patch_y";
    public static final String PARAM_POS = "pos";
    public static final String PARAM_SKYMAP_ID = "skymap_id";

    private static final Splitter PATCH_SPLITTER = Splitter.on(',').trimResults();

    private static void rename(Map<String, String> parameters, String from, String to) {
        final String value = parameters.remove(from);
        if (value != null) {
            parameters.put(to, value);
        }
    }

    /**
     * @param marker the value of the {@code API} parameter, may be {@code null}
     * @return the protocol variant that the marker selects
     */
    public static ProtocolVersion forMarker(String marker) {
        return marker != null && SODA.name().equalsIgnoreCase(marker.trim()) ? SODA : DAX;
    }

    /**
     * Rename the protocol's parameters to canonical names, in place.
     * @param parameters the parameters, without the {@code API} marker
     */
    abstract void renameParameters(Map<String, String> parameters);

    /**
     * Canonicalize request parameters. Parameters with empty values are treated as absent.
     * @param raw the request parameters
     * @return the canonical parameters
     * @throws RequestParseException if a parameter is malformed
     */
    public CanonicalParams canonicalize(Map<String, String> raw) {
        final Map<String, String> parameters = new HashMap<>();
        for (final Map.Entry<String, String> parameter : raw.entrySet()) {
            final String value = parameter.getValue();
            if (value != null && !value.trim().isEmpty()) {
                parameters.put(parameter.getKey(), value.trim());
            }
        }
        parameters.remove(PARAM_API);
        renameParameters(parameters);
        final String database = parameters.remove(PARAM_DB);
        final String dataset = parameters.remove(PARAM_DS);
        return new CanonicalParams(this, database, dataset, parameters);
    }
}
