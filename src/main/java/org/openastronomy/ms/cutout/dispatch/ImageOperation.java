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
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import com.google.common.collect.ImmutableSet;

import org.openastronomy.ms.cutout.error.RequestParseException;
import org.openastronomy.ms.cutout.geom.SkyPoint;
import org.openastronomy.ms.cutout.getimage.Cancellation;
import org.openastronomy.ms.cutout.getimage.ImageGetter;
import org.openastronomy.ms.cutout.raster.Raster;
import org.openastronomy.ms.cutout.region.RegionDescriptor;
import org.openastronomy.ms.cutout.region.ShapeKind;
import org.openastronomy.ms.cutout.region.SizeUnit;
import org.openastronomy.ms.cutout.store.TileReference;

import static org.openastronomy.ms.cutout.dispatch.ProtocolVersion.*;

/**
 * The operations to which requests may be dispatched, each named in the handler table by its lower-case name.
 */
public enum ImageOperation {
    FULL_NEAREST {
        @Override
        public Raster apply(ImageGetter getter, CanonicalParams params, Cancellation cancellation) throws IOException {
            return getter.fullNearest(getCenter(params), getSearchFilter(params));
        }
    },
    FULL_FROM_DATA_ID {
        @Override
        public Raster apply(ImageGetter getter, CanonicalParams params, Cancellation cancellation) throws IOException {
            return getter.fullFromDataId(getDataId(params));
        }
    },
    FULL_FROM_SCIENCE_ID {
        @Override
        public Raster apply(ImageGetter getter, CanonicalParams params, Cancellation cancellation) throws IOException {
            return getter.fullFromScienceId(params.getLong(PARAM_SCIENCE_ID));
        }
    },
    CUTOUT_FROM_NEAREST {
        @Override
        public Raster apply(ImageGetter getter, CanonicalParams params, Cancellation cancellation) throws IOException {
            return getter.cutoutFromNearest(getRegion(params), getSearchFilter(params));
        }
    },
    CUTOUT_FROM_DATA_ID {
        @Override
        public Raster apply(ImageGetter getter, CanonicalParams params, Cancellation cancellation) throws IOException {
            return getter.getCutout(getRegion(params), getDataId(params));
        }
    },
    CUTOUT_FROM_SCIENCE_ID {
        @Override
        public Raster apply(ImageGetter getter, CanonicalParams params, Cancellation cancellation) throws IOException {
            return getter.cutoutFromScienceId(getRegion(params), params.getLong(PARAM_SCIENCE_ID));
        }
    },
    CUTOUT_FROM_SKYMAP {
        @Override
        public Raster apply(ImageGetter getter, CanonicalParams params, Cancellation cancellation) throws IOException {
            return getter.cutoutFromSkyMap(params.getRequired(PARAM_SKYMAP_ID), getRegion(params), getSearchFilter(params),
                    cancellation);
        }
    },
    CUTOUT_FROM_POS {
        @Override
        public Raster apply(ImageGetter getter, CanonicalParams params, Cancellation cancellation) throws IOException {
            final TileReference dataId = hasDataId(params) ? getDataId(params) : null;
            return getter.cutoutFromPos(params.getRequired(PARAM_POS), getSearchFilter(params), dataId);
        }
    };

    private static final Set<String> DATA_ID_KEYS = ImmutableSet.of("run", "camcol", "field", "filter",
            "tract", PARAM_PATCH_X, PARAM_PATCH_Y, "instrument", "detector", "visit");

    /**
     * Perform this operation.
     * @param getter the image operations of the requested dataset
     * @param params the canonical request parameters
     * @param cancellation for abandoning the operation
     * @return the resulting raster
     * @throws IOException if an image could not be read
     */
    public abstract Raster apply(ImageGetter getter, CanonicalParams params, Cancellation cancellation) throws IOException;

    /**
     * @return the name by which the handler table refers to this operation
     */
    public String getHandlerName() {
        return name().toLowerCase();
    }

    /**
     * @param handlerName a name from the handler table
     * @return the operation so named, or {@code null} if there is none
     */
    public static ImageOperation forHandlerName(String handlerName) {
        for (final ImageOperation operation : values()) {
            if (operation.getHandlerName().equals(handlerName)) {
                return operation;
            }
        }
        return null;
    }

    private static SkyPoint getCenter(CanonicalParams params) {
        final String unit = params.getString(PARAM_CENTER_UNIT);
        if (unit != null && SizeUnit.parse(unit) != SizeUnit.DEGREE) {
            throw new RequestParseException("center must be given in degrees");
        }
        return new SkyPoint(params.getDouble(PARAM_CENTER_X), params.getDouble(PARAM_CENTER_Y));
    }

    private static RegionDescriptor getRegion(CanonicalParams params) {
        final double width = params.getDouble(PARAM_SIZE_X);
        final double height = params.getDouble(PARAM_SIZE_Y);
        if (width < 0 || height < 0) {
            throw new RequestParseException("size cannot be negative");
        }
        final SizeUnit unit = SizeUnit.parse(params.getRequired(PARAM_SIZE_UNIT));
        return RegionDescriptor.box(ShapeKind.POINT_SIZE, getCenter(params), width, height, unit);
    }

    private static String getSearchFilter(CanonicalParams params) {
        final String filter = params.getString(PARAM_NEAREST_FILTER);
        return filter == null ? params.getString(PARAM_FILTER) : filter;
    }

    private static boolean hasDataId(CanonicalParams params) {
        return params.contains("run") || params.contains("tract") || params.contains("visit");
    }

    private static TileReference getDataId(CanonicalParams params) {
        final Map<String, String> keys = new TreeMap<>();
        for (final Map.Entry<String, String> parameter : params.getParameters().entrySet()) {
            if (DATA_ID_KEYS.contains(parameter.getKey())) {
                keys.put(parameter.getKey(), parameter.getValue());
            }
        }
        if (keys.isEmpty()) {
            throw new RequestParseException("no image key given");
        }
        try {
            return TileReference.of(keys);
        } catch (IllegalArgumentException iae) {
            throw new RequestParseException(iae.getMessage(), iae);
        }
    }
}
