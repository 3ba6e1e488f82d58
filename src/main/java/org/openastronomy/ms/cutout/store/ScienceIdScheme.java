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

package org.openastronomy.ms.cutout.store;

import org.openastronomy.ms.cutout.error.RequestParseException;

/**
 * The ways in which a dataset packs a tile's key into a single number.
 */
public enum ScienceIdScheme {
    /** a single exposure: run, camera column, field and filter in decimal digits */
    FIELD {
        @Override
        public TileReference decode(long scienceId) {
            final int field = (int) (scienceId % 10000);
            final int camcol = (int) (scienceId / 10000 % 10);
            final int filterIndex = (int) (scienceId / 100000 % 10);
            final long run = scienceId / 1000000;
            return TileReference.forField(run, camcol, field, filterFor(scienceId, filterIndex));
        }
    },
    /** a coadded patch: tract, patch column, patch row and filter in bit fields */
    PATCH {
        @Override
        public TileReference decode(long scienceId) {
            final int filterIndex = (int) (scienceId % 8);
            final int patchY = (int) (scienceId / 8 % (1 << 13));
            final int patchX = (int) (scienceId / (1 << 16) % (1 << 13));
            final long tract = scienceId / (1 << 29);
            if (tract > Integer.MAX_VALUE) {
                throw new RequestParseException("science id " + scienceId + " has tract out of range");
            }
            return TileReference.forPatch((int) tract, patchX, patchY, filterFor(scienceId, filterIndex));
        }
    };

    private static final String FILTERS = "ugriz";

    private static String filterFor(long scienceId, int filterIndex) {
        if (filterIndex >= FILTERS.length()) {
            throw new RequestParseException("science id " + scienceId + " has no valid filter");
        }
        return FILTERS.substring(filterIndex, filterIndex + 1);
    }

    /**
     * @param scienceId a science id
     * @return the key of the tile that the id denotes
     * @throws RequestParseException if the id cannot be decoded
     */
    public abstract TileReference decode(long scienceId);

    /**
     * Decode a science id after checking that it is not negative.
     * @param scienceId a science id
     * @return the key of the tile that the id denotes
     * @throws RequestParseException if the id cannot be decoded
     */
    public TileReference toTileReference(long scienceId) {
        if (scienceId < 0) {
            throw new RequestParseException("science id cannot be negative: " + scienceId);
        }
        return decode(scienceId);
    }
}
