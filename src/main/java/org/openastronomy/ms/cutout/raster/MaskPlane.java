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

package org.openastronomy.ms.cutout.raster;

/**
 * The bits of a raster's mask plane that the cutout service sets or reads.
 * Bit positions follow the usual survey pipeline layout so that stored mask planes can be used directly.
 */
public enum MaskPlane {
    /** the pixel value is not to be trusted */
    BAD(0),
    /** the pixel lies near the edge of the detector or patch */
    EDGE(4),
    /** the pixel has no data */
    NO_DATA(8);

    private final int bit;

    MaskPlane(int bit) {
        this.bit = bit;
    }

    /**
     * @return the single-bit mask for this plane
     */
    public int getBitMask() {
        return 1 << bit;
    }

    /**
     * @param planes some mask planes
     * @return the bits of the given planes combined
     */
    public static int bitMaskOf(MaskPlane... planes) {
        int mask = 0;
        for (final MaskPlane plane : planes) {
            mask |= plane.getBitMask();
        }
        return mask;
    }
}
