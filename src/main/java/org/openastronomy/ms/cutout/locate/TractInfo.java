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

package org.openastronomy.ms.cutout.locate;

import org.openastronomy.ms.cutout.geom.PixelBox;
import org.openastronomy.ms.cutout.geom.SkyWcs;

/**
 * A tract of a sky map: a region of sky sharing one pixel frame.
 */
public final class TractInfo {

    private final int id;
    private final SkyWcs wcs;
    private final PixelBox bounds;

    public TractInfo(int id, SkyWcs wcs, PixelBox bounds) {
        this.id = id;
        this.wcs = wcs;
        this.bounds = bounds;
    }

    public int getId() {
        return id;
    }

    public SkyWcs getWcs() {
        return wcs;
    }

    public PixelBox getBounds() {
        return bounds;
    }

    @Override
    public String toString() {
        return "tract " + id;
    }
}
