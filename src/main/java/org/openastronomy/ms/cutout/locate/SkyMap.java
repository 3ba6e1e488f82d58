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

import java.util.List;

import org.openastronomy.ms.cutout.geom.SkyPoint;

/**
 * A tessellation of the sky into tracts, each divided into a grid of patches.
 */
public interface SkyMap {

    /**
     * @param point a position on the sky
     * @return the tract that contains the point and whose center is nearest to it
     * @throws org.openastronomy.ms.cutout.error.ImageNotFoundException if no tract contains the point
     */
    TractInfo findTract(SkyPoint point);

    /**
     * @param corners the corners of a region on the sky, in order around its outline
     * @return the tracts overlapping the region, each with the patches that overlap it, in a stable order
     */
    List<TractPatches> findTractPatchList(List<SkyPoint> corners);
}
