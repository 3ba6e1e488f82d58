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

package org.openastronomy.ms.cutout.getimage;

import org.openastronomy.ms.cutout.geom.PixelBox;
import org.openastronomy.ms.cutout.geom.PixelPoint;
import org.openastronomy.ms.cutout.geom.SkyWcs;
import org.openastronomy.ms.cutout.raster.Raster;

/**
 * Resamples a raster onto another pixel frame by nearest-neighbour lookup through the sky.
 */
public class Warper {

    /**
     * Resample a raster onto a destination frame.
     * Destination pixels that map outside the source keep the no-data mark.
     * @param source the raster to resample, must have a transform
     * @param destinationWcs the transform of the destination frame
     * @param destinationBox the extent of the result in the destination frame
     * @param cancellation checked once per destination row
     * @return a new raster in the destination frame
     */
    public Raster warp(Raster source, SkyWcs destinationWcs, PixelBox destinationBox, Cancellation cancellation) {
        final Raster destination = new Raster(destinationBox, destinationWcs);
        final PixelBox sourceBounds = source.getBounds();
        if (sourceBounds.isEmpty()) {
            return destination;
        }
        final SkyWcs sourceWcs = source.getWcs();
        for (int y = destinationBox.getY(); y < destinationBox.getEndY(); y++) {
            cancellation.check();
            for (int x = destinationBox.getX(); x < destinationBox.getEndX(); x++) {
                final PixelPoint sourcePixel = sourceWcs.skyToPixel(destinationWcs.pixelToSky(new PixelPoint(x, y)));
                if (!sourcePixel.isFinite()) {
                    continue;
                }
                final int sourceX = sourcePixel.roundX();
                final int sourceY = sourcePixel.roundY();
                if (sourceBounds.contains(sourceX, sourceY)) {
                    destination.setPixel(x, y, source.getPixel(sourceX, sourceY), source.getMask(sourceX, sourceY));
                }
            }
        }
        return destination;
    }
}
