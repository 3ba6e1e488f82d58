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

package org.openastronomy.ms.cutout.geom;

import java.util.OptionalDouble;

/**
 * A coordinate transform between the sky and a pixel frame.
 * Implementations are immutable so may be shared among threads.
 */
public interface SkyWcs {

    /**
     * @param sky a position on the sky
     * @return the corresponding pixel position, not finite if the point does not project
     */
    PixelPoint skyToPixel(SkyPoint sky);

    /**
     * @param pixel a position in the pixel frame
     * @return the corresponding position on the sky
     */
    SkyPoint pixelToSky(PixelPoint pixel);

    /**
     * @return the size of a pixel in arcseconds, if the transform knows it
     */
    OptionalDouble getPixelScale();
}
