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

import java.util.Objects;

/**
 * A position on the sky, right ascension and declination in degrees.
 */
public final class SkyPoint {

    private final double ra;
    private final double dec;

    /**
     * @param ra the right ascension in degrees
     * @param dec the declination in degrees
     */
    public SkyPoint(double ra, double dec) {
        this.ra = ra;
        this.dec = dec;
    }

    /**
     * @return the right ascension in degrees
     */
    public double getRa() {
        return ra;
    }

    /**
     * @return the declination in degrees
     */
    public double getDec() {
        return dec;
    }

    @Override
    public boolean equals(Object object) {
        if (this == object) {
            return true;
        }
        if (!(object instanceof SkyPoint)) {
            return false;
        }
        final SkyPoint other = (SkyPoint) object;
        return Double.compare(ra, other.ra) == 0 && Double.compare(dec, other.dec) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(ra, dec);
    }

    @Override
    public String toString() {
        return "(" + ra + ", " + dec + ")";
    }
}
