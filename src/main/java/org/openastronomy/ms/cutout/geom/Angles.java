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

/**
 * Angle arithmetic on the sky.
 */
public final class Angles {

    public static final double ARCSEC_PER_DEGREE = 3600;

    private Angles() {
    }

    /**
     * Shift an angle by whole turns until it lies within half a turn of a target.
     * Used so that right ascension differences do not jump across the 0/360 seam.
     * @param target the angle to stay near, in degrees
     * @param angle the angle to shift, in degrees
     * @return an angle equivalent to {@code angle} in {@code [target - 180, target + 180]}
     */
    public static double keepWithin180(double target, double angle) {
        if (!Double.isFinite(angle) || !Double.isFinite(target)) {
            return angle;
        }
        while (angle > target + 180) {
            angle -= 360;
        }
        while (angle < target - 180) {
            angle += 360;
        }
        return angle;
    }

    /**
     * @param angle an angle in degrees
     * @return the equivalent angle in {@code [0, 360)}
     */
    public static double normalizeRa(double angle) {
        final double normalized = angle % 360;
        return normalized < 0 ? normalized + 360 : normalized;
    }

    public static double toArcsec(double degrees) {
        return degrees * ARCSEC_PER_DEGREE;
    }

    public static double toDegrees(double arcsec) {
        return arcsec / ARCSEC_PER_DEGREE;
    }

    /**
     * Approximate the angular separation of two nearby points in the tangent plane,
     * shrinking the right ascension difference by the cosine of the given declination.
     * @param from the first point
     * @param to the second point
     * @param declination the declination at which to take the cosine, in degrees
     * @return the separation in arcseconds
     */
    public static double planarSeparationArcsec(SkyPoint from, SkyPoint to, double declination) {
        final double toRa = keepWithin180(from.getRa(), to.getRa());
        final double raDistance = Math.cos(Math.toRadians(declination)) * toArcsec(from.getRa() - toRa);
        final double decDistance = toArcsec(from.getDec() - to.getDec());
        return Math.hypot(raDistance, decDistance);
    }
}
