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

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

/**
 * A gnomonic (tangent-plane) projection defined by a reference sky position, the reference pixel
 * and a CD matrix of degrees per pixel.
 */
public final class TanWcs implements SkyWcs {

    private final double crval1;
    private final double crval2;
    private final double crpix1;
    private final double crpix2;
    private final double cd11, cd12, cd21, cd22;
    private final double determinant;

    private final double sinDec0;
    private final double cosDec0;

    /**
     * Construct a new tangent-plane projection.
     * @param crval the sky position at the reference pixel
     * @param crpix the reference pixel
     * @param cd the CD matrix in degrees per pixel, row-major: {@code cd11, cd12, cd21, cd22}
     */
    public TanWcs(SkyPoint crval, PixelPoint crpix, double... cd) {
        if (cd.length != 4) {
            throw new IllegalArgumentException("CD matrix must have four elements");
        }
        this.crval1 = crval.getRa();
        this.crval2 = crval.getDec();
        this.crpix1 = crpix.getX();
        this.crpix2 = crpix.getY();
        this.cd11 = cd[0];
        this.cd12 = cd[1];
        this.cd21 = cd[2];
        this.cd22 = cd[3];
        this.determinant = cd11 * cd22 - cd12 * cd21;
        this.sinDec0 = Math.sin(Math.toRadians(crval2));
        this.cosDec0 = Math.cos(Math.toRadians(crval2));
    }

    /**
     * Construct a north-up, east-left projection with square pixels.
     * @param crval the sky position at the reference pixel
     * @param crpix the reference pixel
     * @param pixelScale the size of a pixel in arcseconds
     * @return a new projection
     */
    public static TanWcs northUp(SkyPoint crval, PixelPoint crpix, double pixelScale) {
        final double degrees = Angles.toDegrees(pixelScale);
        return new TanWcs(crval, crpix, -degrees, 0, 0, degrees);
    }

    /**
     * Read a projection from its JSON form, {@code {"crval": [ra, dec], "crpix": [x, y], "cd": [cd11, cd12, cd21, cd22]}}.
     * @param json a JSON object
     * @return a new projection
     */
    public static TanWcs fromJson(JsonObject json) {
        final JsonArray crval = json.getJsonArray("crval");
        final JsonArray crpix = json.getJsonArray("crpix");
        final JsonArray cd = json.getJsonArray("cd");
        if (crval == null || crpix == null || cd == null || crval.size() != 2 || crpix.size() != 2 || cd.size() != 4) {
            throw new IllegalArgumentException("projection requires crval[2], crpix[2] and cd[4]");
        }
        return new TanWcs(new SkyPoint(crval.getDouble(0), crval.getDouble(1)),
                new PixelPoint(crpix.getDouble(0), crpix.getDouble(1)),
                cd.getDouble(0), cd.getDouble(1), cd.getDouble(2), cd.getDouble(3));
    }

    /**
     * @return this projection in the JSON form read by {@link #fromJson(JsonObject)}
     */
    public JsonObject toJson() {
        return new JsonObject()
                .put("crval", new JsonArray().add(crval1).add(crval2))
                .put("crpix", new JsonArray().add(crpix1).add(crpix2))
                .put("cd", new JsonArray().add(cd11).add(cd12).add(cd21).add(cd22));
    }

    @Override
    public PixelPoint skyToPixel(SkyPoint sky) {
        final double dec = Math.toRadians(sky.getDec());
        final double deltaRa = Math.toRadians(sky.getRa() - crval1);
        final double sinDec = Math.sin(dec);
        final double cosDec = Math.cos(dec);
        final double cosDeltaRa = Math.cos(deltaRa);
        final double cosC = sinDec0 * sinDec + cosDec0 * cosDec * cosDeltaRa;
        if (cosC <= 0) {
            /* behind the tangent plane */
            return new PixelPoint(Double.NaN, Double.NaN);
        }
        final double xi = Math.toDegrees(cosDec * Math.sin(deltaRa) / cosC);
        final double eta = Math.toDegrees((cosDec0 * sinDec - sinDec0 * cosDec * cosDeltaRa) / cosC);
        final double dx = (cd22 * xi - cd12 * eta) / determinant;
        final double dy = (cd11 * eta - cd21 * xi) / determinant;
        return new PixelPoint(crpix1 + dx, crpix2 + dy);
    }

    @Override
    public SkyPoint pixelToSky(PixelPoint pixel) {
        final double dx = pixel.getX() - crpix1;
        final double dy = pixel.getY() - crpix2;
        final double xi = Math.toRadians(cd11 * dx + cd12 * dy);
        final double eta = Math.toRadians(cd21 * dx + cd22 * dy);
        final double denominator = cosDec0 - eta * sinDec0;
        final double ra = crval1 + Math.toDegrees(Math.atan2(xi, denominator));
        final double dec = Math.toDegrees(Math.atan2(sinDec0 + eta * cosDec0, Math.hypot(xi, denominator)));
        return new SkyPoint(Angles.normalizeRa(ra), dec);
    }

    @Override
    public OptionalDouble getPixelScale() {
        return OptionalDouble.of(Angles.toArcsec(Math.sqrt(Math.abs(determinant))));
    }

    @Override
    public String toString() {
        return "TAN crval=(" + crval1 + ", " + crval2 + ") crpix=(" + crpix1 + ", " + crpix2 + ")";
    }
}
