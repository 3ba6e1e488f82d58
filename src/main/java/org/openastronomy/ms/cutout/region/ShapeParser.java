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

package org.openastronomy.ms.cutout.region;

import java.util.ArrayList;
import java.util.List;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;

import org.openastronomy.ms.cutout.error.RequestParseException;
import org.openastronomy.ms.cutout.error.ShapeParseException;
import org.openastronomy.ms.cutout.geom.Angles;
import org.openastronomy.ms.cutout.geom.SkyPoint;

/**
 * Parses region descriptors of the forms
 * <ul>
 * <li>{@code CIRCLE ra dec radius}</li>
 * <li>{@code RANGE ra1 ra2 dec1 dec2}</li>
 * <li>{@code POLYGON ra1 dec1 ra2 dec2 ra3 dec3 ...}</li>
 * <li>{@code BRECT ra dec width height [unit]}</li>
 * </ul>
 * with angles in degrees. Tokens may be separated by white space or commas.
 */
public final class ShapeParser {

    private static final Splitter TOKENIZER =
            Splitter.on(CharMatcher.whitespace().or(CharMatcher.is(','))).omitEmptyStrings().trimResults();

    private ShapeParser() {
    }

    /**
     * Parse a region descriptor.
     * @param descriptor the text of the descriptor
     * @return the region described
     * @throws ShapeParseException if the descriptor is malformed
     */
    public static RegionDescriptor parse(String descriptor) {
        if (descriptor == null) {
            throw new ShapeParseException("no region given");
        }
        final List<String> tokens = TOKENIZER.splitToList(descriptor);
        if (tokens.isEmpty()) {
            throw new ShapeParseException("empty region");
        }
        final ShapeKind kind;
        try {
            kind = ShapeKind.valueOf(tokens.get(0).toUpperCase());
        } catch (IllegalArgumentException iae) {
            throw new ShapeParseException("unknown shape: " + tokens.get(0), iae);
        }
        final List<String> arguments = tokens.subList(1, tokens.size());
        switch (kind) {
        case CIRCLE:
            return parseCircle(arguments);
        case RANGE:
            return parseRange(arguments);
        case POLYGON:
            return parsePolygon(arguments);
        case BRECT:
            return parseBoxRectangle(arguments);
        default:
            throw new ShapeParseException("shape cannot be given as a descriptor: " + kind);
        }
    }

    private static double parseNumber(String token) {
        final double number;
        try {
            number = Double.parseDouble(token);
        } catch (NumberFormatException nfe) {
            throw new ShapeParseException("not a number: " + token, nfe);
        }
        if (!Double.isFinite(number)) {
            throw new ShapeParseException("not a finite number: " + token);
        }
        return number;
    }

    private static void requireArguments(ShapeKind kind, List<String> arguments, int minimum, int maximum) {
        if (arguments.size() < minimum || arguments.size() > maximum) {
            final String expected = minimum == maximum ? Integer.toString(minimum) : minimum + " to " + maximum;
            throw new ShapeParseException(kind + " requires " + expected + " values, not " + arguments.size());
        }
    }

    private static RegionDescriptor parseCircle(List<String> arguments) {
        requireArguments(ShapeKind.CIRCLE, arguments, 3, 3);
        final double ra = parseNumber(arguments.get(0));
        final double dec = parseNumber(arguments.get(1));
        final double radius = parseNumber(arguments.get(2));
        if (radius <= 0) {
            throw new ShapeParseException("circle radius must be positive");
        }
        return RegionDescriptor.circle(new SkyPoint(ra, dec), radius);
    }

    private static RegionDescriptor parseRange(List<String> arguments) {
        requireArguments(ShapeKind.RANGE, arguments, 4, 4);
        final double ra1 = parseNumber(arguments.get(0));
        final double ra2 = Angles.keepWithin180(ra1, parseNumber(arguments.get(1)));
        final double dec1 = parseNumber(arguments.get(2));
        final double dec2 = parseNumber(arguments.get(3));
        final SkyPoint center = new SkyPoint(Angles.normalizeRa((ra1 + ra2) / 2), (dec1 + dec2) / 2);
        final double width = Angles.toArcsec(Math.abs(ra2 - ra1)) * Math.cos(Math.toRadians(center.getDec()));
        final double height = Angles.toArcsec(Math.abs(dec2 - dec1));
        return RegionDescriptor.box(ShapeKind.RANGE, center, width, height, SizeUnit.ARCSECOND);
    }

    private static RegionDescriptor parsePolygon(List<String> arguments) {
        if (arguments.size() < 6 || arguments.size() % 2 != 0) {
            throw new ShapeParseException("POLYGON requires at least three pairs of coordinates, not " + arguments.size() + " values");
        }
        final List<SkyPoint> vertices = new ArrayList<>();
        final int count = arguments.size() / 2;
        final double[] ras = new double[count];
        final double[] decs = new double[count];
        for (int index = 0; index < count; index++) {
            final double ra = parseNumber(arguments.get(2 * index));
            final double dec = parseNumber(arguments.get(2 * index + 1));
            vertices.add(new SkyPoint(ra, dec));
            /* unwrap right ascension around the first vertex */
            ras[index] = index == 0 ? ra : Angles.keepWithin180(ras[0], ra);
            decs[index] = dec;
        }
        double minRa = ras[0], maxRa = ras[0], minDec = decs[0], maxDec = decs[0];
        double sumRa = 0, sumDec = 0;
        double doubleArea = 0, weightedRa = 0, weightedDec = 0;
        for (int current = 0; current < count; current++) {
            final int next = (current + 1) % count;
            minRa = Math.min(minRa, ras[current]);
            maxRa = Math.max(maxRa, ras[current]);
            minDec = Math.min(minDec, decs[current]);
            maxDec = Math.max(maxDec, decs[current]);
            sumRa += ras[current];
            sumDec += decs[current];
            final double cross = ras[current] * decs[next] - ras[next] * decs[current];
            doubleArea += cross;
            weightedRa += (ras[current] + ras[next]) * cross;
            weightedDec += (decs[current] + decs[next]) * cross;
        }
        final double centerRa, centerDec;
        if (Math.abs(doubleArea) > 1e-12) {
            centerRa = weightedRa / (3 * doubleArea);
            centerDec = weightedDec / (3 * doubleArea);
        } else {
            /* degenerate outline */
            centerRa = sumRa / count;
            centerDec = sumDec / count;
        }
        final SkyPoint center = new SkyPoint(Angles.normalizeRa(centerRa), centerDec);
        final double width = (maxRa - minRa) * Math.cos(Math.toRadians(centerDec));
        final double height = maxDec - minDec;
        return RegionDescriptor.polygon(vertices, center, width, height);
    }

    private static RegionDescriptor parseBoxRectangle(List<String> arguments) {
        requireArguments(ShapeKind.BRECT, arguments, 4, 5);
        final double ra = parseNumber(arguments.get(0));
        final double dec = parseNumber(arguments.get(1));
        final double width = parseNumber(arguments.get(2));
        final double height = parseNumber(arguments.get(3));
        if (width < 0 || height < 0) {
            throw new ShapeParseException("box size cannot be negative");
        }
        SizeUnit unit = SizeUnit.DEGREE;
        if (arguments.size() > 4) {
            try {
                unit = SizeUnit.parse(arguments.get(4));
            } catch (RequestParseException rpe) {
                throw new ShapeParseException(rpe.getMessage(), rpe);
            }
        }
        return RegionDescriptor.box(ShapeKind.BRECT, new SkyPoint(ra, dec), width, height, unit);
    }
}
