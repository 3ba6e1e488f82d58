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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

/**
 * Check the decoding of science identifiers into tile references.
 */
public class ScienceIdSchemeTest {

    /**
     * Check the decoding of a survey field identifier.
     */
    @Test
    public void testField() {
        final TileReference reference = ScienceIdScheme.FIELD.toTileReference(3325260184L);
        Assertions.assertEquals(TileReference.forField(3325, 6, 184, "r"), reference);
        Assertions.assertEquals("camcol=6,field=184,filter=r,run=3325", reference.toString());
        Assertions.assertEquals(TileReference.forField(0, 0, 0, "u"), ScienceIdScheme.FIELD.toTileReference(0));
    }

    /**
     * Check the decoding of a coadd patch identifier.
     */
    @Test
    public void testPatch() {
        final long tract = 8766;
        final long scienceId = ((tract * 8192 + 4) * 8192 + 5) * 8 + 3;
        final TileReference reference = ScienceIdScheme.PATCH.toTileReference(scienceId);
        Assertions.assertEquals(TileReference.forPatch(8766, 4, 5, "i"), reference);
        Assertions.assertEquals("4", reference.get("patch_x"));
        Assertions.assertEquals("5", reference.get("patch_y"));
    }

    /**
     * Check that identifiers without a valid filter are rejected.
     */
    @Test
    public void testInvalidFilter() {
        Assertions.assertThrows(RequestParseException.class, () -> ScienceIdScheme.FIELD.toTileReference(3325760184L));
        Assertions.assertThrows(RequestParseException.class, () -> ScienceIdScheme.PATCH.toTileReference(6));
    }

    /**
     * Check that negative identifiers are rejected.
     */
    @Test
    public void testNegative() {
        Assertions.assertThrows(RequestParseException.class, () -> ScienceIdScheme.FIELD.toTileReference(-1));
        Assertions.assertThrows(RequestParseException.class, () -> ScienceIdScheme.PATCH.toTileReference(-8));
    }
}
