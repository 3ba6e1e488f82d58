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

import com.google.common.collect.ImmutableList;

/**
 * A tract with those of its patches that a region touches.
 */
public final class TractPatches {

    private final TractInfo tract;
    private final List<PatchInfo> patches;

    public TractPatches(TractInfo tract, List<PatchInfo> patches) {
        this.tract = tract;
        this.patches = ImmutableList.copyOf(patches);
    }

    public TractInfo getTract() {
        return tract;
    }

    public List<PatchInfo> getPatches() {
        return patches;
    }
}
