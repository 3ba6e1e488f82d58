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

import java.util.Map;

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableSortedMap;

/**
 * The composite key of a stored tile, such as its run, camera column, field and filter.
 * Rendered with its keys in sorted order, for example {@code camcol=1,field=20,filter=r,run=3}.
 */
public final class TileReference {

    private static final Joiner.MapJoiner JOINER = Joiner.on(',').withKeyValueSeparator("=");
    private static final Splitter.MapSplitter SPLITTER = Splitter.on(',').trimResults().withKeyValueSeparator('=');

    private final ImmutableSortedMap<String, String> keys;

    private TileReference(ImmutableSortedMap<String, String> keys) {
        if (keys.isEmpty()) {
            throw new IllegalArgumentException("tile reference requires at least one key");
        }
        for (final Map.Entry<String, String> key : keys.entrySet()) {
            if (key.getValue().isEmpty() || key.getValue().indexOf(',') >= 0 || key.getValue().indexOf('=') >= 0
                    || key.getValue().indexOf('/') >= 0 || key.getValue().indexOf('\\') >= 0) {
                throw new IllegalArgumentException("invalid value for tile reference key " + key.getKey() + ": " + key.getValue());
            }
        }
        this.keys = keys;
    }

    /**
     * @param keys the keys and values identifying a tile
     * @return a new tile reference
     */
    public static TileReference of(Map<String, ?> keys) {
        final ImmutableSortedMap.Builder<String, String> builder = ImmutableSortedMap.naturalOrder();
        for (final Map.Entry<String, ?> key : keys.entrySet()) {
            builder.put(key.getKey(), key.getValue().toString());
        }
        return new TileReference(builder.build());
    }

    /**
     * @param text a tile reference as rendered by {@link #toString()}
     * @return the tile reference
     */
    public static TileReference parse(String text) {
        return new TileReference(ImmutableSortedMap.copyOf(SPLITTER.split(text)));
    }

    /**
     * @param run the imaging run
     * @param camcol the camera column
     * @param field the field within the run
     * @param filter the filter band
     * @return a reference to a single exposure
     */
    public static TileReference forField(long run, int camcol, int field, String filter) {
        return new TileReference(ImmutableSortedMap.of("run", Long.toString(run), "camcol", Integer.toString(camcol),
                "field", Integer.toString(field), "filter", filter));
    }

    /**
     * @param tract the tract
     * @param patchX the column of the patch within the tract
     * @param patchY the row of the patch within the tract
     * @param filter the filter band
     * @return a reference to a coadded patch
     */
    public static TileReference forPatch(int tract, int patchX, int patchY, String filter) {
        return new TileReference(ImmutableSortedMap.of("tract", Integer.toString(tract), "patch_x", Integer.toString(patchX),
                "patch_y", Integer.toString(patchY), "filter", filter));
    }

    /**
     * @return the keys and values of this reference
     */
    public Map<String, String> getKeys() {
        return keys;
    }

    /**
     * @param key a key name
     * @return the value for that key, or {@code null} if this reference has no such key
     */
    public String get(String key) {
        return keys.get(key);
    }

    @Override
    public boolean equals(Object object) {
        return this == object || (object instanceof TileReference && keys.equals(((TileReference) object).keys));
    }

    @Override
    public int hashCode() {
        return keys.hashCode();
    }

    @Override
    public String toString() {
        return JOINER.join(keys);
    }
}
