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

import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Lets a caller abandon a long-running image operation, such as when a client disconnects.
 * The operation checks the token between units of work.
 */
public final class Cancellation {

    private final AtomicBoolean isCancelled = new AtomicBoolean(false);

    /**
     * Request that the operation stop.
     */
    public void cancel() {
        isCancelled.set(true);
    }

    /**
     * @return if the operation has been asked to stop
     */
    public boolean isCancelled() {
        return isCancelled.get();
    }

    /**
     * @throws CancellationException if the operation has been asked to stop
     */
    public void check() {
        if (isCancelled.get()) {
            throw new CancellationException("image operation cancelled");
        }
    }
}
