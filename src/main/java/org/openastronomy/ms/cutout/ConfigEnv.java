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

package org.openastronomy.ms.cutout;

import java.io.IOException;
import java.util.Map;
import java.util.Properties;

public class ConfigEnv {

    /**
     * Converts the given environment variables beginning with "CONFIG_" to configuration properties.
     * Since "." is not allowed in a variable name "." must be replaced by "_", and "_" by "__".
     * For example "CONFIG_cutout_ms_net_port=8081" will become "cutout.ms.net.port=8081"
     * and "CONFIG_cutout_ms_tile-cache_size=64" will become "cutout.ms.tile-cache.size=64".
     * @param environment environment variables
     * @return the corresponding properties
     */
    static Properties toProperties(Map<String, String> environment) {
        final Properties overrides = new Properties();
        for (final Map.Entry<String, String> e : environment.entrySet()) {
            if (e.getKey().startsWith("CONFIG_")) {
                String key = e.getKey().substring(7);
                key = key.replaceAll("(?<=[^_])_(?=[^_])", ".").replaceAll("__", "_");
                overrides.put(key, e.getValue());
            }
        }
        return overrides;
    }

    /**
     * Converts configuration environment variables to properties and runs the microservice.
     * @param argv filename(s) from which to read configuration beyond current Java system properties
     * @throws IOException if the configuration could not be loaded
     */
    public static void main(String[] argv) throws IOException {
        CutoutService.mainVerticle(argv, toProperties(System.getenv()));
    }
}
