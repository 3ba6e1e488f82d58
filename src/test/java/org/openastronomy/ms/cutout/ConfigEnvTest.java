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

import java.util.Properties;

import com.google.common.collect.ImmutableMap;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

/**
 * Check that environment variables are mapped to configuration properties.
 */
public class ConfigEnvTest {

    /**
     * Check the mapping of variable names to property names.
     */
    @Test
    public void testToProperties() {
        final Properties properties = ConfigEnv.toProperties(ImmutableMap.of(
                "CONFIG_cutout_ms_net_port", "8081",
                "CONFIG_cutout_ms_tile-cache_size", "64",
                "CONFIG_cutout_ms_a_b", "short",
                "CONFIG_cutout_ms_store__root", "underscored",
                "PATH", "/usr/bin"));
        Assertions.assertEquals(4, properties.size());
        Assertions.assertEquals("8081", properties.getProperty("cutout.ms.net.port"));
        Assertions.assertEquals("64", properties.getProperty("cutout.ms.tile-cache.size"));
        Assertions.assertEquals("short", properties.getProperty("cutout.ms.a.b"));
        Assertions.assertEquals("underscored", properties.getProperty("cutout.ms.store_root"));
    }

    /**
     * Check that mapped variables configure the microservice.
     */
    @Test
    public void testConfigures() {
        final Properties properties = ConfigEnv.toProperties(ImmutableMap.of(
                "CONFIG_cutout_ms_net_port", "8082",
                "CONFIG_cutout_ms_mosaic_threads", "3"));
        final Configuration configuration = new Configuration(Configuration.fromProperties(properties));
        Assertions.assertEquals(8082, configuration.getServerPort());
        Assertions.assertEquals(3, configuration.getMosaicThreads());
    }
}
