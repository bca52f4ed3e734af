/**
 * dimdict: Dimension Dictionary.
 *
 * Copyright (C) 2015 Bastian Gloeckle
 *
 * This file is part of dimdict.
 *
 * dimdict is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */
package org.dimdict.config;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import org.testng.Assert;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.Test;

/**
 * Tests the layering of {@link ConfigurationManager}.
 *
 * @author Bastian Gloeckle
 */
public class ConfigurationManagerTest {
  private Path customFile;

  @AfterMethod
  public void cleanUp() throws IOException {
    System.clearProperty(ConfigurationManager.CUSTOM_PROPERTIES_SYSTEM_PROPERTY);
    if (customFile != null)
      Files.deleteIfExists(customFile);
    customFile = null;
  }

  @Test
  public void customFileOverridesTestPropertiesTest() throws IOException {
    // GIVEN
    customFile = Files.createTempFile("dimdict-custom", ".properties");
    Files.write(customFile, Arrays.asList(ConfigKey.DICTIONARY_SHARDS + "=7", "someTypo=1"), StandardCharsets.UTF_8);
    System.setProperty(ConfigurationManager.CUSTOM_PROPERTIES_SYSTEM_PROPERTY, customFile.toString());
    ConfigurationManager manager = new ConfigurationManager();

    // WHEN
    manager.initialize();

    // THEN
    Assert.assertEquals(manager.getValue(ConfigKey.DICTIONARY_SHARDS), "7", "Expected value of custom file");
    Assert.assertEquals(manager.getValue(ConfigKey.DICTIONARY_SHARD_LOAD_QUEUE_BACKLOG), "16",
        "Expected value of test properties for keys the custom file does not contain");
    Assert.assertEquals(manager.getValue("someTypo"), "1", "Unknown keys should still be readable");
  }

  @Test
  public void defaultsFillKeysMissingInUpperLayersTest() {
    // GIVEN
    ConfigurationManager manager = new ConfigurationManager();

    // WHEN
    manager.initialize();

    // THEN
    for (String key : Arrays.asList(ConfigKey.DICTIONARY_SHARDS, ConfigKey.DICTIONARY_SHARD_LOAD_QUEUE_BACKLOG,
        ConfigKey.DICTIONARY_REQUIRE_NONEMPTY, ConfigKey.DICTIONARY_LIFETIME_MIN_SECONDS,
        ConfigKey.DICTIONARY_LIFETIME_MAX_SECONDS, ConfigKey.DICTIONARY_SPARSE))
      Assert.assertNotNull(manager.getValue(key), "Expected a value for " + key);
  }

  @Test(expectedExceptions = RuntimeException.class)
  public void missingCustomFileTest() {
    // GIVEN
    System.setProperty(ConfigurationManager.CUSTOM_PROPERTIES_SYSTEM_PROPERTY, "/does/not/exist.properties");

    // WHEN
    new ConfigurationManager().initialize();
  }
}
