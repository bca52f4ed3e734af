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
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.Properties;

import javax.annotation.PostConstruct;

import org.dimdict.context.AutoInstatiate;
import org.dimdict.context.Profiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Profile;

/**
 * Provides the active configuration values.
 * 
 * <p>
 * Values are resolved in layers, each one overriding the one below:
 * <ol>
 * <li>{@value #DEFAULT_CONFIG_CLASSPATH_FILENAME} on the classpath, which must contain a value for each
 * {@link ConfigKey}.
 * <li>{@value #TEST_CONFIG_CLASSPATH_FILENAME} on the classpath, if available (i.e. when running tests).
 * <li>The file the system property {@value #CUSTOM_PROPERTIES_SYSTEM_PROPERTY} points to, if set.
 * </ol>
 *
 * @author Bastian Gloeckle
 */
@AutoInstatiate
@Profile(Profiles.CONFIG)
public class ConfigurationManager {
  private static final Logger logger = LoggerFactory.getLogger(ConfigurationManager.class);

  public static final String DEFAULT_CONFIG_CLASSPATH_FILENAME = "/dimdict.properties";

  public static final String TEST_CONFIG_CLASSPATH_FILENAME = "/dimdict-test.properties";

  public static final String CUSTOM_PROPERTIES_SYSTEM_PROPERTY = "dimdict.properties";

  private Properties activeProperties;

  @PostConstruct
  public void initialize() {
    InputStream defaults = getClass().getResourceAsStream(DEFAULT_CONFIG_CLASSPATH_FILENAME);
    if (defaults == null)
      throw new RuntimeException("Could not find default config " + DEFAULT_CONFIG_CLASSPATH_FILENAME);
    Properties layer = loadLayer(new InputStreamReader(defaults, StandardCharsets.UTF_8),
        DEFAULT_CONFIG_CLASSPATH_FILENAME, null);

    InputStream test = getClass().getResourceAsStream(TEST_CONFIG_CLASSPATH_FILENAME);
    if (test != null)
      layer = loadLayer(new InputStreamReader(test, StandardCharsets.UTF_8), TEST_CONFIG_CLASSPATH_FILENAME, layer);

    String customFileName = System.getProperty(CUSTOM_PROPERTIES_SYSTEM_PROPERTY);
    if (customFileName != null) {
      Reader custom;
      try {
        custom = Files.newBufferedReader(Paths.get(customFileName), StandardCharsets.UTF_8);
      } catch (IOException e) {
        throw new RuntimeException("Could not open custom properties " + customFileName, e);
      }
      layer = loadLayer(custom, customFileName, layer);
    } else
      logger.info("No custom properties. Set system property '{}' to the path of a properties file to provide some.",
          CUSTOM_PROPERTIES_SYSTEM_PROPERTY);

    activeProperties = layer;
  }

  /**
   * @return The value of the given config key (see {@link ConfigKey}) in the topmost layer that contains it,
   *         <code>null</code> if no layer contains it.
   */
  public String getValue(String configKey) {
    return activeProperties.getProperty(configKey);
  }

  /**
   * Reads one layer of properties and closes the reader.
   * 
   * @param lower
   *          The layer the new one falls back to, <code>null</code> for the bottom layer.
   */
  private Properties loadLayer(Reader reader, String source, Properties lower) {
    Properties res = new Properties(lower);
    try (Reader r = reader) {
      res.load(r);
    } catch (IOException e) {
      throw new RuntimeException("Could not load config from " + source, e);
    }
    if (lower != null)
      for (String key : res.stringPropertyNames())
        if (lower.getProperty(key) == null)
          logger.warn("Config key '{}' in {} is not known to dimdict.", key, source);
    logger.info("Loaded {} config values from {}", res.size(), source);
    return res;
  }
}
