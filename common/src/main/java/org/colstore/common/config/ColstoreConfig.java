/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.colstore.common.config;

import java.util.List;
import java.util.Properties;
import java.util.concurrent.TimeUnit;

import org.colstore.common.exceptions.UserException;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Stopwatch;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigRenderOptions;

/**
 * Configuration of a colstore process, backed by a Typesafe {@link Config}.
 */
public class ColstoreConfig {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(ColstoreConfig.class);

  private final Config config;

  @VisibleForTesting
  public ColstoreConfig(Config config) {
    this.config = config;
    logger.trace("Given Config object is:\n{}", config.root().render(ConfigRenderOptions.concise()));
  }

  /**
   * Creates a configuration from the default config file and the optional
   * override file found on the class path.
   *
   * @return The new ColstoreConfig object.
   */
  public static ColstoreConfig create() {
    return create(null, null);
  }

  /**
   * @param overrideFileResourcePathname
   *          the class path resource to use for configuration override purposes; {@code null} specifies to use
   *          the default pathname ({@link CommonConstants#CONFIG_OVERRIDE_RESOURCE_PATHNAME})
   * @return A merged configuration.
   */
  public static ColstoreConfig create(String overrideFileResourcePathname) {
    return create(overrideFileResourcePathname, null);
  }

  /**
   * <b><u>Do not use this method outside of test code.</u></b>
   */
  @VisibleForTesting
  public static ColstoreConfig create(Properties testConfigurations) {
    return create(null, testConfigurations);
  }

  /**
   * Loads configuration in the following order of precedence (highest first):
   * <ul>
   * <li>the given properties, if any</li>
   * <li>the override file, {@code colstore-override.conf} unless another resource is named</li>
   * <li>{@code colstore-default.conf}</li>
   * </ul>
   */
  private static ColstoreConfig create(String overrideFileResourcePathname, Properties overriderProps) {
    final Stopwatch watch = Stopwatch.createStarted();
    final String overridePath = overrideFileResourcePathname == null
        ? CommonConstants.CONFIG_OVERRIDE_RESOURCE_PATHNAME
        : overrideFileResourcePathname;

    Config effective = ConfigFactory.parseResources(CommonConstants.CONFIG_DEFAULT_RESOURCE_PATHNAME);
    effective = ConfigFactory.parseResources(overridePath).withFallback(effective);
    if (overriderProps != null) {
      effective = ConfigFactory.parseProperties(overriderProps).withFallback(effective);
    }
    ColstoreConfig colstoreConfig = new ColstoreConfig(effective.resolve());
    logger.debug("Configuration loaded from {} and {} in {} ms.", CommonConstants.CONFIG_DEFAULT_RESOURCE_PATHNAME,
        overridePath, watch.elapsed(TimeUnit.MILLISECONDS));
    return colstoreConfig;
  }

  public boolean hasPath(String path) {
    return config.hasPath(path);
  }

  public String getString(String path) {
    return get(path, config::getString);
  }

  public int getInt(String path) {
    return get(path, config::getInt);
  }

  public long getLong(String path) {
    return get(path, config::getLong);
  }

  public boolean getBoolean(String path) {
    return get(path, config::getBoolean);
  }

  public List<String> getStringList(String path) {
    return get(path, config::getStringList);
  }

  public Config getConfig() {
    return config;
  }

  private <T> T get(String path, java.util.function.Function<String, T> getter) {
    try {
      return getter.apply(path);
    } catch (ConfigException e) {
      throw UserException.validationError(e)
          .message("Invalid or missing configuration value at path %s.", path)
          .addContext("Reason", e.getMessage())
          .build(logger);
    }
  }

  @Override
  public String toString() {
    return config.root().render();
  }
}
