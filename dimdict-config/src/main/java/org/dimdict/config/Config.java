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

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Fields of beans annotated with this annotation get the value of the given config key injected, see
 * {@link ConfigurationPostProcessor}.
 *
 * @author Bastian Gloeckle
 */
@Target({ ElementType.FIELD })
@Retention(RetentionPolicy.RUNTIME)
public @interface Config {
  /**
   * The config key, see {@link ConfigKey}.
   */
  public String value();
}
