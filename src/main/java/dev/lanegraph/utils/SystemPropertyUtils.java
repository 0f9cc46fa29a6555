// Copyright (c) 2026, the Lanegraph project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package dev.lanegraph.utils;

import java.util.function.Function;

public class SystemPropertyUtils {

  public static boolean parseSystemPropertyOrDefault(String propertyName, boolean defaultValue) {
    return internalParseSystemPropertyOrDefault(propertyName, defaultValue, Boolean::parseBoolean);
  }

  public static int parseSystemPropertyOrDefault(String propertyName, int defaultValue) {
    return internalParseSystemPropertyOrDefault(propertyName, defaultValue, Integer::parseInt);
  }

  private static <T> T internalParseSystemPropertyOrDefault(
      String propertyName, T defaultValue, Function<String, T> parser) {
    String propertyValue = System.getProperty(propertyName);
    if (propertyValue == null || propertyValue.isEmpty()) {
      return defaultValue;
    }
    try {
      return parser.apply(propertyValue);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(
          "Invalid value '" + propertyValue + "' for system property " + propertyName, e);
    }
  }
}
