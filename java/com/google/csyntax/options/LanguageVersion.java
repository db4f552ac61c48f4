/*
 * Copyright 2016 Google Inc. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.google.csyntax.options;

import com.google.common.base.Ascii;

/** The C# language version, which decides how version-dependent constructs are parsed. */
public enum LanguageVersion {
  CSHARP_7_3("7.3"),
  CSHARP_8("8"),
  CSHARP_9("9"),
  CSHARP_10("10"),
  CSHARP_11("11"),
  CSHARP_12("12"),
  CSHARP_13("13");

  private final String version;

  LanguageVersion(String version) {
    this.version = version;
  }

  /** The most recent supported version. */
  public static LanguageVersion latest() {
    return CSHARP_13;
  }

  /** The version used when none is configured. */
  public static LanguageVersion createDefault() {
    return latest();
  }

  /**
   * Parses a version as given to {@code --langversion}: {@code 7.3}, {@code 8} ... {@code 13},
   * optionally with a {@code .0} suffix, or one of {@code latest}, {@code default}, {@code
   * preview}.
   */
  public static LanguageVersion fromString(String value) {
    String normalized = Ascii.toLowerCase(value.trim());
    switch (normalized) {
      case "latest", "default", "preview", "latestmajor" -> {
        return latest();
      }
      default -> {}
    }
    if (normalized.endsWith(".0")) {
      normalized = normalized.substring(0, normalized.length() - ".0".length());
    }
    for (LanguageVersion languageVersion : values()) {
      if (languageVersion.version.equals(normalized)) {
        return languageVersion;
      }
    }
    throw new IllegalArgumentException("invalid --langversion: " + value);
  }

  /** The version number, e.g. {@code 7.3} or {@code 12}. */
  public String version() {
    return version;
  }

  /** Positional and nominal {@code record} declarations. */
  public boolean supportsRecords() {
    return compareTo(CSHARP_9) >= 0;
  }

  /** {@code record struct} and {@code record class}. */
  public boolean supportsRecordStructs() {
    return compareTo(CSHARP_10) >= 0;
  }

  /** {@code namespace N;} */
  public boolean supportsFileScopedNamespaces() {
    return compareTo(CSHARP_10) >= 0;
  }

  /** {@code ref} as a modifier of a {@code record struct}. */
  public boolean supportsRefRecords() {
    return compareTo(CSHARP_11) >= 0;
  }

  /** Collection expressions, {@code [1, 2, ..rest]}. */
  public boolean supportsCollectionExpressions() {
    return compareTo(CSHARP_12) >= 0;
  }

  @Override
  public String toString() {
    return "C# " + version;
  }
}
