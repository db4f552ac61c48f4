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

package com.google.csyntax.main;

/** Reports incorrect command-line usage. */
public class UsageException extends RuntimeException {

  private static final String USAGE =
      "usage: csyntax [--langversion <version>] [--define <symbols>] [--max_depth <n>]\n"
          + "               [--diagnostics|--nodiagnostics] [--help] <file.cs>...";

  public UsageException() {
    super(USAGE);
  }

  public UsageException(String message) {
    super(message + "\n" + USAGE);
  }
}
