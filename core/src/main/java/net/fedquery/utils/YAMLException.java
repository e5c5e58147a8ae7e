// This file is part of Fedquery.
// Copyright (C) 2026  The Fedquery Authors.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.fedquery.utils;

/**
 * Exception class used to wrap the myriad of typed exceptions thrown by
 * Jackson when parsing YAML.
 * @since 1.0
 */
public final class YAMLException extends RuntimeException {
  private static final long serialVersionUID = -2915830581206734447L;

  /**
   * @param cause The exception that caused this one to be thrown.
   */
  public YAMLException(final Throwable cause) {
    super(cause);
  }
}
