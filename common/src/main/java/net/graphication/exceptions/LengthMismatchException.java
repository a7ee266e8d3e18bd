// This file is part of Graphication.
// Copyright (C) 2026  The Graphication Authors.
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
package net.graphication.exceptions;

/**
 * A value sequence did not have one entry per key.
 */
public final class LengthMismatchException extends IllegalArgumentException {

  /**
   * Constructor.
   *
   * @param msg Message describing the problem.
   */
  public LengthMismatchException(final String msg) {
    super(msg);
  }

  private static final long serialVersionUID = 1761131423L;

}
