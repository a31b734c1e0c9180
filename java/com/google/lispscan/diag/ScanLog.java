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

package com.google.lispscan.diag;

import com.google.common.collect.ImmutableList;
import com.google.lispscan.diag.ScanError.ErrorKind;
import java.util.ArrayList;
import java.util.List;

/**
 * Collects the diagnostics reported while scanning.
 *
 * <p>Reporting never interrupts the scanner; callers decide afterwards whether the input was
 * acceptable, e.g. by calling {@link #maybeThrow}.
 */
public class ScanLog {

  private final List<ScanDiagnostic> errors = new ArrayList<>();

  public void error(Position position, ErrorKind kind, Object... args) {
    errors.add(ScanDiagnostic.format(position, kind, args));
  }

  /** The number of errors reported so far. */
  public int errorCount() {
    return errors.size();
  }

  public boolean anyErrors() {
    return !errors.isEmpty();
  }

  public ImmutableList<ScanDiagnostic> diagnostics() {
    return ImmutableList.copyOf(errors);
  }

  public void maybeThrow() {
    if (!errors.isEmpty()) {
      throw new ScanError(ImmutableList.copyOf(errors));
    }
  }
}
