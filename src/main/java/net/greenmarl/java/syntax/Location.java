// Copyright 2026 The Green-Marl Authors. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.greenmarl.java.syntax;

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;

/** A Location denotes a position within a Green-Marl source file. */
@AutoValue
public abstract class Location implements Comparable<Location> {

  /** The location used for nodes that have no source position, such as synthesized ones. */
  public static final Location BUILTIN = fromFileLineColumn("<builtin>", 0, 0);

  public abstract String file();

  /** Returns the 1-based line number, or 0 if unknown. */
  public abstract int line();

  /** Returns the 1-based column number, or 0 if unknown. */
  public abstract int column();

  public static Location fromFileLineColumn(String file, int line, int column) {
    Preconditions.checkArgument(line >= 0 && column >= 0, "negative position %s:%s", line, column);
    return new AutoValue_Location(file, line, column);
  }

  public static Location fromFileLine(String file, int line) {
    return fromFileLineColumn(file, line, 0);
  }

  @Override
  public final int compareTo(Location that) {
    int cmp = file().compareTo(that.file());
    if (cmp != 0) {
      return cmp;
    }
    cmp = Integer.compare(line(), that.line());
    return cmp != 0 ? cmp : Integer.compare(column(), that.column());
  }

  /** Formats the location as "file:line:column", omitting the column if unknown. */
  @Override
  public final String toString() {
    StringBuilder buf = new StringBuilder().append(file());
    if (line() != 0) {
      buf.append(':').append(line());
      if (column() != 0) {
        buf.append(':').append(column());
      }
    }
    return buf.toString();
  }
}
