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
package net.greenmarl.java.annotation;

import com.google.common.base.Preconditions;

/**
 * The key of an opaque, typed annotation. A key is bound to exactly one value type, so a reader
 * cannot reinterpret a value written under it.
 *
 * <p>Keys compare by identity; declare them as constants next to the pass that writes them.
 */
public final class ValueKey<T> {

  private final String name;
  private final Class<T> type;

  private ValueKey(String name, Class<T> type) {
    this.name = Preconditions.checkNotNull(name);
    this.type = Preconditions.checkNotNull(type);
  }

  /** Returns a new key, distinct from every other, for values of the given type. */
  public static <T> ValueKey<T> of(String name, Class<T> type) {
    return new ValueKey<>(name, type);
  }

  /** Returns the type of the values stored under this key. */
  public Class<T> getType() {
    return type;
  }

  @Override
  public String toString() {
    return name;
  }
}
