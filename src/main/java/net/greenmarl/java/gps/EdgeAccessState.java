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
package net.greenmarl.java.gps;

import com.google.common.base.Preconditions;
import javax.annotation.Nullable;

/**
 * The access history of one edge property within one inner loop, as far as it matters for
 * messaging: a message carries at most one version of each property per superstep.
 *
 * <pre>
 *                 write          send
 *   (none)        WRITE          SENT
 *   WRITE         WRITE          WRITE_SENT
 *   SENT          SENT_WRITE     SENT
 *   WRITE_SENT    SENT_WRITE     WRITE_SENT
 *   SENT_WRITE    SENT_WRITE     ERROR
 *   ERROR         ERROR          ERROR
 * </pre>
 */
public enum EdgeAccessState {
  WRITE,
  SENT,
  WRITE_SENT,
  SENT_WRITE,
  /** Two versions would be sent. Terminal. */
  ERROR;

  /** An access to an edge property. */
  public enum Access {
    /** The property's value is used, and so must be sent with the message. */
    SEND,
    /** The property is assigned. */
    WRITE,
  }

  /**
   * Returns the state after an access.
   *
   * @param current the state before the access, or null for the first access
   */
  public static EdgeAccessState next(@Nullable EdgeAccessState current, Access access) {
    Preconditions.checkNotNull(access);
    boolean send = access == Access.SEND;
    if (current == null) {
      return send ? SENT : WRITE;
    }
    switch (current) {
      case WRITE:
        return send ? WRITE_SENT : WRITE;
      case SENT:
      case WRITE_SENT:
        return send ? current : SENT_WRITE;
      case SENT_WRITE:
        return send ? ERROR : SENT_WRITE;
      case ERROR:
        return ERROR;
    }
    throw new AssertionError(current);
  }

  /** Returns the state of the given ordinal, as stored in an annotation. */
  public static EdgeAccessState fromOrdinal(int ordinal) {
    EdgeAccessState[] states = values();
    Preconditions.checkArgument(
        ordinal >= 0 && ordinal < states.length, "not an edge access state: %s", ordinal);
    return states[ordinal];
  }
}
