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
package net.greenmarl.java.check;

import com.google.auto.value.AutoValue;

/** PipelineOptions controls how a {@link PassPipeline} runs its passes. */
@AutoValue
public abstract class PipelineOptions {

  public static final PipelineOptions DEFAULT = builder().build();

  /**
   * Run the remaining passes after one has failed, to collect their diagnostics too. Later passes
   * must then tolerate the missing or partial annotations of the failed one.
   */
  public abstract boolean keepGoing();

  public static Builder builder() {
    // These are the DEFAULT values.
    return new AutoValue_PipelineOptions.Builder().keepGoing(false);
  }

  public abstract Builder toBuilder();

  /** Builder for {@link PipelineOptions}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder keepGoing(boolean value);

    public abstract PipelineOptions build();
  }
}
