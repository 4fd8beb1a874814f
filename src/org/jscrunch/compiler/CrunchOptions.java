/*
 * Copyright 2026 The JsCrunch Authors.
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

package org.jscrunch.compiler;

import com.google.auto.value.AutoValue;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.Immutable;
import java.io.Serializable;
import java.util.EnumSet;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * The policy consulted by every rewrite.
 *
 * <p>Options are immutable. A pass reads them for its whole lifetime and never changes them, so a
 * single instance may be shared between passes and threads.
 */
@AutoValue
@Immutable
public abstract class CrunchOptions implements Serializable {

  /** The categories of rewrites that may be applied. */
  public abstract ImmutableSet<TreeModification> getAllowedModifications();

  /** Master switch for the literal evaluation pass. */
  public abstract boolean getEvalLiteralExpressions();

  /**
   * Whether output is minified. Together with {@link
   * TreeModification#BOOLEAN_LITERALS_TO_NOT_OPERATORS} it decides how boolean literals are
   * printed, which the logical-not cost model takes into account.
   */
  public abstract boolean getMinifyCode();

  /** Whether the rename table applies to property names. */
  public abstract boolean getManualRenamesProperties();

  /** Manual renames, original name to new name. */
  public abstract ImmutableMap<String, String> getRenamePairs();

  public boolean isModificationAllowed(TreeModification modification) {
    return getAllowedModifications().contains(modification);
  }

  public boolean hasRenamePairs() {
    return !getRenamePairs().isEmpty();
  }

  /** Returns the new name for {@code name}, or null if it is not renamed. */
  public @Nullable String getNewName(String name) {
    return Strings.emptyToNull(getRenamePairs().get(name));
  }

  public abstract Builder toBuilder();

  /** Every modification allowed, literal evaluation and minification on, no renames. */
  public static CrunchOptions defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new AutoValue_CrunchOptions.Builder()
        .setAllowedModifications(EnumSet.allOf(TreeModification.class))
        .setEvalLiteralExpressions(true)
        .setMinifyCode(true)
        .setManualRenamesProperties(true)
        .setRenamePairs(ImmutableMap.of());
  }

  /** Builder for {@link CrunchOptions}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setAllowedModifications(Iterable<TreeModification> modifications);

    public abstract Builder setEvalLiteralExpressions(boolean value);

    public abstract Builder setMinifyCode(boolean value);

    public abstract Builder setManualRenamesProperties(boolean value);

    public abstract Builder setRenamePairs(Map<String, String> renamePairs);

    abstract ImmutableSet<TreeModification> getAllowedModifications();

    @CanIgnoreReturnValue
    public Builder allow(TreeModification modification) {
      EnumSet<TreeModification> allowed = EnumSet.of(modification);
      allowed.addAll(getAllowedModifications());
      return setAllowedModifications(allowed);
    }

    /** Removes {@code modification} from the allowed set. */
    @CanIgnoreReturnValue
    public Builder disallow(TreeModification modification) {
      EnumSet<TreeModification> remaining = EnumSet.noneOf(TreeModification.class);
      for (TreeModification m : getAllowedModifications()) {
        if (m != modification) {
          remaining.add(m);
        }
      }
      return setAllowedModifications(remaining);
    }

    public abstract CrunchOptions build();
  }
}
