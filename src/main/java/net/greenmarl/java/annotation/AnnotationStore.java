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

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.HashBasedTable;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.Table;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import javax.annotation.Nullable;
import net.greenmarl.java.syntax.Annotatable;
import net.greenmarl.java.syntax.Statement;
import net.greenmarl.java.syntax.Symbol;

/**
 * An AnnotationStore attaches analysis results to AST nodes and symbols without changing either.
 *
 * <p>There is one table per key family, so each key has exactly one payload shape: a {@link Flag}
 * holds a boolean, a {@link SymbolMap} a mapping from symbol to int, a {@link StatementList} an
 * ordered list of statements, and a {@link ValueKey} a value of its declared type. Entries are
 * created on first write and never deleted; a store lives for one analysis run and is discarded
 * with the tree.
 *
 * <p>Owners are keyed by identity (neither nodes nor symbols override {@code equals}). A store is
 * not thread-safe; passes use it one at a time.
 */
public final class AnnotationStore {

  private final Table<Annotatable, Flag, Boolean> flags = HashBasedTable.create();
  private final Table<Annotatable, SymbolMap, Map<Symbol, Integer>> maps = HashBasedTable.create();
  private final Map<StatementList, ListMultimap<Annotatable, Statement>> lists = new HashMap<>();
  private final Table<Annotatable, ValueKey<?>, Object> values = HashBasedTable.create();

  public void setFlag(Annotatable owner, Flag key, boolean value) {
    flags.put(owner, key, value);
  }

  /** Returns the flag, or empty if it was never set on this owner. */
  public Optional<Boolean> getFlag(Annotatable owner, Flag key) {
    return Optional.ofNullable(flags.get(owner, key));
  }

  /** Reports whether the flag is set and true. */
  public boolean isSet(Annotatable owner, Flag key) {
    return Boolean.TRUE.equals(flags.get(owner, key));
  }

  /** Records {@code symbol -> value} in the owner's map, creating the map on first write. */
  public void setMapEntry(Annotatable owner, SymbolMap key, Symbol symbol, int value) {
    Map<Symbol, Integer> map = maps.get(owner, key);
    if (map == null) {
      map = new HashMap<>();
      maps.put(owner, key, map);
    }
    map.put(symbol, value);
  }

  /** Replaces the owner's map with a copy of {@code entries}. */
  public void setMap(Annotatable owner, SymbolMap key, Map<Symbol, Integer> entries) {
    maps.put(owner, key, new HashMap<>(entries));
  }

  public OptionalInt getMapEntry(Annotatable owner, SymbolMap key, Symbol symbol) {
    Map<Symbol, Integer> map = maps.get(owner, key);
    Integer value = map == null ? null : map.get(symbol);
    return value == null ? OptionalInt.empty() : OptionalInt.of(value);
  }

  /** Appends a statement to the owner's list. Duplicates are kept. */
  public void appendToList(Annotatable owner, StatementList key, Statement stmt) {
    lists.computeIfAbsent(key, k -> ArrayListMultimap.create()).put(owner, stmt);
  }

  /** Replaces the owner's list with {@code stmts}, in order. */
  public void setList(Annotatable owner, StatementList key, List<? extends Statement> stmts) {
    lists.computeIfAbsent(key, k -> ArrayListMultimap.create()).replaceValues(owner, stmts);
  }

  /** Returns the owner's list in insertion order; empty if nothing was appended. */
  public ImmutableList<Statement> getList(Annotatable owner, StatementList key) {
    ListMultimap<Annotatable, Statement> multimap = lists.get(key);
    return multimap == null ? ImmutableList.of() : ImmutableList.copyOf(multimap.get(owner));
  }

  public <T> void setValue(Annotatable owner, ValueKey<T> key, T value) {
    values.put(owner, key, key.getType().cast(value));
  }

  public <T> Optional<T> getValue(Annotatable owner, ValueKey<T> key) {
    return Optional.ofNullable(key.getType().cast(values.get(owner, key)));
  }

  /** Like {@link #getValue}, for callers that treat an absent value as null. */
  @Nullable
  public <T> T getValueOrNull(Annotatable owner, ValueKey<T> key) {
    return getValue(owner, key).orElse(null);
  }
}
