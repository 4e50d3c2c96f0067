/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.constraint.infer;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.CaseFormat;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Ordering;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Property that controls constraint inference.
 *
 * @see ConstraintInference#map
 */
public enum Prop {
  /**
   * Boolean property "inlineConstrainedPrimitives" controls whether the
   * length and pattern constraints of a constrained primitive are copied onto
   * each property whose type is that constrained primitive. Default is true.
   *
   * <p>Turn it off for a target whose schema references a named type for each
   * constrained primitive rather than repeating its constraints.
   */
  INLINE_CONSTRAINED_PRIMITIVES(
      "inlineConstrainedPrimitives", Boolean.class, true, true),

  /**
   * Boolean property "deduplicateInheritedPatterns" controls whether, when
   * merging a class with its ancestors, an inherited pattern whose text the
   * class already has is left out. Default is true.
   *
   * <p>A constrained primitive that is inlined at every level of a hierarchy
   * would otherwise contribute the same pattern once per level.
   */
  DEDUPLICATE_INHERITED_PATTERNS(
      "deduplicateInheritedPatterns", Boolean.class, true, true),

  /**
   * Boolean property "rejectEmptySets" controls whether merging fails if a
   * property is constrained to a set that, after intersection, is empty. No
   * value satisfies such a property, so the class can have no instances.
   * Default is true.
   */
  REJECT_EMPTY_SETS("rejectEmptySets", Boolean.class, true, true);

  public final String camelName;
  private final Class<?> type;
  private final boolean required;
  private final Object defaultValue;

  /**
   * Map of all properties, keyed by both {@link #name()} and {@link
   * #camelName}.
   */
  public static final ImmutableMap<String, Prop> BY_NAME;

  /** List of all properties sorted by {@link #camelName}. */
  public static final List<Prop> BY_CAMEL_NAME;

  static {
    final List<Prop> list = Arrays.asList(values());
    final Ordering<Prop> ordering =
        Ordering.from(Comparator.comparing((Prop o) -> o.camelName));
    BY_CAMEL_NAME = ordering.sortedCopy(list);

    final Map<String, Prop> map = new LinkedHashMap<>();
    for (Prop value : BY_CAMEL_NAME) {
      map.put(value.name(), value);
      map.put(value.camelName, value);
    }
    BY_NAME = ImmutableMap.copyOf(map);
  }

  Prop(String camelName, Class<?> type, boolean required, Object defaultValue) {
    this.camelName = camelName;
    this.type = type;
    this.required = required;
    this.defaultValue = defaultValue;
    checkArgument(
        CaseFormat.LOWER_CAMEL
            .to(CaseFormat.UPPER_UNDERSCORE, camelName)
            .equals(name()));
    checkArgument(type.isInstance(defaultValue));
  }

  /** Looks up a property by name. Throws if not found; never returns null. */
  public static Prop lookup(String propName) {
    Prop prop = BY_NAME.get(propName);
    if (prop == null) {
      throw new RuntimeException("property " + propName + " not found");
    }
    return prop;
  }

  /** Returns the value of a property. */
  public Object get(Map<Prop, Object> map) {
    Object o = map.get(this);
    return o != null ? o : defaultValue;
  }

  /** Returns the value of a boolean property. */
  public boolean booleanValue(Map<Prop, Object> map) {
    checkArgument(
        type == Boolean.class,
        "invalid type %s for property %s",
        type,
        camelName);
    return (Boolean) get(map);
  }

  /** Sets the value of a property, allowing strings for boolean types. */
  public void setLenient(Map<Prop, Object> map, @Nullable Object value) {
    if (type == Boolean.class && value instanceof String) {
      switch (((String) value).toLowerCase(Locale.ROOT)) {
        case "true":
          set(map, true);
          return;
        case "false":
          set(map, false);
          return;
        default:
          throw new RuntimeException("value must be one of: 'true', 'false'");
      }
    }
    set(map, value);
  }

  /** Sets the value of a property. Checks that its type is valid. */
  public void set(Map<Prop, Object> map, @Nullable Object value) {
    if (value == null) {
      if (required) {
        throw new RuntimeException("property is required");
      }
      map.remove(this);
    } else {
      if (!type.isInstance(value)) {
        throw new RuntimeException("value for property must have type " + type);
      }
      map.put(this, value);
    }
  }

  /**
   * Removes the value of this property from a map, returning the previous value
   * or null.
   */
  public @Nullable Object remove(Map<Prop, Object> map) {
    return map.remove(this);
  }
}

// End Prop.java
