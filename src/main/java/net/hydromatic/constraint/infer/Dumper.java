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

import static java.util.Objects.requireNonNull;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import net.hydromatic.constraint.model.Enumeration;
import net.hydromatic.constraint.model.PrimitiveSetLiteral;
import net.hydromatic.constraint.model.PrimitiveType;
import net.hydromatic.constraint.model.Property;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Writes inferred constraints as text, for testing and debugging.
 *
 * <p>The format is stable, so that it can be compared against golden
 * strings. An entity is written as its class name followed by its fields in
 * parentheses, one field per line; lists and maps are written one element per
 * line; each nested line is indented by two spaces. A missing value is
 * written {@code None}, a boolean {@code True} or {@code False}, and a string
 * in quotes, e.g. {@code 'abc'}.
 */
public abstract class Dumper {
  private static final String INDENT = "  ";

  private Dumper() {}

  /** Dumps a constraint, a {@link ConstraintsByProperty}, or null. */
  public static String dump(@Nullable Object o) {
    final StringBuilder buf = new StringBuilder();
    write(buf, toDumpable(o));
    return buf.toString();
  }

  /**
   * Returns a string literal, quoted and escaped.
   *
   * <p>Single quotes are used unless the string contains a single quote and
   * no double quote.
   */
  public static String repr(String s) {
    final char quote = s.indexOf('\'') >= 0 && s.indexOf('"') < 0 ? '"' : '\'';
    final StringBuilder buf = new StringBuilder();
    buf.append(quote);
    for (int i = 0; i < s.length(); i++) {
      final char c = s.charAt(i);
      switch (c) {
        case '\\':
          buf.append("\\\\");
          break;
        case '\n':
          buf.append("\\n");
          break;
        case '\r':
          buf.append("\\r");
          break;
        case '\t':
          buf.append("\\t");
          break;
        default:
          if (c == quote) {
            buf.append('\\');
          }
          buf.append(c);
      }
    }
    return buf.append(quote).toString();
  }

  /**
   * Returns a bytes literal, e.g. {@code b'ab\x00'}.
   *
   * <p>Printable ASCII characters are written as themselves, other bytes as
   * hexadecimal escapes.
   */
  public static String reprBytes(List<?> bytes) {
    final StringBuilder buf = new StringBuilder("b'");
    for (Object o : bytes) {
      final int b = (Byte) o & 0xFF;
      if (b == '\\' || b == '\'') {
        buf.append('\\').append((char) b);
      } else if (b == '\n') {
        buf.append("\\n");
      } else if (b == '\r') {
        buf.append("\\r");
      } else if (b == '\t') {
        buf.append("\\t");
      } else if (b >= 0x20 && b < 0x7F) {
        buf.append((char) b);
      } else {
        buf.append(String.format(Locale.ROOT, "\\x%02x", b));
      }
    }
    return buf.append('\'').toString();
  }

  /** Converts a value into entities, lists, maps and scalars. */
  private static @Nullable Object toDumpable(@Nullable Object o) {
    if (o instanceof LenConstraint) {
      final LenConstraint c = (LenConstraint) o;
      return new Entity("LenConstraint")
          .field("min_value", c.minValue)
          .field("max_value", c.maxValue);
    }
    if (o instanceof PatternConstraint) {
      return new Entity("PatternConstraint")
          .field("pattern", ((PatternConstraint) o).pattern);
    }
    if (o instanceof SetOfPrimitivesConstraint) {
      final SetOfPrimitivesConstraint c = (SetOfPrimitivesConstraint) o;
      return new Entity("SetOfPrimitivesConstraint")
          .field("a_type", c.aType.name())
          .field("literals", toDumpables(c.literals));
    }
    if (o instanceof PrimitiveSetLiteral) {
      final PrimitiveSetLiteral literal = (PrimitiveSetLiteral) o;
      return new Entity("PrimitiveSetLiteral")
          .field(
              "value",
              literal.aType == PrimitiveType.BYTEARRAY
                  ? new Raw(reprBytes((List<?>) literal.value))
                  : literal.value)
          .field("a_type", literal.aType.name());
    }
    if (o instanceof SetOfEnumerationLiteralsConstraint) {
      final SetOfEnumerationLiteralsConstraint c =
          (SetOfEnumerationLiteralsConstraint) o;
      return new Entity("SetOfEnumerationLiteralsConstraint")
          .field(
              "enumeration", "Reference to Enumeration " + c.enumeration.name)
          .field("literals", toDumpables(c.literals));
    }
    if (o instanceof Enumeration.Literal) {
      return "Reference to EnumerationLiteral "
          + ((Enumeration.Literal) o).name;
    }
    if (o instanceof ConstraintsByProperty) {
      final ConstraintsByProperty c = (ConstraintsByProperty) o;
      return new Entity("ConstraintsByProperty")
          .field(
              "len_constraints_by_property",
              byName(c.lenConstraintsByProperty))
          .field("patterns_by_property", byName(c.patternsByProperty))
          .field(
              "set_of_primitives_by_property",
              byName(c.setOfPrimitivesByProperty))
          .field(
              "set_of_enumeration_literals_by_property",
              byName(c.setOfEnumerationLiteralsByProperty));
    }
    if (o instanceof List) {
      return toDumpables((List<?>) o);
    }
    return o;
  }

  private static List<@Nullable Object> toDumpables(List<?> list) {
    final List<@Nullable Object> result = new ArrayList<>();
    for (Object o : list) {
      result.add(toDumpable(o));
    }
    return result;
  }

  private static Map<String, @Nullable Object> byName(Map<Property, ?> map) {
    final Map<String, @Nullable Object> result = new LinkedHashMap<>();
    map.forEach(
        (property, value) -> result.put(property.name, toDumpable(value)));
    return result;
  }

  private static void write(StringBuilder buf, @Nullable Object o) {
    if (o == null) {
      buf.append("None");
    } else if (o instanceof Boolean) {
      buf.append((Boolean) o ? "True" : "False");
    } else if (o instanceof Number) {
      buf.append(o);
    } else if (o instanceof String) {
      buf.append(repr((String) o));
    } else if (o instanceof Raw) {
      buf.append(((Raw) o).text);
    } else if (o instanceof Entity) {
      final Entity entity = (Entity) o;
      buf.append(entity.name).append('(');
      if (entity.fields.isEmpty()) {
        buf.append(')');
        return;
      }
      buf.append('\n');
      int i = 0;
      for (Map.Entry<String, @Nullable Object> field :
          entity.fields.entrySet()) {
        if (i++ > 0) {
          buf.append(",\n");
        }
        buf.append(INDENT).append(field.getKey()).append('=');
        buf.append(indentButFirstLine(str(field.getValue())));
      }
      buf.append(')');
    } else if (o instanceof List) {
      final List<?> list = (List<?>) o;
      if (list.isEmpty()) {
        buf.append("[]");
        return;
      }
      buf.append("[\n");
      for (int i = 0; i < list.size(); i++) {
        if (i > 0) {
          buf.append(",\n");
        }
        buf.append(indent(str(list.get(i))));
      }
      buf.append(']');
    } else if (o instanceof Map) {
      final Map<?, ?> map = (Map<?, ?>) o;
      if (map.isEmpty()) {
        buf.append("{}");
        return;
      }
      buf.append("{\n");
      int i = 0;
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        if (i++ > 0) {
          buf.append(",\n");
        }
        buf.append(
            indent(str(entry.getKey()) + ": " + str(entry.getValue())));
      }
      buf.append('}');
    } else {
      throw new AssertionError("cannot dump " + o.getClass());
    }
  }

  private static String str(@Nullable Object o) {
    final StringBuilder buf = new StringBuilder();
    write(buf, o);
    return buf.toString();
  }

  /** Indents every line of a string. */
  private static String indent(String s) {
    return INDENT + indentButFirstLine(s);
  }

  /** Indents every line of a string except the first. */
  private static String indentButFirstLine(String s) {
    return s.replace("\n", "\n" + INDENT);
  }

  /** Text that is written as is. */
  private static class Raw {
    final String text;

    Raw(String text) {
      this.text = requireNonNull(text);
    }
  }

  /** Named record with ordered fields. */
  private static class Entity {
    final String name;
    final Map<String, @Nullable Object> fields = new LinkedHashMap<>();

    Entity(String name) {
      this.name = requireNonNull(name);
    }

    Entity field(String name, @Nullable Object value) {
      fields.put(name, value);
      return this;
    }
  }
}

// End Dumper.java
