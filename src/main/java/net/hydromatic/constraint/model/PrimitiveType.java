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
package net.hydromatic.constraint.model;

import java.util.Locale;

/** Primitive type of the meta-model. */
public enum PrimitiveType {
  BOOL,
  INT,
  FLOAT,
  STR,
  BYTEARRAY;

  /** Name of the type as written in the meta-model, e.g. "str". */
  public final String moniker;

  PrimitiveType() {
    this.moniker = name().toLowerCase(Locale.ROOT);
  }

  /** Returns whether values of this type have a length. */
  public boolean isLengthable() {
    return this == STR || this == BYTEARRAY;
  }
}

// End PrimitiveType.java
