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
import static net.hydromatic.constraint.util.Static.transformEager;

import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * The meta-model has one or more errors that prevent constraint inference.
 *
 * <p>Carries every error found, not just the first.
 */
public class ConstraintException extends RuntimeException {
  public final ImmutableList<ConstraintError> errors;

  public ConstraintException(List<ConstraintError> errors) {
    super(describe(errors));
    this.errors = ImmutableList.copyOf(errors);
    checkArgument(!errors.isEmpty(), "no errors");
  }

  private static String describe(List<ConstraintError> errors) {
    final StringBuilder buf = new StringBuilder();
    for (ConstraintError error : errors) {
      if (buf.length() > 0) {
        buf.append('\n');
      }
      error.describeTo(buf);
    }
    return buf.toString();
  }

  /** Returns the messages of the errors, without positions. */
  public List<String> messages() {
    return transformEager(errors, error -> error.message);
  }
}

// End ConstraintException.java
