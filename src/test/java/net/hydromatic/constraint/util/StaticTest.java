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
package net.hydromatic.constraint.util;

import static net.hydromatic.constraint.util.Static.skip;
import static net.hydromatic.constraint.util.Static.transformEager;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.is;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.junit.jupiter.api.Test;

/** Tests for {@link Static}. */
public class StaticTest {
  @Test
  void testSkip() {
    final List<String> list = ImmutableList.of("a", "b", "c");
    assertThat(skip(list), hasToString("[b, c]"));
    assertThat(skip(list, 3).isEmpty(), is(true));
    assertThat(skip(ImmutableList.of("a")).isEmpty(), is(true));
  }

  @Test
  void testTransformEager() {
    assertThat(
        transformEager(ImmutableList.<String>of(), String::length),
        hasToString("[]"));
    assertThat(
        transformEager(ImmutableList.of("abc"), String::length),
        hasToString("[3]"));
    assertThat(
        transformEager(ImmutableList.of("abc", "", "de"), String::length),
        hasToString("[3, 0, 2]"));
  }
}

// End StaticTest.java
