/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.tributary.sql.expression.env;

/** The definition of the environment. */
public interface Environment<E, V> {

  /** resolve the value of expression from the environment. */
  V resolve(E var);
}
