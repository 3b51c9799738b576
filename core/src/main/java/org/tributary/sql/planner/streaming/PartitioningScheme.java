/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.tributary.sql.planner.streaming;

import java.util.Collections;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/** Describes how an operator's output is partitioned across parallel consumers. */
@ToString
@EqualsAndHashCode
public class PartitioningScheme {

  private final ExchangeType exchangeType;
  private final List<Integer> hashChannels;

  private PartitioningScheme(ExchangeType exchangeType, List<Integer> hashChannels) {
    this.exchangeType = exchangeType;
    this.hashChannels = Collections.unmodifiableList(hashChannels);
  }

  /** Creates a GATHER partitioning (all data to one consumer). */
  public static PartitioningScheme gather() {
    return new PartitioningScheme(ExchangeType.GATHER, List.of());
  }

  /** Creates a HASH_REPARTITION partitioning on the given column indices. */
  public static PartitioningScheme hashRepartition(List<Integer> hashChannels) {
    return new PartitioningScheme(ExchangeType.HASH_REPARTITION, List.copyOf(hashChannels));
  }

  /** Hash partitioning on the key columns, or GATHER when there are no keys. */
  public static PartitioningScheme byKeys(List<Integer> keyChannels) {
    return keyChannels.isEmpty() ? gather() : hashRepartition(keyChannels);
  }

  public ExchangeType getExchangeType() {
    return exchangeType;
  }

  /** Returns the column indices used for hash partitioning. Empty for non-hash schemes. */
  public List<Integer> getHashChannels() {
    return hashChannels;
  }
}
