/* (C)2026 */
package com.ammann.trips.algorithm;

/**
 * Immutable (category, count) pair returned by {@link TopKSelector}.
 *
 * @param category the counted category
 * @param count    number of occurrences seen
 * @param <K>      category type
 */
public record FrequencyRecord<K>(K category, long count) {}
