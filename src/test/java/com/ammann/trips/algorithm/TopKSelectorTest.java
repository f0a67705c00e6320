package com.ammann.trips.algorithm;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link TopKSelector}.
 */
class TopKSelectorTest
{

    @Test
    void ranksMostFrequentCategories()
    {
        TopKSelector<String> selector = selectorOf(2, "A", "B", "A", "C", "A", "B");

        assertThat(selector.topK(2)).containsExactly(
                new FrequencyRecord<>("A", 3L),
                new FrequencyRecord<>("B", 2L));
    }

    @Test
    void breaksTiesByFirstSeenOrder()
    {
        TopKSelector<String> selector = selectorOf(3, "C", "B", "A", "A", "B", "C");

        assertThat(selector.topK(3)).extracting(FrequencyRecord::category)
                .containsExactly("C", "B", "A");
    }

    @Test
    void earlierCategoryReclaimsSlotWhenItCatchesUp()
    {
        // B overtakes A first, then A ties it again and wins on first-seen order.
        TopKSelector<String> selector = selectorOf(1, "A", "B", "B", "A");

        assertThat(selector.topK(1)).containsExactly(new FrequencyRecord<>("A", 2L));
    }

    @Test
    void readingIsIdempotent()
    {
        TopKSelector<String> selector = selectorOf(3, "x", "y", "x", "z", "y", "x", "w");

        List<FrequencyRecord<String>> first = selector.topK(3);
        List<FrequencyRecord<String>> second = selector.topK(3);

        assertThat(second).isEqualTo(first);
    }

    @Test
    void weightedInsertAddsOccurrences()
    {
        TopKSelector<String> selector = new TopKSelector<>(3);
        selector.insert("A", 5);
        selector.insert("B", 3);
        selector.insert("C", 8);
        selector.insert("D", 2);

        assertThat(selector.topK()).containsExactly(
                new FrequencyRecord<>("C", 8L),
                new FrequencyRecord<>("A", 5L),
                new FrequencyRecord<>("B", 3L));
        assertThat(selector.totalCount()).isEqualTo(18L);
        assertThat(selector.count("D")).isEqualTo(2L);
        assertThat(selector.count("missing")).isZero();
    }

    @Nested
    @DisplayName("Boundaries")
    class Boundaries
    {
        @Test
        void nonPositiveKYieldsEmptyResult()
        {
            TopKSelector<String> selector = selectorOf(2, "A", "B");

            assertThat(selector.topK(0)).isEmpty();
            assertThat(selector.topK(-3)).isEmpty();
        }

        @Test
        void emptyInputYieldsEmptyResult()
        {
            assertThat(new TopKSelector<String>(5).topK(5)).isEmpty();
        }

        @Test
        void kBeyondDistinctCountReturnsAllCategories()
        {
            TopKSelector<String> selector = selectorOf(10, "A", "B", "B");

            assertThat(selector.topK(10)).containsExactly(
                    new FrequencyRecord<>("B", 2L),
                    new FrequencyRecord<>("A", 1L));
            assertThat(selector.distinctCount()).isEqualTo(2);
        }

        @Test
        void kBeyondCapacityFallsBackToFullTable()
        {
            TopKSelector<String> selector = selectorOf(1, "A", "B", "B", "C", "C", "C");

            assertThat(selector.topK(3)).containsExactly(
                    new FrequencyRecord<>("C", 3L),
                    new FrequencyRecord<>("B", 2L),
                    new FrequencyRecord<>("A", 1L));
            assertThat(selector.topK(1)).containsExactly(new FrequencyRecord<>("C", 3L));
        }

        @Test
        void largeCapacityAllocatesOnlyWhatIsUsed()
        {
            TopKSelector<String> selector = selectorOf(Integer.MAX_VALUE, "A", "B", "A");

            assertThat(selector.topK()).containsExactly(
                    new FrequencyRecord<>("A", 2L),
                    new FrequencyRecord<>("B", 1L));
            assertThat(selector.topK(Integer.MAX_VALUE)).hasSize(2);
        }

        @Test
        void heapGrowsPastInitialSlots()
        {
            TopKSelector<Integer> selector = new TopKSelector<>(40);
            for (int category = 0; category < 50; category++) {
                selector.insert(category, category + 1L);
            }

            List<FrequencyRecord<Integer>> top = selector.topK();
            assertThat(top).hasSize(40);
            assertThat(top.get(0)).isEqualTo(new FrequencyRecord<>(49, 50L));
            assertThat(top.get(39)).isEqualTo(new FrequencyRecord<>(10, 11L));
        }

        @Test
        void zeroCapacityStillCounts()
        {
            TopKSelector<String> selector = selectorOf(0, "A", "B", "A");

            assertThat(selector.topK()).isEmpty();
            assertThat(selector.topK(1)).containsExactly(new FrequencyRecord<>("A", 2L));
        }

        @Test
        void rejectsInvalidArguments()
        {
            TopKSelector<String> selector = new TopKSelector<>(2);

            assertThatThrownBy(() -> new TopKSelector<String>(-1)).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> selector.insert(null)).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> selector.insert("A", 0)).isInstanceOf(IllegalArgumentException.class);
            assertThat(selector.distinctCount()).isZero();
        }
    }

    @ParameterizedTest
    @ValueSource(longs = {3L, 17L, 99L})
    void matchesFullyRankedCountTable(long seed)
    {
        Random random = new Random(seed);
        List<Integer> stream = new ArrayList<>();
        for (int i = 0; i < 2_000; i++) {
            // Skewed distribution with many ties among the rare categories
            stream.add(random.nextInt(random.nextBoolean() ? 8 : 60));
        }
        List<FrequencyRecord<Integer>> expected = rankByBruteForce(stream);

        for (int k = 1; k <= expected.size() + 2; k += 3) {
            TopKSelector<Integer> selector = new TopKSelector<>(k);
            stream.forEach(selector::insert);

            assertThat(selector.topK(k))
                    .as("top-%d for seed %d", k, seed)
                    .containsExactlyElementsOf(expected.subList(0, Math.min(k, expected.size())));
        }
    }

    @Test
    void finalCountsDoNotDependOnInsertionOrder()
    {
        List<String> stream = new ArrayList<>(List.of("a", "b", "c", "a", "b", "a", "d", "d", "d", "d"));
        TopKSelector<String> forward = new TopKSelector<>(4);
        stream.forEach(forward::insert);

        Collections.shuffle(stream, new Random(7));
        TopKSelector<String> shuffled = new TopKSelector<>(4);
        stream.forEach(shuffled::insert);

        for (String category : List.of("a", "b", "c", "d")) {
            assertThat(shuffled.count(category)).isEqualTo(forward.count(category));
        }
        assertThat(shuffled.topK(4)).extracting(FrequencyRecord::count)
                .containsExactlyElementsOf(forward.topK(4).stream().map(FrequencyRecord::count).toList());
    }

    @SafeVarargs
    private static <K> TopKSelector<K> selectorOf(int capacity, K... occurrences)
    {
        TopKSelector<K> selector = new TopKSelector<>(capacity);
        for (K occurrence : occurrences) {
            selector.insert(occurrence);
        }
        return selector;
    }

    private static <K> List<FrequencyRecord<K>> rankByBruteForce(List<K> stream)
    {
        Map<K, Long> counts = new LinkedHashMap<>();
        for (K category : stream) {
            counts.merge(category, 1L, Long::sum);
        }
        // LinkedHashMap keeps first-seen order; the stable sort preserves it among ties.
        List<FrequencyRecord<K>> ranked = new ArrayList<>();
        counts.forEach((category, count) -> ranked.add(new FrequencyRecord<>(category, count)));
        ranked.sort(Comparator.comparingLong((FrequencyRecord<K> r) -> r.count()).reversed());
        return ranked;
    }
}
