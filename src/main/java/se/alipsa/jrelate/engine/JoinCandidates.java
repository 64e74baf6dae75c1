package se.alipsa.jrelate.engine;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import se.alipsa.jrelate.Record;

/**
 * Index over the materialized right side of a join. For a left record it lists
 * the positions of the right records that may match, in right-side order. The
 * caller still verifies every candidate with the join predicate, so both
 * strategies share a single matching loop.
 */
interface JoinCandidates {

  int[] NONE = new int[0];

  /**
   * Candidate right positions for a left record.
   *
   * @param left
   *          the left record
   * @return ascending positions into the right rows, never {@code null}
   */
  int[] candidatesFor(Record left);

  /**
   * Number of distinct keys, or {@code -1} when the index is not hashed.
   *
   * @return the bucket count
   */
  int bucketCount();

  static JoinCandidates nestedLoop(int rightSize) {
    int[] all = new int[rightSize];
    for (int i = 0; i < rightSize; i++) {
      all[i] = i;
    }
    return new JoinCandidates() {
      @Override
      public int[] candidatesFor(Record left) {
        return all;
      }

      @Override
      public int bucketCount() {
        return -1;
      }
    };
  }

  static JoinCandidates hash(List<Record> rightRows, KeyExtractor extractor) {
    Map<String, List<Integer>> building = new HashMap<>();
    for (int i = 0; i < rightRows.size(); i++) {
      Optional<String> key = extractor.extractKey(rightRows.get(i));
      if (key.isPresent()) {
        building.computeIfAbsent(key.get(), k -> new ArrayList<>()).add(i);
      }
    }
    Map<String, int[]> buckets = new HashMap<>(building.size() * 2);
    for (Map.Entry<String, List<Integer>> entry : building.entrySet()) {
      List<Integer> positions = entry.getValue();
      int[] bucket = new int[positions.size()];
      for (int i = 0; i < bucket.length; i++) {
        bucket[i] = positions.get(i);
      }
      buckets.put(entry.getKey(), bucket);
    }
    return new JoinCandidates() {
      @Override
      public int[] candidatesFor(Record left) {
        Optional<String> key = extractor.extractKey(left);
        if (key.isEmpty()) {
          return NONE;
        }
        return buckets.getOrDefault(key.get(), NONE);
      }

      @Override
      public int bucketCount() {
        return buckets.size();
      }
    };
  }
}
