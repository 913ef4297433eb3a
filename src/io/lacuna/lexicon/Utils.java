package io.lacuna.lexicon;

import io.lacuna.bifurcan.IList;
import io.lacuna.bifurcan.ISet;
import io.lacuna.bifurcan.LinearList;

/**
 * Helpers for working with lists of disjoint sets.
 */
final class Utils {

  private Utils() {
  }

  /**
   * Splits every set which is partially covered by {@code partition} into the covered and uncovered halves, in that
   * order, keeping the relative order of all other sets.  Each split is recorded in {@code splits} as
   * {@code [original, intersection, difference]}.
   */
  static <V> IList<ISet<V>> partitionAll(Iterable<ISet<V>> sets, ISet<V> partition, IList<IList<ISet<V>>> splits) {
    IList<ISet<V>> accumulator = new LinearList<>();
    for (ISet<V> set : sets) {
      ISet<V> intersection = set.intersection(partition);
      if (intersection.size() == 0 || intersection.size() == set.size()) {
        accumulator.addLast(set);
        continue;
      }

      ISet<V> difference = set.difference(partition);
      accumulator.addLast(intersection);
      accumulator.addLast(difference);
      splits.addLast(LinearList.of(set, intersection, difference));
    }
    return accumulator;
  }

  /**
   * @return the index of the first element equal to {@code value}, or -1 if there is none
   */
  static <V> long indexOf(IList<V> list, V value) {
    for (long i = 0; i < list.size(); i++) {
      if (list.nth(i).equals(value)) {
        return i;
      }
    }
    return -1;
  }

  /**
   * @return a copy of {@code list} without the element at {@code idx}
   */
  static <V> LinearList<V> removeNth(IList<V> list, long idx) {
    LinearList<V> result = new LinearList<>((int) list.size());
    for (long i = 0; i < list.size(); i++) {
      if (i != idx) {
        result.addLast(list.nth(i));
      }
    }
    return result;
  }
}
