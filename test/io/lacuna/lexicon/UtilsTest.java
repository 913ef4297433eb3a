package io.lacuna.lexicon;

import io.lacuna.bifurcan.IList;
import io.lacuna.bifurcan.ISet;
import io.lacuna.bifurcan.LinearList;
import io.lacuna.bifurcan.LinearSet;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class UtilsTest {

  @Test
  void testPartitionAll() {
    IList<ISet<Integer>> sets = LinearList.<ISet<Integer>>of(
            LinearSet.of(1, 2, 3),
            LinearSet.of(4, 5),
            LinearSet.of(6));
    IList<IList<ISet<Integer>>> splits = new LinearList<>();

    IList<ISet<Integer>> result = Utils.partitionAll(sets, LinearSet.of(2, 4, 5, 6), splits);

    // covered halves come first, untouched sets keep their position
    Assertions.assertEquals(4, result.size());
    Assertions.assertEquals(LinearSet.of(2), result.nth(0));
    Assertions.assertEquals(LinearSet.of(1, 3), result.nth(1));
    Assertions.assertEquals(LinearSet.of(4, 5), result.nth(2));
    Assertions.assertEquals(LinearSet.of(6), result.nth(3));

    Assertions.assertEquals(1, splits.size());
    Assertions.assertEquals(LinearSet.of(1, 2, 3), splits.first().nth(0));
    Assertions.assertEquals(LinearSet.of(2), splits.first().nth(1));
    Assertions.assertEquals(LinearSet.of(1, 3), splits.first().nth(2));
  }

  @Test
  void testIndexOfAndRemoveNth() {
    IList<String> list = LinearList.of("a", "b", "c");

    Assertions.assertEquals(1, Utils.indexOf(list, "b"));
    Assertions.assertEquals(-1, Utils.indexOf(list, "d"));
    Assertions.assertEquals(LinearList.of("a", "c"), Utils.removeNth(list, 1));
    Assertions.assertEquals(3, list.size());
  }
}
