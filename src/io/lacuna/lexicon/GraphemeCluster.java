package io.lacuna.lexicon;

import io.lacuna.bifurcan.IList;
import io.lacuna.bifurcan.LinearList;

import java.util.Iterator;

/**
 * A non-empty, ordered sequence of graphemes, representing a single input string.
 */
public final class GraphemeCluster implements Iterable<Grapheme> {

  private final IList<Grapheme> graphemes;

  private GraphemeCluster(IList<Grapheme> graphemes) {
    if (graphemes.size() == 0) {
      throw new IllegalArgumentException("a cluster must contain at least one grapheme");
    }
    this.graphemes = graphemes.forked();
  }

  public static GraphemeCluster of(Grapheme... graphemes) {
    LinearList<Grapheme> list = new LinearList<>();
    for (Grapheme g : graphemes) {
      if (g == null) {
        throw new IllegalArgumentException("graphemes must be non-null");
      }
      list.addLast(g);
    }
    return new GraphemeCluster(list);
  }

  /**
   * @return a cluster with one grapheme per code point of {@code s}
   */
  public static GraphemeCluster from(String s) {
    LinearList<Grapheme> list = new LinearList<>();
    s.codePoints().forEach(c -> list.addLast(Grapheme.of(c)));
    return new GraphemeCluster(list);
  }

  public IList<Grapheme> graphemes() {
    return graphemes;
  }

  public int size() {
    return (int) graphemes.size();
  }

  @Override
  public Iterator<Grapheme> iterator() {
    return graphemes.iterator();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    } else if (obj instanceof GraphemeCluster) {
      return graphemes.equals(((GraphemeCluster) obj).graphemes);
    }
    return false;
  }

  @Override
  public int hashCode() {
    return graphemes.hashCode();
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    graphemes.forEach(sb::append);
    return sb.toString();
  }
}
