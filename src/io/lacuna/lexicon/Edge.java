package io.lacuna.lexicon;

/**
 * A transition between two states, labeled with a single grapheme.
 */
public final class Edge {

  private final int source, target;
  private final Grapheme grapheme;

  Edge(int source, int target, Grapheme grapheme) {
    this.source = source;
    this.target = target;
    this.grapheme = grapheme;
  }

  public int source() {
    return source;
  }

  public int target() {
    return target;
  }

  public Grapheme grapheme() {
    return grapheme;
  }

  Edge withGrapheme(Grapheme g) {
    return new Edge(source, target, g);
  }

  @Override
  public String toString() {
    return source + " -[" + grapheme + "]-> " + target;
  }
}
