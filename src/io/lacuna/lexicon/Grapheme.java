package io.lacuna.lexicon;

import java.util.Objects;

/**
 * An element of an automaton's alphabet: either a single character, or a contiguous range of code points which
 * share a display value.
 */
public final class Grapheme implements Comparable<Grapheme> {

  private final String value;
  private final int minimum, maximum;

  private Grapheme(String value, int minimum, int maximum) {
    if (value == null) {
      throw new IllegalArgumentException("value must be non-null");
    }
    if (minimum > maximum) {
      throw new IllegalArgumentException("inverted range [" + minimum + ", " + maximum + "]");
    }
    this.value = value;
    this.minimum = minimum;
    this.maximum = maximum;
  }

  /**
   * @return a grapheme matching exactly {@code codePoint}
   */
  public static Grapheme of(int codePoint) {
    return new Grapheme(new String(Character.toChars(codePoint)), codePoint, codePoint);
  }

  /**
   * @return a grapheme displayed as {@code value}, matching the inclusive range {@code [minimum, maximum]}
   */
  public static Grapheme of(String value, int minimum, int maximum) {
    return new Grapheme(value, minimum, maximum);
  }

  /**
   * @return a grapheme with the value of {@code b}, spanning both ranges
   */
  public static Grapheme union(Grapheme a, Grapheme b) {
    return new Grapheme(b.value, Math.min(a.minimum, b.minimum), Math.max(a.maximum, b.maximum));
  }

  public String value() {
    return value;
  }

  public int minimum() {
    return minimum;
  }

  public int maximum() {
    return maximum;
  }

  /**
   * @return true if {@code g} has the same value, and its range lies within this grapheme's range
   */
  public boolean covers(Grapheme g) {
    return value.equals(g.value) && minimum <= g.minimum && g.maximum <= maximum;
  }

  /**
   * @return true if {@code g} has the same value, and the two ranges share at least one code point
   */
  public boolean overlaps(Grapheme g) {
    return value.equals(g.value) && minimum <= g.maximum && g.minimum <= maximum;
  }

  @Override
  public int compareTo(Grapheme o) {
    if (minimum != o.minimum) {
      return Integer.compare(minimum, o.minimum);
    } else if (maximum != o.maximum) {
      return Integer.compare(maximum, o.maximum);
    } else {
      return value.compareTo(o.value);
    }
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    } else if (obj instanceof Grapheme) {
      Grapheme g = (Grapheme) obj;
      return minimum == g.minimum && maximum == g.maximum && value.equals(g.value);
    }
    return false;
  }

  @Override
  public int hashCode() {
    return Objects.hash(value, minimum, maximum);
  }

  @Override
  public String toString() {
    if (minimum == maximum) {
      return value;
    }
    return value + "[" + minimum + "-" + maximum + "]";
  }
}
