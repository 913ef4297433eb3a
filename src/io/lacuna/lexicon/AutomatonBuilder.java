package io.lacuna.lexicon;

import io.lacuna.bifurcan.IList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.OptionalInt;

/**
 * Builds an automaton one grapheme cluster at a time, sharing common prefixes.  Adjacent ranges with the same value
 * are merged into a single transition, which assumes that for any given state, ranges are inserted in ascending order.
 */
public class AutomatonBuilder {

  private static final Logger LOG = LoggerFactory.getLogger(AutomatonBuilder.class);

  /**
   * Settings for an {@link AutomatonBuilder}.
   */
  public static final class Options {

    public static final Options DEFAULT = new Options(true);

    private final boolean validateDeterminism;

    private Options(boolean validateDeterminism) {
      this.validateDeterminism = validateDeterminism;
    }

    /**
     * @return options which check, after every transition, that no two transitions from the same state overlap
     */
    public Options validateDeterminism(boolean validateDeterminism) {
      return new Options(validateDeterminism);
    }

    public boolean validateDeterminism() {
      return validateDeterminism;
    }
  }

  private final Options options;
  private final Automaton automaton = new Automaton();
  private long clusterCount = 0;
  private boolean built = false;

  public AutomatonBuilder() {
    this(Options.DEFAULT);
  }

  public AutomatonBuilder(Options options) {
    if (options == null) {
      throw new IllegalArgumentException("options must be non-null");
    }
    this.options = options;
  }

  /**
   * @return the current builder, extended to also accept {@code cluster}
   */
  public AutomatonBuilder insert(GraphemeCluster cluster) {
    ensureOpen();

    int state = automaton.initialState;
    for (Grapheme g : cluster) {
      automaton.alphabet.add(g);
      state = nextState(state, g);
    }
    automaton.finalStates.add(state);
    clusterCount++;

    return this;
  }

  /**
   * @return the current builder, extended to also accept each of {@code clusters}
   */
  public AutomatonBuilder insertAll(Iterable<GraphemeCluster> clusters) {
    clusters.forEach(this::insert);
    return this;
  }

  /**
   * @return the minimized automaton, after which the builder can no longer be used
   */
  public Automaton build() {
    ensureOpen();
    built = true;

    LOG.debug("minimizing automaton with {} states built from {} clusters", automaton.stateCount(), clusterCount);
    automaton.minimize();

    return automaton;
  }

  // the automaton as built so far, before minimization
  Automaton automaton() {
    return automaton;
  }

  ///

  private int nextState(int state, Grapheme g) {
    OptionalInt next = findNextState(state, g);
    int result = next.isPresent() ? next.getAsInt() : addNewState(state, g);

    if (options.validateDeterminism()) {
      checkDeterministic(state, result);
    }

    return result;
  }

  // edges are scanned oldest first, so out-of-order ranges reuse the earliest matching edge
  private OptionalInt findNextState(int state, Grapheme g) {
    IList<Edge> edges = automaton.graph.outgoing(state);

    for (int n = 0; n < edges.size(); n++) {
      Edge e = edges.nth(n);
      Grapheme current = e.grapheme();

      if (!current.value().equals(g.value())) {
        continue;
      }

      if (current.maximum() == g.maximum() - 1) {
        automaton.graph.relabel(state, n, Grapheme.union(current, g));
        return OptionalInt.of(e.target());
      } else if (current.maximum() == g.maximum()) {
        return OptionalInt.of(e.target());
      }
    }

    return OptionalInt.empty();
  }

  private int addNewState(int state, Grapheme g) {
    int next = automaton.graph.addState();
    automaton.graph.addEdge(state, next, g);
    return next;
  }

  // only the edge just taken can have introduced an overlap, so it's compared against its siblings
  private void checkDeterministic(int state, int target) {
    IList<Edge> edges = automaton.graph.outgoing(state);

    Grapheme taken = null;
    for (Edge e : edges) {
      if (e.target() == target) {
        taken = e.grapheme();
        break;
      }
    }

    for (Edge e : edges) {
      if (e.target() != target && e.grapheme().overlaps(taken)) {
        throw new IllegalStateException("state " + state + " has overlapping transitions on " + e.grapheme()
                + " and " + taken + ", ranges must be inserted in ascending order");
      }
    }
  }

  private void ensureOpen() {
    if (built) {
      throw new IllegalStateException("automaton has already been built");
    }
  }
}
