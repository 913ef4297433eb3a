package io.lacuna.lexicon;

import io.lacuna.bifurcan.IList;
import io.lacuna.bifurcan.ISet;
import io.lacuna.bifurcan.LinearList;
import io.lacuna.bifurcan.LinearMap;
import io.lacuna.bifurcan.LinearSet;

import java.util.Collections;
import java.util.Iterator;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * A deterministic automaton which accepts a finite set of grapheme clusters.  States are identified by their index,
 * which is only meaningful until the automaton is minimized.
 */
public class Automaton {

  StateGraph graph;
  int initialState;
  LinearSet<Integer> finalStates;
  final TreeSet<Grapheme> alphabet = new TreeSet<>();

  private boolean minimized = false;

  Automaton() {
    this.graph = new StateGraph();
    this.initialState = graph.addState();
    this.finalStates = new LinearSet<>();
  }

  /**
   * @return the minimal automaton accepting exactly {@code clusters}
   */
  public static Automaton from(Iterable<GraphemeCluster> clusters) {
    return new AutomatonBuilder().insertAll(clusters).build();
  }

  /**
   * @return the minimal automaton accepting exactly {@code strings}, with one grapheme per code point
   */
  public static Automaton from(String... strings) {
    LinearList<GraphemeCluster> clusters = new LinearList<>();
    for (String s : strings) {
      clusters.addLast(GraphemeCluster.from(s));
    }
    return from(clusters);
  }

  /// traversal

  public int stateCount() {
    return graph.stateCount();
  }

  public int edgeCount() {
    return graph.edgeCount();
  }

  public int initialState() {
    return initialState;
  }

  /**
   * @return every state reachable from the initial state, each exactly once, in depth-first order
   */
  public IList<Integer> statesInDepthFirstOrder() {
    LinearList<Integer> states = new LinearList<>();
    LinearSet<Integer> visited = new LinearSet<>();
    LinearList<Integer> stack = LinearList.of(initialState);

    while (stack.size() > 0) {
      int state = stack.popLast();
      if (visited.contains(state)) {
        continue;
      }

      visited.add(state);
      states.addLast(state);

      for (Edge e : graph.outgoing(state)) {
        if (!visited.contains(e.target())) {
          stack.addLast(e.target());
        }
      }
    }

    return states;
  }

  /**
   * @return the edges leaving {@code state}, in the order they were added
   */
  public Iterator<Edge> outgoingEdges(int state) {
    checkState(state);
    return graph.outgoing(state).iterator();
  }

  public boolean isFinalState(int state) {
    checkState(state);
    return finalStates.contains(state);
  }

  /**
   * @return every grapheme which has been inserted, in ascending order
   */
  public SortedSet<Grapheme> alphabet() {
    return Collections.unmodifiableSortedSet(alphabet);
  }

  public boolean isMinimized() {
    return minimized;
  }

  /**
   * @return true if every grapheme in {@code cluster} can be consumed, ending in an accepting state
   */
  public boolean accepts(GraphemeCluster cluster) {
    int state = initialState;
    for (Grapheme g : cluster) {
      state = transition(state, g);
      if (state < 0) {
        return false;
      }
    }
    return isFinalState(state);
  }

  private int transition(int state, Grapheme g) {
    for (Edge e : graph.outgoing(state)) {
      if (e.grapheme().covers(g)) {
        return e.target();
      }
    }
    return -1;
  }

  /// minimization

  /**
   * Collapses all equivalent states.  Every state index handed out before this call is invalidated.
   */
  void minimize() {
    if (minimized) {
      throw new IllegalStateException("automaton has already been minimized");
    }

    IList<ISet<Integer>> classes = new Minimizer(graph, alphabet).equivalenceClasses(finalStates);
    recreateGraph(classes);
    minimized = true;
  }

  // builds a graph with one state per equivalence class, then swaps it in
  private void recreateGraph(IList<ISet<Integer>> classes) {
    StateGraph newGraph = new StateGraph();
    LinearSet<Integer> newFinalStates = new LinearSet<>();
    LinearMap<Integer, Integer> mappings = new LinearMap<>();
    int newInitialState = -1;

    for (ISet<Integer> equivalenceClass : classes) {
      int newState = newGraph.addState();
      for (int oldState : equivalenceClass) {
        mappings.put(oldState, newState);
        if (oldState == initialState) {
          newInitialState = newState;
        }
        if (finalStates.contains(oldState)) {
          newFinalStates.add(newState);
        }
      }
    }

    // all members of a class are equivalent, so any one of them has the transitions of the whole class
    for (ISet<Integer> equivalenceClass : classes) {
      int representative = Integer.MAX_VALUE;
      for (int oldState : equivalenceClass) {
        representative = Math.min(representative, oldState);
      }

      int source = mappings.get(representative).get();
      for (Edge e : graph.outgoing(representative)) {
        newGraph.addEdge(source, mappings.get(e.target()).get(), e.grapheme());
      }
    }

    if (newInitialState < 0) {
      throw new IllegalStateException("initial state is missing from the partition");
    }

    this.graph = newGraph;
    this.initialState = newInitialState;
    this.finalStates = newFinalStates;
  }

  ///

  private void checkState(int state) {
    if (!graph.contains(state)) {
      throw new IllegalArgumentException("no such state: " + state);
    }
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("automaton[initial=" + initialState + ", final=[");
    Iterator<Integer> it = finalStates.iterator();
    while (it.hasNext()) {
      sb.append(it.next());
      if (it.hasNext()) {
        sb.append(", ");
      }
    }
    sb.append("]]\n");
    for (int state = 0; state < graph.stateCount(); state++) {
      for (Edge e : graph.outgoing(state)) {
        sb.append("  ").append(e).append('\n');
      }
    }
    return sb.toString();
  }
}
