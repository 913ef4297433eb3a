package io.lacuna.lexicon;

import io.lacuna.bifurcan.IList;
import io.lacuna.bifurcan.LinearList;

/**
 * A directed graph whose nodes are addressed by their index, and whose edges are kept in insertion order.  Nodes are
 * never removed, a graph with fewer nodes is built instead.
 */
final class StateGraph {

  private final LinearList<Edge> edges = new LinearList<>();

  // edge indices, per state
  private final LinearList<LinearList<Integer>> outgoing = new LinearList<>();
  private final LinearList<LinearList<Integer>> incoming = new LinearList<>();

  int addState() {
    outgoing.addLast(new LinearList<>());
    incoming.addLast(new LinearList<>());
    return (int) outgoing.size() - 1;
  }

  void addEdge(int source, int target, Grapheme grapheme) {
    checkState(source);
    checkState(target);

    int idx = (int) edges.size();
    edges.addLast(new Edge(source, target, grapheme));
    outgoing.nth(source).addLast(idx);
    incoming.nth(target).addLast(idx);
  }

  /**
   * Replaces the grapheme on the {@code n}th outgoing edge of {@code state}, leaving both endpoints as they were.
   */
  void relabel(int state, int n, Grapheme grapheme) {
    int idx = outgoing.nth(state).nth(n);
    edges.set(idx, edges.nth(idx).withGrapheme(grapheme));
  }

  int stateCount() {
    return (int) outgoing.size();
  }

  int edgeCount() {
    return (int) edges.size();
  }

  boolean contains(int state) {
    return state >= 0 && state < outgoing.size();
  }

  IList<Edge> outgoing(int state) {
    return resolve(outgoing.nth(state));
  }

  IList<Edge> incoming(int state) {
    return resolve(incoming.nth(state));
  }

  private IList<Edge> resolve(IList<Integer> indices) {
    LinearList<Edge> result = new LinearList<>((int) indices.size());
    for (int idx : indices) {
      result.addLast(edges.nth(idx));
    }
    return result;
  }

  private void checkState(int state) {
    if (!contains(state)) {
      throw new IllegalArgumentException("no such state: " + state);
    }
  }
}
