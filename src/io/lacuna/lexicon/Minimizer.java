package io.lacuna.lexicon;

import io.lacuna.bifurcan.IList;
import io.lacuna.bifurcan.ISet;
import io.lacuna.bifurcan.LinearList;
import io.lacuna.bifurcan.LinearSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes the coarsest partition of a deterministic automaton's states which agrees with its accepting states, by
 * Hopcroft-style partition refinement.  States in the same class accept the same suffixes, and can be collapsed into a
 * single state.
 */
final class Minimizer {

  private static final Logger LOG = LoggerFactory.getLogger(Minimizer.class);

  private final StateGraph graph;
  private final IList<Grapheme> alphabet;

  Minimizer(StateGraph graph, Iterable<Grapheme> alphabet) {
    this.graph = graph;

    // frozen for the duration of the refinement
    LinearList<Grapheme> signals = new LinearList<>();
    alphabet.forEach(signals::addLast);
    this.alphabet = signals;
  }

  /**
   * @return the non-empty equivalence classes of the graph's states, in a deterministic order
   */
  IList<ISet<Integer>> equivalenceClasses(ISet<Integer> finalStates) {
    IList<ISet<Integer>> partition = initialPartition(finalStates);

    LinearList<ISet<Integer>> waiting = new LinearList<>();
    partition.forEach(waiting::addLast);

    long iterations = 0;
    while (waiting.size() > 0) {
      ISet<Integer> a = waiting.popFirst();
      iterations++;

      for (Grapheme signal : alphabet) {
        ISet<Integer> x = parentStates(a, signal);
        if (x.size() == 0) {
          continue;
        }

        IList<IList<ISet<Integer>>> splits = new LinearList<>();
        partition = Utils.partitionAll(partition, x, splits);

        for (IList<ISet<Integer>> split : splits) {
          ISet<Integer> y = split.nth(0);
          ISet<Integer> i = split.nth(1);
          ISet<Integer> d = split.nth(2);

          long idx = Utils.indexOf(waiting, y);
          if (idx >= 0) {
            waiting = Utils.removeNth(waiting, idx);
            waiting.addLast(i);
            waiting.addLast(d);
          } else {
            waiting.addLast(i.size() <= d.size() ? i : d);
          }
        }
      }
    }

    IList<ISet<Integer>> classes = new LinearList<>();
    for (ISet<Integer> c : partition) {
      if (c.size() > 0) {
        classes.addLast(c);
      }
    }

    LOG.debug("refined {} states into {} equivalence classes over {} iterations",
            graph.stateCount(), classes.size(), iterations);

    return classes;
  }

  // non-accepting states first, then accepting states, either of which may be empty
  private IList<ISet<Integer>> initialPartition(ISet<Integer> finalStates) {
    LinearSet<Integer> accepting = new LinearSet<>();
    LinearSet<Integer> rejecting = new LinearSet<>();
    for (int state = 0; state < graph.stateCount(); state++) {
      if (finalStates.contains(state)) {
        accepting.add(state);
      } else {
        rejecting.add(state);
      }
    }
    return LinearList.<ISet<Integer>>of(rejecting, accepting);
  }

  /**
   * Returns every state with a transition into {@code states} on {@code signal}.  A transition matches if it has the
   * same value and shares either bound with {@code signal}, since transitions may have been widened to cover several
   * signals in the alphabet.
   */
  ISet<Integer> parentStates(ISet<Integer> states, Grapheme signal) {
    LinearSet<Integer> parents = new LinearSet<>();
    for (int state : states) {
      for (Edge e : graph.incoming(state)) {
        Grapheme g = e.grapheme();
        if (g.value().equals(signal.value())
                && (g.maximum() == signal.maximum() || g.minimum() == signal.minimum())) {
          parents.add(e.source());
        }
      }
    }
    return parents;
  }
}
