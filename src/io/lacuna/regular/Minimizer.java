package io.lacuna.regular;

import io.lacuna.bifurcan.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * Partition refinement over a total DFA. States start out split into accepting and non-accepting classes, and any
 * class whose members disagree on the classes of their successors is split, until no class can be split further.
 * <p>
 * Refinement is driven by a worklist of splitters, so that a long chain of states isn't refined one state per pass.
 * Classes are numbered in order of their lowest member, and so the start state's class always comes first.
 */
public class Minimizer {

  private static final Logger LOG = LoggerFactory.getLogger(Minimizer.class);

  private Minimizer() {
  }

  public static DFA minimize(DFA dfa) {
    if (!dfa.isTotal()) {
      throw new IllegalStateException("only a total DFA can be minimized");
    }

    int[] partition = new Refinement(dfa).refine();
    int classes = renumber(partition);

    DFA result = build(dfa, partition, classes);
    LOG.debug("minimized {} states to {}", dfa.size(), result.size());
    return result;
  }

  /**
   * Renumbers the classes by the order in which they're first seen, walking the states in ascending order.
   *
   * @return the number of classes
   */
  private static int renumber(int[] partition) {
    int[] classes = new int[partition.length];
    Arrays.fill(classes, DFA.NONE);

    int count = 0;
    for (int s = 0; s < partition.length; s++) {
      int block = partition[s];
      if (classes[block] == DFA.NONE) {
        classes[block] = count++;
      }
      partition[s] = classes[block];
    }
    return count;
  }

  /**
   * Each block is a contiguous range {@code [first, end)} of {@code elems}. While a block is being split, its members
   * which lead into the splitter are swapped to the front of that range, up to {@code mid}.
   */
  private static class Refinement {

    // predecessors of t on signal c are preds[c][predStart[c][t] .. predStart[c][t + 1])
    private final int[][] predStart, preds;

    private final int[] elems, loc, block;
    private final int[] first, end, mid;
    private int blocks = 0;

    private final LinearList<int[]> splitters = new LinearList<>();

    Refinement(DFA dfa) {
      int size = dfa.size();

      int signals = Signals.count();
      predStart = new int[signals][size + 1];
      preds = new int[signals][size];
      for (int c = 0; c < signals; c++) {
        for (DFA.State s : dfa.states) {
          predStart[c][s.next[c] + 1]++;
        }
        for (int t = 0; t < size; t++) {
          predStart[c][t + 1] += predStart[c][t];
        }
        int[] cursor = Arrays.copyOf(predStart[c], size);
        for (DFA.State s : dfa.states) {
          preds[c][cursor[s.next[c]]++] = s.id;
        }
      }

      elems = new int[size];
      loc = new int[size];
      block = new int[size];
      first = new int[size];
      end = new int[size];
      mid = new int[size];

      LinearList<Integer> ids = new LinearList<>();
      for (int i = 0; i < size; i++) {
        ids.addLast(i);
      }

      int pos = 0;
      for (ISet<Integer> group : Utils.groupBy(ids, s -> dfa.state(s).accept).values()) {
        first[blocks] = pos;
        mid[blocks] = pos;
        for (int s : group) {
          elems[pos] = s;
          loc[s] = pos;
          block[s] = blocks;
          pos++;
        }
        end[blocks] = pos;
        blocks++;
      }

      // with a total DFA, splitting on the smaller of the two initial blocks also splits on the other
      if (blocks == 2) {
        int smaller = end[0] - first[0] <= end[1] - first[1] ? 0 : 1;
        for (int c = 0; c < signals; c++) {
          splitters.addLast(new int[]{smaller, c});
        }
      }
    }

    /**
     * @return the block of each state, in no particular numbering
     */
    int[] refine() {
      while (splitters.size() > 0) {
        int[] splitter = splitters.popLast();
        int a = splitter[0];
        int c = splitter[1];

        // gathered up front, since splitting may rearrange the splitter's own block
        LinearList<Integer> sources = new LinearList<>();
        for (int i = first[a]; i < end[a]; i++) {
          int t = elems[i];
          for (int j = predStart[c][t]; j < predStart[c][t + 1]; j++) {
            sources.addLast(preds[c][j]);
          }
        }

        LinearList<Integer> touched = new LinearList<>();
        for (int s : sources) {
          int b = block[s];
          if (loc[s] < mid[b]) {
            continue;
          }
          if (mid[b] == first[b]) {
            touched.addLast(b);
          }
          int displaced = elems[mid[b]];
          elems[loc[s]] = displaced;
          loc[displaced] = loc[s];
          elems[mid[b]] = s;
          loc[s] = mid[b];
          mid[b]++;
        }

        for (int b : touched) {
          split(b);
        }
      }

      return block.clone();
    }

    // carves the marked members of block b away from the rest, and gives the smaller half a new block
    private void split(int b) {
      if (mid[b] == end[b]) {
        mid[b] = first[b];
        return;
      }

      int nb = blocks++;
      if (mid[b] - first[b] <= end[b] - mid[b]) {
        first[nb] = first[b];
        end[nb] = mid[b];
        first[b] = mid[b];
      } else {
        first[nb] = mid[b];
        end[nb] = end[b];
        end[b] = mid[b];
      }
      mid[b] = first[b];
      mid[nb] = first[nb];

      for (int i = first[nb]; i < end[nb]; i++) {
        block[elems[i]] = nb;
      }

      // whether or not b is still waiting to be used, the smaller half is always enough
      for (int c = 0; c < Signals.count(); c++) {
        splitters.addLast(new int[]{nb, c});
      }
    }
  }

  private static DFA build(DFA dfa, int[] partition, int classes) {
    int[] representative = new int[classes];
    Arrays.fill(representative, DFA.NONE);
    boolean[] accept = new boolean[classes];

    for (int i = 0; i < dfa.size(); i++) {
      int c = partition[i];
      if (representative[c] == DFA.NONE) {
        representative[c] = i;
      }
      accept[c] |= dfa.state(i).accept;
    }

    DFA result = new DFA();
    for (int c = 0; c < classes; c++) {
      DFA.State s = result.newState(accept[c]);
      DFA.State template = dfa.state(representative[c]);
      for (int idx = 0; idx < Signals.count(); idx++) {
        s.next[idx] = partition[template.next[idx]];
      }
    }

    result.start = partition[dfa.start];
    result.trap = dfa.trap == DFA.NONE ? DFA.NONE : partition[dfa.trap];
    return result;
  }
}
