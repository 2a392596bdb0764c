package io.lacuna.regular;

import io.lacuna.bifurcan.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Translates a {@link Regex} into an epsilon-NFA via Thompson's construction. Every node of the tree becomes a fragment with
 * a single entry and a single exit state, and only the exit of the outermost fragment accepts.
 */
public class ThompsonBuilder {

  private static final Logger LOG = LoggerFactory.getLogger(ThompsonBuilder.class);

  private static class Fragment {
    final int entry, exit;

    Fragment(int entry, int exit) {
      this.entry = entry;
      this.exit = exit;
    }
  }

  // a node on the work stack, which is expanded on its first visit and wired up on its second
  private static class Task {
    final Regex node;
    boolean expanded = false;
    int entry, exit;

    Task(Regex node) {
      this.node = node;
    }
  }

  private final NFA nfa = new NFA();
  private final LinearList<Task> tasks = new LinearList<>();
  private final LinearList<Fragment> fragments = new LinearList<>();

  private ThompsonBuilder() {
  }

  public static NFA build(Regex regex) {
    ThompsonBuilder builder = new ThompsonBuilder();
    NFA nfa = builder.nfa;

    if (regex.type == Regex.Type.NONE) {
      nfa.start = nfa.newState().id;
    } else {
      Fragment f = builder.fragment(regex);
      nfa.state(f.exit).accept = true;
      nfa.start = f.entry;
    }

    LOG.debug("built epsilon-NFA with {} states from {} nodes", nfa.size(), regex.size());
    return nfa;
  }

  ///

  // a post-order walk, where union and star allocate their own states before their operands' states
  private Fragment fragment(Regex root) {
    tasks.addLast(new Task(root));

    while (tasks.size() > 0) {
      Task t = tasks.popLast();
      Regex node = t.node;

      if (!t.expanded) {
        switch (node.type) {
          case LITERAL: {
            State entry = nfa.newState();
            State exit = nfa.newState();
            entry.addTransition(node.signal, exit.id);
            fragments.addLast(new Fragment(entry.id, exit.id));
            continue;
          }

          case UNION:
          case STAR:
            t.entry = nfa.newState().id;
            t.exit = nfa.newState().id;
            break;

          case CONCAT:
            break;

          default:
            throw new IllegalStateException("the empty language can only appear at the root");
        }

        t.expanded = true;
        tasks.addLast(t);
        if (node.right != null) {
          tasks.addLast(new Task(node.right));
        }
        tasks.addLast(new Task(node.left));
        continue;
      }

      switch (node.type) {
        case CONCAT: {
          Fragment b = fragments.popLast();
          Fragment a = fragments.popLast();
          nfa.state(a.exit).addEpsilon(b.entry);
          fragments.addLast(new Fragment(a.entry, b.exit));
          break;
        }

        case UNION: {
          Fragment b = fragments.popLast();
          Fragment a = fragments.popLast();
          nfa.state(t.entry).addEpsilon(a.entry);
          nfa.state(t.entry).addEpsilon(b.entry);
          nfa.state(a.exit).addEpsilon(t.exit);
          nfa.state(b.exit).addEpsilon(t.exit);
          fragments.addLast(new Fragment(t.entry, t.exit));
          break;
        }

        default: {
          Fragment f = fragments.popLast();
          nfa.state(t.entry).addEpsilon(f.entry);
          nfa.state(f.exit).addEpsilon(t.exit);
          nfa.state(t.entry).addEpsilon(t.exit);
          nfa.state(f.exit).addEpsilon(f.entry);
          fragments.addLast(new Fragment(t.entry, t.exit));
        }
      }
    }

    return fragments.popLast();
  }
}
