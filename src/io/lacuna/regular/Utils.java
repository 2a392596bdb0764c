package io.lacuna.regular;

import io.lacuna.bifurcan.*;

import java.util.function.Function;
import java.util.stream.Stream;

/**
 * @author ztellman
 */
public class Utils {

  public static <V> LinearSet<V> toSet(Stream<V> s) {
    return s.collect(Sets.linearCollector());
  }

  /**
   * @return the integers in {@code set}, with ascending iteration order
   */
  public static LinearSet<Integer> sorted(ISet<Integer> set) {
    return toSet(set.stream().sorted());
  }

  public static <U, V> Function<U, V> memoize(Function<U, V> f) {
    LinearMap<U, V> cache = new LinearMap<>();
    return (U x) -> {
      cache.update(x, y -> y == null ? f.apply(x) : y);
      return cache.get(x).get();
    };
  }

  public static <K, V> IMap<K, ISet<V>> groupBy(Iterable<V> vals, Function<V, K> f) {
    LinearMap<K, ISet<V>> m = new LinearMap<>();
    vals.forEach(v -> m.getOrCreate(f.apply(v), LinearSet::new).add(v));
    return m;
  }
}
