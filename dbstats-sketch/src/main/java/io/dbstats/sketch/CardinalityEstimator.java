package io.dbstats.sketch;

/**
 * Approximates the number of distinct keys added to it.
 *
 * <p>Implementations are not thread-safe. Callers sharing one instance must serialize every
 * {@link #addElement} and every {@link #computeCardinality()}/{@link #getCardinality()} pair
 * under the same lock.
 */
public interface CardinalityEstimator<K>
{
  void addElement(K key);

  /**
   * Recomputes the estimate from the current state and caches it.
   */
  void computeCardinality();

  /**
   * @return the estimate cached by the last {@link #computeCardinality()}, 0 if it was never called
   */
  long getCardinality();

  long memoryFootprint();

  String name();
}
