package ca.gc.cra.didagent.application.stats;

/**
 * Aggregated timing for one instrumented method.
 *
 * @param count completed calls, including calls that threw
 * @param totalNanos summed wall time
 * @param minNanos fastest call
 * @param maxNanos slowest call
 */
public record CallStats(long count, long totalNanos, long minNanos, long maxNanos) {
  public double averageNanos() {
    return count == 0 ? 0d : (double) totalNanos / count;
  }
}
