package ca.gc.cra.faultline.application.filter;

import ca.gc.cra.faultline.validation.Numbers;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Probabilistic sampler: an event is kept iff a uniform draw in {@code [0, 1)} is below the rate.
 * A rate of {@code 1.0} always keeps and {@code 0.0} always drops.
 *
 * @since 0.1.0
 */
public final class Sampler {
  private final double rate;
  private final DoubleSupplier draws;

  /**
   * Creates a sampler backed by {@link ThreadLocalRandom}.
   *
   * @param rate sample rate in {@code [0.0, 1.0]}
   */
  public Sampler(double rate) {
    this(rate, () -> ThreadLocalRandom.current().nextDouble());
  }

  /**
   * Creates a sampler with a custom draw source.
   *
   * @param rate sample rate in {@code [0.0, 1.0]}
   * @param draws supplier of uniform values in {@code [0, 1)}
   */
  public Sampler(double rate, DoubleSupplier draws) {
    this.rate = Numbers.requireFraction("sampleRate", rate);
    this.draws = Objects.requireNonNull(draws, "draws");
  }

  /** @return {@code true} to keep the event */
  public boolean sample() {
    return draws.getAsDouble() < rate;
  }

  /** @return configured rate */
  public double rate() {
    return rate;
  }
}
