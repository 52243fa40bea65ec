package ca.gc.cra.faultline.application.filter;

import ca.gc.cra.faultline.domain.event.ExceptionValue;
import java.lang.reflect.InvocationTargetException;

/**
 * Pluggable predicate deciding whether an exception-carrying event is excluded.
 *
 * <p>Implementations named by {@code filter.class} need a public no-argument constructor.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface EventFilter {
  /**
   * Decides whether to drop an event.
   *
   * @param exception primary exception of the event
   * @param source capture source (e.g., {@code logger}); may be {@code null}
   * @return {@code true} to exclude the event
   */
  boolean excludeException(ExceptionValue exception, String source);

  /** Filter that never excludes. */
  EventFilter NONE = (exception, source) -> false;

  /**
   * Instantiates a filter by class name.
   *
   * @param className fully qualified implementation name; {@code null} or blank yields {@link #NONE}
   * @param loader class loader used for lookup
   * @return filter instance
   * @throws IllegalArgumentException if the class cannot be loaded, does not implement {@link EventFilter}, or
   *     cannot be instantiated
   */
  static EventFilter load(String className, ClassLoader loader) {
    if (className == null || className.isBlank()) {
      return NONE;
    }
    try {
      Class<?> type = Class.forName(className.trim(), true, loader);
      if (!EventFilter.class.isAssignableFrom(type)) {
        throw new IllegalArgumentException("filter.class " + className + " does not implement EventFilter");
      }
      return (EventFilter) type.getDeclaredConstructor().newInstance();
    } catch (ClassNotFoundException ex) {
      throw new IllegalArgumentException("filter.class " + className + " not found", ex);
    } catch (NoSuchMethodException | InstantiationException | IllegalAccessException
        | InvocationTargetException ex) {
      throw new IllegalArgumentException("filter.class " + className + " cannot be instantiated", ex);
    }
  }
}
