package io.github.fiserro.synphot.component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;

/**
 * Built components shared between observation modes, so identical (interpolated) curves are
 * built once. Entries are never evicted.
 *
 * <p>A component is published only once it is fully built; a failed build leaves no entry.
 */
@Slf4j
public class ComponentCache {

  private final Map<ComponentKey, Component> components = new ConcurrentHashMap<>();

  /** Cached component for {@code key}, built with {@code builder} on a miss. */
  public Component get(ComponentKey key, Function<ComponentKey, Component> builder) {
    Component cached = components.get(key);
    if (cached != null) {
      log.trace("Component cache hit for {}", key);
      return cached;
    }
    return components.computeIfAbsent(key, builder);
  }

  public boolean contains(ComponentKey key) {
    return components.containsKey(key);
  }

  public int size() {
    return components.size();
  }
}
