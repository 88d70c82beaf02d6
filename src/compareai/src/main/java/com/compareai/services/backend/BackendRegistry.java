package com.compareai.services.backend;

import com.compareai.core.api.Backend;
import com.compareai.core.api.BackendAdapter;
import com.compareai.core.model.BackendInfo;
import com.compareai.core.model.Pricing;
import com.compareai.exception.CompareAiException;
import com.compareai.exception.NotFoundException;
import com.compareai.exception.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Catalog of backends, resolved once from {@link ProviderProperties} at startup.
 *
 * <p>A backend whose adapter cannot be built (for example because its API key is missing) is still
 * listed, with zero prices and {@code available=false}, but cannot be selected.
 */
@Component
public class BackendRegistry {
  private static final Logger LOGGER = LoggerFactory.getLogger(BackendRegistry.class);

  private final Map<String, BackendInfo> catalog;
  private final Map<String, Backend> available;

  @Autowired
  public BackendRegistry(ProviderProperties properties, ChatModelFactory chatModelFactory) {
    Map<String, BackendInfo> infos = new LinkedHashMap<>();
    Map<String, Backend> backends = new LinkedHashMap<>();
    Map<String, ProviderProperties.ProviderSettings> configured =
        properties.getProviders() == null ? Map.of() : properties.getProviders();

    configured.forEach((key, settings) -> {
      if (settings == null || !settings.isEnabled()) {
        LOGGER.info("Backend '{}' is disabled", key);
        return;
      }
      BackendKind kind = BackendKind.fromId(settings.getKind());
      try {
        BackendAdapter adapter = new LangChain4jBackendAdapter(
            chatModelFactory.create(kind, settings), properties.getSystemPrompt(), settings.getModelName());
        BackendInfo info = describe(key, kind, settings, true);
        infos.put(key, info);
        backends.put(key, new Backend(info, adapter));
        LOGGER.info("Registered backend '{}' (kind={}, model={})", key, kind.id(), settings.getModelName());
      } catch (CompareAiException | IllegalArgumentException e) {
        LOGGER.warn("Backend '{}' unavailable: {}", key, e.getMessage());
        infos.put(key, describe(key, kind, settings, false));
      }
    });

    this.catalog = Collections.unmodifiableMap(infos);
    this.available = Collections.unmodifiableMap(backends);
  }

  /** Registry over prebuilt backends; used when adapters are supplied directly. */
  public BackendRegistry(Collection<Backend> backends) {
    Map<String, BackendInfo> infos = new LinkedHashMap<>();
    Map<String, Backend> byKey = new LinkedHashMap<>();
    for (Backend backend : backends) {
      infos.put(backend.key(), backend.info());
      byKey.put(backend.key(), backend);
    }
    this.catalog = Collections.unmodifiableMap(infos);
    this.available = Collections.unmodifiableMap(byKey);
  }

  /** Every configured backend, available or not, in configuration order. */
  public List<BackendInfo> listBackends() {
    return List.copyOf(catalog.values());
  }

  public List<BackendInfo> listAvailable() {
    return available.values().stream().map(Backend::info).toList();
  }

  /**
   * Resolves the requested keys, preserving their order.
   *
   * @throws ValidationException for an empty selection or a repeated key
   * @throws NotFoundException for a key that is unknown or unavailable
   */
  public List<Backend> resolve(List<String> keys) {
    if (keys == null || keys.isEmpty()) {
      throw new ValidationException("Select at least one backend");
    }
    Set<String> distinct = new LinkedHashSet<>();
    for (String key : keys) {
      if (!distinct.add(Objects.requireNonNull(key, "backend key"))) {
        throw new ValidationException("Backend selected more than once: " + key);
      }
    }
    List<Backend> resolved = new ArrayList<>(distinct.size());
    for (String key : distinct) {
      Backend backend = available.get(key);
      if (backend == null) {
        throw new NotFoundException(catalog.containsKey(key)
            ? "Backend not available: " + key
            : "Unknown backend: " + key, Map.of("backend", key));
      }
      resolved.add(backend);
    }
    return resolved;
  }

  private static BackendInfo describe(String key, BackendKind kind, ProviderProperties.ProviderSettings s, boolean ok) {
    Pricing pricing = ok ? new Pricing(s.getInputPricePerK(), s.getOutputPricePerK()) : Pricing.FREE;
    return new BackendInfo(
        key,
        kind.id(),
        s.getDisplayName() != null ? s.getDisplayName() : kind.defaultDisplayName(),
        s.getDescription() != null ? s.getDescription() : kind.defaultDescription(),
        s.getModelName(),
        pricing,
        ok);
  }
}
