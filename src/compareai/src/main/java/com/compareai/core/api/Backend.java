package com.compareai.core.api;

import com.compareai.core.model.BackendInfo;
import java.util.Objects;

/** A selectable backend: its descriptive info paired with the adapter that calls it. */
public record Backend(BackendInfo info, BackendAdapter adapter) {
  public Backend {
    Objects.requireNonNull(info, "info");
    Objects.requireNonNull(adapter, "adapter");
  }

  public String key() {
    return info.key();
  }
}
