package com.compareai.services.orchestration;

import com.compareai.core.model.BackendResult;

/**
 * Notified once per backend as soon as its result is recorded. Exceptions thrown here are logged
 * and ignored.
 */
@FunctionalInterface
public interface CompletionObserver {
  void onBackendCompleted(String requestId, String backendKey, BackendResult result);
}
