package com.compareai.core.model;

import java.util.List;
import java.util.Map;

/**
 * What a blocking caller receives: every response gathered so far, and whether the wait gave up
 * before all backends reported.
 */
public record AggregatedResult(
    String requestId,
    Map<String, String> responses,
    Map<String, BackendMetadata> metadata,
    UserSession userInfo,
    List<BackendInfo> backendInfo,
    boolean timeout) {

  public static AggregatedResult from(RequestSnapshot snapshot, boolean timeout) {
    return new AggregatedResult(
        snapshot.id(),
        snapshot.responses(),
        snapshot.metadata(),
        snapshot.userInfo(),
        snapshot.backendInfo(),
        timeout);
  }
}
