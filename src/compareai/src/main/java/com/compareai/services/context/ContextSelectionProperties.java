package com.compareai.services.context;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Tunable thresholds of the context window policy.
 *
 * <pre>
 * context:
 *   recent-window: 12
 *   selected-window: 6
 *   important-phrases: ["my name is", "call me"]
 * </pre>
 */
@Component
@ConfigurationProperties(prefix = "context")
public class ContextSelectionProperties {

  /** How many of the latest history messages are considered at all. */
  private int recentWindow = 12;

  /** How many of the filtered recent messages are forwarded. */
  private int selectedWindow = 6;

  /** Case-insensitive cues marking a user message as a self-introduction worth keeping. */
  private List<String> importantPhrases = new ArrayList<>(List.of(
      "my name is",
      "my name's",
      "call me",
      "i am called",
      "me llamo",
      "mi nombre es"
  ));

  public int getRecentWindow() {
    return recentWindow;
  }

  public void setRecentWindow(int recentWindow) {
    this.recentWindow = recentWindow;
  }

  public int getSelectedWindow() {
    return selectedWindow;
  }

  public void setSelectedWindow(int selectedWindow) {
    this.selectedWindow = selectedWindow;
  }

  public List<String> getImportantPhrases() {
    return importantPhrases;
  }

  public void setImportantPhrases(List<String> importantPhrases) {
    this.importantPhrases = importantPhrases;
  }
}
