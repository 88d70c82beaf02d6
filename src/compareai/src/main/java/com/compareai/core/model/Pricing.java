package com.compareai.core.model;

/** USD price per thousand tokens, for input and output respectively. */
public record Pricing(double inputPerK, double outputPerK) {
  public static final Pricing FREE = new Pricing(0.0, 0.0);
}
