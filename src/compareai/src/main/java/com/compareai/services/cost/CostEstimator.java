package com.compareai.services.cost;

import com.compareai.core.model.Pricing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Estimates the USD cost of a response from its length.
 *
 * <p>Tokens are approximated as {@code length / 4} (integer division), which is a rough heuristic
 * and not real tokenization. The same token count is charged at both the input and the output
 * price, and the total is rounded to 6 decimal places.
 */
@Component
public class CostEstimator {
  private static final Logger logger = LoggerFactory.getLogger(CostEstimator.class);

  static final int CHARS_PER_TOKEN = 4;
  private static final int SCALE = 6;

  public int estimateTokens(String text) {
    return text == null ? 0 : text.length() / CHARS_PER_TOKEN;
  }

  /** Never throws; returns {@code 0.0} when the cost cannot be computed. */
  public double estimate(Pricing pricing, String responseText) {
    try {
      int tokens = estimateTokens(responseText);
      double thousands = tokens / 1000.0;
      double cost = thousands * pricing.inputPerK() + thousands * pricing.outputPerK();
      if (Double.isNaN(cost) || Double.isInfinite(cost)) return 0.0;
      return BigDecimal.valueOf(cost).setScale(SCALE, RoundingMode.HALF_EVEN).doubleValue();
    } catch (RuntimeException e) {
      logger.debug("Could not estimate cost, reporting 0", e);
      return 0.0;
    }
  }
}
