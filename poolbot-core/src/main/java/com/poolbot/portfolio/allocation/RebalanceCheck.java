package com.poolbot.portfolio.allocation;

import java.util.List;

public record RebalanceCheck(boolean needed, List<String> reasons) {

  public RebalanceCheck {
    reasons = reasons == null ? List.of() : List.copyOf(reasons);
  }

  public static RebalanceCheck notNeeded() {
    return new RebalanceCheck(false, List.of());
  }
}
