package org.hypertrace.alert.router.notification.inhibit;

import com.google.common.collect.ImmutableList;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.hypertrace.alert.router.datamodel.Alert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Evaluates the configured inhibition rules against the alerts seen so far. */
public class Inhibitor {
  private static final Logger LOGGER = LoggerFactory.getLogger(Inhibitor.class);

  private final List<InhibitRule> rules;
  private final Clock clock;

  public Inhibitor(List<InhibitRule> rules, Clock clock) {
    this.rules = ImmutableList.copyOf(rules);
    this.clock = clock;
  }

  /** Feeds the latest version of an alert. */
  public void observe(Alert alert) {
    rules.forEach(rule -> rule.observe(alert));
  }

  /** The fingerprint of the alert inhibiting the label set, if any. */
  public Optional<Long> inhibitedBy(Map<String, String> labels) {
    Instant now = clock.instant();
    for (InhibitRule rule : rules) {
      if (!rule.matchesTarget(labels)) {
        continue;
      }
      Optional<Long> inhibitor = rule.findInhibitor(labels, now);
      if (inhibitor.isPresent()) {
        return inhibitor;
      }
    }
    return Optional.empty();
  }

  public int gc() {
    Instant now = clock.instant();
    int removed = rules.stream().mapToInt(rule -> rule.gc(now)).sum();
    if (removed > 0) {
      LOGGER.debug("Removed {} resolved alerts from the inhibition cache", removed);
    }
    return removed;
  }
}
