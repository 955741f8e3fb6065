package org.hypertrace.alert.router.state.silence;

import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Getter;
import org.hypertrace.alert.router.state.Versioned;

/** A silence as held by the store, with the instant after which it is garbage collected. */
@Getter
@AllArgsConstructor
class SilenceEntry implements Versioned {
  private final Silence silence;
  private final Instant expiresAt;
  private final String origin;

  @Override
  public String getKey() {
    return silence.getId();
  }

  @Override
  public Instant getUpdatedAt() {
    return silence.getUpdatedAt();
  }
}
