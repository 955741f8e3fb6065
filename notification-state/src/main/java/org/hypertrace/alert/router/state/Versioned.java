package org.hypertrace.alert.router.state;

import java.time.Instant;

/** A replicated value: one per key, ordered by its update timestamp. */
public interface Versioned {
  String getKey();

  Instant getUpdatedAt();

  /** After this instant the value is garbage and is neither kept nor accepted from peers. */
  Instant getExpiresAt();

  /** Name of the peer that produced this version. */
  String getOrigin();
}
