package org.hypertrace.alert.router.state.silence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.google.common.base.Preconditions;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.stream.Collectors;
import org.hypertrace.alert.router.datamodel.LabelMatcher;
import org.hypertrace.alert.router.datamodel.LabelMatcher.MatchType;
import org.hypertrace.alert.router.datamodel.json.ObjectMapperProvider;
import org.hypertrace.alert.router.state.ReplicatedStore;
import org.hypertrace.alert.router.state.VersionedRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Replicated set of silences keyed by id. A silence is kept until its end time plus the retention
 * window has passed.
 *
 * <p>Silences are indexed by the first equality matcher they carry so that matching an alert only
 * evaluates silences that can possibly select it. Silences without an equality matcher are always
 * evaluated.
 */
public class SilenceStore extends ReplicatedStore<SilenceEntry> {
  private static final Logger LOGGER = LoggerFactory.getLogger(SilenceStore.class);
  public static final String STATE_NAME = "silences";

  private final Duration retention;
  private final int maxSilences;
  private final ConcurrentMap<String, Set<String>> matcherIndex = new ConcurrentHashMap<>();
  private final Set<String> unindexed = ConcurrentHashMap.newKeySet();

  public SilenceStore(String peerName, Clock clock, Duration retention, int maxSilences) {
    super(STATE_NAME, peerName, clock);
    Preconditions.checkArgument(
        !retention.isNegative() && !retention.isZero(), "retention must be positive");
    this.retention = retention;
    this.maxSilences = maxSilences;
  }

  public Optional<Silence> get(String id) {
    SilenceEntry entry = entries.get(id);
    return entry == null ? Optional.empty() : Optional.of(entry.getSilence());
  }

  /**
   * Creates or updates a silence and returns its id. A silence without id is created. A silence
   * with an id is updated in place when only its time range changes in an allowed way; otherwise
   * a new silence is created and the previous one expired.
   */
  public synchronized String set(Silence silence) {
    Instant now = clock.instant();
    Silence candidate =
        silence.getStartsAt() == null ? silence.toBuilder().startsAt(now).build() : silence;
    validate(candidate);

    Silence previous = null;
    if (candidate.getId() != null) {
      previous =
          get(candidate.getId())
              .orElseThrow(() -> new SilenceNotFoundException(candidate.getId()));
      if (canUpdate(previous, candidate, now)) {
        Silence updated =
            candidate.toBuilder()
                .updatedAt(nextUpdateTimestamp(candidate.getId(), now))
                .build();
        applyLocal(toEntry(updated));
        LOGGER.info("Updated silence: {}", updated);
        return updated.getId();
      }
    }

    if (candidate.getEndsAt().isBefore(now)) {
      throw new InvalidSilenceException("end time must not be in the past");
    }
    if (maxSilences > 0) {
      int current = query(Set.of(SilenceState.ACTIVE, SilenceState.PENDING), Set.of()).size();
      if (current + 1 > maxSilences) {
        throw new SilenceLimitExceededException(current, maxSilences);
      }
    }

    Silence created =
        candidate.toBuilder()
            .id(UUID.randomUUID().toString())
            .startsAt(candidate.getStartsAt().isBefore(now) ? now : candidate.getStartsAt())
            .updatedAt(now)
            .build();
    if (previous != null && previous.getState(now) != SilenceState.EXPIRED) {
      // keeps the previous version around as history of the change
      expireSilence(previous, now);
    }
    applyLocal(toEntry(created));
    LOGGER.info("Created silence: {}", created);
    return created.getId();
  }

  /** Expires a silence now. Expiring an expired silence is a no-op. */
  public synchronized void expire(String id) {
    Silence silence = get(id).orElseThrow(() -> new SilenceNotFoundException(id));
    expireSilence(silence, clock.instant());
  }

  private void expireSilence(Silence silence, Instant now) {
    Silence.SilenceBuilder expired = silence.toBuilder();
    switch (silence.getState(now)) {
      case EXPIRED:
        return;
      case ACTIVE:
        expired.endsAt(now);
        break;
      case PENDING:
        expired.startsAt(now).endsAt(now);
        break;
      default:
        throw new IllegalStateException("Unknown silence state");
    }
    Silence result = expired.updatedAt(nextUpdateTimestamp(silence.getId(), now)).build();
    applyLocal(toEntry(result));
    LOGGER.info("Expired silence: {}", result.getId());
  }

  /** Silences in any of the given states restricted to the given ids. Empty filters select all. */
  public List<Silence> query(Set<SilenceState> states, Set<String> ids) {
    Instant now = clock.instant();
    return entries.values().stream()
        .map(SilenceEntry::getSilence)
        .filter(silence -> ids.isEmpty() || ids.contains(silence.getId()))
        .filter(silence -> states.isEmpty() || states.contains(silence.getState(now)))
        .sorted(Comparator.comparing(Silence::getStartsAt).thenComparing(Silence::getId))
        .collect(Collectors.toList());
  }

  /** Ids of the active silences muting the label set, sorted. */
  public List<String> mutedBy(Map<String, String> labels) {
    Instant now = clock.instant();
    Set<String> candidates = new HashSet<>(unindexed);
    labels.forEach(
        (name, value) -> {
          Set<String> ids = matcherIndex.get(indexKey(name, value));
          if (ids != null) {
            candidates.addAll(ids);
          }
        });
    List<String> muting = new ArrayList<>();
    for (String id : candidates) {
      SilenceEntry entry = entries.get(id);
      if (entry != null && entry.getSilence().mutes(labels, now)) {
        muting.add(id);
      }
    }
    muting.sort(Comparator.naturalOrder());
    return muting;
  }

  public boolean mutes(Map<String, String> labels) {
    return !mutedBy(labels).isEmpty();
  }

  @Override
  protected void onMerged(SilenceEntry previous, SilenceEntry current) {
    if (previous != null) {
      unindex(previous.getSilence());
    }
    Optional<String> key = indexKey(current.getSilence());
    if (key.isPresent()) {
      matcherIndex
          .computeIfAbsent(key.get(), k -> ConcurrentHashMap.newKeySet())
          .add(current.getKey());
    } else {
      unindexed.add(current.getKey());
    }
  }

  @Override
  protected void onRemoved(SilenceEntry removed) {
    unindex(removed.getSilence());
  }

  private void unindex(Silence silence) {
    Optional<String> key = indexKey(silence);
    if (key.isPresent()) {
      matcherIndex.computeIfPresent(
          key.get(),
          (k, ids) -> {
            ids.remove(silence.getId());
            return ids.isEmpty() ? null : ids;
          });
    } else {
      unindexed.remove(silence.getId());
    }
  }

  private static Optional<String> indexKey(Silence silence) {
    return silence.getMatchers().stream()
        .filter(matcher -> matcher.getType() == MatchType.EQUAL && !matcher.getValue().isEmpty())
        .findFirst()
        .map(matcher -> indexKey(matcher.getName(), matcher.getValue()));
  }

  private static String indexKey(String name, String value) {
    return name + "=" + value;
  }

  private SilenceEntry toEntry(Silence silence) {
    return new SilenceEntry(silence, silence.getEndsAt().plus(retention), getPeerName());
  }

  static void validate(Silence silence) {
    if (silence.getMatchers().isEmpty()) {
      throw new InvalidSilenceException("at least one matcher required");
    }
    if (silence.getMatchers().stream().allMatch(LabelMatcher::matchesEmpty)) {
      throw new InvalidSilenceException("at least one matcher must not match the empty string");
    }
    if (!silence.hasTimestamps()) {
      throw new InvalidSilenceException("start and end time must be set");
    }
    if (silence.getEndsAt().isBefore(silence.getStartsAt())) {
      throw new InvalidSilenceException("end time must not be before start time");
    }
  }

  static boolean canUpdate(Silence previous, Silence next, Instant now) {
    if (!previous.getMatchers().equals(next.getMatchers())) {
      return false;
    }
    switch (previous.getState(now)) {
      case ACTIVE:
        return previous
                .getStartsAt()
                .truncatedTo(ChronoUnit.SECONDS)
                .equals(next.getStartsAt().truncatedTo(ChronoUnit.SECONDS))
            && !next.getEndsAt().isBefore(now);
      case PENDING:
        return !next.getStartsAt().isBefore(now);
      default:
        return false;
    }
  }

  @Override
  protected VersionedRecord encode(SilenceEntry entry) {
    return VersionedRecord.builder()
        .key(entry.getKey())
        .payload(ObjectMapperProvider.get().valueToTree(entry.getSilence()))
        .updatedAt(entry.getUpdatedAt())
        .expiresAt(entry.getExpiresAt())
        .origin(entry.getOrigin())
        .build();
  }

  @Override
  protected SilenceEntry decode(VersionedRecord record) throws JsonProcessingException {
    Silence silence =
        ObjectMapperProvider.get()
            .treeToValue(record.getPayload(), Silence.class)
            .toBuilder()
            .updatedAt(record.getUpdatedAt())
            .build();
    Preconditions.checkArgument(
        record.getKey().equals(silence.getId()),
        "record key %s does not match silence id %s",
        record.getKey(),
        silence.getId());
    try {
      validate(silence);
    } catch (InvalidSilenceException e) {
      throw new IllegalArgumentException("Invalid silence " + silence.getId(), e);
    }
    return new SilenceEntry(silence, record.getExpiresAt(), record.getOrigin());
  }
}
