package streamlease.aws.dynamodb;

import com.google.common.collect.ImmutableMap;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import streamlease.exceptions.LeaseStoreSchemaException;
import streamlease.model.Checkpoint;
import streamlease.model.Lease;
import streamlease.model.ShardId;
import streamlease.model.WorkerId;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Attribute layout of a lease-table item.
 */
final class LeaseItems {
  static final String LEASE_KEY = "leaseKey";
  static final String LEASE_OWNER = "leaseOwner";
  static final String LEASE_COUNTER = "leaseCounter";
  static final String LEASE_EXPIRES_AT = "leaseExpiresAt";
  static final String CHECKPOINT = "checkpoint";
  static final String PARENT_SHARD_IDS = "parentShardIds";

  private static final Map<String, String> NAMES = ImmutableMap.<String, String>builder()
          .put("#key", LEASE_KEY)
          .put("#owner", LEASE_OWNER)
          .put("#counter", LEASE_COUNTER)
          .put("#expiresAt", LEASE_EXPIRES_AT)
          .put("#checkpoint", CHECKPOINT)
          .build();

  private LeaseItems() {
  }

  /**
   * Expression attribute names for the given placeholders. DynamoDB rejects requests that define names their
   * expressions do not use, so each request names only what it references.
   */
  static Map<String, String> names(String... placeholders) {
    ImmutableMap.Builder<String, String> names = ImmutableMap.builder();
    for (String placeholder : placeholders) {
      names.put(placeholder, NAMES.get(placeholder));
    }
    return names.build();
  }

  static Map<String, AttributeValue> key(ShardId shardId) {
    return Map.of(LEASE_KEY, s(shardId.id()));
  }

  static Map<String, AttributeValue> toItem(Lease lease) {
    ImmutableMap.Builder<String, AttributeValue> item = ImmutableMap.<String, AttributeValue>builder()
            .put(LEASE_KEY, s(lease.shardId().id()))
            .put(LEASE_COUNTER, n(lease.counter()))
            .put(LEASE_EXPIRES_AT, n(lease.expiresAt().toEpochMilli()));
    lease.owner().ifPresent(owner -> item.put(LEASE_OWNER, s(owner.id())));
    lease.checkpoint().ifPresent(checkpoint -> item.put(CHECKPOINT, s(checkpoint.toString())));
    // string sets may not be empty
    if (!lease.parentShardIds().isEmpty()) {
      item.put(PARENT_SHARD_IDS, AttributeValue.builder()
              .ss(lease.parentShardIds().stream().map(ShardId::id).sorted().collect(Collectors.toList()))
              .build());
    }
    return item.build();
  }

  static Lease fromItem(Map<String, AttributeValue> item) {
    try {
      return Lease.builder()
              .shardId(ShardId.of(required(item, LEASE_KEY).s()))
              .owner(Optional.ofNullable(item.get(LEASE_OWNER)).map(AttributeValue::s).map(WorkerId::of))
              .counter(Long.parseLong(required(item, LEASE_COUNTER).n()))
              .expiresAt(Instant.ofEpochMilli(Long.parseLong(required(item, LEASE_EXPIRES_AT).n())))
              .checkpoint(Optional.ofNullable(item.get(CHECKPOINT)).map(AttributeValue::s).map(Checkpoint::parse))
              .parentShardIds(Optional.ofNullable(item.get(PARENT_SHARD_IDS))
                      .map(parents -> parents.ss().stream().map(ShardId::of).collect(Collectors.toSet()))
                      .orElse(Set.of()))
              .build();
    } catch (RuntimeException e) {
      throw new LeaseStoreSchemaException("Malformed lease item: " + item, e);
    }
  }

  static AttributeValue s(String value) {
    return AttributeValue.builder().s(value).build();
  }

  static AttributeValue n(long value) {
    return AttributeValue.builder().n(Long.toString(value)).build();
  }

  private static AttributeValue required(Map<String, AttributeValue> item, String attribute) {
    AttributeValue value = item.get(attribute);
    if (value == null) throw new IllegalArgumentException("missing attribute " + attribute);
    return value;
  }
}
