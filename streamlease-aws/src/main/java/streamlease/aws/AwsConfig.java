package streamlease.aws;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.typesafe.config.Config;
import org.immutables.value.Value;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.awscore.client.builder.AwsClientBuilder;
import software.amazon.awssdk.regions.Region;
import streamlease.config.StreamLeaseConfig;

import java.net.URI;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Settings under {@code streamlease.aws}. Lease-table capacities are optional: when both are set the table is
 * created with provisioned throughput, otherwise it is billed per request.
 */
@Value.Immutable
@JsonDeserialize(as = ImmutableAwsConfig.class)
public interface AwsConfig {
  String PATH = StreamLeaseConfig.ROOT_PATH + ".aws";

  static ImmutableAwsConfig.Builder builder() {
    return ImmutableAwsConfig.builder();
  }

  static AwsConfig fromConfig(Config config) {
    return StreamLeaseConfig.configMapper().mapSubConfig(config, PATH, AwsConfig.class);
  }

  @Value.Default
  default String region() {
    return "us-east-1";
  }

  Optional<URI> endpointOverride();

  Optional<Long> leaseTableReadCapacity();

  Optional<Long> leaseTableWriteCapacity();

  default <BuilderT extends AwsClientBuilder<BuilderT, ClientT>, ClientT> BuilderT configure(BuilderT builder) {
    endpointOverride().ifPresent(builder::endpointOverride);
    return builder
            .region(Region.of(region()))
            .credentialsProvider(DefaultCredentialsProvider.create());
  }

  @Value.Check
  default void check() {
    checkArgument(leaseTableReadCapacity().isPresent() == leaseTableWriteCapacity().isPresent(),
            "leaseTableReadCapacity and leaseTableWriteCapacity must be configured together");
    checkArgument(leaseTableReadCapacity().orElse(1L) > 0 && leaseTableWriteCapacity().orElse(1L) > 0,
            "Lease table capacities must be positive");
  }
}
