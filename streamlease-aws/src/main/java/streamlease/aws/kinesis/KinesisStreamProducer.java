package streamlease.aws.kinesis;

import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.services.kinesis.KinesisClient;
import software.amazon.awssdk.services.kinesis.model.PutRecordRequest;
import software.amazon.awssdk.services.kinesis.model.PutRecordResponse;
import streamlease.model.PutResult;
import streamlease.model.SequenceNumber;
import streamlease.model.ShardId;
import streamlease.spi.StreamProducer;

public class KinesisStreamProducer implements StreamProducer {
  private final KinesisClient client;
  private final String streamName;

  public KinesisStreamProducer(KinesisClient client, String streamName) {
    this.client = client;
    this.streamName = streamName;
  }

  @Override
  public PutResult put(String partitionKey, byte[] data) {
    PutRecordRequest request = PutRecordRequest.builder()
            .streamName(streamName)
            .partitionKey(partitionKey)
            .data(SdkBytes.fromByteArray(data))
            .build();
    PutRecordResponse response = KinesisExceptions.call("PutRecord to " + streamName, () -> client.putRecord(request));
    return PutResult.of(ShardId.of(response.shardId()), SequenceNumber.of(response.sequenceNumber()));
  }
}
