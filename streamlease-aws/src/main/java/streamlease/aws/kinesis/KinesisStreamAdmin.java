package streamlease.aws.kinesis;

import com.google.common.collect.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.kinesis.KinesisClient;
import software.amazon.awssdk.services.kinesis.model.CreateStreamRequest;
import software.amazon.awssdk.services.kinesis.model.DeleteStreamRequest;
import software.amazon.awssdk.services.kinesis.model.DescribeStreamSummaryRequest;
import software.amazon.awssdk.services.kinesis.model.ListStreamsRequest;
import software.amazon.awssdk.services.kinesis.model.ListStreamsResponse;
import software.amazon.awssdk.services.kinesis.model.ResourceInUseException;
import software.amazon.awssdk.services.kinesis.model.ResourceNotFoundException;
import streamlease.exceptions.StreamLeaseException;
import streamlease.model.StreamStatus;
import streamlease.spi.StreamAdmin;

import javax.inject.Inject;
import java.util.List;

public class KinesisStreamAdmin implements StreamAdmin {
  private static final Logger LOG = LoggerFactory.getLogger(KinesisStreamAdmin.class);
  private static final int LIST_STREAMS_PAGE_SIZE = 10;

  private final KinesisClient client;

  @Inject
  public KinesisStreamAdmin(KinesisClient client) {
    this.client = client;
  }

  @Override
  public StreamStatus describeStream(String streamName) {
    DescribeStreamSummaryRequest request = DescribeStreamSummaryRequest.builder().streamName(streamName).build();
    var status = KinesisExceptions.call("DescribeStreamSummary for " + streamName,
            () -> client.describeStreamSummary(request)).streamDescriptionSummary().streamStatus();
    switch (status) {
      case CREATING:
        return StreamStatus.CREATING;
      case ACTIVE:
        return StreamStatus.ACTIVE;
      case UPDATING:
        return StreamStatus.UPDATING;
      case DELETING:
        return StreamStatus.DELETING;
      default:
        throw new StreamLeaseException("Unrecognized status for stream " + streamName + ": " + status);
    }
  }

  @Override
  public void createStream(String streamName, int shardCount) {
    CreateStreamRequest request = CreateStreamRequest.builder().streamName(streamName).shardCount(shardCount).build();
    try {
      client.createStream(request);
    } catch (ResourceInUseException e) {
      LOG.info("Stream {} already exists", streamName);
    } catch (SdkException e) {
      throw KinesisExceptions.translate("CreateStream " + streamName, e);
    }
  }

  @Override
  public boolean deleteStream(String streamName) {
    try {
      client.deleteStream(DeleteStreamRequest.builder().streamName(streamName).build());
      return true;
    } catch (ResourceNotFoundException e) {
      return false;
    } catch (SdkException e) {
      throw KinesisExceptions.translate("DeleteStream " + streamName, e);
    }
  }

  @Override
  public List<String> listStreamNames() {
    ImmutableList.Builder<String> names = ImmutableList.builder();
    String lastStreamName = null;
    ListStreamsResponse response;
    do {
      ListStreamsRequest request = ListStreamsRequest.builder()
              .limit(LIST_STREAMS_PAGE_SIZE)
              .exclusiveStartStreamName(lastStreamName)
              .build();
      response = KinesisExceptions.call("ListStreams", () -> client.listStreams(request));
      names.addAll(response.streamNames());
      if (!response.streamNames().isEmpty()) {
        lastStreamName = response.streamNames().get(response.streamNames().size() - 1);
      }
    } while (Boolean.TRUE.equals(response.hasMoreStreams()) && !response.streamNames().isEmpty());
    return names.build();
  }
}
