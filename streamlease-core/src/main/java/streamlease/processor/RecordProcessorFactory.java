package streamlease.processor;

@FunctionalInterface
public interface RecordProcessorFactory {
  RecordProcessor newProcessor();
}
