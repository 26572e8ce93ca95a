package com.mk.fx.qa.chatflow.execution.sink;

import com.mk.fx.qa.chatflow.execution.model.ExportScope;
import com.mk.fx.qa.chatflow.execution.model.ResultRecord;
import java.util.List;

/**
 * Durable, append-only store of result records, one stream per run.
 *
 * <p>A record passed to {@link #append} is durable when the call returns. Reads go through a path
 * independent of the writer, so records written before a crash or a stop stay readable.
 */
public interface ResultSink {

  /**
   * Starts a new result stream and makes it the target of {@link #append}. Any previously open
   * stream is closed.
   *
   * @throws ResultSinkException if the stream cannot be created
   */
  void open(String runId);

  /**
   * Appends one record to the open stream.
   *
   * @throws ResultSinkException if no stream is open or the write fails
   */
  void append(ResultRecord record);

  /** Closes the open stream, if any. Further appends fail until the next {@link #open}. */
  void close();

  /**
   * Reads every complete record of a run, in write order.
   *
   * @throws IllegalArgumentException if the run id is malformed
   * @throws ResultSinkException if the run does not exist or cannot be read
   */
  List<ResultRecord> read(String runId);

  /** Known run ids, oldest first. */
  List<String> runIds();

  default List<ResultRecord> export(String runId, ExportScope scope) {
    return read(runId).stream().filter(scope::includes).toList();
  }
}
