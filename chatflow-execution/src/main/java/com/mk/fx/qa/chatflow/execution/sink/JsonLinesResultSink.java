package com.mk.fx.qa.chatflow.execution.sink;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.mk.fx.qa.chatflow.execution.cfg.ExecutionCfg;
import com.mk.fx.qa.chatflow.execution.model.ResultRecord;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Stores each run as a JSON Lines file ({@code <runId>.jsonl}) under the configured results
 * directory.
 *
 * <p>Every append writes one complete line and forces it to disk before returning. A crash can only
 * leave a partial last line without its terminating newline; {@link #read} ignores such a line, so
 * readers never see a torn record.
 */
@Slf4j
@Component
public class JsonLinesResultSink implements ResultSink {

  static final String FILE_SUFFIX = ".jsonl";
  private static final Pattern RUN_ID = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]*");
  private static final byte NEWLINE = '\n';

  private final Path directory;
  private final ObjectWriter writer;
  private final ObjectReader reader;
  private final Object writeLock = new Object();

  private FileChannel channel;
  private String openRunId;

  @Autowired
  public JsonLinesResultSink(ObjectMapper objectMapper, ExecutionCfg cfg) {
    this(objectMapper, Path.of(cfg.getResultsDir()));
  }

  public JsonLinesResultSink(ObjectMapper objectMapper, Path directory) {
    this.directory = directory;
    this.writer =
        objectMapper.writerFor(ResultRecord.class).without(SerializationFeature.INDENT_OUTPUT);
    this.reader = objectMapper.readerFor(ResultRecord.class);
  }

  @Override
  public void open(String runId) {
    var file = fileFor(runId);
    synchronized (writeLock) {
      closeQuietly();
      try {
        Files.createDirectories(directory);
        channel =
            FileChannel.open(
                file,
                StandardOpenOption.CREATE_NEW,
                StandardOpenOption.WRITE,
                StandardOpenOption.APPEND);
        openRunId = runId;
        log.info("Writing results of run {} to {}", runId, file.toAbsolutePath());
      } catch (IOException e) {
        throw new ResultSinkException(
            "Cannot create result file " + file + ": " + e.getMessage(), e);
      }
    }
  }

  @Override
  public void append(ResultRecord record) {
    byte[] line;
    try {
      var json = writer.writeValueAsBytes(record);
      line = new byte[json.length + 1];
      System.arraycopy(json, 0, line, 0, json.length);
      line[json.length] = NEWLINE;
    } catch (JsonProcessingException e) {
      throw new ResultSinkException("Cannot serialise result record: " + e.getOriginalMessage(), e);
    }

    synchronized (writeLock) {
      if (channel == null) {
        throw new ResultSinkException("No result file is open");
      }
      try {
        var buffer = ByteBuffer.wrap(line);
        while (buffer.hasRemaining()) {
          channel.write(buffer);
        }
        channel.force(false);
      } catch (IOException e) {
        throw new ResultSinkException(
            "Cannot append to result file of run " + openRunId + ": " + e.getMessage(), e);
      }
    }
  }

  @Override
  public void close() {
    synchronized (writeLock) {
      if (channel == null) {
        return;
      }
      try {
        channel.close();
        log.debug("Closed result file of run {}", openRunId);
      } catch (IOException e) {
        throw new ResultSinkException(
            "Cannot close result file of run " + openRunId + ": " + e.getMessage(), e);
      } finally {
        channel = null;
        openRunId = null;
      }
    }
  }

  @PreDestroy
  void onShutdown() {
    close();
  }

  @Override
  public List<ResultRecord> read(String runId) {
    var file = fileFor(runId);
    if (!Files.isRegularFile(file)) {
      throw new ResultSinkException("No results stored for run " + runId);
    }
    byte[] content;
    try {
      content = Files.readAllBytes(file);
    } catch (IOException e) {
      throw new ResultSinkException(
          "Cannot read results of run " + runId + ": " + e.getMessage(), e);
    }

    // the tail after the last newline may end inside a multi-byte character, so cut before decoding
    List<ResultRecord> records = new ArrayList<>();
    var end = lastNewline(content);
    if (end < content.length - 1) {
      log.warn("Ignoring unterminated trailing line in results of run {}", runId);
    }
    if (end < 0) {
      return records;
    }
    var complete = new String(content, 0, end, StandardCharsets.UTF_8);
    var lineNumber = 0;
    for (String line : complete.split("\n", -1)) {
      lineNumber++;
      if (line.isBlank()) {
        continue;
      }
      try {
        records.add(reader.readValue(line));
      } catch (IOException e) {
        log.warn(
            "Skipping unreadable line {} in results of run {}: {}", lineNumber, runId, e.getMessage());
      }
    }
    return records;
  }

  private static int lastNewline(byte[] content) {
    for (int i = content.length - 1; i >= 0; i--) {
      if (content[i] == NEWLINE) {
        return i;
      }
    }
    return -1;
  }

  @Override
  public List<String> runIds() {
    if (!Files.isDirectory(directory)) {
      return List.of();
    }
    try (Stream<Path> files = Files.list(directory)) {
      return files
          .map(path -> path.getFileName().toString())
          .filter(name -> name.endsWith(FILE_SUFFIX))
          .map(name -> name.substring(0, name.length() - FILE_SUFFIX.length()))
          .sorted()
          .toList();
    } catch (IOException e) {
      throw new ResultSinkException("Cannot list results directory " + directory, e);
    }
  }

  private Path fileFor(String runId) {
    if (runId == null || !RUN_ID.matcher(runId).matches()) {
      throw new IllegalArgumentException("Invalid run id: " + runId);
    }
    return directory.resolve(runId + FILE_SUFFIX);
  }

  private void closeQuietly() {
    if (channel == null) {
      return;
    }
    try {
      channel.close();
    } catch (IOException e) {
      log.warn("Failed to close result file of run {}: {}", openRunId, e.getMessage());
    } finally {
      channel = null;
      openRunId = null;
    }
  }
}
