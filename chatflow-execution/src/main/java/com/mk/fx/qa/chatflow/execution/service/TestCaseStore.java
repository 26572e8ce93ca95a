package com.mk.fx.qa.chatflow.execution.service;

import com.mk.fx.qa.chatflow.execution.dto.TestCaseRow;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** In-memory holder of the uploaded test-case rows, replaced as a whole on each upload. */
@Slf4j
@Component
public class TestCaseStore {

  private final AtomicReference<List<TestCaseRow>> rows = new AtomicReference<>(List.of());

  public void replace(List<TestCaseRow> newRows) {
    rows.set(Collections.unmodifiableList(new ArrayList<>(newRows)));
    log.info("Stored {} test case row(s)", newRows.size());
  }

  public List<TestCaseRow> getAll() {
    return rows.get();
  }

  public int size() {
    return rows.get().size();
  }

  public void clear() {
    rows.set(List.of());
    log.info("Cleared uploaded test cases");
  }
}
