package io.intellixity.pivot.examples.service;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.pivot.exec.CancellationSignal;
import io.intellixity.pivot.exec.ExecutionContext;
import io.intellixity.pivot.plan.PivotPlan;
import io.intellixity.pivot.run.PivotQueryRunner;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.OutputStream;
import java.util.Map;

@Service
public final class PivotService {
  private final PivotQueryRunner runner;
  private final ObjectMapper json;

  public PivotService(PivotQueryRunner runner, ObjectMapper json) {
    this.runner = runner;
    this.json = json;
  }

  /** Validates and plans; nothing is executed yet. */
  public PivotPlan plan(Map<String, Object> rawRequest) {
    return runner.plan(rawRequest);
  }

  public void stream(PivotPlan plan, Map<String, Object> info, CancellationSignal cancellation, OutputStream out)
      throws IOException {
    try (JsonGenerator gen = json.createGenerator(out)) {
      runner.execute(plan, new ExecutionContext(cancellation, info), schema -> new JsonRowWriter(gen, schema));
    }
  }
}
