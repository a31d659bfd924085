package dev.evalforge.evaluation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.evalforge.BaseIntegrationTest;
import dev.evalforge.analysis.InputSchema;
import dev.evalforge.analysis.OutputSchema;
import dev.evalforge.analysis.PromptAnalysis;
import dev.evalforge.analysis.TaskType;
import dev.evalforge.pipeline.PromptAnalyzer;
import dev.evalforge.pipeline.TestCaseGenerator;
import dev.evalforge.testcase.TestCase;
import dev.evalforge.testcase.TestCaseCategory;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;

/**
 * Runs the whole pipeline against PostgreSQL with an analyzer and generator only, so execution
 * is simulated and error analysis falls back to heuristics.
 */
class EvaluationPipelineIT extends BaseIntegrationTest {

  @TestConfiguration
  static class StubCollaborators {

    @Bean
    PromptAnalyzer promptAnalyzer() {
      return (prompt, examples) ->
          new PromptAnalysis(
              prompt,
              TaskType.CLASSIFICATION,
              InputSchema.empty(),
              OutputSchema.classification(List.of("positive", "negative")),
              List.of(),
              examples,
              0.9);
    }

    @Bean
    TestCaseGenerator testCaseGenerator() {
      return (analysis, options) -> {
        List<TestCase> cases = new ArrayList<>();
        for (int i = 0; i < options.normalCases(); i++) {
          cases.add(
              new TestCase(
                  "normal_" + i,
                  TestCaseCategory.NORMAL,
                  Map.of("text", "review " + i),
                  Map.of("class", i % 2 == 0 ? "positive" : "negative")));
        }
        for (int i = 0; i < options.edgeCases(); i++) {
          cases.add(
              new TestCase(
                  "edge_" + i, TestCaseCategory.EDGE_CASE, Map.of("text", ""),
                  Map.of("class", "negative")));
        }
        return cases;
      };
    }
  }

  @Autowired private EvaluationOrchestrator orchestrator;

  @Test
  void simulated_run_persists_every_artifact() {
    Evaluation created =
        orchestrator.createEvaluation(
            501L, "Classify the sentiment of the review", EvaluationOptions.named("IT run", null));

    EvaluationDetails run = orchestrator.runEvaluation(created.getId());
    EvaluationDetails reloaded = orchestrator.getEvaluation(created.getId());

    assertThat(run.evaluation().getStatus()).isEqualTo(EvaluationStatus.COMPLETED);
    assertThat(reloaded.evaluation().getStatus()).isEqualTo(EvaluationStatus.COMPLETED);
    assertThat(reloaded.evaluation().getProgress()).isEqualTo(100.0);
    assertThat(reloaded.evaluation().getErrorAnalysis()).isNotNull();
    assertThat(reloaded.testCases()).hasSize(run.testCases().size());
    assertThat(reloaded.testCases()).allMatch(TestCase::isSimulated);
    assertThat(reloaded.findMetrics())
        .hasValueSatisfying(
            metrics -> {
              assertThat(metrics.isSimulated()).isTrue();
              assertThat(metrics.getClassificationMetrics()).isNotNull();
              assertThat(metrics.getTestCasesTotal()).isEqualTo(run.testCases().size());
            });
    assertThat(reloaded.suggestions()).isEmpty();
  }

  @Test
  void completed_run_cannot_be_claimed_again() {
    Evaluation created = orchestrator.createEvaluation(502L, "Classify the sentiment", null);
    orchestrator.runEvaluation(created.getId());

    assertThatThrownBy(() -> orchestrator.runEvaluation(created.getId()))
        .isInstanceOf(EvaluationStateException.class);
  }

  @Test
  void listing_pages_newest_first_and_filters_status() {
    Evaluation older = orchestrator.createEvaluation(503L, "First prompt", null);
    Evaluation newer = orchestrator.createEvaluation(503L, "Second prompt", null);
    orchestrator.runEvaluation(older.getId());

    assertThat(orchestrator.listEvaluations(503L, ListOptions.firstPage(1)))
        .extracting(Evaluation::getId)
        .containsExactly(newer.getId());
    assertThat(
            orchestrator.listEvaluations(
                503L, new ListOptions(0, 0, EvaluationStatus.COMPLETED, false)))
        .extracting(Evaluation::getId)
        .containsExactly(older.getId());
  }

  @Test
  void delete_removes_evaluation_and_artifacts() {
    Evaluation created = orchestrator.createEvaluation(504L, "Classify the sentiment", null);
    orchestrator.runEvaluation(created.getId());

    orchestrator.deleteEvaluation(created.getId());

    assertThatThrownBy(() -> orchestrator.getEvaluation(created.getId()))
        .isInstanceOf(EvaluationNotFoundException.class);
    assertThat(orchestrator.listEvaluations(504L, ListOptions.firstPage(10))).isEmpty();
  }
}
