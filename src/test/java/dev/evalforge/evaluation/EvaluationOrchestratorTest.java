package dev.evalforge.evaluation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.evalforge.analysis.ErrorAnalysis;
import dev.evalforge.analysis.InputSchema;
import dev.evalforge.analysis.OutputSchema;
import dev.evalforge.analysis.PromptAnalysis;
import dev.evalforge.analysis.TaskType;
import dev.evalforge.fixture.EvaluationBuilder;
import dev.evalforge.fixture.InMemoryEvaluationStore;
import dev.evalforge.fixture.TestCaseBuilder;
import dev.evalforge.metrics.EvaluationMetrics;
import dev.evalforge.metrics.MetricsCalculator;
import dev.evalforge.pipeline.ErrorAnalyzer;
import dev.evalforge.pipeline.PromptAnalyzer;
import dev.evalforge.pipeline.PromptOptimizer;
import dev.evalforge.pipeline.TestCaseGenerator;
import dev.evalforge.pipeline.TestExecutor;
import dev.evalforge.suggestion.OptimizationSuggestion;
import dev.evalforge.suggestion.SuggestionType;
import dev.evalforge.testcase.TestCase;
import dev.evalforge.testcase.TestCaseCategory;
import dev.evalforge.testcase.TestCaseStatus;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

class EvaluationOrchestratorTest {

  private static final Clock CLOCK =
      Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC);

  private static final PromptAnalysis SENTIMENT =
      new PromptAnalysis(
          "Classify the sentiment",
          TaskType.CLASSIFICATION,
          InputSchema.empty(),
          OutputSchema.classification(List.of("positive", "negative")),
          List.of(),
          List.of(),
          0.95);

  private final PromptAnalyzer analyzer = (prompt, examples) -> SENTIMENT;

  private final TestCaseGenerator generator =
      (analysis, options) -> {
        List<TestCase> cases = new ArrayList<>();
        cases.add(new TestCaseBuilder().id(null).name("normal_1").expected("class", "positive")
            .build());
        cases.add(new TestCaseBuilder().id(null).name("normal_2").expected("class", "negative")
            .build());
        cases.add(new TestCaseBuilder().id(null).name("edge_1")
            .category(TestCaseCategory.EDGE_CASE).expected("class", "negative").build());
        return cases;
      };

  private final TestExecutor echoExecutor =
      (cases, prompt, options) -> {
        for (TestCase testCase : cases) {
          testCase.recordResult(
              testCase.getExpectedOutput(), TestCaseStatus.PASSED, 1.0, CLOCK.instant());
        }
        return cases;
      };

  private final ErrorAnalyzer errorAnalyzer =
      (cases, analysis) ->
          new ErrorAnalysis(
              List.of("none"), Map.of(), 0.0, 0.0, 0.0, 0.0, Map.of(), CLOCK.instant());

  private final PromptOptimizer optimizer =
      (prompt, metrics, errors) ->
          List.of(
              new OptimizationSuggestion(
                  SuggestionType.CLARITY, "Name the labels", prompt, prompt + " Use lowercase."));

  private InMemoryEvaluationStore store;
  private PipelineProperties properties;
  private ThreadPoolTaskExecutor stageExecutor;
  private ThreadPoolTaskExecutor runExecutor;

  @BeforeEach
  void setUp() {
    store = new InMemoryEvaluationStore();
    properties = new PipelineProperties();
    properties.setExecutionTimeout(Duration.ofSeconds(5));
    stageExecutor = executor("test-stage-");
    runExecutor = executor("test-run-");
  }

  @AfterEach
  void tearDown() {
    stageExecutor.shutdown();
    runExecutor.shutdown();
  }

  private static ThreadPoolTaskExecutor executor(String prefix) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(4);
    executor.setMaxPoolSize(4);
    executor.setThreadNamePrefix(prefix);
    executor.initialize();
    return executor;
  }

  private EvaluationOrchestrator orchestrator(PipelineCollaborators collaborators) {
    return orchestrator(store, collaborators, new MetricsCalculator(CLOCK));
  }

  private EvaluationOrchestrator orchestrator(
      EvaluationStore evaluationStore,
      PipelineCollaborators collaborators,
      MetricsCalculator calculator) {
    return new EvaluationOrchestrator(
        evaluationStore,
        calculator,
        collaborators,
        new SimulatedExecutionPolicy(42L, CLOCK),
        properties,
        stageExecutor,
        runExecutor,
        CLOCK);
  }

  private PipelineCollaborators all() {
    return new PipelineCollaborators(analyzer, generator, echoExecutor, errorAnalyzer, optimizer);
  }

  private Evaluation pending() {
    return store.add(new EvaluationBuilder().build());
  }

  private static void awaitCondition(BooleanSupplier condition) throws InterruptedException {
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
    while (!condition.getAsBoolean()) {
      if (System.nanoTime() > deadline) {
        throw new AssertionError("Condition not met within 10s");
      }
      Thread.sleep(20);
    }
  }

  private static void assertSimulatedOnly(TestCase testCase) {
    assertThat(testCase.isSimulated()).isTrue();
    assertThat(testCase.getStatus()).isNotEqualTo(TestCaseStatus.ERROR);
    assertThat(testCase.getActualOutput()).doesNotContainEntry("class", "late");
  }

  @Nested
  class SuccessfulRun {

    @Test
    void all_stages_complete_and_artifacts_are_stored() {
      Evaluation evaluation = pending();

      EvaluationDetails details = orchestrator(all()).runEvaluation(evaluation.getId());

      assertThat(details.evaluation().getStatus()).isEqualTo(EvaluationStatus.COMPLETED);
      assertThat(details.evaluation().getProgress()).isEqualTo(100.0);
      assertThat(details.evaluation().getCompletedAt()).isEqualTo(CLOCK.instant());
      assertThat(details.evaluation().getPromptAnalysis()).isEqualTo(SENTIMENT);
      assertThat(details.evaluation().getErrorAnalysis().commonErrors()).containsExactly("none");
      assertThat(details.testCases()).hasSize(3);
      assertThat(details.findMetrics()).hasValueSatisfying(
          metrics -> {
            assertThat(metrics.getPassRate()).isEqualTo(1.0);
            assertThat(metrics.isSimulated()).isFalse();
            assertThat(metrics.getEvaluationId()).isEqualTo(evaluation.getId());
          });
      assertThat(details.suggestions()).singleElement()
          .extracting(OptimizationSuggestion::getEvaluationId)
          .isEqualTo(evaluation.getId());
    }

    @Test
    void progress_is_persisted_after_every_stage_in_order() {
      Evaluation evaluation = pending();

      orchestrator(all()).runEvaluation(evaluation.getId());

      assertThat(store.progressUpdates()).containsExactly(20.0, 40.0, 60.0, 80.0, 90.0, 100.0);
    }

    @Test
    void generated_cases_get_evaluation_id_and_ordinal() {
      Evaluation evaluation = pending();

      orchestrator(all()).runEvaluation(evaluation.getId());

      List<TestCase> stored = store.findTestCases(evaluation.getId());
      assertThat(stored).extracting(TestCase::getOrdinal).containsExactly(0, 1, 2);
      assertThat(stored).allSatisfy(
          testCase -> assertThat(testCase.getEvaluationId()).isEqualTo(evaluation.getId()));
    }

    @Test
    void executor_returning_copies_has_results_merged_back() {
      TestExecutor copyingExecutor =
          (cases, prompt, options) -> {
            List<TestCase> copies = new ArrayList<>();
            for (TestCase testCase : cases) {
              copies.add(new TestCaseBuilder().name(testCase.getName())
                  .actual("class", "positive").failed(0.25).build());
            }
            return copies;
          };
      Evaluation evaluation = pending();

      EvaluationDetails details =
          orchestrator(
                  new PipelineCollaborators(
                      analyzer, generator, copyingExecutor, errorAnalyzer, optimizer))
              .runEvaluation(evaluation.getId());

      assertThat(details.testCases()).allSatisfy(
          testCase -> {
            assertThat(testCase.getStatus()).isEqualTo(TestCaseStatus.FAILED);
            assertThat(testCase.getScore()).isEqualTo(0.25);
            assertThat(testCase.isSimulated()).isFalse();
          });
    }
  }

  @Nested
  class MandatoryStageFailures {

    @Test
    void generator_exception_fails_run_without_metrics() {
      TestCaseGenerator broken =
          (analysis, options) -> {
            throw new IllegalStateException("model unavailable");
          };
      Evaluation evaluation = pending();
      EvaluationOrchestrator orchestrator =
          orchestrator(
              new PipelineCollaborators(analyzer, broken, echoExecutor, errorAnalyzer, optimizer));

      assertThatThrownBy(() -> orchestrator.runEvaluation(evaluation.getId()))
          .isInstanceOfSatisfying(
              EvaluationFailedException.class,
              e -> assertThat(e.getStage()).isEqualTo(PipelineStage.GENERATE_TEST_CASES))
          .hasMessageContaining("model unavailable");

      assertThat(evaluation.getStatus()).isEqualTo(EvaluationStatus.FAILED);
      assertThat(evaluation.getProgress()).isEqualTo(20.0);
      assertThat(evaluation.getFailureReason()).contains("model unavailable");
      assertThat(evaluation.getCompletedAt()).isNotNull();
      assertThat(store.metricsSaves()).isZero();
    }

    @Test
    void empty_generator_output_fails_run() {
      TestCaseGenerator empty = (analysis, options) -> List.of();
      Evaluation evaluation = pending();
      EvaluationOrchestrator orchestrator =
          orchestrator(
              new PipelineCollaborators(analyzer, empty, echoExecutor, errorAnalyzer, optimizer));

      assertThatThrownBy(() -> orchestrator.runEvaluation(evaluation.getId()))
          .isInstanceOf(EvaluationFailedException.class);
      assertThat(evaluation.getFailureReason()).contains("no test cases");
    }

    @Test
    void missing_analyzer_fails_at_prompt_analysis() {
      Evaluation evaluation = pending();
      EvaluationOrchestrator orchestrator =
          orchestrator(new PipelineCollaborators(null, generator, null, null, null));

      assertThatThrownBy(() -> orchestrator.runEvaluation(evaluation.getId()))
          .isInstanceOfSatisfying(
              EvaluationFailedException.class,
              e -> assertThat(e.getStage()).isEqualTo(PipelineStage.ANALYZE_PROMPT));
      assertThat(evaluation.getStatus()).isEqualTo(EvaluationStatus.FAILED);
      assertThat(evaluation.getProgress()).isZero();
    }

    @Test
    void classification_without_classes_fails_at_prompt_analysis() {
      PromptAnalyzer classless =
          (prompt, examples) ->
              new PromptAnalysis(
                  prompt,
                  TaskType.CLASSIFICATION,
                  InputSchema.empty(),
                  OutputSchema.empty(),
                  List.of(),
                  List.of(),
                  0.5);
      Evaluation evaluation = pending();
      EvaluationOrchestrator orchestrator =
          orchestrator(new PipelineCollaborators(classless, generator, null, null, null));

      assertThatThrownBy(() -> orchestrator.runEvaluation(evaluation.getId()))
          .isInstanceOf(EvaluationFailedException.class)
          .hasMessageContaining("output classes");
    }

    @Test
    void metrics_failure_fails_run_at_metrics_stage() {
      MetricsCalculator broken =
          new MetricsCalculator(CLOCK) {
            @Override
            public EvaluationMetrics calculateMetrics(
                List<TestCase> testCases, PromptAnalysis analysis) {
              throw new IllegalStateException("division by zero");
            }
          };
      Evaluation evaluation = pending();
      EvaluationOrchestrator orchestrator = orchestrator(store, all(), broken);

      assertThatThrownBy(() -> orchestrator.runEvaluation(evaluation.getId()))
          .isInstanceOfSatisfying(
              EvaluationFailedException.class,
              e -> assertThat(e.getStage()).isEqualTo(PipelineStage.CALCULATE_METRICS));
      assertThat(evaluation.getProgress()).isEqualTo(60.0);
      assertThat(store.metricsSaves()).isZero();
    }

    @Test
    void storage_error_fails_run() {
      InMemoryEvaluationStore failingStore =
          new InMemoryEvaluationStore() {
            @Override
            public synchronized List<TestCase> saveTestCases(List<TestCase> cases) {
              throw new IllegalStateException("connection refused");
            }
          };
      Evaluation evaluation = failingStore.add(new EvaluationBuilder().build());
      EvaluationOrchestrator orchestrator =
          orchestrator(failingStore, all(), new MetricsCalculator(CLOCK));

      assertThatThrownBy(() -> orchestrator.runEvaluation(evaluation.getId()))
          .isInstanceOf(EvaluationFailedException.class);
      assertThat(evaluation.getStatus()).isEqualTo(EvaluationStatus.FAILED);
      assertThat(evaluation.getFailureReason()).startsWith("storage error");
    }
  }

  @Nested
  class DegradedStages {

    @Test
    void missing_executor_simulates_results() {
      Evaluation evaluation = pending();

      EvaluationDetails details =
          orchestrator(
                  new PipelineCollaborators(analyzer, generator, null, errorAnalyzer, optimizer))
              .runEvaluation(evaluation.getId());

      assertThat(details.evaluation().getStatus()).isEqualTo(EvaluationStatus.COMPLETED);
      assertThat(details.testCases()).allMatch(TestCase::isSimulated);
      assertThat(details.testCases()).allMatch(tc -> tc.getStatus() != TestCaseStatus.PENDING);
      assertThat(details.metrics().isSimulated()).isTrue();
    }

    @Test
    void executor_timeout_falls_back_to_simulation() {
      properties.setExecutionTimeout(Duration.ofMillis(100));
      CountDownLatch never = new CountDownLatch(1);
      TestExecutor hanging =
          (cases, prompt, options) -> {
            try {
              never.await();
            } catch (InterruptedException e) {
              Thread.currentThread().interrupt();
            }
            return cases;
          };
      Evaluation evaluation = pending();

      EvaluationDetails details =
          orchestrator(
                  new PipelineCollaborators(analyzer, generator, hanging, errorAnalyzer, optimizer))
              .runEvaluation(evaluation.getId());

      assertThat(details.evaluation().getStatus()).isEqualTo(EvaluationStatus.COMPLETED);
      assertThat(details.metrics().isSimulated()).isTrue();
    }

    @Test
    void late_writes_from_timed_out_executor_do_not_reach_simulated_cases()
        throws InterruptedException {
      properties.setExecutionTimeout(Duration.ofMillis(100));
      CountDownLatch finished = new CountDownLatch(1);
      TestExecutor ignoresInterrupts =
          (cases, prompt, options) -> {
            long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(400);
            while (System.nanoTime() < deadline) {
              Thread.onSpinWait();
            }
            for (TestCase testCase : cases) {
              testCase.recordResult(
                  Map.of("class", "late"), TestCaseStatus.ERROR, 0.0, CLOCK.instant());
            }
            finished.countDown();
            return cases;
          };
      Evaluation evaluation = pending();

      EvaluationDetails details =
          orchestrator(
                  new PipelineCollaborators(
                      analyzer, generator, ignoresInterrupts, errorAnalyzer, optimizer))
              .runEvaluation(evaluation.getId());
      assertThat(finished.await(5, TimeUnit.SECONDS)).isTrue();

      assertThat(details.metrics().isSimulated()).isTrue();
      assertThat(store.findTestCases(evaluation.getId())).hasSize(3).allSatisfy(
          EvaluationOrchestratorTest::assertSimulatedOnly);
      assertThat(details.testCases()).hasSize(3).allSatisfy(
          EvaluationOrchestratorTest::assertSimulatedOnly);
    }

    @Test
    void executor_result_count_mismatch_falls_back_to_simulation() {
      TestExecutor partial = (cases, prompt, options) -> cases.subList(0, 1);
      Evaluation evaluation = pending();

      EvaluationDetails details =
          orchestrator(
                  new PipelineCollaborators(analyzer, generator, partial, errorAnalyzer, optimizer))
              .runEvaluation(evaluation.getId());

      assertThat(details.testCases()).allMatch(TestCase::isSimulated);
    }

    @Test
    void error_analyzer_failure_uses_heuristic_analysis() {
      ErrorAnalyzer broken =
          (cases, analysis) -> {
            throw new IllegalStateException("parse error");
          };
      Evaluation evaluation = pending();

      EvaluationDetails details =
          orchestrator(
                  new PipelineCollaborators(analyzer, generator, echoExecutor, broken, optimizer))
              .runEvaluation(evaluation.getId());

      assertThat(details.evaluation().getStatus()).isEqualTo(EvaluationStatus.COMPLETED);
      ErrorAnalysis fallback = details.evaluation().getErrorAnalysis();
      assertThat(fallback).isNotNull();
      assertThat(fallback.ambiguousCases()).isZero();
      assertThat(fallback.errorCategories()).containsKey("format_errors");
    }

    @Test
    void optimizer_failure_completes_without_suggestions() {
      PromptOptimizer broken =
          (prompt, metrics, errors) -> {
            throw new IllegalStateException("rate limited");
          };
      Evaluation evaluation = pending();

      EvaluationDetails details =
          orchestrator(
                  new PipelineCollaborators(
                      analyzer, generator, echoExecutor, errorAnalyzer, broken))
              .runEvaluation(evaluation.getId());

      assertThat(details.evaluation().getStatus()).isEqualTo(EvaluationStatus.COMPLETED);
      assertThat(details.suggestions()).isEmpty();
    }
  }

  @Nested
  class Preconditions {

    @Test
    void unknown_evaluation_is_not_found() {
      UUID id = UUID.randomUUID();

      assertThatThrownBy(() -> orchestrator(all()).runEvaluation(id))
          .isInstanceOf(EvaluationNotFoundException.class);
    }

    @Test
    void completed_evaluation_cannot_run_again() {
      Evaluation evaluation = pending();
      EvaluationOrchestrator orchestrator = orchestrator(all());
      orchestrator.runEvaluation(evaluation.getId());

      assertThatThrownBy(() -> orchestrator.runEvaluation(evaluation.getId()))
          .isInstanceOf(EvaluationStateException.class)
          .hasMessageContaining("only pending");
    }

    @Test
    void lost_claim_is_rejected_and_leaves_evaluation_pending() {
      InMemoryEvaluationStore contended =
          new InMemoryEvaluationStore() {
            @Override
            public synchronized boolean markRunning(UUID evaluationId, Instant startedAt) {
              return false;
            }
          };
      Evaluation evaluation = contended.add(new EvaluationBuilder().build());
      EvaluationOrchestrator orchestrator =
          orchestrator(contended, all(), new MetricsCalculator(CLOCK));

      assertThatThrownBy(() -> orchestrator.runEvaluation(evaluation.getId()))
          .isInstanceOf(EvaluationStateException.class);
      assertThat(evaluation.getStatus()).isEqualTo(EvaluationStatus.PENDING);
    }

    @Test
    void blank_prompt_is_rejected_at_creation() {
      assertThatThrownBy(() -> orchestrator(all()).createEvaluation(1L, "  ", null))
          .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void created_evaluation_is_pending_with_defaults() {
      Evaluation created = orchestrator(all()).createEvaluation(7L, "Summarize the text", null);

      assertThat(created.getStatus()).isEqualTo(EvaluationStatus.PENDING);
      assertThat(created.getProjectId()).isEqualTo(7L);
      assertThat(created.getName()).isEqualTo("Evaluation");
      assertThat(created.getPromptAnalysis()).satisfies(
          analysis -> {
            assertThat(analysis.promptText()).isEqualTo("Summarize the text");
            assertThat(analysis.isAnalyzed()).isFalse();
          });
      assertThat(store.findEvaluation(created.getId())).contains(created);
    }
  }

  @Nested
  class BackgroundRuns {

    @Test
    void async_run_completes_in_background() throws InterruptedException {
      Evaluation evaluation = pending();
      EvaluationOrchestrator orchestrator = orchestrator(all());

      orchestrator.runEvaluationAsync(evaluation.getId());

      awaitCondition(
          () ->
              orchestrator.getEvaluationStatus(evaluation.getId()).status()
                  == EvaluationStatus.COMPLETED);
      awaitCondition(() -> !orchestrator.isRunActive(evaluation.getId()));
      assertThat(orchestrator.getEvaluation(evaluation.getId()).findMetrics()).isPresent();
    }

    @Test
    void cancelling_a_running_evaluation_marks_it_failed() throws InterruptedException {
      CountDownLatch started = new CountDownLatch(1);
      CountDownLatch release = new CountDownLatch(1);
      TestCaseGenerator blocking =
          (analysis, options) -> {
            started.countDown();
            try {
              release.await();
            } catch (InterruptedException e) {
              Thread.currentThread().interrupt();
            }
            return List.of();
          };
      Evaluation evaluation = pending();
      EvaluationOrchestrator orchestrator =
          orchestrator(new PipelineCollaborators(analyzer, blocking, null, null, null));

      orchestrator.runEvaluationAsync(evaluation.getId());
      assertThat(started.await(10, TimeUnit.SECONDS)).isTrue();

      assertThat(orchestrator.isRunActive(evaluation.getId())).isTrue();
      assertThatThrownBy(() -> orchestrator.deleteEvaluation(evaluation.getId()))
          .isInstanceOf(EvaluationStateException.class);

      orchestrator.cancelEvaluation(evaluation.getId());

      awaitCondition(
          () ->
              orchestrator.getEvaluationStatus(evaluation.getId()).status()
                  == EvaluationStatus.FAILED);
      EvaluationProgress progress = orchestrator.getEvaluationStatus(evaluation.getId());
      assertThat(progress.failureReason()).isEqualTo("cancelled");
      assertThat(progress.progress()).isEqualTo(20.0);
      assertThat(orchestrator.isRunActive(evaluation.getId())).isFalse();
      release.countDown();
    }

    @Test
    void scheduling_the_same_evaluation_twice_is_rejected() {
      CountDownLatch release = new CountDownLatch(1);
      PromptAnalyzer blocking =
          (prompt, examples) -> {
            try {
              release.await();
            } catch (InterruptedException e) {
              Thread.currentThread().interrupt();
            }
            return SENTIMENT;
          };
      Evaluation evaluation = pending();
      EvaluationOrchestrator orchestrator =
          orchestrator(new PipelineCollaborators(blocking, generator, null, null, null));

      orchestrator.runEvaluationAsync(evaluation.getId());
      try {
        assertThatThrownBy(() -> orchestrator.runEvaluationAsync(evaluation.getId()))
            .isInstanceOf(EvaluationStateException.class);
      } finally {
        release.countDown();
      }
    }

    @Test
    void cancel_without_background_run_is_rejected() {
      Evaluation evaluation = pending();

      assertThatThrownBy(() -> orchestrator(all()).cancelEvaluation(evaluation.getId()))
          .isInstanceOf(EvaluationStateException.class);
    }
  }

  @Nested
  class Queries {

    @Test
    void status_reports_progress_of_stored_evaluation() {
      Evaluation evaluation = pending();
      EvaluationOrchestrator orchestrator = orchestrator(all());

      assertThat(orchestrator.getEvaluationStatus(evaluation.getId()))
          .isEqualTo(
              new EvaluationProgress(evaluation.getId(), EvaluationStatus.PENDING, 0.0, null));
    }

    @Test
    void pending_evaluation_has_no_metrics() {
      Evaluation evaluation = pending();

      EvaluationDetails details = orchestrator(all()).getEvaluation(evaluation.getId());

      assertThat(details.findMetrics()).isEmpty();
      assertThat(details.testCases()).isEmpty();
    }

    @Test
    void delete_removes_completed_evaluation() {
      Evaluation evaluation = pending();
      EvaluationOrchestrator orchestrator = orchestrator(all());
      orchestrator.runEvaluation(evaluation.getId());

      orchestrator.deleteEvaluation(evaluation.getId());

      assertThatThrownBy(() -> orchestrator.getEvaluation(evaluation.getId()))
          .isInstanceOf(EvaluationNotFoundException.class);
      assertThat(store.findTestCases(evaluation.getId())).isEmpty();
    }

    @Test
    void list_filters_by_project_and_status() {
      Evaluation first = store.add(new EvaluationBuilder().projectId(5L).build());
      store.add(new EvaluationBuilder().projectId(6L).build());
      EvaluationOrchestrator orchestrator = orchestrator(all());
      orchestrator.runEvaluation(first.getId());
      store.add(new EvaluationBuilder().projectId(5L).build());

      assertThat(orchestrator.listEvaluations(5L, ListOptions.firstPage(10))).hasSize(2);
      assertThat(
              orchestrator.listEvaluations(
                  5L, new ListOptions(10, 0, EvaluationStatus.COMPLETED, true)))
          .containsExactly(first);
    }
  }
}
