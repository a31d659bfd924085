package dev.evalforge.custom;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

/** Spring Data repository for {@link EvaluationMetricResult} entities. */
public interface EvaluationMetricResultRepository
    extends JpaRepository<EvaluationMetricResult, UUID> {

  Optional<EvaluationMetricResult> findByEvaluationIdAndMetricId(UUID evaluationId, UUID metricId);

  List<EvaluationMetricResult> findAllByEvaluationId(UUID evaluationId);

  void deleteAllByMetricId(UUID metricId);
}
