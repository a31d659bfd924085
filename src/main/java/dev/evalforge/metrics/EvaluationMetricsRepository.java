package dev.evalforge.metrics;

import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

/** Spring Data repository for {@link EvaluationMetrics} entities. */
public interface EvaluationMetricsRepository extends JpaRepository<EvaluationMetrics, UUID> {

  Optional<EvaluationMetrics> findByEvaluationId(UUID evaluationId);

  void deleteByEvaluationId(UUID evaluationId);
}
