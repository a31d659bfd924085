package dev.evalforge.suggestion;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

/** Spring Data repository for {@link OptimizationSuggestion} entities. */
public interface OptimizationSuggestionRepository
    extends JpaRepository<OptimizationSuggestion, UUID> {

  List<OptimizationSuggestion> findAllByEvaluationIdOrderByCreatedAtAsc(UUID evaluationId);

  void deleteAllByEvaluationId(UUID evaluationId);
}
