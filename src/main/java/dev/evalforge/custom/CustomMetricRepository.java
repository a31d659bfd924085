package dev.evalforge.custom;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

/** Spring Data repository for {@link CustomMetric} entities. */
public interface CustomMetricRepository extends JpaRepository<CustomMetric, UUID> {

  /** Enabled metrics of a project, the set {@link CustomMetricsEvaluator} caches. */
  List<CustomMetric> findAllByProjectIdAndEnabledTrueOrderByNameAsc(long projectId);

  List<CustomMetric> findAllByProjectIdOrderByNameAsc(long projectId);

  Optional<CustomMetric> findByProjectIdAndName(long projectId, String name);
}
