package dev.evalforge.testcase;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

/** Spring Data repository for {@link TestCase} entities. */
public interface TestCaseRepository extends JpaRepository<TestCase, UUID> {

  /** All test cases of an evaluation in the order the generator produced them. */
  List<TestCase> findAllByEvaluationIdOrderByOrdinalAsc(UUID evaluationId);

  long countByEvaluationId(UUID evaluationId);

  void deleteAllByEvaluationId(UUID evaluationId);
}
