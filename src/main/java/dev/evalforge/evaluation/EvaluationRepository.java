package dev.evalforge.evaluation;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

/** Spring Data repository for {@link Evaluation} entities. */
public interface EvaluationRepository extends JpaRepository<Evaluation, UUID> {

  /**
   * Moves a pending evaluation to running in a single conditional update.
   *
   * @return 1 if this caller won the transition, 0 if the evaluation was not pending
   */
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Transactional
  @Query(
      """
      UPDATE Evaluation e
      SET e.status = :running, e.progress = 0, e.startedAt = :startedAt,
          e.updatedAt = :startedAt
      WHERE e.id = :id AND e.status = :pending
      """)
  int markRunning(
      @Param("id") UUID id,
      @Param("startedAt") Instant startedAt,
      @Param("pending") EvaluationStatus pending,
      @Param("running") EvaluationStatus running);

  /** Evaluations of a project, newest first; a null status matches every status. */
  @Query(
      value =
          """
          SELECT * FROM evaluations
          WHERE project_id = :projectId
            AND (CAST(:status AS TEXT) IS NULL OR status = CAST(:status AS TEXT))
          ORDER BY created_at DESC
          LIMIT :limit OFFSET :offset
          """,
      nativeQuery = true)
  List<Evaluation> findPageNewestFirst(
      @Param("projectId") long projectId,
      @Param("status") String status,
      @Param("limit") int limit,
      @Param("offset") int offset);

  /** Evaluations of a project, oldest first; a null status matches every status. */
  @Query(
      value =
          """
          SELECT * FROM evaluations
          WHERE project_id = :projectId
            AND (CAST(:status AS TEXT) IS NULL OR status = CAST(:status AS TEXT))
          ORDER BY created_at ASC
          LIMIT :limit OFFSET :offset
          """,
      nativeQuery = true)
  List<Evaluation> findPageOldestFirst(
      @Param("projectId") long projectId,
      @Param("status") String status,
      @Param("limit") int limit,
      @Param("offset") int offset);
}
