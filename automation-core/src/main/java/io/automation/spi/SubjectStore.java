package io.automation.spi;

import io.automation.model.Subject;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Access to the external record store for subject records (projects and their contacts).
 *
 * <p>Reads are non-transactional. The only write is a stage transition, which runs on
 * the caller's connection so it commits together with the ledger resolution.
 */
public interface SubjectStore {

  Optional<Subject> find(String tenantId, String subjectId);

  /**
   * Returns the subjects currently in a stage.
   */
  List<Subject> findInStage(String tenantId, String stageId);

  /**
   * Returns the subjects that carry an anchor date.
   */
  List<Subject> findWithAnchorDate(String tenantId);

  /**
   * Moves a subject to a new stage and stamps its stage-entry time.
   *
   * @param conn          the caller's connection, inside the resolving transaction
   * @param tenantId      owning tenant
   * @param subjectId     subject record id
   * @param targetStageId new stage
   * @param enteredAt     stage-entry time to record
   */
  void applyStageTransition(Connection conn, String tenantId, String subjectId,
      String targetStageId, Instant enteredAt);
}
