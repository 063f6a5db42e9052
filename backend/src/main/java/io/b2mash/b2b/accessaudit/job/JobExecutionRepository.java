package io.b2mash.b2b.accessaudit.job;

import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface JobExecutionRepository extends JpaRepository<JobExecution, UUID> {

  /** Average time cost in seconds over finished executions, or null if there are none. */
  @Query(
      """
      SELECT AVG(e.timeCost) FROM JobExecution e
      WHERE e.job.id = :jobId AND e.finished = true AND e.timeCost IS NOT NULL
      """)
  Double averageTimeCost(@Param("jobId") UUID jobId);

  @Query(
      """
      SELECT e FROM JobExecution e
      WHERE e.tenantId = :tenantId
        AND (:jobId IS NULL OR e.job.id = :jobId)
        AND (:finished IS NULL OR e.finished = :finished)
      ORDER BY e.dateCreated DESC
      """)
  Page<JobExecution> findByFilter(
      @Param("tenantId") String tenantId,
      @Param("jobId") UUID jobId,
      @Param("finished") Boolean finished,
      Pageable pageable);
}
