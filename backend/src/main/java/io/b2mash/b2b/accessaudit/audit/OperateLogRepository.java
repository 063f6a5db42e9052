package io.b2mash.b2b.accessaudit.audit;

import java.time.Instant;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface OperateLogRepository extends JpaRepository<OperateLog, UUID> {

  /**
   * Tenant-scoped search with nullable filters: {@code (:param IS NULL OR o.field = :param)}.
   * {@code resource} is a substring match. Results ordered by datetime DESC.
   */
  @Query(
      """
      SELECT o FROM OperateLog o
      WHERE o.tenantId = :tenantId
        AND (CAST(:user AS string) IS NULL OR o.user = :user)
        AND (:action IS NULL OR o.action = :action)
        AND (CAST(:resourceType AS string) IS NULL OR o.resourceType = :resourceType)
        AND (CAST(:resource AS string) IS NULL
             OR o.resource LIKE CONCAT('%', CAST(:resource AS string), '%'))
        AND (CAST(:from AS timestamp) IS NULL OR o.datetime >= :from)
        AND (CAST(:to AS timestamp) IS NULL OR o.datetime < :to)
      ORDER BY o.datetime DESC
      """)
  Page<OperateLog> findByFilter(
      @Param("tenantId") String tenantId,
      @Param("user") String user,
      @Param("action") ActionType action,
      @Param("resourceType") String resourceType,
      @Param("resource") String resource,
      @Param("from") Instant from,
      @Param("to") Instant to,
      Pageable pageable);
}
