package io.b2mash.b2b.accessaudit.audit;

import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface PasswordChangeLogRepository extends JpaRepository<PasswordChangeLog, UUID> {

  @Query(
      """
      SELECT p FROM PasswordChangeLog p
      WHERE p.tenantId = :tenantId
        AND (CAST(:user AS string) IS NULL OR p.user = :user)
      ORDER BY p.datetime DESC
      """)
  Page<PasswordChangeLog> findByFilter(
      @Param("tenantId") String tenantId, @Param("user") String user, Pageable pageable);
}
