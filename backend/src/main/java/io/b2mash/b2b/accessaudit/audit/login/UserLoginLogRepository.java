package io.b2mash.b2b.accessaudit.audit.login;

import java.time.Instant;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface UserLoginLogRepository extends JpaRepository<UserLoginLog, UUID> {

  @Query(
      """
      SELECT l FROM UserLoginLog l
      WHERE (CAST(:username AS string) IS NULL OR l.username = :username)
        AND (CAST(:ip AS string) IS NULL OR l.ip = :ip)
        AND (:status IS NULL OR l.status = :status)
        AND (CAST(:from AS timestamp) IS NULL OR l.datetime >= :from)
        AND (CAST(:to AS timestamp) IS NULL OR l.datetime < :to)
      ORDER BY l.datetime DESC
      """)
  Page<UserLoginLog> findByFilter(
      @Param("username") String username,
      @Param("ip") String ip,
      @Param("status") Boolean status,
      @Param("from") Instant from,
      @Param("to") Instant to,
      Pageable pageable);

  long countByUsernameAndStatusAndDatetimeAfter(String username, boolean status, Instant after);

  boolean existsByUsernameAndIpAndStatusTrueAndDatetimeAfter(
      String username, String ip, Instant after);
}
