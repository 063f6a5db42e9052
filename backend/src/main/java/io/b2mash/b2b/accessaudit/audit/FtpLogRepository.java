package io.b2mash.b2b.accessaudit.audit;

import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface FtpLogRepository extends JpaRepository<FtpLog, UUID> {}
