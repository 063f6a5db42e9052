package io.b2mash.b2b.accessaudit.terminal;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface SessionCommandRepository extends JpaRepository<SessionCommand, UUID> {

  List<SessionCommand> findBySessionIdOrderByTimestamp(UUID sessionId);
}
