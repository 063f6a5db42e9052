package io.b2mash.b2b.accessaudit.terminal;

import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface TerminalSessionRepository extends JpaRepository<TerminalSession, UUID> {}
