package io.b2mash.b2b.accessaudit.terminal;

import io.b2mash.b2b.accessaudit.audit.AuditText;
import io.b2mash.b2b.accessaudit.exception.ResourceNotFoundException;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Records sessions and commands reported by terminal gateways. Input lines longer than the column
 * are truncated.
 */
@Service
public class TerminalRecordService {

  private static final Logger log = LoggerFactory.getLogger(TerminalRecordService.class);

  private static final int INPUT_MAX_LENGTH = 128;

  private final TerminalSessionRepository sessionRepository;
  private final SessionCommandRepository commandRepository;

  public TerminalRecordService(
      TerminalSessionRepository sessionRepository, SessionCommandRepository commandRepository) {
    this.sessionRepository = sessionRepository;
    this.commandRepository = commandRepository;
  }

  @Transactional
  public TerminalSession openSession(TerminalSession session) {
    var saved = sessionRepository.save(session);
    log.debug("Opened terminal session id={}, user={}", saved.getId(), saved.getUser());
    return saved;
  }

  @Transactional
  public TerminalSession finishSession(UUID sessionId) {
    var session =
        sessionRepository
            .findById(sessionId)
            .orElseThrow(() -> new ResourceNotFoundException("Terminal session", sessionId));
    session.finish(Instant.now());
    return session;
  }

  /** Persists a batch of commands captured for one session. */
  @Transactional
  public List<SessionCommand> recordCommands(UUID sessionId, List<CapturedCommand> commands) {
    var session =
        sessionRepository
            .findById(sessionId)
            .orElseThrow(() -> new ResourceNotFoundException("Terminal session", sessionId));
    var entities =
        commands.stream()
            .map(
                c ->
                    new SessionCommand(
                        session,
                        AuditText.truncate(c.input(), INPUT_MAX_LENGTH),
                        c.riskLevel(),
                        c.timestamp()))
            .toList();
    return commandRepository.saveAll(entities);
  }

  @Transactional(readOnly = true)
  public List<SessionCommand> listCommands(UUID sessionId) {
    return commandRepository.findBySessionIdOrderByTimestamp(sessionId);
  }

  /** A command as captured by the gateway. */
  public record CapturedCommand(String input, int riskLevel, Instant timestamp) {}
}
