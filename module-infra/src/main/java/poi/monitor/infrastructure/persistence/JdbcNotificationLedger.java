package poi.monitor.infrastructure.persistence;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import poi.monitor.core.domain.model.DeploymentBlock;
import poi.monitor.core.domain.model.DisagreementIdentity;
import poi.monitor.core.port.out.NotificationLedgerPort;
import poi.monitor.error.exception.InvariantViolationException;
import poi.monitor.infrastructure.executor.LogicExecutor;
import poi.monitor.infrastructure.executor.TaskContext;
import poi.monitor.infrastructure.executor.strategy.ExceptionTranslator;

/**
 * Notification ledger over the {@code poi_notifications} table.
 *
 * <h3>Identity columns</h3>
 *
 * <ul>
 *   <li>{@code poi_set}: {@link DisagreementIdentity#canonicalForm()}
 *   <li>{@code poi_set_digest}: {@link DisagreementIdentity#digest()}, part of the unique key
 * </ul>
 *
 * <p>A second matching record for the same key and identity is an {@link
 * InvariantViolationException}; a duplicate insert means another cycle recorded the same state
 * first and is accepted.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class JdbcNotificationLedger implements NotificationLedgerPort {

  static final String COUNT_SQL =
      """
      SELECT COUNT(*) FROM poi_notifications
      WHERE deployment_id = :deploymentId
        AND block_number = :blockNumber
        AND poi_set_digest = :digest
        AND poi_set = :poiSet
      """;

  static final String INSERT_SQL =
      """
      INSERT INTO poi_notifications
        (deployment_id, block_number, poi_set, poi_set_digest, message, sent_at)
      VALUES (:deploymentId, :blockNumber, :poiSet, :digest, :message, :sentAt)
      """;

  static final String PURGE_SQL = "DELETE FROM poi_notifications WHERE sent_at < :cutoff";

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final LogicExecutor executor;
  private final Clock clock;

  @Override
  public boolean hasNotified(DeploymentBlock key, DisagreementIdentity identity) {
    if (identity.isEmpty()) {
      return false;
    }
    return executor.executeWithTranslation(
        () -> countMatches(key, identity) > 0,
        ExceptionTranslator.forLedgerRead(),
        TaskContext.of("Ledger", "hasNotified", key.toString()));
  }

  @Override
  public void recordNotified(DeploymentBlock key, DisagreementIdentity identity, String message) {
    executor.executeWithTranslation(
        () -> insert(key, identity, message),
        ExceptionTranslator.forLedgerWrite(),
        TaskContext.of("Ledger", "record", key.toString()));
  }

  @Override
  public int purgeOlderThan(Duration age) {
    return executor.executeWithTranslation(
        () -> deleteOlderThan(age),
        ExceptionTranslator.forLedgerWrite(),
        TaskContext.of("Ledger", "purge", age.toString()));
  }

  private long countMatches(DeploymentBlock key, DisagreementIdentity identity) {
    Long count =
        jdbcTemplate.queryForObject(COUNT_SQL, identityParams(key, identity), Long.class);
    long matches = count == null ? 0 : count;
    if (matches > 1) {
      throw new InvariantViolationException(
          matches + " ledger records for " + key + " " + identity.digest());
    }
    return matches;
  }

  private boolean insert(DeploymentBlock key, DisagreementIdentity identity, String message) {
    MapSqlParameterSource params =
        identityParams(key, identity)
            .addValue("message", message)
            .addValue("sentAt", OffsetDateTime.ofInstant(clock.instant(), ZoneOffset.UTC));
    try {
      jdbcTemplate.update(INSERT_SQL, params);
      return true;
    } catch (DuplicateKeyException e) {
      log.warn("[Ledger] Notification for {} {} already recorded", key, identity.digest());
      return false;
    }
  }

  private int deleteOlderThan(Duration age) {
    OffsetDateTime cutoff = OffsetDateTime.ofInstant(clock.instant().minus(age), ZoneOffset.UTC);
    int deleted = jdbcTemplate.update(PURGE_SQL, Map.of("cutoff", cutoff));
    if (deleted > 0) {
      log.info("[Ledger] Purged {} notifications sent before {}", deleted, cutoff);
    }
    return deleted;
  }

  private static MapSqlParameterSource identityParams(
      DeploymentBlock key, DisagreementIdentity identity) {
    return new MapSqlParameterSource()
        .addValue("deploymentId", key.deploymentId())
        .addValue("blockNumber", key.blockNumber())
        .addValue("digest", identity.digest())
        .addValue("poiSet", identity.canonicalForm());
  }
}
