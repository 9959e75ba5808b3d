package poi.monitor.infrastructure.persistence;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import poi.monitor.core.domain.model.DeploymentBlock;
import poi.monitor.core.domain.model.Fingerprint;
import poi.monitor.core.domain.model.FingerprintSet;
import poi.monitor.core.domain.model.PoiSubmission;
import poi.monitor.core.port.out.FingerprintStorePort;
import poi.monitor.infrastructure.executor.LogicExecutor;
import poi.monitor.infrastructure.executor.TaskContext;
import poi.monitor.infrastructure.executor.strategy.ExceptionTranslator;

/**
 * Reads submitted POIs from the Graphix tables.
 *
 * <p>Read-only. Queries are bounded by {@code spring.jdbc.template.query-timeout}; any failure
 * surfaces as {@code StorageException}.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class JdbcFingerprintStore implements FingerprintStorePort {

  private static final HexFormat HEX = HexFormat.of();

  static final String CURRENT_SET_SQL =
      """
      SELECT p.poi, i.address
      FROM pois p
      JOIN indexers i ON i.id = p.indexer_id
      JOIN blocks b ON b.id = p.block_id
      JOIN sg_deployments d ON d.id = p.sg_deployment_id
      WHERE d.ipfs_cid = :deploymentId AND b.number = :blockNumber
      """;

  static final String OCCURRENCES_SQL =
      """
      SELECT p.poi,
             d.ipfs_cid AS deployment_id,
             b.number AS block_number,
             i.address AS indexer_address,
             n.name AS network_name,
             p.created_at AS submitted_at
      FROM pois p
      JOIN sg_deployments d ON d.id = p.sg_deployment_id
      JOIN blocks b ON b.id = p.block_id
      JOIN indexers i ON i.id = p.indexer_id
      JOIN networks n ON n.id = d.network
      WHERE p.poi IN (:pois)
      """;

  private static final RowMapper<PoiSubmission> SUBMISSION_MAPPER =
      JdbcFingerprintStore::mapSubmission;

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final LogicExecutor executor;

  @Override
  public FingerprintSet currentSet(DeploymentBlock key) {
    return executor.executeWithTranslation(
        () -> queryCurrentSet(key),
        ExceptionTranslator.forStoreRead(),
        TaskContext.of("FingerprintStore", "currentSet", key.toString()));
  }

  @Override
  public List<PoiSubmission> historicalOccurrences(Set<Fingerprint> fingerprints) {
    if (fingerprints.isEmpty()) {
      return List.of();
    }
    return executor.executeWithTranslation(
        () -> queryOccurrences(fingerprints),
        ExceptionTranslator.forStoreRead(),
        TaskContext.of("FingerprintStore", "occurrences", fingerprints.size() + " pois"));
  }

  private FingerprintSet queryCurrentSet(DeploymentBlock key) {
    FingerprintSet.Builder builder = FingerprintSet.builder();
    jdbcTemplate.query(
        CURRENT_SET_SQL,
        Map.of("deploymentId", key.deploymentId(), "blockNumber", key.blockNumber()),
        rs -> {
          builder.add(Fingerprint.of(rs.getBytes("poi")), HEX.formatHex(rs.getBytes("address")));
        });
    return builder.build();
  }

  private List<PoiSubmission> queryOccurrences(Set<Fingerprint> fingerprints) {
    List<byte[]> pois = fingerprints.stream().map(Fingerprint::toBytes).toList();
    List<PoiSubmission> rows =
        jdbcTemplate.query(OCCURRENCES_SQL, Map.of("pois", pois), SUBMISSION_MAPPER);
    log.debug("[FingerprintStore] {} occurrences for {} fingerprints", rows.size(), pois.size());
    return rows;
  }

  private static PoiSubmission mapSubmission(ResultSet rs, int rowNum) throws SQLException {
    Timestamp submittedAt = rs.getTimestamp("submitted_at");
    return new PoiSubmission(
        DeploymentBlock.of(rs.getString("deployment_id"), rs.getLong("block_number")),
        Fingerprint.of(rs.getBytes("poi")),
        HEX.formatHex(rs.getBytes("indexer_address")),
        submittedAt.toInstant(),
        rs.getString("network_name"));
  }
}
