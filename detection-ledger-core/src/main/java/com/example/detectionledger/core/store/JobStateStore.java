package com.example.detectionledger.core.store;

import static java.lang.System.Logger.Level.*;

import com.example.detectionledger.core.TransactionException;
import com.example.detectionledger.core.detection.Detection;
import com.example.detectionledger.core.detection.InferenceResult;
import java.lang.System.Logger;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Persistent image state and detection rows.
 *
 * <p>Every method runs on the connection of a unit of work opened by the caller and never commits
 * or rolls back itself, so several calls made inside one {@code SessionManager.inTransaction}
 * commit together. JDBC failures surface as {@link TransactionException}, which makes the
 * enclosing unit of work roll back.
 */
public final class JobStateStore {

  private static final Logger logger = System.getLogger(JobStateStore.class.getName());

  private static final String UPSERT_STATUS =
      """
      INSERT INTO image_processing_status (customer_name, upload_date, filename, status)
      VALUES (?, ?, ?, ?)
      ON CONFLICT (customer_name, upload_date, filename) DO UPDATE SET status = EXCLUDED.status
      """;
  private static final String INSERT_STATUS_IF_ABSENT =
      """
      INSERT INTO image_processing_status (customer_name, upload_date, filename, status)
      VALUES (?, ?, ?, ?)
      ON CONFLICT (customer_name, upload_date, filename) DO NOTHING
      """;
  private static final String UPDATE_STATUS =
      """
      UPDATE image_processing_status SET status = ?
      WHERE customer_name = ? AND upload_date = ? AND filename = ?
      """;
  private static final String INSERT_STATUS =
      """
      INSERT INTO image_processing_status (customer_name, upload_date, filename, status)
      VALUES (?, ?, ?, ?)
      """;
  private static final String SELECT_STATUS =
      """
      SELECT status FROM image_processing_status
      WHERE customer_name = ? AND upload_date = ? AND filename = ?
      """;
  private static final String SELECT_BY_STATUS =
      """
      SELECT upload_date, filename FROM image_processing_status
      WHERE customer_name = ? AND status IN (%s)
      ORDER BY upload_date, filename
      """;
  private static final String INSERT_DETECTION =
      """
      INSERT INTO detection_information
        (customer_name, upload_date, filename, has_detection, class_id,
         x_norm, y_norm, w_norm, h_norm, image_width, image_height, run_id)
      VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
      """;

  private final SqlDialect configuredDialect;
  private final ClaimPolicy claimPolicy;
  private volatile SqlDialect detectedDialect;

  /** Last-write-wins claims, dialect detected from the first connection used. */
  public JobStateStore() {
    this(null, ClaimPolicy.LAST_WRITE_WINS);
  }

  /**
   * @param dialect upsert spelling, or null to detect it from the connection
   * @param claimPolicy behaviour of {@link #claim} on an image that already has a row
   */
  public JobStateStore(final SqlDialect dialect, final ClaimPolicy claimPolicy) {
    this.configuredDialect = dialect;
    this.claimPolicy = Objects.requireNonNull(claimPolicy, "claimPolicy");
  }

  public ClaimPolicy claimPolicy() {
    return claimPolicy;
  }

  /**
   * Marks the image as being worked on.
   *
   * @param conn connection of the caller's unit of work
   * @param key image to claim
   * @throws ClaimConflictException under {@link ClaimPolicy#EXCLUSIVE} when the image has a row
   */
  public void claim(final Connection conn, final ImageKey key) {
    if (claimPolicy == ClaimPolicy.LAST_WRITE_WINS) {
      upsert(conn, key, ProcessingStatus.IN_PROGRESS);
    } else {
      claimExclusively(conn, key);
    }
    logger.log(DEBUG, "Claimed {0}", key);
  }

  /**
   * Marks the image as processed. Repeating the call leaves the same single row.
   *
   * @param conn connection of the caller's unit of work
   * @param key image to complete
   */
  public void complete(final Connection conn, final ImageKey key) {
    upsert(conn, key, ProcessingStatus.PROCESSED);
    logger.log(DEBUG, "Completed {0}", key);
  }

  /**
   * Current status of one image.
   *
   * @param conn connection of the caller's unit of work
   * @param key image to look up
   * @return the status, or empty if the image was never claimed
   */
  public Optional<ProcessingStatus> statusOf(final Connection conn, final ImageKey key) {
    try (var ps = conn.prepareStatement(SELECT_STATUS)) {
      bindKey(ps, 1, key);
      try (var rs = ps.executeQuery()) {
        return rs.next()
            ? Optional.of(ProcessingStatus.fromDbValue(rs.getString(1)))
            : Optional.empty();
      }
    } catch (final SQLException e) {
      throw new TransactionException("Failed to read status of " + key, e);
    }
  }

  /**
   * Images of a customer whose status is one of {@code statuses}, used to skip finished work when
   * a run resumes.
   *
   * @param conn connection of the caller's unit of work
   * @param customer customer to query
   * @param statuses statuses to match
   * @return matching images ordered by upload date and file name
   */
  public Set<CompletedImage> queryCompleted(
      final Connection conn, final String customer, final Set<ProcessingStatus> statuses) {
    if (statuses.isEmpty()) return Collections.emptySet();

    final var placeholders = String.join(", ", Collections.nCopies(statuses.size(), "?"));
    try (var ps = conn.prepareStatement(SELECT_BY_STATUS.formatted(placeholders))) {
      ps.setString(1, customer);
      var index = 2;
      for (final var status : statuses) ps.setString(index++, status.dbValue());

      final var result = new LinkedHashSet<CompletedImage>();
      try (var rs = ps.executeQuery()) {
        while (rs.next()) {
          result.add(
              new CompletedImage(rs.getObject(1, LocalDate.class), rs.getString(2)));
        }
      }
      return result;
    } catch (final SQLException e) {
      throw new TransactionException("Failed to query images of " + customer, e);
    }
  }

  /**
   * Appends the detection rows of one image for one run: a row per detected object with a
   * non-empty box, or a single {@code has_detection = false} row with null geometry when there is
   * none.
   *
   * @param conn connection of the caller's unit of work
   * @param key image the result belongs to
   * @param runId run that produced the result
   * @param result model output for the image
   * @return number of rows written
   */
  public int recordDetection(
      final Connection conn, final ImageKey key, final String runId, final InferenceResult result) {
    final List<Detection> detections = result.recordable();
    if (detections.size() < result.detections().size()) {
      logger.log(DEBUG, "Dropped {0} empty boxes for {1}",
          result.detections().size() - detections.size(), key);
    }

    try (var ps = conn.prepareStatement(INSERT_DETECTION)) {
      if (detections.isEmpty()) {
        bindKey(ps, 1, key);
        ps.setBoolean(4, false);
        ps.setNull(5, Types.INTEGER);
        for (var i = 6; i <= 9; i++) ps.setNull(i, Types.DOUBLE);
        ps.setNull(10, Types.INTEGER);
        ps.setNull(11, Types.INTEGER);
        ps.setString(12, runId);
        ps.executeUpdate();
        return 1;
      }

      for (final var detection : detections) {
        final var box = detection.box().normalize(result.imageWidth(), result.imageHeight());
        bindKey(ps, 1, key);
        ps.setBoolean(4, true);
        ps.setInt(5, detection.classId());
        ps.setDouble(6, box.x());
        ps.setDouble(7, box.y());
        ps.setDouble(8, box.w());
        ps.setDouble(9, box.h());
        ps.setInt(10, result.imageWidth());
        ps.setInt(11, result.imageHeight());
        ps.setString(12, runId);
        ps.addBatch();
      }
      ps.executeBatch();
      return detections.size();
    } catch (final SQLException e) {
      throw new TransactionException("Failed to record detections for " + key, e);
    }
  }

  private void upsert(final Connection conn, final ImageKey key, final ProcessingStatus status) {
    try {
      if (dialect(conn) == SqlDialect.POSTGRESQL) {
        try (var ps = conn.prepareStatement(UPSERT_STATUS)) {
          bindKey(ps, 1, key);
          ps.setString(4, status.dbValue());
          ps.executeUpdate();
        }
        return;
      }

      final int updated;
      try (var ps = conn.prepareStatement(UPDATE_STATUS)) {
        ps.setString(1, status.dbValue());
        bindKey(ps, 2, key);
        updated = ps.executeUpdate();
      }
      if (updated == 0) insert(conn, INSERT_STATUS, key, status);
    } catch (final SQLException e) {
      throw new TransactionException(
          "Failed to set %s to %s".formatted(key, status.dbValue()), e);
    }
  }

  private void claimExclusively(final Connection conn, final ImageKey key) {
    try {
      if (dialect(conn) == SqlDialect.POSTGRESQL) {
        if (insert(conn, INSERT_STATUS_IF_ABSENT, key, ProcessingStatus.IN_PROGRESS) == 0)
          throw new ClaimConflictException(key, statusOf(conn, key).orElse(null));
        return;
      }

      final var existing = statusOf(conn, key);
      if (existing.isPresent()) throw new ClaimConflictException(key, existing.get());
      try {
        insert(conn, INSERT_STATUS, key, ProcessingStatus.IN_PROGRESS);
      } catch (final SQLException e) {
        if (isUniqueViolation(e)) throw new ClaimConflictException(key, null);
        throw e;
      }
    } catch (final SQLException e) {
      throw new TransactionException("Failed to claim " + key, e);
    }
  }

  private int insert(
      final Connection conn, final String sql, final ImageKey key, final ProcessingStatus status)
      throws SQLException {
    try (var ps = conn.prepareStatement(sql)) {
      bindKey(ps, 1, key);
      ps.setString(4, status.dbValue());
      return ps.executeUpdate();
    }
  }

  private SqlDialect dialect(final Connection conn) throws SQLException {
    if (configuredDialect != null) return configuredDialect;
    var dialect = detectedDialect;
    if (dialect == null) {
      dialect = SqlDialect.detect(conn);
      detectedDialect = dialect;
      logger.log(DEBUG, "Using {0} statements", dialect);
    }
    return dialect;
  }

  private static void bindKey(final PreparedStatement ps, final int from, final ImageKey key)
      throws SQLException {
    ps.setString(from, key.customer());
    ps.setObject(from + 1, key.uploadDate());
    ps.setString(from + 2, key.filename());
  }

  private static boolean isUniqueViolation(final SQLException e) {
    final var state = e.getSQLState();
    return state != null && state.startsWith("23");
  }
}
