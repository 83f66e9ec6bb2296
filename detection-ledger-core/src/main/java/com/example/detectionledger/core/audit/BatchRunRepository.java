package com.example.detectionledger.core.audit;

import com.example.detectionledger.core.TransactionException;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Types;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

/** Reads and writes {@code batch_run_information} on the caller's unit of work. */
public class BatchRunRepository {

  private static final String INSERT =
      """
      INSERT INTO batch_run_information
        (run_id, start_time, end_time, model, success, error_code)
      VALUES (?, ?, ?, ?, ?, ?)
      """;
  private static final String SELECT_BY_RUN =
      """
      SELECT run_id, start_time, end_time, model, success, error_code
      FROM batch_run_information WHERE run_id = ? ORDER BY end_time
      """;

  public void insert(final Connection conn, final BatchRunRecord record) {
    try (var ps = conn.prepareStatement(INSERT)) {
      ps.setString(1, record.runId());
      ps.setObject(2, record.startTime());
      ps.setObject(3, record.endTime());
      ps.setString(4, record.model());
      ps.setBoolean(5, record.success());
      if (record.errorCode() == null) ps.setNull(6, Types.VARCHAR);
      else ps.setString(6, record.errorCode());
      ps.executeUpdate();
    } catch (final SQLException e) {
      throw new TransactionException("Failed to insert run record for " + record.runId(), e);
    }
  }

  /**
   * All records written for a run. More than one means the run id was replayed.
   *
   * @param conn connection of the caller's unit of work
   * @param runId run to look up
   * @return records ordered by end time
   */
  public List<BatchRunRecord> findByRunId(final Connection conn, final String runId) {
    try (var ps = conn.prepareStatement(SELECT_BY_RUN)) {
      ps.setString(1, runId);
      final var records = new ArrayList<BatchRunRecord>();
      try (var rs = ps.executeQuery()) {
        while (rs.next()) {
          records.add(
              new BatchRunRecord(
                  rs.getString(1),
                  rs.getObject(2, OffsetDateTime.class),
                  rs.getObject(3, OffsetDateTime.class),
                  rs.getString(4),
                  rs.getBoolean(5),
                  rs.getString(6)));
        }
      }
      return records;
    } catch (final SQLException e) {
      throw new TransactionException("Failed to read run records for " + runId, e);
    }
  }
}
