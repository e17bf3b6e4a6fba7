package io.timezz.backend.timeentry;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TimeEntryRepository extends JpaRepository<TimeEntry, UUID> {

  /** The open entry of a user. The partial unique index guarantees there is at most one. */
  Optional<TimeEntry> findFirstByUserIdAndEndTimeIsNull(UUID userId);

  long countByUserIdAndEndTimeIsNull(UUID userId);

  @Query(
      """
      SELECT te FROM TimeEntry te
      WHERE te.userId = :userId
        AND te.startTime >= :from
        AND te.startTime < :to
        AND (:projectId IS NULL OR te.projectId = :projectId)
        AND (:boardId IS NULL OR te.boardId = :boardId)
        AND (:cardId IS NULL OR te.cardId = :cardId)
      """)
  Page<TimeEntry> findByFilters(
      @Param("userId") UUID userId,
      @Param("projectId") UUID projectId,
      @Param("boardId") String boardId,
      @Param("cardId") String cardId,
      @Param("from") Instant from,
      @Param("to") Instant to,
      Pageable pageable);

  /** Closed entries whose start falls in {@code [from, to)}, oldest first. */
  @Query(
      """
      SELECT te FROM TimeEntry te
      WHERE te.userId = :userId
        AND te.endTime IS NOT NULL
        AND te.startTime >= :from
        AND te.startTime < :to
        AND (:projectId IS NULL OR te.projectId = :projectId)
        AND (:boardId IS NULL OR te.boardId = :boardId)
        AND (:cardId IS NULL OR te.cardId = :cardId)
      ORDER BY te.startTime ASC
      """)
  List<TimeEntry> findClosedInRange(
      @Param("userId") UUID userId,
      @Param("from") Instant from,
      @Param("to") Instant to,
      @Param("projectId") UUID projectId,
      @Param("boardId") String boardId,
      @Param("cardId") String cardId);

  @Query(
      """
      SELECT COALESCE(SUM(te.durationMinutes), 0.0) FROM TimeEntry te
      WHERE te.userId = :userId
        AND te.endTime IS NOT NULL
        AND te.startTime >= :from
        AND te.startTime < :to
      """)
  double sumClosedMinutes(
      @Param("userId") UUID userId, @Param("from") Instant from, @Param("to") Instant to);

  @Query(
      """
      SELECT te.projectId AS projectId,
             SUM(te.durationMinutes) AS totalMinutes,
             SUM(te.amount) AS totalAmount,
             COUNT(te) AS entryCount
      FROM TimeEntry te
      WHERE te.userId = :userId
        AND te.projectId IS NOT NULL
        AND te.endTime IS NOT NULL
      GROUP BY te.projectId
      """)
  List<ProjectTotalsProjection> sumByProject(@Param("userId") UUID userId);

  List<TimeEntry> findTop10ByUserIdAndBoardIdAndEndTimeIsNotNullOrderByStartTimeDesc(
      UUID userId, String boardId);
}
