package io.timezz.backend.activity;

import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ActivityLogRepository extends JpaRepository<ActivityLog, UUID> {

  List<ActivityLog> findByUserIdOrderByOccurredAtDesc(UUID userId, Pageable pageable);
}
