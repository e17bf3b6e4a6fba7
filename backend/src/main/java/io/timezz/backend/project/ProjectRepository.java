package io.timezz.backend.project;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ProjectRepository extends JpaRepository<Project, UUID> {

  Optional<Project> findByIdAndOwnerId(UUID id, UUID ownerId);

  List<Project> findByOwnerIdOrderByCreatedAtDesc(UUID ownerId);

  long countByOwnerIdAndStatusNot(UUID ownerId, ProjectStatus status);
}
