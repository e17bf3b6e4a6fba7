package io.timezz.backend.client;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ClientRepository extends JpaRepository<Client, UUID> {

  Optional<Client> findByIdAndOwnerId(UUID id, UUID ownerId);

  List<Client> findByOwnerIdOrderByNameAsc(UUID ownerId);
}
