package tw.gc.auto.control.repositories;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import tw.gc.auto.control.entities.EventReactionStats;

import java.util.List;
import java.util.Optional;

@Repository
public interface EventReactionStatsRepository extends JpaRepository<EventReactionStats, Long> {

    Optional<EventReactionStats> findByEventTypeAndSector(String eventType, String sector);

    List<EventReactionStats> findByPassesValidationTrue();
}
