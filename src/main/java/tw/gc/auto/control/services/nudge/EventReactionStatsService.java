package tw.gc.auto.control.services.nudge;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import tw.gc.auto.control.entities.EventReactionStats;
import tw.gc.auto.control.repositories.EventReactionStatsRepository;

import java.util.List;
import java.util.Optional;

/**
 * Read access to the reaction statistics maintained by the news ingestion side.
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class EventReactionStatsService {

    private final EventReactionStatsRepository repository;

    public Optional<EventReactionStats> getReactionStats(String eventType, String sector) {
        if (eventType == null || sector == null) {
            return Optional.empty();
        }
        return repository.findByEventTypeAndSector(eventType, sector);
    }

    public List<EventReactionStats> getValidatedEventTypes() {
        return repository.findByPassesValidationTrue();
    }
}
