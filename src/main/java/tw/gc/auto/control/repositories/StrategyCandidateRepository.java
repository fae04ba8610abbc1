package tw.gc.auto.control.repositories;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import tw.gc.auto.control.entities.StrategyCandidate;

import java.util.List;

@Repository
public interface StrategyCandidateRepository extends JpaRepository<StrategyCandidate, String> {

    List<StrategyCandidate> findByExperimentId(String experimentId);

    List<StrategyCandidate> findAllByOrderByCreatedAtDesc();
}
