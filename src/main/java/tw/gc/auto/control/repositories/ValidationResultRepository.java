package tw.gc.auto.control.repositories;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import tw.gc.auto.control.entities.ValidationResult;

import java.util.List;
import java.util.Optional;

@Repository
public interface ValidationResultRepository extends JpaRepository<ValidationResult, Long> {

    List<ValidationResult> findByCandidateIdOrderByValidatedAtDesc(String candidateId);

    Optional<ValidationResult> findFirstByCandidateIdAndPipelineIdOrderByValidatedAtDesc(String candidateId, String pipelineId);
}
