package tw.gc.auto.control.repositories;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import tw.gc.auto.control.entities.PipelineMembership;
import tw.gc.auto.control.enums.PipelineStage;

import java.util.List;
import java.util.Optional;

@Repository
public interface PipelineMembershipRepository extends JpaRepository<PipelineMembership, Long> {

    Optional<PipelineMembership> findByPipelineIdAndCandidateId(String pipelineId, String candidateId);

    boolean existsByPipelineIdAndCandidateId(String pipelineId, String candidateId);

    /**
     * Members of one of the three sets of a pipeline, oldest first
     */
    List<PipelineMembership> findByPipelineIdAndStageOrderByEnteredAtAsc(String pipelineId, PipelineStage stage);

    List<PipelineMembership> findByCandidateId(String candidateId);

    long countByStage(PipelineStage stage);
}
