package tw.gc.auto.control.repositories;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import tw.gc.auto.control.entities.PromotionPipeline;

import java.util.List;

@Repository
public interface PromotionPipelineRepository extends JpaRepository<PromotionPipeline, String> {

    List<PromotionPipeline> findByActiveTrue();

    List<PromotionPipeline> findAllByOrderByCreatedAtAsc();
}
