package tw.gc.auto.control.repositories;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import tw.gc.auto.control.entities.ControlEvent;

import java.util.List;

@Repository
public interface ControlEventRepository extends JpaRepository<ControlEvent, Long> {

    List<ControlEvent> findAllByOrderByOccurredAtDesc(Pageable pageable);

    List<ControlEvent> findByCategoryOrderByOccurredAtDesc(String category, Pageable pageable);
}
