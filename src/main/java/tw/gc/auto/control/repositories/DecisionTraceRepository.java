package tw.gc.auto.control.repositories;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import tw.gc.auto.control.entities.DecisionTrace;

import java.util.List;

@Repository
public interface DecisionTraceRepository extends JpaRepository<DecisionTrace, String> {

    List<DecisionTrace> findBySymbolOrderByAsOfDesc(String symbol, Pageable pageable);

    List<DecisionTrace> findAllByOrderByAsOfDesc(Pageable pageable);
}
