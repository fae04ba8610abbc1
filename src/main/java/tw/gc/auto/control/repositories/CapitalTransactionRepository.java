package tw.gc.auto.control.repositories;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import tw.gc.auto.control.entities.CapitalTransaction;

import java.util.List;

@Repository
public interface CapitalTransactionRepository extends JpaRepository<CapitalTransaction, Long> {

    List<CapitalTransaction> findAllByOrderByIdDesc(Pageable pageable);

    List<CapitalTransaction> findByPoolIdOrderByIdDesc(String poolId, Pageable pageable);

    List<CapitalTransaction> findByAllocationIdOrderByIdAsc(Long allocationId);
}
