package tw.gc.auto.control.repositories;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import tw.gc.auto.control.entities.CapitalAllocation;
import tw.gc.auto.control.enums.AllocationStatus;

import java.util.List;

@Repository
public interface CapitalAllocationRepository extends JpaRepository<CapitalAllocation, Long> {

    List<CapitalAllocation> findByPoolId(String poolId);

    List<CapitalAllocation> findByStatus(AllocationStatus status);

    List<CapitalAllocation> findByPoolIdAndStatus(String poolId, AllocationStatus status);

    long countByPoolIdAndStatus(String poolId, AllocationStatus status);
}
