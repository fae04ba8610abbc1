package tw.gc.auto.control.repositories;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import tw.gc.auto.control.entities.CapitalPool;

import java.util.Optional;

@Repository
public interface CapitalPoolRepository extends JpaRepository<CapitalPool, String> {

    /**
     * Load a pool with a row lock held until the surrounding transaction ends
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM CapitalPool p WHERE p.id = :id")
    Optional<CapitalPool> findByIdForUpdate(@Param("id") String id);
}
