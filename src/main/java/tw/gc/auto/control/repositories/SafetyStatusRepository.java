package tw.gc.auto.control.repositories;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import tw.gc.auto.control.entities.SafetyStatus;

@Repository
public interface SafetyStatusRepository extends JpaRepository<SafetyStatus, Long> {
}
