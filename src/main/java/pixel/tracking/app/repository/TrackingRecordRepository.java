package pixel.tracking.app.repository;

import jakarta.persistence.LockModeType;
import pixel.tracking.app.entity.TrackingRecordEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface TrackingRecordRepository extends JpaRepository<TrackingRecordEntity, String> {
    List<TrackingRecordEntity> findByCampaignId(String campaignId);

    // SELECT ... FOR UPDATE; holds the row until the surrounding transaction ends
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM TrackingRecordEntity r WHERE r.identifier = :identifier")
    Optional<TrackingRecordEntity> findForUpdate(@Param("identifier") String identifier);
}
