package com.starscape.photolog.features.metadata.infra;

import com.starscape.photolog.features.metadata.domain.UploadStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

@Repository
public interface JpaPhotoEntityRepository extends JpaRepository<PhotoEntity, String> {

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE PhotoEntity p SET p.fileUrl = :fileUrl, p.thumbnailUrlsJson = :thumbnailUrls WHERE p.id = :id")
    int updateUrls(@Param("id") String id,
                   @Param("fileUrl") String fileUrl,
                   @Param("thumbnailUrls") String thumbnailUrlsJson);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE PhotoEntity p SET p.uploadStatus = :status WHERE p.id = :id")
    int updateStatus(@Param("id") String id, @Param("status") UploadStatus status);

    /**
     * Status change that only applies while the row still has the expected status.
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE PhotoEntity p SET p.uploadStatus = :to WHERE p.id = :id AND p.uploadStatus = :from")
    int transitionStatus(@Param("id") String id,
                         @Param("from") UploadStatus from,
                         @Param("to") UploadStatus to);

    @Query("SELECT p.id FROM PhotoEntity p WHERE p.uploadStatus = :status AND p.uploadTimestamp < :cutoff " +
           "ORDER BY p.uploadTimestamp ASC")
    List<String> findIdsByStatusUploadedBefore(@Param("status") UploadStatus status,
                                               @Param("cutoff") Instant cutoff);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM PhotoEntity p WHERE p.id = :id")
    int deleteByIdReturningCount(@Param("id") String id);

    /**
     * Rows within {@code radiusKm} of the point, nearest first. Haversine in SQL; the cosine
     * term is clamped to 1 so rounding never pushes ACOS out of its domain.
     */
    @Query(value = """
            SELECT * FROM photos p
            WHERE p.latitude IS NOT NULL AND p.longitude IS NOT NULL
              AND 6371.0 * ACOS(LEAST(1.0, GREATEST(-1.0,
                    COS(RADIANS(:lat)) * COS(RADIANS(p.latitude)) * COS(RADIANS(p.longitude) - RADIANS(:lon))
                    + SIN(RADIANS(:lat)) * SIN(RADIANS(p.latitude))))) <= :radiusKm
            ORDER BY 6371.0 * ACOS(LEAST(1.0, GREATEST(-1.0,
                    COS(RADIANS(:lat)) * COS(RADIANS(p.latitude)) * COS(RADIANS(p.longitude) - RADIANS(:lon))
                    + SIN(RADIANS(:lat)) * SIN(RADIANS(p.latitude))))) ASC, p.id ASC
            LIMIT :limit
            """, nativeQuery = true)
    List<PhotoEntity> findWithinRadius(@Param("lat") double latitude,
                                       @Param("lon") double longitude,
                                       @Param("radiusKm") double radiusKm,
                                       @Param("limit") int limit);
}
