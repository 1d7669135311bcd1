package com.starscape.imagevariants.features.imagerecord.infra;

import com.starscape.imagevariants.features.imagerecord.domain.ImageRecord;
import com.starscape.imagevariants.features.imagerecord.domain.ImageRecordRepository;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface JpaImageRecordRepository extends JpaRepository<ImageRecord, Long>, ImageRecordRepository {

    @Query("SELECT i FROM ImageRecord i WHERE i.parentId = :parentId AND ("
            + "(i.wantedWidth IS NULL AND (i.width = :width OR i.height = :height)) "
            + "OR i.wantedWidth = :width OR i.wantedHeight = :height) "
            + "ORDER BY i.width DESC, i.height DESC")
    List<ImageRecord> findMatchingChildren(
            @Param("parentId") Long parentId,
            @Param("width") int width,
            @Param("height") int height,
            Pageable pageable);

    @Override
    default Optional<ImageRecord> findChild(Long parentId, int width, int height) {
        return findMatchingChildren(parentId, width, height, PageRequest.of(0, 1)).stream().findFirst();
    }

    long countByParentId(Long parentId);

    long countByLocator(String locator);
}
