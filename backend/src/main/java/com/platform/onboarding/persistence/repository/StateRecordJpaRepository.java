package com.platform.onboarding.persistence.repository;

import com.platform.onboarding.persistence.entity.StateRecordEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Spring Data JPA repository for state records.
 */
@Repository
public interface StateRecordJpaRepository extends JpaRepository<StateRecordEntity, String> {

    @Query("SELECT r.recordKey FROM StateRecordEntity r WHERE r.recordKey LIKE CONCAT(:prefix, '%')")
    List<String> findKeysStartingWith(@Param("prefix") String prefix);
}
