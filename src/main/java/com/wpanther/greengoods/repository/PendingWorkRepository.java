package com.wpanther.greengoods.repository;

import com.wpanther.greengoods.entity.PendingWork;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface PendingWorkRepository extends JpaRepository<PendingWork, String> {

    /**
     * Pending work for a garden, most recent first
     */
    List<PendingWork> findByGardenAddressOrderByCreatedAtDescIdDesc(String gardenAddress);

    /**
     * Delete by id, reporting how many rows went away
     */
    @Modifying(clearAutomatically = true)
    @Query("delete from PendingWork w where w.id = :id")
    int deleteByIdReturningCount(@Param("id") String id);
}
