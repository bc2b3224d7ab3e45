package com.ecgheartbeat.backend.repository;

import com.ecgheartbeat.backend.entity.EcgResult;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface EcgResultRepository extends JpaRepository<EcgResult, Long> {
    List<EcgResult> findByUserIdOrderByTanggalDescWaktuDesc(Long userId);

    Optional<EcgResult> findByIdAndUserId(Long id, Long userId);

    long countByUserId(Long userId);

    @Modifying(clearAutomatically = true)
    @Query("DELETE FROM EcgResult e WHERE e.userId = :userId")
    int deleteAllOwnedBy(@Param("userId") Long userId);
}
