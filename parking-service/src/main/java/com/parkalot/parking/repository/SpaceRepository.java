package com.parkalot.parking.repository;

import com.parkalot.parking.domain.Space;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface SpaceRepository extends JpaRepository<Space, Long> {

    List<Space> findByOwnerIdOrderByCreatedAtDesc(Long ownerId);
}
