package com.example.pairprog.repository;

import com.example.pairprog.model.PersistentRoom;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface PersistentRoomRepository extends JpaRepository<PersistentRoom, String> {

    List<PersistentRoom> findAllByOrderByCreatedAtDesc();
}
