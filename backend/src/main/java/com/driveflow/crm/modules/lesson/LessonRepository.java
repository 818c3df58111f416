package com.driveflow.crm.modules.lesson;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface LessonRepository extends JpaRepository<Lesson, Long> {

    // Resolves the whole ownership chain in one round trip
    @Query("SELECT l FROM Lesson l LEFT JOIN FETCH l.enrollment e LEFT JOIN FETCH e.student " +
            "LEFT JOIN FETCH e.instructor LEFT JOIN FETCH e.license WHERE l.id = :id")
    Optional<Lesson> findWithEnrollmentById(@Param("id") Long id);
}
