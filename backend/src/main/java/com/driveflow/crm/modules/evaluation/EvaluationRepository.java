package com.driveflow.crm.modules.evaluation;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface EvaluationRepository extends JpaRepository<Evaluation, Long> {

    boolean existsByLessonId(Long lessonId);

    Optional<Evaluation> findByLessonId(Long lessonId);

    // Loads the evaluation together with its ownership chain and template items
    @Query("SELECT ev FROM Evaluation ev JOIN FETCH ev.lesson l LEFT JOIN FETCH l.enrollment e " +
            "LEFT JOIN FETCH e.student LEFT JOIN FETCH e.instructor " +
            "JOIN FETCH ev.template t LEFT JOIN FETCH t.items WHERE ev.id = :id")
    Optional<Evaluation> findDetailedById(@Param("id") Long id);

    // Student history, newest lesson first; bounds are inclusive
    @Query(value = "SELECT ev FROM Evaluation ev JOIN ev.lesson l " +
            "WHERE l.enrollment.student.id = :studentId AND l.date BETWEEN :from AND :to " +
            "ORDER BY l.date DESC, ev.id DESC",
            countQuery = "SELECT COUNT(ev) FROM Evaluation ev JOIN ev.lesson l " +
                    "WHERE l.enrollment.student.id = :studentId AND l.date BETWEEN :from AND :to")
    Page<Evaluation> findPageByStudentIdBetween(@Param("studentId") UUID studentId,
            @Param("from") LocalDate from, @Param("to") LocalDate to, Pageable pageable);

    @Query("SELECT COUNT(ev) FROM Evaluation ev JOIN ev.lesson l " +
            "WHERE l.enrollment.student.id = :studentId AND l.date BETWEEN :from AND :to")
    long countByStudentIdBetween(@Param("studentId") UUID studentId,
            @Param("from") LocalDate from, @Param("to") LocalDate to);
}
