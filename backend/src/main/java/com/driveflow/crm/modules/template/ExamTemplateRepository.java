package com.driveflow.crm.modules.template;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface ExamTemplateRepository extends JpaRepository<ExamTemplate, Long> {

    @Query("SELECT t FROM ExamTemplate t LEFT JOIN FETCH t.items WHERE t.license.id = :licenseId")
    Optional<ExamTemplate> findWithItemsByLicenseId(@Param("licenseId") Long licenseId);

    boolean existsByLicenseId(Long licenseId);
}
