package com.driveflow.crm.modules.evaluation;

import com.driveflow.crm.TestData;
import com.driveflow.crm.exception.BusinessException;
import com.driveflow.crm.exception.ResourceNotFoundException;
import com.driveflow.crm.exception.UnauthorizedAccessException;
import com.driveflow.crm.modules.enrollment.Enrollment;
import com.driveflow.crm.modules.evaluation.dto.EvaluationHistoryItemDto;
import com.driveflow.crm.modules.evaluation.dto.PagedResult;
import com.driveflow.crm.modules.evaluation.dto.SubmitEvaluationRequest;
import com.driveflow.crm.modules.license.License;
import com.driveflow.crm.modules.user.User;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@ActiveProfiles("test")
class EvaluationHistoryServiceTest {

    private static final Long SCHOOL = 1L;
    private static final LocalDate TODAY = LocalDate.of(2026, 6, 30);

    @Autowired private TestData data;
    @Autowired private EvaluationService evaluationService;
    @Autowired private EvaluationHistoryService historyService;

    private User student;
    private User instructor;
    private Enrollment enrollment;

    @BeforeEach
    void setUp() {
        data.wipe();
        student = data.user(User.Role.STUDENT, "Ana", SCHOOL);
        instructor = data.user(User.Role.INSTRUCTOR, "Ivan", SCHOOL);
        License license = data.license("B");
        data.template(license, 21, 3, 5);
        enrollment = data.enrollment(student, instructor, license, SCHOOL);
    }

    @AfterEach
    void tearDown() {
        data.signOut();
        data.wipe();
    }

    @Test
    void newestLessonComesFirst() {
        evaluateLessonsOn(TODAY.minusDays(5), TODAY.minusDays(1), TODAY.minusDays(10));
        data.authenticateAs(student);

        PagedResult<EvaluationHistoryItemDto> page = historyService.listStudentEvaluations(
                student.getId(), null, null, 1, 20);

        assertEquals(3, page.total());
        assertEquals(List.of(TODAY.minusDays(1), TODAY.minusDays(5), TODAY.minusDays(10)),
                page.items().stream().map(EvaluationHistoryItemDto::getDate).toList());
    }

    @Test
    void dateBoundsAreInclusive() {
        evaluateLessonsOn(TODAY.minusDays(5), TODAY.minusDays(1), TODAY.minusDays(10));
        data.authenticateAs(student);

        PagedResult<EvaluationHistoryItemDto> recent = historyService.listStudentEvaluations(
                student.getId(), TODAY.minusDays(7), null, 1, 20);
        PagedResult<EvaluationHistoryItemDto> window = historyService.listStudentEvaluations(
                student.getId(), TODAY.minusDays(10), TODAY.minusDays(5), 1, 20);

        assertEquals(List.of(TODAY.minusDays(1), TODAY.minusDays(5)),
                recent.items().stream().map(EvaluationHistoryItemDto::getDate).toList());
        assertEquals(List.of(TODAY.minusDays(5), TODAY.minusDays(10)),
                window.items().stream().map(EvaluationHistoryItemDto::getDate).toList());
    }

    @Test
    void pagesThroughHistory() {
        evaluateLessonsOn(TODAY.minusDays(1), TODAY.minusDays(2), TODAY.minusDays(3),
                TODAY.minusDays(4), TODAY.minusDays(5));
        data.authenticateAs(student);

        PagedResult<EvaluationHistoryItemDto> second = historyService.listStudentEvaluations(
                student.getId(), null, null, 2, 2);
        PagedResult<EvaluationHistoryItemDto> beyond = historyService.listStudentEvaluations(
                student.getId(), null, null, 4, 2);

        assertEquals(5, second.total());
        assertEquals(2, second.page());
        assertEquals(List.of(TODAY.minusDays(3), TODAY.minusDays(4)),
                second.items().stream().map(EvaluationHistoryItemDto::getDate).toList());
        assertEquals(5, beyond.total());
        assertTrue(beyond.items().isEmpty());
    }

    @Test
    void pageBeyondAddressableOffsetIsEmptyWithTotal() {
        evaluateLessonsOn(TODAY);
        data.authenticateAs(student);

        PagedResult<EvaluationHistoryItemDto> far = historyService.listStudentEvaluations(
                student.getId(), null, null, 30_000_000, 100);
        PagedResult<EvaluationHistoryItemDto> last = historyService.listStudentEvaluations(
                student.getId(), null, null, Integer.MAX_VALUE, EvaluationHistoryService.MAX_PAGE_SIZE);

        assertEquals(30_000_000, far.page());
        assertEquals(1, far.total());
        assertTrue(far.items().isEmpty());
        assertEquals(1, last.total());
        assertTrue(last.items().isEmpty());
    }

    @Test
    void historyItemsCarryScore() {
        evaluateLessonsOn(TODAY);
        data.authenticateAs(instructor);

        EvaluationHistoryItemDto item = historyService.listStudentEvaluations(
                student.getId(), null, null, 1, 20).items().get(0);

        assertEquals(0, item.getTotalPoints());
        assertEquals(21, item.getMaxPoints());
        assertEquals(EvaluationResult.OK, item.getResult());
    }

    @Test
    void rejectsBadPaging() {
        data.authenticateAs(student);

        assertThrows(BusinessException.class,
                () -> historyService.listStudentEvaluations(student.getId(), null, null, 0, 20));
        assertThrows(BusinessException.class,
                () -> historyService.listStudentEvaluations(student.getId(), null, null, 1, 0));
        assertThrows(BusinessException.class,
                () -> historyService.listStudentEvaluations(student.getId(), null, null, 1, 101));
        assertEquals(0, historyService.listStudentEvaluations(student.getId(), null, null, 1, 100).total());
    }

    @Test
    void rejectsReversedRange() {
        data.authenticateAs(student);

        assertThrows(BusinessException.class, () -> historyService.listStudentEvaluations(
                student.getId(), TODAY, TODAY.minusDays(1), 1, 20));
    }

    @Test
    void unknownStudentIsNotFound() {
        data.authenticateAs(data.user(User.Role.SCHOOL_ADMIN, "Admin", SCHOOL));

        assertThrows(ResourceNotFoundException.class,
                () -> historyService.listStudentEvaluations(UUID.randomUUID(), null, null, 1, 20));
        assertThrows(ResourceNotFoundException.class,
                () -> historyService.listStudentEvaluations(instructor.getId(), null, null, 1, 20));
    }

    @Test
    void onlyRelatedCallersSeeHistory() {
        data.authenticateAs(data.user(User.Role.INSTRUCTOR, "Petar", SCHOOL));
        assertThrows(UnauthorizedAccessException.class,
                () -> historyService.listStudentEvaluations(student.getId(), null, null, 1, 20));

        data.authenticateAs(data.user(User.Role.STUDENT, "Mila", SCHOOL));
        assertThrows(UnauthorizedAccessException.class,
                () -> historyService.listStudentEvaluations(student.getId(), null, null, 1, 20));

        data.authenticateAs(data.user(User.Role.SCHOOL_ADMIN, "Foreign", 2L));
        assertThrows(UnauthorizedAccessException.class,
                () -> historyService.listStudentEvaluations(student.getId(), null, null, 1, 20));

        data.authenticateAs(instructor);
        assertEquals(0, historyService.listStudentEvaluations(student.getId(), null, null, 1, 20).total());
    }

    private void evaluateLessonsOn(LocalDate... dates) {
        data.authenticateAs(instructor);
        for (LocalDate date : dates) {
            evaluationService.submit(data.lesson(enrollment, date).getId(), new SubmitEvaluationRequest());
        }
    }
}
