package com.driveflow.crm.modules.evaluation;

import com.driveflow.crm.TestData;
import com.driveflow.crm.modules.enrollment.Enrollment;
import com.driveflow.crm.modules.lesson.Lesson;
import com.driveflow.crm.modules.license.License;
import com.driveflow.crm.modules.template.ExamTemplate;
import com.driveflow.crm.modules.user.User;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.security.test.context.support.WithMockUser;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * HTTP surface of evaluations with authentication enabled: status codes and the
 * error kind carried in the JSON body.
 */
@SpringBootTest
@ActiveProfiles("test")
@AutoConfigureMockMvc
class EvaluationControllerTest {

    private static final Long SCHOOL = 1L;

    @Autowired private MockMvc mvc;
    @Autowired private ObjectMapper objectMapper;
    @Autowired private TestData data;

    private User student;
    private User instructor;
    private License license;
    private Lesson lesson;
    private List<Long> items;

    @BeforeEach
    void setUp() {
        data.wipe();
        student = data.user(User.Role.STUDENT, "Ana", SCHOOL);
        instructor = data.user(User.Role.INSTRUCTOR, "Ivan", SCHOOL);
        license = data.license("B");
        ExamTemplate template = data.template(license, 21, 3, 5, 1);
        items = data.itemIds(template);
        Enrollment enrollment = data.enrollment(student, instructor, license, SCHOOL);
        lesson = data.lesson(enrollment, LocalDate.of(2026, 5, 4));
    }

    @AfterEach
    void tearDown() {
        data.wipe();
    }

    @Test
    void noTokenReturns401Json() throws Exception {
        mvc.perform(get("/api/evaluations/1"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("UNAUTHORIZED"));
    }

    @Test
    void garbageTokenReturns401() throws Exception {
        mvc.perform(get("/api/evaluations/1").header(HttpHeaders.AUTHORIZATION, "Bearer not.a.jwt"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void instructorSubmitsAndStudentReadsBack() throws Exception {
        MvcResult created = mvc.perform(post("/api/lessons/{id}/evaluations", lesson.getId())
                        .header(HttpHeaders.AUTHORIZATION, data.bearer(instructor))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(sheet(items.get(0), 2, items.get(1), 1)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.totalPoints").value(11))
                .andExpect(jsonPath("$.maxPoints").value(21))
                .andExpect(jsonPath("$.result").value("OK"))
                .andReturn();
        long id = objectMapper.readTree(created.getResponse().getContentAsString()).get("id").asLong();

        mvc.perform(get("/api/evaluations/{id}", id).header(HttpHeaders.AUTHORIZATION, data.bearer(student)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.lessonId").value(lesson.getId()))
                .andExpect(jsonPath("$.lessonDate").value("2026-05-04"))
                .andExpect(jsonPath("$.mistakes.length()").value(2))
                .andExpect(jsonPath("$.mistakes[0].description").value("Item 1"))
                .andExpect(jsonPath("$.mistakes[0].count").value(2));

        mvc.perform(get("/api/lessons/{id}/evaluation", lesson.getId())
                        .header(HttpHeaders.AUTHORIZATION, data.bearer(instructor)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(id));
    }

    @Test
    void submitWithoutBodyScoresEmptySheet() throws Exception {
        mvc.perform(post("/api/lessons/{id}/evaluations", lesson.getId())
                        .header(HttpHeaders.AUTHORIZATION, data.bearer(instructor)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.totalPoints").value(0))
                .andExpect(jsonPath("$.result").value("OK"));
    }

    @Test
    void duplicateSubmitReturns409() throws Exception {
        submitEmpty(instructor).andExpect(status().isCreated());

        submitEmpty(instructor)
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("CONFLICT"));
    }

    @Test
    void studentCannotSubmit() throws Exception {
        submitEmpty(student)
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error").value("FORBIDDEN"));
    }

    @Test
    @WithMockUser(roles = "SUPER_ADMIN")
    void platformAdminIsNotAnEvaluationRole() throws Exception {
        mvc.perform(get("/api/evaluations/{id}", 1))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error").value("FORBIDDEN"));
    }

    @Test
    void unassignedInstructorCannotSubmit() throws Exception {
        submitEmpty(data.user(User.Role.INSTRUCTOR, "Petar", SCHOOL))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error").value("FORBIDDEN"));
    }

    @Test
    void unknownItemReturns400() throws Exception {
        mvc.perform(post("/api/lessons/{id}/evaluations", lesson.getId())
                        .header(HttpHeaders.AUTHORIZATION, data.bearer(instructor))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(sheet(items.get(0), 1, 987_654L, 1)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_ARGUMENT"));
    }

    @Test
    void negativeCountReturns400() throws Exception {
        mvc.perform(post("/api/lessons/{id}/evaluations", lesson.getId())
                        .header(HttpHeaders.AUTHORIZATION, data.bearer(instructor))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(sheet(items.get(0), -1)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_ARGUMENT"));
    }

    @Test
    void studentWithMalformedSheetIsStillForbidden() throws Exception {
        mvc.perform(post("/api/lessons/{id}/evaluations", lesson.getId())
                        .header(HttpHeaders.AUTHORIZATION, data.bearer(student))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"mistakes\":[{\"itemId\":null,\"count\":-3}],\"maxPoints\":-1}"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error").value("FORBIDDEN"));
    }

    @Test
    void missingCountReturns400() throws Exception {
        mvc.perform(post("/api/lessons/{id}/evaluations", lesson.getId())
                        .header(HttpHeaders.AUTHORIZATION, data.bearer(instructor))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"mistakes\":[{\"itemId\":" + items.get(0) + "}]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_ARGUMENT"));
    }

    @Test
    void unknownLessonReturns404() throws Exception {
        mvc.perform(post("/api/lessons/{id}/evaluations", lesson.getId() + 500)
                        .header(HttpHeaders.AUTHORIZATION, data.bearer(instructor)))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("NOT_FOUND"));
    }

    @Test
    void historyPagingIsValidated() throws Exception {
        mvc.perform(get("/api/students/{id}/evaluations", student.getId())
                        .param("pageSize", "101")
                        .header(HttpHeaders.AUTHORIZATION, data.bearer(student)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_ARGUMENT"));

        mvc.perform(get("/api/students/{id}/evaluations", student.getId())
                        .param("from", "yesterday")
                        .header(HttpHeaders.AUTHORIZATION, data.bearer(student)))
                .andExpect(status().isBadRequest());
    }

    @Test
    void historyReturnsPagedEnvelope() throws Exception {
        submitEmpty(instructor).andExpect(status().isCreated());

        MvcResult result = mvc.perform(get("/api/students/{id}/evaluations", student.getId())
                        .param("from", "2026-05-01")
                        .param("to", "2026-05-31")
                        .header(HttpHeaders.AUTHORIZATION, data.bearer(student)))
                .andExpect(status().isOk())
                .andReturn();

        JsonNode body = objectMapper.readTree(result.getResponse().getContentAsString());
        assertEquals(1, body.get("page").asInt());
        assertEquals(20, body.get("pageSize").asInt());
        assertEquals(1, body.get("total").asLong());
        assertEquals("2026-05-04", body.get("items").get(0).get("date").asText());
    }

    @Test
    void examTemplateIsReadable() throws Exception {
        mvc.perform(get("/api/licenses/{id}/exam-template", license.getId())
                        .header(HttpHeaders.AUTHORIZATION, data.bearer(student)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.maxPoints").value(21))
                .andExpect(jsonPath("$.items.length()").value(3))
                .andExpect(jsonPath("$.items[0].orderIndex").value(1));
    }

    private org.springframework.test.web.servlet.ResultActions submitEmpty(User caller) throws Exception {
        return mvc.perform(post("/api/lessons/{id}/evaluations", lesson.getId())
                .header(HttpHeaders.AUTHORIZATION, data.bearer(caller))
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"mistakes\":[]}"));
    }

    private static String sheet(Object... idCountPairs) {
        StringBuilder json = new StringBuilder("{\"mistakes\":[");
        for (int i = 0; i < idCountPairs.length; i += 2) {
            if (i > 0) {
                json.append(',');
            }
            json.append("{\"itemId\":").append(idCountPairs[i])
                    .append(",\"count\":").append(idCountPairs[i + 1]).append('}');
        }
        return json.append("]}").toString();
    }
}
