package io.b2mash.outline.outline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.nullValue;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.jayway.jsonpath.JsonPath;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.MethodOrderer;
import org.junit.jupiter.api.Order;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.junit.jupiter.api.TestMethodOrder;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
@TestMethodOrder(MethodOrderer.OrderAnnotation.class)
class OutlineIntegrationTest {

  @Autowired private MockMvc mockMvc;
  @Autowired private SectionOrderingEngine orderingEngine;

  private String templateId;
  private String kickoffId;
  private String planningId;
  private String wrapUpId;
  private String agendaId;
  private String slidesId;

  @BeforeAll
  void setup() throws Exception {
    templateId =
        extractId(
            mockMvc
                .perform(
                    post("/api/project-templates")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(
                            """
                            {"name": "Quarterly review", "description": "QBR", "meetingType": "QBR"}
                            """))
                .andExpect(status().isCreated())
                .andReturn()
                .getResponse()
                .getContentAsString());

    kickoffId = createSection("Kickoff");
    planningId = createSection("Planning");
    wrapUpId = createSection("Wrap-up");
  }

  @Test
  @Order(1)
  void createTaskAndSubtask_outlineShowsNesting() throws Exception {
    agendaId =
        extractId(
            mockMvc
                .perform(
                    post("/api/tasks")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(
                            """
                            {"sectionId": "%s", "title": "Agenda"}
                            """
                                .formatted(kickoffId)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.sortOrder").value(1))
                .andReturn()
                .getResponse()
                .getContentAsString());

    slidesId =
        extractId(
            mockMvc
                .perform(
                    post(
                            "/api/project-templates/{t}/outline/tasks/{p}/subtasks",
                            templateId,
                            agendaId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                            {"title": "Slides"}
                            """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.parentId").value(agendaId))
                .andReturn()
                .getResponse()
                .getContentAsString());

    mockMvc
        .perform(get("/api/project-templates/{t}/outline", templateId))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$", hasSize(3)))
        .andExpect(jsonPath("$[0].title").value("Kickoff"))
        .andExpect(jsonPath("$[0].taskCount").value(2))
        .andExpect(jsonPath("$[0].tasks", hasSize(1)))
        .andExpect(jsonPath("$[0].tasks[0].title").value("Agenda"))
        .andExpect(jsonPath("$[0].tasks[0].children[0].title").value("Slides"));

    mockMvc
        .perform(
            get("/api/project-templates/{t}/outline/sections/{s}/rows", templateId, kickoffId))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[1].title").value("Slides"))
        .andExpect(jsonPath("$[1].depth").value(1));
  }

  @Test
  @Order(2)
  void createTask_blankTitle_returns400() throws Exception {
    mockMvc
        .perform(
            post("/api/tasks")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"sectionId": "%s", "title": ""}
                    """
                        .formatted(kickoffId)))
        .andExpect(status().isBadRequest());
  }

  @Test
  @Order(3)
  void moveSection_persistsNewOrder() throws Exception {
    mockMvc
        .perform(
            post(
                    "/api/project-templates/{t}/outline/sections/{s}/move",
                    templateId,
                    wrapUpId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"targetIndex": 0}
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.state").value("CONFIRMED"))
        .andExpect(jsonPath("$.superseded").value(false))
        .andExpect(jsonPath("$.order[0]").value(wrapUpId));

    mockMvc
        .perform(get("/api/project-templates/{t}/sections", templateId))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].id").value(wrapUpId))
        .andExpect(jsonPath("$[1].id").value(kickoffId))
        .andExpect(jsonPath("$[2].id").value(planningId));

    mockMvc
        .perform(get("/api/project-templates/{t}/outline", templateId))
        .andExpect(jsonPath("$[0].title").value("Wrap-up"))
        .andExpect(jsonPath("$[1].taskCount").value(2));
  }

  @Test
  @Order(4)
  void reorderSections_staleList_returns409() throws Exception {
    mockMvc
        .perform(
            put("/api/project-templates/{t}/sections/order", templateId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"sectionIds": ["%s", "%s"]}
                    """
                        .formatted(kickoffId, planningId)))
        .andExpect(status().isConflict());
  }

  @Test
  @Order(5)
  void moveTask_underOwnChild_returns400() throws Exception {
    mockMvc
        .perform(
            post("/api/project-templates/{t}/outline/tasks/{id}/move", templateId, agendaId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"parentId": "%s"}
                    """
                        .formatted(slidesId)))
        .andExpect(status().isBadRequest());
  }

  @Test
  @Order(6)
  void deleteParentTask_childSurfacesAsRoot() throws Exception {
    mockMvc.perform(delete("/api/tasks/{id}", agendaId)).andExpect(status().isNoContent());

    mockMvc
        .perform(get("/api/project-templates/{t}/outline", templateId))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[1].tasks", hasSize(1)))
        .andExpect(jsonPath("$[1].tasks[0].title").value("Slides"))
        .andExpect(jsonPath("$[1].tasks[0].parentId").value(agendaId));
  }

  @Test
  @Order(7)
  void patchTask_detachParent_clearsDanglingReference() throws Exception {
    mockMvc
        .perform(
            patch("/api/tasks/{id}", slidesId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"detachParent": true, "assignedTo": "me", "estimatedDays": 2}
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.parentId").value(nullValue()))
        .andExpect(jsonPath("$.assignedTo").value("me"))
        .andExpect(jsonPath("$.estimatedDays").value(2));
  }

  @Test
  @Order(8)
  void duplicateTemplate_copiesSectionsAndTasks() throws Exception {
    var copyId =
        extractId(
            mockMvc
                .perform(post("/api/project-templates/{t}/duplicate", templateId))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.name").value("Quarterly review (Copy)"))
                .andExpect(jsonPath("$.sectionCount").value(3))
                .andExpect(jsonPath("$.taskCount").value(1))
                .andReturn()
                .getResponse()
                .getContentAsString());

    assertThat(copyId).isNotEqualTo(templateId);
  }

  @Test
  @Order(9)
  void deleteSection_removesItsTasks() throws Exception {
    mockMvc.perform(delete("/api/sections/{id}", kickoffId)).andExpect(status().isNoContent());

    mockMvc
        .perform(get("/api/project-templates/{t}/outline", templateId))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$", hasSize(2)))
        .andExpect(jsonPath("$[0].title").value("Wrap-up"))
        .andExpect(jsonPath("$[1].title").value("Planning"));

    mockMvc.perform(get("/api/tasks/{id}", slidesId)).andExpect(status().isNotFound());
  }

  @Test
  @Order(10)
  void outline_unknownTemplate_returns404() throws Exception {
    mockMvc
        .perform(get("/api/project-templates/{t}/outline", UUID.randomUUID()))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.title").value("Project template not found"))
        .andExpect(jsonPath("$.resourceType").value("ProjectTemplate"));
  }

  @Test
  @Order(11)
  void reorderSectionsThroughRest_afterOutlineMove_outlineShowsStoreOrder() throws Exception {
    mockMvc
        .perform(
            put("/api/project-templates/{t}/sections/order", templateId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"sectionIds": ["%s", "%s"]}
                    """
                        .formatted(planningId, wrapUpId)))
        .andExpect(status().isOk());

    mockMvc
        .perform(get("/api/project-templates/{t}/outline", templateId))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].title").value("Planning"))
        .andExpect(jsonPath("$[1].title").value("Wrap-up"));

    var id = UUID.fromString(templateId);
    assertThat(orderingEngine.state(id)).isEqualTo(ReorderState.IDLE);
    assertThat(orderingEngine.confirmedOrder(id))
        .contains(List.of(UUID.fromString(planningId), UUID.fromString(wrapUpId)));

    mockMvc
        .perform(
            post(
                    "/api/project-templates/{t}/outline/sections/{s}/move",
                    templateId,
                    wrapUpId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"targetIndex": 0}
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.order[0]").value(wrapUpId))
        .andExpect(jsonPath("$.order[1]").value(planningId));
  }

  @Test
  @Order(12)
  void deleteTemplate_forgetsItsSectionOrder() throws Exception {
    var id = UUID.fromString(templateId);
    assertThat(orderingEngine.displayedOrder(id)).isPresent();

    mockMvc
        .perform(delete("/api/project-templates/{t}", templateId))
        .andExpect(status().isNoContent());

    assertThat(orderingEngine.state(id)).isEqualTo(ReorderState.IDLE);
    assertThat(orderingEngine.displayedOrder(id)).isEmpty();
    mockMvc
        .perform(get("/api/project-templates/{t}/outline", templateId))
        .andExpect(status().isNotFound());
  }

  private String createSection(String title) throws Exception {
    return extractId(
        mockMvc
            .perform(
                post("/api/sections")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(
                        """
                        {"templateId": "%s", "title": "%s"}
                        """
                            .formatted(templateId, title)))
            .andExpect(status().isCreated())
            .andReturn()
            .getResponse()
            .getContentAsString());
  }

  private static String extractId(String json) {
    return JsonPath.read(json, "$.id");
  }
}
