package io.b2mash.teamboard.project;

import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.jwt;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.jayway.jsonpath.JsonPath;
import io.b2mash.teamboard.TestcontainersConfiguration;
import java.util.List;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.JwtRequestPostProcessor;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;
import org.testcontainers.junit.jupiter.Testcontainers;

@SpringBootTest
@AutoConfigureMockMvc
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
@Testcontainers(disabledWithoutDocker = true)
class ProjectIntegrationTest {

  private static final String API_KEY = "test-api-key";

  @Autowired private MockMvc mockMvc;

  private String ownerId;
  private String newcomerId;
  private String watcherId;

  @BeforeAll
  void syncMembers() throws Exception {
    ownerId = syncMember("user_pj_owner", "Project Owner", "manager");
    syncMember("user_pj_other", "Other Manager", "manager");
    syncMember("user_pj_admin", "Project Admin", "admin");
    newcomerId = syncMember("user_pj_newcomer", "Newcomer", "member");
    watcherId = syncMember("user_pj_watcher", "Watcher", "member");
  }

  // --- Project update and delete ---

  @Test
  void shouldLetOnlyOwnerOrAdminUpdateProject() throws Exception {
    String projectId = createProject("Renamable");

    updateProject(projectId, jwtFor("user_pj_other", "manager"), "Hijacked")
        .andExpect(status().isForbidden());

    updateProject(projectId, ownerJwt(), "Renamed")
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.name").value("Renamed"))
        .andExpect(jsonPath("$.description").value("updated"));

    updateProject(projectId, jwtFor("user_pj_admin", "admin"), "Renamed by admin")
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.name").value("Renamed by admin"));
  }

  @Test
  void shouldDeleteProjectWithItsTasks() throws Exception {
    String projectId = createProject("Disposable");
    String taskId = createTask(projectId, ownerJwt(), "Goes with it");

    mockMvc
        .perform(delete("/api/projects/" + projectId).with(jwtFor("user_pj_other", "manager")))
        .andExpect(status().isForbidden());

    mockMvc
        .perform(delete("/api/projects/" + projectId).with(ownerJwt()))
        .andExpect(status().isNoContent());

    mockMvc
        .perform(get("/api/projects/" + projectId).with(ownerJwt()))
        .andExpect(status().isNotFound());
    mockMvc
        .perform(get("/api/tasks/" + taskId).with(ownerJwt()))
        .andExpect(status().isNotFound());
  }

  // --- Membership ---

  @Test
  void shouldGateTaskCreationAndListingOnMembership() throws Exception {
    String projectId = createProject("Members only");

    mockMvc
        .perform(
            post("/api/projects/" + projectId + "/tasks")
                .with(newcomerJwt())
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"title": "Sneaky"}
                    """))
        .andExpect(status().isForbidden());
    mockMvc
        .perform(get("/api/projects/" + projectId + "/tasks").with(newcomerJwt()))
        .andExpect(status().isForbidden());

    addMember(projectId, ownerJwt(), newcomerId).andExpect(status().isCreated());

    String taskId = createTask(projectId, newcomerJwt(), "Welcome aboard");
    mockMvc
        .perform(get("/api/projects/" + projectId + "/tasks").with(newcomerJwt()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[*].id", hasItem(taskId)));
  }

  @Test
  void shouldManageProjectMembers() throws Exception {
    String projectId = createProject("Roster");

    mockMvc
        .perform(get("/api/projects/" + projectId + "/members").with(ownerJwt()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$", hasSize(1)))
        .andExpect(jsonPath("$[0].memberId").value(ownerId))
        .andExpect(jsonPath("$[0].projectRole").value("lead"));

    addMember(projectId, jwtFor("user_pj_other", "manager"), newcomerId)
        .andExpect(status().isForbidden());
    addMember(projectId, ownerJwt(), newcomerId).andExpect(status().isCreated());
    addMember(projectId, ownerJwt(), newcomerId).andExpect(status().isConflict());

    mockMvc
        .perform(get("/api/projects/" + projectId + "/members").with(newcomerJwt()))
        .andExpect(jsonPath("$", hasSize(2)))
        .andExpect(jsonPath("$[*].projectRole", hasItem("member")));

    mockMvc
        .perform(
            delete("/api/projects/" + projectId + "/members/" + ownerId)
                .with(jwtFor("user_pj_admin", "admin")))
        .andExpect(status().isBadRequest());
    mockMvc
        .perform(delete("/api/projects/" + projectId + "/members/" + newcomerId).with(ownerJwt()))
        .andExpect(status().isNoContent());
    mockMvc
        .perform(delete("/api/projects/" + projectId + "/members/" + newcomerId).with(ownerJwt()))
        .andExpect(status().isNotFound());
  }

  @Test
  void shouldEnrolMembersListedAtCreation() throws Exception {
    var result =
        mockMvc
            .perform(
                post("/api/projects")
                    .with(ownerJwt())
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(
                        """
                        {"name": "Staffed", "memberIds": ["%s"]}
                        """
                            .formatted(watcherId)))
            .andExpect(status().isCreated())
            .andReturn();
    String projectId = JsonPath.read(result.getResponse().getContentAsString(), "$.id");

    createTask(projectId, watcherJwt(), "Already in");
  }

  // --- Deactivated members ---

  @Test
  void shouldRefuseRequestsFromDeactivatedMember() throws Exception {
    syncMember("user_pj_leaver", "Leaver", "member");
    var leaverJwt = jwtFor("user_pj_leaver", "member");

    mockMvc.perform(get("/api/tasks/mine").with(leaverJwt)).andExpect(status().isOk());

    mockMvc
        .perform(delete("/internal/members/user_pj_leaver").header("X-API-KEY", API_KEY))
        .andExpect(status().isNoContent());

    mockMvc.perform(get("/api/tasks/mine").with(leaverJwt)).andExpect(status().isForbidden());
  }

  // --- Notifications ---

  @Test
  void shouldReadAndClearNotifications() throws Exception {
    String projectId = createProject("Noisy");
    String taskId = createTaskWithStakeholder(projectId, "Review me", watcherId);
    mockMvc
        .perform(
            patch("/api/tasks/" + taskId + "/status")
                .with(ownerJwt())
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"newStatus": "TASK_REVIEW"}
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.outcome").value("PENDING"));

    var listed =
        mockMvc
            .perform(get("/api/notifications").param("size", "100").with(watcherJwt()))
            .andExpect(status().isOk())
            .andReturn();
    List<String> ids =
        JsonPath.read(
            listed.getResponse().getContentAsString(),
            "$.content[?(@.type == 'APPROVAL_REQUEST' && @.referenceEntityId == '"
                + taskId
                + "')].id");
    String notificationId = ids.get(0);

    mockMvc
        .perform(get("/api/notifications/" + notificationId).with(watcherJwt()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.type").value("APPROVAL_REQUEST"))
        .andExpect(jsonPath("$.referenceEntityId").value(taskId));
    mockMvc
        .perform(get("/api/notifications/" + notificationId).with(ownerJwt()))
        .andExpect(status().isNotFound());

    markBatchRead(ownerJwt(), notificationId).andExpect(jsonPath("$.updated").value(0));
    markBatchRead(watcherJwt(), notificationId).andExpect(jsonPath("$.updated").value(1));
    markBatchRead(watcherJwt(), notificationId).andExpect(jsonPath("$.updated").value(0));

    // Only the read notification goes by default
    mockMvc
        .perform(delete("/api/notifications/clear-all").with(watcherJwt()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.deleted").value(1));
    mockMvc
        .perform(get("/api/notifications/" + notificationId).with(watcherJwt()))
        .andExpect(status().isNotFound());

    mockMvc
        .perform(
            delete("/api/notifications/clear-all").param("readOnly", "false").with(watcherJwt()))
        .andExpect(status().isOk());
    mockMvc
        .perform(get("/api/notifications/unread-count").with(watcherJwt()))
        .andExpect(jsonPath("$.count").value(0));
  }

  @Test
  void shouldRejectBatchWithoutIds() throws Exception {
    mockMvc
        .perform(
            put("/api/notifications/read-batch")
                .with(watcherJwt())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{}"))
        .andExpect(status().isBadRequest());
  }

  // --- Helpers ---

  private String createProject(String name) throws Exception {
    var result =
        mockMvc
            .perform(
                post("/api/projects")
                    .with(ownerJwt())
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(
                        """
                        {"name": "%s"}
                        """
                            .formatted(name)))
            .andExpect(status().isCreated())
            .andReturn();
    return JsonPath.read(result.getResponse().getContentAsString(), "$.id");
  }

  private ResultActions updateProject(
      String projectId, JwtRequestPostProcessor actor, String name) throws Exception {
    return mockMvc.perform(
        put("/api/projects/" + projectId)
            .with(actor)
            .contentType(MediaType.APPLICATION_JSON)
            .content(
                """
                {"name": "%s", "description": "updated"}
                """
                    .formatted(name)));
  }

  private ResultActions addMember(String projectId, JwtRequestPostProcessor actor, String memberId)
      throws Exception {
    return mockMvc.perform(
        post("/api/projects/" + projectId + "/members")
            .with(actor)
            .contentType(MediaType.APPLICATION_JSON)
            .content(
                """
                {"memberId": "%s"}
                """
                    .formatted(memberId)));
  }

  private String createTask(String projectId, JwtRequestPostProcessor actor, String title)
      throws Exception {
    var result =
        mockMvc
            .perform(
                post("/api/projects/" + projectId + "/tasks")
                    .with(actor)
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(
                        """
                        {"title": "%s"}
                        """
                            .formatted(title)))
            .andExpect(status().isCreated())
            .andReturn();
    return JsonPath.read(result.getResponse().getContentAsString(), "$.id");
  }

  private String createTaskWithStakeholder(String projectId, String title, String stakeholderId)
      throws Exception {
    var result =
        mockMvc
            .perform(
                post("/api/projects/" + projectId + "/tasks")
                    .with(ownerJwt())
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(
                        """
                        {"title": "%s", "stakeholderIds": ["%s"]}
                        """
                            .formatted(title, stakeholderId)))
            .andExpect(status().isCreated())
            .andReturn();
    return JsonPath.read(result.getResponse().getContentAsString(), "$.id");
  }

  private ResultActions markBatchRead(JwtRequestPostProcessor actor, String notificationId)
      throws Exception {
    return mockMvc
        .perform(
            put("/api/notifications/read-batch")
                .with(actor)
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"notificationIds": ["%s"]}
                    """
                        .formatted(notificationId)))
        .andExpect(status().isOk());
  }

  private String syncMember(String externalUserId, String name, String role) throws Exception {
    var result =
        mockMvc
            .perform(
                post("/internal/members/sync")
                    .header("X-API-KEY", API_KEY)
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(
                        """
                        {
                          "externalUserId": "%s",
                          "email": "%s@test.com",
                          "name": "%s",
                          "role": "%s"
                        }
                        """
                            .formatted(externalUserId, externalUserId, name, role)))
            .andExpect(status().is2xxSuccessful())
            .andReturn();
    return JsonPath.read(result.getResponse().getContentAsString(), "$.memberId");
  }

  private JwtRequestPostProcessor ownerJwt() {
    return jwtFor("user_pj_owner", "manager");
  }

  private JwtRequestPostProcessor newcomerJwt() {
    return jwtFor("user_pj_newcomer", "member");
  }

  private JwtRequestPostProcessor watcherJwt() {
    return jwtFor("user_pj_watcher", "member");
  }

  private JwtRequestPostProcessor jwtFor(String subject, String role) {
    return jwt()
        .jwt(j -> j.subject(subject).claim("role", role))
        .authorities(List.of(new SimpleGrantedAuthority("ROLE_" + role.toUpperCase())));
  }
}
