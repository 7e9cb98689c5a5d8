package io.b2mash.teamboard.project;

import io.b2mash.teamboard.member.MemberContext;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/projects")
public class ProjectController {

  private final ProjectService projectService;

  public ProjectController(ProjectService projectService) {
    this.projectService = projectService;
  }

  @GetMapping
  @PreAuthorize("hasAnyRole('MEMBER', 'MANAGER', 'ADMIN')")
  public ResponseEntity<List<ProjectResponse>> listProjects() {
    var projects = projectService.listProjects().stream().map(ProjectResponse::from).toList();
    return ResponseEntity.ok(projects);
  }

  @GetMapping("/{id}")
  @PreAuthorize("hasAnyRole('MEMBER', 'MANAGER', 'ADMIN')")
  public ResponseEntity<ProjectResponse> getProject(@PathVariable UUID id) {
    return ResponseEntity.ok(ProjectResponse.from(projectService.getProject(id)));
  }

  @PostMapping
  @PreAuthorize("hasAnyRole('MANAGER', 'ADMIN')")
  public ResponseEntity<ProjectResponse> createProject(
      @Valid @RequestBody CreateProjectRequest request) {
    UUID memberId = MemberContext.requireMemberId();
    var project =
        projectService.createProject(
            request.name(), request.description(), memberId, request.memberIds());
    return ResponseEntity.created(URI.create("/api/projects/" + project.getId()))
        .body(ProjectResponse.from(project));
  }

  @PutMapping("/{id}")
  @PreAuthorize("hasAnyRole('MEMBER', 'MANAGER', 'ADMIN')")
  public ResponseEntity<ProjectResponse> updateProject(
      @PathVariable UUID id, @Valid @RequestBody UpdateProjectRequest request) {
    var project =
        projectService.updateProject(
            id,
            request.name(),
            request.description(),
            MemberContext.requireMemberId(),
            MemberContext.getRole());
    return ResponseEntity.ok(ProjectResponse.from(project));
  }

  @DeleteMapping("/{id}")
  @PreAuthorize("hasAnyRole('MEMBER', 'MANAGER', 'ADMIN')")
  public ResponseEntity<Void> deleteProject(@PathVariable UUID id) {
    projectService.deleteProject(id, MemberContext.requireMemberId(), MemberContext.getRole());
    return ResponseEntity.noContent().build();
  }

  public record CreateProjectRequest(
      @NotBlank(message = "name is required")
          @Size(max = 255, message = "name must be at most 255 characters")
          String name,
      String description,
      List<UUID> memberIds) {}

  public record UpdateProjectRequest(
      @NotBlank(message = "name is required")
          @Size(max = 255, message = "name must be at most 255 characters")
          String name,
      String description) {}

  public record ProjectResponse(
      UUID id,
      String name,
      String description,
      UUID ownerId,
      Instant createdAt,
      Instant updatedAt) {

    public static ProjectResponse from(Project project) {
      return new ProjectResponse(
          project.getId(),
          project.getName(),
          project.getDescription(),
          project.getOwnerId(),
          project.getCreatedAt(),
          project.getUpdatedAt());
    }
  }
}
