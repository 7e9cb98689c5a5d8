package io.b2mash.teamboard.member;

import java.time.Instant;
import java.util.UUID;

public record ProjectMemberInfo(
    UUID id,
    UUID memberId,
    String name,
    String email,
    String avatarUrl,
    String projectRole,
    Instant createdAt) {}
