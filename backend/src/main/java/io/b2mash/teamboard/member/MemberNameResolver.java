package io.b2mash.teamboard.member;

import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.stream.Collectors;
import org.springframework.stereotype.Service;

@Service
public class MemberNameResolver {

  private final MemberRepository memberRepository;

  public MemberNameResolver(MemberRepository memberRepository) {
    this.memberRepository = memberRepository;
  }

  public String resolveName(UUID memberId) {
    if (memberId == null) {
      return null;
    }
    return memberRepository.findById(memberId).map(Member::getName).orElse("Unknown");
  }

  /** Batch lookup; null ids are ignored and unknown ids are simply absent from the result. */
  public Map<UUID, String> resolveNames(Collection<UUID> memberIds) {
    var ids = memberIds.stream().filter(Objects::nonNull).collect(Collectors.toSet());
    if (ids.isEmpty()) return Map.of();

    return memberRepository.findAllById(ids).stream()
        .collect(Collectors.toMap(Member::getId, Member::getName, (a, b) -> a));
  }
}
