package io.b2mash.teamboard.notification;

import io.b2mash.teamboard.member.Member;
import io.b2mash.teamboard.member.MemberRepository;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Matches mention tokens against active member names. Two forms are recognised: {@code @alice}
 * (ends at whitespace or punctuation) and {@code @{Alice Smith}} for names containing spaces.
 */
@Component
public class MemberMentionScanner implements MentionScanner {

  static final Pattern MENTION_PATTERN =
      Pattern.compile("@\\{([^}]+)}|@(\\S+?)(?=\\s|$|[，。！？,.!?])");

  private final MemberRepository memberRepository;
  private final NotificationProperties properties;

  public MemberMentionScanner(
      MemberRepository memberRepository, NotificationProperties properties) {
    this.memberRepository = memberRepository;
    this.properties = properties;
  }

  @Override
  public Set<UUID> scan(String text) {
    Set<String> names = parseNames(text);
    if (names.isEmpty()) {
      return Set.of();
    }
    return memberRepository.findActiveByNameIn(names).stream()
        .map(Member::getId)
        .collect(Collectors.toCollection(LinkedHashSet::new));
  }

  /** Distinct names referenced in {@code text}, in order of first appearance. */
  static Set<String> parseNames(String text) {
    if (text == null || text.isBlank()) {
      return Set.of();
    }
    Set<String> names = new LinkedHashSet<>();
    Matcher matcher = MENTION_PATTERN.matcher(text);
    while (matcher.find()) {
      String name = matcher.group(1) != null ? matcher.group(1) : matcher.group(2);
      if (name != null && !name.isBlank()) {
        names.add(name.strip());
      }
    }
    return names;
  }

  /**
   * Excerpt of {@code text} around the first mention of {@code name}, with an ellipsis on any side
   * that was cut. Falls back to the head of the text when the mention is not found.
   */
  public String contextFor(String text, String name) {
    if (text == null) {
      return "";
    }
    int radius = properties.mentionContextLength();
    for (String token : new String[] {"@{" + name + "}", "@" + name}) {
      int pos = text.indexOf(token);
      if (pos != -1) {
        int start = Math.max(0, pos - radius);
        int end = Math.min(text.length(), pos + token.length() + radius);
        String context = text.substring(start, end);
        if (start > 0) {
          context = "..." + context;
        }
        if (end < text.length()) {
          context = context + "...";
        }
        return context;
      }
    }
    int fallback = properties.fallbackExcerptLength();
    return text.length() > fallback ? text.substring(0, fallback) : text;
  }
}
