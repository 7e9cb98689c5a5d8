package io.b2mash.teamboard.notification;

import static io.b2mash.teamboard.testutil.TestIds.withId;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.b2mash.teamboard.member.Member;
import io.b2mash.teamboard.member.MemberRepository;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class MemberMentionScannerTest {

  @Mock private MemberRepository memberRepository;

  private MemberMentionScanner scanner;

  @BeforeEach
  void setUp() {
    scanner = new MemberMentionScanner(memberRepository, new NotificationProperties(5, 10, null));
  }

  @Test
  void parseNames_findsPlainAndBracedMentionsInOrder() {
    var names =
        MemberMentionScanner.parseNames("hi @alice and @{Bob Smith}, thanks @alice. cc @carol");

    assertThat(names).containsExactly("alice", "Bob Smith", "carol");
  }

  @Test
  void parseNames_stopsPlainMentionAtPunctuation() {
    assertThat(MemberMentionScanner.parseNames("done @dave, @erin! @frank?"))
        .containsExactly("dave", "erin", "frank");
  }

  @Test
  void parseNames_stopsAtFullWidthPunctuation() {
    assertThat(MemberMentionScanner.parseNames("请看 @grace。")).containsExactly("grace");
  }

  @Test
  void parseNames_ignoresBlankInputAndBareAtSign() {
    assertThat(MemberMentionScanner.parseNames(null)).isEmpty();
    assertThat(MemberMentionScanner.parseNames("   ")).isEmpty();
    assertThat(MemberMentionScanner.parseNames("mail me @ noon")).isEmpty();
  }

  @Test
  void scan_resolvesNamesToActiveMemberIds() {
    var alice =
        withId(new Member("user_a", "a@example.com", "alice", null, "member"), UUID.randomUUID());
    when(memberRepository.findActiveByNameIn(Set.of("alice", "nobody")))
        .thenReturn(List.of(alice));

    assertThat(scanner.scan("@alice and @nobody")).containsExactly(alice.getId());
  }

  @Test
  void scan_skipsLookupWithoutMentions() {
    assertThat(scanner.scan("no mentions here")).isEmpty();
    verifyNoInteractions(memberRepository);
  }

  @Test
  void contextFor_cutsAroundMentionWithEllipses() {
    var context = scanner.contextFor("0123456789 @alice 0123456789", "alice");

    assertThat(context).isEqualTo("...6789 @alice 0123...");
  }

  @Test
  void contextFor_keepsShortTextWhole() {
    assertThat(scanner.contextFor("hi @{Bob Smith}", "Bob Smith")).isEqualTo("hi @{Bob Smith}");
  }

  @Test
  void contextFor_fallsBackToTextHead() {
    assertThat(scanner.contextFor("no mention of anyone here", "alice")).isEqualTo("no mention");
    assertThat(scanner.contextFor(null, "alice")).isEmpty();
  }

  @Test
  void scan_passesEveryDistinctNameOnce() {
    when(memberRepository.findActiveByNameIn(any())).thenReturn(List.of());

    scanner.scan("@alice @alice @bob");

    verify(memberRepository).findActiveByNameIn(Set.of("alice", "bob"));
  }
}
