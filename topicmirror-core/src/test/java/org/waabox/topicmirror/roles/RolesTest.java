package org.waabox.topicmirror.roles;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;

/**
 * Tests for {@link Roles}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class RolesTest {

  @Test
  void whenParsing_givenQuotedRoles_shouldReturnThemInOrder() {
    final Set<String> roles = Roles.parse("\"TRADER\",\"AUTHENTICATED\"");

    assertEquals(List.of("TRADER", "AUTHENTICATED"), List.copyOf(roles));
  }

  @Test
  void whenParsing_givenUnquotedRoles_shouldTrimThem() {
    assertEquals(Set.of("TRADER", "CLIENT"), Roles.parse(" TRADER , CLIENT"));
  }

  @Test
  void whenParsing_givenEscapedCharacters_shouldUnescape() {
    assertEquals(Set.of("A,\"B\""), Roles.parse("\"A,\\\"B\\\"\""));
  }

  @Test
  void whenParsing_givenNullOrBlank_shouldReturnEmpty() {
    assertTrue(Roles.parse(null).isEmpty());
    assertTrue(Roles.parse("  ").isEmpty());
  }

  @Test
  void whenParsing_givenUnterminatedQuote_shouldThrow() {
    assertThrows(IllegalArgumentException.class,
        () -> Roles.parse("\"TRADER"));
  }

  @Test
  void whenFormatting_givenRoles_shouldQuoteAndEscapeThem() {
    assertEquals("\"TRADER\",\"A\\\"B\"",
        Roles.format(List.of("TRADER", "A\"B")));
    assertEquals("", Roles.format(List.of()));
  }

  @Test
  void whenFormatting_givenParsedRoles_shouldProduceSameSet() {
    final List<String> roles = List.of("TRADER", "with space", "back\\slash");

    assertEquals(Set.copyOf(roles), Roles.parse(Roles.format(roles)));
  }
}
