package ca.gc.cra.nmapper.api;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class CliInputTest {
  @Test
  void separatesFlagsFromArguments() {
    CliInput input = CliInput.parse(new String[] {"diff", "--latest", "format=json", " ", "--verbose"});

    assertArrayEquals(new String[] {"diff", "format=json"}, input.arguments());
    assertTrue(input.hasFlag("--latest"));
    assertTrue(input.verbose());
    assertFalse(input.help());
  }

  @Test
  void quietOverridesVerbose() {
    CliInput input = CliInput.parse(new String[] {"-v", "--quiet"});

    assertTrue(input.quiet());
    assertFalse(input.verbose());
  }

  @Test
  void recognisesHelpSpellings() {
    assertTrue(CliInput.parse(new String[] {"-h"}).help());
    assertTrue(CliInput.parse(new String[] {"HELP"}).help());
    assertFalse(CliInput.parse(null).help());
  }

  @Test
  void delegateArgumentsDropTheCommandAndKeepFlags() {
    CliInput input = CliInput.parse(new String[] {"snapshots", "--stats", "size=10", "--help"});

    CliInput delegated = CliInput.parse(input.delegateArguments());

    assertArrayEquals(new String[] {"size=10"}, delegated.arguments());
    assertTrue(delegated.hasFlag("--stats"));
    assertTrue(delegated.help());
  }

  @Test
  void dashedKeyValueStaysAnArgument() {
    CliInput input = CliInput.parse(new String[] {"--storage.type=memory"});

    assertArrayEquals(new String[] {"--storage.type=memory"}, input.arguments());
    assertFalse(input.hasFlag("--storage.type=memory"));
  }
}
