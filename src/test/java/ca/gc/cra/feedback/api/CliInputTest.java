package ca.gc.cra.feedback.api;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class CliInputTest {
  @Test
  void separatesFlagsFromKeyValueArgs() {
    CliInput input = CliInput.parse(new String[] {"workers=4", "--DRY-RUN", " ", "-v", "batchSize=2"});

    assertArrayEquals(new String[] {"workers=4", "batchSize=2"}, input.keyValueArgs());
    assertTrue(input.hasFlag("--dry-run"));
    assertTrue(input.verbose());
    assertFalse(input.help());
  }

  @Test
  void recognisesHelpAliases() {
    assertTrue(CliInput.parse(new String[] {"-h"}).help());
    assertTrue(CliInput.parse(new String[] {"help"}).help());
    assertTrue(CliInput.parse(new String[] {"--help"}).hasFlag("--help"));
  }

  @Test
  void emptyInputHasNoFlags() {
    CliInput input = CliInput.parse(null);
    assertArrayEquals(new String[0], input.keyValueArgs());
    assertFalse(input.hasFlag("--dry-run"));
    assertFalse(input.hasFlag(null));
  }
}
