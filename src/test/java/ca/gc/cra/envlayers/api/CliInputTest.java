package ca.gc.cra.envlayers.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class CliInputTest {

  @Test
  void splitsFlagsFromKeyValues() {
    CliInput input = CliInput.parse(new String[] {"--verbose", "port=1", "--dry-run", " ", "-h"});

    assertTrue(input.verbose());
    assertTrue(input.help());
    assertEquals(List.of("port=1"), input.keyValueArgs());
    assertEquals(Set.of("--dry-run"), input.unknownFlags());
  }

  @Test
  void nullArgsParseToEmptyInput() {
    CliInput input = CliInput.parse(null);

    assertFalse(input.help());
    assertFalse(input.verbose());
    assertEquals(0, input.keyValueArray().length);
  }
}
