package ca.gc.cra.docwatch.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class CliInputTest {

  @Test
  void separatesOptionsFlagsAndWords() {
    CliInput input = CliInput.parse(new String[] {"config=a.yaml", "--FORCE", "-v", "extra", "  "});

    assertEquals(Map.of("config", "a.yaml"), input.options());
    assertTrue(input.hasFlag("--force"));
    assertTrue(input.verbose());
    assertFalse(input.help());
    assertEquals(List.of("extra"), input.words());
  }

  @Test
  void recognisesHelpSpellings() {
    assertTrue(CliInput.parse(new String[] {"-h"}).help());
    assertTrue(CliInput.parse(new String[] {"HELP"}).help());
    assertTrue(CliInput.parse(new String[] {"--debug"}).verbose());
  }

  @Test
  void blankOptionValueReadsAsAbsent() {
    CliInput input = CliInput.parse(new String[] {"out="});

    assertEquals(Optional.empty(), input.option("out"));
    assertTrue(input.options().containsKey("out"));
  }

  @Test
  void optionsCopyIsIndependent() {
    CliInput input = CliInput.parse(new String[] {"out=r.csv"});

    input.options().remove("out");

    assertEquals(Optional.of("r.csv"), input.option("out"));
  }

  @Test
  void rejectsMalformedKeys() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> CliInput.parse(new String[] {"bad key=1"}));
    assertTrue(ex.getMessage().contains("invalid argument name"));

    assertThrows(IllegalArgumentException.class, () -> CliInput.parse(new String[] {"=value"}));
  }

  @Test
  void rejectsControlCharactersInValues() {
    assertThrows(IllegalArgumentException.class,
        () -> CliInput.parse(new String[] {"out=a\u0007b.csv"}));
  }

  @Test
  void nullArgumentsParseToEmptyInput() {
    CliInput input = CliInput.parse(null);

    assertTrue(input.options().isEmpty());
    assertTrue(input.words().isEmpty());
  }
}
