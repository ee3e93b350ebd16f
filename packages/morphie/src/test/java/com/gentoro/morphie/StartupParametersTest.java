package com.gentoro.morphie;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.morphie.exception.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class StartupParametersTest {

  @Test
  @DisplayName("defaults apply when nothing is given")
  void defaults() {
    StartupParameters params = new StartupParameters(new String[0]);
    assertEquals("classpath:application.yaml", params.configFile());
    assertFalse(params.isHelpMode());
    assertFalse(params.isParameterPresent("analyzer"));
  }

  @Test
  @DisplayName("name value pairs and bare flags are parsed")
  void parsesPairsAndFlags() {
    StartupParameters params =
        new StartupParameters(
            new String[] {
              "--analyzer", "plaso", "--show-all-sources", "--json-file", "events.json"
            });
    assertEquals("plaso", params.getParameter("analyzer"));
    assertEquals("true", params.getParameter("show-all-sources"));
    assertEquals("events.json", params.getOptionalParameter("json-file").orElseThrow());
    assertTrue(params.getOptionalParameter("csv-file").isEmpty());
  }

  @Test
  @DisplayName("unknown parameters, stray values and bad modes are rejected")
  void rejectsBadArguments() {
    assertThrows(
        ValidationException.class, () -> new StartupParameters(new String[] {"--colour", "red"}));
    assertThrows(ValidationException.class, () -> new StartupParameters(new String[] {"plaso"}));
    assertThrows(
        ValidationException.class, () -> new StartupParameters(new String[] {"--mode", "serve"}));
  }

  @Test
  @DisplayName("help mode is recognized and usage lists the inputs")
  void help() {
    assertTrue(new StartupParameters(new String[] {"--mode", "help"}).isHelpMode());
    assertTrue(StartupParameters.usage().contains("--json-stream-file"));
  }
}
