package com.gentoro.morphie;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.gentoro.morphie.AnalysisOptions.InputFormat;
import com.gentoro.morphie.AnalysisOptions.OutputFormat;
import com.gentoro.morphie.analyzer.GraphAnalyzer;
import com.gentoro.morphie.exception.IoException;
import com.gentoro.morphie.exception.ValidationException;
import com.gentoro.morphie.export.explorer.GraphDef;
import com.gentoro.morphie.graph.LabeledGraph;
import com.gentoro.morphie.utility.JacksonUtility;
import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import org.apache.commons.configuration2.BaseConfiguration;
import org.apache.commons.configuration2.Configuration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.InOrder;

class FrontendTest {

  @TempDir Path tempDir;

  private Configuration config;
  private ByteArrayOutputStream stdout;
  private Frontend frontend;

  @BeforeEach
  void setUp() {
    config = new BaseConfiguration();
    stdout = new ByteArrayOutputStream();
    frontend = new Frontend(config, new PrintStream(stdout, true, StandardCharsets.UTF_8));
  }

  private Path fixture(String name) throws Exception {
    Path target = tempDir.resolve(name);
    try (InputStream in = getClass().getResourceAsStream("/fixtures/" + name)) {
      Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
    }
    return target;
  }

  @Test
  @DisplayName("the access log is exported as DOT")
  void mailToDot() throws Exception {
    Path out = tempDir.resolve("out/access.dot");
    config.setProperty("export.dot.graphName", "accounts");
    frontend.run(
        new AnalysisOptions(
            "mail", InputFormat.CSV, fixture("access.csv"), OutputFormat.DOT, out, false));

    String dot = Files.readString(out);
    assertThat(dot).startsWith("digraph \"accounts\" {").contains("actor\\nalice");
    assertEquals(0, stdout.size());
  }

  @Test
  @DisplayName("the Curio graph is exported as GraphExplorer JSON")
  void curioToGraphExplorer() throws Exception {
    Path out = tempDir.resolve("curio.json");
    frontend.run(
        new AnalysisOptions(
            "curio",
            InputFormat.JSON,
            fixture("curio.json"),
            OutputFormat.GRAPH_EXPLORER,
            out,
            false));

    GraphDef def = JacksonUtility.getJsonMapper().readValue(out.toFile(), GraphDef.class);
    assertEquals(5, def.nodes().size());
    assertEquals("binary/0", def.nodes().get(0).name());
  }

  @Test
  @DisplayName("a .yaml GraphExplorer output is written as YAML with configured metanodes")
  void plasoToYaml() throws Exception {
    Path out = tempDir.resolve("plaso.yaml");
    config.setProperty("export.explorer.metanodes", true);
    frontend.run(
        new AnalysisOptions(
            "plaso",
            InputFormat.JSON_STREAM,
            fixture("plaso.jsonl"),
            OutputFormat.GRAPH_EXPLORER,
            out,
            false));

    GraphDef def = JacksonUtility.getYamlMapper().readValue(out.toFile(), GraphDef.class);
    assertTrue(def.nodes().get(0).isMetanode());
    assertEquals(6, def.nodes().size());
  }

  @Test
  @DisplayName("without an output file the DOT graph goes to stdout")
  void plasoToStdout() throws Exception {
    frontend.run(
        new AnalysisOptions(
            "plaso", InputFormat.JSON, fixture("plaso.json"), OutputFormat.STDOUT, null, true));

    String printed = stdout.toString(StandardCharsets.UTF_8);
    assertThat(printed).startsWith("digraph \"morphie\" {").contains("/var/log/auth.log");
  }

  @Test
  @DisplayName("analyzers reject input formats they cannot read")
  void wrongInputFormat() throws Exception {
    Path csv = fixture("access.csv");
    assertThrows(
        ValidationException.class,
        () ->
            frontend.run(
                new AnalysisOptions(
                    "plaso", InputFormat.CSV, csv, OutputFormat.STDOUT, null, false)));
    assertThrows(
        ValidationException.class,
        () ->
            frontend.run(
                new AnalysisOptions(
                    "curio", InputFormat.JSON_STREAM, csv, OutputFormat.STDOUT, null, false)));
    assertThrows(
        ValidationException.class,
        () ->
            frontend.run(
                new AnalysisOptions(
                    "mail", InputFormat.JSON, csv, OutputFormat.STDOUT, null, false)));
  }

  @Test
  @DisplayName("nothing is written when the analysis fails")
  void noExportOnFailure() throws Exception {
    Path input = tempDir.resolve("bad.csv");
    Files.writeString(input, "who,what\na,b\n");
    Path out = tempDir.resolve("bad.dot");

    assertThrows(
        ValidationException.class,
        () ->
            frontend.run(
                new AnalysisOptions("mail", InputFormat.CSV, input, OutputFormat.DOT, out, false)));
    assertFalse(Files.exists(out));
  }

  @Test
  @DisplayName("a missing input file is an I/O error")
  void missingInput() {
    Path input = tempDir.resolve("absent.json");
    assertThrows(
        IoException.class,
        () ->
            frontend.run(
                new AnalysisOptions(
                    "curio", InputFormat.JSON, input, OutputFormat.STDOUT, null, false)));
  }

  @Test
  @DisplayName("buildGraph is not called when initialize fails")
  @SuppressWarnings("unchecked")
  void shortCircuit() {
    GraphAnalyzer<String> analyzer = mock(GraphAnalyzer.class);
    doThrow(new ValidationException("bad input")).when(analyzer).initialize("input");

    assertThrows(ValidationException.class, () -> Frontend.runAnalyzer(analyzer, "input"));
    verify(analyzer).initialize("input");
    verify(analyzer, never()).buildGraph();
    verify(analyzer, never()).graph();
  }

  @Test
  @DisplayName("runAnalyzer returns the analyzer's graph after building it")
  @SuppressWarnings("unchecked")
  void runAnalyzer() {
    GraphAnalyzer<String> analyzer = mock(GraphAnalyzer.class);
    LabeledGraph graph = new LabeledGraph();
    when(analyzer.graph()).thenReturn(graph);
    when(analyzer.skippedRecords()).thenReturn(2);
    when(analyzer.name()).thenReturn("mock");

    assertSame(graph, Frontend.runAnalyzer(analyzer, "input"));
    InOrder order = inOrder(analyzer);
    order.verify(analyzer).initialize("input");
    order.verify(analyzer).buildGraph();
  }
}
