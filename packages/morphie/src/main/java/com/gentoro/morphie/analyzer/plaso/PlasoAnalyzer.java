package com.gentoro.morphie.analyzer.plaso;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.morphie.analyzer.GraphAnalyzer;
import com.gentoro.morphie.analyzer.json.JsonSource;
import com.gentoro.morphie.exception.MorphieException;
import com.gentoro.morphie.exception.StateException;
import com.gentoro.morphie.graph.LabeledGraph;

/**
 * Builds a {@link PlasoGraph} from plaso JSON output, either a full document or a stream of
 * events. Events missing a timestamp or a data type are skipped.
 */
public class PlasoAnalyzer implements GraphAnalyzer<JsonSource> {
  private static final org.slf4j.Logger log =
      com.gentoro.morphie.logging.LoggingService.getLogger(PlasoAnalyzer.class);

  private final boolean showAllSources;
  private final PlasoGraph plasoGraph = new PlasoGraph();
  private JsonSource source;
  private int skipped;

  public PlasoAnalyzer() {
    this(false);
  }

  /**
   * @param showAllSources keep every source file, including files that yielded a single event
   */
  public PlasoAnalyzer(boolean showAllSources) {
    this.showAllSources = showAllSources;
  }

  @Override
  public String name() {
    return "plaso";
  }

  @Override
  public void initialize(JsonSource source) {
    if (this.source != null) {
      throw new StateException("The plaso analyzer is already initialized");
    }
    if (source == null) {
      throw new StateException("The plaso analyzer requires an event source");
    }
    this.source = source;
    plasoGraph.initialize();
  }

  @Override
  public void buildGraph() {
    if (source == null) {
      throw new StateException("The plaso analyzer has not been initialized");
    }
    int index = 0;
    while (source.hasNext()) {
      JsonNode event = source.next();
      try {
        plasoGraph.addEvent(PlasoEvent.fromJson(event));
      } catch (MorphieException e) {
        skipped++;
        log.warn("Skipping event #{} of {}: {}", index, source.description(), e.getMessage());
      }
      index++;
    }
    plasoGraph.linkTimeline();
    if (!showAllSources) {
      plasoGraph.pruneSingleSourceFiles();
    }
    log.info(
        "Built plaso graph from {}: {} nodes, {} edges, {} events skipped",
        source.description(),
        graph().nodeCount(),
        graph().edgeCount(),
        skipped);
  }

  @Override
  public LabeledGraph graph() {
    return plasoGraph.graph();
  }

  @Override
  public int skippedRecords() {
    return skipped;
  }
}
