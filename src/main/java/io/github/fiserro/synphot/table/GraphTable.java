package io.github.fiserro.synphot.table;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ListMultimap;
import io.github.fiserro.synphot.BrokenChainException;
import io.github.fiserro.synphot.ModeResolutionException;
import io.github.fiserro.synphot.ReferenceDataException;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.OptionalDouble;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/**
 * Graph table mapping observation-mode keywords to ordered component chains.
 *
 * <p>Each row is an edge {@code innode -> outnode} taken when its keyword is part of the mode
 * (or, failing that, when its keyword is {@code default}). Every edge taken contributes one
 * optical and one thermal component name.
 */
@Slf4j
public class GraphTable {

  public static final String DEFAULT_KEYWORD = "default";

  /**
   * One edge of the graph.
   *
   * @param keyword mode keyword selecting the edge, or {@code default}
   * @param innode node the edge leaves
   * @param outnode node the edge enters
   * @param compname optical component name
   * @param thcompname thermal component name, {@code null} meaning clear
   */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Row(String keyword, int innode, int outnode, String compname, String thcompname) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Contents(Double primaryArea, List<Row> rows) {}

  private final String name;
  private final Double primaryArea;
  private final ListMultimap<Integer, Row> rowsByInnode;
  private final int startNode;

  public GraphTable(String name, Double primaryArea, List<Row> rows) {
    if (rows == null || rows.isEmpty()) {
      throw new ReferenceDataException("Graph table " + name + " has no rows");
    }
    this.name = name;
    this.primaryArea = primaryArea;
    ImmutableListMultimap.Builder<Integer, Row> builder = ImmutableListMultimap.builder();
    rows.forEach(row -> builder.put(row.innode(), row));
    this.rowsByInnode = builder.build();
    this.startNode = Collections.min(rowsByInnode.keySet());
  }

  /** Reads a JSON graph table: {@code {"primaryArea": ..., "rows": [...]}}. */
  public static GraphTable read(Path path, String name, ObjectMapper objectMapper) {
    try {
      Contents contents = objectMapper.readValue(path.toFile(), Contents.class);
      log.debug("Loaded graph table {} with {} rows", name,
          contents.rows() == null ? 0 : contents.rows().size());
      return new GraphTable(name, contents.primaryArea(), contents.rows());
    } catch (IOException e) {
      throw new ReferenceDataException("Cannot read graph table " + name + " (" + path + ")", e);
    }
  }

  public String name() {
    return name;
  }

  /** Collecting area declared by the table, if any. */
  public OptionalDouble primaryArea() {
    return primaryArea == null ? OptionalDouble.empty() : OptionalDouble.of(primaryArea);
  }

  /**
   * Walks the graph from its first node, choosing at each node the edge whose keyword appears
   * in {@code keywords} (first in keyword order) or else the node's default edge.
   *
   * @throws ModeResolutionException when a node offers no usable edge, or a keyword is unused
   * @throws BrokenChainException when the traversal loops
   */
  public ComponentChain resolve(List<String> keywords) {
    List<String> optical = new ArrayList<>();
    List<String> thermal = new ArrayList<>();
    Set<String> used = new HashSet<>();
    Set<Integer> visited = new HashSet<>();

    int node = startNode;
    while (rowsByInnode.containsKey(node)) {
      if (!visited.add(node)) {
        throw new BrokenChainException(String.format(
            "Graph table %s loops back to node %d while resolving %s", name, node, keywords));
      }
      Row edge = selectEdge(node, keywords);
      if (edge == null) {
        throw new ModeResolutionException(String.format(
            "Incomplete obsmode %s: graph table %s has no matching or default branch at node %d",
            String.join(",", keywords), name, node));
      }
      if (!DEFAULT_KEYWORD.equals(edge.keyword())) {
        used.add(edge.keyword());
      }
      optical.add(edge.compname());
      thermal.add(edge.thcompname() == null ? ComponentTable.CLEAR : edge.thcompname());
      node = edge.outnode();
    }

    Set<String> unused = new LinkedHashSet<>(keywords);
    unused.removeAll(used);
    if (!unused.isEmpty()) {
      throw new ModeResolutionException(String.format(
          "Unused keywords %s in obsmode %s (graph table %s)",
          unused, String.join(",", keywords), name));
    }

    log.debug("Graph table {} resolved {} to {}", name, keywords, optical);
    return new ComponentChain(optical, thermal);
  }

  private Row selectEdge(int node, List<String> keywords) {
    List<Row> rows = rowsByInnode.get(node);
    for (String keyword : keywords) {
      for (Row row : rows) {
        if (keyword.equals(row.keyword())) {
          return row;
        }
      }
    }
    for (Row row : rows) {
      if (DEFAULT_KEYWORD.equals(row.keyword())) {
        return row;
      }
    }
    return null;
  }
}
