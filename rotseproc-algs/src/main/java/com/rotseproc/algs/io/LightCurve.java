package com.rotseproc.algs.io;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/** Target photometry over time, as produced by the photometry tool. */
public record LightCurve(List<Point> points) {
  private static final ObjectMapper M = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

  public record Point(double mjd, double mag, double magErr) {}

  public LightCurve {
    points = List.copyOf(points);
  }

  /**
   * Whitespace-separated columns, MJD then magnitude then magnitude error; further columns are
   * ignored and {@code #} starts a comment line.
   */
  public static LightCurve parse(Path file) throws IOException {
    List<Point> points = new ArrayList<>();
    int lineNo = 0;
    for (String line : Files.readAllLines(file)) {
      lineNo++;
      String t = line.trim();
      if (t.isEmpty() || t.startsWith("#")) continue;
      String[] cols = t.split("\\s+");
      if (cols.length < 3) throw new IOException(file + ":" + lineNo + ": expected MJD, magnitude and error");
      try {
        points.add(new Point(Double.parseDouble(cols[0]), Double.parseDouble(cols[1]), Double.parseDouble(cols[2])));
      } catch (NumberFormatException e) {
        throw new IOException(file + ":" + lineNo + ": " + e.getMessage(), e);
      }
    }
    return new LightCurve(points);
  }

  /** Writes {@code {"MJD": [...], "ROTSE_MAG": [...], "MAG_ERR": [...]}}. */
  public void writeJson(Path target) throws IOException {
    ObjectNode root = M.createObjectNode();
    ArrayNode mjd = root.putArray("MJD");
    ArrayNode mag = root.putArray("ROTSE_MAG");
    ArrayNode err = root.putArray("MAG_ERR");
    for (Point p : points) {
      mjd.add(p.mjd());
      mag.add(p.mag());
      err.add(p.magErr());
    }
    Path parent = target.toAbsolutePath().getParent();
    if (parent != null) Files.createDirectories(parent);
    M.writeValue(target.toFile(), root);
  }

  public int size() {
    return points.size();
  }
}
