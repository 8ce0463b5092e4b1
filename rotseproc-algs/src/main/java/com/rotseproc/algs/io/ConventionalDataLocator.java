package com.rotseproc.algs.io;

import com.rotseproc.core.Artifact;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Archive layout {@code <dataDir>/image} and {@code <dataDir>/prod}, with file names of the form
 * {@code yymmdd_<field>_<telescope>_...}.
 *
 * <p>Field centres come from an explicit table when one is given; otherwise they are decoded
 * from field names such as {@code sks0246+30} (RA 02h46m, Dec +30).
 */
public final class ConventionalDataLocator implements DataLocator {
    private static final Logger log = LoggerFactory.getLogger(ConventionalDataLocator.class);

    /** A field is a candidate when its centre is within this many degrees of the target. */
    public static final double FIELD_RADIUS_DEG = 1.85;

    private static final Pattern ENCODED_CENTRE = Pattern.compile("^[a-z]+(\\d{2})(\\d{2})([+-])(\\d{2})$");

    public record FieldCentre(String field, double ra, double dec) {}

    private final Map<String, FieldCentre> centres;

    public ConventionalDataLocator() {
        this(List.of());
    }

    public ConventionalDataLocator(List<FieldCentre> centres) {
        Map<String, FieldCentre> m = new LinkedHashMap<>();
        for (FieldCentre c : centres) m.put(c.field(), c);
        this.centres = m;
    }

    /** Reads {@code field ra dec} lines; blank lines and lines starting with {@code #} are ignored. */
    public static List<FieldCentre> readFieldCentres(Path table) throws IOException {
        List<FieldCentre> out = new ArrayList<>();
        int lineNo = 0;
        for (String line : Files.readAllLines(table)) {
            lineNo++;
            String t = line.trim();
            if (t.isEmpty() || t.startsWith("#")) continue;
            String[] cols = t.split("\\s+");
            if (cols.length < 3) throw new IOException(table + ":" + lineNo + ": expected 'field ra dec'");
            try {
                out.add(new FieldCentre(cols[0], Double.parseDouble(cols[1]), Double.parseDouble(cols[2])));
            } catch (NumberFormatException e) {
                throw new IOException(table + ":" + lineNo + ": bad coordinate", e);
            }
        }
        return out;
    }

    /** Parsed form of an archive file name. */
    record Name(LocalDate night, String field, String telescope) {
        static Optional<Name> parse(String fileName) {
            String[] parts = fileName.split("_");
            if (parts.length < 3) return Optional.empty();
            try {
                return Optional.of(new Name(Nights.parse(parts[0]), parts[1], parts[2]));
            } catch (IllegalArgumentException notArchiveName) {
                return Optional.empty();
            }
        }
    }

    @Override
    public Optional<String> resolveField(Path dataDir, double ra, double dec) throws IOException {
        Map<String, FieldCentre> candidates = new LinkedHashMap<>(centres);
        if (candidates.isEmpty()) {
            TreeSet<String> fields = new TreeSet<>();
            for (Path p : Artifact.list(dataDir.resolve("image"), "*")) {
                Name.parse(p.getFileName().toString()).ifPresent(n -> fields.add(n.field()));
            }
            for (String f : fields) decode(f).ifPresent(c -> candidates.put(f, c));
        }

        String best = null;
        double bestSep = Double.POSITIVE_INFINITY;
        for (FieldCentre c : candidates.values()) {
            double sep = separationDeg(ra, dec, c.ra(), c.dec());
            if (sep <= FIELD_RADIUS_DEG && sep < bestSep) {
                best = c.field();
                bestSep = sep;
            }
        }
        log.debug("resolved ra={} dec={} to field={} ({} candidates)", ra, dec, best, candidates.size());
        return Optional.ofNullable(best);
    }

    @Override
    public Found locate(Query q) throws IOException {
        return new Found(select(q.dataDir().resolve("image"), q), select(q.dataDir().resolve("prod"), q));
    }

    private static List<Path> select(Path dir, Query q) throws IOException {
        List<Path> out = new ArrayList<>();
        for (Path p : Artifact.list(dir, "*")) {
            Optional<Name> name = Name.parse(p.getFileName().toString());
            if (name.isEmpty()) continue;
            Name n = name.get();
            if (!n.field().equals(q.field())) continue;
            if (q.telescope() != null && !n.telescope().equals(q.telescope())) continue;
            long offset = ChronoUnit.DAYS.between(q.night(), n.night());
            if (offset < -q.daysBefore() || offset > q.daysAfter()) continue;
            out.add(p);
        }
        return out;
    }

    static Optional<FieldCentre> decode(String field) {
        Matcher m = ENCODED_CENTRE.matcher(field);
        if (!m.matches()) return Optional.empty();
        double ra = (Integer.parseInt(m.group(1)) + Integer.parseInt(m.group(2)) / 60.0) * 15.0;
        double dec = Integer.parseInt(m.group(4)) * ("-".equals(m.group(3)) ? -1 : 1);
        return Optional.of(new FieldCentre(field, ra, dec));
    }

    /** Great-circle separation in degrees (haversine). */
    static double separationDeg(double ra1, double dec1, double ra2, double dec2) {
        double p1 = Math.toRadians(dec1);
        double p2 = Math.toRadians(dec2);
        double dp = p2 - p1;
        double dl = Math.toRadians(ra2 - ra1);
        double a = Math.sin(dp / 2) * Math.sin(dp / 2) + Math.cos(p1) * Math.cos(p2) * Math.sin(dl / 2) * Math.sin(dl / 2);
        return Math.toDegrees(2 * Math.asin(Math.min(1.0, Math.sqrt(a))));
    }
}
