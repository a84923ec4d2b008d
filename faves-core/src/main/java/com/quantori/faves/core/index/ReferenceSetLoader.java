package com.quantori.faves.core.index;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.quantori.faves.api.StructureParseException;
import com.quantori.faves.api.structure.NormalizedStructure;
import com.quantori.faves.api.structure.StructureNormalizer;
import com.quantori.faves.api.util.StructureHashes;
import com.quantori.faves.core.util.ResourceLocations;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.BooleanUtils;
import org.apache.commons.lang3.StringUtils;

/**
 * Reads reference snapshots: tab-separated files with a header row and the columns {@code name},
 * {@code structure}, {@code canonical_form}, {@code secondary_hash}, {@code schedule},
 * {@code fda_banned} and {@code cwc_scheduled}. Rows without a precomputed canonical form are
 * normalized from their structure; a precomputed form must already be canonical. Lines starting
 * with {@code #} are comments.
 */
@Slf4j
public class ReferenceSetLoader {
  private static final Set<String> SCHEDULES = Set.of("I", "II", "III", "IV", "V");

  private final StructureNormalizer normalizer;
  private final ObjectReader reader;

  public ReferenceSetLoader(StructureNormalizer normalizer) {
    this.normalizer = normalizer;
    CsvMapper mapper = new CsvMapper();
    mapper.enable(CsvParser.Feature.SKIP_EMPTY_LINES);
    mapper.enable(CsvParser.Feature.ALLOW_COMMENTS);
    mapper.enable(CsvParser.Feature.TRIM_SPACES);
    CsvSchema schema =
        CsvSchema.emptySchema().withHeader().withColumnSeparator('\t').withoutQuoteChar();
    this.reader = mapper.readerFor(ReferenceRow.class).with(schema);
  }

  /**
   * Loads a snapshot.
   *
   * @param location file path or {@code classpath:} resource
   * @param category partition the records belong to
   * @return records in snapshot order
   * @throws IndexLoadException if the snapshot cannot be read or a row is invalid
   */
  public List<ReferenceRecord> load(String location, ReferenceCategory category) {
    try (InputStream stream = ResourceLocations.open(location);
        Reader text = new InputStreamReader(stream, StandardCharsets.UTF_8)) {
      List<ReferenceRecord> records = read(text, category, location);
      log.info("Loaded {} {} records from {}", records.size(), category, location);
      return records;
    } catch (IndexLoadException e) {
      throw e;
    } catch (IOException | RuntimeException e) {
      throw new IndexLoadException("Unable to load reference snapshot " + location, e);
    }
  }

  List<ReferenceRecord> read(Reader text, ReferenceCategory category, String location)
      throws IOException {
    List<ReferenceRecord> records = new ArrayList<>();
    try (MappingIterator<ReferenceRow> rows = reader.readValues(text)) {
      int row = 0;
      while (rows.hasNextValue()) {
        ReferenceRow values = rows.nextValue();
        records.add(toRecord(values, category, location, ++row));
      }
    }
    return records;
  }

  private ReferenceRecord toRecord(
      ReferenceRow row, ReferenceCategory category, String location, int index) {
    if (StringUtils.isBlank(row.getName())) {
      throw invalid(location, index, "name is missing");
    }
    String canonicalForm = StringUtils.trimToNull(row.getCanonicalForm());
    String secondaryHash = StringUtils.trimToNull(row.getSecondaryHash());
    if (canonicalForm == null) {
      if (StringUtils.isBlank(row.getStructure())) {
        throw invalid(location, index, "neither structure nor canonical_form is set");
      }
      NormalizedStructure structure = normalize(row.getStructure(), row, location, index);
      canonicalForm = structure.getCanonicalForm();
      secondaryHash = structure.getSecondaryHash();
    } else {
      String expected = normalize(canonicalForm, row, location, index).getCanonicalForm();
      if (!expected.equals(canonicalForm)) {
        throw invalid(
            location,
            index,
            "canonical_form " + canonicalForm + " is not canonical, expected " + expected);
      }
    }
    String agnosticHash = StructureHashes.stereoAgnosticHash(canonicalForm);
    if (secondaryHash == null) {
      secondaryHash = agnosticHash;
    }
    secondaryHash = secondaryHash.toUpperCase(Locale.ROOT);
    String schedule = StringUtils.trimToNull(row.getSchedule());
    if (schedule != null) {
      schedule = schedule.toUpperCase(Locale.ROOT);
      if (!SCHEDULES.contains(schedule)) {
        throw invalid(location, index, "unknown schedule " + row.getSchedule());
      }
    }
    return ReferenceRecord.builder()
        .name(row.getName().trim())
        .canonicalForm(canonicalForm)
        .secondaryHash(secondaryHash)
        .category(category)
        .schedule(schedule)
        .fdaBanned(toFlag(row.getFdaBanned(), location, index))
        .cwcScheduled(toFlag(row.getCwcScheduled(), location, index))
        .stereoAgnostic(secondaryHash.equals(agnosticHash))
        .build();
  }

  private NormalizedStructure normalize(
      String smiles, ReferenceRow row, String location, int index) {
    try {
      return normalizer.normalize(smiles);
    } catch (StructureParseException e) {
      throw new IndexLoadException(
          String.format("%s, row %d: invalid structure of %s", location, index, row.getName()),
          e);
    }
  }

  private static boolean toFlag(String value, String location, int index) {
    if (StringUtils.isBlank(value)) {
      return false;
    }
    Boolean flag = "1".equals(value) ? Boolean.TRUE : "0".equals(value) ? Boolean.FALSE
        : BooleanUtils.toBooleanObject(value);
    if (flag == null) {
      throw invalid(location, index, "invalid flag value " + value);
    }
    return flag;
  }

  private static IndexLoadException invalid(String location, int index, String problem) {
    return new IndexLoadException(String.format("%s, row %d: %s", location, index, problem));
  }
}
