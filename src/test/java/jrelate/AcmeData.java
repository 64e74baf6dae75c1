package jrelate;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import se.alipsa.jrelate.Record;
import se.alipsa.jrelate.RecordSequence;

/**
 * Loads the acme datasets from {@code src/test/resources/acme}.
 */
public final class AcmeData {

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private AcmeData() {
  }

  public static RecordSequence employees() {
    return load("employees");
  }

  public static RecordSequence departments() {
    return load("departments");
  }

  public static RecordSequence salaryChanges() {
    return load("salary_changes");
  }

  /**
   * Read {@code /acme/<name>.json}, an array of JSON objects, into a replayable
   * sequence.
   *
   * @param name
   *          the dataset name
   * @return the records in file order
   */
  public static RecordSequence load(String name) {
    String resource = "/acme/" + name + ".json";
    try (InputStream in = AcmeData.class.getResourceAsStream(resource)) {
      if (in == null) {
        throw new IllegalStateException(resource + " must be on the test classpath (src/test/resources)");
      }
      List<Map<String, Object>> rows = MAPPER.readValue(in, new TypeReference<List<Map<String, Object>>>() {
      });
      List<Record> records = new ArrayList<>(rows.size());
      for (Map<String, Object> row : rows) {
        records.add(Record.fromMap(row));
      }
      return RecordSequence.of(records);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to load " + resource, e);
    }
  }
}
