package jrelate.join;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.util.List;
import java.util.stream.Collectors;
import jrelate.AcmeData;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import se.alipsa.jrelate.JRelate;
import se.alipsa.jrelate.Record;
import se.alipsa.jrelate.RecordSequence;
import se.alipsa.jrelate.engine.JoinPredicate;
import se.alipsa.jrelate.engine.JoinPredicates;

/**
 * Tests covering {@code LEFT}, {@code RIGHT} and {@code FULL} joins between the
 * acme employees (left) and departments (right).
 */
class OuterJoinTest {

  private static RecordSequence employees;
  private static RecordSequence departments;
  private static final JoinPredicate ON_DEPT = JoinPredicates.onFields("dept_id");

  @BeforeAll
  static void setup() {
    employees = AcmeData.employees();
    departments = AcmeData.departments();
  }

  private static List<Object> column(List<Record> rows, String field) {
    return rows.stream().map(r -> r.get(field)).collect(Collectors.toList());
  }

  /**
   * Employees without a matching department are emitted unmodified, in input
   * order.
   */
  @Test
  void leftJoinKeepsEveryEmployee() throws IOException {
    List<Record> rows = employees.then(JRelate.leftJoin(departments, ON_DEPT)).toList();
    assertEquals(5, rows.size());
    assertEquals(List.of(1L, 2L, 3L, 4L, 5L), column(rows, "id"));
    List<Record> source = employees.toList();
    assertEquals(source.get(3), rows.get(3));
    assertEquals(source.get(4), rows.get(4));
    assertFalse(rows.get(3).has("dept_name"));
  }

  @Test
  void leftJoinUnmatchedShape() throws IOException {
    RecordSequence left = RecordSequence.of(Record.of("id", 1, "name", "Ann"), Record.of("id", 2, "name", "Zed"));
    RecordSequence right = RecordSequence.of(Record.of("id", 1, "team", "A"));
    List<Record> rows = left.then(JRelate.leftJoin(right, JoinPredicates.onFields("id"))).toList();
    assertEquals(List.of(Record.of("id", 1, "name", "Ann", "team", "A"), Record.of("id", 2, "name", "Zed")), rows);
  }

  @Test
  void rightJoinAddsDepartmentsWithoutEmployees() throws IOException {
    List<Record> rows = employees.then(JRelate.rightJoin(departments, ON_DEPT)).toList();
    assertEquals(4, rows.size());
    assertEquals(Record.of("dept_id", 3, "dept_name", "Marketing"), rows.get(3));
  }

  /**
   * Full join emits the matched pairs, then the unmatched employees, then the
   * unmatched departments.
   */
  @Test
  void fullJoinOrdersMatchedThenLeftThenRight() throws IOException {
    List<Record> rows = employees.then(JRelate.fullJoin(departments, ON_DEPT)).toList();
    assertEquals(3 + 2 + 1, rows.size());
    assertEquals(List.of("Engineering", "Engineering", "Sales"), column(rows.subList(0, 3), "dept_name"));
    assertEquals(List.of(4L, 5L), column(rows.subList(3, 5), "id"));
    assertEquals("Marketing", rows.get(5).get("dept_name"));
  }

  @Test
  void outerJoinCardinalities() throws IOException {
    long leftSize = employees.toList().size();
    long inner = employees.then(JRelate.innerJoin(departments, ON_DEPT)).toList().size();
    long left = employees.then(JRelate.leftJoin(departments, ON_DEPT)).toList().size();
    long full = employees.then(JRelate.fullJoin(departments, ON_DEPT)).toList().size();
    assertTrue(left >= leftSize);
    assertEquals(inner + 2 + 1, full);
  }

  @Test
  void outerJoinsOnEmptyInputs() throws IOException {
    assertEquals(5, employees.then(JRelate.leftJoin(RecordSequence.empty(), ON_DEPT)).toList().size());
    assertEquals(3, RecordSequence.empty().then(JRelate.rightJoin(departments, ON_DEPT)).toList().size());
    assertEquals(3, RecordSequence.empty().then(JRelate.fullJoin(departments, ON_DEPT)).toList().size());
    assertTrue(RecordSequence.empty().then(JRelate.fullJoin(RecordSequence.empty(), ON_DEPT)).toList().isEmpty());
  }
}
