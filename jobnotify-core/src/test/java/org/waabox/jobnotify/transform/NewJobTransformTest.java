package org.waabox.jobnotify.transform;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;

import java.math.BigInteger;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

/** Tests for {@link NewJobTransform}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class NewJobTransformTest {

  private final NewJobTransform transform = new NewJobTransform();

  @Test
  void whenApplying_givenWellFormedJob_shouldParseRunAtAndStripType() {
    final TransformResult result = transform.apply(
        job(90, "2017-06-30T18:33:33.402669Z", 44));

    assertEquals(TransformResult.Outcome.ACCEPTED, result.outcome());
    assertEquals(Map.of("priority", 90,
        "run_at", Instant.parse("2017-06-30T18:33:33.402669Z"),
        "id", 44), result.fields());
    assertEquals(List.of("priority", "run_at", "id"),
        List.copyOf(result.fields().keySet()));
  }

  @Test
  void whenApplying_givenRunAtWithOffset_shouldConvertToUtcInstant() {
    final TransformResult result = transform.apply(
        job(1, "2017-06-30T15:33:33.402669-03:00", 1));

    assertEquals(Instant.parse("2017-06-30T18:33:33.402669Z"),
        result.fields().get("run_at"));
  }

  @Test
  void whenApplying_givenLongOrBigIntegerPriority_shouldAccept() {
    assertEquals(TransformResult.Outcome.ACCEPTED, transform.apply(
        job(5_000_000_000L, "2017-06-30T18:33:33Z", 1)).outcome());
    assertEquals(TransformResult.Outcome.ACCEPTED, transform.apply(
        job(BigInteger.TEN.pow(30), "2017-06-30T18:33:33Z", 1)).outcome());
  }

  @Test
  void whenApplying_givenNonIntegerPriority_shouldAbstain() {
    assertEquals(TransformResult.Outcome.ABSTAINED, transform.apply(
        job("90", "2017-06-30T18:33:33.402669Z", 45)).outcome());
    assertEquals(TransformResult.Outcome.ABSTAINED, transform.apply(
        job(90.5, "2017-06-30T18:33:33.402669Z", 45)).outcome());
    assertEquals(TransformResult.Outcome.ABSTAINED, transform.apply(
        job(null, "2017-06-30T18:33:33.402669Z", 45)).outcome());
  }

  @Test
  void whenApplying_givenNonStringRunAt_shouldAbstain() {
    final Map<String, Object> fields = job(90, null, 45);
    fields.put("run_at", 1498847613);

    final TransformResult result = transform.apply(fields);

    assertEquals(TransformResult.Outcome.ABSTAINED, result.outcome());
    assertFalse(result.reason().isEmpty());
  }

  @Test
  void whenApplying_givenMissingRunAt_shouldAbstain() {
    final Map<String, Object> fields = job(90, null, 45);
    fields.remove("run_at");

    assertEquals(TransformResult.Outcome.ABSTAINED,
        transform.apply(fields).outcome());
  }

  @Test
  void whenApplying_givenUnparseableRunAt_shouldFault() {
    final TransformResult result = transform.apply(job(90, "blah", 45));

    assertEquals(TransformResult.Outcome.FAULTED, result.outcome());
    assertInstanceOf(DateTimeParseException.class, result.error());
  }

  @Test
  void whenApplying_givenRunAtWithoutOffset_shouldFault() {
    assertEquals(TransformResult.Outcome.FAULTED, transform.apply(
        job(90, "2017-06-30T18:33:33.402669", 45)).outcome());
  }

  @Test
  void whenApplying_givenStringId_shouldPassItThrough() {
    final Map<String, Object> fields = job(90, "2017-06-30T18:33:33Z", 0);
    fields.put("id", "not-validated");

    assertEquals("not-validated", transform.apply(fields).fields().get("id"));
  }

  /** Builds new_job fields.
   *
   * @param priority the priority.
   * @param runAt    the run_at value.
   * @param id       the job id.
   * @return the mutable fields, including message_type.
   */
  private static Map<String, Object> job(final Object priority,
      final String runAt, final int id) {
    final Map<String, Object> fields = new LinkedHashMap<>();
    fields.put("message_type", "new_job");
    fields.put("priority", priority);
    fields.put("run_at", runAt);
    fields.put("id", id);
    return fields;
  }
}
