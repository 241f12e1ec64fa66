package org.waabox.jobnotify.transform;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Map;

import org.junit.jupiter.api.Test;

/** Tests for {@link MessageTransformRegistry}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class MessageTransformRegistryTest {

  @Test
  void whenLookingUp_givenDefaults_shouldResolveNewJob() {
    final MessageTransformRegistry registry =
        MessageTransformRegistry.defaults();

    assertInstanceOf(NewJobTransform.class, registry.transformFor("new_job"));
  }

  @Test
  void whenLookingUp_givenUnknownTag_shouldFallBackToPassthrough() {
    final MessageTransformRegistry registry =
        MessageTransformRegistry.defaults();

    final MessageTransform transform = registry.transformFor("job_done");

    assertInstanceOf(PassthroughTransform.class, transform);
    assertEquals(Map.of("value", 3), transform.apply(
        Map.of("message_type", "job_done", "value", 3)).fields());
  }

  @Test
  void whenRegistering_givenCustomTransform_shouldResolveIt() {
    final MessageTransform custom = fields ->
        TransformResult.abstained("never valid");

    final MessageTransformRegistry registry = MessageTransformRegistry
        .builder()
        .register("audit", custom)
        .build();

    assertSame(custom, registry.transformFor("audit"));
    assertInstanceOf(PassthroughTransform.class,
        registry.transformFor("new_job"));
  }

  @Test
  void whenRegistering_givenInvalidArguments_shouldFail() {
    final MessageTransformRegistry.Builder builder =
        MessageTransformRegistry.builder();

    assertThrows(IllegalArgumentException.class,
        () -> builder.register(" ", fields -> null));
    assertThrows(NullPointerException.class,
        () -> builder.register("x", null));
  }
}
