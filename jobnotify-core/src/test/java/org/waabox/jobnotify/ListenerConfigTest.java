package org.waabox.jobnotify;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

/** Tests for {@link ListenerConfig}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class ListenerConfigTest {

  @Test
  void whenCreating_givenNoPrefix_shouldUseDefault() {
    final ListenerConfig config = ListenerConfig.create();

    assertEquals("job_listener", config.channelPrefix());
    assertEquals("job_listener_5120", config.channelFor(5120));
  }

  @Test
  void whenCreating_givenValidPrefix_shouldBuildChannelsWithIt() {
    assertEquals("_jobs_7", ListenerConfig.create("_jobs").channelFor(7));
  }

  @Test
  void whenCreating_givenInvalidPrefix_shouldFail() {
    assertThrows(NullPointerException.class,
        () -> ListenerConfig.create(null));
    assertThrows(IllegalArgumentException.class,
        () -> ListenerConfig.create("  "));
    assertThrows(IllegalArgumentException.class,
        () -> ListenerConfig.create("1listener"));
    assertThrows(IllegalArgumentException.class,
        () -> ListenerConfig.create("job-listener"));
    assertThrows(IllegalArgumentException.class,
        () -> ListenerConfig.create("a\"; DROP TABLE jobs; --"));
  }

  @Test
  void whenCreating_givenPrefixTooLongForPidSuffix_shouldFail() {
    assertEquals(52, ListenerConfig.create("a".repeat(52))
        .channelPrefix().length());
    assertThrows(IllegalArgumentException.class,
        () -> ListenerConfig.create("a".repeat(53)));
  }
}
