package io.b2mash.b2b.accessaudit.audit;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class AuditTextTest {

  @Test
  void truncate_keepsShortValues() {
    assertThat(AuditText.truncate("short", 128)).isEqualTo("short");
    assertThat(AuditText.truncate(null, 128)).isNull();
  }

  @Test
  void truncate_cutsToLimit() {
    var value = "x".repeat(300);

    assertThat(AuditText.truncate(value, 128)).hasSize(128).isEqualTo("x".repeat(128));
  }

  @Test
  void truncate_countsCodePointsNotChars() {
    // each emoji is one code point stored as two chars
    var value = "😀".repeat(130);

    var truncated = AuditText.truncate(value, 128);

    assertThat(truncated.codePointCount(0, truncated.length())).isEqualTo(128);
    assertThat(truncated).isEqualTo("😀".repeat(128));
  }

  @Test
  void truncate_neverSplitsSurrogatePair() {
    var value = "a" + "😀".repeat(200);

    var truncated = AuditText.truncate(value, 128);

    assertThat(Character.isHighSurrogate(truncated.charAt(truncated.length() - 1))).isFalse();
    assertThat(truncated.codePointCount(0, truncated.length())).isEqualTo(128);
  }

  @Test
  void operateLog_truncatesResourceOnConstruction() {
    var log =
        new OperateLog(
            "Alice(alice)", ActionType.CREATE, "User", "r".repeat(500), "192.0.2.1", "tenant-1");

    assertThat(log.getResource()).hasSize(AuditText.RESOURCE_MAX_LENGTH);
    assertThat(log.getDatetime()).isNotNull();
  }
}
