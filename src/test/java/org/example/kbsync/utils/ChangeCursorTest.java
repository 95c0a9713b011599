package org.example.kbsync.utils;

import org.example.kbsync.entity.dto.RecordKind;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChangeCursorTest {

    private static final Instant T = Instant.parse("2025-01-01T00:00:00.000001Z");

    @Test
    void encodedCursorDecodesToTheSamePosition() {
        ChangeCursor cursor = new ChangeCursor(T, RecordKind.DOCUMENT, 42L);

        assertThat(ChangeCursor.decode(cursor.encode())).isEqualTo(cursor);
    }

    @Test
    void malformedCursorIsRejected() {
        assertThatThrownBy(() -> ChangeCursor.decode("not-a-cursor"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void ordersByTimeThenKindThenId() {
        ChangeCursor cursor = new ChangeCursor(T, RecordKind.DOCUMENT, 5L);

        assertThat(cursor.precedes(T, RecordKind.DOCUMENT, 6L)).isTrue();
        assertThat(cursor.precedes(T, RecordKind.DOCUMENT, 5L)).isFalse();
        assertThat(cursor.precedes(T, RecordKind.KNOWLEDGE_ENTRY, 1L)).isTrue();
        assertThat(cursor.precedes(T.minusNanos(1000), RecordKind.KNOWLEDGE_ENTRY, 99L)).isFalse();
        assertThat(cursor.precedes(T.plusNanos(1000), RecordKind.DOCUMENT, 1L)).isTrue();
    }

    @Test
    void sinceCursorExcludesEverythingAtThatInstant() {
        ChangeCursor cursor = ChangeCursor.since(T);

        assertThat(cursor.precedes(T, RecordKind.DOCUMENT, Long.MAX_VALUE - 1)).isFalse();
        assertThat(cursor.precedes(T, RecordKind.KNOWLEDGE_ENTRY, 1L)).isFalse();
        assertThat(cursor.precedes(T.plusNanos(1000), RecordKind.DOCUMENT, 1L)).isTrue();
    }
}
