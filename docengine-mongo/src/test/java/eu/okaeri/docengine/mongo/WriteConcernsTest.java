package eu.okaeri.docengine.mongo;

import com.mongodb.WriteConcern;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class WriteConcernsTest {

    private static Map<String, Object> flags(Object... keysAndValues) {
        Map<String, Object> flags = new LinkedHashMap<>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            flags.put((String) keysAndValues[i], keysAndValues[i + 1]);
        }
        return flags;
    }

    @Test
    void no_flags_is_acknowledged() {
        assertThat(WriteConcerns.of(Collections.emptyMap())).isEqualTo(WriteConcern.ACKNOWLEDGED);
        assertThat(WriteConcerns.of(flags("safe", true))).isEqualTo(WriteConcern.ACKNOWLEDGED);
    }

    @Test
    void unsafe_without_w_is_unacknowledged() {
        WriteConcern concern = WriteConcerns.of(flags("safe", false));

        assertThat(concern).isEqualTo(WriteConcern.UNACKNOWLEDGED);
        assertThat(concern.isAcknowledged()).isFalse();
    }

    @Test
    void w_wins_over_unsafe() {
        WriteConcern concern = WriteConcerns.of(flags("safe", false, "w", 2));

        assertThat(concern.isAcknowledged()).isTrue();
        assertThat(concern.getW()).isEqualTo(2);
    }

    @Test
    void boolean_w_is_primary_acknowledgement_or_none() {
        WriteConcern acknowledged = WriteConcerns.of(flags("safe", true, "w", true));

        assertThat(acknowledged.isAcknowledged()).isTrue();
        assertThat(acknowledged.getW()).isEqualTo(1);
        assertThat(acknowledged.asDocument().get("w").isInt32()).isTrue();
        assertThat(WriteConcerns.of(flags("w", false))).isEqualTo(WriteConcern.UNACKNOWLEDGED);
    }

    @Test
    void w_accepts_counts_and_tags() {
        assertThat(WriteConcerns.of(flags("w", "3")).getW()).isEqualTo(3);
        assertThat(WriteConcerns.of(flags("w", "majority")).getWString()).isEqualTo("majority");
    }

    @Test
    void wtimeout_is_in_milliseconds() {
        WriteConcern concern = WriteConcerns.of(flags("w", 2, "wtimeout", 500));

        assertThat(concern.getWTimeout(TimeUnit.MILLISECONDS)).isEqualTo(500);
        assertThat(concern.getW()).isEqualTo(2);
    }

    @Test
    void fsync_and_j_request_journal() {
        assertThat(WriteConcerns.of(flags("fsync", true)).getJournal()).isTrue();
        assertThat(WriteConcerns.of(flags("j", 1)).getJournal()).isTrue();
        assertThat(WriteConcerns.of(flags("j", false)).getJournal()).isNull();
    }
}
