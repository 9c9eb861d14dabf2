package com.ryuqq.workpool.core.progress;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Progress 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@DisplayName("Progress 테스트")
class ProgressTest {

    private static final ProgressType PROGRESS_CRAP = ProgressType.of(1024);

    @Nested
    @DisplayName("알 수 없는 태그")
    class UnknownType {

        @Test
        void 이름은_비어있고_payload는_렌더링된다() {
            Progress crap = Progress.of(PROGRESS_CRAP, "CRAP!");

            assertThat(crap.type()).isEqualTo(PROGRESS_CRAP);
            assertThat(crap.type().displayName()).isEmpty();
            assertThat(crap.data()).isInstanceOf(String.class);
            assertThat(crap.asError()).isEmpty();
            assertThat(crap.render()).isEqualTo(": CRAP!");
        }

        @Test
        void 어떤_payload든_허용된다() {
            assertThat(Progress.of(PROGRESS_CRAP, null).render()).isEqualTo(": null");
            assertThat(Progress.of(PROGRESS_CRAP, 12).asCount()).isEmpty();
        }
    }

    @Nested
    @DisplayName("ERROR")
    class Errors {

        @Test
        void errorf는_구조화된_오류와_렌더링을_모두_제공한다() {
            Progress error = Progress.errorf("an %s", "ERROR");

            assertThat(error.type()).isEqualTo(ProgressType.ERROR);
            assertThat(error.type().displayName()).isEqualTo("ProgressError");
            assertThat(error.data()).isInstanceOf(Throwable.class);
            assertThat(error.asError()).contains(new ProgressFailure("an ERROR"));
            assertThat(error.render()).isEqualTo("ProgressError: an ERROR");
        }

        @Test
        void errorf_boom은_직접_만든_오류와_같다() {
            Progress boom = Progress.errorf("boom");

            assertThat(boom.asError()).hasValue(new ProgressFailure("boom"));
            assertThat(boom.toString()).isEqualTo("ProgressError: boom");
        }

        @Test
        void error는_전달된_예외를_그대로_담는다() {
            IOException cause = new IOException("disk full");

            Progress error = Progress.error(cause);

            assertThat(error.asError()).containsSame(cause);
            assertThat(error.render()).isEqualTo("ProgressError: disk full");
        }

        @Test
        void Throwable이_아닌_payload는_거부된다() {
            assertThatThrownBy(() -> Progress.of(ProgressType.ERROR, "not an error"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Throwable");
            assertThatThrownBy(() -> Progress.error(null))
                .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("MESSAGE")
    class Messages {

        @Test
        void messagef는_오류가_아니다() {
            Progress message = Progress.messagef("MESSAGE!");

            assertThat(message.type()).isEqualTo(ProgressType.MESSAGE);
            assertThat(message.asError()).isEmpty();
            assertThat(message.asMessage()).contains("MESSAGE!");
            assertThat(message.render()).isEqualTo("ProgressMessage: MESSAGE!");
        }

        @Test
        void messagef_렌더링() {
            assertThat(Progress.messagef("X").render()).isEqualTo("ProgressMessage: X");
        }
    }

    @Nested
    @DisplayName("UPDATE / ESTIMATE")
    class Counts {

        @Test
        void update는_음수_증감량을_허용한다() {
            Progress update = Progress.update(-1);

            assertThat(update.type()).isEqualTo(ProgressType.UPDATE);
            assertThat(update.asCount()).hasValue(-1L);
            assertThat(update.asError()).isEmpty();
            assertThat(update.render()).isEqualTo("ProgressUpdate: -1");
        }

        @Test
        void estimate는_값으로_비교된다() {
            assertThat(Progress.estimate(42)).isEqualTo(Progress.estimate(42));
            assertThat(Progress.estimate(42).render()).isEqualTo("ProgressEstimate: 42");
        }

        @Test
        void Integer_payload는_Long으로_넓혀진다() {
            assertThat(Progress.of(ProgressType.UPDATE, 5)).isEqualTo(Progress.update(5));
        }

        @Test
        void 숫자가_아닌_payload는_거부된다() {
            assertThatThrownBy(() -> Progress.of(ProgressType.ESTIMATE, "lots"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("ProgressEstimate");
        }
    }

    @Test
    void other는_payload를_해석하지_않는다() {
        Object payload = new Object();

        Progress other = Progress.other(payload);

        assertThat(other.type()).isEqualTo(ProgressType.OTHER);
        assertThat(other.data()).isSameAs(payload);
        assertThat(other.asError()).isEmpty();
        assertThat(other.asCount()).isEmpty();
        assertThat(other.asMessage()).isEmpty();
    }

    @Test
    void type이_null이면_거부된다() {
        assertThatThrownBy(() -> Progress.of(null, "x"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("type cannot be null");
    }
}
