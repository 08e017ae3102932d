package io.github.tmarsteel.flags;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class FlagsTest {

    @Test
    void shouldCombineWithOr() {
        var mask = Flags.or(WideFlag.ONE, WideFlag.THREE);

        assertThat(mask.bits()).isEqualTo(0b101L);
        assertThat(mask.getFlagType()).isSameAs(FlagType.of(WideFlag.class));
    }

    @Test
    void shouldCombineWithAnd() {
        assertThat(Flags.and(WideFlag.ONE, WideFlag.TWO).isEmpty()).isTrue();
        assertThat(Flags.and(WideFlag.TWO, WideFlag.TWO).bits()).isEqualTo(2L);
        assertThat(Flags.and(Access.ALL, Access.WRITE).asFlag()).contains(Access.WRITE);
        assertThat(Flags.and(Flags.or(WideFlag.ONE, WideFlag.TWO), WideFlag.TWO).bits()).isEqualTo(2L);
    }

    @Test
    void shouldNestCombinations() {
        var all = Flags.or(Flags.or(NarrowFlag.ONE, NarrowFlag.TWO), NarrowFlag.THREE);

        assertThat(all.bits()).isEqualTo(0b111L);
        assertThat(all.or(NarrowFlag.HIGH).bits()).isEqualTo(0x87L);
        assertThat(all.and(Flags.maskOf(NarrowFlag.TWO))).isEqualTo(Flags.maskOf(NarrowFlag.TWO));
    }

    @Test
    void shouldNestCombinationsOnEitherSide() {
        var right = Flags.or(WideFlag.ONE, Flags.or(WideFlag.TWO, WideFlag.THREE));
        var both = Flags.or(Flags.maskOf(WideFlag.ONE), Flags.or(WideFlag.TWO, WideFlag.THREE));

        assertThat(right.bits()).isEqualTo(0b111L);
        assertThat(both).isEqualTo(right);
        assertThat(Flags.and(WideFlag.TWO, Flags.or(WideFlag.ONE, WideFlag.TWO)).bits()).isEqualTo(2L);
        assertThat(Flags.and(Flags.or(WideFlag.ONE, WideFlag.TWO), Flags.or(WideFlag.TWO, WideFlag.THREE)).bits()).isEqualTo(2L);
    }

    @Test
    void shouldResolveCombinationToDeclaredConstant() {
        assertThat(Flags.or(Access.READ, Access.WRITE).asFlag()).contains(Access.READ_WRITE);
        assertThat(Flags.or(Access.READ_WRITE, Access.EXECUTE).asFlag()).contains(Access.ALL);
        assertThat(Flags.or(Access.READ, Access.EXECUTE).asFlag()).isEmpty();
        assertThat(Flags.noneOf(Access.class).asFlag()).contains(Access.NONE);
    }

    @Test
    void shouldBuildMaskOfAllDeclaredFlags() {
        assertThat(Flags.allOf(WideFlag.class).bits()).isEqualTo(0b111L);
        assertThat(Flags.allOf(NarrowFlag.class).bits()).isEqualTo(0x87L);
        assertThat(Flags.noneOf(NarrowFlag.class).isEmpty()).isTrue();
    }

    @Test
    @SuppressWarnings({"unchecked", "rawtypes"})
    void shouldRejectMasksOfDifferentEnums() {
        FlagMask narrow = Flags.maskOf(NarrowFlag.ONE);
        FlagMask wide = Flags.maskOf(WideFlag.ONE);

        assertThatThrownBy(() -> narrow.or(wide)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> narrow.and(WideFlag.TWO)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldDescribeMask() {
        assertThat(Flags.or(WideFlag.ONE, WideFlag.TWO)).hasToString("FlagMask<WideFlag>[ONE, TWO]");
    }
}
