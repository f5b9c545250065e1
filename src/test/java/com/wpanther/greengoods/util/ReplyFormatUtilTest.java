package com.wpanther.greengoods.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ReplyFormatUtilTest {

    @Test
    void testFormatWaitTime_SecondsAndMinutes() {
        assertThat(ReplyFormatUtil.formatWaitTime(1_000)).isEqualTo("1 second");
        assertThat(ReplyFormatUtil.formatWaitTime(44_001)).isEqualTo("45 seconds");
        assertThat(ReplyFormatUtil.formatWaitTime(60_000)).isEqualTo("1 minute");
        assertThat(ReplyFormatUtil.formatWaitTime(61_000)).isEqualTo("2 minutes");
        assertThat(ReplyFormatUtil.formatWaitTime(-5)).isEqualTo("0 seconds");
    }

    @Test
    void testFormatAddress_Shortens() {
        assertThat(ReplyFormatUtil.formatAddress("0x7E5F4552091A69125d5DfCb7b8C2659029395Bdf"))
                .isEqualTo("0x7E5F...5Bdf");
        assertThat(ReplyFormatUtil.formatAddress("0x12")).isEqualTo("0x12");
        assertThat(ReplyFormatUtil.formatAddress(null)).isNull();
    }

    @Test
    void testPlatformUserId() {
        assertThat(ReplyFormatUtil.platformUserId("telegram", "42")).isEqualTo("telegram:42");
    }
}
