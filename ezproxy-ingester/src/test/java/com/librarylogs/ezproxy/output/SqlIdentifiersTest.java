package com.librarylogs.ezproxy.output;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SqlIdentifiersTest {

    @Test
    void requireLogType_acceptsPlainIdentifiers() {
        assertThat(SqlIdentifiers.requireLogType("proxyLogs")).isEqualTo("proxyLogs");
        assertThat(SqlIdentifiers.requireLogType("access_logs_2020")).isEqualTo("access_logs_2020");
    }

    @Test
    void requireLogType_rejectsAnythingElse() {
        assertThatThrownBy(() -> SqlIdentifiers.requireLogType(null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SqlIdentifiers.requireLogType("")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SqlIdentifiers.requireLogType("1logs")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SqlIdentifiers.requireLogType("logs where 1=1"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SqlIdentifiers.requireLogType("INVALID_LOGS"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
