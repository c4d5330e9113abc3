package dev.mars.pgpubsub.db.config;

/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

import io.vertx.sqlclient.PoolOptions;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("core")
class PgPoolConfigTest {

    @Test
    void defaults() {
        PgPoolConfig pool = PgPoolConfig.defaults();

        assertThat(pool.maxSize()).isEqualTo(16);
        assertThat(pool.maxWaitQueueSize()).isEqualTo(128);
        assertThat(pool.connectionTimeout()).isEqualTo(Duration.ofSeconds(30));
        assertThat(pool.idleTimeout()).isEqualTo(Duration.ofMinutes(10));
        assertThat(pool.shared()).isTrue();
    }

    @Test
    void rejectsUnusableSizes() {
        assertThatThrownBy(() -> PgPoolConfig.defaults().withMaxSize(0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("maxSize");
        assertThatThrownBy(() -> new PgPoolConfig(4, -2, Duration.ofSeconds(1), Duration.ofSeconds(1), false))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("maxWaitQueueSize");
    }

    @Test
    void claimLimitKeepsOneConnectionForPublishes() {
        assertThat(PgPoolConfig.defaults().claimLimit()).isEqualTo(15);
        assertThat(PgPoolConfig.defaults().withMaxSize(2).claimLimit()).isEqualTo(1);
        assertThat(PgPoolConfig.defaults().withMaxSize(1).claimLimit()).isEqualTo(1);
    }

    @Test
    void mapsToVertxPoolOptionsWithoutLosingSubSecondTimeouts() {
        PoolOptions options = new PgPoolConfig(8, -1, Duration.ofMillis(1500), Duration.ofMinutes(2), false)
            .toPoolOptions();

        assertThat(options.getMaxSize()).isEqualTo(8);
        assertThat(options.getMaxWaitQueueSize()).isEqualTo(-1);
        assertThat(options.getConnectionTimeout()).isEqualTo(1500);
        assertThat(options.getConnectionTimeoutUnit()).isEqualTo(TimeUnit.MILLISECONDS);
        assertThat(options.getIdleTimeout()).isEqualTo(120_000);
        assertThat(options.getIdleTimeoutUnit()).isEqualTo(TimeUnit.MILLISECONDS);
        assertThat(options.isShared()).isFalse();
    }
}
