package io.nosqlbench.bulkfetch.downloader;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class RetryPolicyTest {

    @Test
    void testLinearBackoffGrowsByBaseDelay() {
        RetryPolicy policy = RetryPolicy.linear(4, Duration.ofMillis(1000));

        assertThat(policy.delayAfter(1)).isEqualTo(Duration.ofMillis(1000));
        assertThat(policy.delayAfter(2)).isEqualTo(Duration.ofMillis(2000));
        assertThat(policy.delayAfter(3)).isEqualTo(Duration.ofMillis(3000));
    }

    @Test
    void testMaxRetriesCountsTotalAttempts() {
        RetryPolicy policy = RetryPolicy.noDelay(3);

        assertThat(policy.shouldRetry(1)).isTrue();
        assertThat(policy.shouldRetry(2)).isTrue();
        assertThat(policy.shouldRetry(3)).isFalse();
        assertThat(RetryPolicy.noDelay(0).shouldRetry(1)).isFalse();
    }

    @Test
    void testDefaults() {
        RetryPolicy policy = RetryPolicy.defaults();
        assertThat(policy.maxRetries()).isEqualTo(3);
        assertThat(policy.baseDelay()).isEqualTo(Duration.ofSeconds(1));
    }

    @Test
    void testExponentialBackoff() {
        RetryPolicy policy = new RetryPolicy(5, Duration.ofMillis(100), RetryPolicy.BackoffFunction.EXPONENTIAL);
        assertThat(policy.delayAfter(1)).isEqualTo(Duration.ofMillis(100));
        assertThat(policy.delayAfter(3)).isEqualTo(Duration.ofMillis(400));
    }

    @Test
    void testRejectsNegativeValues() {
        assertThatThrownBy(() -> RetryPolicy.noDelay(-1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RetryPolicy.linear(1, Duration.ofMillis(-5)))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
